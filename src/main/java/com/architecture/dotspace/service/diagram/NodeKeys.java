package com.architecture.dotspace.service.diagram;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Resolves written node names to canonical keys for one graph. Names match case-insensitively and
 * the first spelling seen becomes the key.
 */
class NodeKeys {

    private final Map<String, String> canonical = new HashMap<>();

    /**
     * @return the canonical key for {@code name}, registering it if it is new
     */
    String resolve(String name) {
        String normalized = normalize(name);
        return canonical.computeIfAbsent(normalized.toLowerCase(Locale.ROOT), k -> normalized);
    }

    /**
     * @return the canonical key, or null if no such name has been registered
     */
    String lookup(String name) {
        return canonical.get(normalize(name).toLowerCase(Locale.ROOT));
    }

    static String normalize(String name) {
        String trimmed = name == null ? "" : name.trim();
        if (trimmed.length() >= 2 && trimmed.startsWith("\"") && trimmed.endsWith("\"")) {
            trimmed = trimmed.substring(1, trimmed.length() - 1).trim();
        }
        return trimmed;
    }
}
