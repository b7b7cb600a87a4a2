package com.architecture.dotspace.model.diagram;

import java.util.Locale;
import java.util.Map;

/**
 * Closed set of node types a diagram can declare.
 */
public enum NodeType {
    ORGANIZATION("organization"),
    LOB("lob"),
    SITE("site"),
    TEAM("team"),
    USER("user"),
    SERVICE("service"),
    FRONTEND("frontend"),
    DATABASE("database"),
    TOOL("tool"),
    EXTERNAL("external"),
    DEFAULT("default");

    private static final Map<String, NodeType> ALIASES = Map.of(
            "org", ORGANIZATION,
            "lineofbusiness", LOB,
            "line_of_business", LOB,
            "line-of-business", LOB,
            "db", DATABASE
    );

    private final String value;

    NodeType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * Get the enum value from a string, case-insensitive. Unknown or blank values resolve to {@link #DEFAULT}.
     */
    public static NodeType fromString(String value) {
        if (value == null || value.isBlank()) return DEFAULT;
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        NodeType alias = ALIASES.get(normalized);
        if (alias != null) return alias;
        for (NodeType type : values()) {
            if (type.value.equals(normalized)) {
                return type;
            }
        }
        return DEFAULT;
    }
}
