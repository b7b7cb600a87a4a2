package com.architecture.dotspace.model.diagram;

import java.util.Locale;

/**
 * Arrow direction of an edge. Layering always follows the written source to target order,
 * the direction only tells the renderer where to draw arrow heads.
 */
public enum EdgeDirection {
    FORWARD,
    REVERSE,
    BOTH,
    NONE;

    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Resolve a DOT {@code dir} attribute; unknown values keep the supplied fallback.
     */
    public static EdgeDirection fromDotAttribute(String value, EdgeDirection fallback) {
        if (value == null) return fallback;
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "forward":
                return FORWARD;
            case "back":
                return REVERSE;
            case "both":
                return BOTH;
            case "none":
                return NONE;
            default:
                return fallback;
        }
    }
}
