package com.architecture.dotspace.model.diagram;

import java.util.Locale;

/**
 * Stroke style of an edge.
 */
public enum LineStyle {
    SOLID,
    DASHED,
    DOTTED;

    /**
     * Resolve a DOT style attribute. Anything that is not dashed or dotted draws solid.
     */
    public static LineStyle fromString(String value) {
        if (value == null) return SOLID;
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "dashed":
                return DASHED;
            case "dotted":
                return DOTTED;
            default:
                return SOLID;
        }
    }

    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
