package com.architecture.dotspace.model.diagram;

import java.util.Locale;

/**
 * Semantics of a sequence-diagram message arrow.
 */
public enum MessageKind {
    SYNC("->", LineStyle.SOLID),
    ASYNC("->>", LineStyle.SOLID),
    RETURN("-->", LineStyle.DASHED);

    private final String arrow;
    private final LineStyle lineStyle;

    MessageKind(String arrow, LineStyle lineStyle) {
        this.arrow = arrow;
        this.lineStyle = lineStyle;
    }

    public String getArrow() {
        return arrow;
    }

    public LineStyle getLineStyle() {
        return lineStyle;
    }

    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * @return the kind for an arrow token, or {@code null} when the token is not a known arrow
     */
    public static MessageKind fromArrow(String arrow) {
        for (MessageKind kind : values()) {
            if (kind.arrow.equals(arrow)) {
                return kind;
            }
        }
        return null;
    }
}
