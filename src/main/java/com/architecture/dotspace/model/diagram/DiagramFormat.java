package com.architecture.dotspace.model.diagram;

/**
 * Input dialects the pipeline understands.
 */
public enum DiagramFormat {
    DOT("DOT"),
    SEQUENCE("PlantUML");

    private final String sourceName;

    DiagramFormat(String sourceName) {
        this.sourceName = sourceName;
    }

    public String getSourceName() {
        return sourceName;
    }
}
