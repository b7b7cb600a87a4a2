package com.architecture.dotspace.service.diagram.parser;

import com.architecture.dotspace.model.diagram.DiagramFormat;

/**
 * Converts raw diagram text of one dialect into a {@link ParsedDiagram}.
 */
public interface DiagramParser {

    /**
     * @return the dialect this parser reads
     */
    DiagramFormat format();

    /**
     * Human-readable name of the source type, e.g. "DOT".
     */
    default String sourceName() {
        return format().getSourceName();
    }

    /**
     * Parse the complete input.
     *
     * @throws com.architecture.dotspace.exception.DiagramSyntaxException on malformed input
     */
    ParsedDiagram parse(String content);
}
