package com.architecture.dotspace.service.diagram.parser;

import com.architecture.dotspace.model.diagram.EdgeDirection;
import com.architecture.dotspace.model.diagram.LineStyle;
import com.architecture.dotspace.model.diagram.MessageKind;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One edge statement (DOT) or message (sequence diagram). Endpoints are unresolved names.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ParsedEdge {
    private String source;
    private String target;
    private String label;

    @Builder.Default
    private LineStyle style = LineStyle.SOLID;

    @Builder.Default
    private EdgeDirection direction = EdgeDirection.FORWARD;

    private MessageKind messageKind;
    private Integer sequence;
    private int ordinal;
    private int line;

    @Builder.Default
    private Map<String, String> attributes = new LinkedHashMap<>();
}
