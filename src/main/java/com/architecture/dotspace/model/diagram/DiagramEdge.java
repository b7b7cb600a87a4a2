package com.architecture.dotspace.model.diagram;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * A directed edge of the unified diagram graph. Edges keep the order they were written in.
 */
@Value
@Builder
public class DiagramEdge {

    String source;
    String target;
    String label;
    LineStyle style;
    EdgeDirection direction;
    MessageKind messageKind;    // sequence diagrams only
    Integer sequence;           // 1-based message order, sequence diagrams only
    Map<String, String> attributes;
}
