package com.architecture.dotspace.dto.graph;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * An edge of the output artifact. Edges keep the order they were written in.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GraphEdge {

    private String id;
    private String source;      // Source node ID
    private String target;      // Target node ID
    private String type;        // sync, async, return for messages, edge otherwise
    private String label;
    private String direction;   // forward, reverse, both, none
    private Integer sequence;   // message order in sequence diagrams
    private boolean backEdge;   // excluded from level assignment
    private Map<String, Object> properties;
    private EdgeStyle style;
}
