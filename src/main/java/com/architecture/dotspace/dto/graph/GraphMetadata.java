package com.architecture.dotspace.dto.graph;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Summary information about a laid-out diagram.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GraphMetadata {

    private int nodeCount;
    private int edgeCount;
    private int clusterCount;
    private List<String> nodeTypes;                 // unique node types in first-seen order
    private Map<String, Integer> nodeCountByType;
    private Map<String, Integer> edgeCountByType;
    private String originFormat;                    // DOT or SEQUENCE
    private String sourceName;                      // "DOT", "PlantUML"
    private String structuralMode;                  // EDGE or CONTAINMENT
    private int maxLevel;
    private int backEdgeCount;
    private Map<String, String> graphAttributes;
    private List<String> diagnostics;
}
