package com.architecture.dotspace.dto.graph;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * The artifact handed to a renderer: graph, positions and appearance in one document.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GraphVisualizationResponse {

    private List<GraphNode> nodes;
    private List<GraphEdge> edges;
    private List<GraphCluster> clusters;
    private GraphMetadata metadata;
}
