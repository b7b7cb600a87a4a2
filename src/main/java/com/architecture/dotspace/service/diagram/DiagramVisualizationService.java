package com.architecture.dotspace.service.diagram;

import com.architecture.dotspace.dto.graph.*;
import com.architecture.dotspace.model.diagram.*;
import com.architecture.dotspace.service.diagram.layout.*;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Converts a graph and its layout into visualization-friendly DTOs.
 */
@Service
@Slf4j
public class DiagramVisualizationService {

    private static final String PLAIN_EDGE_TYPE = "edge";

    public GraphVisualizationResponse toResponse(DiagramResult result) {
        DiagramGraph graph = result.getGraph();
        DiagramLayout layout = result.getLayout();
        Set<Integer> backEdges = layout.getBackEdgeIndexes();

        List<GraphNode> nodes = graph.getNodes().values().stream()
                .map(node -> convertNode(node, layout))
                .collect(Collectors.toList());

        List<GraphEdge> edges = new ArrayList<>();
        for (int i = 0; i < graph.getEdges().size(); i++) {
            edges.add(convertEdge(i, graph.getEdges().get(i), layout.getEdgeAppearances().get(i), backEdges.contains(i)));
        }

        List<GraphCluster> clusters = graph.getClusters().values().stream()
                .map(cluster -> convertCluster(cluster, layout.getClusterSectors().get(cluster.getId())))
                .collect(Collectors.toList());

        log.debug("[pipeline] Built visualization: {} nodes, {} edges, {} clusters",
                nodes.size(), edges.size(), clusters.size());

        return GraphVisualizationResponse.builder()
                .nodes(nodes)
                .edges(edges)
                .clusters(clusters)
                .metadata(buildMetadata(result, nodes, edges))
                .build();
    }

    // ==================== Conversion Methods ====================

    private GraphNode convertNode(DiagramNode node, DiagramLayout layout) {
        NodePosition position = layout.positionOf(node.getKey());
        NodeAppearance appearance = layout.getNodeAppearances().get(node.getKey());

        return GraphNode.builder()
                .id(node.getKey())
                .label(node.getLabel())
                .type(node.getType().getValue())
                .group(node.getClusterId())
                .level(layout.getLevels().get(node.getKey()))
                .explicitLevel(node.hasExplicitLevel())
                .x(position.getX())
                .y(position.getY())
                .z(position.getZ())
                .properties(new LinkedHashMap<>(node.getAttributes()))
                .style(NodeStyle.builder()
                        .color(appearance.getColor())
                        .size(appearance.getSize())
                        .shape(appearance.getShape().getValue())
                        .build())
                .build();
    }

    private GraphEdge convertEdge(int index, DiagramEdge edge, EdgeAppearance appearance, boolean backEdge) {
        EdgeDirection direction = edge.getDirection();
        return GraphEdge.builder()
                .id("e" + (index + 1))
                .source(edge.getSource())
                .target(edge.getTarget())
                .type(edge.getMessageKind() != null ? edge.getMessageKind().getValue() : PLAIN_EDGE_TYPE)
                .label(edge.getLabel())
                .direction(direction.getValue())
                .sequence(edge.getSequence())
                .backEdge(backEdge)
                .properties(new LinkedHashMap<>(edge.getAttributes()))
                .style(EdgeStyle.builder()
                        .color(appearance.getColor())
                        .width(appearance.getThickness())
                        .lineStyle(edge.getStyle().getValue())
                        .arrowShape(direction == EdgeDirection.NONE ? "none" : "triangle")
                        .build())
                .build();
    }

    private GraphCluster convertCluster(DiagramCluster cluster, AngularSector sector) {
        return GraphCluster.builder()
                .id(cluster.getId())
                .label(cluster.getLabel())
                .parentId(cluster.getParentId())
                .childNodes(cluster.getChildNodes())
                .childClusters(cluster.getChildClusters())
                .startAngle(sector != null ? sector.getStartAngle() : 0)
                .sweep(sector != null ? sector.getSweep() : 0)
                .build();
    }

    private GraphMetadata buildMetadata(DiagramResult result, List<GraphNode> nodes, List<GraphEdge> edges) {
        DiagramGraph graph = result.getGraph();
        Map<String, Integer> nodeCountByType = nodes.stream()
                .collect(Collectors.groupingBy(GraphNode::getType, LinkedHashMap::new, Collectors.summingInt(n -> 1)));
        Map<String, Integer> edgeCountByType = edges.stream()
                .collect(Collectors.groupingBy(GraphEdge::getType, LinkedHashMap::new, Collectors.summingInt(e -> 1)));

        return GraphMetadata.builder()
                .nodeCount(nodes.size())
                .edgeCount(edges.size())
                .clusterCount(graph.getClusters().size())
                .nodeTypes(new ArrayList<>(nodeCountByType.keySet()))
                .nodeCountByType(nodeCountByType)
                .edgeCountByType(edgeCountByType)
                .originFormat(graph.getOriginFormat().name())
                .sourceName(graph.getOriginFormat().getSourceName())
                .structuralMode(graph.getStructuralMode().name())
                .maxLevel(result.getLayout().maxLevel())
                .backEdgeCount(result.getLayout().getBackEdgeCount())
                .graphAttributes(new LinkedHashMap<>(graph.getGraphAttributes()))
                .diagnostics(new ArrayList<>(graph.getDiagnostics()))
                .build();
    }
}
