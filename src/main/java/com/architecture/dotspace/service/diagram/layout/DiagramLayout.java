package com.architecture.dotspace.service.diagram.layout;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Output of the layout engine. Derived from a graph, never written back onto it.
 */
@Value
@Builder
public class DiagramLayout {
    Map<String, NodePosition> positions;            // node declaration order
    Map<String, Integer> levels;
    Map<String, NodeAppearance> nodeAppearances;
    List<EdgeAppearance> edgeAppearances;           // parallel to DiagramGraph.edges
    Map<String, AngularSector> clusterSectors;      // containment mode only
    Set<Integer> backEdgeIndexes;                   // positions in DiagramGraph.edges left out of layering

    public NodePosition positionOf(String key) {
        return positions.get(key);
    }

    public int getBackEdgeCount() {
        return backEdgeIndexes.size();
    }

    public int maxLevel() {
        return levels.values().stream().mapToInt(Integer::intValue).max().orElse(0);
    }
}
