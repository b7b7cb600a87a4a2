package com.architecture.dotspace.model.diagram;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.stream.Collectors;

/**
 * A named grouping block. Only present in containment mode.
 */
@Value
@Builder
public class DiagramCluster {

    String id;
    String label;
    String parentId;                // null for a root of the forest
    List<ClusterChild> children;    // nodes and nested clusters in first-appearance order

    public List<String> getChildNodes() {
        return children.stream()
                .filter(child -> !child.isCluster())
                .map(ClusterChild::getId)
                .collect(Collectors.toList());
    }

    public List<String> getChildClusters() {
        return children.stream()
                .filter(ClusterChild::isCluster)
                .map(ClusterChild::getId)
                .collect(Collectors.toList());
    }
}
