package com.architecture.dotspace.model.diagram;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Canonical graph produced once per input. Never mutated after construction: every collection
 * handed to the builder is an unmodifiable copy.
 */
@Value
@Builder
public class DiagramGraph {

    Map<String, DiagramNode> nodes;         // keyed by canonical node key, first-appearance order
    List<DiagramEdge> edges;
    Map<String, DiagramCluster> clusters;   // empty outside containment mode
    List<ClusterChild> topLevel;            // root clusters and unclustered nodes, first-appearance order
    Map<String, String> graphAttributes;
    DiagramFormat originFormat;
    StructuralMode structuralMode;
    List<String> diagnostics;               // informational notes, e.g. a discarded cluster forest

    public DiagramNode getNode(String key) {
        return nodes.get(key);
    }

    public boolean hasClusters() {
        return !clusters.isEmpty();
    }
}
