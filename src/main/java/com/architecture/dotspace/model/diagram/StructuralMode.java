package com.architecture.dotspace.model.diagram;

/**
 * How a diagram's structure drives node levels.
 * EDGE: levels come from edges, grouping blocks are dropped.
 * CONTAINMENT: no edges at all, subgraph nesting becomes the cluster forest.
 */
public enum StructuralMode {
    EDGE,
    CONTAINMENT
}
