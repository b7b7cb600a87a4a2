package com.architecture.dotspace.service.diagram.layout;

import lombok.Value;

import java.util.Map;
import java.util.Set;

/**
 * Final level per node key plus the edges that were excluded from layering.
 */
@Value
public class LevelAssignment {
    Map<String, Integer> levels;        // node declaration order
    Set<Integer> backEdgeIndexes;       // positions in DiagramGraph.edges

    public int levelOf(String key) {
        return levels.get(key);
    }
}
