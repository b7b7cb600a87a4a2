package com.architecture.dotspace.model.diagram;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * A node of the unified diagram graph.
 */
@Value
@Builder(toBuilder = true)
public class DiagramNode {

    String key;
    String label;
    NodeType type;
    Integer level;                      // null when the level has to be derived by the layout
    Map<String, String> attributes;     // declared keys not modelled above, declaration order
    String clusterId;                   // innermost cluster in containment mode, otherwise null

    public boolean hasExplicitLevel() {
        return level != null;
    }
}
