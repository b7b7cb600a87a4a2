package com.architecture.dotspace.dto.graph;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * A node of the output artifact with its computed position.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GraphNode {

    private String id;              // canonical node key
    private String label;
    private String type;            // organization, lob, site, team, user, service, ...
    private String group;           // innermost cluster in containment mode
    private int level;
    private boolean explicitLevel;  // level was declared rather than derived
    private double x;
    private double y;
    private double z;
    private Map<String, Object> properties;
    private NodeStyle style;
}
