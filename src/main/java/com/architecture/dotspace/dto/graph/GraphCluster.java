package com.architecture.dotspace.dto.graph;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GraphCluster {

    private String id;
    private String label;
    private String parentId;
    private List<String> childNodes;
    private List<String> childClusters;
    private double startAngle;      // radians
    private double sweep;
}
