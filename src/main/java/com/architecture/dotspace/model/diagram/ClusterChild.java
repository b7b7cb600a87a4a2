package com.architecture.dotspace.model.diagram;

import lombok.Value;

/**
 * One ordered entry below a cluster (or below the graph root): either a node or a nested cluster.
 */
@Value
public class ClusterChild {

    public enum Kind {
        NODE,
        CLUSTER
    }

    Kind kind;
    String id;

    public static ClusterChild node(String key) {
        return new ClusterChild(Kind.NODE, key);
    }

    public static ClusterChild cluster(String id) {
        return new ClusterChild(Kind.CLUSTER, id);
    }

    public boolean isCluster() {
        return kind == Kind.CLUSTER;
    }
}
