package com.architecture.dotspace.service.diagram.layout;

import com.architecture.dotspace.model.diagram.MessageKind;
import com.architecture.dotspace.model.diagram.NodeType;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Fixed lookup tables from node type to {@link NodeAppearance} and from message kind to
 * {@link EdgeAppearance}. Built once, never modified.
 */
public final class AppearanceCatalog {

    public static final NodeAppearance DEFAULT_NODE = new NodeAppearance(NodeShape.SPHERE, 0.7, "#808080");
    public static final EdgeAppearance DEFAULT_EDGE = new EdgeAppearance("#666666", 0.02);

    private static final Map<NodeType, NodeAppearance> NODE_APPEARANCES;
    private static final Map<MessageKind, EdgeAppearance> EDGE_APPEARANCES;

    static {
        Map<NodeType, NodeAppearance> nodes = new EnumMap<>(NodeType.class);
        nodes.put(NodeType.ORGANIZATION, new NodeAppearance(NodeShape.CUBE, 1.5, "#CC3333"));       // Red, large
        nodes.put(NodeType.LOB, new NodeAppearance(NodeShape.CYLINDER, 1.2, "#CC8033"));            // Orange
        nodes.put(NodeType.SITE, new NodeAppearance(NodeShape.TORUS, 1.0, "#3399CC"));              // Blue
        nodes.put(NodeType.TEAM, new NodeAppearance(NodeShape.SPHERE, 0.8, "#33CC80"));             // Green
        nodes.put(NodeType.USER, new NodeAppearance(NodeShape.CAPSULE, 0.6, "#9966CC"));            // Purple, small
        nodes.put(NodeType.SERVICE, new NodeAppearance(NodeShape.CUBE, 0.8, "#4DB34D"));            // Green
        nodes.put(NodeType.FRONTEND, new NodeAppearance(NodeShape.CAPSULE, 0.9, "#E6994D"));        // Orange
        nodes.put(NodeType.DATABASE, new NodeAppearance(NodeShape.CYLINDER, 1.0, "#3366B3"));       // Dark blue
        nodes.put(NodeType.TOOL, new NodeAppearance(NodeShape.SPHERE, 0.8, "#B3B333"));             // Yellow
        nodes.put(NodeType.EXTERNAL, new NodeAppearance(NodeShape.TORUS, 0.9, "#8033B3"));          // Purple
        nodes.put(NodeType.DEFAULT, DEFAULT_NODE);
        NODE_APPEARANCES = Collections.unmodifiableMap(nodes);

        Map<MessageKind, EdgeAppearance> edges = new EnumMap<>(MessageKind.class);
        edges.put(MessageKind.SYNC, new EdgeAppearance("#3366CC", 0.03));     // Blue, thick
        edges.put(MessageKind.ASYNC, new EdgeAppearance("#CC6633", 0.02));    // Orange
        edges.put(MessageKind.RETURN, new EdgeAppearance("#66CC66", 0.015));  // Green, thin
        EDGE_APPEARANCES = Collections.unmodifiableMap(edges);
    }

    private AppearanceCatalog() {
    }

    public static NodeAppearance forType(NodeType type) {
        if (type == null) return DEFAULT_NODE;
        return NODE_APPEARANCES.getOrDefault(type, DEFAULT_NODE);
    }

    public static EdgeAppearance forMessageKind(MessageKind kind) {
        if (kind == null) return DEFAULT_EDGE;
        return EDGE_APPEARANCES.getOrDefault(kind, DEFAULT_EDGE);
    }

    public static Map<NodeType, NodeAppearance> nodeAppearances() {
        return NODE_APPEARANCES;
    }
}
