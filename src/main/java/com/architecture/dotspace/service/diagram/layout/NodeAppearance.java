package com.architecture.dotspace.service.diagram.layout;

import lombok.Value;

/**
 * Shape, relative size and color of a node, looked up from its type.
 */
@Value
public class NodeAppearance {
    NodeShape shape;
    double size;        // relative to a default node at 1.0
    String color;       // hex, e.g. "#CC3333"
}
