package com.architecture.dotspace.service.diagram.layout;

import lombok.Value;

@Value
public class NodePosition {
    double x;
    double y;
    double z;
}
