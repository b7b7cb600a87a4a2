package com.architecture.dotspace.service.diagram.layout;

import lombok.Value;

@Value
public class EdgeAppearance {
    String color;
    double thickness;   // radius of the connecting cylinder in scene units
}
