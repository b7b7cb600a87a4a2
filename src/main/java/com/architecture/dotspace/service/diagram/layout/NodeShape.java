package com.architecture.dotspace.service.diagram.layout;

import java.util.Locale;

public enum NodeShape {
    CUBE,
    CYLINDER,
    TORUS,
    SPHERE,
    CAPSULE;

    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
