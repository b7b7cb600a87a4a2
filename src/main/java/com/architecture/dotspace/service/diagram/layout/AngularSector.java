package com.architecture.dotspace.service.diagram.layout;

import lombok.Value;

/**
 * Angular range, in radians, reserved for one cluster's subtree in containment mode.
 */
@Value
public class AngularSector {
    double startAngle;
    double sweep;

    public double endAngle() {
        return startAngle + sweep;
    }

    public boolean contains(double angle) {
        return angle >= startAngle && angle < endAngle();
    }

    /**
     * The {@code index}-th of {@code count} equal slices.
     */
    public AngularSector slice(int index, int count) {
        double width = sweep / count;
        return new AngularSector(startAngle + index * width, width);
    }
}
