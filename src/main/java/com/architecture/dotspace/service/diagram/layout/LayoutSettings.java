package com.architecture.dotspace.service.diagram.layout;

import lombok.Value;

/**
 * Spacing constants of the radial layout. Fixed for the lifetime of the process.
 */
@Value
public class LayoutSettings {

    public static final LayoutSettings DEFAULTS = new LayoutSettings(2.0, 5.0, 1.5);

    double verticalSpacing;     // y distance between consecutive levels
    double baseRadius;          // radius of a ring before sibling growth
    double radiusGrowth;        // k in base + k * sqrt(siblingCount)

    public LayoutSettings(double verticalSpacing, double baseRadius, double radiusGrowth) {
        if (verticalSpacing <= 0 || baseRadius < 0 || radiusGrowth < 0) {
            throw new IllegalArgumentException(String.format(
                    "Invalid layout settings: verticalSpacing=%s, baseRadius=%s, radiusGrowth=%s",
                    verticalSpacing, baseRadius, radiusGrowth));
        }
        this.verticalSpacing = verticalSpacing;
        this.baseRadius = baseRadius;
        this.radiusGrowth = radiusGrowth;
    }

    public double radiusFor(int siblingCount) {
        return baseRadius + radiusGrowth * Math.sqrt(siblingCount);
    }
}
