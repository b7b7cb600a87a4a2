package com.architecture.dotspace.dto.graph;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Rendering hints for a node, taken from the fixed appearance table of its type.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NodeStyle {

    private String color;       // Hex color (e.g., "#CC3333")
    private Double size;        // Relative size, 1.0 = regular node
    private String shape;       // cube, cylinder, torus, sphere, capsule
}
