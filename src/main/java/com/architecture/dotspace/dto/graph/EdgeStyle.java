package com.architecture.dotspace.dto.graph;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Rendering hints for an edge.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EdgeStyle {

    private String color;       // Hex color
    private Double width;       // Thickness of the connector in scene units
    private String lineStyle;   // solid, dashed, dotted
    private String arrowShape;  // triangle, none
}
