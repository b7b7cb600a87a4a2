package com.architecture.dotspace.service.diagram;

import com.architecture.dotspace.model.diagram.DiagramGraph;
import com.architecture.dotspace.service.diagram.layout.DiagramLayout;
import lombok.Value;

/**
 * Graph plus layout of one successfully processed input.
 */
@Value
public class DiagramResult {
    FormatDetection detection;
    DiagramGraph graph;
    DiagramLayout layout;
}
