package com.architecture.dotspace.service.diagram.parser;

import com.architecture.dotspace.model.diagram.DiagramFormat;
import com.architecture.dotspace.model.diagram.StructuralMode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Dialect-neutral parse tree handed from a dialect parser to the graph builder.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ParsedDiagram {
    private DiagramFormat format;
    private StructuralMode structuralMode;
    private String name;

    @Builder.Default
    private List<ParsedNode> nodes = new ArrayList<>();

    @Builder.Default
    private List<ParsedEdge> edges = new ArrayList<>();

    @Builder.Default
    private List<ParsedCluster> clusters = new ArrayList<>();

    @Builder.Default
    private Map<String, String> graphAttributes = new LinkedHashMap<>();

    // Sequence diagrams: peak activate/deactivate nesting per participant name
    @Builder.Default
    private Map<String, Integer> activationDepths = new LinkedHashMap<>();
}
