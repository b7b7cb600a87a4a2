package com.architecture.dotspace.service.diagram.parser;

import com.architecture.dotspace.model.diagram.NodeType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One node declaration as written in the source. A node declared twice yields two entries;
 * merging is the graph builder's job.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ParsedNode {
    private String name;            // unquoted identifier as written
    private String label;           // null when not declared
    private NodeType type;          // null when the declaration does not specify a type
    private Integer level;          // null when not declared
    private String clusterId;       // innermost enclosing subgraph, null at top level
    private int ordinal;            // position among all parsed elements
    private int line;

    // Declared keys not modelled above, in declaration order
    @Builder.Default
    private Map<String, String> attributes = new LinkedHashMap<>();
}
