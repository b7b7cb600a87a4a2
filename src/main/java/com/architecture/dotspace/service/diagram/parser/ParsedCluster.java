package com.architecture.dotspace.service.diagram.parser;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One occurrence of a subgraph block. A subgraph id that is reopened later yields another occurrence.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ParsedCluster {
    private String id;
    private String label;       // null unless the block sets a label
    private String parentId;    // enclosing subgraph of this occurrence, null at top level
    private int depth;          // 1 for a block directly inside the graph body
    private int ordinal;
    private int line;
}
