package com.architecture.dotspace.exception;

import lombok.Getter;

/**
 * An edge points at a node the graph does not contain. The builder auto-creates missing
 * endpoints, so this signals a broken graph rather than bad input.
 */
@Getter
public class DanglingReferenceException extends DiagramException {

    private final String nodeKey;

    public DanglingReferenceException(String nodeKey, String source, String target) {
        super(String.format("Edge %s -> %s references unknown node '%s'", source, target, nodeKey));
        this.nodeKey = nodeKey;
    }
}
