package com.architecture.dotspace.exception;

/**
 * Base class for failures of the diagram pipeline.
 */
public abstract class DiagramException extends RuntimeException {

    protected DiagramException(String message) {
        super(message);
    }

    protected DiagramException(String message, Throwable cause) {
        super(message, cause);
    }
}
