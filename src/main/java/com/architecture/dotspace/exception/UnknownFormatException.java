package com.architecture.dotspace.exception;

/**
 * The input matched neither dialect and the DOT fallback could not parse it either.
 */
public class UnknownFormatException extends DiagramSyntaxException {

    public UnknownFormatException(DiagramSyntaxException cause) {
        super("Unable to determine diagram format: " + cause.getMessage(), cause);
    }
}
