package com.architecture.dotspace.exception;

import lombok.Getter;

/**
 * Input text could not be parsed. Line and column are 1-based, 0 when unknown.
 */
@Getter
public class DiagramSyntaxException extends DiagramException {

    private final String reason;
    private final int line;
    private final int column;

    public DiagramSyntaxException(String reason, int line, int column) {
        super(format(reason, line, column));
        this.reason = reason;
        this.line = line;
        this.column = column;
    }

    public DiagramSyntaxException(String reason, int line) {
        this(reason, line, 0);
    }

    protected DiagramSyntaxException(String message, DiagramSyntaxException cause) {
        super(message, cause);
        this.reason = cause.getReason();
        this.line = cause.getLine();
        this.column = cause.getColumn();
    }

    public String getPosition() {
        if (line <= 0) return "unknown position";
        return column > 0 ? "line " + line + ", column " + column : "line " + line;
    }

    private static String format(String reason, int line, int column) {
        if (line <= 0) return reason;
        return column > 0
                ? String.format("%s (line %d, column %d)", reason, line, column)
                : String.format("%s (line %d)", reason, line);
    }
}
