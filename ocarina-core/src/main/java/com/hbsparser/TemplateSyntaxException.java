package com.hbsparser;

/**
 * Thrown when a template cannot be parsed. Carries the offending source position.
 */
public class TemplateSyntaxException extends RuntimeException {
    private final int position;
    private final int line;
    private final int column;

    public TemplateSyntaxException(String message, int position, int line, int column) {
        super(message + " (" + line + ":" + column + ")");
        this.position = position;
        this.line = line;
        this.column = column;
    }

    /**
     * Offset into the template source.
     */
    public int getPosition() {
        return position;
    }

    /**
     * 1-based line.
     */
    public int getLine() {
        return line;
    }

    /**
     * 0-based column.
     */
    public int getColumn() {
        return column;
    }
}
