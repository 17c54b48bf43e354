package com.hbsparser.ast;

public record StringLiteral(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    String value
) implements Expression {
    public StringLiteral(String value) {
        this(0, 0, 0, 0, 0, 0, value);
    }

    public StringLiteral(
        int start,
        int end,
        SourceLocation loc,
        String value
    ) {
        this(start,
             end,
             loc != null ? loc.start().line() : 0,
             loc != null ? loc.start().column() : 0,
             loc != null ? loc.end().line() : 0,
             loc != null ? loc.end().column() : 0,
             value);
    }

    @Override
    public SourceLocation loc() {
        return new SourceLocation(
            new SourceLocation.Position(startLine, startCol),
            new SourceLocation.Position(endLine, endCol)
        );
    }

    @Override
    public String type() {
        return "StringLiteral";
    }
}
