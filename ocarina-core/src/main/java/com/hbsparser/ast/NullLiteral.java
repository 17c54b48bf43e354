package com.hbsparser.ast;

public record NullLiteral(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol
) implements Expression {
    public NullLiteral() {
        this(0, 0, 0, 0, 0, 0);
    }

    public NullLiteral(
        int start,
        int end,
        SourceLocation loc
    ) {
        this(start,
             end,
             loc != null ? loc.start().line() : 0,
             loc != null ? loc.start().column() : 0,
             loc != null ? loc.end().line() : 0,
             loc != null ? loc.end().column() : 0);
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
        return "NullLiteral";
    }
}
