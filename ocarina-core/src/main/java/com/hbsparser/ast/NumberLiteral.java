package com.hbsparser.ast;

public record NumberLiteral(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    double value
) implements Expression {
    public NumberLiteral(double value) {
        this(0, 0, 0, 0, 0, 0, value);
    }

    public NumberLiteral(
        int start,
        int end,
        SourceLocation loc,
        double value
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
        return "NumberLiteral";
    }
}
