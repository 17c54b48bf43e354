package com.hbsparser.ast;

public record HashPair(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    String key,
    Expression value
) implements Node {
    public HashPair(String key, Expression value) {
        this(0, 0, 0, 0, 0, 0, key, value);
    }

    public HashPair(
        int start,
        int end,
        SourceLocation loc,
        String key,
        Expression value
    ) {
        this(start,
             end,
             loc != null ? loc.start().line() : 0,
             loc != null ? loc.start().column() : 0,
             loc != null ? loc.end().line() : 0,
             loc != null ? loc.end().column() : 0,
             key,
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
        return "HashPair";
    }
}
