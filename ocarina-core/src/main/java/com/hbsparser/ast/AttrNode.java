package com.hbsparser.ast;

public record AttrNode(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    String name,
    AttrValue value
) implements Node {
    public AttrNode(String name, AttrValue value) {
        this(0, 0, 0, 0, 0, 0, name, value);
    }

    public AttrNode(
        int start,
        int end,
        SourceLocation loc,
        String name,
        AttrValue value
    ) {
        this(start,
             end,
             loc != null ? loc.start().line() : 0,
             loc != null ? loc.start().column() : 0,
             loc != null ? loc.end().line() : 0,
             loc != null ? loc.end().column() : 0,
             name,
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
        return "AttrNode";
    }
}
