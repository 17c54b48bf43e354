package com.hbsparser.ast;

public record TextNode(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    String chars
) implements Statement, AttrValue {
    public TextNode(String chars) {
        this(0, 0, 0, 0, 0, 0, chars);
    }

    public TextNode(
        int start,
        int end,
        SourceLocation loc,
        String chars
    ) {
        this(start,
             end,
             loc != null ? loc.start().line() : 0,
             loc != null ? loc.start().column() : 0,
             loc != null ? loc.end().line() : 0,
             loc != null ? loc.end().column() : 0,
             chars);
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
        return "TextNode";
    }
}
