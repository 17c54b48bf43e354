package com.hbsparser.ast;

import java.util.List;

public record Hash(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    List<HashPair> pairs
) implements Node {
    public Hash(List<HashPair> pairs) {
        this(0, 0, 0, 0, 0, 0, pairs);
    }

    public Hash(
        int start,
        int end,
        SourceLocation loc,
        List<HashPair> pairs
    ) {
        this(start,
             end,
             loc != null ? loc.start().line() : 0,
             loc != null ? loc.start().column() : 0,
             loc != null ? loc.end().line() : 0,
             loc != null ? loc.end().column() : 0,
             pairs);
    }

    public static Hash empty() {
        return new Hash(List.of());
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
        return "Hash";
    }
}
