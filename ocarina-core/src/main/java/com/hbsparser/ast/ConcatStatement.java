package com.hbsparser.ast;

import java.util.List;

/**
 * A quoted attribute value mixing text and mustaches, e.g. {@code class="btn {{kind}}"}.
 */
public record ConcatStatement(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    List<AttrValue> parts
) implements AttrValue {
    public ConcatStatement(List<AttrValue> parts) {
        this(0, 0, 0, 0, 0, 0, parts);
    }

    public ConcatStatement(
        int start,
        int end,
        SourceLocation loc,
        List<AttrValue> parts
    ) {
        this(start,
             end,
             loc != null ? loc.start().line() : 0,
             loc != null ? loc.start().column() : 0,
             loc != null ? loc.end().line() : 0,
             loc != null ? loc.end().column() : 0,
             parts);
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
        return "ConcatStatement";
    }
}
