package com.hbsparser.ast;

import java.util.List;

/**
 * Body of a block statement: either the main program or the {@code {{else}}} inverse.
 *
 * <p>{@code chained} is set on an inverse produced by {@code {{else if ...}}}, whose body is a
 * single nested {@link BlockStatement} sharing the outer block's closing delimiter.</p>
 */
public record Block(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    List<String> blockParams,
    List<Statement> body,
    boolean chained
) implements Node {
    public Block(List<String> blockParams, List<Statement> body) {
        this(0, 0, 0, 0, 0, 0, blockParams, body, false);
    }

    public Block(
        int start,
        int end,
        SourceLocation loc,
        List<String> blockParams,
        List<Statement> body,
        boolean chained
    ) {
        this(start,
             end,
             loc != null ? loc.start().line() : 0,
             loc != null ? loc.start().column() : 0,
             loc != null ? loc.end().line() : 0,
             loc != null ? loc.end().column() : 0,
             blockParams,
             body,
             chained);
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
        return "Block";
    }
}
