package com.hbsparser.ast;

import java.util.List;

public record MustacheStatement(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    Expression path,
    List<Expression> params,
    Hash hash,
    boolean trusting
) implements Statement, AttrValue {
    public MustacheStatement(Expression path, List<Expression> params, Hash hash, boolean trusting) {
        this(0, 0, 0, 0, 0, 0, path, params, hash, trusting);
    }

    public MustacheStatement(
        int start,
        int end,
        SourceLocation loc,
        Expression path,
        List<Expression> params,
        Hash hash,
        boolean trusting
    ) {
        this(start,
             end,
             loc != null ? loc.start().line() : 0,
             loc != null ? loc.start().column() : 0,
             loc != null ? loc.end().line() : 0,
             loc != null ? loc.end().column() : 0,
             path,
             params,
             hash,
             trusting);
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
        return "MustacheStatement";
    }
}
