package com.hbsparser.ast;

import java.util.List;

public record BlockStatement(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    Expression path,
    List<Expression> params,
    Hash hash,
    Block program,
    Block inverse
) implements Statement {
    public BlockStatement(Expression path, List<Expression> params, Hash hash, Block program, Block inverse) {
        this(0, 0, 0, 0, 0, 0, path, params, hash, program, inverse);
    }

    public BlockStatement(
        int start,
        int end,
        SourceLocation loc,
        Expression path,
        List<Expression> params,
        Hash hash,
        Block program,
        Block inverse
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
             program,
             inverse);
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
        return "BlockStatement";
    }
}
