package com.hbsparser.ast;

import java.util.List;

/**
 * A curly invocation inside an element's opening tag, e.g. {@code <input {{autofocus}}>}.
 */
public record ElementModifierStatement(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    Expression path,
    List<Expression> params,
    Hash hash
) implements Node {
    public ElementModifierStatement(Expression path, List<Expression> params, Hash hash) {
        this(0, 0, 0, 0, 0, 0, path, params, hash);
    }

    public ElementModifierStatement(
        int start,
        int end,
        SourceLocation loc,
        Expression path,
        List<Expression> params,
        Hash hash
    ) {
        this(start,
             end,
             loc != null ? loc.start().line() : 0,
             loc != null ? loc.start().column() : 0,
             loc != null ? loc.end().line() : 0,
             loc != null ? loc.end().column() : 0,
             path,
             params,
             hash);
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
        return "ElementModifierStatement";
    }
}
