package com.hbsparser.ast;

import java.util.List;

/**
 * A dotted or slashed path as written by the template author, e.g. {@code my-component/bar},
 * {@code @model.name} or {@code this.title}.
 */
public record PathExpression(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    String original
) implements Expression {
    public PathExpression(String original) {
        this(0, 0, 0, 0, 0, 0, original);
    }

    public PathExpression(
        int start,
        int end,
        SourceLocation loc,
        String original
    ) {
        this(start, end,
             loc != null ? loc.start().line() : 0,
             loc != null ? loc.start().column() : 0,
             loc != null ? loc.end().line() : 0,
             loc != null ? loc.end().column() : 0,
             original);
    }

    /**
     * First segment of the path, before any {@code .} or {@code /} separator.
     */
    public String head() {
        for (int i = 0; i < original.length(); i++) {
            char ch = original.charAt(i);
            if (ch == '.' || ch == '/') {
                return original.substring(0, i);
            }
        }
        return original;
    }

    /**
     * All segments of the path, split on {@code .} and {@code /}.
     */
    public List<String> parts() {
        return List.of(original.split("[./]", -1));
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
        return "PathExpression";
    }
}
