package com.hbsparser.ast;

import java.util.List;

/**
 * Root of a parsed template.
 */
public record Template(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    List<Statement> body
) implements Node {
    public Template(List<Statement> body) {
        this(0, 0, 0, 0, 0, 0, body);
    }

    public Template(
        int start,
        int end,
        SourceLocation loc,
        List<Statement> body
    ) {
        this(start,
             end,
             loc != null ? loc.start().line() : 0,
             loc != null ? loc.start().column() : 0,
             loc != null ? loc.end().line() : 0,
             loc != null ? loc.end().column() : 0,
             body);
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
        return "Template";
    }
}
