package com.hbsparser.ast;

import java.util.List;

public record ElementNode(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    String tag,
    List<AttrNode> attributes,
    List<ElementModifierStatement> modifiers,
    List<String> blockParams,
    List<Statement> children,
    boolean selfClosing
) implements Statement {
    public ElementNode(String tag, List<AttrNode> attributes, List<ElementModifierStatement> modifiers, List<String> blockParams, List<Statement> children, boolean selfClosing) {
        this(0, 0, 0, 0, 0, 0, tag, attributes, modifiers, blockParams, children, selfClosing);
    }

    public ElementNode(
        int start,
        int end,
        SourceLocation loc,
        String tag,
        List<AttrNode> attributes,
        List<ElementModifierStatement> modifiers,
        List<String> blockParams,
        List<Statement> children,
        boolean selfClosing
    ) {
        this(start,
             end,
             loc != null ? loc.start().line() : 0,
             loc != null ? loc.start().column() : 0,
             loc != null ? loc.end().line() : 0,
             loc != null ? loc.end().column() : 0,
             tag,
             attributes,
             modifiers,
             blockParams,
             children,
             selfClosing);
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
        return "ElementNode";
    }
}
