package com.hbsparser.ast;

/**
 * Base interface for all template AST nodes
 */
public sealed interface Node permits
    Template,
    Statement,
    Expression,
    AttrValue,
    AttrNode,
    ElementModifierStatement,
    Hash,
    HashPair,
    Block {

    String type();
    int start();
    int end();
    SourceLocation loc();
}
