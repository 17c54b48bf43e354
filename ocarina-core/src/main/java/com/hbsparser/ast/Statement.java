package com.hbsparser.ast;

/**
 * Content-level node: anything that can appear in a template, element or block body.
 */
public sealed interface Statement extends Node permits
    ElementNode,
    MustacheStatement,
    BlockStatement,
    TextNode,
    MustacheCommentStatement,
    CommentStatement,
    ExtensionNode {
}
