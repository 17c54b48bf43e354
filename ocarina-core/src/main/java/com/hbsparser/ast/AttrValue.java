package com.hbsparser.ast;

/**
 * Right-hand side of an attribute: plain text, a single mustache, or a quoted mix of both.
 */
public sealed interface AttrValue extends Node permits TextNode, MustacheStatement, ConcatStatement {
}
