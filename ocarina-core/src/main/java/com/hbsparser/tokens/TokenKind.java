package com.hbsparser.tokens;

/**
 * Syntax an invocation token was collected from.
 */
public enum TokenKind {
    ANGLE_BRACKET_COMPONENT,
    MUSTACHE,
    BLOCK,
    SUB_EXPRESSION,
    MODIFIER
}
