package com.hbsparser.ast;

public sealed interface Expression extends Node permits
    PathExpression,
    SubExpression,
    StringLiteral,
    NumberLiteral,
    BooleanLiteral,
    NullLiteral,
    UndefinedLiteral {
}
