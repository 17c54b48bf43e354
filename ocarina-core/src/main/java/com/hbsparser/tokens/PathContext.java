package com.hbsparser.tokens;

/**
 * Syntactic position a path was written in.
 */
public enum PathContext {
    /** Angle-bracket tag name, e.g. {@code <MyComponent::Bar>}. */
    TAG_NAME,
    /** Mustache, block, sub-expression or modifier path, e.g. {@code {{my-helper}}}. */
    CURLY_PATH
}
