package com.hbsparser.tokens;

import com.hbsparser.ast.SourceLocation;

/**
 * One collected invocation.
 *
 * @param name normalized token, e.g. {@code my-component/bar}
 * @param kind syntax the token came from
 * @param loc  location of the invoking element or path
 */
public record TokenOccurrence(String name, TokenKind kind, SourceLocation loc) {
}
