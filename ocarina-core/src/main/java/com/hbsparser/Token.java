package com.hbsparser;

/**
 * A lexed mustache token.
 *
 * @param type        token kind
 * @param lexeme      raw source text of the token
 * @param literal     decoded value for STRING (String), NUMBER (Double) and BOOLEAN (Boolean); null otherwise
 * @param position    start offset in the template source
 * @param endPosition end offset (exclusive) in the template source
 */
public record Token(
    TokenType type,
    String lexeme,
    Object literal,
    int position,
    int endPosition
) {
    public Token(TokenType type, String lexeme, int position, int endPosition) {
        this(type, lexeme, null, position, endPosition);
    }
}
