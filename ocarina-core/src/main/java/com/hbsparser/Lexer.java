package com.hbsparser;

import java.util.ArrayList;
import java.util.List;

/**
 * Tokenizes the interior of a single mustache, from its opening {@code {{} through the
 * matching close.
 *
 * <p>The lexer is stateless between calls: {@link #tokenizeMustache(int)} may be called
 * at any offset, which lets the parser look at an upcoming mustache before deciding
 * whether to consume it.</p>
 */
public class Lexer {
    private final String source;
    private final char[] buf;
    private final int length;
    private final LineMap lineMap;

    // Per-call cursor
    private int pos;

    public Lexer(String source) {
        this(source, new LineMap(source.toCharArray()));
    }

    Lexer(String source, LineMap lineMap) {
        this.source = source;
        this.buf = source.toCharArray();
        this.length = buf.length;
        this.lineMap = lineMap;
    }

    /**
     * Tokenize the mustache that starts at {@code start}. The returned list begins with an
     * opening delimiter token and ends with a CLOSE or CLOSE_UNESCAPED token.
     *
     * @throws TemplateSyntaxException if the mustache is malformed or unterminated
     */
    public List<Token> tokenizeMustache(int start) {
        pos = start;
        List<Token> tokens = new ArrayList<>();

        Token open = scanOpen();
        tokens.add(open);
        boolean unescaped = open.type() == TokenType.OPEN_UNESCAPED;

        while (true) {
            skipWhitespace();
            if (pos >= length) {
                throw lineMap.error("Unclosed mustache", start);
            }

            Token close = scanClose(unescaped);
            if (close != null) {
                tokens.add(close);
                return tokens;
            }

            tokens.add(scanToken());
        }
    }

    private Token scanOpen() {
        int start = pos;
        if (!startsWith("{{")) {
            throw lineMap.error("Expected '{{'", pos);
        }
        if (startsWith("{{{")) {
            pos += 3;
            skipStrip();
            return new Token(TokenType.OPEN_UNESCAPED, source.substring(start, pos), start, pos);
        }
        pos += 2;
        skipStrip();

        TokenType type = TokenType.OPEN;
        if (pos < length) {
            switch (buf[pos]) {
                case '#' -> {
                    if (startsWith("#>")) {
                        throw lineMap.error("Partial blocks are not supported", start);
                    }
                    type = TokenType.OPEN_BLOCK;
                    pos++;
                }
                case '/' -> {
                    type = TokenType.OPEN_END_BLOCK;
                    pos++;
                }
                case '>' -> throw lineMap.error("Partials are not supported", start);
                case '^' -> throw lineMap.error("Inverse sections are not supported, use {{else}}", start);
                case '!' -> throw lineMap.error("Comment found where a mustache was expected", start);
                default -> { }
            }
        }
        return new Token(type, source.substring(start, pos), start, pos);
    }

    private void skipStrip() {
        if (pos < length && buf[pos] == '~') {
            pos++;
        }
    }

    // Returns null when the cursor is not at a closing delimiter
    private Token scanClose(boolean unescaped) {
        int start = pos;
        int p = pos;
        if (p < length && buf[p] == '~') {
            p++;
        }
        if (unescaped) {
            if (source.startsWith("}}}", p)) {
                pos = p + 3;
                return new Token(TokenType.CLOSE_UNESCAPED, source.substring(start, pos), start, pos);
            }
            if (source.startsWith("}}", p)) {
                throw lineMap.error("Expected '}}}' to close '{{{'", start);
            }
            return null;
        }
        if (source.startsWith("}}", p)) {
            pos = p + 2;
            return new Token(TokenType.CLOSE, source.substring(start, pos), start, pos);
        }
        return null;
    }

    private Token scanToken() {
        int start = pos;
        char ch = buf[pos];

        switch (ch) {
            case '(':
                pos++;
                return new Token(TokenType.OPEN_SEXPR, "(", start, pos);
            case ')':
                pos++;
                return new Token(TokenType.CLOSE_SEXPR, ")", start, pos);
            case '=':
                pos++;
                return new Token(TokenType.EQUALS, "=", start, pos);
            case '|':
                pos++;
                return new Token(TokenType.CLOSE_BLOCK_PARAMS, "|", start, pos);
            case '"':
            case '\'':
                return scanString(ch);
            default:
                break;
        }

        if (isBlockParamsStart()) {
            pos += 2;
            skipWhitespace();
            pos++; // '|'
            return new Token(TokenType.OPEN_BLOCK_PARAMS, source.substring(start, pos), start, pos);
        }

        Token number = scanNumber();
        if (number != null) {
            return number;
        }

        return scanIdentifier();
    }

    // "as" followed by whitespace and '|'
    private boolean isBlockParamsStart() {
        if (!startsWith("as") || pos + 2 >= length || !Character.isWhitespace(buf[pos + 2])) {
            return false;
        }
        int p = pos + 2;
        while (p < length && Character.isWhitespace(buf[p])) {
            p++;
        }
        return p < length && buf[p] == '|';
    }

    private Token scanString(char quote) {
        int start = pos;
        pos++; // opening quote
        StringBuilder value = new StringBuilder();
        while (pos < length && buf[pos] != quote) {
            char ch = buf[pos];
            if (ch == '\\' && pos + 1 < length && buf[pos + 1] == quote) {
                value.append(quote);
                pos += 2;
            } else {
                value.append(ch);
                pos++;
            }
        }
        if (pos >= length) {
            throw lineMap.error("Unterminated string literal", start);
        }
        pos++; // closing quote
        return new Token(TokenType.STRING, source.substring(start, pos), value.toString(), start, pos);
    }

    private Token scanNumber() {
        int start = pos;
        int p = pos;
        if (p < length && buf[p] == '-') {
            p++;
        }
        int digitsStart = p;
        while (p < length && isDigit(buf[p])) {
            p++;
        }
        if (p == digitsStart) {
            return null;
        }
        if (p + 1 < length && buf[p] == '.' && isDigit(buf[p + 1])) {
            p++;
            while (p < length && isDigit(buf[p])) {
                p++;
            }
        }
        // 12abc is an identifier, not a number
        if (p < length && !isLiteralTerminator(buf[p])) {
            return null;
        }
        pos = p;
        String lexeme = source.substring(start, pos);
        return new Token(TokenType.NUMBER, lexeme, Double.parseDouble(lexeme), start, pos);
    }

    private Token scanIdentifier() {
        int start = pos;
        while (pos < length) {
            char ch = buf[pos];
            if (ch == '[') {
                // Segment literal: foo.[bar baz]
                int close = source.indexOf(']', pos);
                if (close < 0) {
                    throw lineMap.error("Unterminated segment literal", pos);
                }
                pos = close + 1;
            } else if (isIdentifierChar(ch)) {
                pos++;
            } else {
                break;
            }
        }
        if (pos == start) {
            throw lineMap.error("Unexpected character '" + buf[pos] + "'", pos);
        }

        String lexeme = source.substring(start, pos);
        return switch (lexeme) {
            case "true" -> new Token(TokenType.BOOLEAN, lexeme, Boolean.TRUE, start, pos);
            case "false" -> new Token(TokenType.BOOLEAN, lexeme, Boolean.FALSE, start, pos);
            case "null" -> new Token(TokenType.NULL, lexeme, start, pos);
            case "undefined" -> new Token(TokenType.UNDEFINED, lexeme, start, pos);
            default -> new Token(TokenType.ID, lexeme, start, pos);
        };
    }

    private void skipWhitespace() {
        while (pos < length && Character.isWhitespace(buf[pos])) {
            pos++;
        }
    }

    private boolean startsWith(String prefix) {
        return source.startsWith(prefix, pos);
    }

    private static boolean isDigit(char ch) {
        return ch >= '0' && ch <= '9';
    }

    private static boolean isLiteralTerminator(char ch) {
        return Character.isWhitespace(ch) || ch == '}' || ch == ')' || ch == '~' || ch == '|' || ch == '=';
    }

    static boolean isIdentifierChar(char ch) {
        if (Character.isWhitespace(ch)) {
            return false;
        }
        return switch (ch) {
            case '!', '"', '#', '%', '&', '\'', '(', ')', '*', '+', ',', ';', '<', '=', '>',
                 '[', ']', '^', '`', '{', '|', '}', '~' -> false;
            default -> true;
        };
    }
}
