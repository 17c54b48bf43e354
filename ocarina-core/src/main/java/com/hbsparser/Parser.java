package com.hbsparser;

import com.hbsparser.ast.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Recursive-descent parser for Handlebars/Glimmer component templates.
 *
 * <p>Markup (text, elements, attributes, HTML comments) is scanned character by character.
 * Each mustache is handed to the {@link Lexer} and its tokens are parsed with the usual
 * peek/advance/consume helpers.</p>
 */
public class Parser {
    public static final int DEFAULT_MAX_DEPTH = 512;

    // Elements that never have a closing tag
    private static final Set<String> VOID_ELEMENTS = Set.of(
        "area", "base", "br", "col", "command", "embed", "hr", "img", "input",
        "keygen", "link", "meta", "param", "source", "track", "wbr"
    );

    private final String source;
    private final char[] sourceBuf;
    private final int sourceLength;
    private final LineMap lineMap;
    private final Lexer lexer;
    private final int maxDepth;

    // Markup cursor
    private int pos = 0;
    // Element/block nesting, checked against maxDepth
    private int depth = 0;

    // Tokens of the mustache currently being parsed
    private List<Token> tokens = List.of();
    private int current = 0;

    // One-entry cache for mustache lookahead
    private int peekedAt = -1;
    private List<Token> peekedTokens;

    // Head of a mustache/block/sub-expression, before the closing delimiter
    private record CallParts(Expression path, List<Expression> params, Hash hash, List<String> blockParams) {}

    public Parser(String source) {
        this(source, DEFAULT_MAX_DEPTH);
    }

    public Parser(String source, int maxDepth) {
        this.source = source;
        this.sourceBuf = source.toCharArray();
        this.sourceLength = sourceBuf.length;
        this.lineMap = new LineMap(sourceBuf);
        this.lexer = new Lexer(source, lineMap);
        this.maxDepth = maxDepth;
    }

    public Template parse() {
        List<Statement> body = parseStatements();

        // parseStatements only stops early at a delimiter that closes something
        if (pos < sourceLength) {
            if (startsWith("</")) {
                String tag = peekClosingTagName();
                throw lineMap.error("Closing tag </" + tag + "> without an open tag", pos);
            }
            List<Token> mustache = peekMustache();
            if (mustache.get(0).type() == TokenType.OPEN_END_BLOCK) {
                throw lineMap.error("Closing block " + describe(mustache) + " without an open block", pos);
            }
            throw lineMap.error("{{else}} outside of a block", pos);
        }

        return new Template(0, sourceLength, lineMap.span(0, sourceLength), body);
    }

    // ========================================================================
    // Content
    // ========================================================================

    /**
     * Parse statements until EOF, a closing tag, {@code {{else ...}}} or {@code {{/...}}}.
     * The terminator is left unconsumed.
     */
    private List<Statement> parseStatements() {
        List<Statement> body = new ArrayList<>();
        while (pos < sourceLength) {
            if (startsWith("{{")) {
                if (isMustacheComment()) {
                    body.add(parseMustacheComment());
                } else if (atBlockTerminator()) {
                    break;
                } else {
                    body.add(parseMustacheOrBlock());
                }
            } else if (startsWith("<!--")) {
                body.add(parseHtmlComment());
            } else if (startsWith("</")) {
                break;
            } else if (isElementStart()) {
                body.add(parseElement());
            } else {
                body.add(parseText());
            }
        }
        return body;
    }

    private TextNode parseText() {
        int start = pos;
        StringBuilder chars = new StringBuilder();
        while (pos < sourceLength) {
            if (startsWith("\\{{")) {
                // Escaped mustache renders literally
                chars.append("{{");
                pos += 3;
                continue;
            }
            if (startsWith("{{") || startsWith("<!--") || startsWith("</") || isElementStart()) {
                break;
            }
            chars.append(sourceBuf[pos]);
            pos++;
        }
        return new TextNode(start, pos, lineMap.span(start, pos), chars.toString());
    }

    private boolean isElementStart() {
        if (pos + 1 >= sourceLength || sourceBuf[pos] != '<') {
            return false;
        }
        char next = sourceBuf[pos + 1];
        return Character.isLetter(next) || next == '@' || next == ':' || next == '_';
    }

    private CommentStatement parseHtmlComment() {
        int start = pos;
        int close = source.indexOf("-->", pos + 4);
        if (close < 0) {
            throw lineMap.error("Unclosed comment", start);
        }
        String value = source.substring(pos + 4, close);
        pos = close + 3;
        return new CommentStatement(start, pos, lineMap.span(start, pos), value);
    }

    private boolean isMustacheComment() {
        return startsWith("{{!") || startsWith("{{~!");
    }

    private MustacheCommentStatement parseMustacheComment() {
        int start = pos;
        int bodyStart = pos + (startsWith("{{~") ? 4 : 3);
        String value;
        if (source.startsWith("--", bodyStart)) {
            int close = source.indexOf("--", bodyStart + 2);
            while (close >= 0 && !closesMustache(close + 2)) {
                close = source.indexOf("--", close + 1);
            }
            if (close < 0) {
                throw lineMap.error("Unclosed comment", start);
            }
            value = source.substring(bodyStart + 2, close);
            pos = endOfClose(close + 2);
        } else {
            int close = source.indexOf("}}", bodyStart);
            if (close < 0) {
                throw lineMap.error("Unclosed comment", start);
            }
            int valueEnd = close > bodyStart && sourceBuf[close - 1] == '~' ? close - 1 : close;
            value = source.substring(bodyStart, valueEnd);
            pos = close + 2;
        }
        return new MustacheCommentStatement(start, pos, lineMap.span(start, pos), value);
    }

    private boolean closesMustache(int at) {
        return source.startsWith("}}", at) || source.startsWith("~}}", at);
    }

    private int endOfClose(int at) {
        return source.startsWith("~}}", at) ? at + 3 : at + 2;
    }

    // ========================================================================
    // Elements
    // ========================================================================

    private ElementNode parseElement() {
        int start = pos;
        enterNesting(start);
        try {
            pos++; // '<'
            String tag = readTagName();
            if (tag.isEmpty()) {
                throw lineMap.error("Expected tag name", pos);
            }

            List<AttrNode> attributes = new ArrayList<>();
            List<ElementModifierStatement> modifiers = new ArrayList<>();
            List<String> blockParams = new ArrayList<>();
            boolean selfClosing = false;

            while (true) {
                skipWhitespace();
                if (pos >= sourceLength) {
                    throw lineMap.error("Unclosed element <" + tag + ">", start);
                }
                if (startsWith("/>")) {
                    pos += 2;
                    selfClosing = true;
                    break;
                }
                if (sourceBuf[pos] == '>') {
                    pos++;
                    break;
                }
                if (startsWith("{{")) {
                    if (isMustacheComment()) {
                        parseMustacheComment();
                    } else {
                        modifiers.add(parseModifier());
                    }
                } else if (atElementBlockParams()) {
                    if (!blockParams.isEmpty()) {
                        throw lineMap.error("Duplicate block params on <" + tag + ">", pos);
                    }
                    blockParams.addAll(parseElementBlockParams());
                } else {
                    attributes.add(parseAttribute());
                }
            }

            List<Statement> children = List.of();
            if (!selfClosing && !VOID_ELEMENTS.contains(tag)) {
                children = parseStatements();
                expectClosingTag(tag, start);
            }

            return new ElementNode(start, pos, lineMap.span(start, pos), tag,
                attributes, modifiers, blockParams, children, selfClosing);
        } finally {
            depth--;
        }
    }

    private String readTagName() {
        int start = pos;
        while (pos < sourceLength) {
            char ch = sourceBuf[pos];
            if (Character.isWhitespace(ch) || ch == '/' || ch == '>' || startsWith("{{")) {
                break;
            }
            pos++;
        }
        return source.substring(start, pos);
    }

    private void expectClosingTag(String tag, int openStart) {
        if (pos >= sourceLength) {
            throw lineMap.error("Unclosed element <" + tag + ">", openStart);
        }
        if (!startsWith("</")) {
            // Stopped on {{else}} or {{/...}} inside the element
            throw lineMap.error("Unexpected " + describe(peekMustache()) + " inside <" + tag + ">", pos);
        }
        int closeStart = pos;
        pos += 2;
        String closing = readTagName();
        skipWhitespace();
        if (pos >= sourceLength || sourceBuf[pos] != '>') {
            throw lineMap.error("Unclosed closing tag </" + closing + ">", closeStart);
        }
        pos++;
        if (!closing.equals(tag)) {
            throw lineMap.error("Closing tag </" + closing + "> did not match last open tag <" + tag + ">", closeStart);
        }
    }

    private String peekClosingTagName() {
        int saved = pos;
        pos += 2;
        String name = readTagName();
        pos = saved;
        return name;
    }

    private boolean atElementBlockParams() {
        if (!startsWith("as") || pos + 2 >= sourceLength) {
            return false;
        }
        int p = pos + 2;
        if (!Character.isWhitespace(sourceBuf[p]) && sourceBuf[p] != '|') {
            return false;
        }
        while (p < sourceLength && Character.isWhitespace(sourceBuf[p])) {
            p++;
        }
        return p < sourceLength && sourceBuf[p] == '|';
    }

    private List<String> parseElementBlockParams() {
        int start = pos;
        pos += 2; // "as"
        skipWhitespace();
        pos++; // '|'
        List<String> names = new ArrayList<>();
        while (true) {
            skipWhitespace();
            if (pos >= sourceLength) {
                throw lineMap.error("Unclosed block params", start);
            }
            if (sourceBuf[pos] == '|') {
                pos++;
                break;
            }
            int nameStart = pos;
            while (pos < sourceLength && Lexer.isIdentifierChar(sourceBuf[pos])) {
                pos++;
            }
            if (pos == nameStart) {
                throw lineMap.error("Invalid block param name", pos);
            }
            names.add(source.substring(nameStart, pos));
        }
        if (names.isEmpty()) {
            throw lineMap.error("Empty block params", start);
        }
        return names;
    }

    private AttrNode parseAttribute() {
        int start = pos;
        while (pos < sourceLength) {
            char ch = sourceBuf[pos];
            if (Character.isWhitespace(ch) || ch == '=' || ch == '>' || startsWith("/>") || startsWith("{{")) {
                break;
            }
            pos++;
        }
        if (pos == start) {
            throw lineMap.error("Unexpected character '" + sourceBuf[pos] + "' in tag", pos);
        }
        String name = source.substring(start, pos);

        int afterName = pos;
        skipWhitespace();
        AttrValue value;
        if (pos < sourceLength && sourceBuf[pos] == '=') {
            pos++;
            skipWhitespace();
            value = parseAttrValue();
        } else {
            pos = afterName;
            value = new TextNode(afterName, afterName, lineMap.span(afterName, afterName), "");
        }
        return new AttrNode(start, pos, lineMap.span(start, pos), name, value);
    }

    private AttrValue parseAttrValue() {
        if (pos >= sourceLength) {
            throw lineMap.error("Expected attribute value", pos);
        }
        char ch = sourceBuf[pos];
        if (ch == '"' || ch == '\'') {
            return parseQuotedAttrValue(ch);
        }
        if (startsWith("{{")) {
            return parseValueMustache();
        }

        int start = pos;
        while (pos < sourceLength) {
            char c = sourceBuf[pos];
            if (Character.isWhitespace(c) || c == '>' || startsWith("/>") || startsWith("{{")) {
                break;
            }
            pos++;
        }
        return new TextNode(start, pos, lineMap.span(start, pos), source.substring(start, pos));
    }

    private AttrValue parseQuotedAttrValue(char quote) {
        int start = pos;
        pos++; // opening quote
        List<AttrValue> parts = new ArrayList<>();
        int textStart = pos;
        StringBuilder text = new StringBuilder();

        while (true) {
            if (pos >= sourceLength) {
                throw lineMap.error("Unterminated attribute value", start);
            }
            char ch = sourceBuf[pos];
            if (ch == quote) {
                break;
            }
            if (startsWith("{{")) {
                if (text.length() > 0) {
                    parts.add(new TextNode(textStart, pos, lineMap.span(textStart, pos), text.toString()));
                    text.setLength(0);
                }
                if (isMustacheComment()) {
                    parseMustacheComment();
                } else {
                    parts.add(parseValueMustache());
                }
                textStart = pos;
                continue;
            }
            text.append(ch);
            pos++;
        }
        if (text.length() > 0) {
            parts.add(new TextNode(textStart, pos, lineMap.span(textStart, pos), text.toString()));
        }
        pos++; // closing quote

        if (parts.isEmpty()) {
            return new TextNode(start, pos, lineMap.span(start, pos), "");
        }
        if (parts.size() == 1 && parts.get(0) instanceof TextNode textNode) {
            return new TextNode(start, pos, lineMap.span(start, pos), textNode.chars());
        }
        return new ConcatStatement(start, pos, lineMap.span(start, pos), parts);
    }

    // Mustache in attribute position: blocks are not allowed here
    private MustacheStatement parseValueMustache() {
        int start = pos;
        consumeMustache();
        Token open = advance();
        if (open.type() != TokenType.OPEN && open.type() != TokenType.OPEN_UNESCAPED) {
            throw lineMap.error("Unexpected " + open.lexeme() + " in attribute value", start);
        }
        return finishMustache(start, open);
    }

    private ElementModifierStatement parseModifier() {
        int start = pos;
        consumeMustache();
        Token open = advance();
        if (open.type() != TokenType.OPEN) {
            throw lineMap.error("Unexpected " + open.lexeme() + " in element modifier position", start);
        }
        CallParts call = parseCallParts(false);
        consume(TokenType.CLOSE, "Expected '}}' to close modifier");
        return new ElementModifierStatement(start, pos, lineMap.span(start, pos), call.path(), call.params(), call.hash());
    }

    // ========================================================================
    // Mustaches and blocks
    // ========================================================================

    private Statement parseMustacheOrBlock() {
        int start = pos;
        consumeMustache();
        Token open = advance();
        if (open.type() == TokenType.OPEN_BLOCK) {
            CallParts call = parseCallParts(true);
            consume(TokenType.CLOSE, "Expected '}}' to close block");
            if (!(call.path() instanceof PathExpression)) {
                throw lineMap.error("Block path must be a path expression", start);
            }
            return parseBlockBody(start, call, false);
        }
        return finishMustache(start, open);
    }

    private MustacheStatement finishMustache(int start, Token open) {
        boolean trusting = open.type() == TokenType.OPEN_UNESCAPED;
        CallParts call = parseCallParts(false);
        if (trusting) {
            consume(TokenType.CLOSE_UNESCAPED, "Expected '}}}'");
        } else {
            consume(TokenType.CLOSE, "Expected '}}'");
        }
        return new MustacheStatement(start, pos, lineMap.span(start, pos), call.path(), call.params(), call.hash(), trusting);
    }

    /**
     * Parse a block's program, optional inverse, and closing delimiter. A chained block
     * ({@code {{else if ...}}}) stops before the closing delimiter, which belongs to the
     * outermost block of the chain.
     */
    private BlockStatement parseBlockBody(int start, CallParts open, boolean chained) {
        enterNesting(start);
        try {
            Block program = parseProgram(open.blockParams(), false);
            Block inverse = null;

            if (atElseMustache()) {
                int elseStart = pos;
                consumeMustache();
                advance(); // open
                advance(); // else
                if (check(TokenType.CLOSE)) {
                    advance();
                    inverse = parseProgram(List.of(), false);
                } else if (check(TokenType.OPEN_BLOCK_PARAMS)) {
                    List<String> params = parseBlockParams();
                    consume(TokenType.CLOSE, "Expected '}}' to close {{else}}");
                    inverse = parseProgram(params, false);
                } else {
                    CallParts chainedOpen = parseCallParts(true);
                    consume(TokenType.CLOSE, "Expected '}}' to close {{else}}");
                    if (!(chainedOpen.path() instanceof PathExpression)) {
                        throw lineMap.error("Block path must be a path expression", elseStart);
                    }
                    BlockStatement nested = parseBlockBody(elseStart, chainedOpen, true);
                    inverse = new Block(elseStart, nested.end(), lineMap.span(elseStart, nested.end()),
                        List.of(), List.of(nested), true);
                }
            }

            if (!chained) {
                expectEndBlock((PathExpression) open.path(), start);
            } else if (atElseMustache()) {
                throw lineMap.error("Unexpected {{else}} after {{else}}", pos);
            }

            return new BlockStatement(start, pos, lineMap.span(start, pos),
                open.path(), open.params(), open.hash(), program, inverse);
        } finally {
            depth--;
        }
    }

    private Block parseProgram(List<String> blockParams, boolean chained) {
        int start = pos;
        List<Statement> body = parseStatements();
        return new Block(start, pos, lineMap.span(start, pos), blockParams, body, chained);
    }

    private void expectEndBlock(PathExpression openPath, int openStart) {
        if (pos >= sourceLength) {
            throw lineMap.error("Unclosed block {{#" + openPath.original() + "}}", openStart);
        }
        if (startsWith("</")) {
            String tag = peekClosingTagName();
            throw lineMap.error("Unexpected closing tag </" + tag + "> inside {{#" + openPath.original() + "}}", pos);
        }
        int closeStart = pos;
        consumeMustache();
        Token open = advance();
        if (open.type() != TokenType.OPEN_END_BLOCK) {
            throw lineMap.error("Unexpected {{else}} after {{else}}", closeStart);
        }
        Token name = consume(TokenType.ID, "Expected block name");
        consume(TokenType.CLOSE, "Expected '}}'");
        if (!name.lexeme().equals(openPath.original())) {
            throw lineMap.error("{{/" + name.lexeme() + "}} does not match {{#" + openPath.original() + "}}", closeStart);
        }
    }

    private boolean atBlockTerminator() {
        List<Token> mustache = peekMustache();
        return mustache.get(0).type() == TokenType.OPEN_END_BLOCK || isElse(mustache);
    }

    private boolean atElseMustache() {
        return startsWith("{{") && !isMustacheComment() && isElse(peekMustache());
    }

    private static boolean isElse(List<Token> mustache) {
        return mustache.get(0).type() == TokenType.OPEN
            && mustache.size() > 1
            && mustache.get(1).type() == TokenType.ID
            && mustache.get(1).lexeme().equals("else");
    }

    // ========================================================================
    // Expressions (token level)
    // ========================================================================

    private CallParts parseCallParts(boolean allowBlockParams) {
        Expression path = parseExpression();
        List<Expression> params = new ArrayList<>();
        while (isParamStart() && !isHashStart()) {
            params.add(parseExpression());
        }
        Hash hash = parseHash();

        List<String> blockParams = List.of();
        if (check(TokenType.OPEN_BLOCK_PARAMS)) {
            if (!allowBlockParams) {
                throw error("Block params are only allowed on blocks", peek());
            }
            blockParams = parseBlockParams();
        }
        return new CallParts(path, params, hash, blockParams);
    }

    private Hash parseHash() {
        if (!isHashStart()) {
            Token at = peek();
            return new Hash(at.position(), at.position(), lineMap.span(at.position(), at.position()), List.of());
        }
        int start = peek().position();
        List<HashPair> pairs = new ArrayList<>();
        while (isHashStart()) {
            Token key = advance();
            advance(); // '='
            Expression value = parseExpression();
            pairs.add(new HashPair(key.position(), value.end(), lineMap.span(key.position(), value.end()), key.lexeme(), value));
        }
        if (isParamStart()) {
            throw error("Positional params must come before hash arguments", peek());
        }
        int end = previous().endPosition();
        return new Hash(start, end, lineMap.span(start, end), pairs);
    }

    private List<String> parseBlockParams() {
        Token open = advance(); // as |
        List<String> names = new ArrayList<>();
        while (check(TokenType.ID)) {
            names.add(advance().lexeme());
        }
        consume(TokenType.CLOSE_BLOCK_PARAMS, "Expected '|' to close block params");
        if (names.isEmpty()) {
            throw error("Empty block params", open);
        }
        return names;
    }

    private Expression parseExpression() {
        Token token = peek();
        switch (token.type()) {
            case ID:
                advance();
                return new PathExpression(token.position(), token.endPosition(), spanOf(token), token.lexeme());
            case STRING:
                advance();
                return new StringLiteral(token.position(), token.endPosition(), spanOf(token), (String) token.literal());
            case NUMBER:
                advance();
                return new NumberLiteral(token.position(), token.endPosition(), spanOf(token), (Double) token.literal());
            case BOOLEAN:
                advance();
                return new BooleanLiteral(token.position(), token.endPosition(), spanOf(token), (Boolean) token.literal());
            case NULL:
                advance();
                return new NullLiteral(token.position(), token.endPosition(), spanOf(token));
            case UNDEFINED:
                advance();
                return new UndefinedLiteral(token.position(), token.endPosition(), spanOf(token));
            case OPEN_SEXPR:
                return parseSubExpression();
            default:
                throw error("Expected expression but found '" + token.lexeme() + "'", token);
        }
    }

    private SubExpression parseSubExpression() {
        Token open = advance(); // '('
        enterNesting(open.position());
        try {
            CallParts call = parseCallParts(false);
            Token close = consume(TokenType.CLOSE_SEXPR, "Expected ')' to close sub-expression");
            return new SubExpression(open.position(), close.endPosition(),
                lineMap.span(open.position(), close.endPosition()), call.path(), call.params(), call.hash());
        } finally {
            depth--;
        }
    }

    private boolean isParamStart() {
        TokenType type = peek().type();
        return type == TokenType.ID || type == TokenType.STRING || type == TokenType.NUMBER
            || type == TokenType.BOOLEAN || type == TokenType.NULL || type == TokenType.UNDEFINED
            || type == TokenType.OPEN_SEXPR;
    }

    private boolean isHashStart() {
        return check(TokenType.ID) && checkAhead(1, TokenType.EQUALS);
    }

    // ========================================================================
    // Helpers
    // ========================================================================

    private List<Token> peekMustache() {
        if (peekedAt != pos) {
            peekedTokens = lexer.tokenizeMustache(pos);
            peekedAt = pos;
        }
        return peekedTokens;
    }

    // Lex the mustache at the cursor, make it current, and move the markup cursor past it
    private void consumeMustache() {
        tokens = peekMustache();
        current = 0;
        pos = tokens.get(tokens.size() - 1).endPosition();
    }

    private void enterNesting(int at) {
        if (++depth > maxDepth) {
            depth--;
            throw lineMap.error("Nesting depth exceeds " + maxDepth, at);
        }
    }

    private SourceLocation spanOf(Token token) {
        return lineMap.span(token.position(), token.endPosition());
    }

    private TemplateSyntaxException error(String message, Token token) {
        return lineMap.error(message, token.position());
    }

    // Source-like rendering of a lexed mustache, e.g. {{/my-component}}
    private static String describe(List<Token> mustache) {
        StringBuilder text = new StringBuilder(mustache.get(0).lexeme());
        for (int i = 1; i < mustache.size() - 1; i++) {
            if (i > 1) {
                text.append(' ');
            }
            text.append(mustache.get(i).lexeme());
        }
        return text.append(mustache.get(mustache.size() - 1).lexeme()).toString();
    }

    private void skipWhitespace() {
        while (pos < sourceLength && Character.isWhitespace(sourceBuf[pos])) {
            pos++;
        }
    }

    private boolean startsWith(String prefix) {
        return source.startsWith(prefix, pos);
    }

    private boolean check(TokenType type) {
        if (isAtEnd()) return false;
        return peek().type() == type;
    }

    private boolean checkAhead(int offset, TokenType type) {
        int at = current + offset;
        if (at >= tokens.size()) return false;
        return tokens.get(at).type() == type;
    }

    private Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    private boolean isAtEnd() {
        return current >= tokens.size();
    }

    private Token peek() {
        return tokens.get(current);
    }

    private Token previous() {
        return tokens.get(current - 1);
    }

    private Token consume(TokenType type, String message) {
        if (check(type)) {
            return advance();
        }
        throw error(message, peek());
    }

    public static Template parse(String source) {
        return new Parser(source).parse();
    }

    public static Template parse(String source, int maxDepth) {
        return new Parser(source, maxDepth).parse();
    }
}
