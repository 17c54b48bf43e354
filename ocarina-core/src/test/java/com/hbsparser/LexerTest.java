package com.hbsparser;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class LexerTest {

    private static List<TokenType> types(String source) {
        return new Lexer(source).tokenizeMustache(0).stream().map(Token::type).toList();
    }

    @Test
    void simpleMustache() {
        assertEquals(List.of(TokenType.OPEN, TokenType.ID, TokenType.CLOSE), types("{{my-component/bar}}"));
    }

    @Test
    void blockWithParamsHashAndBlockParams() {
        assertEquals(List.of(
                TokenType.OPEN_BLOCK, TokenType.ID, TokenType.ID, TokenType.ID, TokenType.EQUALS,
                TokenType.OPEN_SEXPR, TokenType.ID, TokenType.STRING, TokenType.CLOSE_SEXPR,
                TokenType.OPEN_BLOCK_PARAMS, TokenType.ID, TokenType.ID, TokenType.CLOSE_BLOCK_PARAMS,
                TokenType.CLOSE),
            types("{{#each items key=(concat 'id') as |item index|}}"));
    }

    @Test
    void literals() {
        List<Token> tokens = new Lexer("{{helper \"a \\\"b\\\"\" 'c' -1.5 42 true false null undefined}}").tokenizeMustache(0);

        assertEquals("a \"b\"", tokens.get(2).literal());
        assertEquals("c", tokens.get(3).literal());
        assertEquals(-1.5, tokens.get(4).literal());
        assertEquals(42.0, tokens.get(5).literal());
        assertEquals(Boolean.TRUE, tokens.get(6).literal());
        assertEquals(Boolean.FALSE, tokens.get(7).literal());
        assertEquals(TokenType.NULL, tokens.get(8).type());
        assertEquals(TokenType.UNDEFINED, tokens.get(9).type());
    }

    @Test
    void identifiersMayLookNumeric() {
        List<Token> tokens = new Lexer("{{2fa-code}}").tokenizeMustache(0);
        assertEquals(TokenType.ID, tokens.get(1).type());
        assertEquals("2fa-code", tokens.get(1).lexeme());
    }

    @Test
    void argumentsAndSegmentLiterals() {
        List<Token> tokens = new Lexer("{{@model.[first name]}}").tokenizeMustache(0);
        assertEquals("@model.[first name]", tokens.get(1).lexeme());
    }

    @Test
    void whitespaceControlAndTripleStash() {
        assertEquals(List.of(TokenType.OPEN, TokenType.ID, TokenType.CLOSE), types("{{~foo~}}"));
        assertEquals(List.of(TokenType.OPEN_UNESCAPED, TokenType.ID, TokenType.CLOSE_UNESCAPED), types("{{{html}}}"));
        assertEquals(List.of(TokenType.OPEN_END_BLOCK, TokenType.ID, TokenType.CLOSE), types("{{~/if}}"));
    }

    @Test
    void positionsAreSourceOffsets() {
        List<Token> tokens = new Lexer("text {{foo}}").tokenizeMustache(5);
        assertEquals(5, tokens.get(0).position());
        assertEquals(10, tokens.get(1).endPosition());
        assertEquals(12, tokens.get(2).endPosition());
    }

    @Test
    void errors() {
        assertThrows(TemplateSyntaxException.class, () -> new Lexer("{{foo").tokenizeMustache(0));
        assertThrows(TemplateSyntaxException.class, () -> new Lexer("{{foo \"bar}}").tokenizeMustache(0));
        assertThrows(TemplateSyntaxException.class, () -> new Lexer("{{> partial}}").tokenizeMustache(0));
        assertThrows(TemplateSyntaxException.class, () -> new Lexer("{{{foo}}").tokenizeMustache(0));
        assertThrows(TemplateSyntaxException.class, () -> new Lexer("{{foo ~bar}}").tokenizeMustache(0));
    }
}
