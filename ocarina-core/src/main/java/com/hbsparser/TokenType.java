package com.hbsparser;

/**
 * Token kinds produced inside a mustache ({@code {{ ... }}}).
 *
 * <p>Markup outside mustaches (text, tags, attributes) is scanned directly by the
 * {@link Parser} and never tokenized.</p>
 */
public enum TokenType {
    // Delimiters
    OPEN,               // {{
    OPEN_UNESCAPED,     // {{{
    OPEN_BLOCK,         // {{#
    OPEN_END_BLOCK,     // {{/
    CLOSE,              // }}
    CLOSE_UNESCAPED,    // }}}
    OPEN_SEXPR,         // (
    CLOSE_SEXPR,        // )
    OPEN_BLOCK_PARAMS,  // as |
    CLOSE_BLOCK_PARAMS, // |
    EQUALS,             // =

    // Values
    ID,
    STRING,
    NUMBER,
    BOOLEAN,
    NULL,
    UNDEFINED
}
