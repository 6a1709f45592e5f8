package org.arfrpc.compiler.model;

/**
 * Kinds of tokens produced by the {@link org.arfrpc.compiler.frontend.lexer.Lexer}.
 * Keywords are not token types of their own: they are {@link #IDENTIFIER} tokens whose
 * text is checked by the parser.
 */
public enum TokenType {
    IDENTIFIER,
    NUMBER,
    STRING,
    COMMENT,

    EQUAL,          // =
    SEMICOLON,      // ;
    LEFT_PAREN,     // (
    RIGHT_PAREN,    // )
    LEFT_BRACE,     // {
    RIGHT_BRACE,    // }
    LEFT_ANGLE,     // <
    RIGHT_ANGLE,    // >
    COMMA,          // ,
    AT,             // @
    DOT,            // .
    ARROW,          // ->

    EOF
}
