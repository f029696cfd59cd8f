package org.channelsim.compiler.frontend.lexer;

/**
 * Defines all token types recognized in a rate equation.
 */
public enum TokenType {
    // Literals and identifiers
    NUMBER,
    IDENTIFIER,

    // Operators
    PLUS,
    MINUS,
    STAR,
    SLASH,

    // Grouping
    LEFT_PAREN,
    RIGHT_PAREN,

    END_OF_INPUT
}
