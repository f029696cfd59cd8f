package org.channelsim.compiler.frontend.lexer;

/**
 * Represents a single token produced by the {@link Lexer}.
 *
 * @param type The type of the token.
 * @param text The raw text of the token.
 * @param value The numeric value for {@link TokenType#NUMBER} tokens, 0 otherwise.
 * @param offset The zero-based character offset of the token within the equation.
 */
public record Token(TokenType type, String text, double value, int offset) {
}
