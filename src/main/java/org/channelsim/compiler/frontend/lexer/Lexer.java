package org.channelsim.compiler.frontend.lexer;

import org.channelsim.compiler.api.RateEquationParseException;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts a rate equation string into a list of {@link Token}s.
 * Whitespace is skipped; every other character must belong to a number, an identifier,
 * an operator or a parenthesis.
 */
public class Lexer {

    private final String source;
    private final List<Token> tokens = new ArrayList<>();
    private int start = 0;
    private int current = 0;

    /**
     * Constructs a new Lexer.
     * @param source The equation text to tokenize.
     */
    public Lexer(String source) {
        this.source = source;
    }

    /**
     * Scans the whole equation.
     * @return The token list, always terminated by an {@link TokenType#END_OF_INPUT} token.
     * @throws RateEquationParseException if an unexpected character or a malformed number is found.
     */
    public List<Token> scanTokens() throws RateEquationParseException {
        while (!isAtEnd()) {
            start = current;
            scanToken();
        }
        tokens.add(new Token(TokenType.END_OF_INPUT, "", 0.0, source.length()));
        return tokens;
    }

    private void scanToken() throws RateEquationParseException {
        char c = advance();
        switch (c) {
            case ' ', '\t', '\r', '\n' -> { }
            case '+' -> addToken(TokenType.PLUS);
            case '-' -> addToken(TokenType.MINUS);
            case '*' -> addToken(TokenType.STAR);
            case '/' -> addToken(TokenType.SLASH);
            case '(' -> addToken(TokenType.LEFT_PAREN);
            case ')' -> addToken(TokenType.RIGHT_PAREN);
            default -> {
                if (isDigit(c) || c == '.') {
                    number();
                } else if (isAlpha(c)) {
                    identifier();
                } else {
                    throw new RateEquationParseException(source, start, "Unexpected character '" + c + "'");
                }
            }
        }
    }

    private void number() throws RateEquationParseException {
        while (isDigit(peek())) advance();
        if (peek() == '.') {
            advance();
            while (isDigit(peek())) advance();
        }
        if (peek() == 'e' || peek() == 'E') {
            int exponentStart = current;
            advance();
            if (peek() == '+' || peek() == '-') advance();
            if (!isDigit(peek())) {
                throw new RateEquationParseException(source, exponentStart, "Malformed exponent in numeric literal");
            }
            while (isDigit(peek())) advance();
        }

        String text = source.substring(start, current);
        if (".".equals(text)) {
            throw new RateEquationParseException(source, start, "Expected digits around '.'");
        }
        double value;
        try {
            value = Double.parseDouble(text);
        } catch (NumberFormatException e) {
            throw new RateEquationParseException(source, start, "Invalid numeric literal '" + text + "'");
        }
        tokens.add(new Token(TokenType.NUMBER, text, value, start));
    }

    private void identifier() {
        while (isAlphaNumeric(peek())) advance();
        addToken(TokenType.IDENTIFIER);
    }

    private void addToken(TokenType type) {
        tokens.add(new Token(type, source.substring(start, current), 0.0, start));
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char advance() {
        return source.charAt(current++);
    }

    private char peek() {
        if (isAtEnd()) return '\0';
        return source.charAt(current);
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }
}
