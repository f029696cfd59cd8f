package org.channelsim.compiler.frontend.parser;

import org.channelsim.compiler.api.RateEquationException;
import org.channelsim.compiler.api.RateEquationParseException;
import org.channelsim.compiler.api.UndefinedSymbolException;
import org.channelsim.compiler.frontend.lexer.Token;
import org.channelsim.compiler.frontend.lexer.TokenType;
import org.channelsim.compiler.frontend.parser.ast.BinaryOpNode;
import org.channelsim.compiler.frontend.parser.ast.BinaryOpNode.Operator;
import org.channelsim.compiler.frontend.parser.ast.ExpCallNode;
import org.channelsim.compiler.frontend.parser.ast.ExpressionNode;
import org.channelsim.compiler.frontend.parser.ast.NegateNode;
import org.channelsim.compiler.frontend.parser.ast.NumberNode;
import org.channelsim.compiler.frontend.parser.ast.VariableNode;

import java.util.List;

/**
 * Recursive-descent parser for rate equations.
 * <p>
 * Grammar, lowest to highest precedence:
 * <pre>
 * expression := term (('+' | '-') term)*
 * term       := unary (('*' | '/') unary)*
 * unary      := ('+' | '-') unary | primary
 * primary    := NUMBER | 'V' | 'exp' '(' expression ')' | '(' expression ')'
 * </pre>
 * Binary operators are left-associative.
 */
public class Parser {

    /** The voltage variable, the only free symbol of a rate equation. */
    public static final String VOLTAGE_SYMBOL = "V";
    /** The only callable function. */
    public static final String EXP_FUNCTION = "exp";

    private final String equation;
    private final List<Token> tokens;
    private int current = 0;

    /**
     * Constructs a new Parser.
     * @param equation The original equation text, used in error reports.
     * @param tokens The tokens produced by the lexer for this equation.
     */
    public Parser(String equation, List<Token> tokens) {
        this.equation = equation;
        this.tokens = tokens;
    }

    /**
     * Parses the complete token stream into a single expression tree.
     * @return The root node.
     * @throws RateEquationException if the equation is malformed or uses an undefined symbol.
     */
    public ExpressionNode parse() throws RateEquationException {
        if (isAtEnd()) {
            throw new RateEquationParseException(equation, 0, "Empty equation");
        }
        ExpressionNode root = expression();
        if (!isAtEnd()) {
            Token unexpected = peek();
            throw new RateEquationParseException(equation, unexpected.offset(),
                    "Unexpected token '" + unexpected.text() + "' after end of expression");
        }
        return root;
    }

    private ExpressionNode expression() throws RateEquationException {
        ExpressionNode left = term();
        while (check(TokenType.PLUS) || check(TokenType.MINUS)) {
            Operator operator = advance().type() == TokenType.PLUS ? Operator.ADD : Operator.SUBTRACT;
            left = new BinaryOpNode(left, operator, term());
        }
        return left;
    }

    private ExpressionNode term() throws RateEquationException {
        ExpressionNode left = unary();
        while (check(TokenType.STAR) || check(TokenType.SLASH)) {
            Operator operator = advance().type() == TokenType.STAR ? Operator.MULTIPLY : Operator.DIVIDE;
            left = new BinaryOpNode(left, operator, unary());
        }
        return left;
    }

    private ExpressionNode unary() throws RateEquationException {
        if (match(TokenType.MINUS)) {
            return new NegateNode(unary());
        }
        if (match(TokenType.PLUS)) {
            return unary();
        }
        return primary();
    }

    private ExpressionNode primary() throws RateEquationException {
        Token token = peek();
        switch (token.type()) {
            case NUMBER -> {
                advance();
                return new NumberNode(token.value());
            }
            case IDENTIFIER -> {
                advance();
                return identifier(token);
            }
            case LEFT_PAREN -> {
                advance();
                ExpressionNode inner = expression();
                consume(TokenType.RIGHT_PAREN, "Expected ')' to close '(' at offset " + token.offset());
                return inner;
            }
            case END_OF_INPUT -> throw new RateEquationParseException(equation, token.offset(),
                    "Unexpected end of equation, expected an operand");
            default -> throw new RateEquationParseException(equation, token.offset(),
                    "Unexpected token '" + token.text() + "', expected an operand");
        }
    }

    private ExpressionNode identifier(Token token) throws RateEquationException {
        String name = token.text();
        if (VOLTAGE_SYMBOL.equals(name)) {
            return new VariableNode();
        }
        if (EXP_FUNCTION.equals(name)) {
            consume(TokenType.LEFT_PAREN, "Expected '(' after '" + EXP_FUNCTION + "'");
            ExpressionNode argument = expression();
            consume(TokenType.RIGHT_PAREN, "Expected ')' to close call of '" + EXP_FUNCTION + "'");
            return new ExpCallNode(argument);
        }
        throw new UndefinedSymbolException(equation, token.offset(), name);
    }

    // --- Token stream navigation ---

    private boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    private boolean check(TokenType type) {
        return peek().type() == type;
    }

    private Token advance() {
        Token token = peek();
        if (!isAtEnd()) current++;
        return token;
    }

    private Token peek() {
        return tokens.get(current);
    }

    private boolean isAtEnd() {
        return peek().type() == TokenType.END_OF_INPUT;
    }

    private Token consume(TokenType type, String errorMessage) throws RateEquationParseException {
        if (check(type)) return advance();
        throw new RateEquationParseException(equation, peek().offset(), errorMessage);
    }
}
