package org.channelsim.compiler;

import org.channelsim.compiler.api.RateEquationException;
import org.channelsim.compiler.api.RateFunction;
import org.channelsim.compiler.backend.ClosureEmitter;
import org.channelsim.compiler.frontend.lexer.Lexer;
import org.channelsim.compiler.frontend.lexer.Token;
import org.channelsim.compiler.frontend.parser.Parser;
import org.channelsim.compiler.frontend.parser.ast.ExpressionNode;

import java.util.List;

/**
 * Compiles rate equation strings such as {@code "0.1 * exp(V / 25.0)"} into
 * {@link RateFunction}s.
 * <p>
 * The pipeline is: {@link Lexer} → {@link Parser} → {@link ClosureEmitter}. The compiler is
 * stateless; callers that evaluate the same equation repeatedly are expected to cache the
 * returned function.
 */
public class RateEquationCompiler {

    /**
     * Parses an equation into its expression tree without emitting code.
     *
     * @param equation The equation text.
     * @return The root of the expression tree.
     * @throws RateEquationException if the equation is malformed or uses an undefined symbol.
     */
    public ExpressionNode parse(String equation) throws RateEquationException {
        List<Token> tokens = new Lexer(equation).scanTokens();
        return new Parser(equation, tokens).parse();
    }

    /**
     * Compiles an equation into a callable function of voltage.
     *
     * @param equation The equation text.
     * @return The compiled function.
     * @throws RateEquationException if the equation is malformed or uses an undefined symbol.
     */
    public RateFunction compile(String equation) throws RateEquationException {
        return ClosureEmitter.emit(parse(equation));
    }
}
