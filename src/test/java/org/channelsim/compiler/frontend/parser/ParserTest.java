package org.channelsim.compiler.frontend.parser;

import org.channelsim.compiler.api.RateEquationException;
import org.channelsim.compiler.api.RateEquationParseException;
import org.channelsim.compiler.api.UndefinedSymbolException;
import org.channelsim.compiler.frontend.lexer.Lexer;
import org.channelsim.compiler.frontend.parser.ast.BinaryOpNode;
import org.channelsim.compiler.frontend.parser.ast.BinaryOpNode.Operator;
import org.channelsim.compiler.frontend.parser.ast.ExpCallNode;
import org.channelsim.compiler.frontend.parser.ast.ExpressionNode;
import org.channelsim.compiler.frontend.parser.ast.NegateNode;
import org.channelsim.compiler.frontend.parser.ast.NumberNode;
import org.channelsim.compiler.frontend.parser.ast.VariableNode;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class ParserTest {

    private static ExpressionNode parse(String equation) throws RateEquationException {
        return new Parser(equation, new Lexer(equation).scanTokens()).parse();
    }

    /** Renders the tree fully parenthesized so precedence is visible. */
    private static String render(ExpressionNode node) {
        if (node instanceof NumberNode number) {
            return String.valueOf(number.value());
        }
        if (node instanceof VariableNode) {
            return "V";
        }
        if (node instanceof NegateNode negate) {
            return "(-" + render(negate.operand()) + ")";
        }
        if (node instanceof ExpCallNode call) {
            return "exp(" + render(call.argument()) + ")";
        }
        BinaryOpNode binary = (BinaryOpNode) node;
        return "(" + render(binary.left()) + " " + binary.operator().symbol() + " " + render(binary.right()) + ")";
    }

    @Test
    void parse_multiplicationBindsTighterThanAddition() throws Exception {
        ExpressionNode root = parse("1 + 2 * V");

        assertThat(root).isInstanceOf(BinaryOpNode.class);
        BinaryOpNode add = (BinaryOpNode) root;
        assertThat(add.operator()).isEqualTo(Operator.ADD);
        assertThat(add.right()).isInstanceOf(BinaryOpNode.class);
        assertThat(((BinaryOpNode) add.right()).operator()).isEqualTo(Operator.MULTIPLY);
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
        "1 - 2 - 3        | ((1.0 - 2.0) - 3.0)",
        "8 / 4 / 2        | ((8.0 / 4.0) / 2.0)",
        "-V * 2           | ((-V) * 2.0)",
        "-(V + 55) / 10   | ((-(V + 55.0)) / 10.0)",
        "(1 + 2) * 3      | ((1.0 + 2.0) * 3.0)",
        "+V               | V",
        "exp(-V / 50)     | exp(((-V) / 50.0))",
        "0.1 * exp(V/25)  | (0.1 * exp((V / 25.0)))"
    })
    void parse_buildsLeftAssociativeTreeWithUnaryPrecedence(String equation, String expected) throws Exception {
        assertThat(render(parse(equation))).isEqualTo(expected);
    }

    @Test
    void parse_rejectsUndefinedSymbolWithOffset() {
        assertThatThrownBy(() -> parse("0.1 * exp(Vm / 25)"))
                .isInstanceOfSatisfying(UndefinedSymbolException.class, e -> {
                    assertThat(e.getSymbol()).isEqualTo("Vm");
                    assertThat(e.getOffset()).isEqualTo(10);
                    assertThat(e.getEquation()).isEqualTo("0.1 * exp(Vm / 25)");
                })
                .hasMessageContaining("Undefined symbol 'Vm'");
    }

    @Test
    void parse_rejectsFunctionsOtherThanExp() {
        assertThatThrownBy(() -> parse("log(V)"))
                .isInstanceOf(UndefinedSymbolException.class)
                .hasMessageContaining("'log'");
    }

    @Test
    void parse_rejectsEmptyEquation() {
        assertThatThrownBy(() -> parse("   "))
                .isInstanceOfSatisfying(RateEquationParseException.class,
                        e -> assertThat(e.getOffset()).isZero())
                .hasMessageContaining("Empty equation");
    }

    @Test
    void parse_rejectsUnclosedParenthesis() {
        assertThatThrownBy(() -> parse("(V + 1"))
                .isInstanceOfSatisfying(RateEquationParseException.class,
                        e -> assertThat(e.getOffset()).isEqualTo(6))
                .hasMessageContaining("Expected ')'");
    }

    @Test
    void parse_rejectsExpWithoutArgumentList() {
        assertThatThrownBy(() -> parse("exp V"))
                .isInstanceOf(RateEquationParseException.class)
                .hasMessageContaining("Expected '(' after 'exp'");
    }

    @Test
    void parse_rejectsTrailingTokens() {
        assertThatThrownBy(() -> parse("V 2"))
                .isInstanceOfSatisfying(RateEquationParseException.class,
                        e -> assertThat(e.getOffset()).isEqualTo(2))
                .hasMessageContaining("after end of expression");
    }

    @Test
    void parse_rejectsDanglingOperator() {
        assertThatThrownBy(() -> parse("V *"))
                .isInstanceOf(RateEquationParseException.class)
                .hasMessageContaining("Unexpected end of equation");
    }
}
