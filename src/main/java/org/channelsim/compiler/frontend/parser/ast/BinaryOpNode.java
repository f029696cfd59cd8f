package org.channelsim.compiler.frontend.parser.ast;

import java.util.List;

/**
 * A binary arithmetic operation.
 *
 * @param left The left operand.
 * @param operator The operator.
 * @param right The right operand.
 */
public record BinaryOpNode(ExpressionNode left, Operator operator, ExpressionNode right) implements ExpressionNode {

    /**
     * The four arithmetic operators of the rate equation grammar.
     */
    public enum Operator {
        ADD("+"),
        SUBTRACT("-"),
        MULTIPLY("*"),
        DIVIDE("/");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }
    }

    @Override
    public List<ExpressionNode> getChildren() {
        return List.of(left, right);
    }
}
