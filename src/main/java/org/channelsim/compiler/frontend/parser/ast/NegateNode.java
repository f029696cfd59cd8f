package org.channelsim.compiler.frontend.parser.ast;

import java.util.List;

/**
 * Unary minus.
 *
 * @param operand The negated expression.
 */
public record NegateNode(ExpressionNode operand) implements ExpressionNode {

    @Override
    public List<ExpressionNode> getChildren() {
        return List.of(operand);
    }
}
