package org.channelsim.compiler.frontend.parser.ast;

import java.util.List;

/**
 * A call of the natural exponential function {@code exp(argument)}.
 *
 * @param argument The exponent.
 */
public record ExpCallNode(ExpressionNode argument) implements ExpressionNode {

    @Override
    public List<ExpressionNode> getChildren() {
        return List.of(argument);
    }
}
