package org.channelsim.compiler.frontend.parser.ast;

import java.util.List;

/**
 * A reference to the membrane voltage {@code V}, the only free variable of a rate equation.
 */
public record VariableNode() implements ExpressionNode {

    @Override
    public List<ExpressionNode> getChildren() {
        return List.of();
    }
}
