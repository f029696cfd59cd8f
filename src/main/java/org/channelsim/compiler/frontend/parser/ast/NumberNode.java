package org.channelsim.compiler.frontend.parser.ast;

import java.util.List;

/**
 * A floating-point literal.
 *
 * @param value The literal value.
 */
public record NumberNode(double value) implements ExpressionNode {

    @Override
    public List<ExpressionNode> getChildren() {
        return List.of();
    }
}
