package org.channelsim.compiler.frontend.parser.ast;

import java.util.List;

/**
 * A node of the abstract syntax tree of a rate equation.
 */
public sealed interface ExpressionNode permits NumberNode, VariableNode, NegateNode, BinaryOpNode, ExpCallNode {

    /**
     * Returns the direct children of this node in evaluation order.
     * @return The child nodes, empty for leaves.
     */
    List<ExpressionNode> getChildren();
}
