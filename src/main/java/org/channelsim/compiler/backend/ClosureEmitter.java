package org.channelsim.compiler.backend;

import org.channelsim.compiler.api.RateFunction;
import org.channelsim.compiler.frontend.parser.ast.BinaryOpNode;
import org.channelsim.compiler.frontend.parser.ast.ExpCallNode;
import org.channelsim.compiler.frontend.parser.ast.ExpressionNode;
import org.channelsim.compiler.frontend.parser.ast.NegateNode;
import org.channelsim.compiler.frontend.parser.ast.NumberNode;
import org.channelsim.compiler.frontend.parser.ast.VariableNode;

/**
 * Folds an expression tree into a tree of lambdas, once.
 * <p>
 * Constant subtrees are evaluated at emission time so that, for example,
 * {@code 0.1 * exp(-65 / 80)} becomes a single literal. The resulting
 * {@link RateFunction} holds no reference to the AST.
 */
public final class ClosureEmitter {

    private ClosureEmitter() {
    }

    /**
     * Emits a callable for the given expression.
     * @param node The root of the expression tree.
     * @return A pure function of voltage.
     */
    public static RateFunction emit(ExpressionNode node) {
        if (isConstant(node)) {
            final double constant = evaluateConstant(node);
            return v -> constant;
        }
        if (node instanceof VariableNode) {
            return v -> v;
        }
        if (node instanceof NegateNode negate) {
            RateFunction operand = emit(negate.operand());
            return v -> -operand.rate(v);
        }
        if (node instanceof ExpCallNode call) {
            RateFunction argument = emit(call.argument());
            return v -> Math.exp(argument.rate(v));
        }
        if (node instanceof BinaryOpNode binary) {
            RateFunction left = emit(binary.left());
            RateFunction right = emit(binary.right());
            return switch (binary.operator()) {
                case ADD -> v -> left.rate(v) + right.rate(v);
                case SUBTRACT -> v -> left.rate(v) - right.rate(v);
                case MULTIPLY -> v -> left.rate(v) * right.rate(v);
                case DIVIDE -> v -> left.rate(v) / right.rate(v);
            };
        }
        throw new IllegalStateException("Unsupported expression node: " + node.getClass().getSimpleName());
    }

    /**
     * Returns true if the subtree does not reference the voltage variable.
     */
    static boolean isConstant(ExpressionNode node) {
        if (node instanceof VariableNode) {
            return false;
        }
        for (ExpressionNode child : node.getChildren()) {
            if (!isConstant(child)) {
                return false;
            }
        }
        return true;
    }

    private static double evaluateConstant(ExpressionNode node) {
        if (node instanceof NumberNode number) {
            return number.value();
        }
        if (node instanceof NegateNode negate) {
            return -evaluateConstant(negate.operand());
        }
        if (node instanceof ExpCallNode call) {
            return Math.exp(evaluateConstant(call.argument()));
        }
        if (node instanceof BinaryOpNode binary) {
            double left = evaluateConstant(binary.left());
            double right = evaluateConstant(binary.right());
            return switch (binary.operator()) {
                case ADD -> left + right;
                case SUBTRACT -> left - right;
                case MULTIPLY -> left * right;
                case DIVIDE -> left / right;
            };
        }
        throw new IllegalStateException("Not a constant expression: " + node.getClass().getSimpleName());
    }
}
