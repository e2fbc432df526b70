package io.fmengine.core.render;

import io.fmengine.core.model.Configuration;
import io.fmengine.core.model.ExpandedTree;
import java.util.Objects;

/**
 * Renders a configuration of the {@code LogicFormula} model as formula text.
 *
 * <p>Variables are numbered {@code x1, x2, ...} from left to right. A negation renders as
 * {@code !operand}, a binary connective as {@code (left op right)} with the model's operator
 * syntax, and an expression without connective as its right operand. Nested expressions are the
 * unrolled {@code Expr1} / {@code Expr2} instances.
 *
 * <p>Thread-safe and stateless.
 */
public final class LogicFormulaRenderer {

    private static final String SEP = "/";

    /**
     * Renders {@code configuration}, which must be a valid configuration of the expanded
     * {@code LogicFormula} model.
     *
     * @throws IllegalArgumentException if the configuration does not select a complete expression
     */
    public String render(ExpandedTree tree, Configuration configuration) {
        Objects.requireNonNull(tree, "tree must not be null");
        Objects.requireNonNull(configuration, "configuration must not be null");
        return new Rendering(tree, configuration).expression(tree.root().id());
    }

    private static final class Rendering {

        private final ExpandedTree tree;
        private final Configuration configuration;
        private int variables;

        Rendering(ExpandedTree tree, Configuration configuration) {
            this.tree = tree;
            this.configuration = configuration;
        }

        String expression(String expr) {
            String left = null;
            if (selected(expr, "Operands/LExpr")) {
                left = operand(expr, "Operands/LExpr/Expr1", "Operands/LExpr/Var1");
            }
            String right = operand(expr, "Operands/RExpr/Expr2", "Operands/RExpr/Var2");

            if (!selected(expr, "Connectives")) {
                return right;
            }
            if (selected(expr, "Connectives/Not")) {
                return "!" + right;
            }
            String op = binaryOperator(expr);
            if (left == null) {
                throw new IllegalArgumentException("Binary connective at '" + expr + "' has no left operand");
            }
            return "(" + left + " " + op + " " + right + ")";
        }

        private String operand(String expr, String nested, String variable) {
            if (selected(expr, nested)) {
                return expression(expr + SEP + nested);
            }
            if (selected(expr, variable)) {
                return "x" + (++variables);
            }
            throw new IllegalArgumentException(
                    "Neither '" + expr + SEP + nested + "' nor '" + expr + SEP + variable + "' is selected");
        }

        private String binaryOperator(String expr) {
            if (selected(expr, "Connectives/BinaryOp/Or")) return "|";
            if (selected(expr, "Connectives/BinaryOp/And")) return "&";
            if (selected(expr, "Connectives/BinaryOp/Implies")) return "=>";
            if (selected(expr, "Connectives/BinaryOp/BiImplication")) return "<=>";
            throw new IllegalArgumentException("No connective selected under '" + expr + SEP + "Connectives'");
        }

        private boolean selected(String expr, String relative) {
            String id = expr + SEP + relative;
            tree.require(id);
            return configuration.isSelected(id);
        }
    }
}
