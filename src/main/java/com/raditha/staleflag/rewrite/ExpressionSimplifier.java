package com.raditha.staleflag.rewrite;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.expr.BooleanLiteralExpr;
import com.github.javaparser.ast.expr.ConditionalExpr;
import com.github.javaparser.ast.expr.EnclosedExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.FieldAccessExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.StringLiteralExpr;
import com.github.javaparser.ast.expr.UnaryExpr;
import com.github.javaparser.ast.stmt.ExpressionStmt;
import com.raditha.staleflag.model.ErrorKind;
import com.raditha.staleflag.model.FlagCleanupException;
import com.raditha.staleflag.model.Range;
import com.raditha.staleflag.model.Treatment;
import com.raditha.staleflag.model.TreatmentKind;
import com.raditha.staleflag.util.ASTUtility;

import java.util.List;
import java.util.Optional;

/**
 * Folds boolean expressions that contain literals.
 * <p>
 * The rules are deliberately few:
 * <ul>
 * <li>{@code true || X} is {@code true}, {@code false || X} and {@code X || false} are {@code X}</li>
 * <li>{@code true && X} and {@code X && true} are {@code X}, {@code false && X} is {@code false}</li>
 * <li>{@code !true}, {@code !false} and parenthesised literals</li>
 * <li>a conditional expression with a literal condition is its taken branch</li>
 * <li>{@code ==}, {@code !=}, {@code equals} and {@code Objects.equals} between two literals</li>
 * </ul>
 * {@code X || true} is not folded because X may have side effects.
 * <p>
 * Enum constants count as literals only for the enum type of the treatment.
 * Subtrees that are moved up keep their node identity, so call sites further
 * along in the same expression stay attached.
 */
public class ExpressionSimplifier {

    private final Treatment treatment;
    private final int maxIterations;

    public ExpressionSimplifier(Treatment treatment, int maxIterations) {
        this.treatment = treatment;
        this.maxIterations = maxIterations;
    }

    /**
     * A compile time value this simplifier understands.
     *
     * @param kind  boolean, string or enum
     * @param value {@code true}/{@code false}, the escaped string content, or the
     *              enum constant's simple name
     */
    public record ConstantValue(TreatmentKind kind, String value) {
        public boolean isBoolean() {
            return kind == TreatmentKind.BOOLEAN;
        }

        public boolean isTrue() {
            return isBoolean() && value.equals("true");
        }
    }

    public Optional<ConstantValue> constantValue(Expression expression) {
        Expression expr = expression;
        while (expr instanceof EnclosedExpr enclosed) {
            expr = enclosed.getInner();
        }
        if (expr instanceof BooleanLiteralExpr bool) {
            return Optional.of(new ConstantValue(TreatmentKind.BOOLEAN, Boolean.toString(bool.getValue())));
        }
        if (expr instanceof StringLiteralExpr string) {
            return Optional.of(new ConstantValue(TreatmentKind.STRING, string.getValue()));
        }
        if (expr instanceof FieldAccessExpr access && isTreatmentEnumType(access.getScope())) {
            return Optional.of(new ConstantValue(TreatmentKind.ENUM, access.getNameAsString()));
        }
        return Optional.empty();
    }

    public boolean isConstant(Expression expression) {
        return constantValue(expression).isPresent();
    }

    private boolean isTreatmentEnumType(Expression scope) {
        if (treatment.kind() != TreatmentKind.ENUM) {
            return false;
        }
        String typeName = treatment.enumTypeName();
        String text = scope.toString();
        if (text.equals(typeName)) {
            return true;
        }
        String simpleName = typeName.substring(typeName.lastIndexOf('.') + 1);
        return text.equals(simpleName) || typeName.endsWith("." + text);
    }

    /**
     * Whether a switch label selects the given constant selector value.
     */
    public boolean matchesLabel(ConstantValue selector, Expression label) {
        if (selector.kind() == TreatmentKind.STRING) {
            return label instanceof StringLiteralExpr string && string.getValue().equals(selector.value());
        }
        if (selector.kind() == TreatmentKind.ENUM) {
            if (label instanceof NameExpr name) {
                return name.getNameAsString().equals(selector.value());
            }
            return label instanceof FieldAccessExpr access && access.getNameAsString().equals(selector.value());
        }
        return false;
    }

    /**
     * {@code a.equals(b)} or {@code Objects.equals(a, b)}.
     */
    public boolean isEqualityCall(MethodCallExpr call) {
        if (!call.getNameAsString().equals("equals")) {
            return false;
        }
        if (call.getArguments().size() == 1) {
            return call.getScope().isPresent();
        }
        return call.getArguments().size() == 2 && call.getScope()
                .map(Expression::toString)
                .filter(s -> s.equals("Objects") || s.equals("java.util.Objects"))
                .isPresent();
    }

    /**
     * Simplify from a freshly substituted node towards the root of its expression,
     * revisiting each ancestor that a reduction exposes.
     *
     * @return the outermost expression that was reached; its parent is not an expression
     */
    public Expression simplifyUpward(Expression start) {
        Expression current = start;
        int iterations = 0;
        while (true) {
            if (++iterations > maxIterations) {
                throw new FlagCleanupException(ErrorKind.FIXED_POINT_ITERATION_EXCEEDED,
                        "Simplification did not settle after " + maxIterations + " steps", Range.of(current));
            }
            Optional<Expression> reduced = reduce(current);
            if (reduced.isPresent()) {
                ASTUtility.replaceExpression(current, reduced.get());
                current = reduced.get();
                continue;
            }
            Node parent = current.getParentNode().orElse(null);
            if (!(parent instanceof Expression parentExpression)) {
                return current;
            }
            current = parentExpression;
        }
    }

    /**
     * Simplify a whole expression tree, innermost nodes first, until nothing
     * changes.
     *
     * @return the simplified expression, which may be a different node
     */
    public Expression simplify(Expression expression) {
        ExpressionStmt holder = null;
        if (expression.getParentNode().isEmpty()) {
            holder = new ExpressionStmt(expression);
        }
        Expression root = expression;
        boolean changed = true;
        int iterations = 0;
        while (changed) {
            changed = false;
            List<Expression> nodes = root.findAll(Expression.class);
            for (int i = nodes.size() - 1; i >= 0; i--) {
                Expression node = nodes.get(i);
                if (node != root && !isDescendant(node, root)) {
                    continue;
                }
                Optional<Expression> reduced = reduce(node);
                if (reduced.isPresent()) {
                    if (++iterations > maxIterations) {
                        throw new FlagCleanupException(ErrorKind.FIXED_POINT_ITERATION_EXCEEDED,
                                "Simplification did not settle after " + maxIterations + " steps", Range.of(node));
                    }
                    ASTUtility.replaceExpression(node, reduced.get());
                    if (node == root) {
                        root = reduced.get();
                    }
                    changed = true;
                }
            }
        }
        if (holder != null) {
            root.setParentNode(null);
        }
        return root;
    }

    private static boolean isDescendant(Node node, Node ancestor) {
        for (Node n = node.getParentNode().orElse(null); n != null; n = n.getParentNode().orElse(null)) {
            if (n == ancestor) {
                return true;
            }
        }
        return false;
    }

    /**
     * One reduction step at this node, assuming its children are already reduced.
     */
    public Optional<Expression> reduce(Expression expr) {
        if (expr instanceof EnclosedExpr enclosed) {
            Expression inner = enclosed.getInner();
            return isConstant(inner) ? Optional.of(inner) : Optional.empty();
        }
        if (expr instanceof UnaryExpr unary && unary.getOperator() == UnaryExpr.Operator.LOGICAL_COMPLEMENT) {
            return booleanValue(unary.getExpression()).map(v -> new BooleanLiteralExpr(!v));
        }
        if (expr instanceof BinaryExpr binary) {
            return reduceBinary(binary);
        }
        if (expr instanceof ConditionalExpr conditional) {
            return booleanValue(conditional.getCondition())
                    .map(v -> v ? conditional.getThenExpr() : conditional.getElseExpr());
        }
        if (expr instanceof MethodCallExpr call && isEqualityCall(call)) {
            return reduceEqualityCall(call);
        }
        return Optional.empty();
    }

    private Optional<Expression> reduceBinary(BinaryExpr binary) {
        Optional<Boolean> left = booleanValue(binary.getLeft());
        Optional<Boolean> right = booleanValue(binary.getRight());
        switch (binary.getOperator()) {
            case OR:
                if (left.isPresent()) {
                    return Optional.of(left.get() ? new BooleanLiteralExpr(true) : binary.getRight());
                }
                if (right.isPresent() && !right.get()) {
                    return Optional.of(binary.getLeft());
                }
                return Optional.empty();
            case AND:
                if (left.isPresent()) {
                    return Optional.of(left.get() ? binary.getRight() : new BooleanLiteralExpr(false));
                }
                if (right.isPresent() && right.get()) {
                    return Optional.of(binary.getLeft());
                }
                return Optional.empty();
            case EQUALS:
                return compare(binary.getLeft(), binary.getRight()).map(BooleanLiteralExpr::new);
            case NOT_EQUALS:
                return compare(binary.getLeft(), binary.getRight()).map(eq -> new BooleanLiteralExpr(!eq));
            default:
                return Optional.empty();
        }
    }

    private Optional<Expression> reduceEqualityCall(MethodCallExpr call) {
        Optional<Boolean> equal = call.getArguments().size() == 1
                ? compare(call.getScope().orElseThrow(), call.getArgument(0))
                : compare(call.getArgument(0), call.getArgument(1));
        return equal.map(BooleanLiteralExpr::new);
    }

    private Optional<Boolean> compare(Expression left, Expression right) {
        Optional<ConstantValue> a = constantValue(left);
        Optional<ConstantValue> b = constantValue(right);
        if (a.isEmpty() || b.isEmpty() || a.get().kind() != b.get().kind()) {
            return Optional.empty();
        }
        return Optional.of(a.get().value().equals(b.get().value()));
    }

    private Optional<Boolean> booleanValue(Expression expression) {
        return constantValue(expression)
                .filter(ConstantValue::isBoolean)
                .map(ConstantValue::isTrue);
    }
}
