package com.raditha.staleflag.rewrite;

import com.github.javaparser.StaticJavaParser;
import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.expr.BooleanLiteralExpr;
import com.github.javaparser.ast.expr.ConditionalExpr;
import com.github.javaparser.ast.expr.EnclosedExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.UnaryExpr;
import com.raditha.staleflag.model.Treatment;
import net.jqwik.api.Arbitraries;
import net.jqwik.api.Arbitrary;
import net.jqwik.api.Combinators;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.Provide;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Property based tests for ExpressionSimplifier over random boolean expressions
 * of literals and the side-effect free names a, b and c.
 */
class SimplificationPropertiesTest {

    private final ExpressionSimplifier simplifier = new ExpressionSimplifier(Treatment.ofBoolean(true), 10_000);

    /**
     * Simplifying never changes what an expression evaluates to.
     */
    @Property(tries = 200)
    void simplificationPreservesValue(@ForAll("expressions") String code) {
        Expression original = StaticJavaParser.parseExpression(code);
        Expression simplified = simplifier.simplify(StaticJavaParser.parseExpression(code));

        for (int bits = 0; bits < 8; bits++) {
            Map<String, Boolean> env = Map.of("a", (bits & 1) != 0, "b", (bits & 2) != 0, "c", (bits & 4) != 0);
            assertEquals(evaluate(original, env), evaluate(simplified, env),
                    () -> code + " became " + simplified + " under " + env);
        }
    }

    /**
     * No node of a simplified expression can be reduced any further.
     */
    @Property(tries = 200)
    void simplificationReachesFixedPoint(@ForAll("expressions") String code) {
        Expression simplified = simplifier.simplify(StaticJavaParser.parseExpression(code));

        for (Expression node : simplified.findAll(Expression.class)) {
            assertTrue(simplifier.reduce(node).isEmpty(), () -> node + " in " + simplified + " is still reducible");
        }
    }

    @Property(tries = 100)
    void simplificationIsIdempotent(@ForAll("expressions") String code) {
        String once = simplifier.simplify(StaticJavaParser.parseExpression(code)).toString();
        String twice = simplifier.simplify(StaticJavaParser.parseExpression(once)).toString();

        assertEquals(once, twice);
    }

    @Provide
    Arbitrary<String> expressions() {
        return expression(3);
    }

    private static Arbitrary<String> expression(int depth) {
        Arbitrary<String> leaf = Arbitraries.of("true", "false", "a", "b", "c");
        if (depth == 0) {
            return leaf;
        }
        Arbitrary<String> sub = expression(depth - 1);
        return Arbitraries.oneOf(
                leaf,
                sub.map(e -> "!(" + e + ")"),
                Combinators.combine(sub, sub).as((l, r) -> "(" + l + " && " + r + ")"),
                Combinators.combine(sub, sub).as((l, r) -> "(" + l + " || " + r + ")"),
                Combinators.combine(sub, sub, sub).as((c, t, e) -> "(" + c + " ? " + t + " : " + e + ")"));
    }

    private static boolean evaluate(Expression expression, Map<String, Boolean> env) {
        if (expression instanceof BooleanLiteralExpr literal) {
            return literal.getValue();
        }
        if (expression instanceof NameExpr name) {
            return env.get(name.getNameAsString());
        }
        if (expression instanceof EnclosedExpr enclosed) {
            return evaluate(enclosed.getInner(), env);
        }
        if (expression instanceof UnaryExpr unary) {
            return !evaluate(unary.getExpression(), env);
        }
        if (expression instanceof BinaryExpr binary) {
            boolean left = evaluate(binary.getLeft(), env);
            boolean right = evaluate(binary.getRight(), env);
            return binary.getOperator() == BinaryExpr.Operator.AND ? left && right : left || right;
        }
        if (expression instanceof ConditionalExpr conditional) {
            return evaluate(conditional.getCondition(), env)
                    ? evaluate(conditional.getThenExpr(), env)
                    : evaluate(conditional.getElseExpr(), env);
        }
        throw new IllegalArgumentException("Unexpected node " + expression);
    }
}
