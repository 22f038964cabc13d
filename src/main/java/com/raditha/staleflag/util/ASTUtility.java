package com.raditha.staleflag.util;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.expr.CastExpr;
import com.github.javaparser.ast.expr.ConditionalExpr;
import com.github.javaparser.ast.expr.EnclosedExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.FieldAccessExpr;
import com.github.javaparser.ast.expr.UnaryExpr;
import com.github.javaparser.ast.nodeTypes.NodeWithArguments;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.BreakStmt;
import com.github.javaparser.ast.stmt.ContinueStmt;
import com.github.javaparser.ast.stmt.IfStmt;
import com.github.javaparser.ast.stmt.ReturnStmt;
import com.github.javaparser.ast.stmt.Statement;
import com.github.javaparser.ast.stmt.SwitchEntry;
import com.github.javaparser.ast.stmt.ThrowStmt;
import com.github.javaparser.ast.stmt.YieldStmt;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Utility class for common AST operations.
 * <p>
 * JavaParser's {@code Node.equals} is structural, so list positions are always
 * looked up by identity here. Two identical {@code println("x");} statements in one
 * block must never be confused with each other.
 */
public class ASTUtility {

    private ASTUtility() {
        /* this is only a utility class */
    }

    /**
     * Position of a node in a list by identity, or -1.
     */
    public static int indexOf(List<? extends Node> nodes, Node node) {
        for (int i = 0; i < nodes.size(); i++) {
            if (nodes.get(i) == node) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Whether the node is still part of the given unit's tree.
     */
    public static boolean isAttached(Node node, CompilationUnit cu) {
        return node.findCompilationUnit().map(found -> found == cu).orElse(false);
    }

    public static int depth(Node node) {
        int depth = 0;
        Optional<Node> parent = node.getParentNode();
        while (parent.isPresent()) {
            depth++;
            parent = parent.get().getParentNode();
        }
        return depth;
    }

    /**
     * The statement list a statement sits in directly, or null when its parent is
     * not a block or switch entry.
     */
    public static NodeList<Statement> containingStatements(Statement statement) {
        Node parent = statement.getParentNode().orElse(null);
        if (parent instanceof BlockStmt block) {
            return block.getStatements();
        }
        if (parent instanceof SwitchEntry entry) {
            return entry.getStatements();
        }
        return null;
    }

    /**
     * Replace an expression, using positional replacement for argument lists.
     */
    public static void replaceExpression(Expression original, Expression replacement) {
        Node parent = original.getParentNode()
                .orElseThrow(() -> new IllegalStateException("Cannot replace a detached expression: " + original));
        if (parent instanceof NodeWithArguments<?> withArguments) {
            int index = indexOf(withArguments.getArguments(), original);
            if (index >= 0) {
                withArguments.setArgument(index, replacement);
                return;
            }
        }
        if (!original.replace(replacement)) {
            throw new IllegalStateException("Could not replace " + original + " in " + parent.getClass().getSimpleName());
        }
    }

    /**
     * Remove a statement from wherever it sits.
     *
     * @return the node that contained the statement
     */
    public static Node removeStatement(Statement statement) {
        Node parent = statement.getParentNode()
                .orElseThrow(() -> new IllegalStateException("Cannot remove a detached statement"));
        NodeList<Statement> siblings = containingStatements(statement);
        if (siblings != null) {
            siblings.remove(indexOf(siblings, statement));
        } else if (parent instanceof IfStmt ifStmt && ifStmt.getElseStmt().orElse(null) == statement) {
            ifStmt.removeElseStmt();
        } else {
            statement.replace(new BlockStmt());
        }
        return parent;
    }

    /**
     * Put the given statements where {@code target} was. In a block or switch entry
     * they are spliced in at the same position; elsewhere a single statement
     * replaces the target directly and several are wrapped in a block.
     *
     * @return the node that now contains the statements
     */
    public static Node spliceStatements(Statement target, List<Statement> replacement) {
        Node parent = target.getParentNode()
                .orElseThrow(() -> new IllegalStateException("Cannot splice into a detached statement"));
        NodeList<Statement> siblings = containingStatements(target);
        if (siblings != null) {
            int index = indexOf(siblings, target);
            siblings.remove(index);
            for (int i = 0; i < replacement.size(); i++) {
                siblings.add(index + i, replacement.get(i));
            }
        } else if (replacement.size() == 1) {
            target.replace(replacement.get(0));
        } else {
            target.replace(new BlockStmt(new NodeList<>(replacement)));
        }
        return parent;
    }

    public static boolean isTerminator(Statement statement) {
        return statement instanceof ReturnStmt
                || statement instanceof ThrowStmt
                || statement instanceof BreakStmt
                || statement instanceof ContinueStmt
                || statement instanceof YieldStmt;
    }

    /**
     * Conservative purity check: literals, names, field reads and operators over them.
     */
    public static boolean isSideEffectFree(Expression expr) {
        if (expr.isLiteralExpr() || expr.isNameExpr() || expr.isThisExpr() || expr.isClassExpr()) {
            return true;
        }
        if (expr instanceof FieldAccessExpr fieldAccess) {
            return isSideEffectFree(fieldAccess.getScope());
        }
        if (expr instanceof EnclosedExpr enclosed) {
            return isSideEffectFree(enclosed.getInner());
        }
        if (expr instanceof CastExpr cast) {
            return isSideEffectFree(cast.getExpression());
        }
        if (expr instanceof UnaryExpr unary) {
            return !isIncrementOrDecrement(unary.getOperator()) && isSideEffectFree(unary.getExpression());
        }
        if (expr instanceof BinaryExpr binary) {
            return isSideEffectFree(binary.getLeft()) && isSideEffectFree(binary.getRight());
        }
        if (expr instanceof ConditionalExpr conditional) {
            return isSideEffectFree(conditional.getCondition())
                    && isSideEffectFree(conditional.getThenExpr())
                    && isSideEffectFree(conditional.getElseExpr());
        }
        return false;
    }

    /**
     * {@code ++} and {@code --} in either position. {@link UnaryExpr.Operator#isPrefix()}
     * is true for every non-postfix operator, {@code !} included.
     */
    public static boolean isIncrementOrDecrement(UnaryExpr.Operator operator) {
        return operator == UnaryExpr.Operator.PREFIX_INCREMENT
                || operator == UnaryExpr.Operator.PREFIX_DECREMENT
                || operator.isPostfix();
    }

    /**
     * Names of all locals and parameters declared anywhere inside the node.
     */
    public static Set<String> declaredNames(Node node) {
        Set<String> names = new HashSet<>();
        node.findAll(VariableDeclarator.class).forEach(v -> names.add(v.getNameAsString()));
        node.findAll(Parameter.class).forEach(p -> names.add(p.getNameAsString()));
        return names;
    }
}
