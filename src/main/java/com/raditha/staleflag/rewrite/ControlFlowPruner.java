package com.raditha.staleflag.rewrite;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.VariableDeclarationExpr;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.BreakStmt;
import com.github.javaparser.ast.stmt.DoStmt;
import com.github.javaparser.ast.stmt.ExpressionStmt;
import com.github.javaparser.ast.stmt.ForEachStmt;
import com.github.javaparser.ast.stmt.ForStmt;
import com.github.javaparser.ast.stmt.IfStmt;
import com.github.javaparser.ast.stmt.LocalClassDeclarationStmt;
import com.github.javaparser.ast.stmt.LocalRecordDeclarationStmt;
import com.github.javaparser.ast.stmt.Statement;
import com.github.javaparser.ast.stmt.SwitchEntry;
import com.github.javaparser.ast.stmt.SwitchStmt;
import com.github.javaparser.ast.stmt.WhileStmt;
import com.raditha.staleflag.model.CleanupError;
import com.raditha.staleflag.model.ErrorKind;
import com.raditha.staleflag.model.Range;
import com.raditha.staleflag.rewrite.ExpressionSimplifier.ConstantValue;
import com.raditha.staleflag.util.ASTUtility;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.Set;

/**
 * Collapses statements whose guard has become a literal.
 * <p>
 * Works from a queue of statements the rewriter touched, deepest first. Pruning
 * a statement queues the statement that encloses it, so an outer {@code if}
 * is looked at again once everything inside it has settled.
 */
public class ControlFlowPruner {

    private static final Logger logger = LoggerFactory.getLogger(ControlFlowPruner.class);

    private final ExpressionSimplifier simplifier;
    private final int maxIterations;

    public ControlFlowPruner(ExpressionSimplifier simplifier, int maxIterations) {
        this.simplifier = simplifier;
        this.maxIterations = maxIterations;
    }

    public record PruneOutcome(int pruned, List<CleanupError> unsupported) {
    }

    private record Pending(Statement statement, int depth) {
    }

    public PruneOutcome prune(CompilationUnit cu, Collection<? extends Statement> touched) {
        PriorityQueue<Pending> queue = new PriorityQueue<>(
                Comparator.comparingInt(Pending::depth).reversed());
        Set<Statement> queued = Collections.newSetFromMap(new IdentityHashMap<>());
        List<CleanupError> unsupported = new ArrayList<>();
        for (Statement statement : touched) {
            enqueue(statement, queue, queued);
        }

        int pruned = 0;
        int iterations = 0;
        while (!queue.isEmpty()) {
            if (++iterations > maxIterations) {
                Statement remaining = queue.peek().statement();
                unsupported.add(new CleanupError(ErrorKind.FIXED_POINT_ITERATION_EXCEEDED,
                        "Pruning did not settle after " + maxIterations + " steps", Range.of(remaining)));
                break;
            }
            Statement statement = queue.poll().statement();
            queued.remove(statement);
            if (!ASTUtility.isAttached(statement, cu)) {
                continue;
            }
            Node container = pruneStatement(statement);
            if (container != null) {
                pruned++;
                enclosingStatement(container).ifPresent(s -> enqueue(s, queue, queued));
            }
        }
        return new PruneOutcome(pruned, unsupported);
    }

    private static void enqueue(Statement statement, PriorityQueue<Pending> queue, Set<Statement> queued) {
        if (queued.add(statement)) {
            queue.add(new Pending(statement, ASTUtility.depth(statement)));
        }
    }

    /**
     * The nearest statement that encloses the node and is not a plain block.
     */
    private static Optional<Statement> enclosingStatement(Node node) {
        for (Node n = node; n != null; n = n.getParentNode().orElse(null)) {
            if (n instanceof Statement statement && !(n instanceof BlockStmt)) {
                return Optional.of(statement);
            }
            if (n instanceof BlockStmt && n.getParentNode().filter(p -> !(p instanceof Statement)).isPresent()) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    /**
     * Prune one statement.
     *
     * @return the node that now holds what replaced the statement, or null when nothing changed
     */
    private Node pruneStatement(Statement statement) {
        if (statement instanceof IfStmt ifStmt) {
            return pruneIf(ifStmt);
        }
        if (statement instanceof WhileStmt whileStmt && isFalse(whileStmt.getCondition())) {
            logger.debug("Removing while (false)");
            return ASTUtility.removeStatement(whileStmt);
        }
        if (statement instanceof ForStmt forStmt && forStmt.getInitialization().isEmpty()
                && forStmt.getCompare().filter(this::isFalse).isPresent()) {
            logger.debug("Removing for loop with a false condition");
            return ASTUtility.removeStatement(forStmt);
        }
        if (statement instanceof SwitchStmt switchStmt) {
            return pruneSwitch(switchStmt);
        }
        return null;
    }

    private Node pruneIf(IfStmt ifStmt) {
        Optional<ConstantValue> guard = simplifier.constantValue(ifStmt.getCondition())
                .filter(ConstantValue::isBoolean);
        if (guard.isEmpty()) {
            return pruneEmptyBranches(ifStmt);
        }
        Statement taken = guard.get().isTrue() ? ifStmt.getThenStmt() : ifStmt.getElseStmt().orElse(null);
        logger.debug("Collapsing if ({}) at {}", guard.get().value(), Range.of(ifStmt));
        if (taken == null) {
            return ASTUtility.removeStatement(ifStmt);
        }
        return replaceWithBranch(ifStmt, taken);
    }

    /**
     * An empty else is dropped; an if with nothing left in it and a pure guard is removed.
     */
    private Node pruneEmptyBranches(IfStmt ifStmt) {
        Optional<Statement> elseStmt = ifStmt.getElseStmt();
        if (elseStmt.isPresent() && isEmpty(elseStmt.get())) {
            ifStmt.removeElseStmt();
            return ifStmt;
        }
        if (elseStmt.isEmpty() && isEmpty(ifStmt.getThenStmt())
                && ASTUtility.isSideEffectFree(ifStmt.getCondition())) {
            return ASTUtility.removeStatement(ifStmt);
        }
        return null;
    }

    private static boolean isEmpty(Statement statement) {
        return statement.isEmptyStmt() || statement instanceof BlockStmt block && block.getStatements().isEmpty();
    }

    private boolean isFalse(Expression expression) {
        return simplifier.constantValue(expression)
                .filter(ConstantValue::isBoolean)
                .filter(v -> !v.isTrue())
                .isPresent();
    }

    /**
     * Put the taken branch where the statement was.
     */
    private Node replaceWithBranch(Statement statement, Statement taken) {
        NodeList<Statement> siblings = ASTUtility.containingStatements(statement);
        if (siblings != null) {
            List<Statement> body = taken instanceof BlockStmt block
                    ? new ArrayList<>(block.getStatements())
                    : List.of(taken);
            return splice(statement, body, siblings);
        }
        Node parent = statement.getParentNode().orElseThrow();
        if (taken instanceof IfStmt inner && inner.getElseStmt().isEmpty()
                && parent instanceof IfStmt outer && outer.getThenStmt() == statement
                && outer.getElseStmt().isPresent()) {
            // keep the outer else attached to the outer if
            statement.replace(new BlockStmt(new NodeList<>(taken)));
            return parent;
        }
        if (isEmpty(taken) && parent instanceof IfStmt outer && outer.getElseStmt().orElse(null) == statement) {
            outer.removeElseStmt();
            return parent;
        }
        return ASTUtility.spliceStatements(statement, List.of(taken));
    }

    /**
     * Splice statements into the block the target sits in. When they declare a name
     * that is also declared around them, or that a later statement reads, they stay
     * wrapped in a block.
     */
    private Node splice(Statement target, List<Statement> body, NodeList<Statement> siblings) {
        Set<String> inner = topLevelDeclarations(body);
        Set<String> outer = new HashSet<>();
        boolean after = false;
        for (Statement sibling : siblings) {
            if (sibling == target) {
                after = true;
                continue;
            }
            outer.addAll(ASTUtility.declaredNames(sibling));
            if (after) {
                sibling.findAll(NameExpr.class).forEach(name -> outer.add(name.getNameAsString()));
            }
        }
        inner.retainAll(outer);
        if (!inner.isEmpty()) {
            logger.debug("Keeping block for {} to avoid a clash on {}", Range.of(target), inner);
            return ASTUtility.spliceStatements(target, List.of(new BlockStmt(new NodeList<>(body))));
        }
        int index = ASTUtility.indexOf(siblings, target);
        Node container = ASTUtility.spliceStatements(target, body);
        dropUnreachable(siblings, index, body.size());
        return container;
    }

    private static Set<String> topLevelDeclarations(List<Statement> statements) {
        Set<String> names = new HashSet<>();
        for (Statement statement : statements) {
            if (statement instanceof ExpressionStmt expressionStmt
                    && expressionStmt.getExpression() instanceof VariableDeclarationExpr declaration) {
                declaration.getVariables().forEach(v -> names.add(v.getNameAsString()));
            } else if (statement instanceof LocalClassDeclarationStmt local) {
                names.add(local.getClassDeclaration().getNameAsString());
            } else if (statement instanceof LocalRecordDeclarationStmt local) {
                names.add(local.getRecordDeclaration().getNameAsString());
            }
        }
        return names;
    }

    /**
     * Remove what follows a spliced terminator in the same list.
     */
    private static void dropUnreachable(NodeList<Statement> siblings, int from, int count) {
        for (int i = from; i < from + count && i < siblings.size(); i++) {
            if (ASTUtility.isTerminator(siblings.get(i))) {
                while (siblings.size() > i + 1) {
                    logger.debug("Dropping unreachable {}", siblings.get(i + 1));
                    siblings.remove(i + 1);
                }
                return;
            }
        }
    }

    private Node pruneSwitch(SwitchStmt switchStmt) {
        Optional<ConstantValue> selector = simplifier.constantValue(switchStmt.getSelector())
                .filter(v -> !v.isBoolean());
        if (selector.isEmpty()) {
            return null;
        }
        SwitchEntry chosen = null;
        SwitchEntry fallback = null;
        for (SwitchEntry entry : switchStmt.getEntries()) {
            if (entry.getLabels().isEmpty()) {
                fallback = entry;
            } else if (entry.getLabels().stream().anyMatch(label -> simplifier.matchesLabel(selector.get(), label))) {
                chosen = entry;
            }
        }
        if (chosen == null) {
            chosen = fallback;
        }
        if (chosen == null) {
            logger.debug("Removing switch with no matching case at {}", Range.of(switchStmt));
            return ASTUtility.removeStatement(switchStmt);
        }

        List<Statement> body = caseBody(chosen);
        if (body == null) {
            return null;
        }
        logger.debug("Collapsing switch on {} at {}", selector.get().value(), Range.of(switchStmt));
        if (body.isEmpty()) {
            return ASTUtility.removeStatement(switchStmt);
        }
        NodeList<Statement> siblings = ASTUtility.containingStatements(switchStmt);
        if (siblings != null) {
            return splice(switchStmt, body, siblings);
        }
        return ASTUtility.spliceStatements(switchStmt, List.of(new BlockStmt(new NodeList<>(body))));
    }

    /**
     * Statements of a case group without its closing break, or null when the group
     * falls through or breaks out of the switch anywhere but at the end.
     */
    private static List<Statement> caseBody(SwitchEntry entry) {
        List<Statement> statements = new ArrayList<>(entry.getStatements());
        boolean arrow = entry.getType() != SwitchEntry.Type.STATEMENT_GROUP;
        if (arrow && statements.size() == 1 && statements.get(0) instanceof BlockStmt block) {
            statements = new ArrayList<>(block.getStatements());
        }
        if (!arrow) {
            if (statements.isEmpty() || !ASTUtility.isTerminator(statements.get(statements.size() - 1))) {
                return null;
            }
        }
        if (!statements.isEmpty() && isSwitchBreak(statements.get(statements.size() - 1))) {
            statements.remove(statements.size() - 1);
        }
        for (Statement statement : statements) {
            if (statement.findAll(BreakStmt.class).stream().anyMatch(b -> breaksOutOf(b, entry))) {
                return null;
            }
        }
        return statements;
    }

    private static boolean isSwitchBreak(Statement statement) {
        return statement instanceof BreakStmt breakStmt && breakStmt.getLabel().isEmpty();
    }

    /**
     * Whether a break inside the case group leaves the switch being collapsed
     * rather than an inner loop or switch. Labeled breaks always count.
     */
    private static boolean breaksOutOf(BreakStmt breakStmt, SwitchEntry entry) {
        if (breakStmt.getLabel().isPresent()) {
            return true;
        }
        for (Node n = breakStmt.getParentNode().orElse(null); n != null && n != entry; n = n.getParentNode().orElse(null)) {
            if (n instanceof WhileStmt || n instanceof DoStmt || n instanceof ForStmt
                    || n instanceof ForEachStmt || n instanceof SwitchStmt) {
                return false;
            }
        }
        return true;
    }
}
