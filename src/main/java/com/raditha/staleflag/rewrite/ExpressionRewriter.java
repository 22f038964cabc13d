package com.raditha.staleflag.rewrite;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.BooleanLiteralExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.FieldAccessExpr;
import com.github.javaparser.ast.expr.LambdaExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.nodeTypes.NodeWithArguments;
import com.github.javaparser.ast.stmt.ExpressionStmt;
import com.github.javaparser.ast.stmt.Statement;
import com.raditha.staleflag.analysis.BindingResolver;
import com.raditha.staleflag.model.Binding;
import com.raditha.staleflag.model.CleanupError;
import com.raditha.staleflag.model.ErrorKind;
import com.raditha.staleflag.model.FlagCleanupException;
import com.raditha.staleflag.model.MatchSite;
import com.raditha.staleflag.model.Range;
import com.raditha.staleflag.model.Treatment;
import com.raditha.staleflag.util.ASTUtility;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * Replaces flag queries with the treatment literal and folds what encloses them.
 * <p>
 * A variable initialised by a flag query becomes a result binding: once its
 * initializer folds to a literal and it is never reassigned, its references are
 * replaced by that literal as well.
 * <p>
 * A flag value handed to an opaque method or constructor is left alone, whether
 * the query itself is the argument or a result binding is. Both are reported as
 * unsupported. Equality calls such as {@code "B".equals(...)} are not opaque.
 */
public class ExpressionRewriter {

    private static final Logger logger = LoggerFactory.getLogger(ExpressionRewriter.class);

    private final BindingResolver bindings;
    private final ExpressionSimplifier simplifier;
    private final Treatment treatment;
    private final int maxHops;

    public ExpressionRewriter(BindingResolver bindings, ExpressionSimplifier simplifier, Treatment treatment,
            int maxHops) {
        this.bindings = bindings;
        this.simplifier = simplifier;
        this.treatment = treatment;
        this.maxHops = maxHops;
    }

    /**
     * What a rewrite pass changed in one unit.
     *
     * @param touched    statements whose expressions changed; the pruner starts from these
     * @param candidates declarators that may have lost their last reference
     * @param unsupported sites left as they were
     * @param rewritten  number of sites rewritten
     */
    public record RewriteOutcome(
            Set<Statement> touched,
            Set<VariableDeclarator> candidates,
            List<CleanupError> unsupported,
            int rewritten) {
    }

    @SuppressWarnings("unchecked")
    public RewriteOutcome rewrite(CompilationUnit cu, List<MatchSite> sites) {
        Set<Statement> touched = Collections.newSetFromMap(new IdentityHashMap<>());
        Set<VariableDeclarator> candidates = Collections.newSetFromMap(new IdentityHashMap<>());
        List<CleanupError> unsupported = new ArrayList<>();
        int rewritten = 0;
        Set<String> ownTypes = new HashSet<>();
        for (TypeDeclaration<?> type : cu.findAll(TypeDeclaration.class)) {
            type.getFullyQualifiedName().ifPresent(ownTypes::add);
        }

        for (MatchSite site : sites) {
            if (!ASTUtility.isAttached(site.call(), cu)) {
                logger.debug("Site {} no longer attached", site);
                continue;
            }
            try {
                rewriteSite(site, touched, candidates, unsupported);
                rewritten++;
                for (Binding binding : site.chain()) {
                    if (binding.declaration() instanceof VariableDeclarator declarator
                            && isDeclaredIn(binding, ownTypes)) {
                        candidates.add(declarator);
                    }
                }
            } catch (FlagCleanupException e) {
                if (e.getKind().skipsUnit()) {
                    throw e;
                }
                logger.debug("Leaving {} as is: {}", site, e.getMessage());
                unsupported.add(CleanupError.from(e));
            }
        }
        return new RewriteOutcome(touched, candidates, unsupported, rewritten);
    }

    /**
     * Locals and anonymous class fields always belong to the unit being rewritten;
     * fields of named types only when that type is declared here.
     */
    private static boolean isDeclaredIn(Binding binding, Set<String> ownTypes) {
        return switch (binding.kind()) {
            case LOCAL -> true;
            case FIELD -> binding.ownerType() == null || ownTypes.contains(binding.ownerType());
            default -> false;
        };
    }

    private void rewriteSite(MatchSite site, Set<Statement> touched, Set<VariableDeclarator> candidates,
            List<CleanupError> unsupported) {
        MethodCallExpr call = site.call();
        Node parent = call.getParentNode().orElseThrow();

        if (parent instanceof ExpressionStmt statement && !isLambdaBody(statement)) {
            logger.debug("Removing bare flag query {}", call);
            ASTUtility.removeStatement(statement);
            return;
        }
        if (isOpaqueArgument(call)) {
            throw new FlagCleanupException(ErrorKind.UNSUPPORTED_EXPRESSION,
                    "Flag value passed into " + parent, site.range());
        }

        Expression literal = treatment.toExpression();
        logger.debug("Replacing {} with {}", call, literal);
        ASTUtility.replaceExpression(call, literal);
        Expression top = simplifier.simplifyUpward(literal);
        touch(top, touched);
        if (initializes(top) instanceof VariableDeclarator declarator) {
            inlineResultBinding(declarator, touched, candidates, unsupported, 0);
        }
    }

    /**
     * An expression-bodied lambda keeps its body as an expression statement.
     */
    private static boolean isLambdaBody(ExpressionStmt statement) {
        return statement.getParentNode().filter(LambdaExpr.class::isInstance).isPresent();
    }

    private boolean isOpaqueArgument(Expression expression) {
        Node parent = expression.getParentNode().orElse(null);
        return parent instanceof NodeWithArguments<?> withArguments
                && ASTUtility.indexOf(withArguments.getArguments(), expression) >= 0
                && !(parent instanceof MethodCallExpr method && simplifier.isEqualityCall(method));
    }

    /**
     * The declarator this expression initialises, or null.
     */
    private Node initializes(Expression top) {
        Node parent = top.getParentNode().orElse(null);
        if (parent instanceof VariableDeclarator declarator
                && declarator.getInitializer().orElse(null) == top
                && simplifier.isConstant(top)) {
            return declarator;
        }
        return null;
    }

    private void inlineResultBinding(VariableDeclarator declarator, Set<Statement> touched,
            Set<VariableDeclarator> candidates, List<CleanupError> unsupported, int depth) {
        if (depth >= maxHops) {
            throw new FlagCleanupException(ErrorKind.RESOLUTION_DEPTH_EXCEEDED,
                    "Result bindings nest deeper than " + maxHops, Range.of(declarator));
        }
        Binding binding = bindings.bindingOf(declarator);
        if (!canInline(binding)) {
            return;
        }
        Expression value = declarator.getInitializer().orElseThrow();
        for (Expression reference : bindings.findReferences(binding)) {
            if (reference.getParentNode().isEmpty() || !isInlinable(reference, value)) {
                continue;
            }
            if (isOpaqueArgument(reference)) {
                logger.debug("Leaving {} in {}", reference, reference.getParentNode().get());
                unsupported.add(new CleanupError(ErrorKind.UNSUPPORTED_EXPRESSION,
                        "Flag value passed into " + reference.getParentNode().get(), Range.of(reference)));
                continue;
            }
            Expression copy = value.clone();
            ASTUtility.replaceExpression(reference, copy);
            Expression top = simplifier.simplifyUpward(copy);
            touch(top, touched);
            if (initializes(top) instanceof VariableDeclarator next && next != declarator) {
                inlineResultBinding(next, touched, candidates, unsupported, depth + 1);
            }
        }
        candidates.add(declarator);
    }

    private boolean canInline(Binding binding) {
        return switch (binding.kind()) {
            case LOCAL, CONSTANT -> bindings.assignedValues(binding).isEmpty();
            case FIELD -> (bindings.isFinal(binding) || binding.privateMember())
                    && bindings.assignedValues(binding).isEmpty();
            default -> false;
        };
    }

    /**
     * Primitive literals cannot be the receiver of a call or field access.
     */
    private static boolean isInlinable(Expression reference, Expression value) {
        if (!(value instanceof BooleanLiteralExpr)) {
            return true;
        }
        Node parent = reference.getParentNode().orElseThrow();
        if (parent instanceof MethodCallExpr call && call.getScope().orElse(null) == reference) {
            return false;
        }
        return !(parent instanceof FieldAccessExpr access && access.getScope() == reference);
    }

    private static void touch(Expression top, Set<Statement> touched) {
        top.findAncestor(Statement.class).ifPresent(touched::add);
    }
}
