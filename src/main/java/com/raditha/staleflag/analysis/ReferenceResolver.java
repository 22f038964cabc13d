package com.raditha.staleflag.analysis;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.StringLiteralExpr;
import com.raditha.staleflag.model.Binding;
import com.raditha.staleflag.model.BindingKind;
import com.raditha.staleflag.model.CleanupError;
import com.raditha.staleflag.model.ErrorKind;
import com.raditha.staleflag.model.FlagCleanupException;
import com.raditha.staleflag.model.FlagSpec;
import com.raditha.staleflag.model.MatchSite;
import com.raditha.staleflag.model.Range;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Finds the calls that query a given flag.
 * <p>
 * Every call matching the configured API shape has its flag argument followed
 * through constant and variable initializers until a literal is reached. The
 * call is a match only when that literal (or enum constant) is the flag's name.
 */
public class ReferenceResolver {

    private static final Logger logger = LoggerFactory.getLogger(ReferenceResolver.class);

    private final BindingResolver bindings;
    private final int maxHops;

    public ReferenceResolver(BindingResolver bindings, int maxHops) {
        this.bindings = bindings;
        this.maxHops = maxHops;
    }

    /**
     * Matched sites in source order, plus the sites that could not be resolved.
     */
    public record ResolutionResult(List<MatchSite> sites, List<CleanupError> unsupported) {
    }

    /**
     * What a binding chain ends in.
     */
    private record Terminal(TerminalKind kind, String value) {
        boolean names(String flagName) {
            return kind != TerminalKind.OTHER && value.equals(flagName);
        }
    }

    private enum TerminalKind {
        STRING,
        ENUM_CONSTANT,
        OTHER
    }

    /**
     * Scan a unit for sites querying the flag.
     *
     * @throws FlagCleanupException with {@link ErrorKind#AMBIGUOUS_BINDING} when the
     *                              flag argument of some call resolves to conflicting literals
     */
    public ResolutionResult resolve(CompilationUnit cu, FlagSpec spec) {
        List<MatchSite> sites = new ArrayList<>();
        List<CleanupError> unsupported = new ArrayList<>();

        for (MethodCallExpr call : cu.findAll(MethodCallExpr.class)) {
            if (!spec.api().matches(call)) {
                continue;
            }
            try {
                List<Binding> chain = new ArrayList<>();
                Optional<Terminal> terminal = terminal(spec.api().flagArgument(call), chain, 0, spec.flagName());
                if (terminal.isPresent() && terminal.get().names(spec.flagName())) {
                    sites.add(new MatchSite(call, chain, bindings.getScopeAnalyzer().scopeAt(call), Range.of(call)));
                }
            } catch (FlagCleanupException e) {
                if (e.getKind().skipsUnit()) {
                    throw e;
                }
                logger.debug("Leaving {} unresolved: {}", call, e.getMessage());
                unsupported.add(CleanupError.from(e));
            }
        }
        return new ResolutionResult(sites, unsupported);
    }

    private Optional<Terminal> terminal(Expression expression, List<Binding> chain, int depth, String flagName) {
        Expression expr = BindingResolver.unwrap(expression);
        if (expr instanceof StringLiteralExpr literal) {
            return Optional.of(new Terminal(TerminalKind.STRING, literal.getValue()));
        }
        if (expr.isLiteralExpr()) {
            return Optional.of(new Terminal(TerminalKind.OTHER, expr.toString()));
        }
        if (!expr.isNameExpr() && !expr.isFieldAccessExpr()) {
            return Optional.empty();
        }
        if (depth >= maxHops) {
            throw new FlagCleanupException(ErrorKind.RESOLUTION_DEPTH_EXCEEDED,
                    "Binding chain longer than " + maxHops + " hops at " + expr, Range.of(expr));
        }

        Optional<Binding> resolved = bindings.resolve(expr);
        if (resolved.isEmpty()) {
            return Optional.empty();
        }
        Binding binding = resolved.get();
        if (chain.contains(binding)) {
            throw new FlagCleanupException(ErrorKind.RESOLUTION_DEPTH_EXCEEDED,
                    "Cyclic binding chain through " + binding, Range.of(expr));
        }
        chain.add(binding);

        if (binding.kind() == BindingKind.ENUM_CONSTANT) {
            return Optional.of(new Terminal(TerminalKind.ENUM_CONSTANT, binding.name()));
        }
        if (binding.initializer() == null) {
            return Optional.empty();
        }

        Optional<Terminal> result = terminal(binding.initializer(), chain, depth + 1, flagName);
        for (Expression value : bindings.assignedValues(binding)) {
            Optional<Terminal> other = terminal(value, new ArrayList<>(chain), depth + 1, flagName);
            if (result.equals(other)) {
                continue;
            }
            if (result.isPresent() && other.isPresent()
                    && (result.get().names(flagName) || other.get().names(flagName))) {
                throw new FlagCleanupException(ErrorKind.AMBIGUOUS_BINDING,
                        binding.name() + " is bound to both " + result.get().value() + " and " + other.get().value(),
                        Range.of(value));
            }
            return Optional.empty();
        }
        return result;
    }
}
