package com.raditha.staleflag.engine;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.Problem;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.printer.lexicalpreservation.LexicalPreservingPrinter;
import com.raditha.staleflag.analysis.BindingResolver;
import com.raditha.staleflag.analysis.ProjectIndex;
import com.raditha.staleflag.analysis.ReferenceCounter;
import com.raditha.staleflag.analysis.ReferenceResolver;
import com.raditha.staleflag.config.CleanupConfig;
import com.raditha.staleflag.model.CleanupError;
import com.raditha.staleflag.model.Edit;
import com.raditha.staleflag.model.ErrorKind;
import com.raditha.staleflag.model.FlagCleanupException;
import com.raditha.staleflag.model.FlagSpec;
import com.raditha.staleflag.model.MatchSite;
import com.raditha.staleflag.model.SourceUnit;
import com.raditha.staleflag.model.UnitResult;
import com.raditha.staleflag.rewrite.ControlFlowPruner;
import com.raditha.staleflag.rewrite.DeclarationCleanup;
import com.raditha.staleflag.rewrite.EditGenerator;
import com.raditha.staleflag.rewrite.ExpressionRewriter;
import com.raditha.staleflag.rewrite.ExpressionSimplifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Everything the engine knows about one unit during a run. Each stage method is
 * called by exactly one worker thread at a time.
 */
class UnitState {

    private static final Logger logger = LoggerFactory.getLogger(UnitState.class);

    private final SourceUnit source;
    private CompilationUnit cu;
    private boolean lexicalPreserving;
    private boolean modified;
    private List<MatchSite> sites = List.of();
    private int rewritten;
    private final List<CleanupError> unsupported = new ArrayList<>();
    private final List<CleanupError> errors = new ArrayList<>();
    private Map<String, Integer> scannedCounts;

    UnitState(SourceUnit source) {
        this.source = source;
    }

    String name() {
        return source.name();
    }

    CompilationUnit getCompilationUnit() {
        return cu;
    }

    List<MatchSite> getSites() {
        return sites;
    }

    boolean isParsed() {
        return cu != null;
    }

    /**
     * Whether this unit's constant references are known. When they are not, no
     * shared constant can safely be deleted.
     */
    boolean isCounted() {
        return scannedCounts != null;
    }

    boolean isSkipped() {
        return errors.stream().anyMatch(e -> e.kind().skipsUnit());
    }

    void markModified() {
        modified = true;
    }

    void parse() {
        JavaParser parser = new JavaParser(new ParserConfiguration()
                .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17));
        ParseResult<CompilationUnit> result = parser.parse(source.source());
        if (!result.isSuccessful() || result.getResult().isEmpty()) {
            String problems = result.getProblems().stream()
                    .map(Problem::getVerboseMessage)
                    .collect(Collectors.joining("; "));
            logger.warn("Could not parse {}: {}", name(), problems);
            errors.add(new CleanupError(ErrorKind.PARSE_FAILURE, problems, null));
            return;
        }
        cu = result.getResult().get();
        try {
            LexicalPreservingPrinter.setup(cu);
            lexicalPreserving = true;
        } catch (RuntimeException e) {
            logger.debug("Lexical preservation unavailable for {}: {}", name(), e.getMessage());
        }
    }

    /**
     * Phase 1: find the sites and count constant references. Read-only.
     */
    void scan(ProjectIndex index, FlagSpec spec, CleanupConfig config, Map<String, Integer> counts) {
        if (!isParsed()) {
            return;
        }
        BindingResolver bindings = new BindingResolver(index);
        try {
            ReferenceResolver.ResolutionResult result =
                    new ReferenceResolver(bindings, config.maxBindingHops()).resolve(cu, spec);
            sites = result.sites();
            unsupported.addAll(result.unsupported());
            logger.debug("{}: {} sites", name(), sites.size());
        } catch (FlagCleanupException e) {
            logger.warn("Skipping {}: {}", name(), e.getMessage());
            errors.add(CleanupError.from(e));
            sites = List.of();
        } catch (RuntimeException e) {
            fail("scan", e);
        }
        try {
            scannedCounts = new ReferenceCounter(index, bindings).countSharedReferences(cu);
            scannedCounts.forEach((key, n) -> counts.merge(key, n, Integer::sum));
        } catch (RuntimeException e) {
            fail("reference count", e);
        }
    }

    /**
     * Phase 2: rewrite, prune and clean up locals. Writes only this unit's tree.
     */
    void rewrite(ProjectIndex index, FlagSpec spec, CleanupConfig config) {
        if (!isParsed() || isSkipped() || sites.isEmpty()) {
            return;
        }
        BindingResolver bindings = new BindingResolver(index);
        ExpressionSimplifier simplifier = new ExpressionSimplifier(spec.treatment(), config.maxFixedPointIterations());
        try {
            ExpressionRewriter.RewriteOutcome outcome = new ExpressionRewriter(
                    bindings, simplifier, spec.treatment(), config.maxBindingHops()).rewrite(cu, sites);
            rewritten = outcome.rewritten();
            unsupported.addAll(outcome.unsupported());
            if (rewritten == 0) {
                return;
            }
            modified = true;

            ControlFlowPruner.PruneOutcome pruned = new ControlFlowPruner(
                    simplifier, config.maxFixedPointIterations()).prune(cu, outcome.touched());
            unsupported.addAll(pruned.unsupported());

            int removed = new DeclarationCleanup(bindings).cleanLocals(cu, outcome.candidates());
            logger.debug("{}: {} rewritten, {} pruned, {} declarations removed",
                    name(), rewritten, pruned.pruned(), removed);
        } catch (FlagCleanupException e) {
            logger.warn("Skipping {}: {}", name(), e.getMessage());
            errors.add(CleanupError.from(e));
        } catch (RuntimeException e) {
            fail("rewrite", e);
        }
    }

    /**
     * Recount constant references on the rewritten tree. A skipped unit keeps its
     * original text, so its scanned counts stand.
     */
    void recount(ProjectIndex index, Map<String, Integer> counts) {
        if (!isCounted()) {
            return;
        }
        Map<String, Integer> current = scannedCounts;
        if (!isSkipped() && modified) {
            try {
                current = new ReferenceCounter(index, new BindingResolver(index)).countSharedReferences(cu);
            } catch (RuntimeException e) {
                fail("reference count", e);
            }
        }
        current.forEach((key, n) -> counts.merge(key, n, Integer::sum));
    }

    void fail(String stage, Throwable e) {
        logger.error("Unexpected failure during {} of {}", stage, name(), e);
        errors.add(new CleanupError(ErrorKind.INTERNAL_ERROR, stage + ": " + e, null));
    }

    /**
     * Current text of the unit. Falls back to the pretty printer when lexical
     * preservation cannot render the tree.
     */
    String render() {
        if (lexicalPreserving) {
            try {
                return LexicalPreservingPrinter.print(cu);
            } catch (RuntimeException e) {
                logger.warn("Lexical printing failed for {}, using the pretty printer: {}", name(), e.getMessage());
            }
        }
        return cu.toString();
    }

    UnitResult toResult() {
        String original = source.source();
        String rewrittenText = original;
        List<Edit> edits = List.of();
        if (isParsed() && !isSkipped() && modified) {
            rewrittenText = render();
            edits = EditGenerator.computeEdits(original, rewrittenText);
        }
        return new UnitResult(name(), source.path(), original, rewrittenText, edits,
                sites.size(), isSkipped() ? 0 : rewritten, unsupported, errors);
    }
}
