package com.raditha.staleflag.engine;

import com.github.javaparser.ast.CompilationUnit;
import com.raditha.staleflag.analysis.BindingResolver;
import com.raditha.staleflag.analysis.ProjectIndex;
import com.raditha.staleflag.config.CleanupConfig;
import com.raditha.staleflag.model.Binding;
import com.raditha.staleflag.model.BindingKind;
import com.raditha.staleflag.model.FlagSpec;
import com.raditha.staleflag.model.MatchSite;
import com.raditha.staleflag.model.SourceUnit;
import com.raditha.staleflag.model.UnitResult;
import com.raditha.staleflag.rewrite.DeclarationCleanup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.function.Consumer;

/**
 * Main orchestrator for a stale flag cleanup.
 * <p>
 * Units are processed in parallel, stage by stage, with every stage finished for
 * all units before the next one starts:
 * <ol>
 * <li>parse and index</li>
 * <li>scan for flag queries and count constant references (read-only)</li>
 * <li>rewrite, prune and remove local declarations (each unit writes only itself)</li>
 * <li>recount and delete flag constants that nothing references any more</li>
 * </ol>
 * A failure in one unit is recorded against that unit and never stops the others.
 */
public class CleanupEngine {

    private static final Logger logger = LoggerFactory.getLogger(CleanupEngine.class);

    private final CleanupConfig config;

    public CleanupEngine(CleanupConfig config) {
        this.config = config;
    }

    public CleanupReport run(List<SourceUnit> sources, FlagSpec spec) throws InterruptedException {
        Instant startedAt = Instant.now();
        long start = System.nanoTime();
        logger.info("Cleaning flag {} from {} units", spec, sources.size());

        List<UnitState> states = sources.stream().map(UnitState::new).toList();
        ExecutorService executor = Executors.newFixedThreadPool(config.parallelism());
        try {
            runStage(executor, states, "parse", UnitState::parse);

            Map<String, CompilationUnit> parsed = new LinkedHashMap<>();
            for (UnitState state : states) {
                if (state.isParsed()) {
                    parsed.put(state.name(), state.getCompilationUnit());
                }
            }
            ProjectIndex index = ProjectIndex.build(parsed);
            logger.debug("Indexed {} types", index.size());

            Map<String, Integer> initialCounts = new ConcurrentHashMap<>();
            runStage(executor, states, "scan", s -> s.scan(index, spec, config, initialCounts));

            runStage(executor, states, "rewrite", s -> s.rewrite(index, spec, config));

            List<String> deleted = sweepConstants(executor, states, index);

            List<UnitResult> results = states.stream().map(UnitState::toResult).toList();
            Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
            CleanupReport report = new CleanupReport(spec, startedAt, elapsed, results, deleted, initialCounts);
            logSummary(report);
            return report;
        } finally {
            executor.shutdownNow();
        }
    }

    /**
     * Clean a single in-memory unit and return its new text.
     */
    public String cleanSource(String name, String source, FlagSpec spec) throws InterruptedException {
        return run(List.of(SourceUnit.of(name, source)), spec).units().get(0).rewrittenSource();
    }

    private void runStage(ExecutorService executor, List<UnitState> states, String stage,
            Consumer<UnitState> action) throws InterruptedException {
        List<Callable<Void>> tasks = new ArrayList<>();
        for (UnitState state : states) {
            tasks.add(() -> {
                action.accept(state);
                return null;
            });
        }
        List<Future<Void>> futures = executor.invokeAll(tasks);
        for (int i = 0; i < futures.size(); i++) {
            try {
                futures.get(i).get();
            } catch (ExecutionException e) {
                states.get(i).fail(stage, e.getCause());
            }
        }
    }

    /**
     * Delete flag constants whose project-wide reference count dropped to zero.
     * Deleting one constant can release another further up its chain, so counts
     * are recomputed until a pass deletes nothing.
     */
    private List<String> sweepConstants(ExecutorService executor, List<UnitState> states, ProjectIndex index)
            throws InterruptedException {
        Map<String, Binding> candidates = new LinkedHashMap<>();
        for (UnitState state : states) {
            for (MatchSite site : state.getSites()) {
                for (Binding binding : site.chain()) {
                    if (binding.kind() == BindingKind.CONSTANT && binding.key() != null) {
                        candidates.putIfAbsent(binding.key(), binding);
                    }
                }
            }
        }
        List<String> deleted = new ArrayList<>();
        if (candidates.isEmpty()) {
            return deleted;
        }
        if (states.stream().anyMatch(s -> !s.isCounted())) {
            logger.warn("Not every unit could be counted; leaving flag constants in place");
            return deleted;
        }

        Map<CompilationUnit, UnitState> owners = new IdentityHashMap<>();
        states.stream().filter(UnitState::isParsed).forEach(s -> owners.put(s.getCompilationUnit(), s));
        DeclarationCleanup cleanup = new DeclarationCleanup(new BindingResolver(index));

        boolean progress = true;
        while (progress) {
            progress = false;
            Map<String, Integer> counts = new ConcurrentHashMap<>();
            runStage(executor, states, "recount", s -> s.recount(index, counts));

            for (Binding constant : candidates.values()) {
                String key = constant.key();
                if (deleted.contains(key) || counts.getOrDefault(key, 0) > 0) {
                    continue;
                }
                if (constant.exported() && !config.removePublicConstants()) {
                    logger.info("Keeping exported constant {}", key);
                    continue;
                }
                UnitState owner = constant.declaration().findCompilationUnit().map(owners::get).orElse(null);
                if (owner == null || owner.isSkipped() || isImportedBySkippedUnit(states, cleanup, key)
                        || !cleanup.removeSharedConstant(constant)) {
                    continue;
                }
                owner.markModified();
                deleted.add(key);
                progress = true;
                for (UnitState state : states) {
                    if (state.isParsed() && !state.isSkipped()
                            && cleanup.removeStaticImports(state.getCompilationUnit(), key) > 0) {
                        state.markModified();
                    }
                }
            }
        }
        return deleted;
    }

    /**
     * A skipped unit keeps its text, including any static import of the constant.
     */
    private static boolean isImportedBySkippedUnit(List<UnitState> states, DeclarationCleanup cleanup, String key) {
        return states.stream().anyMatch(s -> s.isParsed() && s.isSkipped()
                && cleanup.hasStaticImport(s.getCompilationUnit(), key));
    }

    private static void logSummary(CleanupReport report) {
        for (UnitResult unit : report.units()) {
            if (unit.isSkipped()) {
                logger.info("{}: skipped ({})", unit.unitName(), unit.errors());
            } else if (unit.matchCount() > 0 || unit.isChanged()) {
                logger.info("{}: {} of {} sites rewritten, {} edits, {} unsupported",
                        unit.unitName(), unit.rewrittenCount(), unit.matchCount(), unit.edits().size(),
                        unit.unsupported().size());
            }
        }
        logger.info("Done in {} ms: {} sites rewritten, constants deleted: {}",
                report.elapsed().toMillis(), report.totalRewritten(), report.deletedConstants());
    }
}
