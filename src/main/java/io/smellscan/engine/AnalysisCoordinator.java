package io.smellscan.engine;

import io.smellscan.ast.AstProvider;
import io.smellscan.ast.ParseFailureException;
import io.smellscan.ast.SyntaxTree;
import io.smellscan.config.EffectiveConfig;
import io.smellscan.model.AnalysisResult;
import io.smellscan.model.FileOutcome;
import io.smellscan.model.Severity;
import io.smellscan.report.ReportAggregator;
import io.smellscan.rules.RegistryException;
import io.smellscan.rules.RuleRegistry;
import io.smellscan.suppress.Baseline;
import io.smellscan.suppress.BaselineFilter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs the analysis of one module's files on a fixed pool of workers.
 * <p>
 * Each file is one task: parse, traverse, filter against the baseline, and return an immutable
 * {@link FileOutcome}. Workers share only read-only inputs and the stop signal. Outcomes are
 * collected in file path order after all tasks are done, then merged on the calling thread, so
 * the result does not depend on the number of workers.
 * <p>
 * With fail-fast on, a file that reports an Error-or-worse finding or an internal rule error
 * stops the run: tasks that have not started yet come back as {@code INCOMPLETE}, in-flight
 * files finish. A timeout abandons whatever is still running, also as {@code INCOMPLETE}.
 */
public class AnalysisCoordinator {

    private static final Logger log = LoggerFactory.getLogger(AnalysisCoordinator.class);

    static final String FAIL_FAST_REASON = "Not analyzed: fail-fast stopped the run after a failing file";
    static final String TIMEOUT_REASON = "Not analyzed: the module timeout expired";
    static final String INTERRUPTED_REASON = "Not analyzed: the run was interrupted";

    private final RuleRegistry registry;
    private final AstProvider astProvider;
    private final TraversalEngine engine;
    private final ReportAggregator aggregator;

    public AnalysisCoordinator(RuleRegistry registry, AstProvider astProvider) {
        this(registry, astProvider, new TraversalEngine(), new ReportAggregator());
    }

    public AnalysisCoordinator(RuleRegistry registry,
                               AstProvider astProvider,
                               TraversalEngine engine,
                               ReportAggregator aggregator) {
        this.registry = registry;
        this.astProvider = astProvider;
        this.engine = engine;
        this.aggregator = aggregator;
    }

    /**
     * Analyzes the given files.
     *
     * @param moduleName name reported in the result
     * @param files      files to analyze; duplicates are analyzed once
     * @param config     resolved configuration of the module
     * @param baseline   accepted findings, ignored in update mode
     * @param options    worker count, timeout, baseline mode and failure policy
     * @throws RegistryException if the registry is still open for registration
     */
    public AnalysisResult analyzeModule(String moduleName,
                                        Collection<Path> files,
                                        EffectiveConfig config,
                                        Baseline baseline,
                                        ExecutionOptions options) {
        if (!registry.isSealed()) {
            throw new RegistryException("Rule registry must be sealed before analysis starts");
        }
        Baseline accepted = baseline != null ? baseline : Baseline.empty();

        // Sorted by normalized path so submission order and outcome order are fixed
        Map<String, Path> byPath = new TreeMap<>();
        for (Path file : files) {
            byPath.putIfAbsent(SyntaxTree.normalize(file), file);
        }

        List<FileOutcome> outcomes = new ArrayList<>(byPath.size());
        Map<String, Path> toAnalyze = new TreeMap<>();
        for (Map.Entry<String, Path> entry : byPath.entrySet()) {
            if (config.isExcluded(entry.getKey())) {
                log.debug("Skipping excluded file {}", entry.getKey());
                outcomes.add(FileOutcome.excluded(entry.getKey()));
            } else {
                toAnalyze.put(entry.getKey(), entry.getValue());
            }
        }

        log.info("Analyzing module {}: {} file(s), {} excluded, {} worker(s)",
                moduleName, toAnalyze.size(), outcomes.size(), options.workerCount());
        if (!toAnalyze.isEmpty()) {
            outcomes.addAll(runAll(toAnalyze, config, accepted, options));
        }

        return aggregator.build(moduleName, outcomes, config, options.failurePolicy(), options.updateBaseline());
    }

    private List<FileOutcome> runAll(Map<String, Path> files,
                                     EffectiveConfig config,
                                     Baseline baseline,
                                     ExecutionOptions options) {
        AtomicReference<String> stopReason = new AtomicReference<>();
        int poolSize = Math.min(options.workerCount(), files.size());
        ExecutorService pool = Executors.newFixedThreadPool(poolSize, new WorkerThreadFactory());

        try {
            Map<String, Future<FileOutcome>> futures = new TreeMap<>();
            for (Map.Entry<String, Path> entry : files.entrySet()) {
                String displayPath = entry.getKey();
                Path file = entry.getValue();
                futures.put(displayPath, pool.submit(() -> {
                    String reason = stopReason.get();
                    if (reason != null) {
                        return FileOutcome.incomplete(displayPath, reason);
                    }
                    FileOutcome outcome = analyzeFile(displayPath, file, config, baseline, options.updateBaseline());
                    if (config.failFast() && triggersFailFast(outcome)
                            && stopReason.compareAndSet(null, FAIL_FAST_REASON)) {
                        log.info("Fail-fast triggered by {}", displayPath);
                    }
                    return outcome;
                }));
            }
            pool.shutdown();

            return collect(futures, stopReason, options);
        } finally {
            pool.shutdownNow();
        }
    }

    private List<FileOutcome> collect(Map<String, Future<FileOutcome>> futures,
                                      AtomicReference<String> stopReason,
                                      ExecutionOptions options) {
        long deadline = options.timeoutIfAny()
                .map(timeout -> System.nanoTime() + timeout.toNanos())
                .orElse(Long.MAX_VALUE);

        List<FileOutcome> outcomes = new ArrayList<>(futures.size());
        for (Map.Entry<String, Future<FileOutcome>> entry : futures.entrySet()) {
            String file = entry.getKey();
            Future<FileOutcome> future = entry.getValue();
            try {
                if (deadline == Long.MAX_VALUE) {
                    outcomes.add(future.get());
                } else {
                    long remaining = Math.max(0L, deadline - System.nanoTime());
                    outcomes.add(future.get(remaining, TimeUnit.NANOSECONDS));
                }
            } catch (TimeoutException e) {
                if (stopReason.compareAndSet(null, TIMEOUT_REASON)) {
                    log.warn("Timeout of {} expired, abandoning unfinished files", options.timeout());
                }
                future.cancel(true);
                outcomes.add(FileOutcome.incomplete(file, TIMEOUT_REASON));
            } catch (CancellationException e) {
                outcomes.add(FileOutcome.incomplete(file, reasonOr(stopReason, TIMEOUT_REASON)));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                stopReason.compareAndSet(null, INTERRUPTED_REASON);
                future.cancel(true);
                outcomes.add(FileOutcome.incomplete(file, INTERRUPTED_REASON));
                deadline = System.nanoTime();
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                log.error("Analysis of {} failed unexpectedly", file, cause);
                outcomes.add(FileOutcome.incomplete(file, "Analysis failed: " + cause));
            }
        }
        return outcomes;
    }

    private FileOutcome analyzeFile(String displayPath,
                                    Path file,
                                    EffectiveConfig config,
                                    Baseline baseline,
                                    boolean updateBaseline) {
        SyntaxTree tree;
        try {
            tree = astProvider.parse(file);
        } catch (ParseFailureException e) {
            log.warn("Could not parse {}: {}", displayPath, e.getMessage());
            return FileOutcome.parseFailure(displayPath, e.getMessage());
        } catch (RuntimeException e) {
            log.warn("AST provider failed on {}", displayPath, e);
            return FileOutcome.parseFailure(displayPath, "AST provider failed: " + e);
        }

        // Providers may report the original source path instead of the path they were given
        if (!tree.path().equals(displayPath) && config.isExcluded(tree.path())) {
            log.debug("Skipping excluded file {}", tree.path());
            return FileOutcome.excluded(tree.path());
        }

        FileAnalysis analysis = engine.analyzeFile(tree, config, registry);
        BaselineFilter.Result filtered = BaselineFilter.filter(analysis.findings(), baseline, updateBaseline);
        return new FileOutcome(
                analysis.file(),
                FileOutcome.Status.COMPLETED,
                filtered.reported(),
                analysis.diagnostics(),
                analysis.corrections(),
                analysis.suppressedCount(),
                filtered.baselineSuppressedCount(),
                filtered.fingerprints()
        );
    }

    static boolean triggersFailFast(FileOutcome outcome) {
        return outcome.hasFindingsAtLeast(Severity.ERROR) || outcome.hasRuleErrors();
    }

    private static String reasonOr(AtomicReference<String> stopReason, String fallback) {
        String reason = stopReason.get();
        return reason != null ? reason : fallback;
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable task) {
            Thread thread = new Thread(task, "smellscan-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
