package com.qualitygate.core.orchestrator;

import com.qualitygate.core.analyzer.AnalysisContext;
import com.qualitygate.core.analyzer.Analyzer;
import com.qualitygate.core.model.AnalysisCategory;
import com.qualitygate.core.model.AnalysisResult;
import com.qualitygate.core.model.Finding;
import com.qualitygate.core.monitor.PerformanceMonitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs analyzers concurrently and merges their results.
 *
 * <p>Every enabled analyzer runs as an independent task. Each attempt gets the analyzer's own
 * timeout; a failed or timed-out attempt is retried up to {@code retryAttempts} more times.
 * An analyzer that still fails is reported as degraded and contributes no findings or metrics;
 * it never prevents the others from completing. Timed-out attempts are abandoned, not
 * interrupted, and other analyzers are never cancelled.
 *
 * <p>{@link #run} returns only after every analyzer has settled. Findings are merged in
 * analyzer order and deduplicated by id, the first occurrence winning.
 */
public class AnalysisOrchestrator implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(AnalysisOrchestrator.class);

    private final ExecutorService executor;
    private final boolean ownsExecutor;
    private final PerformanceMonitor monitor;

    /**
     * Creates an orchestrator with its own daemon thread pool.
     */
    public AnalysisOrchestrator() {
        this(null);
    }

    /**
     * Creates an orchestrator with its own daemon thread pool reporting to a monitor.
     *
     * @param monitor performance monitor, or null
     */
    public AnalysisOrchestrator(PerformanceMonitor monitor) {
        this(Executors.newCachedThreadPool(new AnalyzerThreadFactory()), true, monitor);
    }

    /**
     * Creates an orchestrator on a caller-managed executor, which is not shut down by {@link #close()}.
     *
     * @param executor executor for analyzer tasks
     * @param monitor performance monitor, or null
     */
    public AnalysisOrchestrator(ExecutorService executor, PerformanceMonitor monitor) {
        this(executor, false, monitor);
    }

    private AnalysisOrchestrator(ExecutorService executor, boolean ownsExecutor, PerformanceMonitor monitor) {
        this.executor = executor;
        this.ownsExecutor = ownsExecutor;
        this.monitor = monitor;
    }

    /**
     * Runs the enabled analyzers and waits for all of them to settle.
     *
     * @param analyzers analyzers in category order; disabled ones are skipped
     * @param context shared run context
     * @return merged results, findings and failures
     */
    public AggregatedAnalysis run(List<Analyzer> analyzers, AnalysisContext context) {
        long start = System.nanoTime();

        List<CompletableFuture<AnalyzerOutcome>> futures = new ArrayList<>();
        for (Analyzer analyzer : analyzers) {
            long analyzerStart = System.nanoTime();
            try {
                if (!analyzer.getSettings().enabled()) {
                    log.debug("Skipping disabled analyzer {}", analyzer.getName());
                    continue;
                }
                futures.add(execute(analyzer, context, analyzerStart));
            } catch (RuntimeException e) {
                rejected(analyzer, context, e, analyzerStart).ifPresent(futures::add);
            }
        }
        log.info("Running {} analyzers on {} files", futures.size(), context.files().size());

        // Outcome futures never complete exceptionally
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        List<AnalyzerOutcome> outcomes = futures.stream().map(CompletableFuture::join).toList();
        return aggregate(outcomes, Duration.ofNanos(System.nanoTime() - start));
    }

    // ==================== Execution ====================

    private CompletableFuture<AnalyzerOutcome> execute(Analyzer analyzer, AnalysisContext context, long start) {
        if (!analyzer.validate()) {
            return CompletableFuture.completedFuture(
                fail(analyzer, context, "Validation failed for " + analyzer.getName(), 0, start));
        }
        return attempt(analyzer, context, 1, start);
    }

    private CompletableFuture<AnalyzerOutcome> attempt(Analyzer analyzer, AnalysisContext context,
                                                       int attempt, long start) {
        CompletableFuture<AnalysisResult> task;
        try {
            task = CompletableFuture
                .supplyAsync(() -> analyzer.analyze(context), executor)
                .orTimeout(analyzer.getTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (RuntimeException e) {
            // Rejected submission or a throwing timeout getter
            task = CompletableFuture.failedFuture(e);
        }

        return task.handle((result, error) -> {
            if (error == null && result != null) {
                return CompletableFuture.completedFuture(succeed(analyzer, context, result, attempt, start));
            }
            String reason = error != null
                ? describe(analyzer, unwrap(error))
                : analyzer.getName() + " returned no result";
            if (attempt <= analyzer.getRetryAttempts()) {
                log.warn("{} attempt {} failed: {}; retrying", analyzer.getName(), attempt, reason);
                return attempt(analyzer, context, attempt + 1, start);
            }
            return CompletableFuture.completedFuture(fail(analyzer, context, reason, attempt, start));
        }).thenCompose(outcome -> outcome);
    }

    /**
     * Turns an exception thrown while reading settings or validating into a failed outcome.
     * An analyzer that cannot even report its category is dropped from the run.
     */
    private Optional<CompletableFuture<AnalyzerOutcome>> rejected(Analyzer analyzer, AnalysisContext context,
                                                                  RuntimeException error, long start) {
        String reason = "Validation failed for " + nameOf(analyzer) + ": " + describe(analyzer, error);
        AnalysisCategory category;
        try {
            category = analyzer.getCategory();
        } catch (RuntimeException e) {
            log.error("Dropping analyzer {}: {}", nameOf(analyzer), reason, e);
            return Optional.empty();
        }
        Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
        log.warn("{} rejected before running: {}", nameOf(analyzer), reason);
        if (monitor != null) {
            monitor.recordAnalyzer(nameOf(analyzer), context.files().size(), elapsed, false, reason);
        }
        return Optional.of(CompletableFuture.completedFuture(
            AnalyzerOutcome.failure(category, nameOf(analyzer), reason, 0, elapsed)));
    }

    private static String nameOf(Analyzer analyzer) {
        try {
            return analyzer.getName();
        } catch (RuntimeException e) {
            return analyzer.getClass().getSimpleName();
        }
    }

    private AnalyzerOutcome succeed(Analyzer analyzer, AnalysisContext context, AnalysisResult result,
                                    int attempts, long start) {
        Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
        record(analyzer, context, elapsed, true, null);
        return AnalyzerOutcome.success(analyzer.getCategory(), analyzer.getName(), result, attempts, elapsed);
    }

    private AnalyzerOutcome fail(Analyzer analyzer, AnalysisContext context, String reason,
                                 int attempts, long start) {
        Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
        log.warn("{} failed after {} attempt(s): {}", nameOf(analyzer), attempts, reason);
        record(analyzer, context, elapsed, false, reason);
        return AnalyzerOutcome.failure(analyzer.getCategory(), nameOf(analyzer), reason, attempts, elapsed);
    }

    private void record(Analyzer analyzer, AnalysisContext context, Duration elapsed,
                        boolean success, String error) {
        if (monitor != null) {
            monitor.recordAnalyzer(nameOf(analyzer), context.files().size(), elapsed, success, error);
        }
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
            && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static String describe(Analyzer analyzer, Throwable error) {
        if (error instanceof TimeoutException) {
            return "Timed out after " + analyzer.getTimeout().toMillis() + " ms";
        }
        String message = error.getMessage();
        return message != null ? message : error.getClass().getSimpleName();
    }

    // ==================== Aggregation ====================

    private AggregatedAnalysis aggregate(List<AnalyzerOutcome> outcomes, Duration totalTime) {
        Map<AnalysisCategory, AnalysisResult> results = new EnumMap<>(AnalysisCategory.class);
        Map<AnalysisCategory, String> failures = new EnumMap<>(AnalysisCategory.class);
        Map<String, Finding> findings = new LinkedHashMap<>();

        for (AnalyzerOutcome outcome : outcomes) {
            if (!outcome.succeeded()) {
                failures.putIfAbsent(outcome.category(), outcome.failureReason());
                continue;
            }
            if (results.putIfAbsent(outcome.category(), outcome.result()) != null) {
                log.warn("Ignoring second result for category {} from {}", outcome.category(), outcome.analyzerName());
                continue;
            }
            for (Finding finding : outcome.result().findings()) {
                findings.putIfAbsent(finding.id(), finding);
            }
        }
        // A category with any successful analyzer is not degraded
        failures.keySet().removeAll(results.keySet());

        log.info("Analyzers settled in {} ms: {} succeeded, {} failed, {} findings",
            totalTime.toMillis(), results.size(), failures.size(), findings.size());
        return new AggregatedAnalysis(results, List.copyOf(findings.values()), failures, outcomes, totalTime);
    }

    @Override
    public void close() {
        if (!ownsExecutor) {
            return;
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(2, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }

    private static final class AnalyzerThreadFactory implements ThreadFactory {

        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "quality-gate-analyzer-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
