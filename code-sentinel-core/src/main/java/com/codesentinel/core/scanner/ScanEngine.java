package com.codesentinel.core.scanner;

import com.codesentinel.core.exception.ScanExecutionException;
import com.codesentinel.core.model.AnalysisOptions;
import com.codesentinel.core.model.Category;
import com.codesentinel.core.model.LineContext;
import com.codesentinel.core.rule.RuleRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Applies registry rules, restricted to the enabled categories, over extracted lines.
 *
 * <p>One {@link CategoryScanner} pass runs per category in {@code enabled ∩ registry},
 * in {@link Category} declaration order. Disabled categories are never evaluated.
 *
 * <p>With {@code parallelism > 1} the passes are dispatched onto a fixed thread pool
 * created for the call; the engine waits for all of them before merging. Passes share
 * only immutable inputs, and results are merged in category order, so parallel and
 * sequential scans produce identical outcomes.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ScanEngine engine = new ScanEngine(RuleRegistry.defaultRegistry());
 * ScanOutcome outcome = engine.scan(lines, AnalysisOptions.of(Category.SECURITY));
 * }</pre>
 *
 * @since 1.0.0
 */
public class ScanEngine {

    private static final Logger log = LoggerFactory.getLogger(ScanEngine.class);

    private final RuleRegistry registry;
    private final int parallelism;
    private final CategoryScanner categoryScanner;

    public ScanEngine(RuleRegistry registry) {
        this(registry, 1);
    }

    /**
     * Creates a scan engine.
     *
     * @param registry rule catalog
     * @param parallelism maximum number of category passes running at once; 1 scans sequentially
     */
    public ScanEngine(RuleRegistry registry, int parallelism) {
        this(registry, parallelism, new RuleEvaluator());
    }

    ScanEngine(RuleRegistry registry, int parallelism, RuleEvaluator evaluator) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be >= 1, was " + parallelism);
        }
        this.parallelism = parallelism;
        this.categoryScanner = new CategoryScanner(evaluator);
    }

    public RuleRegistry registry() {
        return registry;
    }

    /**
     * Scans lines with every enabled category.
     *
     * @param lines line facts of one unit
     * @param options enabled categories
     * @return merged matches and faults
     * @throws ScanExecutionException if a worker fails outside rule evaluation, or the
     *                                calling thread is interrupted while waiting
     */
    public ScanOutcome scan(List<LineContext> lines, AnalysisOptions options) {
        List<Category> categories = new ArrayList<>();
        for (Category category : Category.values()) {
            if (options.isEnabled(category) && !registry.rulesFor(category).isEmpty()) {
                categories.add(category);
            }
        }
        if (categories.isEmpty()) {
            log.debug("No enabled category has rules, nothing to scan");
            return ScanOutcome.empty();
        }

        List<CategoryScanResult> results = parallelism > 1 && categories.size() > 1
            ? scanParallel(lines, categories)
            : scanSequential(lines, categories);
        return ScanOutcome.merge(results);
    }

    private List<CategoryScanResult> scanSequential(List<LineContext> lines, List<Category> categories) {
        List<CategoryScanResult> results = new ArrayList<>(categories.size());
        for (Category category : categories) {
            results.add(categoryScanner.scan(category, registry.rulesFor(category), lines));
        }
        return results;
    }

    private List<CategoryScanResult> scanParallel(List<LineContext> lines, List<Category> categories) {
        int threads = Math.min(parallelism, categories.size());
        log.debug("Scanning {} categories on {} threads", categories.size(), threads);

        List<Callable<CategoryScanResult>> tasks = new ArrayList<>(categories.size());
        for (Category category : categories) {
            tasks.add(() -> categoryScanner.scan(category, registry.rulesFor(category), lines));
        }

        ExecutorService executor = Executors.newFixedThreadPool(threads, new ScanThreadFactory());
        try {
            List<Future<CategoryScanResult>> futures = executor.invokeAll(tasks);
            List<CategoryScanResult> results = new ArrayList<>(futures.size());
            for (Future<CategoryScanResult> future : futures) {
                results.add(future.get());
            }
            return results;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ScanExecutionException("Interrupted while waiting for category scans", e);
        } catch (ExecutionException e) {
            throw new ScanExecutionException("Category scan failed: " + e.getCause(), e.getCause());
        } finally {
            executor.shutdownNow();
        }
    }

    private static final class ScanThreadFactory implements ThreadFactory {
        private static final AtomicInteger POOL_COUNTER = new AtomicInteger();

        private final int pool = POOL_COUNTER.incrementAndGet();
        private final AtomicInteger threadCounter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "sentinel-scan-" + pool + "-" + threadCounter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
