package com.trust.network.metrics;

import com.trust.network.selection.OptimizationProblem;
import com.trust.network.selection.SelectionMethod;
import com.trust.network.solver.SolverStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code optimizer.selection.duration}: Timer (tags: problem, method)</li>
 *   <li>{@code optimizer.selection.objective}: DistributionSummary (tags: problem, method)</li>
 *   <li>{@code optimizer.solver.fallback}: Counter (tags: problem, reason)</li>
 *   <li>{@code optimizer.records.skipped}: Counter</li>
 *   <li>{@code optimizer.network.nodes}, {@code optimizer.network.edges}: DistributionSummary</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Map<String, DistributionSummary> summaryCache = new ConcurrentHashMap<>();
    private final Counter skippedRecordsCounter;
    private final DistributionSummary nodesSummary;
    private final DistributionSummary edgesSummary;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.skippedRecordsCounter = Counter.builder("optimizer.records.skipped")
                .description("Number of malformed endorsement records skipped")
                .register(registry);
        this.nodesSummary = DistributionSummary.builder("optimizer.network.nodes")
                .description("Nodes per built snapshot")
                .register(registry);
        this.edgesSummary = DistributionSummary.builder("optimizer.network.edges")
                .description("Edges per built snapshot")
                .register(registry);
    }

    @Override
    public void recordSelectionDuration(OptimizationProblem problem, SelectionMethod method, Duration duration) {
        String key = problem.name() + ":" + method.name();
        Timer timer = timerCache.computeIfAbsent(key, k ->
                Timer.builder("optimizer.selection.duration")
                        .description("Duration of selection methods")
                        .tag("problem", problem.name())
                        .tag("method", method.name())
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void recordObjective(OptimizationProblem problem, SelectionMethod method, double objective) {
        String key = problem.name() + ":" + method.name();
        DistributionSummary summary = summaryCache.computeIfAbsent(key, k ->
                DistributionSummary.builder("optimizer.selection.objective")
                        .description("Objective value achieved by selection methods")
                        .tag("problem", problem.name())
                        .tag("method", method.name())
                        .register(registry));
        summary.record(objective);
    }

    @Override
    public void incrementFallback(OptimizationProblem problem, SolverStatus reason) {
        String key = problem.name() + ":" + reason.name();
        Counter counter = counterCache.computeIfAbsent(key, k ->
                Counter.builder("optimizer.solver.fallback")
                        .description("Exact solves replaced by the approximate method")
                        .tag("problem", problem.name())
                        .tag("reason", reason.name())
                        .register(registry));
        counter.increment();
    }

    @Override
    public void incrementSkippedRecords(long count) {
        if (count > 0) {
            skippedRecordsCounter.increment(count);
        }
    }

    @Override
    public void recordNetworkSize(int nodes, int edges) {
        nodesSummary.record(nodes);
        edgesSummary.record(edges);
    }
}
