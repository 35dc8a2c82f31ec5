package com.trust.network.metrics;

import com.trust.network.selection.OptimizationProblem;
import com.trust.network.selection.SelectionMethod;
import com.trust.network.solver.SolverStatus;

import java.time.Duration;

/**
 * Interface for recording optimization metrics.
 * The default {@link NoOpMetricsService} does nothing, so the library works
 * without a metrics registry.
 */
public interface MetricsService {

    void recordSelectionDuration(OptimizationProblem problem, SelectionMethod method, Duration duration);

    void recordObjective(OptimizationProblem problem, SelectionMethod method, double objective);

    void incrementFallback(OptimizationProblem problem, SolverStatus reason);

    void incrementSkippedRecords(long count);

    void recordNetworkSize(int nodes, int edges);
}
