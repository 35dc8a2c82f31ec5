package com.trust.network.metrics;

import com.trust.network.selection.OptimizationProblem;
import com.trust.network.selection.SelectionMethod;
import com.trust.network.solver.SolverStatus;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordSelectionDuration(OptimizationProblem problem, SelectionMethod method, Duration duration) {
    }

    @Override
    public void recordObjective(OptimizationProblem problem, SelectionMethod method, double objective) {
    }

    @Override
    public void incrementFallback(OptimizationProblem problem, SolverStatus reason) {
    }

    @Override
    public void incrementSkippedRecords(long count) {
    }

    @Override
    public void recordNetworkSize(int nodes, int edges) {
    }
}
