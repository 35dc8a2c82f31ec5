package com.trust.network.selection;

import com.trust.network.solver.SolverStatus;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable outcome of one selection method.
 *
 * @param method         the method that was requested
 * @param provenance     how the ids were actually produced
 * @param selected       selected node ids, in the method's output order
 * @param objective      achieved objective: unique coverage, or total value
 * @param budgetUsed     sentinels used, or minutes consumed
 * @param fallbackReason why the exact method fell back; empty unless {@link Provenance#FALLBACK}
 * @param runtime        wall-clock time spent, including any fallback
 */
public record SelectionResult(
        SelectionMethod method,
        Provenance provenance,
        List<Long> selected,
        double objective,
        double budgetUsed,
        Optional<SolverStatus> fallbackReason,
        Duration runtime
) {
    public SelectionResult {
        Objects.requireNonNull(method, "method is required");
        Objects.requireNonNull(provenance, "provenance is required");
        selected = selected != null ? List.copyOf(selected) : List.of();
        fallbackReason = fallbackReason != null ? fallbackReason : Optional.empty();
        runtime = runtime != null ? runtime : Duration.ZERO;
        if (provenance == Provenance.FALLBACK && fallbackReason.isEmpty()) {
            throw new IllegalArgumentException("a fallback result needs a fallback reason");
        }
    }

    public static SelectionResult exact(List<Long> selected, double objective, double budgetUsed, Duration runtime) {
        return new SelectionResult(SelectionMethod.EXACT, Provenance.EXACT, selected, objective, budgetUsed,
                Optional.empty(), runtime);
    }

    public static SelectionResult approximate(SelectionMethod method, List<Long> selected, double objective,
                                              double budgetUsed, Duration runtime) {
        return new SelectionResult(method, Provenance.APPROXIMATE, selected, objective, budgetUsed,
                Optional.empty(), runtime);
    }

    /**
     * Re-labels an approximate result as the fallback answer of an exact request.
     */
    public SelectionResult asFallback(SolverStatus reason, Duration totalRuntime) {
        return new SelectionResult(SelectionMethod.EXACT, Provenance.FALLBACK, selected, objective, budgetUsed,
                Optional.of(reason), totalRuntime);
    }

    public boolean isFallback() {
        return provenance == Provenance.FALLBACK;
    }

    public int size() {
        return selected.size();
    }

    public boolean contains(long nodeId) {
        return selected.contains(nodeId);
    }

    @Override
    public String toString() {
        return "SelectionResult{method=" + method +
                ", provenance=" + provenance +
                ", selected=" + selected.size() +
                ", objective=" + objective +
                ", budgetUsed=" + budgetUsed +
                fallbackReason.map(r -> ", fallbackReason=" + r).orElse("") +
                ", runtimeMs=" + runtime.toMillis() + '}';
    }
}
