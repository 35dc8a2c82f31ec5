package com.trust.network.sentinel;

import com.trust.network.selection.SelectionResult;

/**
 * The three sentinel selections computed on one snapshot, with comparison figures.
 *
 * @param exact  integer-program selection, or the greedy answer tagged as fallback
 * @param greedy maximal-marginal-gain selection
 * @param naive  top-K-by-degree baseline
 */
public record SentinelSelection(SelectionResult exact, SelectionResult greedy, SelectionResult naive) {

    /**
     * Greedy coverage as a percentage of the exact coverage; 0 when exact covers nothing.
     */
    public double greedyVsOptimalPct() {
        return percentOf(greedy.objective(), exact.objective());
    }

    /**
     * Naive coverage as a percentage of the exact coverage; 0 when exact covers nothing.
     */
    public double naiveVsOptimalPct() {
        return percentOf(naive.objective(), exact.objective());
    }

    /**
     * Relative improvement of the exact coverage over the naive baseline, in percent.
     */
    public double exactImprovementOverNaivePct() {
        if (naive.objective() <= 0) {
            return 0.0;
        }
        return (exact.objective() - naive.objective()) / naive.objective() * 100.0;
    }

    /**
     * How many times faster greedy ran than the exact method; 0 when greedy took no measurable time.
     */
    public double greedySpeedupFactor() {
        long greedyNanos = greedy.runtime().toNanos();
        return greedyNanos > 0 ? (double) exact.runtime().toNanos() / greedyNanos : 0.0;
    }

    private static double percentOf(double value, double reference) {
        return reference > 0 ? value / reference * 100.0 : 0.0;
    }
}
