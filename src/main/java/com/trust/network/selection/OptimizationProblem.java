package com.trust.network.selection;

/**
 * The two selection problems solved on a snapshot.
 */
public enum OptimizationProblem {

    /**
     * Maximum coverage: choose at most K sentinels covering the most distinct talents.
     */
    SENTINEL,

    /**
     * Budgeted knapsack: choose dormant relationships to re-engage within T minutes.
     */
    MAINTENANCE
}
