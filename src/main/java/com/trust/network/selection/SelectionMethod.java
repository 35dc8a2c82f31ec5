package com.trust.network.selection;

/**
 * The algorithm that was asked to produce a selection.
 */
public enum SelectionMethod {

    /**
     * Integer program solved to optimality.
     */
    EXACT,

    /**
     * Maximal-marginal-gain greedy for coverage.
     */
    GREEDY,

    /**
     * Top-K by degree; comparison baseline only.
     */
    NAIVE,

    /**
     * Value-to-cost ratio greedy for the knapsack, with optional local swaps.
     */
    APPROXIMATE
}
