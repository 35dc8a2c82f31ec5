package com.trust.network.solver;

/**
 * Why an integer-programming backend did not return an optimal solution.
 */
public enum SolverStatus {
    INFEASIBLE,
    TIMEOUT,
    UNAVAILABLE,
    ERROR
}
