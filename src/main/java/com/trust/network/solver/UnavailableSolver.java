package com.trust.network.solver;

import java.time.Duration;

/**
 * Solver used when no integer-programming backend is available.
 * Every call fails with {@link SolverStatus#UNAVAILABLE}, so the selectors run
 * their approximate methods only.
 */
public class UnavailableSolver implements IntegerProgramSolver {

    @Override
    public IpSolution solve(IntegerProgram program, Duration timeLimit) throws SolverException {
        throw new SolverException(SolverStatus.UNAVAILABLE, "No integer-programming backend configured");
    }

    @Override
    public String getName() {
        return "unavailable";
    }
}
