package com.trust.network.solver;

import java.time.Duration;

/**
 * An integer-programming backend for binary maximization programs.
 * Implementations must return a provably optimal solution or throw.
 */
public interface IntegerProgramSolver {

    /**
     * Solves the program to optimality.
     *
     * @param program   the binary program to maximize
     * @param timeLimit wall-clock limit for the attempt; zero means no attempt is made
     * @return an optimal solution
     * @throws SolverException if the program is infeasible, the limit is exceeded,
     *                         or the backend is unavailable
     */
    IpSolution solve(IntegerProgram program, Duration timeLimit) throws SolverException;

    /**
     * Name of the backend, for logs and result provenance.
     */
    String getName();
}
