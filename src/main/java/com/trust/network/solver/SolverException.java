package com.trust.network.solver;

/**
 * Thrown when an integer-programming backend cannot produce an optimal solution.
 * Callers recover by running the approximate method instead.
 */
public class SolverException extends Exception {

    private final SolverStatus status;

    public SolverException(SolverStatus status, String message) {
        super(message);
        this.status = status;
    }

    public SolverException(SolverStatus status, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
    }

    public SolverStatus getStatus() {
        return status;
    }
}
