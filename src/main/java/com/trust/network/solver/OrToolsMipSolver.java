package com.trust.network.solver;

import com.google.ortools.Loader;
import com.google.ortools.linearsolver.MPConstraint;
import com.google.ortools.linearsolver.MPObjective;
import com.google.ortools.linearsolver.MPSolver;
import com.google.ortools.linearsolver.MPSolverParameters;
import com.google.ortools.linearsolver.MPVariable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.BitSet;
import java.util.List;

/**
 * Exact backend on the OR-Tools linear solver wrapper, SCIP by default.
 *
 * <p>Each call builds a fresh native model: one boolean variable per program variable,
 * one {@code <=} row per linear constraint, the warm start passed as a solution hint.
 * The relative MIP gap is set to zero so only a proven optimum counts as solved.
 * The time limit is enforced by the native solver itself; a limit reached with or
 * without an incumbent is reported as {@link SolverStatus#TIMEOUT}.</p>
 *
 * <p>The native libraries are loaded on first use. If they cannot be loaded, or the
 * requested backend is not compiled into the bundle, every call fails with
 * {@link SolverStatus#UNAVAILABLE}.</p>
 */
public class OrToolsMipSolver implements IntegerProgramSolver {
    private static final Logger log = LoggerFactory.getLogger(OrToolsMipSolver.class);

    public static final String DEFAULT_BACKEND = "SCIP";

    static final double FEASIBILITY_TOLERANCE = 1e-6;

    private static final Object LOAD_LOCK = new Object();
    private static volatile boolean nativeLoaded;

    private final String backend;

    public OrToolsMipSolver() {
        this(DEFAULT_BACKEND);
    }

    /**
     * @param backend OR-Tools solver id, e.g. {@code SCIP} or {@code CBC}
     */
    public OrToolsMipSolver(String backend) {
        if (backend == null || backend.isBlank()) {
            throw new IllegalArgumentException("backend must not be blank");
        }
        this.backend = backend;
    }

    @Override
    public IpSolution solve(IntegerProgram program, Duration timeLimit) throws SolverException {
        if (timeLimit == null || timeLimit.isNegative() || timeLimit.isZero()) {
            throw new SolverException(SolverStatus.TIMEOUT, "Time limit of " + timeLimit + " leaves no time to solve");
        }
        if (program.variableCount() == 0) {
            return new IpSolution(0.0, new BitSet(), 0);
        }
        loadNativeLibraries();

        MPSolver solver = MPSolver.createSolver(backend);
        if (solver == null) {
            throw new SolverException(SolverStatus.UNAVAILABLE, "OR-Tools backend " + backend + " is not available");
        }
        long started = System.nanoTime();
        try {
            MPVariable[] variables = new MPVariable[program.variableCount()];
            MPObjective objective = solver.objective();
            for (int v = 0; v < variables.length; v++) {
                variables[v] = solver.makeBoolVar(program.variableName(v));
                objective.setCoefficient(variables[v], program.objectiveCoefficient(v));
            }
            objective.setMaximization();

            List<IntegerProgram.LinearConstraint> rows = program.getConstraints();
            for (IntegerProgram.LinearConstraint row : rows) {
                MPConstraint constraint = solver.makeConstraint(-MPSolver.infinity(), row.rhs(), row.name());
                for (int t = 0; t < row.size(); t++) {
                    constraint.setCoefficient(variables[row.variable(t)], row.coefficient(t));
                }
            }

            program.getWarmStart().ifPresent(ones -> {
                double[] values = new double[variables.length];
                for (int v = ones.nextSetBit(0); v >= 0; v = ones.nextSetBit(v + 1)) {
                    values[v] = 1.0;
                }
                solver.setHint(variables, values);
            });

            solver.setTimeLimit(saturatedMillis(timeLimit));
            MPSolverParameters parameters = new MPSolverParameters();
            parameters.setDoubleParam(MPSolverParameters.DoubleParam.RELATIVE_MIP_GAP, 0.0);

            log.debug("solver.start backend={} program={} variables={} rows={} limitMs={}",
                    backend, program.getName(), variables.length, rows.size(), timeLimit.toMillis());
            MPSolver.ResultStatus status = solver.solve(parameters);
            long elapsedMs = (System.nanoTime() - started) / 1_000_000;

            switch (status) {
                case OPTIMAL:
                    break;
                case FEASIBLE:
                case NOT_SOLVED:
                    throw new SolverException(SolverStatus.TIMEOUT, "Solve of " + program.getName()
                            + " stopped at the " + timeLimit + " limit without proving optimality (" + status + ")");
                case INFEASIBLE:
                    throw new SolverException(SolverStatus.INFEASIBLE, program.getName() + " has no feasible solution");
                default:
                    throw new SolverException(SolverStatus.ERROR,
                            "Backend " + backend + " returned " + status + " for " + program.getName());
            }

            BitSet ones = new BitSet(variables.length);
            for (int v = 0; v < variables.length; v++) {
                if (variables[v].solutionValue() > 0.5) {
                    ones.set(v);
                }
            }
            if (!program.isFeasible(ones, FEASIBILITY_TOLERANCE)) {
                throw new SolverException(SolverStatus.ERROR,
                        "Backend " + backend + " returned an infeasible assignment for " + program.getName());
            }
            IpSolution solution = new IpSolution(program.evaluate(ones), ones, solver.nodes());
            log.debug("solver.finished backend={} program={} objective={} nodes={} elapsedMs={}",
                    backend, program.getName(), solution.objective(), solution.nodesExplored(), elapsedMs);
            return solution;
        } finally {
            solver.delete();
        }
    }

    @Override
    public String getName() {
        return "or-tools-" + backend.toLowerCase();
    }

    private static void loadNativeLibraries() throws SolverException {
        if (nativeLoaded) {
            return;
        }
        synchronized (LOAD_LOCK) {
            if (nativeLoaded) {
                return;
            }
            try {
                Loader.loadNativeLibraries();
                nativeLoaded = true;
            } catch (UnsatisfiedLinkError | RuntimeException e) {
                log.error("solver.unavailable cannot load OR-Tools native libraries: {}", e.getMessage());
                throw new SolverException(SolverStatus.UNAVAILABLE,
                        "Cannot load OR-Tools native libraries: " + e.getMessage(), e);
            }
        }
    }

    private static long saturatedMillis(Duration duration) {
        try {
            return Math.max(1L, duration.toMillis());
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE;
        }
    }
}
