package com.trust.network.solver;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs a backend on a worker thread and enforces the time limit from the outside.
 *
 * <p>The backend gets one attempt. If it has not returned when the limit expires
 * the worker is interrupted and the call fails with {@link SolverStatus#TIMEOUT}.
 * A zero limit fails immediately without starting the backend. Failures are never
 * retried.</p>
 *
 * <p>Backends that honour the limit themselves can be given a grace period, so their
 * own timeout is reported before the outer wait gives up.</p>
 */
public class TimeBoundedSolver implements IntegerProgramSolver, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(TimeBoundedSolver.class);
    private static final AtomicInteger THREAD_COUNTER = new AtomicInteger();

    private final IntegerProgramSolver delegate;
    private final Duration grace;
    private final ExecutorService executor;

    public TimeBoundedSolver(IntegerProgramSolver delegate) {
        this(delegate, Duration.ZERO);
    }

    /**
     * @param grace extra wait on top of the time limit before the worker is interrupted
     */
    public TimeBoundedSolver(IntegerProgramSolver delegate, Duration grace) {
        if (grace == null || grace.isNegative()) {
            throw new IllegalArgumentException("grace must be zero or positive");
        }
        this.delegate = delegate;
        this.grace = grace;
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable, "ip-solver-" + THREAD_COUNTER.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        this.executor = Executors.newCachedThreadPool(threadFactory);
    }

    @Override
    public IpSolution solve(IntegerProgram program, Duration timeLimit) throws SolverException {
        if (timeLimit == null || timeLimit.isNegative() || timeLimit.isZero()) {
            throw new SolverException(SolverStatus.TIMEOUT,
                    "Time limit of " + timeLimit + " for " + program.getName() + " leaves no time to solve");
        }

        Future<IpSolution> future = executor.submit(() -> delegate.solve(program, timeLimit));
        try {
            return future.get(toMillis(timeLimit, grace), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("solver.timeout backend={} program={} limit={}", delegate.getName(), program.getName(), timeLimit);
            throw new SolverException(SolverStatus.TIMEOUT,
                    "Solve of " + program.getName() + " exceeded " + timeLimit, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof SolverException solverException) {
                throw solverException;
            }
            throw new SolverException(SolverStatus.ERROR,
                    "Backend " + delegate.getName() + " failed on " + program.getName() + ": " + cause, cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new SolverException(SolverStatus.TIMEOUT, "Interrupted while waiting for " + program.getName(), e);
        }
    }

    @Override
    public String getName() {
        return delegate.getName();
    }

    private static long toMillis(Duration limit, Duration grace) {
        try {
            return Math.max(1L, limit.plus(grace).toMillis());
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE;
        }
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
