package com.trust.network.solver;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.BitSet;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class TimeBoundedSolverTest {

    @Mock
    private IntegerProgramSolver backend;

    private TimeBoundedSolver solver;
    private IntegerProgram program;

    @BeforeEach
    void setUp() {
        solver = new TimeBoundedSolver(backend);
        IntegerProgram.Builder b = IntegerProgram.builder("p");
        b.addVariable("x", 1);
        program = b.build();
    }

    @AfterEach
    void tearDown() {
        solver.close();
    }

    @Test
    @DisplayName("Zero time limit should time out without calling the backend")
    void zeroLimitNeverCallsBackend() {
        SolverException e = assertThrows(SolverException.class, () -> solver.solve(program, Duration.ZERO));

        assertEquals(SolverStatus.TIMEOUT, e.getStatus());
        verifyNoInteractions(backend);
    }

    @Test
    @DisplayName("A backend result within the limit should be returned")
    void returnsResult() throws SolverException {
        IpSolution expected = new IpSolution(1.0, new BitSet(), 3);
        when(backend.solve(any(), any())).thenReturn(expected);

        assertSame(expected, solver.solve(program, Duration.ofSeconds(5)));
    }

    @Test
    @DisplayName("A backend overrunning the limit should be interrupted and reported as TIMEOUT")
    void overrunTimesOut() throws Exception {
        CountDownLatch interrupted = new CountDownLatch(1);
        when(backend.solve(any(), any())).thenAnswer(invocation -> {
            try {
                Thread.sleep(10_000);
            } catch (InterruptedException e) {
                interrupted.countDown();
                throw e;
            }
            return null;
        });

        SolverException e = assertThrows(SolverException.class,
                () -> solver.solve(program, Duration.ofMillis(50)));

        assertEquals(SolverStatus.TIMEOUT, e.getStatus());
        assertTrue(interrupted.await(5, TimeUnit.SECONDS), "backend should be interrupted");
        verify(backend, times(1)).solve(any(), any());
    }

    @Test
    @DisplayName("Grace period should let a backend report its own timeout")
    void graceLetsBackendReport() throws SolverException {
        when(backend.solve(any(), any())).thenAnswer(invocation -> {
            Thread.sleep(150);
            throw new SolverException(SolverStatus.TIMEOUT, "own limit reached");
        });
        try (TimeBoundedSolver graceful = new TimeBoundedSolver(backend, Duration.ofSeconds(5))) {
            SolverException e = assertThrows(SolverException.class,
                    () -> graceful.solve(program, Duration.ofMillis(50)));

            assertEquals("own limit reached", e.getMessage());
        }
    }

    @Test
    @DisplayName("Negative grace period should be rejected")
    void rejectsNegativeGrace() {
        assertThrows(IllegalArgumentException.class, () -> new TimeBoundedSolver(backend, Duration.ofMillis(-1)));
    }

    @Test
    @DisplayName("Backend status should pass through unchanged")
    void passesStatusThrough() throws SolverException {
        when(backend.solve(any(), any())).thenThrow(new SolverException(SolverStatus.INFEASIBLE, "none"));

        SolverException e = assertThrows(SolverException.class, () -> solver.solve(program, Duration.ofSeconds(5)));

        assertEquals(SolverStatus.INFEASIBLE, e.getStatus());
    }

    @Test
    @DisplayName("Unexpected backend failures should be reported as ERROR")
    void wrapsRuntimeFailures() throws SolverException {
        when(backend.solve(any(), any())).thenThrow(new IllegalStateException("boom"));

        SolverException e = assertThrows(SolverException.class, () -> solver.solve(program, Duration.ofSeconds(5)));

        assertEquals(SolverStatus.ERROR, e.getStatus());
        assertInstanceOf(IllegalStateException.class, e.getCause());
    }

    @Test
    @DisplayName("The unavailable solver always reports UNAVAILABLE")
    void unavailable() {
        SolverException e = assertThrows(SolverException.class,
                () -> new UnavailableSolver().solve(program, Duration.ofSeconds(1)));
        assertEquals(SolverStatus.UNAVAILABLE, e.getStatus());
    }
}
