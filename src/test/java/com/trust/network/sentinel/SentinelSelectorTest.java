package com.trust.network.sentinel;

import com.trust.network.config.ConfigurationException;
import com.trust.network.config.OptimizationConfig;
import com.trust.network.core.model.EndorsementRecord;
import com.trust.network.graph.NetworkBuilder;
import com.trust.network.graph.NetworkSnapshot;
import com.trust.network.metrics.MetricsService;
import com.trust.network.selection.OptimizationProblem;
import com.trust.network.selection.Provenance;
import com.trust.network.selection.SelectionMethod;
import com.trust.network.selection.SelectionResult;
import com.trust.network.solver.IntegerProgram;
import com.trust.network.solver.OrToolsMipSolver;
import com.trust.network.solver.IntegerProgramSolver;
import com.trust.network.solver.SolverException;
import com.trust.network.solver.SolverStatus;
import com.trust.network.solver.UnavailableSolver;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.TreeSet;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SentinelSelectorTest {

    private static final OptimizationConfig CONFIG = OptimizationConfig.builder()
            .solverTimeLimit(Duration.ofSeconds(30))
            .build();

    @Mock
    private MetricsService metrics;

    /**
     * Greedy takes 1 first and then can add only one more talent; the optimum is {2, 3}.
     * Candidate 4 has the highest degree but covers a single talent.
     */
    private static CoverageInstance greedyTrap() {
        Map<Long, Set<Long>> coverage = new HashMap<>();
        coverage.put(1L, Set.of(10L, 11L, 12L, 13L));
        coverage.put(2L, Set.of(10L, 11L, 14L));
        coverage.put(3L, Set.of(12L, 13L, 15L));
        coverage.put(4L, Set.of(10L));
        return CoverageInstance.of(coverage, Map.of(1L, 4, 2L, 3, 3L, 3, 4L, 10));
    }

    @Nested
    @DisplayName("Worked example")
    class WorkedExample {

        @Test
        @DisplayName("A->B(+5), A->C(+6), B->C(+3) with K=1 and threshold 1 selects A covering 2")
        void threeNodeExample() {
            NetworkSnapshot snapshot = new NetworkBuilder().build(List.of(
                    EndorsementRecord.of(1, 2, 5, 0),
                    EndorsementRecord.of(1, 3, 6, 0),
                    EndorsementRecord.of(2, 3, 3, 100)));
            OptimizationConfig config = OptimizationConfig.builder()
                    .sentinelBudget(1)
                    .coverageThreshold(1)
                    .solverTimeLimit(Duration.ofSeconds(30))
                    .build();

            SentinelSelection selection = new SentinelSelector(config, new OrToolsMipSolver()).select(snapshot);

            assertEquals(List.of(1L), selection.exact().selected());
            assertEquals(2.0, selection.exact().objective());
            assertEquals(Provenance.EXACT, selection.exact().provenance());
            assertEquals(List.of(1L), selection.greedy().selected());
            assertEquals(2.0, selection.greedy().objective());
        }
    }

    @Nested
    @DisplayName("Methods")
    class Methods {

        private final SentinelSelector selector = new SentinelSelector(CONFIG, new OrToolsMipSolver());

        @Test
        @DisplayName("Exact should find the optimum greedy misses")
        void exactBeatsGreedy() {
            SentinelSelection selection = selector.select(greedyTrap(), 2);

            assertEquals(List.of(2L, 3L), selection.exact().selected());
            assertEquals(6.0, selection.exact().objective());
            assertEquals(List.of(1L, 2L), selection.greedy().selected());
            assertEquals(5.0, selection.greedy().objective());
            assertEquals(List.of(4L, 1L), selection.naive().selected());
            assertEquals(4.0, selection.naive().objective());
        }

        @Test
        @DisplayName("Greedy should break gain ties by lowest id")
        void greedyTieBreak() {
            CoverageInstance instance = CoverageInstance.of(
                    Map.of(5L, Set.of(1L, 2L), 3L, Set.of(7L, 8L)), Map.of());

            SelectionResult greedy = selector.greedy(instance, 1);

            assertEquals(List.of(3L), greedy.selected());
        }

        @Test
        @DisplayName("Greedy should stop when no candidate adds coverage")
        void greedyStopsWithoutGain() {
            CoverageInstance instance = CoverageInstance.of(
                    Map.of(1L, Set.of(9L), 2L, Set.of(9L)), Map.of());

            SelectionResult greedy = selector.greedy(instance, 5);

            assertEquals(List.of(1L), greedy.selected());
            assertEquals(1.0, greedy.budgetUsed());
        }

        @Test
        @DisplayName("Naive should break degree ties by lowest id")
        void naiveTieBreak() {
            CoverageInstance instance = CoverageInstance.of(
                    Map.of(8L, Set.of(1L), 6L, Set.of(2L), 7L, Set.of(3L)), Map.of(8L, 2, 6L, 2, 7L, 5));

            assertEquals(List.of(7L, 6L), selector.naive(instance, 2).selected());
        }

        @Test
        @DisplayName("Empty instance should give empty selections")
        void emptyInstance() {
            SentinelSelection selection = selector.select(CoverageInstance.of(Map.of(), Map.of()), 3);

            assertTrue(selection.exact().selected().isEmpty());
            assertEquals(0.0, selection.exact().objective());
            assertTrue(selection.greedy().selected().isEmpty());
        }

        @ParameterizedTest
        @ValueSource(ints = {0, -2})
        @DisplayName("Non-positive budget should be a configuration error")
        void rejectsNonPositiveBudget(int k) {
            assertThrows(ConfigurationException.class, () -> selector.select(greedyTrap(), k));
            assertThrows(ConfigurationException.class, () -> selector.greedy(greedyTrap(), k));
            assertThrows(ConfigurationException.class, () -> selector.naive(greedyTrap(), k));
        }
    }

    @Nested
    @DisplayName("Guarantees on random instances")
    class Guarantees {

        @Test
        @DisplayName("exact >= greedy >= (1 - 1/e) * exact, and every method stays within K")
        void ordering() {
            SentinelSelector selector = new SentinelSelector(CONFIG, new OrToolsMipSolver());
            Random random = new Random(11);
            double bound = 1.0 - 1.0 / Math.E;
            for (int round = 0; round < 15; round++) {
                CoverageInstance instance = randomInstance(random, 10, 25, 6);
                int k = 1 + random.nextInt(4);

                SentinelSelection selection = selector.select(instance, k);

                assertEquals(Provenance.EXACT, selection.exact().provenance(), "round " + round);
                assertTrue(selection.exact().objective() >= selection.greedy().objective(), "round " + round);
                assertTrue(selection.greedy().objective() >= bound * selection.exact().objective() - 1e-9,
                        "round " + round);
                assertTrue(selection.exact().size() <= k);
                assertTrue(selection.greedy().size() <= k);
                assertTrue(selection.naive().size() <= k);
                assertEquals(instance.unionSize(selection.exact().selected()), selection.exact().objective());
            }
        }

        @Test
        @DisplayName("Exact should stay optimal on a few hundred candidates")
        void exactAtScale() {
            SentinelSelector selector = new SentinelSelector(CONFIG, new OrToolsMipSolver());
            CoverageInstance instance = randomInstance(new Random(2024), 300, 600, 12);

            SentinelSelection selection = selector.select(instance, 10);

            assertEquals(Provenance.EXACT, selection.exact().provenance());
            assertEquals(10, selection.exact().size());
            assertTrue(selection.exact().objective() >= selection.greedy().objective());
            assertTrue(selection.exact().objective() >= selection.naive().objective());
            assertEquals(instance.unionSize(selection.exact().selected()), selection.exact().objective());
        }

        private CoverageInstance randomInstance(Random random, int candidates, int talents, int maxCovered) {
            Map<Long, Set<Long>> coverage = new HashMap<>();
            for (long c = 1; c <= candidates; c++) {
                Set<Long> covered = new TreeSet<>();
                int size = 1 + random.nextInt(maxCovered);
                for (int i = 0; i < size; i++) {
                    covered.add(100L + random.nextInt(talents));
                }
                coverage.put(c, covered);
            }
            return CoverageInstance.of(coverage, Map.of());
        }

        @Test
        @DisplayName("Repeated runs should produce identical selections")
        void idempotent() {
            SentinelSelector selector = new SentinelSelector(CONFIG, new OrToolsMipSolver());

            SentinelSelection first = selector.select(greedyTrap(), 2);
            SentinelSelection second = selector.select(greedyTrap(), 2);

            assertEquals(first.exact().selected(), second.exact().selected());
            assertEquals(first.greedy().selected(), second.greedy().selected());
            assertEquals(first.naive().selected(), second.naive().selected());
        }
    }

    @Nested
    @DisplayName("Fallback")
    class Fallback {

        @Test
        @DisplayName("Zero time limit should fall back to greedy and mark the result, never throw")
        void zeroTimeLimit() {
            OptimizationConfig config = OptimizationConfig.builder().solverTimeLimit(Duration.ZERO).build();
            SentinelSelector selector = new SentinelSelector(config, new OrToolsMipSolver(), metrics);

            SentinelSelection selection = assertDoesNotThrow(() -> selector.select(greedyTrap(), 2));

            SelectionResult exact = selection.exact();
            assertTrue(exact.isFallback());
            assertEquals(SelectionMethod.EXACT, exact.method());
            assertEquals(SolverStatus.TIMEOUT, exact.fallbackReason().orElseThrow());
            assertEquals(selection.greedy().selected(), exact.selected());
            assertEquals(selection.greedy().objective(), exact.objective());
            verify(metrics).incrementFallback(OptimizationProblem.SENTINEL, SolverStatus.TIMEOUT);
        }

        @Test
        @DisplayName("Unavailable backend should leave the core working on greedy")
        void unavailableBackend() {
            SentinelSelector selector = new SentinelSelector(CONFIG, new UnavailableSolver());

            SelectionResult exact = selector.exact(greedyTrap(), 2);

            assertEquals(Provenance.FALLBACK, exact.provenance());
            assertEquals(SolverStatus.UNAVAILABLE, exact.fallbackReason().orElseThrow());
            assertEquals(List.of(1L, 2L), exact.selected());
        }

        @Test
        @DisplayName("Solver should be called once with the configured limit and never retried")
        void singleAttempt() throws SolverException {
            IntegerProgramSolver solver = mock(IntegerProgramSolver.class);
            when(solver.solve(any(IntegerProgram.class), any(Duration.class)))
                    .thenThrow(new SolverException(SolverStatus.INFEASIBLE, "no solution"));
            SentinelSelector selector = new SentinelSelector(CONFIG, solver, metrics);

            SelectionResult exact = selector.exact(greedyTrap(), 2);

            assertTrue(exact.isFallback());
            verify(solver, times(1)).solve(any(IntegerProgram.class), eq(CONFIG.getSolverTimeLimit()));
            verify(metrics).incrementFallback(OptimizationProblem.SENTINEL, SolverStatus.INFEASIBLE);
        }
    }

    @Test
    @DisplayName("Program should declare candidate variables first and warm start from greedy")
    void programLayout() {
        SentinelSelector selector = new SentinelSelector(CONFIG, new OrToolsMipSolver());
        CoverageInstance instance = greedyTrap();

        IntegerProgram program = selector.buildProgram(instance, 2, List.of(1L, 2L));

        assertEquals(4 + 6, program.variableCount());
        assertEquals("x_1", program.variableName(0));
        assertEquals("y_10", program.variableName(4));
        assertEquals(1 + 6, program.getConstraints().size());
        assertTrue(program.isFeasible(program.getWarmStart().orElseThrow(), 1e-9));
        assertEquals(5.0, program.evaluate(program.getWarmStart().orElseThrow()));
    }

    @Test
    @DisplayName("Comparison figures should be derived from the three results")
    void comparisonFigures() {
        SentinelSelection selection = new SentinelSelector(CONFIG, new OrToolsMipSolver())
                .select(greedyTrap(), 2);

        assertEquals(5.0 / 6.0 * 100.0, selection.greedyVsOptimalPct(), 1e-9);
        assertEquals(4.0 / 6.0 * 100.0, selection.naiveVsOptimalPct(), 1e-9);
        assertEquals(50.0, selection.exactImprovementOverNaivePct(), 1e-9);
    }
}
