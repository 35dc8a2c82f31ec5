package com.trust.network.sentinel;

import com.trust.network.config.ConfigurationException;
import com.trust.network.config.OptimizationConfig;
import com.trust.network.graph.NetworkSnapshot;
import com.trust.network.logging.LogContext;
import com.trust.network.metrics.MetricsService;
import com.trust.network.metrics.NoOpMetricsService;
import com.trust.network.selection.OptimizationProblem;
import com.trust.network.selection.SelectionMethod;
import com.trust.network.selection.SelectionResult;
import com.trust.network.solver.IntegerProgram;
import com.trust.network.solver.IntegerProgramSolver;
import com.trust.network.solver.IpSolution;
import com.trust.network.solver.SolverException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Chooses sentinels by solving maximum coverage three ways.
 *
 * <ul>
 *   <li><b>Exact</b>: binary program with one selection variable per candidate and one
 *       covered variable per talent; maximize covered talents subject to at most K
 *       selections, and a talent counts only if a selected candidate covers it. The
 *       greedy answer is the warm start. If the solver is unavailable, finds no
 *       solution or runs out of time, the greedy answer is returned tagged as fallback.</li>
 *   <li><b>Greedy</b>: repeatedly take the candidate adding the most uncovered talents,
 *       lowest id on ties, until K picks or no candidate adds anything.</li>
 *   <li><b>Naive</b>: the K candidates of highest degree, lowest id on ties.</li>
 * </ul>
 *
 * <p>The selector holds no mutable state and can run concurrently with the
 * maintenance selector on the same snapshot.</p>
 */
public class SentinelSelector {
    private static final Logger log = LoggerFactory.getLogger(SentinelSelector.class);

    private final OptimizationConfig config;
    private final IntegerProgramSolver solver;
    private final MetricsService metrics;

    public SentinelSelector(OptimizationConfig config, IntegerProgramSolver solver) {
        this(config, solver, new NoOpMetricsService());
    }

    public SentinelSelector(OptimizationConfig config, IntegerProgramSolver solver, MetricsService metrics) {
        this.config = config;
        this.solver = solver;
        this.metrics = metrics != null ? metrics : new NoOpMetricsService();
    }

    /**
     * Runs all three methods on the snapshot with the configured budget and threshold.
     */
    public SentinelSelection select(NetworkSnapshot snapshot) {
        return select(CoverageInstance.from(snapshot, config.getCoverageThreshold()), config.getSentinelBudget());
    }

    /**
     * Runs all three methods on an explicit instance.
     *
     * @throws ConfigurationException if {@code budget <= 0}
     */
    public SentinelSelection select(CoverageInstance instance, int budget) {
        requirePositive(budget);
        log.info("sentinel.start candidates={} talents={} budget={}",
                instance.candidates().size(), instance.talents().size(), budget);

        SelectionResult greedy = greedy(instance, budget);
        SelectionResult exact = exact(instance, budget, greedy);
        SelectionResult naive = naive(instance, budget);

        SentinelSelection selection = new SentinelSelection(exact, greedy, naive);
        log.info("sentinel.completed exactCoverage={} provenance={} greedyCoverage={} naiveCoverage={} greedyVsOptimalPct={}",
                exact.objective(), exact.provenance(), greedy.objective(), naive.objective(),
                String.format("%.1f", selection.greedyVsOptimalPct()));
        return selection;
    }

    /**
     * Solves the coverage program exactly, falling back to greedy.
     */
    public SelectionResult exact(CoverageInstance instance, int budget) {
        requirePositive(budget);
        return exact(instance, budget, greedy(instance, budget));
    }

    private SelectionResult exact(CoverageInstance instance, int budget, SelectionResult greedy) {
        try (LogContext ignored = LogContext.forSelection(null, OptimizationProblem.SENTINEL.name(),
                SelectionMethod.EXACT.name())) {
            long started = System.nanoTime();
            IntegerProgram program = buildProgram(instance, budget, greedy.selected());
            SelectionResult result;
            try {
                IpSolution solution = solver.solve(program, config.getSolverTimeLimit());
                List<Long> selected = new ArrayList<>();
                List<Long> candidates = instance.candidates();
                for (int i = 0; i < candidates.size(); i++) {
                    if (solution.isSet(i)) {
                        selected.add(candidates.get(i));
                    }
                }
                int coverage = instance.unionSize(selected);
                result = SelectionResult.exact(selected, coverage, selected.size(), elapsedSince(started));
                log.info("sentinel.exact.solved backend={} selected={} coverage={} nodes={}",
                        solver.getName(), selected.size(), coverage, solution.nodesExplored());
            } catch (SolverException e) {
                metrics.incrementFallback(OptimizationProblem.SENTINEL, e.getStatus());
                log.warn("sentinel.fallback method=EXACT reason={} backend={} detail={}",
                        e.getStatus(), solver.getName(), e.getMessage());
                result = greedy.asFallback(e.getStatus(), elapsedSince(started).plus(greedy.runtime()));
            }
            record(result);
            return result;
        }
    }

    /**
     * Maximal-marginal-gain greedy.
     */
    public SelectionResult greedy(CoverageInstance instance, int budget) {
        requirePositive(budget);
        long started = System.nanoTime();
        Set<Long> covered = new HashSet<>();
        Set<Long> chosen = new HashSet<>();
        List<Long> picks = new ArrayList<>();

        while (picks.size() < budget) {
            long best = -1;
            int bestGain = 0;
            for (Long candidate : instance.candidates()) {
                if (chosen.contains(candidate)) {
                    continue;
                }
                int gain = 0;
                for (Long talent : instance.coverageOf(candidate)) {
                    if (!covered.contains(talent)) {
                        gain++;
                    }
                }
                if (gain > bestGain) {
                    bestGain = gain;
                    best = candidate;
                }
            }
            if (bestGain == 0) {
                break;
            }
            chosen.add(best);
            picks.add(best);
            covered.addAll(instance.coverageOf(best));
            log.debug("sentinel.greedy.pick node={} gain={} covered={}", best, bestGain, covered.size());
        }

        SelectionResult result = SelectionResult.approximate(SelectionMethod.GREEDY, picks, covered.size(),
                picks.size(), elapsedSince(started));
        record(result);
        return result;
    }

    /**
     * Top-K candidates by degree. Comparison baseline only.
     */
    public SelectionResult naive(CoverageInstance instance, int budget) {
        requirePositive(budget);
        long started = System.nanoTime();
        List<Long> picks = instance.candidates().stream()
                .sorted(Comparator.comparingInt((Long id) -> instance.degreeOf(id)).reversed()
                        .thenComparingLong(id -> id))
                .limit(budget)
                .toList();
        SelectionResult result = SelectionResult.approximate(SelectionMethod.NAIVE, picks,
                instance.unionSize(picks), picks.size(), elapsedSince(started));
        record(result);
        return result;
    }

    /**
     * Variables 0..n-1 are candidate selections in ascending id order, followed by one
     * covered variable per talent in ascending id order.
     */
    IntegerProgram buildProgram(CoverageInstance instance, int budget, List<Long> warmStart) {
        IntegerProgram.Builder builder = IntegerProgram.builder("sentinel_max_coverage");
        List<Long> candidates = instance.candidates();
        List<Long> talents = instance.talents();

        Map<Long, Integer> candidateVar = new HashMap<>();
        for (Long candidate : candidates) {
            candidateVar.put(candidate, builder.addVariable("x_" + candidate, 0.0));
        }
        Map<Long, Integer> talentVar = new HashMap<>();
        for (Long talent : talents) {
            talentVar.put(talent, builder.addVariable("y_" + talent, 1.0));
        }

        IntegerProgram.ConstraintBuilder budgetRow = builder.constraint("budget");
        candidates.forEach(c -> budgetRow.term(candidateVar.get(c), 1.0));
        budgetRow.atMost(budget);

        Map<Long, List<Long>> coveredBy = new HashMap<>();
        for (Long candidate : candidates) {
            for (Long talent : instance.coverageOf(candidate)) {
                coveredBy.computeIfAbsent(talent, k -> new ArrayList<>()).add(candidate);
            }
        }
        for (Long talent : talents) {
            IntegerProgram.ConstraintBuilder row = builder.constraint("cover_" + talent)
                    .term(talentVar.get(talent), 1.0);
            for (Long candidate : coveredBy.getOrDefault(talent, List.of())) {
                row.term(candidateVar.get(candidate), -1.0);
            }
            row.atMost(0.0);
        }

        BitSet start = new BitSet(candidates.size() + talents.size());
        for (Long candidate : warmStart) {
            Integer var = candidateVar.get(candidate);
            if (var != null) {
                start.set(var);
                for (Long talent : instance.coverageOf(candidate)) {
                    start.set(talentVar.get(talent));
                }
            }
        }
        builder.warmStart(start);
        return builder.build();
    }

    private void record(SelectionResult result) {
        metrics.recordSelectionDuration(OptimizationProblem.SENTINEL, result.method(), result.runtime());
        metrics.recordObjective(OptimizationProblem.SENTINEL, result.method(), result.objective());
    }

    private static void requirePositive(int budget) {
        if (budget <= 0) {
            throw new ConfigurationException("Sentinel budget K must be positive, was " + budget);
        }
    }

    private static Duration elapsedSince(long startedNanos) {
        return Duration.ofNanos(System.nanoTime() - startedNanos);
    }
}
