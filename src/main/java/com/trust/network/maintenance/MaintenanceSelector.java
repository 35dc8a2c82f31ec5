package com.trust.network.maintenance;

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
import com.trust.network.solver.SolverStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Chooses dormant relationships to re-engage within a time budget (0/1 knapsack).
 *
 * <ul>
 *   <li><b>Exact</b>: one binary variable per candidate, maximize total value subject to
 *       total cost within the budget. The approximate answer is the warm start; solver
 *       failures return it tagged as fallback.</li>
 *   <li><b>Approximate</b>: candidates sorted by value/cost descending, then value
 *       descending, then id ascending, accepted while they fit. Optionally improved by
 *       a bounded number of 1-for-1 swaps.</li>
 * </ul>
 *
 * <p>No returned selection ever costs more than the budget.</p>
 */
public class MaintenanceSelector {
    private static final Logger log = LoggerFactory.getLogger(MaintenanceSelector.class);

    static final Comparator<MaintenanceCandidate> RATIO_ORDER =
            Comparator.comparingDouble(MaintenanceCandidate::ratio).reversed()
                    .thenComparing(Comparator.comparingDouble(MaintenanceCandidate::value).reversed())
                    .thenComparingLong(MaintenanceCandidate::id);

    private final OptimizationConfig config;
    private final IntegerProgramSolver solver;
    private final MetricsService metrics;
    private final MaintenanceCandidateFactory candidateFactory;

    public MaintenanceSelector(OptimizationConfig config, IntegerProgramSolver solver) {
        this(config, solver, new NoOpMetricsService());
    }

    public MaintenanceSelector(OptimizationConfig config, IntegerProgramSolver solver, MetricsService metrics) {
        this.config = config;
        this.solver = solver;
        this.metrics = metrics != null ? metrics : new NoOpMetricsService();
        this.candidateFactory = new MaintenanceCandidateFactory(config);
    }

    /**
     * Derives candidates from the snapshot and runs both methods with the configured budget.
     */
    public MaintenanceSelection select(NetworkSnapshot snapshot) {
        return select(candidateFactory.candidates(snapshot), config.getMaintenanceBudgetMinutes());
    }

    /**
     * Runs both methods on explicit candidates.
     *
     * @throws ConfigurationException if {@code budget <= 0}
     */
    public MaintenanceSelection select(List<MaintenanceCandidate> candidates, double budget) {
        requirePositive(budget);
        log.info("maintenance.start candidates={} budgetMinutes={}", candidates.size(), budget);

        SelectionResult approximate = approximate(candidates, budget);
        SelectionResult exact = exact(candidates, budget, approximate);

        log.info("maintenance.completed exactValue={} provenance={} approximateValue={} exactBudgetUsed={}",
                String.format("%.2f", exact.objective()), exact.provenance(),
                String.format("%.2f", approximate.objective()), exact.budgetUsed());
        return new MaintenanceSelection(exact, approximate, candidates);
    }

    /**
     * Solves the knapsack program exactly, falling back to the approximate method.
     */
    public SelectionResult exact(List<MaintenanceCandidate> candidates, double budget) {
        requirePositive(budget);
        return exact(candidates, budget, approximate(candidates, budget));
    }

    private SelectionResult exact(List<MaintenanceCandidate> candidates, double budget,
                                  SelectionResult approximate) {
        try (LogContext ignored = LogContext.forSelection(null, OptimizationProblem.MAINTENANCE.name(),
                SelectionMethod.EXACT.name())) {
            long started = System.nanoTime();
            List<MaintenanceCandidate> ordered = byId(candidates);
            IntegerProgram program = buildProgram(ordered, budget, approximate.selected());
            SelectionResult result;
            try {
                IpSolution solution = solver.solve(program, config.getSolverTimeLimit());
                List<Long> selected = new ArrayList<>();
                double value = 0.0;
                double cost = 0.0;
                for (int i = 0; i < ordered.size(); i++) {
                    if (solution.isSet(i)) {
                        MaintenanceCandidate candidate = ordered.get(i);
                        selected.add(candidate.id());
                        value += candidate.value();
                        cost += candidate.cost();
                    }
                }
                if (cost > budget) {
                    throw new SolverException(SolverStatus.ERROR,
                            "Solution of " + program.getName() + " costs " + cost + " over budget " + budget);
                }
                result = SelectionResult.exact(selected, value, cost, elapsedSince(started));
                log.info("maintenance.exact.solved backend={} selected={} value={} budgetUsed={} nodes={}",
                        solver.getName(), selected.size(), String.format("%.2f", value), cost,
                        solution.nodesExplored());
            } catch (SolverException e) {
                metrics.incrementFallback(OptimizationProblem.MAINTENANCE, e.getStatus());
                log.warn("maintenance.fallback method=EXACT reason={} backend={} detail={}",
                        e.getStatus(), solver.getName(), e.getMessage());
                result = approximate.asFallback(e.getStatus(), elapsedSince(started).plus(approximate.runtime()));
            }
            record(result);
            return result;
        }
    }

    /**
     * Ratio greedy, followed by the configured number of swap rounds.
     */
    public SelectionResult approximate(List<MaintenanceCandidate> candidates, double budget) {
        requirePositive(budget);
        long started = System.nanoTime();
        List<MaintenanceCandidate> ordered = new ArrayList<>(candidates);
        ordered.sort(RATIO_ORDER);

        List<MaintenanceCandidate> selected = new ArrayList<>();
        double used = 0.0;
        for (MaintenanceCandidate candidate : ordered) {
            if (candidate.value() > 0 && used + candidate.cost() <= budget) {
                selected.add(candidate);
                used += candidate.cost();
            }
        }

        if (config.getLocalSwapIterations() > 0) {
            selected = improveBySwaps(selected, ordered, budget, config.getLocalSwapIterations());
        }

        double value = selected.stream().mapToDouble(MaintenanceCandidate::value).sum();
        double cost = selected.stream().mapToDouble(MaintenanceCandidate::cost).sum();
        List<Long> ids = selected.stream().map(MaintenanceCandidate::id).toList();
        SelectionResult result = SelectionResult.approximate(SelectionMethod.APPROXIMATE, ids, value, cost,
                elapsedSince(started));
        record(result);
        return result;
    }

    /**
     * Repeatedly applies the best value-improving exchange of one selected candidate for
     * one unselected candidate that still fits, then refills leftover budget in ratio order.
     * Stops after {@code maxRounds} exchanges or when no exchange improves the value.
     */
    List<MaintenanceCandidate> improveBySwaps(List<MaintenanceCandidate> initial, List<MaintenanceCandidate> ratioOrdered,
                                              double budget, int maxRounds) {
        List<MaintenanceCandidate> selected = new ArrayList<>(initial);
        Set<Long> chosen = new HashSet<>();
        selected.forEach(c -> chosen.add(c.id()));
        double used = selected.stream().mapToDouble(MaintenanceCandidate::cost).sum();

        for (int round = 0; round < maxRounds; round++) {
            int outIndex = -1;
            MaintenanceCandidate in = null;
            double bestGain = 0.0;
            for (int i = 0; i < selected.size(); i++) {
                MaintenanceCandidate out = selected.get(i);
                for (MaintenanceCandidate candidate : ratioOrdered) {
                    if (chosen.contains(candidate.id())) {
                        continue;
                    }
                    double gain = candidate.value() - out.value();
                    if (gain > bestGain && used - out.cost() + candidate.cost() <= budget) {
                        bestGain = gain;
                        outIndex = i;
                        in = candidate;
                    }
                }
            }
            if (in == null) {
                break;
            }
            MaintenanceCandidate out = selected.get(outIndex);
            selected.set(outIndex, in);
            chosen.remove(out.id());
            chosen.add(in.id());
            used += in.cost() - out.cost();
            log.debug("maintenance.swap round={} out={} in={} gain={}", round + 1, out.id(), in.id(), bestGain);

            for (MaintenanceCandidate candidate : ratioOrdered) {
                if (!chosen.contains(candidate.id()) && candidate.value() > 0 && used + candidate.cost() <= budget) {
                    selected.add(candidate);
                    chosen.add(candidate.id());
                    used += candidate.cost();
                }
            }
        }
        return selected;
    }

    /**
     * One variable per candidate in ascending id order and a single budget row.
     */
    IntegerProgram buildProgram(List<MaintenanceCandidate> orderedById, double budget, List<Long> warmStart) {
        IntegerProgram.Builder builder = IntegerProgram.builder("maintenance_knapsack");
        IntegerProgram.ConstraintBuilder budgetRow = builder.constraint("time_budget");
        Set<Long> start = new HashSet<>(warmStart);
        BitSet ones = new BitSet(orderedById.size());
        for (MaintenanceCandidate candidate : orderedById) {
            int var = builder.addVariable("x_" + candidate.id(), candidate.value());
            budgetRow.term(var, candidate.cost());
            if (start.contains(candidate.id())) {
                ones.set(var);
            }
        }
        budgetRow.atMost(budget);
        builder.warmStart(ones);
        return builder.build();
    }

    private static List<MaintenanceCandidate> byId(List<MaintenanceCandidate> candidates) {
        List<MaintenanceCandidate> ordered = new ArrayList<>(candidates);
        ordered.sort(Comparator.comparingLong(MaintenanceCandidate::id));
        return ordered;
    }

    private void record(SelectionResult result) {
        metrics.recordSelectionDuration(OptimizationProblem.MAINTENANCE, result.method(), result.runtime());
        metrics.recordObjective(OptimizationProblem.MAINTENANCE, result.method(), result.objective());
    }

    private static void requirePositive(double budget) {
        if (!(budget > 0.0)) {
            throw new ConfigurationException("Maintenance budget T must be positive, was " + budget);
        }
    }

    private static Duration elapsedSince(long startedNanos) {
        return Duration.ofNanos(System.nanoTime() - startedNanos);
    }
}
