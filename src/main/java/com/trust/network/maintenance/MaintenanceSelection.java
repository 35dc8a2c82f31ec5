package com.trust.network.maintenance;

import com.trust.network.selection.SelectionResult;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Exact and approximate maintenance selections over the same candidates.
 */
public final class MaintenanceSelection {

    private final SelectionResult exact;
    private final SelectionResult approximate;
    private final Map<Long, MaintenanceCandidate> candidates;

    public MaintenanceSelection(SelectionResult exact, SelectionResult approximate,
                                List<MaintenanceCandidate> candidates) {
        this.exact = exact;
        this.approximate = approximate;
        Map<Long, MaintenanceCandidate> byId = new LinkedHashMap<>();
        candidates.forEach(c -> byId.put(c.id(), c));
        this.candidates = Collections.unmodifiableMap(byId);
    }

    /**
     * Integer-program selection, or the approximate answer tagged as fallback.
     */
    public SelectionResult exact() {
        return exact;
    }

    public SelectionResult approximate() {
        return approximate;
    }

    public List<MaintenanceCandidate> candidates() {
        return List.copyOf(candidates.values());
    }

    public Optional<MaintenanceCandidate> candidate(long id) {
        return Optional.ofNullable(candidates.get(id));
    }

    /**
     * The candidates behind a result, in the result's order.
     */
    public List<MaintenanceCandidate> selectedCandidates(SelectionResult result) {
        List<MaintenanceCandidate> selected = new ArrayList<>(result.size());
        for (Long id : result.selected()) {
            MaintenanceCandidate candidate = candidates.get(id);
            if (candidate == null) {
                throw new IllegalStateException("Selected node " + id + " is not a maintenance candidate");
            }
            selected.add(candidate);
        }
        return selected;
    }

    public double totalValue(SelectionResult result) {
        return result.objective();
    }

    public double budgetUsed(SelectionResult result) {
        return result.budgetUsed();
    }

    /**
     * Mean days dormant over a result's nodes; 0 for an empty selection.
     */
    public double avgDaysDormant(SelectionResult result) {
        return selectedCandidates(result).stream()
                .mapToLong(MaintenanceCandidate::daysDormant)
                .average()
                .orElse(0.0);
    }

    @Override
    public String toString() {
        return "MaintenanceSelection{candidates=" + candidates.size() +
                ", exact=" + exact +
                ", approximate=" + approximate + '}';
    }
}
