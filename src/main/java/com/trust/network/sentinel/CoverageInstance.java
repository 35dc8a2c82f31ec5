package com.trust.network.sentinel;

import com.trust.network.graph.NetworkSnapshot;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * A maximum-coverage instance: candidate sentinels, the talents each one covers,
 * and the candidate degrees used by the naive baseline.
 *
 * <p>Candidates are the nodes with a non-empty coverage set; talents are the
 * nodes covered by at least one candidate. Both are kept in ascending id order.</p>
 */
public final class CoverageInstance {

    private final Map<Long, SortedSet<Long>> coverage;
    private final Map<Long, Integer> degrees;
    private final List<Long> candidates;
    private final List<Long> talents;

    private CoverageInstance(Map<Long, SortedSet<Long>> coverage, Map<Long, Integer> degrees) {
        this.coverage = Collections.unmodifiableMap(coverage);
        this.degrees = Collections.unmodifiableMap(degrees);
        this.candidates = List.copyOf(coverage.keySet());
        SortedSet<Long> allTalents = new TreeSet<>();
        coverage.values().forEach(allTalents::addAll);
        this.talents = List.copyOf(allTalents);
    }

    /**
     * Derives the instance from a snapshot. Coverage sets come from the snapshot's memo.
     *
     * @param snapshot  the network
     * @param threshold an edge covers its target only if its weight exceeds this value
     */
    public static CoverageInstance from(NetworkSnapshot snapshot, double threshold) {
        Map<Long, SortedSet<Long>> coverage = new TreeMap<>();
        Map<Long, Integer> degrees = new TreeMap<>();
        for (Long id : snapshot.allNodeIds()) {
            SortedSet<Long> covered = snapshot.coverageSet(id, threshold);
            if (!covered.isEmpty()) {
                coverage.put(id, covered);
                degrees.put(id, snapshot.degree(id));
            }
        }
        return new CoverageInstance(coverage, degrees);
    }

    /**
     * Builds an instance from explicit coverage sets.
     *
     * @param coverage candidate id to covered talent ids; empty sets are dropped
     * @param degrees  candidate degrees for the naive baseline; missing entries count as
     *                 the coverage set size
     */
    public static CoverageInstance of(Map<Long, ? extends Set<Long>> coverage, Map<Long, Integer> degrees) {
        Map<Long, SortedSet<Long>> sorted = new TreeMap<>();
        Map<Long, Integer> degreeMap = new TreeMap<>();
        coverage.forEach((id, covered) -> {
            if (covered != null && !covered.isEmpty()) {
                sorted.put(id, Collections.unmodifiableSortedSet(new TreeSet<>(covered)));
                Integer degree = degrees != null ? degrees.get(id) : null;
                degreeMap.put(id, degree != null ? degree : covered.size());
            }
        });
        return new CoverageInstance(sorted, degreeMap);
    }

    /**
     * Candidate ids in ascending order.
     */
    public List<Long> candidates() {
        return candidates;
    }

    /**
     * Talent ids in ascending order.
     */
    public List<Long> talents() {
        return talents;
    }

    public SortedSet<Long> coverageOf(long candidate) {
        SortedSet<Long> covered = coverage.get(candidate);
        return covered != null ? covered : Collections.emptySortedSet();
    }

    public int degreeOf(long candidate) {
        return degrees.getOrDefault(candidate, 0);
    }

    /**
     * Size of the union of the given candidates' coverage sets.
     */
    public int unionSize(Iterable<Long> selected) {
        Set<Long> union = new TreeSet<>();
        for (Long id : selected) {
            union.addAll(coverageOf(id));
        }
        return union.size();
    }

    public boolean isEmpty() {
        return candidates.isEmpty();
    }
}
