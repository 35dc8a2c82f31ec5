package com.trust.network.graph;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import com.trust.network.core.model.Endorsement;
import com.trust.network.core.model.IdentityMetadata;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Immutable in-memory snapshot of the endorsement network.
 *
 * <p>All derived metrics are pure functions of the edges and the reference time.
 * Coverage sets are memoized per (node, threshold) pair for the lifetime of the
 * snapshot; the memo is safe for concurrent readers.</p>
 */
public final class NetworkSnapshot {

    private static final long SECONDS_PER_DAY = 86_400L;

    private final List<Endorsement> edges;
    private final List<Long> nodeIds;
    private final Map<Long, NodeStats> stats;
    private final Map<Long, IdentityMetadata> identities;
    private final long referenceTime;
    private final BuildReport buildReport;
    private final Cache<CoverageKey, SortedSet<Long>> coverageCache;

    NetworkSnapshot(List<Endorsement> edges,
                    Map<Long, IdentityMetadata> identities,
                    long referenceTime,
                    ScoreAggregation scoreAggregation,
                    BuildReport buildReport) {
        this.edges = List.copyOf(edges);
        this.referenceTime = referenceTime;
        this.buildReport = buildReport;
        this.coverageCache = Caffeine.newBuilder().recordStats().build();

        Map<Long, NodeStats.Accumulator> acc = new TreeMap<>();
        for (Endorsement edge : this.edges) {
            acc.computeIfAbsent(edge.sourceId(), NodeStats.Accumulator::new).outgoing(edge);
            acc.computeIfAbsent(edge.targetId(), NodeStats.Accumulator::new).incoming(edge);
        }
        Map<Long, NodeStats> built = new HashMap<>();
        acc.forEach((id, a) -> built.put(id, a.finish(scoreAggregation)));
        this.stats = Collections.unmodifiableMap(built);
        this.nodeIds = List.copyOf(acc.keySet());

        Map<Long, IdentityMetadata> attached = new HashMap<>();
        identities.forEach((id, meta) -> {
            if (stats.containsKey(id) && meta != null) {
                attached.put(id, meta);
            }
        });
        this.identities = Collections.unmodifiableMap(attached);
    }

    /**
     * All node ids in ascending order.
     */
    public List<Long> allNodeIds() {
        return nodeIds;
    }

    /**
     * All edges ordered by source, target, timestamp.
     */
    public List<Endorsement> edges() {
        return edges;
    }

    public int nodeCount() {
        return nodeIds.size();
    }

    public int edgeCount() {
        return edges.size();
    }

    public boolean contains(long nodeId) {
        return stats.containsKey(nodeId);
    }

    /**
     * Number of incident edges (incoming plus outgoing).
     */
    public int degree(long nodeId) {
        NodeStats s = require(nodeId);
        return s.inDegree() + s.outDegree();
    }

    public int inDegree(long nodeId) {
        return require(nodeId).inDegree();
    }

    public int outDegree(long nodeId) {
        return require(nodeId).outDegree();
    }

    /**
     * Aggregate talent/trust score from incoming endorsement weights; 0 when none were received.
     */
    public double score(long nodeId) {
        return require(nodeId).score();
    }

    /**
     * Timestamp of the latest edge touching the node, in either direction.
     */
    public long lastContact(long nodeId) {
        return require(nodeId).lastContact();
    }

    /**
     * Time since last contact, measured against the given reference. Never negative.
     */
    public Duration dormancy(long nodeId, long referenceTime) {
        return Duration.ofSeconds(Math.max(0L, referenceTime - require(nodeId).lastContact()));
    }

    /**
     * Whole days since last contact against the snapshot's reference time, at least 1.
     */
    public long dormantDays(long nodeId) {
        return Math.max(1L, dormancy(nodeId, referenceTime).getSeconds() / SECONDS_PER_DAY);
    }

    /**
     * The reference time dormancy is measured against by default.
     */
    public long referenceTime() {
        return referenceTime;
    }

    /**
     * Distinct nodes reached by an outgoing edge whose weight exceeds {@code threshold}.
     * Memoized per (node, threshold).
     *
     * @return an unmodifiable set in ascending id order
     */
    public SortedSet<Long> coverageSet(long nodeId, double threshold) {
        NodeStats s = require(nodeId);
        return coverageCache.get(new CoverageKey(nodeId, threshold), key -> {
            TreeSet<Long> covered = new TreeSet<>();
            for (Endorsement edge : s.outgoing()) {
                if (edge.weight() > threshold) {
                    covered.add(edge.targetId());
                }
            }
            return Collections.unmodifiableSortedSet(covered);
        });
    }

    /**
     * Distinct neighbours in either direction, in ascending id order.
     */
    public SortedSet<Long> neighbors(long nodeId) {
        return require(nodeId).neighbors();
    }

    public Optional<IdentityMetadata> identity(long nodeId) {
        require(nodeId);
        return Optional.ofNullable(identities.get(nodeId));
    }

    public BuildReport buildReport() {
        return buildReport;
    }

    /**
     * Coverage memo statistics: hits, misses and the number of memoized sets.
     */
    public CacheStats coverageCacheStats() {
        return coverageCache.stats();
    }

    public long coverageCacheSize() {
        return coverageCache.estimatedSize();
    }

    private NodeStats require(long nodeId) {
        NodeStats s = stats.get(nodeId);
        if (s == null) {
            throw new IllegalArgumentException("Unknown node id " + nodeId);
        }
        return s;
    }

    @Override
    public String toString() {
        return "NetworkSnapshot{nodes=" + nodeIds.size() +
                ", edges=" + edges.size() +
                ", referenceTime=" + referenceTime + '}';
    }

    record CoverageKey(long nodeId, double threshold) {}

    /**
     * Per-node derived metrics, computed once at construction.
     */
    private record NodeStats(int inDegree, int outDegree, double score, long lastContact,
                             List<Endorsement> outgoing, SortedSet<Long> neighbors) {

        static final class Accumulator {
            private final long nodeId;
            private final List<Endorsement> outgoing = new ArrayList<>();
            private final TreeSet<Long> neighbors = new TreeSet<>();
            private int inDegree;
            private double weightSum;
            private long lastContact = Long.MIN_VALUE;

            Accumulator(long nodeId) {
                this.nodeId = nodeId;
            }

            void outgoing(Endorsement edge) {
                outgoing.add(edge);
                neighbors.add(edge.targetId());
                lastContact = Math.max(lastContact, edge.timestamp());
            }

            void incoming(Endorsement edge) {
                inDegree++;
                weightSum += edge.weight();
                neighbors.add(edge.sourceId());
                lastContact = Math.max(lastContact, edge.timestamp());
            }

            NodeStats finish(ScoreAggregation aggregation) {
                double score;
                if (inDegree == 0) {
                    score = 0.0;
                } else if (aggregation == ScoreAggregation.SUM) {
                    score = weightSum;
                } else {
                    score = weightSum / inDegree;
                }
                neighbors.remove(nodeId);
                return new NodeStats(inDegree, outgoing.size(), score, lastContact,
                        List.copyOf(outgoing), Collections.unmodifiableSortedSet(neighbors));
            }
        }
    }
}
