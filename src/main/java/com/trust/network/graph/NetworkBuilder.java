package com.trust.network.graph;

import com.trust.network.core.model.Endorsement;
import com.trust.network.core.model.EndorsementRecord;
import com.trust.network.core.model.IdentityMetadata;
import com.trust.network.ingest.ProgressCallback;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Builds an immutable {@link NetworkSnapshot} from endorsement records.
 *
 * <p>Contract:</p>
 * <ul>
 *   <li>Malformed records (missing field, unparsable id, rating or timestamp,
 *       rating outside the scale, self-endorsement) are skipped and listed in the
 *       {@link BuildReport}. They never abort the build.</li>
 *   <li>Under {@link EdgePolicy#RETAIN_ALL} every valid record becomes one edge.
 *       Under {@link EdgePolicy#AGGREGATE_PAIRS} records for the same ordered pair
 *       become one edge with the mean weight and the latest timestamp.</li>
 *   <li>Edges are ordered by source, target, then timestamp, so the snapshot does
 *       not depend on input order.</li>
 *   <li>Identity metadata is attached only to nodes that appear in an edge.</li>
 * </ul>
 */
public class NetworkBuilder {
    private static final Logger log = LoggerFactory.getLogger(NetworkBuilder.class);
    private static final int PROGRESS_INTERVAL = 10_000;

    private static final Comparator<Endorsement> EDGE_ORDER = Comparator
            .comparingLong(Endorsement::sourceId)
            .thenComparingLong(Endorsement::targetId)
            .thenComparingLong(Endorsement::timestamp)
            .thenComparingDouble(Endorsement::weight);

    private final NetworkOptions options;

    public NetworkBuilder() {
        this(NetworkOptions.defaults());
    }

    public NetworkBuilder(NetworkOptions options) {
        this.options = options != null ? options : NetworkOptions.defaults();
    }

    /**
     * Builds a snapshot without identity metadata.
     */
    public NetworkSnapshot build(Iterable<EndorsementRecord> records) {
        return build(records, Map.of(), ProgressCallback.NOOP);
    }

    /**
     * Builds a snapshot and attaches identity metadata.
     *
     * @param records    endorsement rows
     * @param identities display metadata keyed by node id; may be empty
     * @param callback   optional progress callback
     * @return the immutable snapshot, carrying its build report
     */
    public NetworkSnapshot build(Iterable<EndorsementRecord> records,
                                 Map<Long, IdentityMetadata> identities,
                                 ProgressCallback callback) {
        ProgressCallback cb = callback != null ? callback : ProgressCallback.NOOP;
        List<BuildReport.SkippedRecord> skipped = new ArrayList<>();
        List<Endorsement> accepted = new ArrayList<>();
        long total = 0;

        for (EndorsementRecord record : records) {
            total++;
            try {
                accepted.add(parse(record));
            } catch (IllegalArgumentException e) {
                skipped.add(new BuildReport.SkippedRecord(record.lineNumber(), record.raw(), e.getMessage()));
                log.debug("network.record.skipped line={} reason={}", record.lineNumber(), e.getMessage());
            }
            if (total % PROGRESS_INTERVAL == 0) {
                cb.onProgress(total, -1, "Parsed " + total + " records");
            }
        }

        List<Endorsement> edges = options.getEdgePolicy() == EdgePolicy.AGGREGATE_PAIRS
                ? aggregatePairs(accepted)
                : new ArrayList<>(accepted);
        edges.sort(EDGE_ORDER);

        long referenceTime = options.getReferenceTime().orElseGet(() -> accepted.stream()
                .mapToLong(Endorsement::timestamp)
                .max()
                .orElse(0L));

        BuildReport report = new BuildReport(total, accepted.size(), skipped);
        NetworkSnapshot snapshot = new NetworkSnapshot(edges,
                identities != null ? identities : Map.of(),
                referenceTime, options.getScoreAggregation(), report);

        cb.onProgress(total, total, "Build completed");
        if (report.hasSkipped()) {
            log.warn("network.records.skipped count={} total={}", report.skippedCount(), total);
        }
        log.info("network.built nodes={} edges={} referenceTime={} report={}",
                snapshot.nodeCount(), snapshot.edgeCount(), referenceTime, report);
        return snapshot;
    }

    private Endorsement parse(EndorsementRecord record) {
        long source = parseId(record.sourceId(), "source_id");
        long target = parseId(record.targetId(), "target_id");
        double rating = parseRating(record.rating());
        long timestamp = parseTimestamp(record.timestamp());
        if (source == target) {
            throw new IllegalArgumentException("self endorsement of " + source);
        }
        return new Endorsement(source, target, rating, timestamp);
    }

    private static long parseId(String value, String field) {
        String text = require(value, field);
        try {
            return Long.parseLong(text);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid " + field + " '" + text + "'");
        }
    }

    private double parseRating(String value) {
        String text = require(value, "rating");
        double rating;
        try {
            rating = Double.parseDouble(text);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid rating '" + text + "'");
        }
        if (!Double.isFinite(rating) || !options.isWithinScale(rating)) {
            throw new IllegalArgumentException("rating " + text + " outside scale ["
                    + options.getRatingMin() + ", " + options.getRatingMax() + "]");
        }
        return rating;
    }

    private static long parseTimestamp(String value) {
        String text = require(value, "timestamp");
        try {
            return Long.parseLong(text);
        } catch (NumberFormatException e) {
            return parseFractionalTimestamp(text);
        }
    }

    private static long parseFractionalTimestamp(String text) {
        double seconds;
        try {
            seconds = Double.parseDouble(text);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("unparsable timestamp '" + text + "'");
        }
        if (!Double.isFinite(seconds)) {
            throw new IllegalArgumentException("unparsable timestamp '" + text + "'");
        }
        return (long) Math.floor(seconds);
    }

    private static String require(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("missing " + field);
        }
        return value.trim();
    }

    private static List<Endorsement> aggregatePairs(List<Endorsement> edges) {
        Map<Long, Map<Long, List<Endorsement>>> byPair = new TreeMap<>();
        for (Endorsement edge : edges) {
            byPair.computeIfAbsent(edge.sourceId(), k -> new LinkedHashMap<>())
                    .computeIfAbsent(edge.targetId(), k -> new ArrayList<>())
                    .add(edge);
        }
        List<Endorsement> aggregated = new ArrayList<>();
        byPair.forEach((source, targets) -> targets.forEach((target, events) -> {
            double meanWeight = events.stream().mapToDouble(Endorsement::weight).average().orElse(0.0);
            long latest = events.stream().mapToLong(Endorsement::timestamp).max().orElse(0L);
            aggregated.add(new Endorsement(source, target, meanWeight, latest));
        }));
        return aggregated;
    }
}
