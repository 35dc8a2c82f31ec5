package com.trust.network.graph;

import java.util.List;

/**
 * Outcome of building a network snapshot from endorsement records.
 *
 * @param totalRecords   number of records offered to the builder
 * @param acceptedEdges  number of records that became (or were folded into) edges
 * @param skipped        the malformed records that were skipped
 */
public record BuildReport(long totalRecords, long acceptedEdges, List<SkippedRecord> skipped) {

    public BuildReport {
        skipped = skipped != null ? List.copyOf(skipped) : List.of();
    }

    public long skippedCount() {
        return skipped.size();
    }

    public boolean hasSkipped() {
        return !skipped.isEmpty();
    }

    /**
     * A record rejected by the builder.
     *
     * @param lineNumber line in the input (1-based), 0 if unknown
     * @param raw        the record text
     * @param reason     why it was skipped
     */
    public record SkippedRecord(long lineNumber, String raw, String reason) {}

    @Override
    public String toString() {
        return "BuildReport{total=" + totalRecords +
                ", accepted=" + acceptedEdges +
                ", skipped=" + skipped.size() + '}';
    }
}
