package com.trust.network.core.model;

/**
 * An unvalidated endorsement row as read from the tabular input.
 * Fields are kept as text so the network builder can decide what is malformed.
 *
 * @param lineNumber the 1-based line in the source, or 0 when not read from a file
 * @param sourceId   source actor id text
 * @param targetId   target actor id text
 * @param rating     signed rating text
 * @param timestamp  Unix epoch seconds text
 */
public record EndorsementRecord(long lineNumber, String sourceId, String targetId, String rating, String timestamp) {

    /**
     * Creates a record from already-typed values.
     */
    public static EndorsementRecord of(long sourceId, long targetId, int rating, long timestamp) {
        return new EndorsementRecord(0, Long.toString(sourceId), Long.toString(targetId),
                Integer.toString(rating), Long.toString(timestamp));
    }

    /**
     * Returns the record as a comma-joined line, for error reports.
     */
    public String raw() {
        return sourceId + "," + targetId + "," + rating + "," + timestamp;
    }
}
