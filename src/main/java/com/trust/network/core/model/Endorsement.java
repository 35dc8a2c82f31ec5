package com.trust.network.core.model;

/**
 * One directed endorsement event: {@code sourceId} rated {@code targetId}.
 *
 * @param sourceId  the endorsing actor
 * @param targetId  the endorsed actor
 * @param weight    signed rating, within the configured rating scale
 * @param timestamp Unix epoch seconds of the event
 */
public record Endorsement(long sourceId, long targetId, double weight, long timestamp) {

    public boolean isSelfLoop() {
        return sourceId == targetId;
    }
}
