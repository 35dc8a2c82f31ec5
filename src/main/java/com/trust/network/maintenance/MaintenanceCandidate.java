package com.trust.network.maintenance;

/**
 * A dormant relationship that may be re-engaged.
 *
 * @param id          node id
 * @param value       re-engagement value
 * @param cost        minutes needed to re-engage; strictly positive
 * @param daysDormant whole days since last contact
 * @param degree      incident edges in the full network
 * @param talentScore aggregate score of the node
 */
public record MaintenanceCandidate(long id, double value, double cost, long daysDormant, int degree,
                                   double talentScore) {

    public MaintenanceCandidate {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException("value of candidate " + id + " must be finite");
        }
        if (!Double.isFinite(cost) || cost <= 0) {
            throw new IllegalArgumentException("cost of candidate " + id + " must be positive, was " + cost);
        }
        if (daysDormant < 0 || degree < 0) {
            throw new IllegalArgumentException("dormancy and degree of candidate " + id + " cannot be negative");
        }
    }

    /**
     * A candidate supplied directly, without network context.
     */
    public static MaintenanceCandidate of(long id, double value, double cost) {
        return new MaintenanceCandidate(id, value, cost, 0L, 0, 0.0);
    }

    public double ratio() {
        return value / cost;
    }
}
