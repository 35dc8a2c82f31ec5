package com.trust.network.config;

/**
 * How the urgency of re-engaging a contact changes with dormancy.
 * The urgency multiplies the contact's network value in the maintenance problem.
 */
public enum DormancyModel {

    /**
     * Concave growth: {@code ln(days + 1)}. Older relationships are more urgent,
     * with diminishing returns.
     */
    LOGARITHMIC,

    /**
     * Exponential decay: {@code exp(-lambda * days)}. Relationships lose value
     * the longer they stay dormant.
     */
    EXPONENTIAL_DECAY,

    /**
     * Linear growth: {@code days}.
     */
    LINEAR_GROWTH,

    /**
     * Dormancy does not affect value.
     */
    NONE;

    /**
     * Computes the urgency multiplier for a dormancy.
     *
     * @param days   days since last contact (non-negative)
     * @param lambda decay rate, used by {@link #EXPONENTIAL_DECAY} only
     * @return the urgency multiplier (non-negative)
     */
    public double urgency(long days, double lambda) {
        long t = Math.max(0, days);
        return switch (this) {
            case LOGARITHMIC -> Math.log(t + 1.0);
            case EXPONENTIAL_DECAY -> Math.exp(-lambda * t);
            case LINEAR_GROWTH -> t;
            case NONE -> 1.0;
        };
    }
}
