package com.trust.network.config;

/**
 * How the effort (in minutes) to re-engage a contact is estimated.
 */
public enum CostModel {

    /**
     * Every contact costs the same fixed number of minutes.
     */
    FIXED,

    /**
     * Fixed minutes times {@code ceil(sqrt(degree))}: deeper relationships take longer.
     */
    DEGREE_PROPORTIONAL,

    /**
     * Uniform integer in a configured range, drawn per node in ascending id order
     * from a seeded generator.
     */
    SEEDED_RANDOM
}
