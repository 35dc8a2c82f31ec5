package com.trust.network.graph;

/**
 * How incoming endorsement weights combine into a node's talent score.
 */
public enum ScoreAggregation {

    /**
     * Mean rating received. Stays within the rating scale.
     */
    MEAN,

    /**
     * Sum of ratings received.
     */
    SUM
}
