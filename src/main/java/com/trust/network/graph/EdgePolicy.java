package com.trust.network.graph;

/**
 * What the network builder does with repeated endorsements between the same ordered pair.
 */
public enum EdgePolicy {

    /**
     * Every endorsement is kept as a distinct edge. Degree counts events.
     */
    RETAIN_ALL,

    /**
     * Repeated endorsements {@code source -> target} collapse into one edge carrying
     * the mean weight and the latest timestamp.
     */
    AGGREGATE_PAIRS
}
