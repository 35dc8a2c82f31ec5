package com.trust.network.config;

/**
 * Which sentinel selection drives the node {@code group} tag in the visualization export.
 */
public enum SentinelGroupSource {
    EXACT("sentinel_ip"),
    GREEDY("sentinel_greedy");

    private final String groupTag;

    SentinelGroupSource(String groupTag) {
        this.groupTag = groupTag;
    }

    public String groupTag() {
        return groupTag;
    }
}
