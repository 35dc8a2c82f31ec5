package com.trust.network.graph;

import java.util.OptionalLong;

/**
 * Options for building a network snapshot.
 */
public class NetworkOptions {

    private static final int DEFAULT_RATING_MIN = -10;
    private static final int DEFAULT_RATING_MAX = 10;

    private final double ratingMin;
    private final double ratingMax;
    private final EdgePolicy edgePolicy;
    private final ScoreAggregation scoreAggregation;
    private final OptionalLong referenceTime;

    private NetworkOptions(Builder builder) {
        this.ratingMin = builder.ratingMin;
        this.ratingMax = builder.ratingMax;
        this.edgePolicy = builder.edgePolicy;
        this.scoreAggregation = builder.scoreAggregation;
        this.referenceTime = builder.referenceTime;
    }

    public double getRatingMin() {
        return ratingMin;
    }

    public double getRatingMax() {
        return ratingMax;
    }

    public EdgePolicy getEdgePolicy() {
        return edgePolicy;
    }

    public ScoreAggregation getScoreAggregation() {
        return scoreAggregation;
    }

    /**
     * The time dormancy is measured against. Empty means "latest valid record timestamp".
     */
    public OptionalLong getReferenceTime() {
        return referenceTime;
    }

    public boolean isWithinScale(double rating) {
        return rating >= ratingMin && rating <= ratingMax;
    }

    /**
     * Defaults: rating scale [-10, +10], all events retained, mean score, reference time from data.
     */
    public static NetworkOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private double ratingMin = DEFAULT_RATING_MIN;
        private double ratingMax = DEFAULT_RATING_MAX;
        private EdgePolicy edgePolicy = EdgePolicy.RETAIN_ALL;
        private ScoreAggregation scoreAggregation = ScoreAggregation.MEAN;
        private OptionalLong referenceTime = OptionalLong.empty();

        public Builder ratingScale(double min, double max) {
            if (Double.isNaN(min) || Double.isNaN(max) || min > max) {
                throw new IllegalArgumentException("rating scale must satisfy min <= max");
            }
            this.ratingMin = min;
            this.ratingMax = max;
            return this;
        }

        public Builder edgePolicy(EdgePolicy edgePolicy) {
            this.edgePolicy = edgePolicy;
            return this;
        }

        public Builder scoreAggregation(ScoreAggregation scoreAggregation) {
            this.scoreAggregation = scoreAggregation;
            return this;
        }

        public Builder referenceTime(long epochSeconds) {
            this.referenceTime = OptionalLong.of(epochSeconds);
            return this;
        }

        public NetworkOptions build() {
            if (edgePolicy == null || scoreAggregation == null) {
                throw new IllegalArgumentException("edgePolicy and scoreAggregation are required");
            }
            return new NetworkOptions(this);
        }
    }

    @Override
    public String toString() {
        return "NetworkOptions{" +
                "ratingScale=[" + ratingMin + ", " + ratingMax + "]" +
                ", edgePolicy=" + edgePolicy +
                ", scoreAggregation=" + scoreAggregation +
                ", referenceTime=" + referenceTime +
                '}';
    }
}
