package com.trust.network.export;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * {@code sentinel_results.json}: the three sentinel selections and how they compare.
 */
@JsonPropertyOrder({"ip", "greedy", "naive", "comparison"})
public record SentinelResultsDocument(Method ip, Method greedy, Method naive, Comparison comparison) {

    /**
     * @param runtime        seconds
     * @param provenance     {@code exact}, {@code approximate} or {@code fallback}
     * @param fallbackReason solver status behind a fallback, omitted otherwise
     */
    @JsonPropertyOrder({"sentinels", "coverage", "runtime", "provenance", "fallback_reason"})
    public record Method(
            List<Long> sentinels,
            double coverage,
            double runtime,
            String provenance,
            @JsonProperty("fallback_reason") @JsonInclude(JsonInclude.Include.NON_NULL) String fallbackReason
    ) {
        public Method {
            sentinels = List.copyOf(sentinels);
        }
    }

    @JsonPropertyOrder({"greedy_vs_optimal_pct", "naive_vs_optimal_pct", "ip_improvement_over_naive_pct",
            "greedy_speedup_factor"})
    public record Comparison(
            @JsonProperty("greedy_vs_optimal_pct") double greedyVsOptimalPct,
            @JsonProperty("naive_vs_optimal_pct") double naiveVsOptimalPct,
            @JsonProperty("ip_improvement_over_naive_pct") double ipImprovementOverNaivePct,
            @JsonProperty("greedy_speedup_factor") double greedySpeedupFactor
    ) {
    }
}
