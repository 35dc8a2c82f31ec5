package com.trust.network.export;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * {@code maintenance_results.json}: the production maintenance selection.
 */
@JsonPropertyOrder({"selected_nodes", "total_value", "budget_used", "num_selected", "avg_days_dormant",
        "provenance", "fallback_reason"})
public record MaintenanceResultsDocument(
        @JsonProperty("selected_nodes") List<SelectedNode> selectedNodes,
        @JsonProperty("total_value") double totalValue,
        @JsonProperty("budget_used") double budgetUsed,
        @JsonProperty("num_selected") int numSelected,
        @JsonProperty("avg_days_dormant") double avgDaysDormant,
        String provenance,
        @JsonProperty("fallback_reason") @JsonInclude(JsonInclude.Include.NON_NULL) String fallbackReason
) {

    public MaintenanceResultsDocument {
        selectedNodes = List.copyOf(selectedNodes);
    }

    /**
     * @param weight re-engagement cost in minutes
     */
    @JsonPropertyOrder({"id", "weight", "value", "days_dormant", "degree", "talent_score", "metadata"})
    public record SelectedNode(
            long id,
            double weight,
            double value,
            @JsonProperty("days_dormant") long daysDormant,
            int degree,
            @JsonProperty("talent_score") double talentScore,
            NodeMetadata metadata
    ) {
    }
}
