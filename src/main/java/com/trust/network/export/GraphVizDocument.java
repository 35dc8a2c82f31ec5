package com.trust.network.export;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * {@code graph_viz.json}: the exported subgraph.
 */
public record GraphVizDocument(List<Node> nodes, List<Link> links) {

    public GraphVizDocument {
        nodes = List.copyOf(nodes);
        links = List.copyOf(links);
    }

    /**
     * @param group      role tag; omitted for nodes without a role
     * @param val        talent score, used for sizing
     * @param degree     links of this node inside the exported subgraph
     * @param fullDegree incident edges in the whole network
     */
    @JsonPropertyOrder({"id", "group", "val", "degree", "full_degree", "label", "metadata"})
    public record Node(
            long id,
            @JsonInclude(JsonInclude.Include.NON_NULL) String group,
            double val,
            int degree,
            @JsonProperty("full_degree") int fullDegree,
            String label,
            NodeMetadata metadata
    ) {
    }

    @JsonPropertyOrder({"source", "target"})
    public record Link(long source, long target) {
    }
}
