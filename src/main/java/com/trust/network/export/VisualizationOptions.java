package com.trust.network.export;

/**
 * Controls which nodes go into {@code graph_viz.json}.
 *
 * <p>By default the exported subgraph holds every selected node, the
 * {@code topTalentContext} highest-scored nodes, and up to {@code neighborsPerNode}
 * neighbours of each of those. {@code fullGraph} exports every node instead.</p>
 */
public class VisualizationOptions {

    private static final int DEFAULT_TOP_TALENT_CONTEXT = 100;
    private static final int DEFAULT_NEIGHBORS_PER_NODE = 10;

    private final int topTalentContext;
    private final int neighborsPerNode;
    private final boolean fullGraph;

    private VisualizationOptions(Builder builder) {
        this.topTalentContext = builder.topTalentContext;
        this.neighborsPerNode = builder.neighborsPerNode;
        this.fullGraph = builder.fullGraph;
    }

    public int getTopTalentContext() {
        return topTalentContext;
    }

    public int getNeighborsPerNode() {
        return neighborsPerNode;
    }

    public boolean isFullGraph() {
        return fullGraph;
    }

    public static VisualizationOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int topTalentContext = DEFAULT_TOP_TALENT_CONTEXT;
        private int neighborsPerNode = DEFAULT_NEIGHBORS_PER_NODE;
        private boolean fullGraph = false;

        public Builder topTalentContext(int topTalentContext) {
            this.topTalentContext = topTalentContext;
            return this;
        }

        public Builder neighborsPerNode(int neighborsPerNode) {
            this.neighborsPerNode = neighborsPerNode;
            return this;
        }

        public Builder fullGraph(boolean fullGraph) {
            this.fullGraph = fullGraph;
            return this;
        }

        public VisualizationOptions build() {
            if (topTalentContext < 0) {
                throw new IllegalArgumentException("topTalentContext must be >= 0");
            }
            if (neighborsPerNode < 0) {
                throw new IllegalArgumentException("neighborsPerNode must be >= 0");
            }
            return new VisualizationOptions(this);
        }
    }

    @Override
    public String toString() {
        return "VisualizationOptions{topTalentContext=" + topTalentContext +
                ", neighborsPerNode=" + neighborsPerNode +
                ", fullGraph=" + fullGraph + '}';
    }
}
