package com.trust.network.solver;

import java.util.BitSet;

/**
 * An optimal assignment of a binary program.
 *
 * @param objective     objective value of the assignment
 * @param ones          indexes of the variables set to 1
 * @param nodesExplored search nodes visited by the backend (0 if not reported)
 */
public record IpSolution(double objective, BitSet ones, long nodesExplored) {

    public IpSolution {
        ones = (BitSet) ones.clone();
    }

    public boolean isSet(int variable) {
        return ones.get(variable);
    }

    @Override
    public BitSet ones() {
        return (BitSet) ones.clone();
    }
}
