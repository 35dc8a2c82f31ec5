package com.trust.network.selection;

/**
 * How the ids in a selection were actually produced.
 */
public enum Provenance {

    /**
     * Proven optimal by the integer-programming backend.
     */
    EXACT,

    /**
     * Produced by an approximate or baseline method, as requested.
     */
    APPROXIMATE,

    /**
     * The exact method was requested but the backend was unavailable, infeasible or
     * timed out, so the approximate method's answer was substituted.
     */
    FALLBACK
}
