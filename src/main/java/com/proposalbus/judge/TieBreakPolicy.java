package com.proposalbus.judge;

/**
 * Resolves candidates with equal accumulated weight.
 */
public enum TieBreakPolicy {
    /** The candidate whose first supporting evaluation came earliest. */
    FIRST_SEEN,
    /** The candidate whose supporters are most confident on average, then first seen. */
    HIGHEST_AVERAGE_CONFIDENCE
}
