package com.example.quorum.consensus;

/**
 * State of a consensus round.
 */
public enum RoundOutcome {

    /**
     * Still collecting answers.
     */
    PENDING,

    /**
     * A bucket reached the plurality threshold and leads every other bucket.
     */
    ACCEPTED,

    /**
     * All expected answers arrived without a qualifying plurality.
     */
    NO_QUORUM,

    /**
     * Fewer than the expected answers arrived before the deadline.
     */
    TIMED_OUT;

    public boolean isTerminal() {
        return this != PENDING;
    }
}
