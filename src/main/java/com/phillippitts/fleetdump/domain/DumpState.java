package com.phillippitts.fleetdump.domain;

/**
 * Lifecycle states of a single device's dump job.
 *
 * <p>{@link #COMPLETED}, {@link #FAILED} and {@link #TIMEOUT} are terminal. A job always
 * returns to {@link #IDLE} once its outcome has been reported.
 */
public enum DumpState {
    IDLE,
    STARTING,
    EXTRACTING,
    VERIFYING,
    COMPLETED,
    FAILED,
    TIMEOUT;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == TIMEOUT;
    }

    /**
     * Returns true when a job in this state owns (or is about to own) a running extraction.
     */
    public boolean isActive() {
        return this == STARTING || this == EXTRACTING || this == VERIFYING;
    }
}
