package com.phillippitts.fleetdump.domain;

/**
 * Classifies failed outcomes so operators can tell a missing script from a crashed one.
 */
public enum FailureKind {
    /** Working directory could not be prepared or the extraction script is missing. */
    SETUP,
    /** The script could not be launched, crashed, or exited non-zero. */
    PROCESS,
    /** The extraction ran past its deadline and was killed. */
    TIMEOUT,
    /** The script exited cleanly but left no usable archives behind. */
    VERIFICATION
}
