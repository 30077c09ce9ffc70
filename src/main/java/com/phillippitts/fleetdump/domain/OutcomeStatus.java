package com.phillippitts.fleetdump.domain;

/**
 * Terminal result of one device's extraction as seen by the coordinator.
 */
public enum OutcomeStatus {
    SUCCESS,
    FAILED,
    CANCELLED
}
