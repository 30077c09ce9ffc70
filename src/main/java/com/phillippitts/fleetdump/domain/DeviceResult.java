package com.phillippitts.fleetdump.domain;

/**
 * Per-device entry in the manifest's {@code results} map.
 *
 * @param success true only for a verified dump
 * @param status outcome status as recorded
 * @param detail success summary or failure reason
 * @param dumpPath device directory, null when it was never created
 */
public record DeviceResult(boolean success, OutcomeStatus status, String detail, String dumpPath) {

    public static DeviceResult from(DumpOutcome outcome) {
        String path = outcome.workingDirectory() == null ? null : outcome.workingDirectory().toString();
        return new DeviceResult(outcome.isSuccess(), outcome.status(), outcome.detail(), path);
    }
}
