package com.phillippitts.fleetdump.service.device;

/**
 * Outcome of one device shell command.
 *
 * @param status whether the command ran and exited cleanly
 * @param output command output (merged streams), empty unless the command ran
 * @param detail reason for a non-OK status
 */
public record ShellResult(Status status, String output, String detail) {

    public enum Status {
        /** Command ran and exited 0. */
        OK,
        /** Command ran but exited non-zero or timed out. */
        FAILED,
        /** Transport binary missing or device unreachable. */
        UNAVAILABLE
    }

    public ShellResult {
        output = output == null ? "" : output;
        detail = detail == null ? "" : detail;
    }

    public static ShellResult ok(String output) {
        return new ShellResult(Status.OK, output, "");
    }

    public static ShellResult failed(String output, String detail) {
        return new ShellResult(Status.FAILED, output, detail);
    }

    public static ShellResult unavailable(String detail) {
        return new ShellResult(Status.UNAVAILABLE, "", detail);
    }

    public boolean isOk() {
        return status == Status.OK;
    }
}
