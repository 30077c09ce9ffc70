package com.phillippitts.fleetdump.exception;

/**
 * Thrown when a fleet dump is requested while another one is still in progress.
 */
public class FleetBusyException extends FleetDumpException {

    private final String activeIssueId;

    public FleetBusyException(String activeIssueId) {
        super("Another fleet dump is in progress (issueId=" + activeIssueId + ")");
        this.activeIssueId = activeIssueId;
    }

    public String getActiveIssueId() {
        return activeIssueId;
    }
}
