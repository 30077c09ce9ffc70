package com.phillippitts.fleetdump.service.coordinator;

import java.util.List;

/**
 * Answer to a fleet dump request.
 *
 * @param accepted whether a new request was started
 * @param issueId id of the new request, or of the request that blocked it
 * @param issueRoot issue directory of the new request (null when rejected)
 * @param targets devices that will be dumped (empty when rejected)
 * @param reason why the request was rejected; null when accepted
 */
public record RequestAdmission(boolean accepted,
                               String issueId,
                               String issueRoot,
                               List<String> targets,
                               Rejection reason) {

    public enum Rejection {
        /** Another request is still in progress. */
        BUSY,
        /** No targets were named and no devices are attached. */
        NO_DEVICES,
        /** The issue directory could not be created. */
        ISSUE_DIRECTORY
    }

    public RequestAdmission {
        targets = targets == null ? List.of() : List.copyOf(targets);
    }

    static RequestAdmission accepted(String issueId, String issueRoot, List<String> targets) {
        return new RequestAdmission(true, issueId, issueRoot, targets, null);
    }

    static RequestAdmission rejected(Rejection reason, String blockingIssueId) {
        return new RequestAdmission(false, blockingIssueId, null, List.of(), reason);
    }
}
