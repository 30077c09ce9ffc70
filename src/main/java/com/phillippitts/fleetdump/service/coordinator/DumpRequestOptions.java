package com.phillippitts.fleetdump.service.coordinator;

/**
 * Optional per-request inputs.
 *
 * @param uploadEnabled explicit upload decision; null defers to the auto-upload setting
 * @param requestDeviceId device that caused the request (recorded in the manifest)
 */
public record DumpRequestOptions(Boolean uploadEnabled, String requestDeviceId) {

    public static DumpRequestOptions defaults() {
        return new DumpRequestOptions(null, null);
    }
}
