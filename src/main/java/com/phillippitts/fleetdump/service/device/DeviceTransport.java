package com.phillippitts.fleetdump.service.device;

/**
 * Runs shell commands on an attached device.
 *
 * <p>Implementations never throw for device-side problems; they report them through
 * {@link ShellResult#status()}.
 */
public interface DeviceTransport {

    /**
     * Executes {@code shellCommand} on the device identified by {@code deviceId}.
     *
     * @return result; {@link ShellResult.Status#UNAVAILABLE} when the transport itself cannot run
     */
    ShellResult execute(String deviceId, String shellCommand);
}
