package com.phillippitts.fleetdump.service.device;

import com.phillippitts.fleetdump.config.properties.DeviceProperties;
import com.phillippitts.fleetdump.service.process.ProcessFactory;
import com.phillippitts.fleetdump.service.process.ProcessOutput;
import com.phillippitts.fleetdump.service.process.ProcessTermination;
import com.phillippitts.fleetdump.util.LogSanitizer;
import com.phillippitts.fleetdump.util.ProcessTimeouts;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * {@link DeviceTransport} backed by {@code adb -s <serial> shell <command>}.
 */
@Component
public class AdbDeviceTransport implements DeviceTransport {

    private static final Logger LOG = LogManager.getLogger(AdbDeviceTransport.class);
    private static final int MAX_OUTPUT_CHARS = 64 * 1024;
    private static final int DETAIL_MAX_CHARS = 200;

    private final ProcessFactory processFactory;
    private final DeviceProperties properties;

    public AdbDeviceTransport(ProcessFactory processFactory, DeviceProperties properties) {
        this.processFactory = Objects.requireNonNull(processFactory, "processFactory");
        this.properties = Objects.requireNonNull(properties, "properties");
    }

    @Override
    public ShellResult execute(String deviceId, String shellCommand) {
        List<String> command = List.of(properties.getAdbBinary(), "-s", deviceId, "shell", shellCommand);
        Process process;
        try {
            process = processFactory.start(command, null);
        } catch (IOException e) {
            LOG.warn("adb not available for device {}: {}", deviceId, e.getMessage());
            return ShellResult.unavailable("adb not available: " + e.getMessage());
        }

        ProcessOutput output = ProcessOutput.collect(process.getInputStream(), "adb-" + deviceId,
                MAX_OUTPUT_CHARS, null);
        try {
            boolean finished = process.waitFor(properties.getCommandTimeout().toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                ProcessTermination.terminate(process, ProcessTimeouts.GRACEFUL_SHUTDOWN_TIMEOUT);
                output.await(ProcessTimeouts.OUTPUT_CLEANUP_TIMEOUT);
                LOG.warn("adb command timed out on {} after {}s: {}", deviceId,
                        properties.getCommandTimeout().toSeconds(), shellCommand);
                return ShellResult.failed(output.text(),
                        "timed out after " + properties.getCommandTimeout().toSeconds() + "s");
            }
            output.await(ProcessTimeouts.OUTPUT_FLUSH_TIMEOUT);
            int exitCode = process.exitValue();
            if (exitCode != 0) {
                String text = output.text();
                LOG.debug("adb command failed on {} (exitCode={}): {}", deviceId, exitCode, shellCommand);
                return ShellResult.failed(text,
                        "exitCode=" + exitCode + ", output=" + LogSanitizer.tail(text, DETAIL_MAX_CHARS));
            }
            return ShellResult.ok(output.text());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ProcessTermination.kill(process);
            return ShellResult.failed(output.text(), "interrupted");
        }
    }
}
