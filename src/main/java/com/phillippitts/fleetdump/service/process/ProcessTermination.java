package com.phillippitts.fleetdump.service.process;

import com.phillippitts.fleetdump.util.ProcessTimeouts;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Graceful-then-forceful process shutdown shared by every component that owns a subprocess.
 */
public final class ProcessTermination {

    private static final Logger LOG = LogManager.getLogger(ProcessTermination.class);

    private ProcessTermination() {
    }

    /**
     * Sends a terminate signal, waits up to {@code grace}, then force-kills if still alive.
     *
     * @return true if the process is no longer alive afterwards
     */
    public static boolean terminate(Process process, Duration grace) {
        if (process == null) {
            return true;
        }
        try {
            process.destroy();
            boolean exited = process.waitFor(grace.toMillis(), TimeUnit.MILLISECONDS);
            if (!exited && process.isAlive()) {
                return kill(process);
            }
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while terminating process");
            return !process.isAlive();
        }
    }

    /**
     * Force-kills the process and waits briefly for the OS to reap it.
     *
     * @return true if the process is no longer alive afterwards
     */
    public static boolean kill(Process process) {
        if (process == null) {
            return true;
        }
        try {
            process.destroyForcibly();
            process.waitFor(ProcessTimeouts.FORCEFUL_SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while killing process");
        }
        if (process.isAlive()) {
            LOG.warn("Process still alive after destroyForcibly");
            return false;
        }
        return true;
    }
}
