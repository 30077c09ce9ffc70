package com.phillippitts.fleetdump.service.process;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Abstraction over {@link ProcessBuilder} to enable hermetic testing of everything that shells out
 * (extraction scripts, adb, the upload CLI).
 *
 * <p>Production code uses {@link DefaultProcessFactory}. Tests provide a stub that returns a fake
 * {@link Process} with controlled output and exit behavior.
 */
public interface ProcessFactory {

    /**
     * Starts a new process. Standard error is merged into standard output.
     *
     * @param command full command line, with the executable as the first element
     * @param workingDir working directory for the process (may be null)
     * @param environment variables added to the inherited environment
     * @return started {@link Process}
     * @throws IOException if the process cannot be started
     */
    Process start(List<String> command, Path workingDir, Map<String, String> environment) throws IOException;

    default Process start(List<String> command, Path workingDir) throws IOException {
        return start(command, workingDir, Map.of());
    }
}
