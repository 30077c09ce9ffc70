package com.phillippitts.fleetdump.exception;

import java.nio.file.Path;

/**
 * Thrown when an extraction exits cleanly but its working directory holds no non-empty archive.
 */
public class DumpVerificationException extends FleetDumpException {

    private final Path workingDirectory;

    public DumpVerificationException(String message, Path workingDirectory) {
        super(message);
        this.workingDirectory = workingDirectory;
    }

    public DumpVerificationException(String message, Path workingDirectory, Throwable cause) {
        super(message, cause);
        this.workingDirectory = workingDirectory;
    }

    public Path getWorkingDirectory() {
        return workingDirectory;
    }
}
