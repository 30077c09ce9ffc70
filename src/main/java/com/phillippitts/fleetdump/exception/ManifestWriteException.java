package com.phillippitts.fleetdump.exception;

import java.nio.file.Path;

/**
 * Thrown when the manifest cannot be persisted. Callers treat this as non-fatal.
 */
public class ManifestWriteException extends FleetDumpException {

    private final Path manifestPath;

    public ManifestWriteException(Path manifestPath, Throwable cause) {
        super("Failed to write manifest: " + manifestPath, cause);
        this.manifestPath = manifestPath;
    }

    public Path getManifestPath() {
        return manifestPath;
    }
}
