package com.phillippitts.fleetdump.exception;

import java.nio.file.Path;

/**
 * Thrown when an existing manifest cannot be read or parsed.
 */
public class ManifestReadException extends FleetDumpException {

    private final Path manifestPath;

    public ManifestReadException(Path manifestPath, Throwable cause) {
        super("Failed to read manifest: " + manifestPath, cause);
        this.manifestPath = manifestPath;
    }

    public Path getManifestPath() {
        return manifestPath;
    }
}
