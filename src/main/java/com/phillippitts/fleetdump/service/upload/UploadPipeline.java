package com.phillippitts.fleetdump.service.upload;

import java.nio.file.Path;

/**
 * Ships a local directory to the artifact store.
 *
 * <p>Implementations report failures through {@link UploadResult}; they do not throw for
 * store-side problems.
 */
public interface UploadPipeline {

    /**
     * Uploads every file below {@code localDirectory}, preserving relative paths under
     * {@code remotePath}.
     */
    UploadResult uploadDirectory(Path localDirectory, String remotePath);
}
