package com.phillippitts.fleetdump.service.manifest;

import com.phillippitts.fleetdump.domain.Manifest;
import com.phillippitts.fleetdump.domain.UploadOutcome;
import com.phillippitts.fleetdump.exception.ManifestReadException;
import com.phillippitts.fleetdump.exception.ManifestWriteException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.DateTimeException;
import java.util.Optional;

/**
 * Persists {@link Manifest} documents as {@code <issueRoot>/manifest.json}.
 *
 * <p>Writes go to a sibling temp file which is then moved over the manifest, so readers never see
 * a half-written document. Failures surface as {@link ManifestWriteException}; callers log and
 * carry on.
 */
@Component
public class ManifestStore {

    private static final Logger LOG = LogManager.getLogger(ManifestStore.class);

    public static final String FILE_NAME = "manifest.json";
    private static final int INDENT = 2;

    public Path manifestPath(Path issueRoot) {
        return issueRoot.resolve(FILE_NAME);
    }

    /**
     * Replaces the manifest in {@code issueRoot}.
     *
     * @throws ManifestWriteException if the document cannot be written
     */
    public void write(Path issueRoot, Manifest manifest) {
        Path target = manifestPath(issueRoot);
        Path temp = issueRoot.resolve(FILE_NAME + ".tmp");
        try {
            Files.writeString(temp, ManifestJson.toJson(manifest).toString(INDENT), StandardCharsets.UTF_8);
            try {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
            LOG.debug("Manifest written: {} ({} of {} results)", target, manifest.results().size(),
                    manifest.targets().size());
        } catch (IOException e) {
            deleteQuietly(temp);
            throw new ManifestWriteException(target, e);
        }
    }

    /**
     * Reads the manifest in {@code issueRoot}.
     *
     * @return empty if no manifest exists
     * @throws ManifestReadException if a manifest exists but cannot be read or parsed
     */
    public Optional<Manifest> read(Path issueRoot) {
        Path source = manifestPath(issueRoot);
        try {
            return Optional.of(ManifestJson.fromJson(Files.readString(source, StandardCharsets.UTF_8)));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException | JSONException | DateTimeException | IllegalArgumentException e) {
            throw new ManifestReadException(source, e);
        }
    }

    /**
     * Read-modify-write of the {@code upload_result} field; every other field is preserved.
     *
     * @return false if there was no manifest to update
     */
    public boolean recordUploadResult(Path issueRoot, UploadOutcome outcome) {
        Optional<Manifest> existing = read(issueRoot);
        if (existing.isEmpty()) {
            LOG.warn("No manifest in {}; upload result for {} not recorded", issueRoot, outcome.issueId());
            return false;
        }
        write(issueRoot, existing.get().withUploadResult(outcome));
        return true;
    }

    private static void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            LOG.debug("Could not remove temp manifest {}: {}", path, e.toString());
        }
    }
}
