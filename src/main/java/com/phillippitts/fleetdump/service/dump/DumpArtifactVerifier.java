package com.phillippitts.fleetdump.service.dump;

import com.phillippitts.fleetdump.exception.DumpVerificationException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Decides whether a finished extraction produced something worth keeping.
 *
 * <p>A dump is valid when its working directory holds at least one non-empty {@code .zip}
 * archive. Missing required items are logged but do not fail the dump.
 */
final class DumpArtifactVerifier {

    private static final Logger LOG = LogManager.getLogger(DumpArtifactVerifier.class);

    private final List<String> requiredItems;

    DumpArtifactVerifier(List<String> requiredItems) {
        this.requiredItems = List.copyOf(requiredItems);
    }

    /**
     * @return number of non-empty archives found
     * @throws DumpVerificationException if there are none or the directory cannot be listed
     */
    int verify(Path workingDirectory) {
        if (!Files.isDirectory(workingDirectory)) {
            throw new DumpVerificationException("Dump directory does not exist: " + workingDirectory,
                    workingDirectory);
        }

        int archives = 0;
        int emptyArchives = 0;
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(workingDirectory)) {
            for (Path entry : entries) {
                if (!isZip(entry) || !Files.isRegularFile(entry)) {
                    continue;
                }
                if (Files.size(entry) > 0) {
                    archives++;
                } else {
                    emptyArchives++;
                }
            }
        } catch (IOException e) {
            throw new DumpVerificationException("Unable to inspect dump directory: " + e.getMessage(),
                    workingDirectory, e);
        }

        for (String item : requiredItems) {
            if (!Files.exists(workingDirectory.resolve(item))) {
                LOG.warn("Expected item '{}' not found in {}", item, workingDirectory);
            }
        }

        if (archives == 0) {
            String reason = emptyArchives > 0
                    ? "Dump produced only empty zip files (" + emptyArchives + ")"
                    : "No zip files were created";
            throw new DumpVerificationException(reason, workingDirectory);
        }
        return archives;
    }

    private static boolean isZip(Path entry) {
        return entry.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".zip");
    }
}
