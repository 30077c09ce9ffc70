package com.phillippitts.fleetdump.service.manifest;

import com.phillippitts.fleetdump.config.properties.DumpProperties;
import com.phillippitts.fleetdump.domain.DeviceResult;
import com.phillippitts.fleetdump.domain.Manifest;
import com.phillippitts.fleetdump.domain.OutcomeStatus;
import com.phillippitts.fleetdump.exception.FleetDumpException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Finalizes manifests left incomplete by a previous run.
 *
 * <p>A request that was in flight when the process stopped has targets without results. On startup
 * those targets are recorded as failed with detail {@value #INTERRUPTED_DETAIL}, the counts are
 * adjusted and the manifest is flagged {@code recovered}.
 */
@Component
public class ManifestRecoveryService {

    private static final Logger LOG = LogManager.getLogger(ManifestRecoveryService.class);

    static final String INTERRUPTED_DETAIL = "interrupted by restart";
    private static final String INDIVIDUAL_DUMPS_DIRECTORY = "dumps";

    private final ManifestStore store;
    private final DumpProperties properties;

    public ManifestRecoveryService(ManifestStore store, DumpProperties properties) {
        this.store = store;
        this.properties = properties;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        int recovered = recover(Path.of(properties.getLogDirectory()));
        if (recovered > 0) {
            LOG.warn("Recovered {} incomplete fleet dump manifest(s) from a previous run", recovered);
        }
    }

    /**
     * Scans the issue directories under {@code logDirectory} and repairs incomplete manifests.
     *
     * @return number of manifests rewritten
     */
    public int recover(Path logDirectory) {
        int recovered = 0;
        for (Path issueRoot : candidateIssueRoots(logDirectory)) {
            try {
                Optional<Manifest> manifest = store.read(issueRoot);
                if (manifest.isPresent() && !manifest.get().isComplete()) {
                    store.write(issueRoot, finalizeInterrupted(manifest.get()));
                    recovered++;
                    LOG.info("Marked interrupted request {} as finished", manifest.get().issueId());
                }
            } catch (FleetDumpException e) {
                LOG.warn("Skipping manifest recovery in {}: {}", issueRoot, e.getMessage());
            }
        }
        return recovered;
    }

    static Manifest finalizeInterrupted(Manifest manifest) {
        Map<String, DeviceResult> results = new LinkedHashMap<>(manifest.results());
        int interrupted = 0;
        for (String target : manifest.targets()) {
            if (!results.containsKey(target)) {
                results.put(target, new DeviceResult(false, OutcomeStatus.FAILED, INTERRUPTED_DETAIL, null));
                interrupted++;
            }
        }
        return new Manifest(manifest.issueId(), manifest.triggeredBy(), manifest.pathStrategy(),
                manifest.requestDeviceId(), manifest.targets(), results, manifest.successCount(),
                manifest.failCount() + interrupted, manifest.cancelledCount(), manifest.issueDir(),
                manifest.uploadEnabled(), manifest.createdAt(), manifest.uploadResult(), true);
    }

    private List<Path> candidateIssueRoots(Path logDirectory) {
        List<Path> roots = new ArrayList<>();
        Path prefixed = logDirectory.resolve(properties.getDirectoryPrefix());
        if (Files.isDirectory(prefixed)) {
            try (DirectoryStream<Path> issues = Files.newDirectoryStream(prefixed, Files::isDirectory)) {
                issues.forEach(roots::add);
            } catch (IOException e) {
                LOG.warn("Unable to scan {} for manifests: {}", prefixed, e.toString());
            }
        }
        Path individual = logDirectory.resolve(INDIVIDUAL_DUMPS_DIRECTORY);
        if (Files.isDirectory(individual)) {
            roots.add(individual);
        }
        return roots;
    }
}
