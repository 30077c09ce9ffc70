package com.phillippitts.fleetdump.service.upload;

import com.phillippitts.fleetdump.config.properties.UploadProperties;
import com.phillippitts.fleetdump.service.process.ProcessFactory;
import com.phillippitts.fleetdump.service.process.ProcessOutput;
import com.phillippitts.fleetdump.service.process.ProcessTermination;
import com.phillippitts.fleetdump.util.LogSanitizer;
import com.phillippitts.fleetdump.util.ProcessTimeouts;
import com.phillippitts.fleetdump.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * {@link UploadPipeline} that shells out to the JFrog CLI.
 *
 * <p>CLI contract:
 * <pre>
 * jf rt upload --recursive=true --flat=true "&lt;local&gt;/(*)" "&lt;repository&gt;/&lt;remote&gt;/{1}"
 * </pre>
 * The capture group keeps each file's path relative to the uploaded directory.
 */
@Component
public class JfrogCliUploadPipeline implements UploadPipeline {

    private static final Logger LOG = LogManager.getLogger(JfrogCliUploadPipeline.class);
    private static final int MAX_OUTPUT_CHARS = 32 * 1024;
    private static final int MESSAGE_MAX_CHARS = 300;

    private final ProcessFactory processFactory;
    private final UploadProperties properties;

    public JfrogCliUploadPipeline(ProcessFactory processFactory, UploadProperties properties) {
        this.processFactory = Objects.requireNonNull(processFactory, "processFactory");
        this.properties = Objects.requireNonNull(properties, "properties");
    }

    @Override
    public UploadResult uploadDirectory(Path localDirectory, String remotePath) {
        if (!Files.isDirectory(localDirectory)) {
            return UploadResult.failure("Local directory does not exist: " + localDirectory);
        }

        String target = properties.getRepository() + "/" + trimSlashes(remotePath) + "/";
        List<String> command = buildCommand(localDirectory, target);
        long start = System.nanoTime();

        Process process;
        try {
            process = processFactory.start(command, localDirectory);
        } catch (IOException e) {
            LOG.warn("JFrog CLI not available ({}): {}", properties.getCliBinary(), e.getMessage());
            return UploadResult.failure("JFrog CLI not available: " + e.getMessage());
        }

        ProcessOutput output = ProcessOutput.collect(process.getInputStream(), "jf-upload", MAX_OUTPUT_CHARS,
                line -> LOG.debug("[jf] {}", line));
        try {
            boolean finished = process.waitFor(properties.getTimeout().toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                ProcessTermination.terminate(process, ProcessTimeouts.GRACEFUL_SHUTDOWN_TIMEOUT);
                LOG.warn("Upload to {} timed out after {}s", target, properties.getTimeout().toSeconds());
                return UploadResult.failure("Upload timed out after " + properties.getTimeout().toSeconds() + "s");
            }
            output.await(ProcessTimeouts.OUTPUT_FLUSH_TIMEOUT);
            int exitCode = process.exitValue();
            long durationMs = TimeUtils.elapsedMillis(start);
            if (exitCode != 0) {
                String tail = LogSanitizer.tail(output.text(), MESSAGE_MAX_CHARS);
                LOG.warn("Upload to {} failed (exitCode={}, durationMs={})", target, exitCode, durationMs);
                return UploadResult.failure("Upload failed (exitCode=" + exitCode + "): " + tail);
            }
            LOG.info("Uploaded {} to {} in {}ms", localDirectory, target, durationMs);
            return new UploadResult(true, "Uploaded to " + target, uploadInfo(target));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ProcessTermination.kill(process);
            return UploadResult.failure("Upload interrupted");
        }
    }

    private List<String> buildCommand(Path localDirectory, String target) {
        String source = localDirectory.toAbsolutePath().normalize() + "/(*)";
        return List.of(properties.getCliBinary(), "rt", "upload",
                "--recursive=true", "--flat=true",
                source, target + "{1}");
    }

    private Map<String, String> uploadInfo(String target) {
        Map<String, String> info = new LinkedHashMap<>();
        info.put("repository", properties.getRepository());
        info.put("target", target);
        String serverUrl = properties.getServerUrl();
        if (serverUrl != null && !serverUrl.isBlank()) {
            String base = serverUrl.endsWith("/") ? serverUrl : serverUrl + "/";
            info.put("url", base + "artifactory/" + target);
        }
        return info;
    }

    private static String trimSlashes(String path) {
        String trimmed = path == null ? "" : path.trim();
        while (trimmed.startsWith("/")) {
            trimmed = trimmed.substring(1);
        }
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }
}
