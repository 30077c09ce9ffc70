package com.phillippitts.fleetdump.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Typed properties for shipping issue directories to Artifactory via the JFrog CLI.
 */
@Validated
@ConfigurationProperties(prefix = "dump.upload")
public class UploadProperties {

    @NotBlank
    private final String cliBinary;

    @NotBlank
    private final String repository;

    private final String directoryPrefix;

    private final String serverUrl;

    @NotNull
    private final Duration timeout;

    @ConstructorBinding
    public UploadProperties(String cliBinary, String repository, String directoryPrefix,
                            String serverUrl, Duration timeout) {
        this.cliBinary = cliBinary == null || cliBinary.isBlank() ? "jf" : cliBinary;
        this.repository = repository == null || repository.isBlank() ? "device-dumps" : repository;
        this.directoryPrefix = directoryPrefix == null ? "" : directoryPrefix;
        this.serverUrl = serverUrl;
        this.timeout = timeout == null ? Duration.ofMinutes(30) : timeout;
    }

    public String getCliBinary() {
        return cliBinary;
    }

    public String getRepository() {
        return repository;
    }

    /** Remote folder under the repository; the issue id is appended below it. */
    public String getDirectoryPrefix() {
        return directoryPrefix;
    }

    /** Base URL used only to build a browsable link in the upload result; may be null. */
    public String getServerUrl() {
        return serverUrl;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
