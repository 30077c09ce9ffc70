package com.phillippitts.fleetdump.config;

import com.phillippitts.fleetdump.config.properties.DumpProperties;
import com.phillippitts.fleetdump.config.properties.UploadProperties;
import com.phillippitts.fleetdump.service.coordinator.CoordinatorSettings;
import com.phillippitts.fleetdump.service.dump.DumpJobSettings;
import com.phillippitts.fleetdump.service.path.PathNamingStrategy;
import com.phillippitts.fleetdump.service.path.PathStrategyType;
import com.phillippitts.fleetdump.service.process.DefaultProcessFactory;
import com.phillippitts.fleetdump.service.process.ProcessFactory;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Wires the dump pipeline's plain collaborators from {@link DumpProperties} and
 * {@link UploadProperties}.
 */
@Configuration
public class CoordinatorConfig {

    private static final Logger LOG = LogManager.getLogger(CoordinatorConfig.class);

    @Bean
    public ProcessFactory processFactory() {
        return new DefaultProcessFactory();
    }

    @Bean
    public DumpJobSettings dumpJobSettings(DumpProperties props) {
        DumpJobSettings settings = DumpJobSettings.from(props);
        LOG.info("Dump jobs: script={}, headlessTimeout={}s, interactiveTimeout={}s",
                settings.scriptPath(), settings.headlessTimeout().toSeconds(),
                settings.interactiveTimeout().toSeconds());
        return settings;
    }

    @Bean
    public PathNamingStrategy pathNamingStrategy(DumpProperties props) {
        PathStrategyType type = PathStrategyType.fromName(props.getPathStrategy());
        Path logDirectory = Path.of(props.getLogDirectory()).toAbsolutePath().normalize();
        LOG.info("Dump directories: strategy={}, root={}", type.value(), logDirectory);
        return type.create(logDirectory, props.getDirectoryPrefix());
    }

    @Bean
    public CoordinatorSettings coordinatorSettings(DumpProperties dump, UploadProperties upload) {
        return CoordinatorSettings.from(dump, upload);
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
