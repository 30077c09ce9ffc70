package com.phillippitts.fleetdump;

import com.phillippitts.fleetdump.config.properties.CrashMonitorProperties;
import com.phillippitts.fleetdump.config.properties.DeviceProperties;
import com.phillippitts.fleetdump.config.properties.DumpProperties;
import com.phillippitts.fleetdump.config.properties.UploadProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        DumpProperties.class,
        UploadProperties.class,
        CrashMonitorProperties.class,
        DeviceProperties.class
})
@EnableScheduling
public class FleetDumpApplication {

    public static void main(String[] args) {
        SpringApplication.run(FleetDumpApplication.class, args);
    }

}
