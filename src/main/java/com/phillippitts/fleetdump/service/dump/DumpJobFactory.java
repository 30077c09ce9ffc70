package com.phillippitts.fleetdump.service.dump;

import com.phillippitts.fleetdump.service.device.DeviceTransport;
import com.phillippitts.fleetdump.service.process.ProcessFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.function.LongSupplier;

/**
 * Creates one {@link DumpJob} per device and request, wired with the shared settings and
 * collaborators.
 */
@Component
public class DumpJobFactory {

    private final DumpJobSettings settings;
    private final ProcessFactory processFactory;
    private final DeviceTransport transport;
    private final Executor supervisorExecutor;
    private final ApplicationEventPublisher publisher;
    private final LongSupplier nanoClock;

    @Autowired
    public DumpJobFactory(DumpJobSettings settings,
                          ProcessFactory processFactory,
                          DeviceTransport transport,
                          @Qualifier("dumpJobExecutor") Executor supervisorExecutor,
                          ApplicationEventPublisher publisher) {
        this(settings, processFactory, transport, supervisorExecutor, publisher, System::nanoTime);
    }

    public DumpJobFactory(DumpJobSettings settings,
                          ProcessFactory processFactory,
                          DeviceTransport transport,
                          Executor supervisorExecutor,
                          ApplicationEventPublisher publisher,
                          LongSupplier nanoClock) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.processFactory = Objects.requireNonNull(processFactory, "processFactory");
        this.transport = Objects.requireNonNull(transport, "transport");
        this.supervisorExecutor = Objects.requireNonNull(supervisorExecutor, "supervisorExecutor");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.nanoClock = Objects.requireNonNull(nanoClock, "nanoClock");
    }

    public DumpJob create(String deviceId) {
        return new DumpJob(deviceId, settings, processFactory, transport, supervisorExecutor, publisher, nanoClock);
    }

    public DumpJobSettings settings() {
        return settings;
    }
}
