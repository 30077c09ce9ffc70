package com.phillippitts.fleetdump.presentation.controller;

import com.phillippitts.fleetdump.domain.DumpMode;
import com.phillippitts.fleetdump.domain.FleetStatus;
import com.phillippitts.fleetdump.domain.TriggerReason;
import com.phillippitts.fleetdump.exception.FleetBusyException;
import com.phillippitts.fleetdump.exception.FleetDumpException;
import com.phillippitts.fleetdump.exception.InvalidDumpRequestException;
import com.phillippitts.fleetdump.service.coordinator.CoordinatorSettings;
import com.phillippitts.fleetdump.service.coordinator.DumpRequestOptions;
import com.phillippitts.fleetdump.service.coordinator.FleetDumpCoordinator;
import com.phillippitts.fleetdump.service.coordinator.RequestAdmission;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Operator API for fleet dumps.
 *
 * <p>Every call is forwarded to the {@link FleetDumpCoordinator}; this class only translates
 * between HTTP and the coordinator's futures. Errors go to {@code GlobalExceptionHandler}.
 */
@RestController
@RequestMapping("/api/dumps")
class DumpController {

    private static final Logger LOG = LogManager.getLogger(DumpController.class);
    private static final Duration COORDINATOR_TIMEOUT = Duration.ofSeconds(10);

    private final FleetDumpCoordinator coordinator;

    DumpController(FleetDumpCoordinator coordinator) {
        this.coordinator = coordinator;
    }

    @PostMapping
    ResponseEntity<DumpAccepted> requestDump(@RequestBody(required = false) DumpRequestBody body) {
        DumpRequestBody request = body == null ? new DumpRequestBody(null, null, null, null) : body;
        TriggerReason trigger = parseTrigger(request.trigger());
        LOG.info("Dump requested over HTTP: trigger={}, devices={}", trigger.value(), request.devices());

        RequestAdmission admission = await(coordinator.request(trigger, request.devices(),
                new DumpRequestOptions(request.uploadEnabled(), request.requestDeviceId())));
        if (!admission.accepted()) {
            throw switch (admission.reason()) {
                case BUSY -> new FleetBusyException(admission.issueId());
                case NO_DEVICES -> new InvalidDumpRequestException("No active devices to dump");
                case ISSUE_DIRECTORY -> new FleetDumpException("Issue directory could not be created");
            };
        }
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(new DumpAccepted(admission.issueId(), admission.issueRoot(), admission.targets()));
    }

    @GetMapping("/active")
    ResponseEntity<FleetStatus> activeDump() {
        return coordinator.activeStatus()
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    @PostMapping("/devices/{deviceId}/cancel")
    ResponseEntity<Map<String, Object>> requestCancel(@PathVariable String deviceId) {
        boolean accepted = await(coordinator.requestCancel(deviceId));
        return cancelResponse(deviceId, "requested", accepted,
                "Device is not in a cancellable interactive extraction");
    }

    @PostMapping("/devices/{deviceId}/cancel/confirm")
    ResponseEntity<Map<String, Object>> confirmCancel(@PathVariable String deviceId,
                                                      @RequestParam(defaultValue = "true") boolean cleanup) {
        boolean accepted = await(coordinator.confirmCancel(deviceId, cleanup));
        return cancelResponse(deviceId, "confirmed", accepted, "No cancellation is pending for this device");
    }

    @DeleteMapping("/devices/{deviceId}/cancel")
    ResponseEntity<Map<String, Object>> withdrawCancel(@PathVariable String deviceId) {
        boolean accepted = await(coordinator.withdrawCancel(deviceId));
        return cancelResponse(deviceId, "withdrawn", accepted, "No cancellation is pending for this device");
    }

    @PostMapping("/{issueId}/upload/confirm")
    ResponseEntity<Map<String, Object>> confirmUpload(@PathVariable String issueId) {
        return uploadResponse(issueId, "confirmed", await(coordinator.confirmUpload(issueId)));
    }

    @PostMapping("/{issueId}/upload/decline")
    ResponseEntity<Map<String, Object>> declineUpload(@PathVariable String issueId) {
        return uploadResponse(issueId, "declined", await(coordinator.declineUpload(issueId)));
    }

    @GetMapping("/settings")
    ResponseEntity<CoordinatorSettings> settings() {
        return ResponseEntity.ok(await(coordinator.currentSettings()));
    }

    @PutMapping("/settings")
    ResponseEntity<CoordinatorSettings> updateSettings(@Valid @RequestBody SettingsBody body) {
        CoordinatorSettings current = await(coordinator.currentSettings());
        CoordinatorSettings updated = new CoordinatorSettings(
                body.maxConcurrency(),
                body.autoUploadEnabled(),
                body.manualMode() != null ? body.manualMode() : current.manualMode(),
                body.automatedMode() != null ? body.automatedMode() : current.automatedMode(),
                current.uploadDirectoryPrefix());
        return ResponseEntity.ok(await(coordinator.updateSettings(updated)));
    }

    private static TriggerReason parseTrigger(String raw) {
        if (raw == null || raw.isBlank()) {
            return TriggerReason.MANUAL;
        }
        try {
            return TriggerReason.fromValue(raw);
        } catch (IllegalArgumentException e) {
            throw new InvalidDumpRequestException(e.getMessage(), e);
        }
    }

    private static ResponseEntity<Map<String, Object>> cancelResponse(String deviceId, String stage,
                                                                      boolean accepted, String rejection) {
        if (accepted) {
            return ResponseEntity.status(HttpStatus.ACCEPTED)
                    .body(Map.of("deviceId", deviceId, "cancellation", stage));
        }
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(Map.of("deviceId", deviceId, "cancellation", "rejected", "reason", rejection));
    }

    private static ResponseEntity<Map<String, Object>> uploadResponse(String issueId, String action,
                                                                      boolean accepted) {
        if (accepted) {
            return ResponseEntity.status(HttpStatus.ACCEPTED).body(Map.of("issueId", issueId, "upload", action));
        }
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(Map.of("issueId", issueId, "upload", "none-pending"));
    }

    private static <T> T await(CompletableFuture<T> future) {
        try {
            return future.get(COORDINATOR_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new FleetDumpException("Coordinator call failed", e.getCause());
        } catch (TimeoutException e) {
            throw new FleetDumpException("Coordinator did not respond within " + COORDINATOR_TIMEOUT.toSeconds() + "s", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FleetDumpException("Interrupted while waiting for coordinator", e);
        }
    }

    /**
     * Body of {@code POST /api/dumps}. Every field is optional.
     *
     * @param trigger {@code manual} (default), {@code crash_monitor} or {@code qs_failed}
     * @param devices serials to dump; omitted or empty means all attached devices
     * @param uploadEnabled explicit upload decision; omitted defers to the auto-upload setting
     * @param requestDeviceId device that prompted the request
     */
    record DumpRequestBody(String trigger, List<String> devices, Boolean uploadEnabled, String requestDeviceId) {}

    record DumpAccepted(String issueId, String issueRoot, List<String> targets) {}

    record SettingsBody(@Min(1) @Max(16) int maxConcurrency,
                        boolean autoUploadEnabled,
                        DumpMode manualMode,
                        DumpMode automatedMode) {}
}
