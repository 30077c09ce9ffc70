/**
 * Per-device dump extraction.
 *
 * <p>A {@link com.phillippitts.fleetdump.service.dump.DumpJob} owns at most one extraction process
 * at a time. It launches the configured script with the device serial in {@code ADB_SERIAL},
 * supervises it against a mode-specific deadline, verifies that the working directory holds at
 * least one non-empty archive, and reports a single
 * {@link com.phillippitts.fleetdump.domain.DumpOutcome}.
 *
 * <p>Status transitions and progress messages are published as Spring application events
 * ({@link com.phillippitts.fleetdump.service.dump.event.DumpStatusChangedEvent},
 * {@link com.phillippitts.fleetdump.service.dump.event.DumpProgressEvent}); the terminal outcome
 * goes to the listener passed to {@code start} so the coordinator never has to subscribe to
 * every job.
 */
package com.phillippitts.fleetdump.service.dump;
