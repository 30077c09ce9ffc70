/**
 * Fleet-level coordination of device dump jobs.
 *
 * <p>{@link com.phillippitts.fleetdump.service.coordinator.FleetDumpCoordinator} owns the single
 * active request. Every state change runs on a
 * {@link com.phillippitts.fleetdump.service.coordinator.SerialCommandLoop}, so job outcomes
 * arriving from supervisor threads are applied one at a time.
 *
 * <p>Lifecycle events published under {@code event}:
 * <ul>
 *   <li>FleetDumpRequested - automated triggers (crash monitor, health checks) ask for a dump</li>
 *   <li>FleetDumpStarted / FleetDumpProgress / FleetDumpCompleted - request lifecycle</li>
 *   <li>FleetDumpError - a request was refused before any device was dumped</li>
 *   <li>UploadConfirmationRequested / UploadCompleted - upload decision and result</li>
 * </ul>
 */
package com.phillippitts.fleetdump.service.coordinator;
