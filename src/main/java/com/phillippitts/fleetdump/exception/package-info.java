/**
 * Application-specific exception hierarchy.
 *
 * <p>All exceptions extend {@link com.phillippitts.fleetdump.exception.FleetDumpException} so the
 * REST layer can translate them in one place.
 *
 * <ul>
 *   <li>{@link com.phillippitts.fleetdump.exception.DumpSetupException} - working directory or
 *       extraction script unavailable; nothing was launched</li>
 *   <li>{@link com.phillippitts.fleetdump.exception.DumpProcessException} - the script failed to
 *       launch or exited non-zero</li>
 *   <li>{@link com.phillippitts.fleetdump.exception.DumpTimeoutException} - extraction deadline expired</li>
 *   <li>{@link com.phillippitts.fleetdump.exception.DumpVerificationException} - clean exit but no
 *       usable archives</li>
 *   <li>{@link com.phillippitts.fleetdump.exception.ManifestWriteException} and
 *       {@link com.phillippitts.fleetdump.exception.ManifestReadException} - manifest persistence</li>
 *   <li>{@link com.phillippitts.fleetdump.exception.FleetBusyException},
 *       {@link com.phillippitts.fleetdump.exception.UnknownDeviceException} and
 *       {@link com.phillippitts.fleetdump.exception.InvalidDumpRequestException} - request admission
 *       and control errors, mapped to 409, 404 and 400</li>
 * </ul>
 *
 * <p>Dump jobs never let these escape to the coordinator: they are converted into a failed
 * {@link com.phillippitts.fleetdump.domain.DumpOutcome} whose detail carries the message.
 *
 * @see com.phillippitts.fleetdump.presentation.exception.GlobalExceptionHandler
 */
package com.phillippitts.fleetdump.exception;
