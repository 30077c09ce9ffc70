/**
 * REST API controllers for HTTP endpoints.
 *
 * <p>Current Endpoints:
 * <ul>
 *   <li>{@code POST /api/dumps} - request a fleet dump (202, 409 when busy, 400 when nothing to dump)</li>
 *   <li>{@code GET /api/dumps/active} - snapshot of the running request (204 when idle)</li>
 *   <li>{@code POST|DELETE /api/dumps/devices/{id}/cancel}, {@code POST .../cancel/confirm} -
 *       two-stage operator cancellation</li>
 *   <li>{@code POST /api/dumps/{issueId}/upload/confirm|decline} - answer a staged upload</li>
 *   <li>{@code GET|PUT /api/dumps/settings} - runtime coordinator settings</li>
 * </ul>
 *
 * <p>Controllers delegate to the service layer and let {@code GlobalExceptionHandler} map
 * exceptions to responses.
 *
 * @see com.phillippitts.fleetdump.presentation.exception.GlobalExceptionHandler
 */
package com.phillippitts.fleetdump.presentation.controller;
