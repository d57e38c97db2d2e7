/**
 * REST API controllers for HTTP endpoints.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@code POST /api/analyses} - submit an analysis (200 result, 202 queued)</li>
 *   <li>{@code GET /api/analyses/{id}} - stored result, or 202 with status</li>
 *   <li>{@code GET /api/analyses/{id}/status} - PENDING, RESOLVED or FAILED</li>
 *   <li>{@code GET /api/analyses/queue} - connectivity and queued request ids</li>
 *   <li>{@code GET /ping} - liveness and MDC check</li>
 * </ul>
 *
 * @see com.phillippitts.windowanalysis.presentation.exception.GlobalExceptionHandler
 */
package com.phillippitts.windowanalysis.presentation.controller;
