/**
 * Presentation layer (REST API controllers and exception handling).
 *
 * <p>Controllers are thin adapters: they translate JSON into an
 * {@link com.phillippitts.windowanalysis.domain.AnalysisRequest} and delegate to the offline queue
 * and orchestrator. Exception handlers map domain exceptions to HTTP status codes.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code presentation.controller} - REST controllers for API endpoints</li>
 *   <li>{@code presentation.dto} - request and status bodies</li>
 *   <li>{@code presentation.exception} - Global exception handling for HTTP responses</li>
 * </ul>
 */
package com.phillippitts.windowanalysis.presentation;
