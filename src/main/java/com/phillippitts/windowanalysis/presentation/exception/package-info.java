/**
 * Global exception handling for REST API responses.
 *
 * <p>Exception Mapping:
 * <ul>
 *   <li>{@link com.phillippitts.windowanalysis.exception.InvalidAnalysisRequestException} → 400 Bad Request</li>
 *   <li>{@link com.phillippitts.windowanalysis.exception.AnalysisNotFoundException} → 404 Not Found</li>
 *   <li>{@link com.phillippitts.windowanalysis.exception.AllProvidersFailedException} → 503 Service Unavailable</li>
 *   <li>{@code Exception} (catch-all) → 500 Internal Server Error</li>
 * </ul>
 *
 * <p>Response Format:
 * <pre>
 * {
 *   "errorCode": "AllProvidersFailedException",
 *   "message": "Analysis providers temporarily unavailable, please retry",
 *   "details": "anthropic=EXHAUSTED, openai=RATE_LIMITED",
 *   "timestamp": "2025-10-17T15:42:32.529Z"
 * }
 * </pre>
 */
package com.phillippitts.windowanalysis.presentation.exception;
