/**
 * Logging infrastructure and MDC (Mapped Diagnostic Context) configuration.
 *
 * <p>MDC Keys:
 * <ul>
 *   <li>{@code requestId} - HTTP request correlation id, set by
 *       {@link com.phillippitts.windowanalysis.config.logging.MdcFilter}</li>
 *   <li>{@code analysisId} - analysis request id, set by the fan-out coordinator</li>
 *   <li>{@code provider} - provider id, set inside each provider unit</li>
 * </ul>
 *
 * <p>Log Format:
 * <pre>
 * 2025-10-17 15:42:32.529 [provider-pool-1] [requestId] [analysisId] [provider] LEVEL logger.name - message
 * </pre>
 */
package com.phillippitts.windowanalysis.config.logging;
