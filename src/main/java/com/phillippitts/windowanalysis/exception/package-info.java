/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.windowanalysis.exception.WindowAnalysisException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.windowanalysis.exception.ProviderException} - One provider call
 *       failed; subclasses split it into transient, permanent, rate-limited and exhausted</li>
 *   <li>{@link com.phillippitts.windowanalysis.exception.AllProvidersFailedException} - No provider
 *       contributed; the only error that aborts a whole request</li>
 *   <li>{@link com.phillippitts.windowanalysis.exception.TransportException} - HTTP-level failure
 *       raised by the provider transport, classified by each adapter</li>
 *   <li>{@link com.phillippitts.windowanalysis.exception.CredentialNotFoundException},
 *       {@link com.phillippitts.windowanalysis.exception.InvalidAnalysisRequestException},
 *       {@link com.phillippitts.windowanalysis.exception.AnalysisNotFoundException}</li>
 * </ul>
 *
 * <p>Per-provider exceptions never escape the fan-out coordinator. They are recorded as a
 * {@link com.phillippitts.windowanalysis.domain.FailureReason} on the synthesized result.
 *
 * @see com.phillippitts.windowanalysis.presentation.exception.GlobalExceptionHandler
 * @since 1.0
 */
package com.phillippitts.windowanalysis.exception;
