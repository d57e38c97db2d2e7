/**
 * Immutable domain model of the analysis orchestrator.
 *
 * <p>All types are records or enums validated in their constructors:
 * <ul>
 *   <li>{@link com.phillippitts.windowanalysis.domain.AnalysisRequest} - one logical
 *       "analyze this image" request and its deadline</li>
 *   <li>{@link com.phillippitts.windowanalysis.domain.ProviderCallAttempt} - one attempt
 *       recorded by the retry executor</li>
 *   <li>{@link com.phillippitts.windowanalysis.domain.NormalizedResult} - canonical fields
 *       extracted from a single provider response</li>
 *   <li>{@link com.phillippitts.windowanalysis.domain.SynthesizedResult} - consensus across
 *       providers, with per-field provenance</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.windowanalysis.domain;
