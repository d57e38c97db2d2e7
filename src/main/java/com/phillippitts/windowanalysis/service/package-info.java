/**
 * Analysis pipeline services.
 *
 * <p>Sub-packages, in call order:
 * <ul>
 *   <li>{@code service.offline} - offline queue and connectivity, the entry point</li>
 *   <li>{@code service.orchestration} - idempotent orchestrator and fan-out coordinator</li>
 *   <li>{@code service.ratelimit} - per-provider sliding-window rate limiter</li>
 *   <li>{@code service.retry} - exponential-backoff retry executor</li>
 *   <li>{@code service.provider} - provider adapters, transport and credentials</li>
 *   <li>{@code service.normalize} - rule-table response normalizer</li>
 *   <li>{@code service.synthesis} - priority-based consensus synthesizer</li>
 *   <li>{@code service.persistence} - resolved analysis store</li>
 *   <li>{@code service.events}, {@code service.metrics}, {@code service.health} - observability</li>
 * </ul>
 */
package com.phillippitts.windowanalysis.service;
