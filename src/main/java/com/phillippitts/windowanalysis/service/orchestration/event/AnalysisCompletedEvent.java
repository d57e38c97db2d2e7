package com.phillippitts.windowanalysis.service.orchestration.event;

import com.phillippitts.windowanalysis.domain.SynthesizedResult;

import java.time.Instant;

/**
 * Emitted when an analysis produced a (possibly partial) synthesized result.
 *
 * @param result     the synthesized result
 * @param durationMs time from fan-out to synthesis
 * @param timestamp  when the analysis completed
 */
public record AnalysisCompletedEvent(
        SynthesizedResult result,
        long durationMs,
        Instant timestamp
) {}
