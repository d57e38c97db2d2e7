package com.phillippitts.windowanalysis.service.orchestration;

import com.phillippitts.windowanalysis.domain.AnalysisRequest;
import com.phillippitts.windowanalysis.domain.RequestStatus;
import com.phillippitts.windowanalysis.domain.SynthesizedResult;
import com.phillippitts.windowanalysis.exception.AllProvidersFailedException;
import com.phillippitts.windowanalysis.exception.AnalysisNotFoundException;
import com.phillippitts.windowanalysis.exception.InvalidAnalysisRequestException;

import java.util.Optional;

/**
 * Entry point for analyses: validation, idempotent resubmission and status tracking around
 * the {@link FanOutCoordinator}.
 */
public interface AnalysisOrchestrator {

    /**
     * Resolves a request synchronously.
     *
     * <p>Resubmitting an id that already resolved returns the stored result without calling any
     * provider. Concurrent submissions of the same id share one fan-out.
     *
     * @throws InvalidAnalysisRequestException if the payload is oversized or empty
     * @throws AllProvidersFailedException     if no provider contributed
     */
    SynthesizedResult submit(AnalysisRequest request);

    /**
     * @throws AnalysisNotFoundException if the id was never submitted (or has expired)
     */
    RequestStatus getStatus(String requestId);

    /**
     * Stored result for a resolved request.
     */
    Optional<SynthesizedResult> getResult(String requestId);
}
