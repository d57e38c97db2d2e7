package com.phillippitts.windowanalysis.service.orchestration;

import com.phillippitts.windowanalysis.domain.AnalysisRequest;
import com.phillippitts.windowanalysis.domain.SynthesizedResult;
import com.phillippitts.windowanalysis.exception.AllProvidersFailedException;

/**
 * Runs one analysis against every requested provider concurrently and merges the outcome.
 *
 * <p>Per-provider failures never abort sibling providers. The request deadline is the only
 * cancellation trigger: units still running when it elapses are abandoned and recorded as
 * timed out.
 */
public interface FanOutCoordinator {

    /**
     * @param request analysis request (providers, payload, deadline)
     * @return synthesized result, flagged partial when some provider did not contribute
     * @throws AllProvidersFailedException if no requested provider contributed
     */
    SynthesizedResult analyze(AnalysisRequest request);
}
