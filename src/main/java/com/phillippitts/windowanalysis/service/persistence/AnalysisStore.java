package com.phillippitts.windowanalysis.service.persistence;

import com.phillippitts.windowanalysis.domain.AnalysisRequest;
import com.phillippitts.windowanalysis.domain.SynthesizedResult;

import java.time.Instant;
import java.util.Optional;

/**
 * Persistence for resolved analyses, backing idempotent resubmission.
 */
public interface AnalysisStore {

    /**
     * Stores the result for a request, replacing any earlier result with the same id.
     */
    void save(AnalysisRequest request, SynthesizedResult result);

    /**
     * @return the stored result, or empty if the id was never resolved (or was purged)
     */
    Optional<SynthesizedResult> load(String requestId);

    /**
     * Removes results saved before the cutoff.
     *
     * @return number of removed entries
     */
    int purgeOlderThan(Instant cutoff);
}
