package com.phillippitts.windowanalysis.service.synthesis;

import com.phillippitts.windowanalysis.domain.FailureReason;
import com.phillippitts.windowanalysis.domain.NormalizedResult;
import com.phillippitts.windowanalysis.domain.SynthesizedResult;
import com.phillippitts.windowanalysis.exception.AllProvidersFailedException;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Merges per-provider normalized results for one request into a consensus result.
 *
 * <p><b>Determinism:</b> the output depends only on the set of inputs, never on their order.
 * Provenance is decided by provider priority, not by arrival order.
 *
 * <p><b>Thread Safety:</b> Implementations should be stateless and thread-safe.
 */
public interface Synthesizer {

    /**
     * @param requestId          request being resolved
     * @param requestedProviders providers the request asked for
     * @param results            normalized results of providers whose call succeeded
     * @param failures           providers that failed before normalization, with the reason
     * @return consensus result, {@code partial} when any requested provider did not contribute
     * @throws AllProvidersFailedException if no provider contributed
     */
    SynthesizedResult synthesize(String requestId,
                                 List<String> requestedProviders,
                                 Collection<NormalizedResult> results,
                                 Map<String, FailureReason> failures);
}
