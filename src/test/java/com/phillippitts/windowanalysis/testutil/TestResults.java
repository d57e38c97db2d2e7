package com.phillippitts.windowanalysis.testutil;

import com.phillippitts.windowanalysis.domain.FieldValue;
import com.phillippitts.windowanalysis.domain.FrameMaterial;
import com.phillippitts.windowanalysis.domain.SynthesizedResult;
import com.phillippitts.windowanalysis.domain.WindowCategory;
import com.phillippitts.windowanalysis.domain.WindowCondition;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Canned synthesized results.
 */
public final class TestResults {

    private TestResults() {
    }

    /**
     * A complete result attributed entirely to {@code anthropic}.
     */
    public static SynthesizedResult result(String requestId) {
        return new SynthesizedResult(requestId,
                FieldValue.of(WindowCategory.CASEMENT, "anthropic"),
                FieldValue.of(FrameMaterial.WOOD, "anthropic"),
                FieldValue.of(WindowCondition.GOOD, "anthropic"),
                FieldValue.unattributed(null),
                FieldValue.of(2, "anthropic"),
                List.of(),
                90,
                80,
                List.of("anthropic"),
                List.of("anthropic"),
                Map.of(),
                false,
                Instant.parse("2024-05-01T10:00:00Z"));
    }
}
