package com.phillippitts.windowanalysis.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

import java.util.List;

/**
 * JSON body of {@code POST /api/analyses}.
 *
 * @param id        optional idempotency key; generated when absent
 * @param image     base64 image data, optionally as a {@code data:image/...;base64,} URL
 * @param mediaType image media type; defaults to the type named in a data URL, else {@code image/jpeg}
 * @param providers provider ids to ask; defaults to the configured default providers
 * @param sessionId optional caller session
 * @param locale    optional caller locale
 * @param prompt    optional prompt override for text-generating providers
 */
public record AnalysisSubmission(
        @Size(max = 128) String id,
        @NotBlank String image,
        String mediaType,
        List<String> providers,
        String sessionId,
        String locale,
        @Size(max = 4000) String prompt
) {}
