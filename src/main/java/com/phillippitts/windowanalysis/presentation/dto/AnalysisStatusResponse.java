package com.phillippitts.windowanalysis.presentation.dto;

import com.phillippitts.windowanalysis.domain.RequestStatus;

/**
 * Status body returned while a request is queued or in flight, and by the status endpoint.
 */
public record AnalysisStatusResponse(String requestId, RequestStatus status) {}
