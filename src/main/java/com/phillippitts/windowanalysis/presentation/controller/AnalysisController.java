package com.phillippitts.windowanalysis.presentation.controller;

import com.phillippitts.windowanalysis.config.properties.OrchestrationProperties;
import com.phillippitts.windowanalysis.domain.AnalysisRequest;
import com.phillippitts.windowanalysis.domain.ImagePayload;
import com.phillippitts.windowanalysis.domain.RequestContext;
import com.phillippitts.windowanalysis.domain.RequestStatus;
import com.phillippitts.windowanalysis.domain.SynthesizedResult;
import com.phillippitts.windowanalysis.exception.InvalidAnalysisRequestException;
import com.phillippitts.windowanalysis.presentation.dto.AnalysisStatusResponse;
import com.phillippitts.windowanalysis.presentation.dto.AnalysisSubmission;
import com.phillippitts.windowanalysis.service.offline.ConnectivityMonitor;
import com.phillippitts.windowanalysis.service.offline.OfflineRequestQueue;
import com.phillippitts.windowanalysis.service.offline.SubmissionResult;
import com.phillippitts.windowanalysis.service.orchestration.AnalysisOrchestrator;
import jakarta.validation.Valid;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * REST surface for submitting window photos and polling their analyses.
 */
@RestController
@RequestMapping("/api/analyses")
class AnalysisController {

    private static final Logger LOG = LogManager.getLogger(AnalysisController.class);

    private final OfflineRequestQueue queue;
    private final AnalysisOrchestrator orchestrator;
    private final ConnectivityMonitor connectivity;
    private final OrchestrationProperties properties;
    private final Clock clock;

    AnalysisController(OfflineRequestQueue queue,
                       AnalysisOrchestrator orchestrator,
                       ConnectivityMonitor connectivity,
                       OrchestrationProperties properties,
                       Clock clock) {
        this.queue = queue;
        this.orchestrator = orchestrator;
        this.connectivity = connectivity;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Submits an analysis. 200 with the synthesized result, or 202 when queued offline.
     */
    @PostMapping
    ResponseEntity<?> submit(@Valid @RequestBody AnalysisSubmission body) {
        AnalysisRequest request = toRequest(body);
        LOG.info("Analysis {} submitted for providers {}", request.id(), request.providers());
        SubmissionResult outcome = queue.submit(request);
        if (outcome.isQueued()) {
            return ResponseEntity.status(HttpStatus.ACCEPTED)
                    .body(new AnalysisStatusResponse(outcome.requestId(), RequestStatus.PENDING));
        }
        return ResponseEntity.ok(outcome.result());
    }

    /**
     * 200 with the stored result, or 202 with the current status when not resolved.
     */
    @GetMapping("/{id}")
    ResponseEntity<?> result(@PathVariable("id") String id) {
        Optional<SynthesizedResult> result = orchestrator.getResult(id);
        if (result.isPresent()) {
            return ResponseEntity.ok(result.get());
        }
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(new AnalysisStatusResponse(id, queue.statusOf(id)));
    }

    @GetMapping("/{id}/status")
    ResponseEntity<AnalysisStatusResponse> status(@PathVariable("id") String id) {
        return ResponseEntity.ok(new AnalysisStatusResponse(id, queue.statusOf(id)));
    }

    @GetMapping("/queue")
    ResponseEntity<Map<String, Object>> queued() {
        return ResponseEntity.ok(Map.of(
                "online", connectivity.isOnline(),
                "queued", queue.queuedIds()
        ));
    }

    private AnalysisRequest toRequest(AnalysisSubmission body) {
        List<String> providers = body.providers() == null || body.providers().isEmpty()
                ? properties.getDefaultProviders()
                : body.providers();
        try {
            return AnalysisRequest.builder()
                    .id(body.id())
                    .payload(new ImagePayload(body.image(), body.mediaType()))
                    .providers(providers)
                    .context(new RequestContext(body.sessionId(), body.locale(), body.prompt()))
                    .clock(clock)
                    .timeout(Duration.ofMillis(properties.getDeadlineMs()))
                    .build();
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new InvalidAnalysisRequestException(e.getMessage(), e);
        }
    }
}
