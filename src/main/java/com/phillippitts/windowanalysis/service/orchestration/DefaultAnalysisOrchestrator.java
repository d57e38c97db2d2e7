package com.phillippitts.windowanalysis.service.orchestration;

import com.phillippitts.windowanalysis.config.properties.OrchestrationProperties;
import com.phillippitts.windowanalysis.config.properties.StoreProperties;
import com.phillippitts.windowanalysis.domain.AnalysisRequest;
import com.phillippitts.windowanalysis.domain.RequestStatus;
import com.phillippitts.windowanalysis.domain.SynthesizedResult;
import com.phillippitts.windowanalysis.exception.AnalysisNotFoundException;
import com.phillippitts.windowanalysis.exception.InvalidAnalysisRequestException;
import com.phillippitts.windowanalysis.service.persistence.AnalysisStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.scheduling.annotation.Scheduled;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Default orchestrator backed by an {@link AnalysisStore}.
 *
 * <p><b>Idempotency:</b> a request id that resolved earlier is answered from the store. A request
 * id that is currently in flight is joined rather than fanned out a second time. A request id that
 * failed is fanned out again, since the failure may have been transient.
 *
 * <p><b>Status tracking:</b> PENDING while in flight, RESOLVED once stored, FAILED when the fan-out
 * threw. Status entries share the store's retention period.
 */
public class DefaultAnalysisOrchestrator implements AnalysisOrchestrator {

    private static final Logger LOG = LogManager.getLogger(DefaultAnalysisOrchestrator.class);

    private final FanOutCoordinator coordinator;
    private final AnalysisStore store;
    private final long maxImageBytes;
    private final Duration statusTtl;
    private final Clock clock;

    private final Map<String, CompletableFuture<SynthesizedResult>> inFlight = new ConcurrentHashMap<>();
    private final Map<String, StatusEntry> statuses = new ConcurrentHashMap<>();

    public DefaultAnalysisOrchestrator(FanOutCoordinator coordinator,
                                       AnalysisStore store,
                                       OrchestrationProperties orchestrationProperties,
                                       StoreProperties storeProperties,
                                       Clock clock) {
        this.coordinator = Objects.requireNonNull(coordinator, "coordinator");
        this.store = Objects.requireNonNull(store, "store");
        this.maxImageBytes = orchestrationProperties.getMaxImageBytes();
        this.statusTtl = Duration.ofMinutes(storeProperties.getAuditTtlMinutes());
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public SynthesizedResult submit(AnalysisRequest request) {
        Objects.requireNonNull(request, "request");
        validate(request);

        Optional<SynthesizedResult> stored = store.load(request.id());
        if (stored.isPresent()) {
            LOG.info("Request {} already resolved; returning stored result", request.id());
            return stored.get();
        }

        CompletableFuture<SynthesizedResult> mine = new CompletableFuture<>();
        CompletableFuture<SynthesizedResult> existing = inFlight.putIfAbsent(request.id(), mine);
        if (existing != null) {
            LOG.info("Request {} already in flight; joining it", request.id());
            return await(existing);
        }

        try {
            // The id may have resolved between the load above and claiming the slot
            Optional<SynthesizedResult> raced = store.load(request.id());
            if (raced.isPresent()) {
                mine.complete(raced.get());
                return raced.get();
            }
            setStatus(request.id(), RequestStatus.PENDING);
            SynthesizedResult result = coordinator.analyze(request);
            store.save(request, result);
            setStatus(request.id(), RequestStatus.RESOLVED);
            mine.complete(result);
            return result;
        } catch (RuntimeException e) {
            setStatus(request.id(), RequestStatus.FAILED);
            mine.completeExceptionally(e);
            throw e;
        } finally {
            inFlight.remove(request.id(), mine);
        }
    }

    @Override
    public RequestStatus getStatus(String requestId) {
        StatusEntry entry = statuses.get(requestId);
        if (entry != null) {
            return entry.status();
        }
        if (store.load(requestId).isPresent()) {
            return RequestStatus.RESOLVED;
        }
        throw new AnalysisNotFoundException(requestId);
    }

    @Override
    public Optional<SynthesizedResult> getResult(String requestId) {
        return store.load(requestId);
    }

    /**
     * Drops status entries that have not changed within the retention period.
     */
    @Scheduled(fixedRate = 600_000) // 10 minutes
    public void purgeStaleStatuses() {
        Instant cutoff = clock.instant().minus(statusTtl);
        int before = statuses.size();
        statuses.entrySet().removeIf(e -> e.getValue().status() != RequestStatus.PENDING
                && e.getValue().updatedAt().isBefore(cutoff));
        int removed = before - statuses.size();
        if (removed > 0) {
            LOG.debug("Purged {} stale status entries", removed);
        }
    }

    private void validate(AnalysisRequest request) {
        long size = request.payload().approximateSizeBytes();
        if (size <= 0) {
            throw new InvalidAnalysisRequestException("image payload is empty");
        }
        if (size > maxImageBytes) {
            throw new InvalidAnalysisRequestException(
                    "image payload of " + size + " bytes exceeds limit of " + maxImageBytes + " bytes");
        }
    }

    private void setStatus(String requestId, RequestStatus status) {
        statuses.put(requestId, new StatusEntry(status, clock.instant()));
    }

    private static SynthesizedResult await(CompletableFuture<SynthesizedResult> future) {
        try {
            return future.join();
        } catch (CompletionException ce) {
            if (ce.getCause() instanceof RuntimeException re) {
                throw re;
            }
            throw ce;
        }
    }

    private record StatusEntry(RequestStatus status, Instant updatedAt) {}
}
