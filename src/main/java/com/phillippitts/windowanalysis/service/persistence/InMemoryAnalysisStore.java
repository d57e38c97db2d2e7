package com.phillippitts.windowanalysis.service.persistence;

import com.phillippitts.windowanalysis.config.properties.StoreProperties;
import com.phillippitts.windowanalysis.domain.AnalysisRequest;
import com.phillippitts.windowanalysis.domain.SynthesizedResult;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.scheduling.annotation.Scheduled;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local {@link AnalysisStore} with scheduled retention.
 *
 * <p>Entries expire {@code analysis.store.audit-ttl-minutes} after they were saved.
 */
public class InMemoryAnalysisStore implements AnalysisStore {

    private static final Logger LOG = LogManager.getLogger(InMemoryAnalysisStore.class);

    private final Map<String, Entry> entries = new ConcurrentHashMap<>();
    private final Duration ttl;
    private final Clock clock;

    public InMemoryAnalysisStore(StoreProperties properties, Clock clock) {
        this.ttl = Duration.ofMinutes(properties.getAuditTtlMinutes());
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public void save(AnalysisRequest request, SynthesizedResult result) {
        Objects.requireNonNull(request, "request");
        Objects.requireNonNull(result, "result");
        if (!request.id().equals(result.requestId())) {
            throw new IllegalArgumentException("Result " + result.requestId()
                    + " does not belong to request " + request.id());
        }
        entries.put(request.id(), new Entry(result, clock.instant()));
    }

    @Override
    public Optional<SynthesizedResult> load(String requestId) {
        Entry e = entries.get(requestId);
        return e == null ? Optional.empty() : Optional.of(e.result());
    }

    @Override
    public int purgeOlderThan(Instant cutoff) {
        int before = entries.size();
        entries.values().removeIf(e -> e.savedAt().isBefore(cutoff));
        return before - entries.size();
    }

    /**
     * Drops entries older than the configured TTL.
     */
    @Scheduled(fixedRate = 600_000) // 10 minutes
    public void purgeExpired() {
        int removed = purgeOlderThan(clock.instant().minus(ttl));
        if (removed > 0) {
            LOG.info("Purged {} analyses older than {} minutes", removed, ttl.toMinutes());
        }
    }

    public int size() {
        return entries.size();
    }

    private record Entry(SynthesizedResult result, Instant savedAt) {}
}
