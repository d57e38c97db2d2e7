package com.phillippitts.windowanalysis.domain;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable "analyze this image" request, fanned out to every requested provider.
 *
 * <p>The identifier is the idempotency key: submitting a request whose id already resolved
 * returns the stored result instead of calling providers again.
 *
 * @param id          unique request identifier (caller-supplied or generated)
 * @param payload     image to analyze
 * @param providers   requested provider ids, de-duplicated, in caller order
 * @param context     caller metadata (session, locale, prompt override)
 * @param createdAt   creation timestamp
 * @param deadline    instant after which unfinished provider calls are abandoned
 */
public record AnalysisRequest(
        String id,
        ImagePayload payload,
        List<String> providers,
        RequestContext context,
        Instant createdAt,
        Instant deadline
) {

    public AnalysisRequest {
        Objects.requireNonNull(id, "id");
        if (id.isBlank()) {
            throw new IllegalArgumentException("Request id must not be blank");
        }
        Objects.requireNonNull(payload, "payload");
        Objects.requireNonNull(providers, "providers");
        providers = List.copyOf(new LinkedHashSet<>(providers));
        if (providers.isEmpty()) {
            throw new IllegalArgumentException("At least one provider must be requested");
        }
        context = context == null ? RequestContext.EMPTY : context;
        Objects.requireNonNull(createdAt, "createdAt");
        Objects.requireNonNull(deadline, "deadline");
        if (deadline.isBefore(createdAt)) {
            throw new IllegalArgumentException("Deadline must not precede creation time");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Time left until the deadline, never negative.
     */
    public Duration remaining(Instant now) {
        Duration left = Duration.between(now, deadline);
        return left.isNegative() ? Duration.ZERO : left;
    }

    /**
     * Fluent builder; generates an id and timestamps when they are not supplied.
     */
    public static final class Builder {
        private String id;
        private ImagePayload payload;
        private final List<String> providers = new ArrayList<>();
        private RequestContext context = RequestContext.EMPTY;
        private Instant createdAt;
        private Instant deadline;
        private Duration timeout;
        private Clock clock = Clock.systemUTC();

        private Builder() {
        }

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder payload(ImagePayload payload) {
            this.payload = payload;
            return this;
        }

        public Builder provider(String providerId) {
            this.providers.add(providerId);
            return this;
        }

        public Builder providers(List<String> providerIds) {
            this.providers.addAll(providerIds);
            return this;
        }

        public Builder context(RequestContext context) {
            this.context = context;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        /** Source of the creation time when none is set explicitly. */
        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        public Builder deadline(Instant deadline) {
            this.deadline = deadline;
            return this;
        }

        /** Deadline relative to the creation time; ignored when an absolute deadline is set. */
        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public AnalysisRequest build() {
            Instant created = createdAt != null ? createdAt : clock.instant();
            Instant due = deadline;
            if (due == null) {
                due = created.plus(timeout != null ? timeout : Duration.ofSeconds(60));
            }
            String requestId = (id == null || id.isBlank()) ? "req-" + UUID.randomUUID() : id;
            return new AnalysisRequest(requestId, payload, providers, context, created, due);
        }
    }
}
