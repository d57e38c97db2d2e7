package com.phillippitts.windowanalysis.testutil;

import org.springframework.context.ApplicationEventPublisher;

import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * Records every published orchestration event so tests can assert on what the core emitted
 * without a Spring context. Safe to publish into from provider worker threads.
 */
public class EventCapturingPublisher implements ApplicationEventPublisher {

    private final Queue<Object> published = new ConcurrentLinkedQueue<>();

    @Override
    public void publishEvent(Object event) {
        published.add(event);
    }

    /**
     * Published events of the given type, in publication order.
     */
    public <T> List<T> ofType(Class<T> type) {
        return published.stream()
                .filter(type::isInstance)
                .map(type::cast)
                .toList();
    }

    public List<Object> all() {
        return List.copyOf(published);
    }

    public void clear() {
        published.clear();
    }
}
