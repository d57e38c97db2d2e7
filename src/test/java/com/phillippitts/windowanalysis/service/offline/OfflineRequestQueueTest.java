package com.phillippitts.windowanalysis.service.offline;

import com.phillippitts.windowanalysis.config.properties.OfflineProperties;
import com.phillippitts.windowanalysis.domain.AnalysisRequest;
import com.phillippitts.windowanalysis.domain.FailureReason;
import com.phillippitts.windowanalysis.domain.RequestStatus;
import com.phillippitts.windowanalysis.domain.SynthesizedResult;
import com.phillippitts.windowanalysis.exception.AllProvidersFailedException;
import com.phillippitts.windowanalysis.service.orchestration.AnalysisOrchestrator;
import com.phillippitts.windowanalysis.service.orchestration.event.QueuedRequestDroppedEvent;
import com.phillippitts.windowanalysis.service.orchestration.event.RequestQueuedEvent;
import com.phillippitts.windowanalysis.testutil.EventCapturingPublisher;
import com.phillippitts.windowanalysis.testutil.MutableClock;
import com.phillippitts.windowanalysis.testutil.TestResults;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;

import static com.phillippitts.windowanalysis.testutil.TestRequests.request;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class OfflineRequestQueueTest {

    private AnalysisOrchestrator orchestrator;
    private DefaultConnectivityMonitor monitor;
    private EventCapturingPublisher publisher;
    private MutableClock clock;
    private OfflineProperties props;
    private final List<Long> sleeps = new CopyOnWriteArrayList<>();
    private final List<String> submitted = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() {
        orchestrator = mock(AnalysisOrchestrator.class);
        monitor = new DefaultConnectivityMonitor(false);
        publisher = new EventCapturingPublisher();
        clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        props = new OfflineProperties();
        props.setMaxReplayAttempts(3);
        props.setReplayBaseDelayMs(100);
    }

    private OfflineRequestQueue queue() {
        return queue(monitor, Runnable::run);
    }

    private OfflineRequestQueue queue(ConnectivityMonitor connectivity, Executor replayExecutor) {
        return new OfflineRequestQueue(orchestrator, connectivity, publisher, props, replayExecutor,
                this::sleep, clock);
    }

    private void sleep(long millis) {
        sleeps.add(millis);
        clock.advance(Duration.ofMillis(millis));
    }

    private static AllProvidersFailedException failure(String id, FailureReason reason) {
        return new AllProvidersFailedException(id, Map.of("anthropic", reason));
    }

    @Test
    void onlineSubmissionPassesStraightThrough() {
        monitor.markOnline();
        OfflineRequestQueue queue = queue();
        AnalysisRequest req = request("r1", "anthropic");
        when(orchestrator.submit(req)).thenReturn(TestResults.result("r1"));

        SubmissionResult result = queue.submit(req);

        assertThat(result.isQueued()).isFalse();
        assertThat(result.result().requestId()).isEqualTo("r1");
        assertThat(queue.size()).isZero();
    }

    @Test
    void offlineSubmissionIsQueuedAndReportedPending() {
        OfflineRequestQueue queue = queue();

        SubmissionResult result = queue.submit(request("r1", "anthropic"));

        assertThat(result.isQueued()).isTrue();
        assertThat(result.requestId()).isEqualTo("r1");
        assertThat(queue.statusOf("r1")).isEqualTo(RequestStatus.PENDING);
        assertThat(queue.isQueued("r1")).isTrue();
        verify(orchestrator, never()).submit(any());
        assertThat(publisher.ofType(RequestQueuedEvent.class)).singleElement()
                .satisfies(e -> {
                    assertThat(e.queueSize()).isEqualTo(1);
                    assertThat(e.replaced()).isFalse();
                });
    }

    @Test
    void resubmittingQueuedIdReplacesItInPlace() {
        OfflineRequestQueue queue = queue();
        queue.submit(request("r1", "anthropic"));
        queue.submit(request("r2", "anthropic"));
        queue.submit(request("r1", "openai"));

        assertThat(queue.queuedIds()).containsExactly("r1", "r2");
        assertThat(queue.snapshot().get(0).request().providers()).containsExactly("openai");
        assertThat(publisher.ofType(RequestQueuedEvent.class)).last()
                .satisfies(e -> assertThat(e.replaced()).isTrue());
    }

    @Test
    void replaysInEnqueueOrderAndRetriesHeadBeforeMovingOn() {
        OfflineRequestQueue queue = queue();
        queue.submit(request("r1", "anthropic"));
        queue.submit(request("r2", "anthropic"));
        queue.submit(request("r3", "anthropic"));
        int[] r2Calls = {0};
        when(orchestrator.submit(any())).thenAnswer(inv -> {
            AnalysisRequest r = inv.getArgument(0);
            submitted.add(r.id());
            if (r.id().equals("r2") && ++r2Calls[0] == 1) {
                throw failure("r2", FailureReason.TIMED_OUT);
            }
            return TestResults.result(r.id());
        });

        monitor.markOnline();

        assertThat(submitted).containsExactly("r1", "r2", "r2", "r3");
        assertThat(sleeps).containsExactly(100L);
        assertThat(queue.size()).isZero();
        assertThat(publisher.ofType(QueuedRequestDroppedEvent.class)).isEmpty();
        // nothing left to drain
        assertThat(queue.replay()).isZero();
    }

    @Test
    void nonRetryableFailureDropsRequestAndContinues() {
        OfflineRequestQueue queue = queue();
        queue.submit(request("r1", "anthropic"));
        queue.submit(request("r2", "anthropic"));
        when(orchestrator.submit(any())).thenAnswer(inv -> {
            AnalysisRequest r = inv.getArgument(0);
            submitted.add(r.id());
            if (r.id().equals("r1")) {
                throw failure("r1", FailureReason.PERMANENT_FAILURE);
            }
            return TestResults.result(r.id());
        });

        monitor.markOnline();

        assertThat(submitted).containsExactly("r1", "r2");
        assertThat(publisher.ofType(QueuedRequestDroppedEvent.class)).singleElement()
                .satisfies(e -> {
                    assertThat(e.requestId()).isEqualTo("r1");
                    assertThat(e.attempts()).isEqualTo(1);
                    assertThat(e.reason()).contains("non-retryable");
                });
    }

    @Test
    void replayBudgetIsBoundedWithExponentialBackoff() {
        OfflineRequestQueue queue = queue();
        queue.submit(request("r1", "anthropic"));
        when(orchestrator.submit(any())).thenThrow(failure("r1", FailureReason.EXHAUSTED));

        monitor.markOnline();

        verify(orchestrator, times(3)).submit(any());
        assertThat(sleeps).containsExactly(100L, 200L);
        assertThat(queue.size()).isZero();
        assertThat(publisher.ofType(QueuedRequestDroppedEvent.class)).singleElement()
                .satisfies(e -> assertThat(e.attempts()).isEqualTo(3));
    }

    @Test
    void losingConnectivityMidReplayLeavesRemainingRequestsQueued() {
        OfflineRequestQueue queue = queue();
        queue.submit(request("r1", "anthropic"));
        queue.submit(request("r2", "anthropic"));
        when(orchestrator.submit(any())).thenAnswer(inv -> {
            monitor.markOffline();
            throw failure("r1", FailureReason.TIMED_OUT);
        });

        monitor.markOnline();

        assertThat(queue.queuedIds()).containsExactly("r1", "r2");
        assertThat(publisher.ofType(QueuedRequestDroppedEvent.class)).isEmpty();
    }

    @Test
    void replayRestartsTheTimeBudget() {
        OfflineRequestQueue queue = queue();
        AnalysisRequest original = request("r1", clock.instant(), Duration.ofSeconds(30), "anthropic");
        queue.submit(original);
        clock.advance(Duration.ofHours(2));
        when(orchestrator.submit(any())).thenAnswer(inv -> {
            AnalysisRequest replayed = inv.getArgument(0);
            assertThat(replayed.createdAt()).isEqualTo(clock.instant());
            assertThat(replayed.deadline()).isEqualTo(clock.instant().plusSeconds(30));
            return TestResults.result("r1");
        });

        monitor.markOnline();

        assertThat(queue.size()).isZero();
    }

    @Test
    void backoffDoublesPerReplayAttempt() {
        OfflineRequestQueue queue = queue();
        assertThat(queue.backoffDelayMs(0)).isEqualTo(100);
        assertThat(queue.backoffDelayMs(2)).isEqualTo(400);
        assertThat(queue.backoffDelayMs(40)).isEqualTo(Duration.ofHours(1).toMillis());
    }

    @Test
    void resolvedIdSubmittedOfflineReturnsStoredResultWithoutQueueing() {
        OfflineRequestQueue queue = queue();
        SynthesizedResult stored = TestResults.result("r1");
        when(orchestrator.getResult("r1")).thenReturn(Optional.of(stored));
        when(orchestrator.getStatus("r1")).thenReturn(RequestStatus.RESOLVED);

        SubmissionResult result = queue.submit(request("r1", "anthropic"));

        assertThat(result.isQueued()).isFalse();
        assertThat(result.result()).isSameAs(stored);
        assertThat(queue.size()).isZero();
        assertThat(queue.statusOf("r1")).isEqualTo(RequestStatus.RESOLVED);
        assertThat(publisher.ofType(RequestQueuedEvent.class)).isEmpty();
        verify(orchestrator, never()).submit(any());
    }

    @Test
    void reconnectBetweenCheckAndEnqueueStillReplaysTheRequest() {
        ConnectivityMonitor racing = mock(ConnectivityMonitor.class);
        when(racing.isOnline()).thenReturn(false, true);
        OfflineRequestQueue queue = queue(racing, Runnable::run);
        when(orchestrator.submit(any())).thenReturn(TestResults.result("r1"));

        SubmissionResult result = queue.submit(request("r1", "anthropic"));

        assertThat(result.isQueued()).isTrue();
        assertThat(queue.size()).isZero();
        verify(orchestrator, times(1)).submit(any());
    }

    @Test
    void reconnectHandsTheDrainToTheReplayExecutor() {
        List<Runnable> handedOff = new ArrayList<>();
        OfflineRequestQueue queue = queue(monitor, handedOff::add);
        queue.submit(request("r1", "anthropic"));
        when(orchestrator.submit(any())).thenReturn(TestResults.result("r1"));

        monitor.markOnline();

        assertThat(handedOff).hasSize(1);
        verify(orchestrator, never()).submit(any());
        assertThat(queue.isQueued("r1")).isTrue();

        handedOff.get(0).run();

        assertThat(queue.size()).isZero();
        verify(orchestrator, times(1)).submit(any());
    }

    @Test
    void failedReplaysAreRecordedOnTheEntryAndCarriedAcrossReconnects() {
        OfflineRequestQueue queue = queue();
        Instant start = clock.instant();
        queue.submit(request("r1", "anthropic"));
        when(orchestrator.submit(any())).thenAnswer(inv -> {
            monitor.markOffline();
            throw failure("r1", FailureReason.TIMED_OUT);
        });

        monitor.markOnline();

        assertThat(queue.snapshot()).singleElement().satisfies(entry -> {
            assertThat(entry.attempts()).isEqualTo(1);
            assertThat(entry.nextAttemptAt()).isEqualTo(start.plusMillis(100));
            assertThat(entry.isDue(start)).isFalse();
        });

        doThrow(failure("r1", FailureReason.TIMED_OUT)).when(orchestrator).submit(any());
        monitor.markOnline();

        verify(orchestrator, times(3)).submit(any());
        assertThat(sleeps).containsExactly(100L, 200L);
        assertThat(queue.size()).isZero();
        assertThat(publisher.ofType(QueuedRequestDroppedEvent.class)).singleElement()
                .satisfies(e -> assertThat(e.attempts()).isEqualTo(3));
    }

    @Test
    void resubmittingAFailedEntryResetsItsReplayState() {
        OfflineRequestQueue queue = queue();
        queue.submit(request("r1", "anthropic"));
        when(orchestrator.submit(any())).thenAnswer(inv -> {
            monitor.markOffline();
            throw failure("r1", FailureReason.TIMED_OUT);
        });
        monitor.markOnline();

        queue.submit(request("r1", "openai"));

        assertThat(queue.snapshot()).singleElement().satisfies(entry -> {
            assertThat(entry.attempts()).isZero();
            assertThat(entry.isDue(clock.instant())).isTrue();
        });
    }
}
