package com.phillippitts.windowanalysis.presentation.controller;

import com.phillippitts.windowanalysis.service.offline.ConnectivityMonitor;
import com.phillippitts.windowanalysis.service.offline.OfflineRequestQueue;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class PingControllerTest {

    @Test
    void reportsConnectivityAndQueueDepth() {
        ConnectivityMonitor connectivity = mock(ConnectivityMonitor.class);
        OfflineRequestQueue queue = mock(OfflineRequestQueue.class);
        when(connectivity.isOnline()).thenReturn(false);
        when(queue.size()).thenReturn(2);
        Clock clock = Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC);

        var response = new PingController(connectivity, queue, clock).ping();

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody())
                .containsEntry("status", "ok")
                .containsEntry("online", false)
                .containsEntry("queued", 2)
                .containsEntry("timestamp", "2024-05-01T10:00:00Z");
    }
}
