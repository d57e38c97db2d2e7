package com.phillippitts.windowanalysis.service.offline;

import com.phillippitts.windowanalysis.config.properties.OfflineProperties;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;

class ConnectivityProbeTest {

    private MockWebServer server;
    private OfflineProperties props;
    private DefaultConnectivityMonitor monitor;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        props = new OfflineProperties();
        props.setProbeUrl(server.url("/health").toString());
        props.setProbeTimeoutMs(2_000);
        monitor = new DefaultConnectivityMonitor(false);
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void anyHttpAnswerMarksOnline() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(503));
        ConnectivityProbe probe = new ConnectivityProbe(new OkHttpClient(), monitor, props);

        assertThat(probe.probe()).isTrue();
        assertThat(monitor.isOnline()).isTrue();
        assertThat(server.takeRequest().getMethod()).isEqualTo("HEAD");
    }

    @Test
    void unreachableUrlMarksOffline() {
        monitor.markOnline();
        props.setProbeUrl("http://localhost:1/health");
        ConnectivityProbe probe = new ConnectivityProbe(new OkHttpClient(), monitor, props);

        assertThat(probe.probe()).isFalse();
        assertThat(monitor.isOnline()).isFalse();
    }

    @Test
    void scheduledProbeIsSkippedWithoutUrl() {
        props.setProbeUrl("");
        ConnectivityProbe probe = new ConnectivityProbe(new OkHttpClient(), monitor, props);

        probe.scheduledProbe();

        assertThat(server.getRequestCount()).isZero();
        assertThat(monitor.isOnline()).isFalse();
    }
}
