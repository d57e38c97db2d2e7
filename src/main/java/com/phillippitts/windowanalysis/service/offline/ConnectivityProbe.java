package com.phillippitts.windowanalysis.service.offline;

import com.phillippitts.windowanalysis.config.properties.OfflineProperties;
import okhttp3.Call;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.scheduling.annotation.Scheduled;

import java.io.IOException;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Periodic HTTP HEAD against {@code analysis.offline.probe-url}, driving the
 * {@link ConnectivityMonitor}. Any HTTP response counts as reachable; only I/O failures
 * mark the monitor offline. Disabled when no probe URL is configured.
 */
public class ConnectivityProbe {

    private static final Logger LOG = LogManager.getLogger(ConnectivityProbe.class);

    private final OkHttpClient client;
    private final ConnectivityMonitor monitor;
    private final OfflineProperties properties;

    public ConnectivityProbe(OkHttpClient client, ConnectivityMonitor monitor, OfflineProperties properties) {
        this.client = Objects.requireNonNull(client, "client");
        this.monitor = Objects.requireNonNull(monitor, "monitor");
        this.properties = Objects.requireNonNull(properties, "properties");
    }

    @Scheduled(fixedDelayString = "${analysis.offline.probe-interval-ms:30000}")
    public void scheduledProbe() {
        if (properties.isProbeEnabled()) {
            probe();
        }
    }

    /**
     * Runs one probe and updates the monitor.
     *
     * @return true if the probe URL answered
     */
    public boolean probe() {
        Request request = new Request.Builder().url(properties.getProbeUrl()).head().build();
        Call call = client.newCall(request);
        call.timeout().timeout(properties.getProbeTimeoutMs(), TimeUnit.MILLISECONDS);
        try (Response response = call.execute()) {
            LOG.debug("Connectivity probe answered with HTTP {}", response.code());
            monitor.markOnline();
            return true;
        } catch (IOException e) {
            LOG.debug("Connectivity probe failed: {}", e.getMessage());
            monitor.markOffline();
            return false;
        }
    }
}
