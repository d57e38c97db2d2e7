package com.phillippitts.windowanalysis.presentation.controller;

import com.phillippitts.windowanalysis.service.offline.ConnectivityMonitor;
import com.phillippitts.windowanalysis.service.offline.OfflineRequestQueue;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.Map;

/**
 * Cheap liveness check. Also reports whether providers are currently reachable and how many
 * submissions wait for replay, so a client can tell "up but offline" from "up".
 */
@RestController
class PingController {

    private static final Logger LOG = LogManager.getLogger(PingController.class);

    private final ConnectivityMonitor connectivity;
    private final OfflineRequestQueue queue;
    private final Clock clock;

    PingController(ConnectivityMonitor connectivity, OfflineRequestQueue queue, Clock clock) {
        this.connectivity = connectivity;
        this.queue = queue;
        this.clock = clock;
    }

    @GetMapping("/ping")
    ResponseEntity<Map<String, Object>> ping() {
        boolean online = connectivity.isOnline();
        int queued = queue.size();
        LOG.debug("Ping: online={}, queued={}", online, queued);
        return ResponseEntity.ok(Map.of(
                "status", "ok",
                "online", online,
                "queued", queued,
                "timestamp", clock.instant().toString()
        ));
    }
}
