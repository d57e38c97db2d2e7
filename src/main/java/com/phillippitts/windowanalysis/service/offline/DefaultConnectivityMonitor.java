package com.phillippitts.windowanalysis.service.offline;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Flag-based connectivity monitor. Starts online.
 *
 * <p>Listeners run on the thread that reported the transition.
 */
public class DefaultConnectivityMonitor implements ConnectivityMonitor {

    private static final Logger LOG = LogManager.getLogger(DefaultConnectivityMonitor.class);

    private final AtomicBoolean online;
    private final List<ConnectivityListener> listeners = new CopyOnWriteArrayList<>();

    public DefaultConnectivityMonitor() {
        this(true);
    }

    public DefaultConnectivityMonitor(boolean initiallyOnline) {
        this.online = new AtomicBoolean(initiallyOnline);
    }

    @Override
    public boolean isOnline() {
        return online.get();
    }

    @Override
    public void markOnline() {
        if (!online.compareAndSet(false, true)) {
            return;
        }
        LOG.info("Connectivity restored; notifying {} listener(s)", listeners.size());
        for (ConnectivityListener listener : listeners) {
            try {
                listener.onReconnect();
            } catch (RuntimeException e) {
                LOG.error("Reconnect listener failed", e);
            }
        }
    }

    @Override
    public void markOffline() {
        if (online.compareAndSet(true, false)) {
            LOG.warn("Connectivity lost; new analyses will be queued");
        }
    }

    @Override
    public void addListener(ConnectivityListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }
}
