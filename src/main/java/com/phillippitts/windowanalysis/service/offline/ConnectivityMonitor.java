package com.phillippitts.windowanalysis.service.offline;

/**
 * Tracks whether provider transport is reachable and announces reconnection.
 */
public interface ConnectivityMonitor {

    boolean isOnline();

    /**
     * Records that connectivity is available. Listeners are notified only on an offline-to-online
     * transition.
     */
    void markOnline();

    void markOffline();

    void addListener(ConnectivityListener listener);

    /**
     * Callback for offline-to-online transitions.
     */
    @FunctionalInterface
    interface ConnectivityListener {
        void onReconnect();
    }
}
