package uploadqueue.spi;

/**
 * Connectivity signal consumed by the scheduler. The queue never detects connectivity
 * itself; the hosting application supplies an implementation backed by its platform.
 *
 * @see uploadqueue.network.ConnectivityTracker
 */
public interface NetworkMonitor {

    /**
     * Monitor that always reports online and never fires a transition.
     */
    NetworkMonitor ALWAYS_ONLINE = new NetworkMonitor() {
        @Override
        public boolean isOnline() {
            return true;
        }

        @Override
        public Registration onBecameOnline(Runnable listener) {
            return () -> {
            };
        }
    };

    /**
     * Returns the current connectivity state.
     *
     * @return {@code true} if the backend is believed reachable
     */
    boolean isOnline();

    /**
     * Subscribes to offline-to-online transitions. The listener fires once per
     * transition (edge-triggered), not while the state stays online.
     *
     * @param listener callback; may run on any thread and must not block
     * @return a registration that unsubscribes the listener when closed
     */
    Registration onBecameOnline(Runnable listener);

    /**
     * Handle for removing a listener. Closing twice is harmless.
     */
    @FunctionalInterface
    interface Registration extends AutoCloseable {
        @Override
        void close();
    }
}
