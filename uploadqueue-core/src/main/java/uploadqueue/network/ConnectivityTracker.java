package uploadqueue.network;

import uploadqueue.spi.NetworkMonitor;

import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Edge-detecting {@link NetworkMonitor} fed by the hosting application.
 *
 * <p>The host forwards every connectivity report from its platform to
 * {@link #update(boolean)}; repeated reports of the same state are ignored, and
 * listeners fire only on an offline-to-online transition. Listeners run on the thread
 * calling {@code update} and must not block.
 *
 * <pre>{@code
 * ConnectivityTracker connectivity = new ConnectivityTracker(false);
 * platform.onConnectivityChanged(connectivity::update);
 * UploadQueue queue = UploadQueue.builder().networkMonitor(connectivity)...build();
 * }</pre>
 */
public final class ConnectivityTracker implements NetworkMonitor {
  private static final Logger logger = Logger.getLogger(ConnectivityTracker.class.getName());

  private final AtomicBoolean online;
  private final CopyOnWriteArrayList<Runnable> listeners = new CopyOnWriteArrayList<>();

  public ConnectivityTracker(boolean initiallyOnline) {
    this.online = new AtomicBoolean(initiallyOnline);
  }

  @Override
  public boolean isOnline() {
    return online.get();
  }

  /**
   * Reports the current connectivity state.
   *
   * @param nowOnline whether the backend is reachable
   * @return {@code true} if this report was an offline-to-online transition
   */
  public boolean update(boolean nowOnline) {
    boolean previous = online.getAndSet(nowOnline);
    if (previous || !nowOnline) {
      if (previous && !nowOnline) {
        logger.info("Connectivity lost");
      }
      return false;
    }
    logger.info("Back online; notifying " + listeners.size() + " listener(s)");
    for (Runnable listener : listeners) {
      try {
        listener.run();
      } catch (RuntimeException e) {
        logger.log(Level.WARNING, "Became-online listener failed", e);
      }
    }
    return true;
  }

  @Override
  public Registration onBecameOnline(Runnable listener) {
    listeners.add(Objects.requireNonNull(listener, "listener"));
    return () -> listeners.remove(listener);
  }

  int listenerCount() {
    return listeners.size();
  }
}
