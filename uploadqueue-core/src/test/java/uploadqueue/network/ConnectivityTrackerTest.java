package uploadqueue.network;

import org.junit.jupiter.api.Test;
import uploadqueue.spi.NetworkMonitor;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ConnectivityTrackerTest {

  @Test
  void reportsInitialState() {
    assertTrue(new ConnectivityTracker(true).isOnline());
    assertFalse(new ConnectivityTracker(false).isOnline());
  }

  @Test
  void listenerFiresOnlyOnOfflineToOnlineEdge() {
    ConnectivityTracker tracker = new ConnectivityTracker(false);
    AtomicInteger reconnects = new AtomicInteger();
    tracker.onBecameOnline(reconnects::incrementAndGet);

    assertFalse(tracker.update(false));
    assertTrue(tracker.update(true));
    assertFalse(tracker.update(true));
    assertFalse(tracker.update(false));
    assertTrue(tracker.update(true));

    assertEquals(2, reconnects.get());
    assertTrue(tracker.isOnline());
  }

  @Test
  void startingOnlineDoesNotFire() {
    ConnectivityTracker tracker = new ConnectivityTracker(true);
    AtomicInteger reconnects = new AtomicInteger();
    tracker.onBecameOnline(reconnects::incrementAndGet);

    tracker.update(true);

    assertEquals(0, reconnects.get());
  }

  @Test
  void closedRegistrationStopsNotifications() {
    ConnectivityTracker tracker = new ConnectivityTracker(false);
    AtomicInteger reconnects = new AtomicInteger();
    NetworkMonitor.Registration registration = tracker.onBecameOnline(reconnects::incrementAndGet);

    registration.close();
    tracker.update(true);

    assertEquals(0, reconnects.get());
    assertEquals(0, tracker.listenerCount());
  }

  @Test
  void failingListenerDoesNotBlockOthers() {
    ConnectivityTracker tracker = new ConnectivityTracker(false);
    AtomicInteger reconnects = new AtomicInteger();
    tracker.onBecameOnline(() -> {
      throw new IllegalStateException("boom");
    });
    tracker.onBecameOnline(reconnects::incrementAndGet);

    assertTrue(tracker.update(true));

    assertEquals(1, reconnects.get());
  }

  @Test
  void nullListenerThrows() {
    assertThrows(NullPointerException.class, () -> new ConnectivityTracker(true).onBecameOnline(null));
  }
}
