package outreach.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DefaultInFlightTrackerTest {

  @Test
  void acquireFailsForAttemptAlreadyInFlight() {
    DefaultInFlightTracker tracker = new DefaultInFlightTracker();

    assertTrue(tracker.tryAcquire("attempt-1"));
    assertFalse(tracker.tryAcquire("attempt-1"));
    assertTrue(tracker.tryAcquire("attempt-2"));
    assertEquals(2, tracker.size());
  }

  @Test
  void releaseAllowsReacquisition() {
    DefaultInFlightTracker tracker = new DefaultInFlightTracker();

    assertTrue(tracker.tryAcquire("attempt-1"));
    tracker.release("attempt-1");
    assertTrue(tracker.tryAcquire("attempt-1"));
  }

  @Test
  void expiredEntryCanBeTakenOver() throws InterruptedException {
    DefaultInFlightTracker tracker = new DefaultInFlightTracker(20);

    assertTrue(tracker.tryAcquire("attempt-1"));
    Thread.sleep(60);
    assertTrue(tracker.tryAcquire("attempt-1"));
    assertFalse(tracker.tryAcquire("attempt-1"));
  }

  @Test
  void negativeTtlRejected() {
    assertThrows(IllegalArgumentException.class, () -> new DefaultInFlightTracker(-1));
  }
}
