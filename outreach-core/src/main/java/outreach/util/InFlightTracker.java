package outreach.util;

/** Process-local guard that keeps two threads off the same attempt. */
public interface InFlightTracker {
  boolean tryAcquire(String attemptId);

  void release(String attemptId);
}
