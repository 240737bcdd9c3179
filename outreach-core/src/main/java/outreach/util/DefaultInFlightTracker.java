package outreach.util;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link ConcurrentHashMap}-based {@link InFlightTracker} with optional expiry.
 *
 * <p>With a positive TTL an entry older than the TTL can be re-acquired, so an attempt
 * held by a worker that died mid-send is picked up again by a later sweep.
 */
public final class DefaultInFlightTracker implements InFlightTracker {
  private final Map<String, Long> inflight = new ConcurrentHashMap<>();
  private final long ttlMs;

  public DefaultInFlightTracker() {
    this(0L);
  }

  public DefaultInFlightTracker(long ttlMs) {
    if (ttlMs < 0) {
      throw new IllegalArgumentException("ttlMs must be >= 0");
    }
    this.ttlMs = ttlMs;
  }

  @Override
  public boolean tryAcquire(String attemptId) {
    long now = System.currentTimeMillis();
    Long existing = inflight.putIfAbsent(attemptId, now);
    if (existing == null) {
      return true;
    }
    return ttlMs > 0 && now - existing > ttlMs && inflight.replace(attemptId, existing, now);
  }

  @Override
  public void release(String attemptId) {
    inflight.remove(attemptId);
  }

  int size() {
    return inflight.size();
  }
}
