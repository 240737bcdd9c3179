package outreach.budget;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Consumed-versus-cap counter for one company and wave.
 *
 * <p>{@link #tryConsume(int)} is a compare-and-increment: it either moves the count to a
 * value within the cap or leaves it untouched. Concurrent callers can therefore never
 * push the count above the cap together.
 */
public final class BudgetCounter {
  private final int cap;
  private final AtomicInteger consumed;

  public BudgetCounter(int cap, int consumed) {
    if (cap < 0) {
      throw new IllegalArgumentException("cap must be >= 0");
    }
    if (consumed < 0 || consumed > cap) {
      throw new IllegalArgumentException("consumed must be in [0, cap]");
    }
    this.cap = cap;
    this.consumed = new AtomicInteger(consumed);
  }

  /**
   * @param n units to consume, positive
   * @return {@code true} if consumed; {@code false} if that would exceed the cap
   */
  public boolean tryConsume(int n) {
    if (n <= 0) {
      throw new IllegalArgumentException("n must be > 0");
    }
    while (true) {
      int current = consumed.get();
      int next = current + n;
      if (next > cap) {
        return false;
      }
      if (consumed.compareAndSet(current, next)) {
        return true;
      }
    }
  }

  public void release(int n) {
    if (n <= 0) {
      throw new IllegalArgumentException("n must be > 0");
    }
    consumed.updateAndGet(current -> Math.max(0, current - n));
  }

  public int cap() {
    return cap;
  }

  public int consumed() {
    return consumed.get();
  }

  public int remaining() {
    return cap - consumed.get();
  }
}
