package outreach.signal;

import outreach.OutreachException;
import outreach.lifecycle.LifecycleTracker;
import outreach.spi.SignalEvent;
import outreach.spi.SignalFeed;
import outreach.util.DaemonThreadFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Pulls reply and claim events from a {@link SignalFeed} and applies them through the
 * {@link LifecycleTracker}.
 *
 * <p>Events are applied one by one; a failing event is logged and does not hold back
 * the rest of the batch. Applying an event twice has no further effect.
 */
public final class SignalPoller implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(SignalPoller.class.getName());

  private final SignalFeed feed;
  private final LifecycleTracker tracker;
  private final int batchSize;
  private final Duration interval;

  private ScheduledExecutorService scheduler;
  private volatile ScheduledFuture<?> pollTask;
  private volatile boolean closed;

  private SignalPoller(Builder builder) {
    this.feed = Objects.requireNonNull(builder.feed, "feed");
    this.tracker = Objects.requireNonNull(builder.tracker, "tracker");
    if (builder.batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be > 0");
    }
    if (builder.interval == null || builder.interval.isZero() || builder.interval.isNegative()) {
      throw new IllegalArgumentException("interval must be > 0");
    }
    this.batchSize = builder.batchSize;
    this.interval = builder.interval;
  }

  public static Builder builder() {
    return new Builder();
  }

  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("SignalPoller has been closed");
    }
    if (pollTask != null) {
      return;
    }
    scheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("outreach-signal-"));
    long millis = interval.toMillis();
    pollTask = scheduler.scheduleWithFixedDelay(this::poll, millis, millis, TimeUnit.MILLISECONDS);
  }

  /**
   * Drains the feed in batches until a batch comes back smaller than the batch size.
   *
   * @return number of attempts that recorded a signal
   */
  public int poll() {
    if (closed) {
      return 0;
    }
    int applied = 0;
    try {
      List<SignalEvent> events;
      do {
        events = feed.fetch(batchSize);
        for (SignalEvent event : events) {
          applied += apply(event);
        }
      } while (events.size() >= batchSize && !closed);
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Signal poll failed", t);
    }
    return applied;
  }

  private int apply(SignalEvent event) {
    try {
      return tracker.applySignal(event.attendeeId(), event.signal(), event.at());
    } catch (OutreachException e) {
      logger.log(Level.WARNING, "Could not apply " + event.signal() + " for attendee "
          + event.attendeeId(), e);
      return 0;
    }
  }

  @Override
  public synchronized void close() {
    closed = true;
    if (pollTask != null) {
      pollTask.cancel(false);
      pollTask = null;
    }
    if (scheduler != null) {
      scheduler.shutdownNow();
      try {
        scheduler.awaitTermination(5, TimeUnit.SECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
  }

  /** Builder for {@link SignalPoller}. */
  public static final class Builder {
    private SignalFeed feed;
    private LifecycleTracker tracker;
    private int batchSize = 200;
    private Duration interval = Duration.ofMinutes(1);

    private Builder() {
    }

    /** <b>Required.</b> */
    public Builder feed(SignalFeed feed) {
      this.feed = feed;
      return this;
    }

    /** <b>Required.</b> */
    public Builder tracker(LifecycleTracker tracker) {
      this.tracker = tracker;
      return this;
    }

    /** Defaults to {@code 200}. */
    public Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    /** Defaults to one minute. */
    public Builder interval(Duration interval) {
      this.interval = interval;
      return this;
    }

    public SignalPoller build() {
      return new SignalPoller(this);
    }
  }
}
