package outreach.spi;

import java.util.List;

/**
 * Source of reply and claim signals (mailbox watcher, CRM export). Events may arrive
 * out of order or more than once.
 */
public interface SignalFeed {

  /**
   * Returns the next events, at most {@code max}. An empty list means nothing is pending.
   */
  List<SignalEvent> fetch(int max);
}
