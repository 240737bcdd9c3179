package outreach.spi;

import outreach.model.ReplySignal;

import java.time.Instant;
import java.util.Objects;

public record SignalEvent(long attendeeId, ReplySignal signal, Instant at) {

  public SignalEvent {
    Objects.requireNonNull(signal, "signal");
    Objects.requireNonNull(at, "at");
    if (signal == ReplySignal.NONE) {
      throw new IllegalArgumentException("signal must be REPLIED or CLAIMED_ELSEWHERE");
    }
  }
}
