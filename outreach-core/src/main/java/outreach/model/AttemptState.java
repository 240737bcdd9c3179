package outreach.model;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Lifecycle of an {@link OutreachAttempt}. Only forward transitions are legal.
 *
 * <pre>
 * PENDING -> GENERATED -> SENT -> AWAITING_REPLY -> FOLLOW_UP_DUE -> FOLLOW_UP_SENT
 *    |  \        |          \___________\_______________\__> REPLIED | CLAIMED_ELSEWHERE
 *    v   \       v
 *  FAILED  `-> SUPPRESSED
 * </pre>
 */
public enum AttemptState {
  PENDING(0),
  GENERATED(1),
  SENT(2),
  AWAITING_REPLY(3),
  REPLIED(4),
  CLAIMED_ELSEWHERE(5),
  FOLLOW_UP_DUE(6),
  FOLLOW_UP_SENT(7),
  FAILED(8),
  SUPPRESSED(9);

  private static final Map<AttemptState, Set<AttemptState>> NEXT = Map.of(
      PENDING, EnumSet.of(GENERATED, FAILED, SUPPRESSED),
      GENERATED, EnumSet.of(SENT, SUPPRESSED),
      SENT, EnumSet.of(AWAITING_REPLY, REPLIED, CLAIMED_ELSEWHERE),
      AWAITING_REPLY, EnumSet.of(FOLLOW_UP_DUE, REPLIED, CLAIMED_ELSEWHERE),
      FOLLOW_UP_DUE, EnumSet.of(FOLLOW_UP_SENT, REPLIED, CLAIMED_ELSEWHERE));

  private final int code;

  AttemptState(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }

  public static AttemptState fromCode(int code) {
    for (AttemptState state : values()) {
      if (state.code == code) {
        return state;
      }
    }
    throw new IllegalArgumentException("Unknown attempt state code: " + code);
  }

  public Set<AttemptState> successors() {
    Set<AttemptState> next = NEXT.get(this);
    return next == null ? Set.of() : Collections.unmodifiableSet(next);
  }

  public boolean canTransitionTo(AttemptState target) {
    return successors().contains(target);
  }

  public boolean isTerminal() {
    return successors().isEmpty();
  }

  /**
   * Returns {@code true} once the initial message has been delivered.
   */
  public boolean isSent() {
    return switch (this) {
      case SENT, AWAITING_REPLY, REPLIED, CLAIMED_ELSEWHERE, FOLLOW_UP_DUE, FOLLOW_UP_SENT -> true;
      default -> false;
    };
  }
}
