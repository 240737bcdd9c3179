package outreach.model;

/**
 * Reply / claim signal recorded on an attempt. {@link #NONE} until the feed reports one.
 */
public enum ReplySignal {
  NONE,
  REPLIED,
  CLAIMED_ELSEWHERE;

  public AttemptState targetState() {
    return switch (this) {
      case REPLIED -> AttemptState.REPLIED;
      case CLAIMED_ELSEWHERE -> AttemptState.CLAIMED_ELSEWHERE;
      case NONE -> throw new IllegalStateException("NONE has no target state");
    };
  }
}
