package outreach.model;

/**
 * Pipeline stage at which a failure occurred.
 */
public enum Stage {
  CLASSIFY,
  COMPOSE,
  SEND,
  FOLLOW_UP,
  SIGNAL
}
