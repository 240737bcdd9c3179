package outreach.model;

public enum GenerationStatus {
  PENDING,
  GENERATED,
  VALIDATED,
  FAILED
}
