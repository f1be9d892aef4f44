package io.cmdschema.api;

/** Coarse quality grade attached to an extraction report. */
public enum QualityTier {
  /** No quality reasons, confidence at least 0.85 and coverage at least 0.6. */
  HIGH,
  /** No quality reasons. */
  MEDIUM,
  /** At least one threshold missed. */
  LOW,
  /** No schema was produced. */
  FAILED
}
