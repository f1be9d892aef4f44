package io.cmdschema.impl.candidate;

import io.cmdschema.api.FlagSchema;
import java.util.Objects;

/** A flag found by a strategy, with provenance. */
public record FlagCandidate(FlagSchema flag, SourceSpan span, String strategy, double confidence)
    implements Candidate {

  public FlagCandidate {
    Objects.requireNonNull(flag, "flag must not be null");
    Objects.requireNonNull(span, "span must not be null");
    Objects.requireNonNull(strategy, "strategy must not be null");
    confidence = Math.max(0.0, Math.min(1.0, confidence));
  }

  @Override
  public String canonicalKey() {
    return flag.canonicalName();
  }

  /** The identifier the scorer inspects: long name if present, otherwise short name. */
  public String primaryIdentifier() {
    return flag.longName() != null ? flag.longName() : flag.shortName();
  }
}
