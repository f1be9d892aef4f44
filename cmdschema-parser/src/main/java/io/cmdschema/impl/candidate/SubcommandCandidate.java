package io.cmdschema.impl.candidate;

import io.cmdschema.api.SubcommandSchema;
import io.cmdschema.util.TextUtil;
import java.util.Objects;

/** A subcommand found by a strategy, with provenance. */
public record SubcommandCandidate(
    SubcommandSchema subcommand, SourceSpan span, String strategy, double confidence)
    implements Candidate {

  public SubcommandCandidate {
    Objects.requireNonNull(subcommand, "subcommand must not be null");
    Objects.requireNonNull(span, "span must not be null");
    Objects.requireNonNull(strategy, "strategy must not be null");
    confidence = Math.max(0.0, Math.min(1.0, confidence));
  }

  @Override
  public String canonicalKey() {
    return TextUtil.lower(subcommand.name());
  }

  public String name() {
    return subcommand.name();
  }
}
