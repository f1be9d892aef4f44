package io.cmdschema.impl.candidate;

import io.cmdschema.api.ArgSchema;
import io.cmdschema.util.TextUtil;
import java.util.Objects;

/** A positional argument found by a strategy, with provenance. */
public record ArgCandidate(ArgSchema arg, SourceSpan span, String strategy, double confidence)
    implements Candidate {

  public ArgCandidate {
    Objects.requireNonNull(arg, "arg must not be null");
    Objects.requireNonNull(span, "span must not be null");
    Objects.requireNonNull(strategy, "strategy must not be null");
    confidence = Math.max(0.0, Math.min(1.0, confidence));
  }

  @Override
  public String canonicalKey() {
    return TextUtil.lower(arg.name());
  }

  public String name() {
    return arg.name();
  }
}
