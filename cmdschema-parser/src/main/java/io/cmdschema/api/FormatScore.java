package io.cmdschema.api;

import java.util.Objects;

/** A classifier score for one {@link HelpFormat}, always within [0, 1]. */
public record FormatScore(HelpFormat format, double score) {
  public FormatScore {
    Objects.requireNonNull(format, "format must not be null");
    score = Math.max(0.0, Math.min(1.0, score));
  }
}
