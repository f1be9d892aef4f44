package io.cmdschema.impl.merge;

import io.cmdschema.impl.candidate.Candidate;
import java.util.List;

/**
 * Result of gating one kind of candidate.
 *
 * @param accepted merged entities, sorted by canonical name
 * @param medium candidates kept for diagnostics only
 * @param discarded candidates dropped outright
 */
public record MergeOutcome<T, C extends Candidate>(
    List<T> accepted, List<C> medium, List<C> discarded) {

  public MergeOutcome {
    accepted = List.copyOf(accepted);
    medium = List.copyOf(medium);
    discarded = List.copyOf(discarded);
  }
}
