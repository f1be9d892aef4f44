package io.cmdschema.impl.candidate;

/**
 * A provisional finding produced by one extraction strategy. Candidates live only for the
 * duration of a single parse.
 */
public sealed interface Candidate permits FlagCandidate, SubcommandCandidate, ArgCandidate {

  /** Grouping key: long name, else short name, else lower-case name. */
  String canonicalKey();

  SourceSpan span();

  /** Name of the extractor that produced the candidate, e.g. {@code section-flags}. */
  String strategy();

  /** Strategy-assigned confidence in [0, 1] before scoring. */
  double confidence();
}
