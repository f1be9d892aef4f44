package io.cmdschema.impl.strategy;

import io.cmdschema.impl.candidate.ArgCandidate;
import io.cmdschema.impl.candidate.FlagCandidate;
import io.cmdschema.impl.candidate.SubcommandCandidate;
import java.util.List;

/**
 * One way of reading help text. Every strategy sees the same normalized lines and produces
 * provenance-tagged candidates; strategies never see each other's output.
 */
public interface ExtractionStrategy {

  /** Short name used in plans and diagnostics, e.g. {@code section}. */
  String name();

  List<FlagCandidate> collectFlags(ParseContext context);

  List<SubcommandCandidate> collectSubcommands(ParseContext context);

  List<ArgCandidate> collectArgs(ParseContext context);
}
