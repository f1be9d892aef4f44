package io.cmdschema.impl.strategy;

import io.cmdschema.api.ArgSchema;
import io.cmdschema.api.FlagSchema;
import io.cmdschema.api.SubcommandSchema;
import io.cmdschema.impl.candidate.ArgCandidate;
import io.cmdschema.impl.candidate.FlagCandidate;
import io.cmdschema.impl.candidate.SourceSpan;
import io.cmdschema.impl.candidate.SubcommandCandidate;
import io.cmdschema.impl.text.LineMatch;
import java.util.ArrayList;
import java.util.List;

/** Turns line matches into candidates carrying their line range. */
final class Matches {
  private Matches() {}

  static List<FlagCandidate> flags(
      List<LineMatch<FlagSchema>> matches, String strategy, double confidence) {
    List<FlagCandidate> out = new ArrayList<>(matches.size());
    for (LineMatch<FlagSchema> match : matches) {
      out.add(new FlagCandidate(match.value(), span(match), strategy, confidence));
    }
    return out;
  }

  static List<SubcommandCandidate> subcommands(
      List<LineMatch<SubcommandSchema>> matches, String strategy, double confidence) {
    List<SubcommandCandidate> out = new ArrayList<>(matches.size());
    for (LineMatch<SubcommandSchema> match : matches) {
      out.add(new SubcommandCandidate(match.value(), span(match), strategy, confidence));
    }
    return out;
  }

  static List<ArgCandidate> args(
      List<LineMatch<ArgSchema>> matches, String strategy, double confidence) {
    List<ArgCandidate> out = new ArrayList<>(matches.size());
    for (LineMatch<ArgSchema> match : matches) {
      out.add(new ArgCandidate(match.value(), span(match), strategy, confidence));
    }
    return out;
  }

  private static SourceSpan span(LineMatch<?> match) {
    return match.start() < 0 ? SourceSpan.UNKNOWN : SourceSpan.of(match.start(), match.end());
  }
}
