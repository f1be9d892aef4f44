package io.cmdschema.impl.report;

import static io.cmdschema.util.TextUtil.lower;

import io.cmdschema.impl.IndexedLine;
import io.cmdschema.impl.candidate.ArgCandidate;
import io.cmdschema.impl.candidate.SubcommandCandidate;
import io.cmdschema.impl.classify.RowFilters;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Drops subcommand and positional candidates that are placeholders or row noise, counting every
 * dropped candidate together with the hard-negative rows of the input.
 */
public final class FalsePositiveFilter {
  private static final Set<String> PLACEHOLDER_ARG_NAMES =
      Set.of("options", "flags", "args", "usage", "command", "subcommand", "commands");

  private FalsePositiveFilter() {}

  /** Surviving candidates and the number of rows that matched a filter. */
  public record Result(
      List<SubcommandCandidate> subcommands, List<ArgCandidate> args, int hits) {
    public Result {
      subcommands = List.copyOf(subcommands);
      args = List.copyOf(args);
    }
  }

  public static Result apply(
      List<IndexedLine> lines, List<SubcommandCandidate> subcommands, List<ArgCandidate> args) {
    int hits = RowFilters.countFilterHits(lines);
    List<SubcommandCandidate> keptSubcommands = new ArrayList<>(subcommands.size());
    for (SubcommandCandidate candidate : subcommands) {
      if (RowFilters.rejectsSubcommandName(candidate.name())) {
        hits++;
      } else {
        keptSubcommands.add(candidate);
      }
    }
    List<ArgCandidate> keptArgs = new ArrayList<>(args.size());
    for (ArgCandidate candidate : args) {
      if (isPlaceholderArg(candidate.name())) {
        hits++;
      } else {
        keptArgs.add(candidate);
      }
    }
    return new Result(keptSubcommands, keptArgs, hits);
  }

  static boolean isPlaceholderArg(String name) {
    return RowFilters.isPlaceholderToken(name)
        || PLACEHOLDER_ARG_NAMES.contains(lower(name.trim()));
  }
}
