package io.cmdschema.impl.report;

import io.cmdschema.impl.merge.MergeOutcome;
import java.util.ArrayList;
import java.util.List;

/** Summary warnings for candidates that did not make it into the schema. */
public final class CandidateWarnings {
  private CandidateWarnings() {}

  public static List<String> summarize(
      MergeOutcome<?, ?> flags,
      MergeOutcome<?, ?> subcommands,
      MergeOutcome<?, ?> args,
      int falsePositiveHits) {
    List<String> warnings = new ArrayList<>();
    int mediumFlags = flags.medium().size();
    int mediumSubs = subcommands.medium().size();
    int mediumArgs = args.medium().size();
    if (mediumFlags + mediumSubs + mediumArgs > 0) {
      warnings.add(
          String.format(
              "Medium-confidence findings kept in diagnostics: %d flags, %d subcommands, %d args",
              mediumFlags, mediumSubs, mediumArgs));
    }
    int droppedFlags = flags.discarded().size();
    int droppedSubs = subcommands.discarded().size();
    int droppedArgs = args.discarded().size();
    if (droppedFlags + droppedSubs + droppedArgs > 0) {
      warnings.add(
          String.format(
              "Discarded low-confidence findings: %d flags, %d subcommands, %d args",
              droppedFlags, droppedSubs, droppedArgs));
    }
    if (falsePositiveHits > 0) {
      warnings.add("False-positive filters matched " + falsePositiveHits + " rows");
    }
    return warnings;
  }
}
