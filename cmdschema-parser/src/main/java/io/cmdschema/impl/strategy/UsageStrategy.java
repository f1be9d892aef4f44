package io.cmdschema.impl.strategy;

import io.cmdschema.impl.candidate.ArgCandidate;
import io.cmdschema.impl.candidate.FlagCandidate;
import io.cmdschema.impl.candidate.SubcommandCandidate;
import io.cmdschema.impl.text.ArgumentRowParser;
import io.cmdschema.impl.text.SectionKind;
import io.cmdschema.impl.text.UsageScanner;
import java.util.List;

/** Flags and positionals written inline in the usage synopsis, e.g. {@code tmux [-2Cu] [FILE]}. */
public final class UsageStrategy implements ExtractionStrategy {
  public static final String NAME = "usage";
  static final String FLAGS_STRATEGY = "usage-compact-flags";
  static final String ARGS_STRATEGY = "usage-positionals";
  static final double FLAGS_CONFIDENCE = 0.75;
  static final double ARGS_CONFIDENCE = 0.72;

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public List<FlagCandidate> collectFlags(ParseContext context) {
    return Matches.flags(
        UsageScanner.compactFlags(context.usage()), FLAGS_STRATEGY, FLAGS_CONFIDENCE);
  }

  @Override
  public List<SubcommandCandidate> collectSubcommands(ParseContext context) {
    return List.of();
  }

  @Override
  public List<ArgCandidate> collectArgs(ParseContext context) {
    boolean hasSubcommands = context.sections().has(SectionKind.SUBCOMMANDS);
    return Matches.args(
        ArgumentRowParser.usagePositionals(context.usage(), context.command(), hasSubcommands),
        ARGS_STRATEGY,
        ARGS_CONFIDENCE);
  }
}
