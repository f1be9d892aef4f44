package io.cmdschema.impl.strategy;

import io.cmdschema.impl.candidate.ArgCandidate;
import io.cmdschema.impl.candidate.FlagCandidate;
import io.cmdschema.impl.candidate.SubcommandCandidate;
import io.cmdschema.impl.text.SubcommandRowParser;
import java.util.List;

/** Comma-separated command lists under an {@code All commands:} header. Yields no flags. */
public final class NpmStrategy implements ExtractionStrategy {
  public static final String NAME = "npm";
  static final String SUBCOMMANDS_STRATEGY = "npm-command-list";
  static final double CONFIDENCE = 0.85;

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public List<FlagCandidate> collectFlags(ParseContext context) {
    return List.of();
  }

  @Override
  public List<SubcommandCandidate> collectSubcommands(ParseContext context) {
    SubcommandRowParser rows = new SubcommandRowParser(context.command());
    return Matches.subcommands(
        rows.npmCommandList(context.lines()), SUBCOMMANDS_STRATEGY, CONFIDENCE);
  }

  @Override
  public List<ArgCandidate> collectArgs(ParseContext context) {
    return List.of();
  }
}
