package io.cmdschema.impl.strategy;

import io.cmdschema.impl.candidate.ArgCandidate;
import io.cmdschema.impl.candidate.FlagCandidate;
import io.cmdschema.impl.candidate.SubcommandCandidate;
import java.util.List;

/** Hands out the manual page bundle computed for the parse. */
public final class ManStrategy implements ExtractionStrategy {
  public static final String NAME = "man";

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public List<FlagCandidate> collectFlags(ParseContext context) {
    return context.man().flags();
  }

  @Override
  public List<SubcommandCandidate> collectSubcommands(ParseContext context) {
    return context.man().subcommands();
  }

  @Override
  public List<ArgCandidate> collectArgs(ParseContext context) {
    return context.man().args();
  }
}
