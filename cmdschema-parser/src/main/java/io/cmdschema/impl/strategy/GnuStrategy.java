package io.cmdschema.impl.strategy;

import io.cmdschema.api.FlagSchema;
import io.cmdschema.impl.IndexedLine;
import io.cmdschema.impl.candidate.ArgCandidate;
import io.cmdschema.impl.candidate.FlagCandidate;
import io.cmdschema.impl.candidate.SourceSpan;
import io.cmdschema.impl.candidate.SubcommandCandidate;
import io.cmdschema.impl.text.FlagRowParser;
import io.cmdschema.impl.text.LineShapes;
import java.util.ArrayList;
import java.util.List;

/** Flag rows anywhere in the text, whether or not a section header introduces them. */
public final class GnuStrategy implements ExtractionStrategy {
  public static final String NAME = "gnu";
  static final String FLAGS_STRATEGY = "gnu-sectionless-flags";
  static final double CONFIDENCE = 0.7;

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public List<FlagCandidate> collectFlags(ParseContext context) {
    List<FlagCandidate> out = new ArrayList<>();
    for (IndexedLine line : context.lines()) {
      String trimmed = line.trimmed();
      if (!LineShapes.looksLikeFlagRowStart(trimmed)) {
        continue;
      }
      for (FlagSchema flag : FlagRowParser.parseRow(trimmed)) {
        out.add(
            new FlagCandidate(flag, SourceSpan.single(line.index()), FLAGS_STRATEGY, CONFIDENCE));
      }
    }
    return out;
  }

  @Override
  public List<SubcommandCandidate> collectSubcommands(ParseContext context) {
    return List.of();
  }

  @Override
  public List<ArgCandidate> collectArgs(ParseContext context) {
    return List.of();
  }
}
