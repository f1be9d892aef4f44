package io.cmdschema.impl.strategy;

import io.cmdschema.api.SubcommandSchema;
import io.cmdschema.impl.candidate.ArgCandidate;
import io.cmdschema.impl.candidate.FlagCandidate;
import io.cmdschema.impl.candidate.SubcommandCandidate;
import io.cmdschema.impl.text.ArgumentRowParser;
import io.cmdschema.impl.text.FlagRowParser;
import io.cmdschema.impl.text.LineMatch;
import io.cmdschema.impl.text.SectionBuckets;
import io.cmdschema.impl.text.SectionKind;
import io.cmdschema.impl.text.SubcommandRowParser;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads explicit {@code FLAGS:}, {@code OPTIONS:}, {@code SUBCOMMANDS:} and {@code ARGUMENTS:}
 * blocks.
 *
 * <p>Subcommands fall back in order when no explicit commands block yields any: a dense grid of
 * command names, then generic two-column rows (skipped for keybinding listings), then named
 * setting rows.
 */
public final class SectionStrategy implements ExtractionStrategy {
  public static final String NAME = "section";

  static final String FLAGS_STRATEGY = "section-flags";
  static final String OPTIONS_STRATEGY = "section-options";
  static final String SUBCOMMANDS_STRATEGY = "section-subcommands";
  static final String ARGUMENTS_STRATEGY = "section-arguments";
  static final String GRID_STRATEGY = "dense-command-grid";
  static final String TWO_COLUMN_STRATEGY = "generic-two-column-subcommands";
  static final String SETTING_STRATEGY = "named-setting-rows";
  static final String KEYBINDING_SKIP_NOTE = "generic-two-column-skipped:keybinding-doc";

  static final double FLAGS_CONFIDENCE = 0.9;
  static final double OPTIONS_CONFIDENCE = 0.88;
  static final double SUBCOMMANDS_CONFIDENCE = 0.9;
  static final double ARGUMENTS_CONFIDENCE = 0.82;
  static final double PRIMARY_GRID_CONFIDENCE = 0.9;
  static final double SECONDARY_GRID_CONFIDENCE = 0.82;
  static final double TWO_COLUMN_CONFIDENCE = 0.8;
  static final double SETTING_CONFIDENCE = 0.72;

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public List<FlagCandidate> collectFlags(ParseContext context) {
    SectionBuckets sections = context.sections();
    List<FlagCandidate> out = new ArrayList<>();
    out.addAll(
        Matches.flags(
            FlagRowParser.parseRows(sections.get(SectionKind.FLAGS)),
            FLAGS_STRATEGY,
            FLAGS_CONFIDENCE));
    out.addAll(
        Matches.flags(
            FlagRowParser.parseRows(sections.get(SectionKind.OPTIONS)),
            OPTIONS_STRATEGY,
            OPTIONS_CONFIDENCE));
    return out;
  }

  @Override
  public List<SubcommandCandidate> collectSubcommands(ParseContext context) {
    List<SubcommandCandidate> out = new ArrayList<>(primarySubcommands(context));
    // Setting rows often sit inside blocks the row parsers above only partly capture.
    SubcommandRowParser rows = new SubcommandRowParser(context.command());
    out.addAll(
        Matches.subcommands(
            rows.namedSettingRows(context.lines()), SETTING_STRATEGY, SETTING_CONFIDENCE));
    return out;
  }

  private List<SubcommandCandidate> primarySubcommands(ParseContext context) {
    SectionBuckets sections = context.sections();
    SubcommandRowParser rows = new SubcommandRowParser(context.command());

    List<LineMatch<SubcommandSchema>> explicit =
        rows.parseRows(sections.get(SectionKind.SUBCOMMANDS));
    if (!explicit.isEmpty()) {
      return Matches.subcommands(explicit, SUBCOMMANDS_STRATEGY, SUBCOMMANDS_CONFIDENCE);
    }

    if (!context.keybindingDocument()) {
      SubcommandRowParser.GridScan grid = rows.denseCommandGrid(context.lines());
      if (!grid.commands().isEmpty()) {
        double confidence = grid.primary() ? PRIMARY_GRID_CONFIDENCE : SECONDARY_GRID_CONFIDENCE;
        return Matches.subcommands(grid.commands(), GRID_STRATEGY, confidence);
      }
    }

    if (!sections.has(SectionKind.SUBCOMMANDS) && !sections.has(SectionKind.ARGUMENTS)) {
      if (context.keybindingDocument()) {
        context.note(KEYBINDING_SKIP_NOTE);
      } else {
        return Matches.subcommands(
            rows.twoColumnBlocks(context.lines()), TWO_COLUMN_STRATEGY, TWO_COLUMN_CONFIDENCE);
      }
    }
    return List.of();
  }

  @Override
  public List<ArgCandidate> collectArgs(ParseContext context) {
    return Matches.args(
        ArgumentRowParser.parseSection(context.sections().get(SectionKind.ARGUMENTS)),
        ARGUMENTS_STRATEGY,
        ARGUMENTS_CONFIDENCE);
  }
}
