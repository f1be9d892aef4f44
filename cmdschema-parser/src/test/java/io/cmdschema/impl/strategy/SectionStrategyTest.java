package io.cmdschema.impl.strategy;

import static org.junit.jupiter.api.Assertions.*;

import io.cmdschema.impl.candidate.SubcommandCandidate;
import io.cmdschema.impl.normalize.HelpNormalizer;
import java.util.List;
import org.junit.jupiter.api.Test;

class SectionStrategyTest {

  private static List<String> names(List<SubcommandCandidate> candidates, String strategy) {
    return candidates.stream()
        .filter(c -> c.strategy().equals(strategy))
        .map(c -> c.subcommand().name())
        .toList();
  }

  @Test
  void settingRowsAreCollectedAlongsideTwoColumnBlocks() {
    String help =
        String.join(
            "\n",
            "  start     Begin a session",
            "  stop      End the session",
            "",
            "  speed     print the terminal speed");
    ParseContext context = ParseContext.of("tool", HelpNormalizer.toIndexedLines(help));

    List<SubcommandCandidate> candidates = new SectionStrategy().collectSubcommands(context);

    assertEquals(
        List.of("start", "stop"), names(candidates, SectionStrategy.TWO_COLUMN_STRATEGY));
    assertEquals(List.of("speed"), names(candidates, SectionStrategy.SETTING_STRATEGY));
    assertEquals(
        SectionStrategy.SETTING_CONFIDENCE,
        candidates.get(candidates.size() - 1).confidence());
  }

  @Test
  void settingRowsFollowExplicitSubcommandSection() {
    String help =
        String.join(
            "\n",
            "Commands:",
            "  build     Compile the project",
            "  clean     Remove build output",
            "",
            "  rows      tell the kernel the terminal has N rows");
    ParseContext context = ParseContext.of("tool", HelpNormalizer.toIndexedLines(help));

    List<SubcommandCandidate> candidates = new SectionStrategy().collectSubcommands(context);

    assertTrue(
        names(candidates, SectionStrategy.SUBCOMMANDS_STRATEGY).containsAll(
            List.of("build", "clean")));
    assertEquals(List.of("rows"), names(candidates, SectionStrategy.SETTING_STRATEGY));
  }
}
