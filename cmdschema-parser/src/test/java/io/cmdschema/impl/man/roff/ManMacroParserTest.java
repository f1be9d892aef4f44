package io.cmdschema.impl.man.roff;

import static org.junit.jupiter.api.Assertions.*;

import io.cmdschema.api.ArgSchema;
import io.cmdschema.api.FlagSchema;
import io.cmdschema.impl.IndexedLine;
import io.cmdschema.impl.candidate.ArgCandidate;
import io.cmdschema.impl.candidate.CandidatePools;
import io.cmdschema.impl.candidate.FlagCandidate;
import io.cmdschema.impl.normalize.HelpNormalizer;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ManMacroParserTest {

  private static final List<IndexedLine> REBASE_PAGE =
      HelpNormalizer.toIndexedLines(
          String.join(
              "\n",
              ".TH GIT-REBASE 1",
              ".SH SYNOPSIS",
              ".B git rebase",
              "[\\fIoptions\\fR] [\\fIupstream\\fR]",
              ".SH OPTIONS",
              ".TP",
              ".B \\-\\-continue",
              "Restart the rebasing process.",
              ".TP",
              ".BR \\-x \", \" \\-\\-exec=\\fIcmd\\fR",
              "Append exec lines."));

  private static FlagSchema flag(CandidatePools pools, String name) {
    return pools.flags().stream()
        .map(FlagCandidate::flag)
        .filter(f -> f.hasIdentifier(name))
        .findFirst()
        .orElseThrow();
  }

  @Test
  void readsTaggedParagraphsAndSynopsis() {
    RoffDocument<ManElement> doc = ManMacroParser.parse(RoffLexer.tokenize(REBASE_PAGE));
    CandidatePools pools = ManMacroParser.extract(doc, 0.95);

    assertEquals("GIT-REBASE", doc.title());

    FlagSchema cont = flag(pools, "--continue");
    assertFalse(cont.takesValue());
    assertEquals("Restart the rebasing process.", cont.description());

    FlagSchema exec = flag(pools, "--exec");
    assertEquals("-x", exec.shortName());
    assertTrue(exec.takesValue());
    assertEquals("Append exec lines.", exec.description());

    ArgSchema upstream =
        pools.args().stream()
            .map(ArgCandidate::arg)
            .filter(a -> a.name().equals("upstream"))
            .findFirst()
            .orElseThrow();
    assertFalse(upstream.required());
    assertTrue(pools.flags().stream().allMatch(c -> c.confidence() == 0.95));
  }

  @Test
  void bracketedOptionalValuesEndTheFlagName() {
    List<IndexedLine> page =
        HelpNormalizer.toIndexedLines(
            String.join(
                "\n",
                ".TH LS 1",
                ".SH OPTIONS",
                ".TP",
                "\\fB\\-\\-block\\-size\\fR[=\\fISIZE\\fR]",
                "scale sizes by SIZE before printing them",
                ".TP",
                "\\fB\\-\\-color\\fR[=\\fIWHEN\\fR]",
                "colorize the output",
                ".TP",
                "\\fB\\-\\-exec\\-path\\fR[=\\fI<path>\\fR]",
                "Path to wherever the core programs are installed."));
    CandidatePools pools =
        ManMacroParser.extract(ManMacroParser.parse(RoffLexer.tokenize(page)), 0.9);

    assertEquals(
        List.of("--block-size", "--color", "--exec-path"),
        pools.flags().stream().map(c -> c.flag().longName()).toList());
    assertTrue(pools.flags().stream().allMatch(c -> c.flag().takesValue()));
  }

  @Test
  void parseFlagDefinitionCutsAtValueMarkers() {
    FlagSchema color = ManMacroParser.parseFlagDefinition("--color[=WHEN]", "when").orElseThrow();
    assertEquals("--color", color.longName());
    assertTrue(color.takesValue());

    FlagSchema path =
        ManMacroParser.parseFlagDefinition("-C <path>, --directory<path>", "").orElseThrow();
    assertEquals("-C", path.shortName());
    assertEquals("--directory", path.longName());
    assertTrue(path.takesValue());

    assertTrue(ManMacroParser.parseFlagDefinition("--[", "").isEmpty());
  }

  @Test
  void commandSectionsYieldSubcommands() {
    List<IndexedLine> page =
        HelpNormalizer.toIndexedLines(
            String.join(
                "\n",
                ".TH TOOL 1",
                ".SH COMMANDS",
                ".TP",
                ".B start",
                "Start the service.",
                ".IP stop \"Stop it.\""));

    CandidatePools pools =
        ManMacroParser.extract(ManMacroParser.parse(RoffLexer.tokenize(page)), 0.9);

    assertEquals(
        List.of("start", "stop"), pools.subcommands().stream().map(c -> c.name()).toList());
    assertEquals("Start the service.", pools.subcommands().get(0).subcommand().description());
  }

  @Test
  void flagDefinitions() {
    Optional<FlagSchema> flag = ManMacroParser.parseFlagDefinition("-o, --output FILE", "Write.");
    assertTrue(flag.isPresent());
    assertEquals("-o", flag.get().shortName());
    assertEquals("--output", flag.get().longName());
    assertTrue(flag.get().takesValue());

    assertTrue(ManMacroParser.parseFlagDefinition("output", "").isEmpty());
  }

  @Test
  void synopsisSkipsTheLeadingCommandWord() {
    List<ArgSchema> args = ManMacroParser.synopsisArgs("tar [file...] dest", new HashSet<>());

    assertEquals(List.of("file", "dest"), args.stream().map(ArgSchema::name).toList());
    assertTrue(args.get(0).multiple());
    assertFalse(args.get(0).required());
    assertTrue(args.get(1).required());
  }
}
