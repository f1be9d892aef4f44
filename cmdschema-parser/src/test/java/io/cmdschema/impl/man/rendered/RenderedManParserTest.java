package io.cmdschema.impl.man.rendered;

import static org.junit.jupiter.api.Assertions.*;

import io.cmdschema.api.FlagSchema;
import io.cmdschema.impl.IndexedLine;
import io.cmdschema.impl.candidate.CandidatePools;
import io.cmdschema.impl.candidate.FlagCandidate;
import io.cmdschema.impl.candidate.SubcommandCandidate;
import io.cmdschema.impl.normalize.HelpNormalizer;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class RenderedManParserTest {

  private static final List<IndexedLine> LS_PAGE =
      HelpNormalizer.toIndexedLines(
          String.join(
              "\n",
              "LS(1)                    User Commands                    LS(1)",
              "",
              "NAME",
              "       ls - list directory contents",
              "",
              "SYNOPSIS",
              "       ls [OPTION]... [FILE]...",
              "",
              "OPTIONS",
              "       -a, --all",
              "              do not ignore entries starting with .",
              "       -w, --width=COLS",
              "              set output width to COLS"));

  private static FlagCandidate flag(CandidatePools pools, String name) {
    return pools.flags().stream()
        .filter(c -> c.flag().hasIdentifier(name))
        .findFirst()
        .orElseThrow();
  }

  @Test
  void readsOptionsSection() {
    CandidatePools pools = RenderedManParser.parse("ls", LS_PAGE);

    FlagCandidate all = flag(pools, "--all");
    assertEquals("-a", all.flag().shortName());
    assertEquals("do not ignore entries starting with .", all.flag().description());
    assertFalse(all.flag().takesValue());
    assertEquals(RenderedManParser.OPTIONS_STRATEGY, all.strategy());
    assertEquals(0.88, all.confidence());
    assertEquals(9, all.span().start());

    FlagSchema width = flag(pools, "--width").flag();
    assertEquals("-w", width.shortName());
    assertTrue(width.takesValue());
  }

  private static final List<IndexedLine> GIT_PAGE =
      HelpNormalizer.toIndexedLines(
          String.join(
              "\n",
              "GIT(1)                        Git Manual                        GIT(1)",
              "",
              "NAME",
              "       git - the stupid content tracker",
              "",
              "SYNOPSIS",
              "       git [-v | --version] [-h | --help] [-C <path>] [-c <name>=<value>]",
              "           [--exec-path[=<path>]] [--html-path] [--man-path] [--info-path]",
              "           [-p|--paginate|-P|--no-pager] [--no-replace-objects] [--bare]",
              "           <command> [<args>]",
              "",
              "OPTIONS",
              "       --exec-path[=<path>]",
              "           Path to wherever your core Git programs are installed.",
              "",
              "       --color[=WHEN]",
              "           Colorize the output."));

  @Test
  void bracketedOptionalValuesInOptionsKeepCleanNames() {
    CandidatePools pools = RenderedManParser.parse("git", GIT_PAGE);

    List<FlagSchema> options =
        pools.flags().stream()
            .filter(c -> c.strategy().equals(RenderedManParser.OPTIONS_STRATEGY))
            .map(FlagCandidate::flag)
            .toList();
    assertEquals(
        List.of("--exec-path", "--color"), options.stream().map(FlagSchema::longName).toList());
    assertTrue(options.stream().allMatch(FlagSchema::takesValue));
  }

  @Test
  void gitSynopsisFlagsAreCleanAndUnique() {
    CandidatePools pools = RenderedManParser.parse("git", GIT_PAGE);

    List<String> names =
        pools.flags().stream()
            .filter(c -> c.strategy().equals(RenderedSynopsis.FLAGS_STRATEGY))
            .map(c -> c.flag().canonicalName())
            .toList();
    assertEquals(names.size(), Set.copyOf(names).size(), names.toString());
    assertTrue(names.containsAll(List.of("--exec-path", "--paginate", "--no-pager", "-C")));
    assertTrue(names.stream().noneMatch(n -> n.contains("[") || n.contains("<")), names.toString());
    FlagSchema execPath =
        pools.flags().stream()
            .filter(c -> c.strategy().equals(RenderedSynopsis.FLAGS_STRATEGY))
            .map(FlagCandidate::flag)
            .filter(f -> f.hasIdentifier("--exec-path"))
            .findFirst()
            .orElseThrow();
    assertTrue(execPath.takesValue());
  }

  @Test
  void readsSynopsisPositionals() {
    CandidatePools pools = RenderedManParser.parse("ls", LS_PAGE);

    List<String> args = pools.args().stream().map(c -> c.arg().name()).toList();
    assertTrue(args.contains("file"), args.toString());
    assertFalse(args.contains("ls"));
    assertTrue(pools.args().stream().allMatch(c -> c.arg().multiple()));
  }

  @Test
  void dropsBannersAndFoldsWrappedDescriptions() {
    List<IndexedLine> normalized = RenderedManParser.normalizeLines(LS_PAGE);

    assertTrue(normalized.stream().noneMatch(l -> l.text().contains("User Commands")));
    IndexedLine all =
        normalized.stream().filter(l -> l.trimmed().startsWith("-a")).findFirst().orElseThrow();
    assertEquals(9, all.index());
    assertEquals("-a, --all  do not ignore entries starting with .", all.trimmed());
  }

  @Test
  void runningHeadersAndFooters() {
    assertTrue(RenderedManParser.isRunningHeaderOrFooter("12"));
    assertTrue(
        RenderedManParser.isRunningHeaderOrFooter("GIT-REBASE(1)  Git Manual  GIT-REBASE(1)"));
    assertTrue(RenderedManParser.isRunningHeaderOrFooter("BSD General Commands Manual"));
    assertFalse(RenderedManParser.isRunningHeaderOrFooter("-v, --verbose"));
    assertFalse(RenderedManParser.isRunningHeaderOrFooter(""));
  }

  @Test
  void synopsisAlternativesBecomeSubcommands() {
    assertEquals(
        Set.of("clone", "init"),
        RenderedSynopsis.subcommandHeads("git [--version] <command> | clone | init"));
    assertTrue(RenderedSynopsis.subcommandHeads("tool start | -h").isEmpty());
    assertTrue(RenderedSynopsis.subcommandHeads("tool start").isEmpty());
  }

  @Test
  void commandsSectionRows() {
    RenderedSection section =
        new RenderedSection(
            "COMMANDS",
            0,
            List.of(
                new IndexedLine(1, "       clone   Clone a repository"),
                new IndexedLine(2, "       init - Create an empty repository"),
                new IndexedLine(3, "       -v  not a command")));
    List<SubcommandCandidate> out = new ArrayList<>();

    RenderedCommands.parse(section, out);

    assertEquals(List.of("clone", "init"), out.stream().map(SubcommandCandidate::name).toList());
    assertEquals("Create an empty repository", out.get(1).subcommand().description());
    assertEquals(RenderedCommands.CONFIDENCE, out.get(0).confidence());
  }

  @Test
  void optionDefinitions() {
    FlagSchema negatable = RenderedOptions.parseDefinition("--[no-]color", null).orElseThrow();
    assertEquals("--color", negatable.longName());
    assertFalse(negatable.takesValue());

    FlagSchema placeholder =
        RenderedOptions.parseDefinition("-C <path>", "Run as if started in path").orElseThrow();
    assertEquals("-C", placeholder.shortName());
    assertTrue(placeholder.takesValue());

    assertTrue(RenderedOptions.parseDefinition("nothing here", null).isEmpty());
  }
}
