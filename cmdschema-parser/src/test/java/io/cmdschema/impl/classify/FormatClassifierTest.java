package io.cmdschema.impl.classify;

import static org.junit.jupiter.api.Assertions.*;

import io.cmdschema.api.FormatScore;
import io.cmdschema.api.HelpFormat;
import io.cmdschema.impl.normalize.HelpNormalizer;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class FormatClassifierTest {

  static final String COBRA =
      String.join(
          "\n",
          "Kubectl controls the Kubernetes cluster manager.",
          "",
          "Usage:",
          "  tool [command]",
          "",
          "Available Commands:",
          "  get         Display one or many resources",
          "  apply       Apply a configuration to a resource",
          "",
          "Flags:",
          "  -h, --help      help for tool",
          "  -v, --verbose   enable verbose output",
          "",
          "Use \"tool [command] --help\" for more information about a command.");

  @Test
  void cobraMarkersWin() {
    List<FormatScore> scores = classify(COBRA);

    assertEquals(HelpFormat.COBRA, FormatClassifier.top(scores));
    assertEquals(1.0, score(scores, HelpFormat.COBRA), 1e-9);
    assertEquals(0.65, score(scores, HelpFormat.GNU), 1e-9);
    assertEquals(0.2, score(scores, HelpFormat.CLAP), 1e-9);
    assertTrue(formats(scores).stream().noneMatch(f -> f == HelpFormat.MAN));
  }

  @Test
  void leadingUsageBannerIsDocopt() {
    List<FormatScore> scores =
        classify(
            "Usage: ls [OPTION]... [FILE]...\n\n"
                + "  -a, --all   do not ignore entries\n"
                + "  -l          use a long listing format\n");

    assertEquals(HelpFormat.DOCOPT, FormatClassifier.top(scores));
    assertEquals(0.75, score(scores, HelpFormat.DOCOPT), 1e-9);
    assertEquals(0.45, score(scores, HelpFormat.GNU), 1e-9);
  }

  @Test
  void argparseSections() {
    List<FormatScore> scores =
        classify(
            "usage: prog [-h] src\n\n"
                + "positional arguments:\n"
                + "  src         source\n\n"
                + "optional arguments:\n"
                + "  -h, --help  show this help message and exit\n");

    assertEquals(HelpFormat.ARGPARSE, FormatClassifier.top(scores));
    assertEquals(0.9, score(scores, HelpFormat.ARGPARSE), 1e-9);
  }

  @Test
  void unmarkedTextFallsBackToUnknownWithStableTies() {
    List<FormatScore> scores = classify("hello world");

    assertEquals(
        List.of(
            HelpFormat.UNKNOWN,
            HelpFormat.CLAP,
            HelpFormat.COBRA,
            HelpFormat.GNU,
            HelpFormat.ARGPARSE,
            HelpFormat.DOCOPT,
            HelpFormat.BSD),
        formats(scores));
    assertEquals(0.05, scores.get(0).score(), 1e-9);
  }

  @Test
  void manPageIsListedWhenDetected() {
    List<FormatScore> scores =
        classify(".TH LS 1\n.SH NAME\nls \\- list\n.SH OPTIONS\n.TP\n.B \\-a\nall\n");

    assertEquals(HelpFormat.MAN, FormatClassifier.top(scores));
  }

  @Test
  void emptyScoreListIsUnknown() {
    assertEquals(HelpFormat.UNKNOWN, FormatClassifier.top(List.of()));
  }

  private static List<FormatScore> classify(String text) {
    return FormatClassifier.classify(HelpNormalizer.normalizeLines(text));
  }

  private static double score(List<FormatScore> scores, HelpFormat format) {
    return scores.stream()
        .filter(s -> s.format() == format)
        .findFirst()
        .map(FormatScore::score)
        .orElseThrow();
  }

  private static List<HelpFormat> formats(List<FormatScore> scores) {
    List<HelpFormat> out = new ArrayList<>();
    scores.forEach(s -> out.add(s.format()));
    return out;
  }
}
