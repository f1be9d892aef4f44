package io.cmdschema.impl.classify;

import io.cmdschema.api.FormatScore;
import io.cmdschema.api.HelpFormat;
import io.cmdschema.impl.IndexedLine;
import io.cmdschema.impl.man.ManDetector;
import io.cmdschema.impl.man.ManFormat;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Scores help text against the known format families. Each family sums fixed points for the
 * markers it finds; the result is sorted by descending score, ties kept in {@link HelpFormat}
 * declaration order. {@link HelpFormat#MAN} is only listed when a manual page is detected.
 */
public final class FormatClassifier {
  private static final double UNKNOWN_BASELINE = 0.05;

  private FormatClassifier() {}

  public static List<FormatScore> classify(List<IndexedLine> lines) {
    StringBuilder joined = new StringBuilder();
    boolean dashLine = false;
    for (IndexedLine line : lines) {
      if (joined.length() > 0) {
        joined.append('\n');
      }
      joined.append(line.text());
      dashLine |= line.text().stripLeading().startsWith("-");
    }
    String output = joined.toString();

    Map<HelpFormat, Double> scores = new EnumMap<>(HelpFormat.class);
    scores.put(HelpFormat.CLAP, clap(output));
    scores.put(HelpFormat.COBRA, cobra(output));
    scores.put(HelpFormat.GNU, gnu(output, dashLine));
    scores.put(HelpFormat.ARGPARSE, argparse(output));
    scores.put(HelpFormat.DOCOPT, output.startsWith("Usage:") ? 0.75 : 0.0);
    scores.put(
        HelpFormat.BSD,
        output.contains("SYNOPSIS") || output.contains("DESCRIPTION") ? 0.45 : 0.0);
    Optional<ManFormat> man = ManDetector.detect(lines);
    man.ifPresent(format -> scores.put(HelpFormat.MAN, ManDetector.confidence(format, lines)));
    scores.put(HelpFormat.UNKNOWN, UNKNOWN_BASELINE);

    List<FormatScore> out = new ArrayList<>(scores.size());
    // EnumMap iterates in declaration order, so the stable sort keeps ties in that order.
    scores.forEach((format, score) -> out.add(new FormatScore(format, score)));
    out.sort(Comparator.comparingDouble(FormatScore::score).reversed());
    return out;
  }

  /** The highest scoring format, or {@link HelpFormat#UNKNOWN} for an empty list. */
  public static HelpFormat top(List<FormatScore> scores) {
    return scores.isEmpty() ? HelpFormat.UNKNOWN : scores.get(0).format();
  }

  private static double clap(String output) {
    double s = 0.0;
    if (output.contains("USAGE:")) {
      s += 0.35;
    }
    if (output.contains("FLAGS:")) {
      s += 0.25;
    }
    if (output.contains("OPTIONS:")) {
      s += 0.2;
    }
    if (output.contains("SUBCOMMANDS:") || output.contains("Commands:")) {
      s += 0.2;
    }
    return s;
  }

  private static double cobra(String output) {
    double s = 0.0;
    if (output.contains("Available Commands:")) {
      s += 0.5;
    }
    if (output.contains("Use \"") && output.contains("--help")) {
      s += 0.35;
    }
    if (output.contains("Flags:")) {
      s += 0.15;
    }
    return s;
  }

  private static double gnu(String output, boolean dashLine) {
    double s = 0.0;
    if (output.contains("Usage:")) {
      s += 0.25;
    }
    if (output.contains("--help")) {
      s += 0.2;
    }
    if (output.contains("--version")) {
      s += 0.2;
    }
    if (dashLine) {
      s += 0.2;
    }
    return s;
  }

  private static double argparse(String output) {
    double s = 0.0;
    if (output.contains("positional arguments:")) {
      s += 0.45;
    }
    if (output.contains("optional arguments:")) {
      s += 0.45;
    }
    return s;
  }
}
