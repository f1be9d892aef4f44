package io.cmdschema.impl.man.rendered;

import static io.cmdschema.util.TextUtil.lower;

import io.cmdschema.impl.IndexedLine;
import io.cmdschema.impl.candidate.CandidatePools;
import io.cmdschema.impl.man.ManDetector;
import io.cmdschema.internal.HelpPatterns;
import io.cmdschema.util.TextUtil;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads the formatted output of {@code man}.
 *
 * <p>Running headers and footers are dropped, wrapped description lines are folded back onto
 * their option or command row, and the page is split into canonical sections before each section
 * reader runs.
 */
public final class RenderedManParser {
  private static final Logger LOG = LoggerFactory.getLogger(RenderedManParser.class);

  static final String OPTIONS_STRATEGY = "man-rendered-options";
  static final String DESCRIPTION_OPTIONS_STRATEGY = "man-rendered-description-options";
  static final double OPTIONS_CONFIDENCE = 0.88;
  static final double DESCRIPTION_OPTIONS_CONFIDENCE = 0.76;

  private RenderedManParser() {}

  /**
   * Extracts candidates from a rendered page.
   *
   * @param command command the page documents; its words are not read as positionals
   * @param lines normalized lines
   * @return candidate pools
   */
  public static CandidatePools parse(String command, List<IndexedLine> lines) {
    List<RenderedSection> sections = identifySections(normalizeLines(lines));
    CandidatePools pools = new CandidatePools();
    RenderedSynopsis synopsis = new RenderedSynopsis(command);
    for (RenderedSection section : sections) {
      String name = section.name();
      if (name.equals("OPTIONS")) {
        RenderedOptions.parse(section, OPTIONS_STRATEGY, OPTIONS_CONFIDENCE, pools.flags());
      } else if (name.contains("OPTION") || name.equals("DESCRIPTION")) {
        if (section.hasOptionLikeLines()) {
          RenderedOptions.parse(
              section, DESCRIPTION_OPTIONS_STRATEGY, DESCRIPTION_OPTIONS_CONFIDENCE, pools.flags());
        }
      }
      if (name.contains("SYNOPSIS")) {
        synopsis.parse(section, pools);
      }
      if (name.contains("COMMAND")) {
        RenderedCommands.parse(section, pools.subcommands());
      }
    }
    LOG.debug(
        "Rendered manual page: {} sections, {} flags, {} subcommands, {} args",
        sections.size(),
        pools.flags().size(),
        pools.subcommands().size(),
        pools.args().size());
    return pools;
  }

  /**
   * Drops running headers and footers and folds indented continuation lines onto the preceding
   * option or two-column row. A folded line keeps the index of the row it joined.
   */
  static List<IndexedLine> normalizeLines(List<IndexedLine> lines) {
    List<IndexedLine> out = new ArrayList<>(lines.size());
    for (IndexedLine line : lines) {
      String text = line.text().stripTrailing();
      String trimmed = text.trim();
      if (isRunningHeaderOrFooter(trimmed)) {
        continue;
      }
      if (trimmed.isEmpty()) {
        out.add(new IndexedLine(line.index(), ""));
        continue;
      }
      if (Character.isWhitespace(text.charAt(0)) && !out.isEmpty()) {
        IndexedLine previous = out.get(out.size() - 1);
        if (continues(previous.trimmed(), trimmed)) {
          // The first folded line becomes the description column.
          String separator = hasColumnBreak(previous.trimmed()) ? " " : "  ";
          out.set(
              out.size() - 1,
              new IndexedLine(previous.index(), previous.text() + separator + trimmed));
          continue;
        }
      }
      out.add(new IndexedLine(line.index(), text));
    }
    return out;
  }

  static List<RenderedSection> identifySections(List<IndexedLine> lines) {
    List<RenderedSection> sections = new ArrayList<>();
    String current = null;
    int headerLine = -1;
    List<IndexedLine> body = new ArrayList<>();
    for (IndexedLine line : lines) {
      Optional<String> header = ManDetector.canonicalSectionName(line.text());
      if (header.isPresent()) {
        if (current != null && !body.isEmpty()) {
          sections.add(new RenderedSection(current, headerLine, body));
        }
        current = header.get();
        headerLine = line.index();
        body = new ArrayList<>();
      } else if (current != null) {
        body.add(line);
      }
    }
    if (current != null && !body.isEmpty()) {
      sections.add(new RenderedSection(current, headerLine, body));
    }
    return sections;
  }

  static boolean isRunningHeaderOrFooter(String trimmed) {
    if (trimmed.isEmpty()) {
      return false;
    }
    if (TextUtil.all(trimmed, TextUtil::isAsciiDigit)) {
      return true;
    }
    String l = lower(trimmed);
    if (l.contains(" git manual ") || l.contains("general commands manual")) {
      return true;
    }
    return ManDetector.looksLikeTitleLine(trimmed);
  }

  private static boolean continues(String previous, String continuation) {
    if (previous.isEmpty() || ManDetector.looksLikeSectionHeader(continuation)) {
      return false;
    }
    return (previous.startsWith("-") || hasColumnBreak(previous)) && !continuation.startsWith("-");
  }

  private static boolean hasColumnBreak(String text) {
    return HelpPatterns.COLUMN_BREAK.matcher(text).find();
  }
}
