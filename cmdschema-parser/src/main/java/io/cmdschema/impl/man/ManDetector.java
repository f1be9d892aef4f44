package io.cmdschema.impl.man;

import io.cmdschema.impl.IndexedLine;
import io.cmdschema.impl.man.roff.RoffLexer;
import io.cmdschema.internal.HelpPatterns;
import io.cmdschema.util.TextUtil;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Decides whether help text is a manual page and which variant.
 *
 * <p>Raw roff is recognised by macro density near the top of the input. When the text is not roff,
 * a rendered page is recognised by its {@code NAME(SECTION)} banner or by its canonical section
 * headers.
 */
public final class ManDetector {
  private static final int MACRO_SCAN_LINES = 20;
  private static final int DIALECT_SCAN_LINES = 64;
  private static final int TITLE_SCAN_LINES = 12;
  private static final int SECTION_SCAN_LINES = 200;
  private static final int MAX_SECTION_HEADER_LENGTH = 48;

  private static final List<String> MDOC_MACROS = List.of(".Dt", ".Dd", ".Sh", ".Ss", ".Fl", ".Ar");
  private static final List<String> MAN_MACROS = List.of(".TH", ".SH", ".SS", ".TP", ".IP");

  private static final Set<String> CANONICAL_SECTIONS =
      Set.of(
          "NAME",
          "SYNOPSIS",
          "DESCRIPTION",
          "OPTIONS",
          "COMMAND OPTIONS",
          "GLOBAL OPTIONS",
          "COMMANDS",
          "SUBCOMMANDS",
          "ARGUMENTS",
          "EXAMPLES",
          "EXIT STATUS");

  private static final Set<String> RENDERED_BODY_SECTIONS =
      Set.of("OPTIONS", "COMMAND OPTIONS", "GLOBAL OPTIONS", "DESCRIPTION", "COMMANDS");

  private ManDetector() {}

  /** At least two macro lines among the first 20 lines. */
  public static boolean isRawRoff(List<IndexedLine> lines) {
    return macroHits(lines) >= 2;
  }

  /**
   * Detects the manual page variant.
   *
   * @param lines normalized lines
   * @return the variant, or empty when the text is not a manual page
   */
  public static Optional<ManFormat> detect(List<IndexedLine> lines) {
    if (!isRawRoff(lines)) {
      return isRenderedManPage(lines) ? Optional.of(ManFormat.RENDERED) : Optional.empty();
    }
    boolean mdoc = false;
    boolean man = false;
    boolean mdocTitle = false;
    int limit = Math.min(lines.size(), DIALECT_SCAN_LINES);
    for (int i = 0; i < limit; i++) {
      String line = lines.get(i).text().stripLeading();
      mdoc |= startsWithAnyMacro(line, MDOC_MACROS);
      man |= startsWithAnyMacro(line, MAN_MACROS);
      mdocTitle |= startsWithMacro(line, ".Dt");
    }
    if (mdoc && man) {
      return Optional.of(mdocTitle ? ManFormat.MDOC : ManFormat.MAN);
    }
    if (mdoc) {
      return Optional.of(ManFormat.MDOC);
    }
    return man ? Optional.of(ManFormat.MAN) : Optional.empty();
  }

  /**
   * Rendered page heuristic: a title banner in the first 12 lines, or {@code NAME}, {@code
   * SYNOPSIS} and a body section header within the first 200 lines.
   */
  public static boolean isRenderedManPage(List<IndexedLine> lines) {
    int titleLimit = Math.min(lines.size(), TITLE_SCAN_LINES);
    for (int i = 0; i < titleLimit; i++) {
      if (looksLikeTitleLine(lines.get(i).trimmed())) {
        return true;
      }
    }
    boolean name = false;
    boolean synopsis = false;
    boolean body = false;
    int limit = Math.min(lines.size(), SECTION_SCAN_LINES);
    for (int i = 0; i < limit; i++) {
      Optional<String> section = canonicalSectionName(lines.get(i).text());
      if (section.isEmpty()) {
        continue;
      }
      String value = section.get();
      name |= value.equals("NAME");
      synopsis |= value.equals("SYNOPSIS");
      body |= RENDERED_BODY_SECTIONS.contains(value);
    }
    return name && synopsis && body;
  }

  /**
   * Whether the line opens with a {@code NAME(SECTION)} banner token such as {@code GIT-REBASE(1)}
   * or {@code MY_CMD(3p)}: an upper-case name and a section of digits and lower-case letters.
   */
  public static boolean looksLikeTitleLine(String trimmed) {
    String first = TextUtil.firstWord(trimmed);
    int open = first.indexOf('(');
    if (open <= 0 || !first.endsWith(")")) {
      return false;
    }
    String name = first.substring(0, open);
    String section = first.substring(open + 1, first.length() - 1);
    return TextUtil.all(
            name,
            ch -> TextUtil.isAsciiUpper(ch) || TextUtil.isAsciiDigit(ch) || "-_.+".indexOf(ch) >= 0)
        && !section.isEmpty()
        && TextUtil.all(section, ch -> TextUtil.isAsciiLower(ch) || TextUtil.isAsciiDigit(ch));
  }

  /**
   * Maps a line to its canonical section name ({@code "GLOBAL OPTIONS"}), ignoring case, a
   * trailing colon and repeated inner whitespace.
   */
  public static Optional<String> canonicalSectionName(String line) {
    String trimmed = TextUtil.trimEndChars(line.trim(), ":");
    if (trimmed.isEmpty() || trimmed.length() > MAX_SECTION_HEADER_LENGTH) {
      return Optional.empty();
    }
    String compact = TextUtil.upper(HelpPatterns.WHITESPACE_RUN.matcher(trimmed).replaceAll(" "));
    return CANONICAL_SECTIONS.contains(compact) ? Optional.of(compact) : Optional.empty();
  }

  public static boolean looksLikeSectionHeader(String line) {
    return canonicalSectionName(line).isPresent();
  }

  /**
   * Detection confidence: roff 0.90, or 0.95 with at least three macro lines in the first 20;
   * rendered pages 0.70 plus 0.05 per canonical section header, capped at 0.90.
   */
  public static double confidence(ManFormat format, List<IndexedLine> lines) {
    if (format != ManFormat.RENDERED) {
      return macroHits(lines) >= 3 ? 0.95 : 0.90;
    }
    int sections = 0;
    for (IndexedLine line : lines) {
      if (looksLikeSectionHeader(line.text())) {
        sections++;
      }
    }
    return Math.min(0.90, 0.70 + 0.05 * Math.min(sections, 4));
  }

  private static int macroHits(List<IndexedLine> lines) {
    int hits = 0;
    int limit = Math.min(lines.size(), MACRO_SCAN_LINES);
    for (int i = 0; i < limit; i++) {
      if (RoffLexer.isMacroLine(lines.get(i).text())) {
        hits++;
      }
    }
    return hits;
  }

  private static boolean startsWithAnyMacro(String line, List<String> macros) {
    for (String macro : macros) {
      if (startsWithMacro(line, macro)) {
        return true;
      }
    }
    return false;
  }

  // Exact macro name followed by whitespace or end of line.
  private static boolean startsWithMacro(String line, String macro) {
    return line.startsWith(macro)
        && (line.length() == macro.length() || Character.isWhitespace(line.charAt(macro.length())));
  }
}
