package io.cmdschema.impl.normalize;

import io.cmdschema.impl.IndexedLine;
import io.cmdschema.impl.text.Columns;
import io.cmdschema.impl.text.LineShapes;
import io.cmdschema.internal.HelpPatterns;
import io.cmdschema.util.TextUtil;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Cleans raw help output: terminal escapes and overstrike formatting are removed, line endings are
 * unified and wrapped description lines are joined back onto the row they continue.
 */
public final class HelpNormalizer {
  private HelpNormalizer() {}

  /**
   * Normalizes raw help text.
   *
   * @param raw help output as printed
   * @return normalized text with {@code \n} line separators, no trailing whitespace per line and
   *     no trailing blank lines
   */
  public static String normalize(String raw) {
    String cleaned = raw;
    String previous;
    // removing one escape can splice together another
    do {
      previous = cleaned;
      cleaned = HelpPatterns.ANSI_CSI.matcher(cleaned).replaceAll("");
      cleaned = HelpPatterns.OVERSTRIKE.matcher(cleaned).replaceAll("");
    } while (!cleaned.equals(previous));
    cleaned = cleaned.replace("\r\n", "\n").replace('\r', '\n');

    List<String> out = new ArrayList<>();
    for (String line : splitLines(cleaned)) {
      String trimmedEnd = stripTrailing(line);
      if (trimmedEnd.isEmpty()) {
        out.add("");
        continue;
      }
      String content = trimmedEnd.trim();
      if (!out.isEmpty()
          && line.startsWith(" ")
          && isContinuation(out.get(out.size() - 1), content)) {
        out.set(out.size() - 1, out.get(out.size() - 1) + " " + content);
        continue;
      }
      out.add(trimmedEnd);
    }
    while (!out.isEmpty() && out.get(out.size() - 1).isEmpty()) {
      out.remove(out.size() - 1);
    }
    return String.join("\n", out);
  }

  /** Normalizes and indexes in one step. */
  public static List<IndexedLine> normalizeLines(String raw) {
    return toIndexedLines(normalize(raw));
  }

  public static List<IndexedLine> toIndexedLines(String normalized) {
    List<String> lines = splitLines(normalized);
    List<IndexedLine> out = new ArrayList<>(lines.size());
    for (int i = 0; i < lines.size(); i++) {
      out.add(new IndexedLine(i, lines.get(i)));
    }
    return out;
  }

  // a wrapped line continues a flag row or a name/description row, never a header
  static boolean isContinuation(String previous, String content) {
    if (content.endsWith(":")) {
      return false;
    }
    String prev = previous.trim();
    if (prev.isEmpty()) {
      return false;
    }
    boolean prevIsFlag = LineShapes.looksLikeFlagRowStart(prev);
    Optional<Columns> columns = LineShapes.splitTwoColumns(prev);
    boolean prevIsCommandRow =
        columns.isPresent()
            && !columns.get().left().startsWith("-")
            && TextUtil.startsWith(columns.get().left(), TextUtil::isAsciiAlnum);
    if (!prevIsFlag && !prevIsCommandRow) {
      return false;
    }
    if (prev.endsWith(":") && !prevIsFlag) {
      return false;
    }
    if (LineShapes.looksLikeSubcommandEntry(content) && !prevIsFlag) {
      return false;
    }
    return !(LineShapes.looksLikeFlagRowStart(content) && !content.contains(";"));
  }

  // line splitting that drops the empty segment after a trailing newline
  private static List<String> splitLines(String text) {
    List<String> lines = TextUtil.splitLiteral(text, "\n");
    if (!lines.isEmpty() && lines.get(lines.size() - 1).isEmpty()) {
      lines.remove(lines.size() - 1);
    }
    return lines;
  }

  private static String stripTrailing(String line) {
    int end = line.length();
    while (end > 0 && Character.isWhitespace(line.charAt(end - 1))) {
      end--;
    }
    return line.substring(0, end);
  }
}
