package io.cmdschema.impl.text;

import static io.cmdschema.util.TextUtil.lower;

import io.cmdschema.impl.IndexedLine;
import io.cmdschema.internal.HelpPatterns;
import io.cmdschema.util.TextUtil;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;

/** Version and one-line description from the top of the help text. */
public final class MetadataExtractor {
  private MetadataExtractor() {}

  private static final int VERSION_SCAN_LINES = 5;
  private static final int DESCRIPTION_SCAN_LINES = 10;

  /**
   * Looks for {@code <command> 1.2.3}, a line mentioning "version", or a {@code <tool> 1.2.3}
   * banner within the first five lines.
   */
  public static Optional<String> version(String command, List<IndexedLine> lines) {
    String base = lower(TextUtil.firstWord(command));
    for (IndexedLine line : lines.subList(0, Math.min(VERSION_SCAN_LINES, lines.size()))) {
      String trimmed = line.trimmed();
      Matcher number = HelpPatterns.VERSION_NUMBER.matcher(trimmed);
      if (!base.isEmpty() && lower(trimmed).startsWith(base + " ") && number.find()) {
        return Optional.of(number.group(1));
      }
      String l = lower(line.text());
      if (l.contains("version") || l.contains(" v")) {
        Matcher any = HelpPatterns.VERSION_NUMBER.matcher(line.text());
        if (any.find()) {
          return Optional.of(any.group(1));
        }
      }
      Matcher banner = HelpPatterns.BANNER_VERSION.matcher(trimmed);
      if (banner.find()) {
        return Optional.of(banner.group(1));
      }
    }
    return Optional.empty();
  }

  /** First prose line of the first ten that is not usage, a header, a row or a synopsis. */
  public static Optional<String> description(List<IndexedLine> lines) {
    for (IndexedLine line : lines.subList(0, Math.min(DESCRIPTION_SCAN_LINES, lines.size()))) {
      String trimmed = line.trimmed();
      String l = lower(trimmed);
      if (trimmed.isEmpty()
          || l.startsWith("usage")
          || l.startsWith("or:")
          || l.startsWith("examples:")
          || l.startsWith("example:")
          || trimmed.endsWith(":")
          || trimmed.startsWith("-")
          || trimmed.startsWith("[")
          || trimmed.startsWith("<")) {
        continue;
      }
      boolean row =
          LineShapes.splitTwoColumns(trimmed)
              .map(
                  c ->
                      LineShapes.looksLikeCommandToken(c.left())
                          || LineShapes.looksLikeFlagRowStart(c.left()))
              .orElse(false);
      if (row) {
        continue;
      }
      if (trimmed.length() > 10
          && !trimmed.contains("--")
          && !trimmed.contains("[")
          && !trimmed.contains("]")
          && !trimmed.contains("...")) {
        return Optional.ofNullable(LineShapes.sanitizeDescription(trimmed));
      }
    }
    return Optional.empty();
  }
}
