package io.cmdschema.impl.classify;

import static io.cmdschema.util.TextUtil.lower;

import io.cmdschema.impl.IndexedLine;
import io.cmdschema.util.TextUtil;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/** Hard-negative filters for rows that look structural but are not schema entities. */
public final class RowFilters {
  private RowFilters() {}

  private static final Set<String> PLACEHOLDER_TOKENS =
      Set.of(
          "COMMAND", "FILE", "PATH", "URL", "ARG", "OPTION", "SUBCOMMAND", "CMD", "ARGS",
          "OPTIONS");

  private static final Set<String> PROSE_HEADERS =
      Set.of(
          "name  description",
          "name description",
          "command  description",
          "command description",
          "option  description",
          "option description");

  /** {@code COMMAND}, {@code FILE}, {@code ARGS} and similar, ignoring case. */
  public static boolean isPlaceholderToken(String text) {
    return PLACEHOLDER_TOKENS.contains(text.trim().toUpperCase(Locale.ROOT));
  }

  /** {@code export FOO=bar} or {@code MY_VAR=value}. */
  public static boolean isEnvVarRow(String line) {
    String trimmed = line.trim();
    if (trimmed.startsWith("export ")) {
      return true;
    }
    int eq = trimmed.indexOf('=');
    if (eq < 0) {
      return false;
    }
    String key = trimmed.substring(0, eq).trim();
    return !key.isEmpty()
        && TextUtil.all(
            key, ch -> TextUtil.isAsciiUpper(ch) || TextUtil.isAsciiDigit(ch) || ch == '_');
  }

  public static boolean isKeybindingRow(String line) {
    String trimmed = line.trim();
    if (trimmed.contains("Ctrl+") || trimmed.contains("ctrl+") || trimmed.contains("^")) {
      return true;
    }
    String l = lower(trimmed);
    return l.contains("esc-")
        || l.contains("arrow")
        || l.contains("backspace")
        || l.contains("delete");
  }

  /** Column headings such as {@code name  description}. */
  public static boolean isProseHeader(String line) {
    return PROSE_HEADERS.contains(lower(line.trim()));
  }

  /** Whether a subcommand name should be dropped before merging. */
  public static boolean rejectsSubcommandName(String name) {
    return isPlaceholderToken(name)
        || isEnvVarRow(name)
        || isKeybindingRow(name)
        || isProseHeader(name);
  }

  /** Lines that match any hard-negative filter. */
  public static int countFilterHits(List<IndexedLine> lines) {
    int hits = 0;
    for (IndexedLine line : lines) {
      String text = line.text();
      if (isEnvVarRow(text) || isKeybindingRow(text) || isProseHeader(text)) {
        hits++;
      }
    }
    return hits;
  }
}
