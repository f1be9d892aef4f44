package io.cmdschema.impl.man.roff;

import io.cmdschema.impl.IndexedLine;
import io.cmdschema.util.TextUtil;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/** Splits roff source lines into macro, text and newline tokens. */
public final class RoffLexer {
  private RoffLexer() {}

  public static List<RoffToken> tokenize(List<IndexedLine> lines) {
    List<RoffToken> tokens = new ArrayList<>(lines.size());
    for (IndexedLine line : lines) {
      String text = line.text();
      if (text.isBlank() || isComment(text)) {
        tokens.add(new RoffToken.Newline(line.index()));
        continue;
      }
      Optional<RoffToken.Macro> macro = parseMacro(text, line.index());
      if (macro.isPresent()) {
        tokens.add(macro.get());
      } else {
        tokens.add(new RoffToken.Text(RoffEscapes.decode(text).trim(), line.index()));
      }
    }
    return tokens;
  }

  /** {@code .\"} and {@code '\"} lines. */
  static boolean isComment(String line) {
    String trimmed = line.stripLeading();
    return trimmed.length() >= 2
        && (trimmed.charAt(0) == '.' || trimmed.charAt(0) == '\'')
        && trimmed.charAt(1) == '"';
  }

  /**
   * Whether the line is a macro line by the detector's rule: a control character followed by two
   * ASCII letters.
   */
  public static boolean isMacroLine(String line) {
    String trimmed = line.stripLeading();
    return trimmed.length() >= 3
        && (trimmed.charAt(0) == '.' || trimmed.charAt(0) == '\'')
        && TextUtil.isAsciiAlpha(trimmed.charAt(1))
        && TextUtil.isAsciiAlpha(trimmed.charAt(2));
  }

  static Optional<RoffToken.Macro> parseMacro(String line, int index) {
    String trimmed = line.stripLeading();
    if (trimmed.isEmpty() || (trimmed.charAt(0) != '.' && trimmed.charAt(0) != '\'')) {
      return Optional.empty();
    }
    String rest = trimmed.substring(1).stripLeading();
    if (rest.isEmpty() || !TextUtil.isAsciiAlpha(rest.charAt(0))) {
      return Optional.empty();
    }
    if (rest.length() > 1) {
      char second = rest.charAt(1);
      if (!TextUtil.isAsciiAlnum(second) && !Character.isWhitespace(second)) {
        return Optional.empty();
      }
    }
    String name = TextUtil.firstWord(rest);
    return Optional.of(new RoffToken.Macro(name, parseArgs(rest.substring(name.length())), index));
  }

  /**
   * Splits macro arguments on whitespace outside double quotes. {@code \ } and {@code \"} are
   * literal; other escapes are left for {@link RoffEscapes#decode}.
   */
  public static List<String> parseArgs(String input) {
    List<String> out = new ArrayList<>();
    StringBuilder current = new StringBuilder();
    String text = input.trim();
    boolean inQuotes = false;
    for (int i = 0; i < text.length(); i++) {
      char ch = text.charAt(i);
      if (ch == '"') {
        inQuotes = !inQuotes;
      } else if (ch == '\\') {
        if (i + 1 >= text.length()) {
          break;
        }
        char next = text.charAt(++i);
        if (next == ' ' || next == '"') {
          current.append(next);
        } else {
          current.append('\\').append(next);
        }
      } else if (Character.isWhitespace(ch) && !inQuotes) {
        if (current.length() > 0) {
          out.add(RoffEscapes.decode(current.toString()));
          current.setLength(0);
        }
      } else {
        current.append(ch);
      }
    }
    if (current.length() > 0) {
      out.add(RoffEscapes.decode(current.toString()));
    }
    return out;
  }
}
