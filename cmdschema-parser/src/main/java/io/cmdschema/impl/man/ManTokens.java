package io.cmdschema.impl.man;

import static io.cmdschema.util.TextUtil.all;
import static io.cmdschema.util.TextUtil.any;
import static io.cmdschema.util.TextUtil.isAsciiAlnum;

import io.cmdschema.util.TextUtil;

/** Token shape checks shared by the roff and rendered manual page readers. */
public final class ManTokens {
  private static final String SYNOPSIS_WRAPPERS = "[]<>{}(),;\"'";

  private ManTokens() {}

  /** Starts with an ASCII letter, then letters, digits, {@code -} or {@code _}. */
  public static boolean looksLikeCommandName(String value) {
    return TextUtil.startsWith(value, TextUtil::isAsciiAlpha)
        && all(value, ch -> isAsciiAlnum(ch) || ch == '-' || ch == '_');
  }

  /** Letters, digits, {@code _ - .} with at least one alphanumeric. */
  public static boolean looksLikeArgToken(String token) {
    return !token.isEmpty()
        && all(token, ch -> isAsciiAlnum(ch) || ch == '_' || ch == '-' || ch == '.')
        && any(token, TextUtil::isAsciiAlnum);
  }

  /** Strips synopsis brackets, quotes and punctuation, then a trailing ellipsis. */
  public static String normalizeSynopsisToken(String raw) {
    String stripped = TextUtil.trimChars(raw, SYNOPSIS_WRAPPERS);
    return TextUtil.trimChars(TextUtil.trimEndRepeated(stripped, "..."), SYNOPSIS_WRAPPERS).trim();
  }

  /** Whether a synopsis word is wrapped as optional or as a placeholder. */
  public static boolean isBracketed(String raw) {
    return raw.indexOf('[') >= 0 || raw.indexOf('<') >= 0 || raw.indexOf('{') >= 0;
  }

  /**
   * Index where the value part of a flag token starts: the first {@code =}, {@code [}, {@code <}
   * or {@code (} after the leading dashes, or -1 for a bare flag. {@code --color[=WHEN]} and
   * {@code --exec-path[=<path>]} both cut after the name.
   */
  public static int valueStart(String token) {
    for (int i = 1; i < token.length(); i++) {
      if ("=[<(".indexOf(token.charAt(i)) >= 0) {
        return i;
      }
    }
    return -1;
  }
}
