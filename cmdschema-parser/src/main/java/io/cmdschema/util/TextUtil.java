package io.cmdschema.util;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.IntPredicate;

/**
 * Small string helpers used by the help-text extractors.
 *
 * <p>Help output is overwhelmingly ASCII, and every shape check in the parser is defined over
 * <strong>ASCII</strong> character classes. The {@code isAscii*} predicates here never match
 * non-ASCII letters or digits, so a token such as {@code "färg"} is not a valid command name.
 *
 * <h2>Trimming</h2>
 *
 * <ul>
 *   <li>{@link #trimChars(String, String)} strips any of the given characters from both ends
 *   <li>{@link #trimEndRepeated(String, String)} strips a suffix repeatedly, e.g. {@code "..."}
 * </ul>
 *
 * <h2>Examples</h2>
 *
 * <pre>{@code
 * TextUtil.trimChars("[<file>]", "[]<>");          // "file"
 * TextUtil.trimEndRepeated("FILE......", "...");  // "FILE"
 * TextUtil.words("  -a,  --all  ");                // ["-a,", "--all"]
 * }</pre>
 */
public final class TextUtil {

  private TextUtil() {}

  public static boolean isAsciiDigit(int ch) {
    return ch >= '0' && ch <= '9';
  }

  public static boolean isAsciiUpper(int ch) {
    return ch >= 'A' && ch <= 'Z';
  }

  public static boolean isAsciiLower(int ch) {
    return ch >= 'a' && ch <= 'z';
  }

  public static boolean isAsciiAlpha(int ch) {
    return isAsciiUpper(ch) || isAsciiLower(ch);
  }

  public static boolean isAsciiAlnum(int ch) {
    return isAsciiAlpha(ch) || isAsciiDigit(ch);
  }

  /**
   * Returns true if every character matches. An empty string matches vacuously.
   *
   * @param text text to check
   * @param predicate character predicate
   * @return whether all characters satisfy the predicate
   */
  public static boolean all(String text, IntPredicate predicate) {
    return text.chars().allMatch(predicate);
  }

  /**
   * Returns true if at least one character matches.
   *
   * @param text text to check
   * @param predicate character predicate
   * @return whether any character satisfies the predicate
   */
  public static boolean any(String text, IntPredicate predicate) {
    return text.chars().anyMatch(predicate);
  }

  /** Whether the first character exists and matches. */
  public static boolean startsWith(String text, IntPredicate predicate) {
    return !text.isEmpty() && predicate.test(text.charAt(0));
  }

  /** Lower-cases using the root locale. */
  public static String lower(String text) {
    return text.toLowerCase(Locale.ROOT);
  }

  /** Upper-cases using the root locale. */
  public static String upper(String text) {
    return text.toUpperCase(Locale.ROOT);
  }

  /**
   * Splits on runs of whitespace, dropping empty tokens.
   *
   * @param text text to split
   * @return whitespace-separated words, never containing empty strings
   */
  public static List<String> words(String text) {
    List<String> out = new ArrayList<>();
    int start = -1;
    for (int i = 0; i < text.length(); i++) {
      boolean ws = Character.isWhitespace(text.charAt(i));
      if (ws && start >= 0) {
        out.add(text.substring(start, i));
        start = -1;
      } else if (!ws && start < 0) {
        start = i;
      }
    }
    if (start >= 0) {
      out.add(text.substring(start));
    }
    return out;
  }

  /** First whitespace-separated word, or the empty string. */
  public static String firstWord(String text) {
    List<String> words = words(text);
    return words.isEmpty() ? "" : words.get(0);
  }

  /**
   * Strips any of {@code chars} from both ends.
   *
   * @param text text to trim
   * @param chars characters to remove
   * @return trimmed text
   */
  public static String trimChars(String text, String chars) {
    return trimEndChars(trimStartChars(text, chars), chars);
  }

  public static String trimStartChars(String text, String chars) {
    int start = 0;
    while (start < text.length() && chars.indexOf(text.charAt(start)) >= 0) {
      start++;
    }
    return text.substring(start);
  }

  public static String trimEndChars(String text, String chars) {
    int end = text.length();
    while (end > 0 && chars.indexOf(text.charAt(end - 1)) >= 0) {
      end--;
    }
    return text.substring(0, end);
  }

  /**
   * Removes {@code suffix} from the end as many times as it occurs.
   *
   * @param text text to trim
   * @param suffix non-empty suffix
   * @return text without trailing repetitions of suffix
   */
  public static String trimEndRepeated(String text, String suffix) {
    String out = text;
    while (!suffix.isEmpty() && out.endsWith(suffix)) {
      out = out.substring(0, out.length() - suffix.length());
    }
    return out;
  }

  /** Removes {@code prefix} from the start as many times as it occurs. */
  public static String trimStartRepeated(String text, String prefix) {
    String out = text;
    while (!prefix.isEmpty() && out.startsWith(prefix)) {
      out = out.substring(prefix.length());
    }
    return out;
  }

  /**
   * Splits on a literal separator, keeping empty segments.
   *
   * @param text text to split
   * @param separator literal separator
   * @return segments in order
   */
  public static List<String> splitLiteral(String text, String separator) {
    List<String> out = new ArrayList<>();
    int from = 0;
    int idx;
    while ((idx = text.indexOf(separator, from)) >= 0) {
      out.add(text.substring(from, idx));
      from = idx + separator.length();
    }
    out.add(text.substring(from));
    return out;
  }

  /**
   * Splits on any of the given characters, keeping empty segments.
   *
   * @param text text to split
   * @param separators separator characters
   * @return segments in order
   */
  public static List<String> splitAny(String text, String separators) {
    List<String> out = new ArrayList<>();
    int from = 0;
    for (int i = 0; i < text.length(); i++) {
      if (separators.indexOf(text.charAt(i)) >= 0) {
        out.add(text.substring(from, i));
        from = i + 1;
      }
    }
    out.add(text.substring(from));
    return out;
  }

  /** Comma-separated parts, trimmed, with empty parts dropped. */
  public static List<String> commaParts(String text) {
    List<String> out = new ArrayList<>();
    for (String part : splitLiteral(text, ",")) {
      String trimmed = part.trim();
      if (!trimmed.isEmpty()) {
        out.add(trimmed);
      }
    }
    return out;
  }
}
