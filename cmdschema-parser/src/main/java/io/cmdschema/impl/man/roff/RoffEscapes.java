package io.cmdschema.impl.man.roff;

/** Decodes the roff escape sequences that appear in manual page sources. */
public final class RoffEscapes {
  private RoffEscapes() {}

  /**
   * Decodes escapes in a line or macro argument.
   *
   * <ul>
   *   <li>font selections {@code \fB}, {@code \f(CW}, {@code \f[BI]} and style toggles {@code \B},
   *       {@code \I}, {@code \R}, {@code \P} are dropped
   *   <li>{@code \ } becomes a space, {@code \\} a backslash and {@code \-} a hyphen
   *   <li>{@code \&} and two-character special glyphs {@code \(XX} are dropped
   *   <li>any other escape keeps its next character; a trailing lone backslash is kept
   * </ul>
   *
   * @param input text to decode
   * @return decoded text
   */
  public static String decode(String input) {
    StringBuilder out = new StringBuilder(input.length());
    int i = 0;
    int len = input.length();
    while (i < len) {
      char ch = input.charAt(i);
      if (ch != '\\') {
        out.append(ch);
        i++;
        continue;
      }
      if (i + 1 >= len) {
        out.append(ch);
        break;
      }
      char next = input.charAt(i + 1);
      switch (next) {
        case 'f' -> i = skipFontSelector(input, i + 2);
        case 'B', 'I', 'R', 'P', '&' -> i += 2;
        case '(' -> i = Math.min(len, i + 4);
        case ' ' -> {
          out.append(' ');
          i += 2;
        }
        default -> {
          out.append(next);
          i += 2;
        }
      }
    }
    return out.toString();
  }

  // returns the index just past the selector that starts at {@code from}
  private static int skipFontSelector(String input, int from) {
    int len = input.length();
    if (from >= len) {
      return len;
    }
    char selector = input.charAt(from);
    if (selector == '[') {
      int close = input.indexOf(']', from + 1);
      return close < 0 ? len : close + 1;
    }
    if (selector == '(') {
      return Math.min(len, from + 3);
    }
    return from + 1;
  }
}
