package io.cmdschema.impl.text;

import static io.cmdschema.util.TextUtil.all;
import static io.cmdschema.util.TextUtil.any;
import static io.cmdschema.util.TextUtil.isAsciiAlnum;
import static io.cmdschema.util.TextUtil.isAsciiDigit;
import static io.cmdschema.util.TextUtil.isAsciiLower;
import static io.cmdschema.util.TextUtil.isAsciiUpper;
import static io.cmdschema.util.TextUtil.lower;

import io.cmdschema.impl.IndexedLine;
import io.cmdschema.internal.HelpPatterns;
import io.cmdschema.util.TextUtil;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;

/**
 * Shape predicates over single help lines and tokens. Every method is pure and operates on
 * already-trimmed text unless stated otherwise.
 */
public final class LineShapes {
  private LineShapes() {}

  private static final Set<String> NON_COMMAND_VALUES =
      Set.of(
          "none", "off", "numbered", "existing", "simple", "never", "nil", "all", "auto", "always",
          "default", "older", "warn", "warn-nopipe", "exit", "exit-nopipe", "once", "pages", "or",
          "while", "gnu", "report", "full");

  private static final Set<String> STRUCTURAL_WORDS =
      Set.of(
          "usage", "options", "option", "flags", "flag", "arguments", "argument", "commands",
          "command", "examples", "example");

  private static final List<String> KEYBINDING_VERBS =
      List.of(
          "display", "forward", "backward", "exit", "repaint", "repeat", "edit", "move cursor",
          "go to", "print version");

  /**
   * Splits a row at its first column gap (a tab run or two or more spaces).
   *
   * @param line row text
   * @return both columns, or empty when either side would be blank
   */
  public static Optional<Columns> splitTwoColumns(String line) {
    Matcher m = HelpPatterns.COLUMN_BREAK.matcher(line);
    if (!m.find()) {
      return Optional.empty();
    }
    String left = line.substring(0, m.start()).trim();
    String right = line.substring(m.end()).trim();
    if (left.isEmpty() || right.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(new Columns(left, right));
  }

  /** Splits {@code name - description} rows at the first {@code " - "}. */
  public static Optional<Columns> splitDashSeparator(String line) {
    int idx = line.indexOf(" - ");
    if (idx < 0) {
      return Optional.empty();
    }
    String left = line.substring(0, idx).trim();
    String right = line.substring(idx + 3).trim();
    if (left.isEmpty() || right.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(new Columns(left, right));
  }

  /**
   * Whether the text starts like a flag definition: {@code --x...} with an alphanumeric first
   * character, or {@code -x} where x is not whitespace and not the start of a negative number.
   */
  public static boolean looksLikeFlagRowStart(String trimmed) {
    if (!trimmed.startsWith("-") || trimmed.length() < 2) {
      return false;
    }
    String rest = trimmed.substring(1);
    if (rest.startsWith("-")) {
      return rest.length() > 1 && isAsciiAlnum(rest.charAt(1));
    }
    char first = rest.charAt(0);
    if (Character.isWhitespace(first)) {
      return false;
    }
    return !(isAsciiDigit(first) && rest.length() > 1 && isAsciiDigit(rest.charAt(1)));
  }

  /** A single-dash cluster of at least two alphanumerics, e.g. {@code -abc}. */
  public static boolean isCompactShortCluster(String token) {
    return token.startsWith("-")
        && token.length() > 2
        && !token.startsWith("--")
        && all(token.substring(1), TextUtil::isAsciiAlnum);
  }

  /** Whether a line reads like a subcommand row: a name column or a comma list of names. */
  public static boolean looksLikeSubcommandEntry(String trimmed) {
    if (!TextUtil.startsWith(trimmed, TextUtil::isAsciiAlnum)) {
      return false;
    }
    if (trimmed.contains("  ")) {
      return true;
    }
    for (String part : TextUtil.splitLiteral(trimmed, ",")) {
      String token = part.trim();
      if (!token.isEmpty() && !all(token, ch -> isAsciiAlnum(ch) || ch == '-' || ch == '_')) {
        return false;
      }
    }
    return true;
  }

  public static boolean isValidCommandName(String value) {
    return !value.isEmpty()
        && value.length() < 50
        && all(value, ch -> isAsciiAlnum(ch) || ch == '-' || ch == '_');
  }

  /** Rejects option values, all-caps placeholders, capitalised words and structural words. */
  public static boolean isPlausibleSubcommandName(String value) {
    String token = value.trim();
    if (token.isEmpty() || looksLikeNonCommandValueToken(token)) {
      return false;
    }
    if (all(token, TextUtil::isAsciiUpper) || isAsciiUpper(token.charAt(0))) {
      return false;
    }
    return !STRUCTURAL_WORDS.contains(lower(token));
  }

  public static boolean looksLikeNonCommandValueToken(String token) {
    return NON_COMMAND_VALUES.contains(lower(token.trim()));
  }

  /** Tokens such as {@code _}, {@code 42}, {@code FILE}, {@code ARG...}. */
  public static boolean looksLikePlaceholderSubcommandToken(String token) {
    String t = token.trim();
    if (t.isEmpty() || t.equals("_") || all(t, TextUtil::isAsciiDigit) || t.endsWith("...")) {
      return true;
    }
    return t.length() <= 4 && all(t, ch -> isAsciiUpper(ch) || isAsciiDigit(ch) || ch == '-');
  }

  /** A lower-case command word, or a dot leader. */
  public static boolean looksLikeCommandToken(String token) {
    String t = token.trim();
    if (t.isEmpty() || t.startsWith("-") || t.equals("_")) {
      return false;
    }
    if (all(t, ch -> ch == '.')) {
      return true;
    }
    if (all(t, TextUtil::isAsciiDigit)) {
      return false;
    }
    if (looksLikePlaceholderSubcommandToken(t) || looksLikeNonCommandValueToken(t)) {
      return false;
    }
    if (any(t, Character::isWhitespace) || any(t, TextUtil::isAsciiUpper)) {
      return false;
    }
    return isValidCommandName(t);
  }

  /** A comma-separated list where every part is a valid command name. */
  public static boolean looksLikeCommandListLine(String line) {
    if (!line.contains(",")) {
      return false;
    }
    for (String part : TextUtil.splitLiteral(line, ",")) {
      String token = part.trim();
      if (!token.isEmpty() && !isValidCommandName(token)) {
        return false;
      }
    }
    return true;
  }

  public static boolean looksLikeCommaCommandList(String trimmed) {
    if (!trimmed.contains(",")) {
      return false;
    }
    for (String token : TextUtil.commaParts(trimmed)) {
      if (!looksLikeCommandToken(token)) {
        return false;
      }
    }
    return true;
  }

  /** Argument placeholder tails such as {@code <name>}, {@code [FILE]...} or {@code NAME}. */
  public static boolean looksLikeArgumentPlaceholder(String value) {
    if (value.isEmpty()) {
      return false;
    }
    boolean markers =
        value.contains("...") || value.contains("<") || value.contains(">") || value.contains("[");
    if (!markers && (any(value, TextUtil::isAsciiLower) || !any(value, TextUtil::isAsciiUpper))) {
      return false;
    }
    return all(
        value,
        ch -> isAsciiAlnum(ch) || "_-.[]<>/:|+?".indexOf(ch) >= 0 || Character.isWhitespace(ch));
  }

  public static boolean looksLikeKeybindingRow(String trimmed) {
    Optional<Columns> columns = splitTwoColumns(trimmed);
    if (columns.isEmpty()) {
      return false;
    }
    String left = columns.get().left();
    String leftLower = lower(left);
    if (leftLower.contains("esc-")
        || leftLower.contains("ctrl")
        || leftLower.contains("arrow")
        || left.contains("^")) {
      return true;
    }
    List<String> keys = TextUtil.words(left);
    boolean compactKeys =
        keys.size() >= 3
            && keys.stream()
                .allMatch(
                    k ->
                        k.length() <= 3
                            && all(k, ch -> isAsciiAlnum(ch) || "^-:".indexOf(ch) >= 0));
    if (compactKeys) {
      return true;
    }
    String rightLower = lower(columns.get().right());
    boolean verb = KEYBINDING_VERBS.stream().anyMatch(rightLower::contains);
    boolean shortKeys =
        keys.stream().allMatch(k -> k.length() <= 2 && all(k, TextUtil::isAsciiAlnum));
    return verb && shortKeys;
  }

  /** A pager-style key listing, detected by at least eight key-marker lines. */
  public static boolean looksLikeKeybindingDocument(List<IndexedLine> lines) {
    long markers =
        lines.stream()
            .map(line -> lower(line.text()))
            .filter(
                line ->
                    line.contains("esc-")
                        || line.contains("ctrl-")
                        || line.contains("^")
                        || line.contains("leftarrow")
                        || line.contains("rightarrow")
                        || line.contains("summary of less commands"))
            .count();
    return markers >= 8;
  }

  public static boolean isUsageLine(String trimmed) {
    String l = lower(trimmed);
    return l.startsWith("usage:")
        || l.startsWith("or:")
        || l.startsWith("usage is ")
        || l.contains(": usage is ");
  }

  public static boolean isSectionHeaderLine(String trimmed) {
    if (HelpPatterns.SUBCOMMANDS_SECTION.matcher(trimmed).matches()
        || HelpPatterns.FLAGS_SECTION.matcher(trimmed).matches()
        || HelpPatterns.OPTIONS_SECTION.matcher(trimmed).matches()
        || HelpPatterns.ARGUMENTS_SECTION.matcher(trimmed).matches()) {
      return true;
    }
    String l = lower(trimmed);
    return trimmed.endsWith(":")
        && (l.contains("command")
            || l.contains("action")
            || l.contains("option")
            || l.contains("flag")
            || l.contains("argument"));
  }

  /** A {@code text:} line short enough to introduce a block of rows. */
  public static boolean isBlockHeader(String trimmed) {
    if (trimmed.endsWith(":") && trimmed.length() < 64) {
      return true;
    }
    String l = lower(trimmed);
    return l.contains("summary of") && l.contains("commands");
  }

  public static boolean looksLikeStructuredTwoColumn(String trimmed) {
    Optional<Columns> columns = splitTwoColumns(trimmed);
    if (columns.isEmpty()) {
      return false;
    }
    String left = columns.get().left();
    String right = columns.get().right();
    if (right.contains(":=") || left.equals("-")) {
      return false;
    }
    if (left.startsWith("-")) {
      return looksLikeFlagRowStart(left);
    }
    List<String> tokens = TextUtil.commaParts(left);
    if (tokens.isEmpty() || tokens.stream().allMatch(LineShapes::looksLikeNonCommandValueToken)) {
      return false;
    }
    if (right.startsWith(":")) {
      return false;
    }
    return tokens.stream().allMatch(LineShapes::looksLikeCommandToken);
  }

  /**
   * A line that opens a usage synopsis without a {@code usage:} prefix, e.g. {@code tar -cf
   * archive [file ...]}.
   */
  public static boolean looksLikeUsageSynopsisStart(String trimmed) {
    if (trimmed.startsWith("-") || !(trimmed.contains("--") || trimmed.contains(" -"))) {
      return false;
    }
    String head = TextUtil.trimChars(TextUtil.firstWord(trimmed), ":`'\"(){}");
    if (head.isEmpty()) {
      return false;
    }
    if (!trimmed.contains("[") && TextUtil.words(trimmed).size() > 4) {
      return false;
    }
    return all(head, ch -> isAsciiAlnum(ch) || "_-./+:".indexOf(ch) >= 0);
  }

  public static boolean looksLikeUsageSynopsisContinuation(String trimmed) {
    if (trimmed.isEmpty() || trimmed.endsWith(".")) {
      return false;
    }
    if (trimmed.contains("[") || trimmed.contains("--") || looksLikeFlagRowStart(trimmed)) {
      return true;
    }
    List<String> words = TextUtil.words(trimmed);
    if (words.isEmpty() || words.size() > 2) {
      return false;
    }
    return words.stream()
        .allMatch(w -> all(w, ch -> isAsciiAlnum(ch) || "_-.<>[]".indexOf(ch) >= 0));
  }

  /**
   * Whether a line carries help structure worth accounting for in coverage: usage lines, section
   * headers, flag rows, two-column command rows and comma command lists. Rulers and keybinding rows
   * are excluded.
   */
  public static boolean isRelevantLine(String trimmed) {
    if (trimmed.isEmpty()
        || trimmed.startsWith("---")
        || trimmed.startsWith("-<")
        || trimmed.startsWith("--<")
        || HelpPatterns.LINE_OF_DASHES.matcher(trimmed).matches()
        || looksLikeKeybindingRow(trimmed)) {
      return false;
    }
    return isUsageLine(trimmed)
        || looksLikeUsageSynopsisStart(trimmed)
        || isSectionHeaderLine(trimmed)
        || looksLikeFlagRowStart(trimmed)
        || looksLikeStructuredTwoColumn(trimmed)
        || looksLikeCommaCommandList(trimmed);
  }

  /**
   * Cleans a description: strips dot leaders and trailing {@code --  } sentinels and collapses
   * whitespace.
   *
   * @param raw description text
   * @return cleaned text, or {@code null} when nothing remains
   */
  public static String sanitizeDescription(String raw) {
    if (raw == null) {
      return null;
    }
    String cleaned = raw.trim();
    if (cleaned.isEmpty()) {
      return null;
    }
    cleaned = HelpPatterns.DOT_LEADER.matcher(cleaned).replaceFirst("");
    cleaned = HelpPatterns.DESCRIPTION_SENTINEL.matcher(cleaned).replaceFirst("");
    cleaned = HelpPatterns.WHITESPACE_RUN.matcher(cleaned).replaceAll(" ").trim();
    return cleaned.isEmpty() ? null : cleaned;
  }

  static boolean hasLowercase(String token) {
    return any(token, TextUtil::isAsciiLower);
  }

  static boolean isLowercaseInitial(String token) {
    return TextUtil.startsWith(token, TextUtil::isAsciiLower);
  }
}
