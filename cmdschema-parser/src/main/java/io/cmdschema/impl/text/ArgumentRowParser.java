package io.cmdschema.impl.text;

import static io.cmdschema.util.TextUtil.lower;

import io.cmdschema.api.ArgSchema;
import io.cmdschema.api.ValueType;
import io.cmdschema.impl.IndexedLine;
import io.cmdschema.util.TextUtil;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Positional arguments from {@code Arguments:} sections and usage synopses. */
public final class ArgumentRowParser {
  private ArgumentRowParser() {}

  private static final Pattern TOKEN = Pattern.compile("\\S+");

  private static final Set<String> PLACEHOLDER_KEYWORDS =
      Set.of(
          "options", "option", "flags", "flag", "args", "arguments", "usage", "command",
          "subcommand", "commands");

  private static final Set<String> STRUCTURAL_WORDS =
      Set.of("usage", "options", "option", "flags", "flag", "args", "arguments");

  private static final Set<String> COMMAND_WORDS = Set.of("command", "subcommand", "cmd");

  /**
   * Parses rows of an explicit arguments section, {@code <name>  description} or bare names.
   * A string-typed argument takes its type from the description when that names one.
   */
  public static List<LineMatch<ArgSchema>> parseSection(List<IndexedLine> lines) {
    List<LineMatch<ArgSchema>> out = new ArrayList<>();
    Set<String> seen = new HashSet<>();
    for (IndexedLine line : lines) {
      String trimmed = line.trimmed();
      if (trimmed.isEmpty() || LineShapes.looksLikeFlagRowStart(trimmed)) {
        continue;
      }
      Optional<Columns> columns = LineShapes.splitTwoColumns(trimmed);
      String left = columns.map(Columns::left).orElse(trimmed);
      String description = columns.map(c -> LineShapes.sanitizeDescription(c.right())).orElse(null);
      for (ArgSchema parsed : parseTokens(left)) {
        ArgSchema arg = parsed;
        if (arg.description() == null) {
          arg = arg.withDescription(description);
        }
        if (arg.valueType() == ValueType.STRING && arg.description() != null) {
          arg =
              new ArgSchema(
                  arg.name(),
                  ValueTypes.fromHelpRow(arg.description()),
                  arg.required(),
                  arg.multiple(),
                  arg.description());
        }
        if (seen.add(lower(arg.name()))) {
          out.add(new LineMatch<>(arg, line.index()));
        }
      }
    }
    return out;
  }

  /**
   * Splits a definition into argument names. Bracketed tokens are optional, {@code ...} marks a
   * repeatable argument and structural words such as {@code options} are skipped.
   */
  public static List<ArgSchema> parseTokens(String value) {
    List<ArgSchema> args = new ArrayList<>();
    for (String raw : TextUtil.words(value)) {
      String token = TextUtil.trimChars(raw, ",;:");
      if (token.isEmpty() || token.startsWith("-") || token.equals("|") || token.equals("or")) {
        continue;
      }
      boolean multiple = token.contains("...") || raw.endsWith("...");
      boolean required = !token.startsWith("[");
      String cleaned = TextUtil.trimEndRepeated(token, "...");
      cleaned = TextUtil.trimChars(cleaned, "[]<>(){}");
      cleaned = TextUtil.trimStartChars(cleaned, "+");
      cleaned = TextUtil.trimEndRepeated(cleaned, "...");
      cleaned = TextUtil.trimChars(cleaned, ",;:");
      if (cleaned.isEmpty()
          || cleaned.startsWith("-")
          || PLACEHOLDER_KEYWORDS.contains(lower(cleaned))
          || !looksLikeArgumentName(cleaned)) {
        continue;
      }
      args.add(
          new ArgSchema(cleaned, ValueTypes.fromArgumentName(cleaned), required, multiple, null));
    }
    return args;
  }

  static boolean looksLikeArgumentName(String token) {
    return !token.isEmpty()
        && token.length() <= 64
        && TextUtil.all(token, ch -> TextUtil.isAsciiAlnum(ch) || "_-.".indexOf(ch) >= 0);
  }

  /**
   * Reads placeholders from the usage synopsis: bracketed or angled tokens, upper-case words such
   * as {@code FILE} and indexed lower-case names such as {@code file1}.
   *
   * @param usage joined usage text
   * @param command command name, skipped when it appears in the synopsis
   * @param hasSubcommands whether {@code command}/{@code cmd} placeholders stand for subcommands
   * @return arguments attributed to the line their token appears on
   */
  public static List<LineMatch<ArgSchema>> usagePositionals(
      UsageText usage, String command, boolean hasSubcommands) {
    if (usage.isEmpty()) {
      return List.of();
    }
    String text = usage.text();
    boolean grammar = text.contains(":=");
    List<LineMatch<ArgSchema>> out = new ArrayList<>();
    Set<String> seen = new HashSet<>();
    Matcher m = TOKEN.matcher(text);
    while (m.find()) {
      String token = TextUtil.trimChars(m.group(), ",;:");
      if (token.equalsIgnoreCase("usage:")
          || token.equalsIgnoreCase("usage")
          || token.startsWith("-")
          || token.equalsIgnoreCase(command)
          || token.contains("::=")
          || !looksLikePlaceholder(token)) {
        continue;
      }
      int line = usage.lineAt(m.start());
      for (ArgSchema arg : parseTokens(token)) {
        String key = lower(arg.name());
        if ((hasSubcommands && COMMAND_WORDS.contains(key))
            || STRUCTURAL_WORDS.contains(key)
            || (grammar && TextUtil.all(arg.name(), TextUtil::isAsciiUpper))) {
          continue;
        }
        if (seen.add(key)) {
          ArgSchema kept =
              token.startsWith("[")
                  ? new ArgSchema(
                      arg.name(), arg.valueType(), false, arg.multiple(), arg.description())
                  : arg;
          out.add(new LineMatch<>(kept, line));
        }
      }
    }
    return out;
  }

  private static boolean looksLikePlaceholder(String token) {
    if (token.contains("<") || token.contains("[") || token.contains("...")) {
      return true;
    }
    boolean upper =
        TextUtil.any(token, TextUtil::isAsciiUpper)
            && TextUtil.all(
                token,
                ch ->
                    TextUtil.isAsciiUpper(ch)
                        || TextUtil.isAsciiDigit(ch)
                        || "_[].+<>".indexOf(ch) >= 0);
    boolean indexedLower =
        TextUtil.any(token, TextUtil::isAsciiLower)
            && TextUtil.any(token, TextUtil::isAsciiDigit)
            && TextUtil.all(token, ch -> TextUtil.isAsciiAlnum(ch) || "_-[].".indexOf(ch) >= 0);
    return upper || indexedLower;
  }
}
