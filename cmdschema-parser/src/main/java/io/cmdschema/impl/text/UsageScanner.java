package io.cmdschema.impl.text;

import static io.cmdschema.util.TextUtil.lower;

import io.cmdschema.api.FlagSchema;
import io.cmdschema.api.ValueType;
import io.cmdschema.impl.IndexedLine;
import io.cmdschema.internal.HelpPatterns;
import io.cmdschema.util.TextUtil;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntSet;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads flags out of usage synopses such as {@code usage: tmux [-2CDlNuVv] [-c shell-command]
 * {-v | --version}}.
 */
public final class UsageScanner {
  private UsageScanner() {}

  private static final Pattern BRACKET_GROUP = Pattern.compile("\\[([^\\]]+)\\]");
  private static final Pattern BRACE_GROUP = Pattern.compile("\\{([^}]+)\\}");

  /** Short and long names of a single usage flag token. */
  public record FlagAtom(String shortName, String longName) {}

  /**
   * Collects usage-like text: {@code usage:} / {@code or:} lines, {@code X: usage is ...} lines,
   * bare synopsis lines such as {@code cmd -x [file]}, and indented continuations of either.
   *
   * @param lines normalized lines, not trimmed
   * @return the joined synopsis
   */
  public static UsageText collect(List<IndexedLine> lines) {
    UsageText usage = new UsageText();
    boolean inSynopsis = false;
    for (IndexedLine line : lines) {
      String trimmed = line.trimmed();
      if (trimmed.isEmpty()) {
        inSynopsis = false;
        continue;
      }
      Optional<String> intro = introPayload(trimmed);
      if (intro.isPresent()) {
        inSynopsis = true;
        usage.append(line.index(), intro.get());
        continue;
      }
      if (LineShapes.looksLikeUsageSynopsisStart(trimmed)) {
        inSynopsis = true;
        usage.append(line.index(), trimmed);
        continue;
      }
      if (inSynopsis
          && line.isIndented()
          && LineShapes.looksLikeUsageSynopsisContinuation(trimmed)) {
        usage.append(line.index(), trimmed);
        continue;
      }
      inSynopsis = false;
    }
    return usage;
  }

  static Optional<String> introPayload(String trimmed) {
    String l = lower(trimmed);
    if (l.startsWith("usage:") || l.startsWith("or:")) {
      return Optional.of(trimmed);
    }
    int pos = l.indexOf("usage is ");
    if (pos >= 0) {
      String tail = trimmed.substring(pos + "usage is ".length()).trim();
      if (!tail.isEmpty()) {
        return Optional.of("usage: " + tail);
      }
    }
    return Optional.empty();
  }

  /**
   * Extracts flags from bracket groups, brace alternations and standalone tokens of the synopsis.
   * Each flag is attributed to the line its token appears on.
   */
  public static List<LineMatch<FlagSchema>> compactFlags(UsageText usage) {
    if (usage.isEmpty()) {
      return List.of();
    }
    String text = usage.text();
    List<LineMatch<FlagSchema>> flags = new ArrayList<>();

    Matcher bracket = BRACKET_GROUP.matcher(text);
    while (bracket.find()) {
      int line = usage.lineAt(bracket.start());
      String group = bracket.group(1).trim();
      if (group.isEmpty() || !group.startsWith("-")) {
        continue;
      }
      List<String> tokens = TextUtil.words(group);
      String first = tokens.get(0);
      boolean takesValue = tokens.size() > 1 && !tokens.get(1).startsWith("-");
      ValueType type = takesValue ? ValueTypes.fromHelpRow(group) : ValueType.BOOL;
      if (first.startsWith("--")) {
        Optional<String> longName = normalizeLongFlag(first);
        longName.ifPresent(
            name ->
                flags.add(
                    new LineMatch<>(
                        new FlagSchema(null, name, type, takesValue, false, null, null, null),
                        line)));
      } else if (first.length() == 2) {
        flags.add(
            new LineMatch<>(
                new FlagSchema(first, null, type, takesValue, false, null, null, null), line));
      } else if (first.length() > 2
          && TextUtil.all(first.substring(1), TextUtil::isAsciiAlnum)) {
        for (int i = 1; i < first.length(); i++) {
          flags.add(new LineMatch<>(FlagSchema.bool("-" + first.charAt(i), null), line));
        }
      }
    }

    Matcher brace = BRACE_GROUP.matcher(text);
    while (brace.find()) {
      String group = brace.group(1).trim();
      if (group.isEmpty() || !group.contains("|") || !group.contains("-")) {
        continue;
      }
      addAlternatives(group, usage.lineAt(brace.start()), flags);
    }

    Matcher inlineLong = HelpPatterns.INLINE_LONG.matcher(text);
    while (inlineLong.find()) {
      int line = usage.lineAt(inlineLong.start(1));
      normalizeLongFlag(inlineLong.group(1))
          .ifPresent(name -> flags.add(new LineMatch<>(FlagSchema.bool(null, name), line)));
    }
    Matcher inlineShort = HelpPatterns.INLINE_SHORT.matcher(text);
    while (inlineShort.find()) {
      int line = usage.lineAt(inlineShort.start(1));
      parseFlagAtom(inlineShort.group(1))
          .filter(atom -> atom.shortName() != null)
          .ifPresent(
              atom -> flags.add(new LineMatch<>(FlagSchema.bool(atom.shortName(), null), line)));
    }
    return dedupe(flags);
  }

  // "{-v | --version}" is one flag with two spellings; other alternations list distinct flags
  private static void addAlternatives(
      String group, int line, List<LineMatch<FlagSchema>> flags) {
    List<FlagAtom> atoms = new ArrayList<>();
    List<Boolean> values = new ArrayList<>();
    for (String raw : TextUtil.splitLiteral(group, "|")) {
      List<String> tokens = TextUtil.words(raw);
      if (tokens.isEmpty()) {
        continue;
      }
      boolean takesValue =
          tokens.size() > 1 && !tokens.get(1).startsWith("-") && !tokens.get(1).startsWith("{");
      Optional<FlagAtom> atom = parseFlagAtom(tokens.get(0));
      if (atom.isPresent()) {
        atoms.add(atom.get());
        values.add(takesValue);
      }
    }
    if (atoms.isEmpty()) {
      return;
    }
    if (atoms.size() == 2 && !values.contains(Boolean.TRUE)) {
      FlagAtom shortOnly =
          atoms.stream()
              .filter(a -> a.shortName() != null && a.longName() == null)
              .findFirst()
              .orElse(null);
      FlagAtom longOnly =
          atoms.stream()
              .filter(a -> a.shortName() == null && a.longName() != null)
              .findFirst()
              .orElse(null);
      if (shortOnly != null && longOnly != null) {
        flags.add(
            new LineMatch<>(FlagSchema.bool(shortOnly.shortName(), longOnly.longName()), line));
        return;
      }
    }
    for (int i = 0; i < atoms.size(); i++) {
      boolean takesValue = values.get(i);
      ValueType type = takesValue ? ValueTypes.fromHelpRow(group) : ValueType.BOOL;
      FlagAtom atom = atoms.get(i);
      flags.add(
          new LineMatch<>(
              new FlagSchema(
                  atom.shortName(), atom.longName(), type, takesValue, false, null, null, null),
              line));
    }
  }

  private static List<LineMatch<FlagSchema>> dedupe(List<LineMatch<FlagSchema>> flags) {
    List<LineMatch<FlagSchema>> out = new ArrayList<>();
    outer:
    for (LineMatch<FlagSchema> match : flags) {
      for (int i = 0; i < out.size(); i++) {
        LineMatch<FlagSchema> existing = out.get(i);
        if (FlagRowParser.overlaps(existing.value(), match.value())) {
          out.set(
              i,
              new LineMatch<>(
                  FlagRowParser.merge(existing.value(), match.value()),
                  existing.start(),
                  existing.end()));
          continue outer;
        }
      }
      out.add(match);
    }
    return out;
  }

  /**
   * Parses one usage token: {@code --name}, {@code -x}, {@code -V[ersion]} or {@code -word}.
   *
   * @param token raw token, possibly wrapped in braces or parentheses
   * @return the names, or empty when the token is not a flag
   */
  public static Optional<FlagAtom> parseFlagAtom(String token) {
    String t = TextUtil.trimChars(token.trim(), "{}(),;");
    if (t.isEmpty()) {
      return Optional.empty();
    }
    if (t.startsWith("--")) {
      return normalizeLongFlag(t).map(name -> new FlagAtom(null, name));
    }
    if (!t.startsWith("-") || t.length() == 1) {
      return Optional.empty();
    }
    String rest = t.substring(1);
    char marker = rest.charAt(0);
    if (TextUtil.isAsciiAlnum(marker)) {
      String tail = rest.substring(1);
      if (tail.isEmpty()
          || (tail.startsWith("[") && tail.endsWith("]") && tail.length() > 2)) {
        return Optional.of(new FlagAtom("-" + marker, null));
      }
    }
    if (TextUtil.all(rest, ch -> TextUtil.isAsciiAlnum(ch) || ch == '-')) {
      return Optional.of(new FlagAtom("-" + rest, null));
    }
    return Optional.empty();
  }

  /** {@code --name[=VALUE]} or {@code --[no-]name} to {@code --name}. */
  public static Optional<String> normalizeLongFlag(String token) {
    if (!token.startsWith("--")) {
      return Optional.empty();
    }
    if (token.startsWith("--[no-]")) {
      String clean = trimValueSuffix(token.substring("--[no-]".length()));
      return clean.isEmpty() ? Optional.empty() : Optional.of("--" + clean);
    }
    String clean = trimValueSuffix(token);
    return clean.length() <= 2 ? Optional.empty() : Optional.of(clean);
  }

  private static String trimValueSuffix(String flag) {
    for (int i = 0; i < flag.length(); i++) {
      char ch = flag.charAt(i);
      if (ch == '[' || ch == '<' || ch == '=') {
        return flag.substring(0, i);
      }
    }
    return flag;
  }

  /**
   * Indices of the first {@code usage:} line and the indented lines that follow it, stopping at
   * the first blank or unindented line.
   */
  public static IntSet usageBlockIndices(List<IndexedLine> lines) {
    IntSet recognized = new IntOpenHashSet();
    boolean inUsage = false;
    for (IndexedLine line : lines) {
      String trimmed = line.trimmed();
      if (trimmed.isEmpty()) {
        if (inUsage) {
          break;
        }
        continue;
      }
      if (lower(trimmed).startsWith("usage:")) {
        inUsage = true;
        recognized.add(line.index());
        continue;
      }
      if (inUsage && line.isIndented()) {
        recognized.add(line.index());
        continue;
      }
      if (inUsage) {
        break;
      }
    }
    return recognized;
  }
}
