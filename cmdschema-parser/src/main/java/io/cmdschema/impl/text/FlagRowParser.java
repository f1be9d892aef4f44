package io.cmdschema.impl.text;

import static io.cmdschema.util.TextUtil.lower;

import io.cmdschema.api.FlagSchema;
import io.cmdschema.api.ValueType;
import io.cmdschema.impl.IndexedLine;
import io.cmdschema.internal.HelpPatterns;
import io.cmdschema.util.TextUtil;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;

/**
 * Parses flag definition rows such as {@code -m, --message <MSG>  Use the given message}.
 *
 * <p>Recognised row shapes, tried in order: short and long together, long only, single-dash word
 * ({@code -name}), single short. A row may also be a compact short cluster ({@code -abc or -c
 * cmd}), several packed definitions separated by wide gaps, or a BSD style single letter option
 * column ({@code a    description}).
 */
public final class FlagRowParser {
  private FlagRowParser() {}

  /**
   * Parses every row and keeps the line each flag came from.
   *
   * @param lines trimmed lines with their normalized indices
   * @return parsed flags in input order
   */
  public static List<LineMatch<FlagSchema>> parseRows(List<IndexedLine> lines) {
    List<LineMatch<FlagSchema>> out = new ArrayList<>();
    for (IndexedLine line : lines) {
      for (FlagSchema flag : parseRow(line.text())) {
        out.add(new LineMatch<>(flag, line.index()));
      }
    }
    return out;
  }

  /** All flags defined on one row. */
  public static List<FlagSchema> parseRow(String line) {
    String trimmed = line.trim();
    if (!LineShapes.looksLikeFlagRowStart(trimmed)) {
      return compactOptionRow(trimmed).map(List::of).orElse(List.of());
    }
    Optional<List<FlagSchema>> cluster = compactShortCluster(trimmed);
    if (cluster.isPresent()) {
      return dedupe(cluster.get());
    }
    List<FlagSchema> flags = new ArrayList<>();
    for (String entry : splitPackedEntries(trimmed)) {
      parseDefinition(entry).ifPresent(flags::add);
    }
    return flags;
  }

  /**
   * Parses a single flag definition with its optional description column.
   *
   * @param line one definition
   * @return the flag, or empty when the text does not start like a flag
   */
  public static Optional<FlagSchema> parseDefinition(String line) {
    String trimmed = line.trim();
    if (!LineShapes.looksLikeFlagRowStart(trimmed)) {
      return Optional.empty();
    }
    String shortName = null;
    String longName = null;
    Matcher m;
    if ((m = HelpPatterns.COMBINED_FLAG.matcher(trimmed)).find()) {
      shortName = m.group(1);
      longName = m.group(2);
    } else if ((m = HelpPatterns.LONG_FLAG.matcher(trimmed)).find()) {
      longName = m.group(1);
    } else if ((m = HelpPatterns.SINGLE_DASH_WORD_FLAG.matcher(trimmed)).find()) {
      shortName = m.group(1);
    } else if ((m = HelpPatterns.SHORT_FLAG.matcher(trimmed)).find()) {
      shortName = m.group(1);
    } else {
      return Optional.empty();
    }

    boolean repeated = false;
    if (shortName != null) {
      NormalizedToken token = normalizeToken(shortName);
      shortName = token.value();
      repeated = token.repeated();
    }
    if (longName != null) {
      NormalizedToken token = normalizeToken(longName);
      longName = token.value();
      repeated |= token.repeated();
    }

    boolean takesValue = false;
    ValueType valueType = ValueType.BOOL;
    if (HelpPatterns.FLAG_WITH_VALUE.matcher(trimmed).find()) {
      takesValue = true;
      valueType = ValueTypes.fromHelpRow(trimmed);
    }

    Optional<Columns> columns = LineShapes.splitTwoColumns(trimmed);
    String definition = columns.map(Columns::left).orElse(trimmed);
    if (!takesValue && (definition.contains("=") || definition.contains("<"))) {
      takesValue = true;
      valueType = ValueType.STRING;
    }

    String description = null;
    if (columns.isPresent() && !columns.get().right().startsWith("-")) {
      description = LineShapes.sanitizeDescription(columns.get().right());
    }
    boolean multiple = inferMultiple(definition, description, repeated);
    return Optional.of(
        new FlagSchema(
            shortName, longName, valueType, takesValue, multiple, description, null, null));
  }

  /** Result of cleaning a raw flag token. */
  public record NormalizedToken(String value, boolean repeated) {}

  /**
   * Strips trailing separators, rewrites {@code --[no-]x} to {@code --x} and removes ellipsis or
   * trailing dots, which mark the flag as repeatable.
   */
  public static NormalizedToken normalizeToken(String raw) {
    String token = TextUtil.trimEndChars(raw.trim(), ",;");
    boolean repeated = false;
    if (token.startsWith("--[no-]")) {
      token = "--" + token.substring("--[no-]".length());
    }
    if (token.endsWith("...")) {
      token = token.substring(0, token.length() - 3);
      repeated = true;
    }
    while (token.endsWith(".")) {
      token = token.substring(0, token.length() - 1);
      repeated = true;
    }
    return new NormalizedToken(TextUtil.trimEndChars(token, ",;").trim(), repeated);
  }

  static boolean inferMultiple(String definition, String description, boolean explicit) {
    if (explicit) {
      return true;
    }
    if (definition.contains("...")
        && (definition.contains("<")
            || definition.contains("[")
            || definition.contains("=")
            || TextUtil.words(definition).size() == 1)) {
      return true;
    }
    String desc = description == null ? "" : lower(description);
    return desc.contains("multiple times")
        || desc.contains("more than once")
        || desc.contains("repeatable")
        || desc.contains("may be repeated");
  }

  // "-abc or -c command" expands into one switch per cluster letter plus the alternatives
  private static Optional<List<FlagSchema>> compactShortCluster(String line) {
    String definition = LineShapes.splitTwoColumns(line).map(Columns::left).orElse(line);
    if (!definition.contains(" or -")) {
      return Optional.empty();
    }
    List<String> segments = TextUtil.splitLiteral(definition, " or ");
    String first = segments.get(0).trim();
    if (!LineShapes.isCompactShortCluster(first)) {
      return Optional.empty();
    }
    List<FlagSchema> flags = new ArrayList<>();
    for (int i = 1; i < first.length(); i++) {
      flags.add(FlagSchema.bool("-" + first.charAt(i), null));
    }
    for (String raw : segments.subList(1, segments.size())) {
      String segment = raw.trim();
      if (!segment.startsWith("-")) {
        continue;
      }
      Optional<FlagSchema> parsed = parseDefinition(segment);
      if (parsed.isEmpty()) {
        continue;
      }
      FlagSchema flag = parsed.get();
      List<String> parts = TextUtil.words(segment);
      if (parts.size() > 1 && !parts.get(1).startsWith("-") && !flag.takesValue()) {
        flag = flag.withValueType(ValueTypes.fromHelpRow(segment), true);
      }
      flags.add(flag);
    }
    return Optional.of(flags);
  }

  private static Optional<FlagSchema> compactOptionRow(String line) {
    Optional<Columns> columns = LineShapes.splitTwoColumns(line);
    if (columns.isEmpty()) {
      return Optional.empty();
    }
    String left = columns.get().left();
    if (left.startsWith("-") || left.contains(" ")) {
      return Optional.empty();
    }
    String token = TextUtil.trimEndChars(left, ",");
    if (token.length() != 1 || !TextUtil.isAsciiAlnum(token.charAt(0))) {
      return Optional.empty();
    }
    String description = LineShapes.sanitizeDescription(columns.get().right());
    if (description == null) {
      return Optional.empty();
    }
    return Optional.of(FlagSchema.bool("-" + token, null).withDescription(description));
  }

  /** Splits {@code "-f desc   -u desc"} at wide gaps that are followed by a new flag. */
  static List<String> splitPackedEntries(String line) {
    String trimmed = line.trim();
    if (trimmed.isEmpty()) {
      return List.of();
    }
    List<String> entries = new ArrayList<>();
    int start = 0;
    int idx = 0;
    int len = trimmed.length();
    while (idx < len) {
      if (trimmed.charAt(idx) != ' ') {
        idx++;
        continue;
      }
      int runStart = idx;
      while (idx < len && trimmed.charAt(idx) == ' ') {
        idx++;
      }
      if (idx - runStart < 2 || idx + 1 >= len || trimmed.charAt(idx) != '-') {
        continue;
      }
      char next = trimmed.charAt(idx + 1);
      if (Character.isWhitespace(next) || next == '-') {
        continue;
      }
      String entry = trimmed.substring(start, runStart).trim();
      if (!entry.isEmpty()) {
        entries.add(entry);
      }
      start = idx;
    }
    String tail = trimmed.substring(start).trim();
    if (!tail.isEmpty()) {
      entries.add(tail);
    }
    return entries.isEmpty() ? List.of(trimmed) : entries;
  }

  /**
   * Collapses flags that share a long name, or a short name when either lacks a long one. The
   * surviving entry keeps the first flag's position.
   */
  public static List<FlagSchema> dedupe(List<FlagSchema> flags) {
    List<FlagSchema> out = new ArrayList<>();
    for (FlagSchema flag : flags) {
      int existing = -1;
      for (int i = 0; i < out.size(); i++) {
        if (overlaps(out.get(i), flag)) {
          existing = i;
          break;
        }
      }
      if (existing < 0) {
        out.add(flag);
      } else {
        out.set(existing, merge(out.get(existing), flag));
      }
    }
    return out;
  }

  static boolean overlaps(FlagSchema left, FlagSchema right) {
    if (left.longName() != null && right.longName() != null) {
      return left.longName().equals(right.longName());
    }
    return left.shortName() != null && left.shortName().equals(right.shortName());
  }

  /**
   * Merges {@code incoming} into {@code target}: missing names are filled, a value type replaces a
   * bool or string one, the longer description wins and relationship lists are unioned.
   */
  public static FlagSchema merge(FlagSchema target, FlagSchema incoming) {
    String shortName = target.shortName() != null ? target.shortName() : incoming.shortName();
    String longName = target.longName() != null ? target.longName() : incoming.longName();
    boolean takesValue = target.takesValue();
    ValueType type = target.valueType();
    if (incoming.takesValue()) {
      takesValue = true;
      if (type == ValueType.BOOL || type == ValueType.STRING) {
        type = incoming.valueType();
      }
    }
    String description = target.description();
    String incomingDesc =
        incoming.description() == null
            ? null
            : LineShapes.sanitizeDescription(incoming.description());
    if (incomingDesc != null
        && (description == null || incomingDesc.length() > description.length())) {
      description = incomingDesc;
    }
    return new FlagSchema(
        shortName,
        longName,
        type,
        takesValue,
        target.multiple() || incoming.multiple(),
        description,
        union(target.requires(), incoming.requires()),
        union(target.conflictsWith(), incoming.conflictsWith()));
  }

  private static List<String> union(List<String> left, List<String> right) {
    List<String> out = new ArrayList<>(left);
    for (String item : right) {
      if (!out.contains(item)) {
        out.add(item);
      }
    }
    return out;
  }
}
