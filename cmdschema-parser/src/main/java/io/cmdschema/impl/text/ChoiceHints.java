package io.cmdschema.impl.text;

import static io.cmdschema.util.TextUtil.lower;

import io.cmdschema.api.FlagSchema;
import io.cmdschema.api.ValueType;
import io.cmdschema.impl.IndexedLine;
import io.cmdschema.internal.HelpPatterns;
import io.cmdschema.util.TextUtil;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntSet;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns value listings that follow a flag ({@code Valid arguments for -o:} lists, {@code MODE is
 * one of the following:} tables) into {@link ValueType.Choice} types on accepted flags.
 */
public final class ChoiceHints {
  private ChoiceHints() {}

  private static final Pattern VALID_ARGUMENTS_LIST =
      Pattern.compile("^Valid (?:arguments|values) for\\s+(-\\S+?)\\s*:?\\s*$");
  private static final Pattern VALID_ARGUMENTS_FOR =
      Pattern.compile(
          "^valid (?:arguments|values) for\\s+(--?[a-zA-Z0-9?@][a-zA-Z0-9?@.-]*)\\s*:\\s*$",
          Pattern.CASE_INSENSITIVE);
  private static final Pattern PLACEHOLDER_VALUES =
      Pattern.compile("^([A-Z][A-Z0-9_-]{1,})\\s+is one of the following\\s*:\\s*$");
  private static final Pattern PLACEHOLDER_DETERMINES =
      Pattern.compile("^([A-Z][A-Z0-9_-]{1,})\\s+determines\\b.*:\\s*$");
  private static final Pattern GENERIC_VALUES_HEADER =
      Pattern.compile(
          "^.*\\b(here are the values|possible values|available values)\\b.*:?\\s*$",
          Pattern.CASE_INSENSITIVE);

  /** What a value table applies to: a flag id, or a placeholder word to resolve. */
  private record Target(String flag, String placeholder) {
    static Target flag(String id) {
      return new Target(id, null);
    }

    static Target placeholder(String word) {
      return new Target(null, word);
    }
  }

  /**
   * Applies both list and table hints.
   *
   * @param lines normalized lines
   * @param flags accepted flags
   * @param recognized receives the indices of every line consumed by a hint
   * @return the updated flags; a list hint for an unknown short flag appends a new flag
   */
  public static List<FlagSchema> apply(
      List<IndexedLine> lines, List<FlagSchema> flags, IntSet recognized) {
    List<FlagSchema> out = new ArrayList<>(flags);
    applyLists(lines, out, recognized);
    applyTables(lines, out, recognized);
    return out;
  }

  private static void applyLists(
      List<IndexedLine> lines, List<FlagSchema> flags, IntSet recognized) {
    for (int i = 0; i < lines.size(); i++) {
      Matcher m = VALID_ARGUMENTS_LIST.matcher(lines.get(i).trimmed());
      if (!m.matches()) {
        continue;
      }
      String flagName = m.group(1);
      int next = i + 1;
      while (next < lines.size() && lines.get(next).isBlank()) {
        next++;
      }
      if (next >= lines.size()) {
        continue;
      }
      String choiceLine = lines.get(next).trimmed();
      if (!choiceLine.contains(",")) {
        continue;
      }
      List<String> choices = new ArrayList<>();
      for (String token : TextUtil.commaParts(choiceLine)) {
        if (LineShapes.isValidCommandName(token)) {
          choices.add(token);
        }
      }
      if (choices.isEmpty()) {
        continue;
      }
      int index = indexOf(flags, flagName);
      if (index >= 0) {
        flags.set(index, flags.get(index).withValueType(ValueType.choice(choices), true));
      } else {
        flags.add(
            FlagSchema.withValue(flagName, null, ValueType.choice(choices))
                .withDescription("Valid arguments for " + flagName));
      }
      recognized.add(lines.get(i).index());
      recognized.add(lines.get(next).index());
    }
  }

  private static void applyTables(
      List<IndexedLine> lines, List<FlagSchema> flags, IntSet recognized) {
    for (int idx = 0; idx < lines.size(); idx++) {
      String trimmed = lines.get(idx).trimmed();
      if (trimmed.isEmpty()) {
        continue;
      }
      Optional<Target> target = targetOf(lines, idx, trimmed);
      if (target.isEmpty()) {
        continue;
      }

      List<String> choices = new ArrayList<>();
      IntList rows = new IntArrayList();
      boolean started = false;
      for (int probe = idx + 1; probe < lines.size(); probe++) {
        String row = lines.get(probe).trimmed();
        if (row.isEmpty()) {
          if (started) {
            break;
          }
          continue;
        }
        if (LineShapes.isUsageLine(row)
            || LineShapes.isSectionHeaderLine(row)
            || row.startsWith("-")) {
          break;
        }
        Optional<Columns> columns = LineShapes.splitTwoColumns(row);
        if (columns.isEmpty()) {
          break;
        }
        List<String> rowChoices = parseChoiceTokens(columns.get().left());
        if (rowChoices.isEmpty()) {
          break;
        }
        started = true;
        for (String choice : rowChoices) {
          if (!choices.contains(choice)) {
            choices.add(choice);
          }
        }
        rows.add(lines.get(probe).index());
      }
      if (choices.size() < 2) {
        continue;
      }

      Target t = target.get();
      int flagIndex =
          t.flag() != null
              ? indexOf(flags, t.flag())
              : resolvePlaceholder(lines, idx, t.placeholder(), flags);
      if (flagIndex < 0) {
        continue;
      }
      FlagSchema flag = flags.get(flagIndex);
      List<String> merged = new ArrayList<>();
      if (flag.valueType() instanceof ValueType.Choice existing) {
        merged.addAll(existing.values());
      }
      for (String choice : choices) {
        if (!merged.contains(choice)) {
          merged.add(choice);
        }
      }
      flags.set(flagIndex, flag.withValueType(ValueType.choice(merged), true));
      recognized.add(lines.get(idx).index());
      recognized.addAll(rows);
    }
  }

  private static Optional<Target> targetOf(List<IndexedLine> lines, int idx, String trimmed) {
    Matcher m;
    if ((m = VALID_ARGUMENTS_FOR.matcher(trimmed)).matches()) {
      return Optional.of(Target.flag(FlagRowParser.normalizeToken(m.group(1)).value()));
    }
    if ((m = PLACEHOLDER_VALUES.matcher(trimmed)).matches()
        || (m = PLACEHOLDER_DETERMINES.matcher(trimmed)).matches()) {
      return Optional.of(Target.placeholder(m.group(1)));
    }
    if (!GENERIC_VALUES_HEADER.matcher(trimmed).matches()) {
      return Optional.empty();
    }
    for (int i = idx - 1; i >= Math.max(0, idx - 3); i--) {
      String context = lines.get(i).trimmed();
      if (context.isEmpty()) {
        continue;
      }
      if ((m = PLACEHOLDER_VALUES.matcher(context)).matches()
          || (m = PLACEHOLDER_DETERMINES.matcher(context)).matches()) {
        return Optional.of(Target.placeholder(m.group(1)));
      }
      Matcher ref = HelpPatterns.FLAG_REFERENCE.matcher(context);
      if (ref.find()) {
        return Optional.of(Target.flag(FlagRowParser.normalizeToken(ref.group(1)).value()));
      }
    }
    return Optional.empty();
  }

  // a single value-taking flag that mentions the placeholder, else a single flag named nearby
  private static int resolvePlaceholder(
      List<IndexedLine> lines, int idx, String placeholder, List<FlagSchema> flags) {
    String needle = lower(placeholder);
    IntList owners = new IntArrayList();
    for (int i = 0; i < flags.size(); i++) {
      FlagSchema flag = flags.get(i);
      if (!flag.takesValue()) {
        continue;
      }
      boolean inLong =
          flag.longName() != null
              && TextUtil.trimStartRepeated(flag.longName(), "-").contains(needle);
      boolean inDescription =
          flag.description() != null && lower(flag.description()).contains(needle);
      if (inLong || inDescription) {
        owners.add(i);
      }
    }
    if (owners.size() == 1) {
      return owners.getInt(0);
    }
    IntList referenced = new IntArrayList();
    for (int i = Math.max(0, idx - 3); i <= idx; i++) {
      Matcher ref = HelpPatterns.FLAG_REFERENCE.matcher(lines.get(i).text());
      while (ref.find()) {
        int found = indexOf(flags, FlagRowParser.normalizeToken(ref.group(1)).value());
        if (found >= 0 && !referenced.contains(found)) {
          referenced.add(found);
        }
      }
    }
    return referenced.size() == 1 ? referenced.getInt(0) : -1;
  }

  static List<String> parseChoiceTokens(String leftColumn) {
    List<String> choices = new ArrayList<>();
    for (String token : TextUtil.commaParts(leftColumn)) {
      if (!TextUtil.all(token, ch -> TextUtil.isAsciiAlnum(ch) || "_-.".indexOf(ch) >= 0)
          || TextUtil.all(token, TextUtil::isAsciiDigit)
          || LineShapes.looksLikePlaceholderSubcommandToken(token)) {
        continue;
      }
      if (!choices.contains(token)) {
        choices.add(token);
      }
    }
    return choices;
  }

  private static int indexOf(List<FlagSchema> flags, String id) {
    for (int i = 0; i < flags.size(); i++) {
      if (flags.get(i).hasIdentifier(id)) {
        return i;
      }
    }
    return -1;
  }
}
