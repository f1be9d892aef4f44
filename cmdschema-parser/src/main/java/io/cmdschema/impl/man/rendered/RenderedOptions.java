package io.cmdschema.impl.man.rendered;

import io.cmdschema.api.FlagSchema;
import io.cmdschema.impl.IndexedLine;
import io.cmdschema.impl.candidate.FlagCandidate;
import io.cmdschema.impl.candidate.SourceSpan;
import io.cmdschema.impl.text.Columns;
import io.cmdschema.impl.text.LineShapes;
import io.cmdschema.impl.text.ValueTypes;
import io.cmdschema.util.TextUtil;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/** Option rows of a rendered page: every dash alias of a row folds into one flag. */
final class RenderedOptions {
  private static final String DEFINITION_WRAPPERS = "[]<>()\"'";
  private static final String PLACEHOLDER_WRAPPERS = "<>[](),;";

  private RenderedOptions() {}

  static void parse(
      RenderedSection section, String strategy, double confidence, List<FlagCandidate> out) {
    Set<String> seen = new HashSet<>();
    for (IndexedLine line : section.lines()) {
      String trimmed = line.trimmed();
      if (!trimmed.startsWith("-")) {
        continue;
      }
      Optional<Columns> columns = LineShapes.splitTwoColumns(trimmed);
      String definition = columns.map(Columns::left).orElse(trimmed);
      String description = columns.map(Columns::right).orElse(null);
      Optional<FlagSchema> flag = parseDefinition(definition, description);
      if (flag.isEmpty() || !seen.add(flag.get().canonicalName())) {
        continue;
      }
      FlagSchema schema = flag.get();
      if (description != null && !description.isEmpty()) {
        schema = schema.withDescription(description);
      }
      out.add(new FlagCandidate(schema, SourceSpan.single(line.index()), strategy, confidence));
    }
  }

  /**
   * Reads {@code -C <path>, --git-dir=<path>} style definitions. {@code --[no-]name} is read as
   * {@code --name}.
   */
  static Optional<FlagSchema> parseDefinition(String definition, String description) {
    String shortName = null;
    String longName = null;
    boolean inlineValue = false;
    for (String raw : TextUtil.splitAny(definition, ",| \t")) {
      String part = TextUtil.trimChars(raw.trim(), DEFINITION_WRAPPERS);
      if (!part.startsWith("-")) {
        continue;
      }
      if (part.startsWith("--[no-]")) {
        part = "--" + part.substring("--[no-]".length());
      }
      String name = part;
      int eq = part.indexOf('=');
      int bracket = firstIndexOfAny(part, "<[(");
      if (eq >= 0) {
        name = part.substring(0, eq);
        inlineValue = true;
      } else if (bracket >= 0) {
        name = part.substring(0, bracket);
        inlineValue = true;
      }
      name = TextUtil.trimEndChars(name, "]>[.,()");
      if (name.startsWith("--")) {
        String body = name.substring(2);
        if (longName == null
            && TextUtil.startsWith(body, TextUtil::isAsciiAlpha)
            && TextUtil.all(
                body, ch -> TextUtil.isAsciiAlnum(ch) || ch == '-' || ch == '_' || ch == '.')) {
          longName = name;
        }
      } else {
        String body = name.substring(1);
        if (shortName == null
            && !body.isEmpty()
            && TextUtil.all(body, ch -> TextUtil.isAsciiAlnum(ch) || ch == '?')) {
          shortName = name;
        }
      }
    }
    if (shortName == null && longName == null) {
      return Optional.empty();
    }
    FlagSchema flag = FlagSchema.bool(shortName, longName);
    if (inlineValue || definition.indexOf('=') >= 0 || hasPlaceholderWord(definition)) {
      String text = description == null ? "" : description;
      flag = flag.withValueType(ValueTypes.fromManText(text), true);
    }
    return Optional.of(flag);
  }

  // An angle-bracketed or upper-case word that is not itself a flag, e.g. <path> or FILE.
  private static boolean hasPlaceholderWord(String text) {
    for (String token : TextUtil.words(text)) {
      if (TextUtil.trimStartChars(token, PLACEHOLDER_WRAPPERS).startsWith("-")) {
        continue;
      }
      if (token.startsWith("<") && token.indexOf('>') > 1) {
        return true;
      }
      String normalized = TextUtil.trimChars(token, PLACEHOLDER_WRAPPERS);
      if (normalized.length() > 1
          && TextUtil.all(normalized, ch -> TextUtil.isAsciiUpper(ch) || ch == '_' || ch == '-')) {
        return true;
      }
    }
    return false;
  }

  private static int firstIndexOfAny(String text, String chars) {
    for (int i = 0; i < text.length(); i++) {
      if (chars.indexOf(text.charAt(i)) >= 0) {
        return i;
      }
    }
    return -1;
  }
}
