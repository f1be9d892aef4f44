package io.cmdschema.impl.man.rendered;

import static io.cmdschema.util.TextUtil.lower;

import io.cmdschema.api.ArgSchema;
import io.cmdschema.api.FlagSchema;
import io.cmdschema.api.SchemaValidator;
import io.cmdschema.api.SubcommandSchema;
import io.cmdschema.api.ValueType;
import io.cmdschema.impl.IndexedLine;
import io.cmdschema.impl.candidate.ArgCandidate;
import io.cmdschema.impl.candidate.CandidatePools;
import io.cmdschema.impl.candidate.FlagCandidate;
import io.cmdschema.impl.candidate.SourceSpan;
import io.cmdschema.impl.candidate.SubcommandCandidate;
import io.cmdschema.impl.man.ManTokens;
import io.cmdschema.impl.text.ValueTypes;
import io.cmdschema.util.TextUtil;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Reads a rendered {@code SYNOPSIS}: dash tokens become flags, other words positionals, and
 * {@code a | b | c} alternatives naming at least two command words become subcommands.
 */
final class RenderedSynopsis {
  static final String FLAGS_STRATEGY = "man-rendered-synopsis-flags";
  static final String ARGS_STRATEGY = "man-rendered-synopsis-args";
  static final String SUBCOMMANDS_STRATEGY = "man-rendered-synopsis-subcommands";
  static final double FLAGS_CONFIDENCE = 0.70;
  static final double ARGS_CONFIDENCE = 0.75;
  static final double SUBCOMMANDS_CONFIDENCE = 0.78;

  private static final String TOKEN_WRAPPERS = "[]<>{}(),;";
  private static final Set<String> PLACEHOLDER_COMMANDS =
      Set.of("command", "commands", "cmd", "subcommand", "option", "options");

  private final Set<String> commandWords = new HashSet<>();

  RenderedSynopsis(String command) {
    for (String part : TextUtil.splitAny(command, " \t-")) {
      if (!part.isEmpty()) {
        commandWords.add(lower(part));
      }
    }
  }

  void parse(RenderedSection section, CandidatePools pools) {
    Set<String> heads = subcommandHeads(joined(section));
    flags(section, pools.flags());
    args(section, heads, pools.args());
    if (!heads.isEmpty()) {
      int line = section.lines().get(0).index();
      for (String head : heads) {
        pools
            .subcommands()
            .add(
                new SubcommandCandidate(
                    SubcommandSchema.named(head),
                    SourceSpan.single(line),
                    SUBCOMMANDS_STRATEGY,
                    SUBCOMMANDS_CONFIDENCE));
      }
    }
  }

  private void flags(RenderedSection section, List<FlagCandidate> out) {
    Set<String> seen = new HashSet<>();
    for (IndexedLine line : section.lines()) {
      List<String> raw = TextUtil.words(line.trimmed());
      for (int i = 0; i < raw.size(); i++) {
        String token = TextUtil.trimChars(raw.get(i), TOKEN_WRAPPERS);
        if (!token.startsWith("-")) {
          continue;
        }
        String next = i + 1 < raw.size() ? raw.get(i + 1) : null;
        for (String alias : TextUtil.splitAny(token, "|,")) {
          String trimmed = alias.trim();
          if (trimmed.startsWith("--[no-]")) {
            trimmed = "--" + trimmed.substring("--[no-]".length());
          }
          int valueAt = ManTokens.valueStart(trimmed);
          String name = valueAt >= 0 ? trimmed.substring(0, valueAt) : trimmed;
          name = TextUtil.trimEndChars(name, "]>[.,()");
          FlagSchema flag;
          if (SchemaValidator.isLongFlagName(name)) {
            flag = FlagSchema.bool(null, name);
          } else if (SchemaValidator.isShortFlagName(name)) {
            flag = FlagSchema.bool(name, null);
          } else {
            continue;
          }
          if (valueAt >= 0) {
            flag = flag.withValueType(ValueType.STRING, true);
          } else if (consumedAsFlagValue(raw.get(i), next)) {
            flag = flag.withValueType(ValueTypes.fromManText(next), true);
          }
          if (seen.add(flag.canonicalName())) {
            out.add(
                new FlagCandidate(
                    flag, SourceSpan.single(line.index()), FLAGS_STRATEGY, FLAGS_CONFIDENCE));
          }
        }
      }
    }
  }

  private void args(RenderedSection section, Set<String> heads, List<ArgCandidate> out) {
    Set<String> seen = new HashSet<>();
    for (IndexedLine line : section.lines()) {
      List<String> raw = TextUtil.words(line.trimmed());
      boolean leading = true;
      for (int i = 0; i < raw.size(); i++) {
        String word = raw.get(i);
        boolean bracketed = ManTokens.isBracketed(word);
        String token = ManTokens.normalizeSynopsisToken(word);
        boolean commandWord = commandWords.contains(lower(token));
        if (leading && !bracketed && (i == 0 || commandWord)) {
          continue;
        }
        leading = false;
        if (token.isEmpty() || word.startsWith("-") || token.startsWith("-")) {
          continue;
        }
        if (i > 0 && consumedAsFlagValue(raw.get(i - 1), word)) {
          continue;
        }
        String name = lower(token);
        if (!ManTokens.looksLikeArgToken(token) || heads.contains(name) || !seen.add(name)) {
          continue;
        }
        ValueType type = ValueTypes.fromManText(token);
        ArgSchema arg =
            word.contains("[") ? ArgSchema.optional(name, type) : ArgSchema.required(name, type);
        out.add(
            new ArgCandidate(
                arg.withMultiple(word.contains("...")),
                SourceSpan.single(line.index()),
                ARGS_STRATEGY,
                ARGS_CONFIDENCE));
      }
    }
  }

  /**
   * Command words offered as {@code |} alternatives after the root command. Fewer than two
   * distinct words yield nothing.
   */
  static Set<String> subcommandHeads(String synopsis) {
    Set<String> out = new LinkedHashSet<>();
    if (synopsis.indexOf('|') < 0) {
      return out;
    }
    String root = ManTokens.normalizeSynopsisToken(TextUtil.firstWord(synopsis));
    if (!ManTokens.looksLikeCommandName(root)) {
      return out;
    }
    String rootLower = lower(root);
    for (String segment : TextUtil.splitAny(synopsis, "|")) {
      for (String raw : TextUtil.words(segment)) {
        String token = ManTokens.normalizeSynopsisToken(raw);
        if (token.isEmpty()) {
          continue;
        }
        String l = lower(token);
        if (l.equals(rootLower)
            || token.startsWith("-")
            || raw.indexOf('<') >= 0
            || raw.indexOf('>') >= 0
            || !ManTokens.looksLikeCommandName(token)
            || PLACEHOLDER_COMMANDS.contains(l)) {
          continue;
        }
        out.add(l);
        break;
      }
    }
    if (out.size() < 2) {
      out.clear();
    }
    return out;
  }

  // The value of "-o FILE" or "[--exec <cmd>]": the word follows a flag in the same bracket group.
  private static boolean consumedAsFlagValue(String previous, String word) {
    String flag = TextUtil.trimChars(previous, TOKEN_WRAPPERS);
    return flag.startsWith("-")
        && flag.indexOf('=') < 0
        && !previous.endsWith("]")
        && isValuePlaceholder(word);
  }

  private static boolean isValuePlaceholder(String raw) {
    if (raw == null || raw.startsWith("[") || raw.startsWith("|") || raw.startsWith("-")) {
      return false;
    }
    return ManTokens.looksLikeArgToken(ManTokens.normalizeSynopsisToken(raw));
  }

  private static String joined(RenderedSection section) {
    List<String> parts = new ArrayList<>();
    for (IndexedLine line : section.lines()) {
      String trimmed = line.trimmed();
      if (!trimmed.isEmpty()) {
        parts.add(trimmed);
      }
    }
    return String.join(" ", parts);
  }
}
