package io.cmdschema.impl.man.roff;

import static io.cmdschema.util.TextUtil.lower;
import static io.cmdschema.util.TextUtil.upper;

import io.cmdschema.api.ArgSchema;
import io.cmdschema.api.FlagSchema;
import io.cmdschema.api.SchemaValidator;
import io.cmdschema.api.SubcommandSchema;
import io.cmdschema.api.ValueType;
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
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Reads classic man(7) sources.
 *
 * <p>A {@code .TP} paragraph takes its tag from the next text or font line and its description
 * from the line after that. Flags come from sections whose name contains {@code OPTION} or {@code
 * SYNOPSIS}, positionals from {@code SYNOPSIS}, subcommands from sections whose name contains
 * {@code COMMAND}.
 */
public final class ManMacroParser {
  static final String OPTIONS_STRATEGY = "man-roff-man-options";
  static final String SYNOPSIS_STRATEGY = "man-roff-man-synopsis";
  static final String COMMANDS_STRATEGY = "man-roff-man-commands";

  private static final Set<String> FONT_MACROS = Set.of("B", "I", "BR", "BI", "RB", "RI");

  private ManMacroParser() {}

  public static RoffDocument<ManElement> parse(List<RoffToken> tokens) {
    Builder builder = new Builder();
    for (RoffToken token : tokens) {
      if (token instanceof RoffToken.Macro macro) {
        builder.macro(macro);
      } else if (token instanceof RoffToken.Text text) {
        builder.text(text.value().trim(), text.line());
      }
    }
    builder.flush("");
    return builder.doc;
  }

  /**
   * Extracts candidates from a parsed document.
   *
   * @param doc parsed man document
   * @param confidence roff detection confidence assigned to every candidate
   * @return candidate pools, one entry per distinct key
   */
  public static CandidatePools extract(RoffDocument<ManElement> doc, double confidence) {
    CandidatePools pools = new CandidatePools();
    extractFlags(doc, confidence, pools.flags());
    extractArgs(doc, confidence, pools.args());
    extractSubcommands(doc, confidence, pools.subcommands());
    return pools;
  }

  private static void extractFlags(
      RoffDocument<ManElement> doc, double confidence, List<FlagCandidate> out) {
    Set<String> seen = new HashSet<>();
    for (String name : doc.sectionNames()) {
      if (!name.contains("OPTION") && !name.contains("SYNOPSIS")) {
        continue;
      }
      for (ManElement element : doc.section(name)) {
        String tag;
        String description;
        if (element instanceof ManElement.TaggedParagraph tagged) {
          tag = tagged.tag();
          description = tagged.description();
        } else if (element instanceof ManElement.IndentedParagraph indented
            && indented.tag() != null) {
          tag = indented.tag();
          description = indented.text();
        } else {
          continue;
        }
        Optional<FlagSchema> flag = parseFlagDefinition(tag, description);
        if (flag.isPresent() && seen.add(flag.get().canonicalName())) {
          out.add(
              new FlagCandidate(
                  flag.get(), SourceSpan.single(element.line()), OPTIONS_STRATEGY, confidence));
        }
      }
    }
  }

  private static void extractArgs(
      RoffDocument<ManElement> doc, double confidence, List<ArgCandidate> out) {
    Set<String> seen = new HashSet<>();
    for (String name : doc.sectionNames()) {
      if (!name.contains("SYNOPSIS")) {
        continue;
      }
      for (ManElement element : doc.section(name)) {
        String text;
        if (element instanceof ManElement.Text t) {
          text = t.value();
        } else if (element instanceof ManElement.IndentedParagraph indented) {
          text = indented.text();
        } else if (element instanceof ManElement.TaggedParagraph tagged) {
          text = tagged.tag() + " " + tagged.description();
        } else {
          continue;
        }
        for (ArgSchema arg : synopsisArgs(text, seen)) {
          out.add(
              new ArgCandidate(
                  arg, SourceSpan.single(element.line()), SYNOPSIS_STRATEGY, confidence));
        }
      }
    }
  }

  private static void extractSubcommands(
      RoffDocument<ManElement> doc, double confidence, List<SubcommandCandidate> out) {
    Set<String> seen = new HashSet<>();
    for (String name : doc.sectionNames()) {
      if (!name.contains("COMMAND")) {
        continue;
      }
      for (ManElement element : doc.section(name)) {
        String tag;
        String description;
        if (element instanceof ManElement.TaggedParagraph tagged) {
          tag = tagged.tag();
          description = tagged.description();
        } else if (element instanceof ManElement.IndentedParagraph indented
            && indented.tag() != null) {
          tag = indented.tag();
          description = indented.text();
        } else {
          continue;
        }
        String token = TextUtil.firstWord(tag);
        if (!ManTokens.looksLikeCommandName(token) || !seen.add(lower(token))) {
          continue;
        }
        SubcommandSchema sub = SubcommandSchema.named(token);
        if (!description.isBlank()) {
          sub = sub.withDescription(description.trim());
        }
        out.add(
            new SubcommandCandidate(
                sub, SourceSpan.single(element.line()), COMMANDS_STRATEGY, confidence));
      }
    }
  }

  /**
   * Reads a paragraph tag such as {@code -o, --output=FILE} into one flag. The first short and
   * the first long alias win. Names end at {@code =}, {@code [}, {@code <} or {@code (}; a value is
   * expected when the tag carries such a marker or an upper-case placeholder word.
   */
  static Optional<FlagSchema> parseFlagDefinition(String tag, String description) {
    String shortName = null;
    String longName = null;
    boolean inlineValue = false;
    for (String raw : TextUtil.splitAny(tag, ",| \t")) {
      String part = TextUtil.trimChars(raw.trim(), "\"'[]()");
      if (!part.startsWith("-")) {
        continue;
      }
      if (part.startsWith("--[no-]")) {
        part = "--" + part.substring("--[no-]".length());
      }
      int valueAt = ManTokens.valueStart(part);
      String name = valueAt >= 0 ? part.substring(0, valueAt) : part;
      inlineValue |= valueAt >= 0;
      if (SchemaValidator.isLongFlagName(name)) {
        longName = longName == null ? name : longName;
      } else if (SchemaValidator.isShortFlagName(name)) {
        shortName = shortName == null ? name : shortName;
      }
    }
    if (shortName == null && longName == null) {
      return Optional.empty();
    }
    FlagSchema flag = FlagSchema.bool(shortName, longName);
    if (inlineValue || hasPlaceholderWord(tag)) {
      flag = flag.withValueType(ValueTypes.fromManText(description), true);
    }
    if (!description.isBlank()) {
      flag = flag.withDescription(description.trim());
    }
    return Optional.of(flag);
  }

  private static boolean hasPlaceholderWord(String text) {
    for (String token : TextUtil.words(text)) {
      if (token.length() > 1 && TextUtil.all(token, TextUtil::isAsciiUpper)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Positionals of a synopsis line. The leading unbracketed word is the command itself; bracketed
   * words are optional and {@code ...} marks repetition.
   */
  static List<ArgSchema> synopsisArgs(String text, Set<String> seen) {
    List<ArgSchema> out = new ArrayList<>();
    List<String> words = TextUtil.words(text);
    for (int i = 0; i < words.size(); i++) {
      String raw = words.get(i);
      if (raw.startsWith("-")) {
        continue;
      }
      boolean bracketed = ManTokens.isBracketed(raw);
      String token = ManTokens.normalizeSynopsisToken(raw);
      if (token.isEmpty() || (i == 0 && !bracketed) || !ManTokens.looksLikeArgToken(token)) {
        continue;
      }
      String name = lower(token);
      if (!seen.add(name)) {
        continue;
      }
      ValueType type = ValueTypes.fromManText(token);
      ArgSchema arg =
          raw.contains("[") ? ArgSchema.optional(name, type) : ArgSchema.required(name, type);
      out.add(arg.withMultiple(raw.contains("...")));
    }
    return out;
  }

  /** Collects elements while tracking the open {@code .TP} paragraph. */
  private static final class Builder {
    final RoffDocument<ManElement> doc = new RoffDocument<>();
    String section = RoffDocument.UNKNOWN_SECTION;
    int pendingStart = -1;
    boolean awaitingTag;
    String tag = "";

    void macro(RoffToken.Macro macro) {
      String name = upper(macro.name());
      List<String> args = macro.args();
      switch (name) {
        case "TH" -> doc.setTitle(argAt(args, 0), argAt(args, 1));
        case "SH" -> {
          flush("");
          String title = upper(TextUtil.trimChars(macro.joinedArgs().trim(), "\""));
          if (!title.isEmpty()) {
            section = title;
          }
          doc.ensureSection(section);
        }
        case "TP" -> {
          flush("");
          pendingStart = macro.line();
          awaitingTag = true;
          tag = "";
        }
        case "IP" -> {
          flush("");
          String ipTag = args.isEmpty() ? null : TextUtil.trimChars(args.get(0), "\"");
          String text =
              args.size() > 1
                  ? TextUtil.trimChars(String.join(" ", args.subList(1, args.size())), "\"")
                  : "";
          doc.add(section, new ManElement.IndentedParagraph(ipTag, text, macro.line()));
        }
        case "PP", "P" -> {
          flush("");
          doc.add(section, new ManElement.Paragraph(macro.line()));
        }
        default -> {
          String rendered = macro.joinedArgs().trim();
          if (rendered.isEmpty()) {
            return;
          }
          if (FONT_MACROS.contains(name)) {
            text(rendered, macro.line());
          } else if (pendingStart >= 0) {
            flush(rendered);
          } else {
            doc.add(section, new ManElement.Text(rendered, macro.line()));
          }
        }
      }
    }

    void text(String value, int line) {
      if (value.isEmpty()) {
        return;
      }
      if (awaitingTag && tag.isEmpty()) {
        tag = value;
        awaitingTag = false;
      } else if (pendingStart >= 0) {
        flush(value);
      } else {
        doc.add(section, new ManElement.Text(value, line));
      }
    }

    // Closes the open tagged paragraph, if any, with the given body line.
    void flush(String description) {
      if (pendingStart >= 0 && !tag.isBlank()) {
        doc.add(
            section,
            new ManElement.TaggedParagraph(tag.trim(), description.trim(), pendingStart));
      }
      pendingStart = -1;
      awaitingTag = false;
      tag = "";
    }
  }

  private static String argAt(List<String> args, int index) {
    return index < args.size() ? args.get(index) : null;
  }
}
