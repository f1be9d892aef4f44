package io.cmdschema.impl.man.roff;

import static io.cmdschema.util.TextUtil.lower;
import static io.cmdschema.util.TextUtil.upper;

import io.cmdschema.api.ArgSchema;
import io.cmdschema.api.FlagSchema;
import io.cmdschema.api.SubcommandSchema;
import io.cmdschema.api.ValueType;
import io.cmdschema.impl.candidate.ArgCandidate;
import io.cmdschema.impl.candidate.CandidatePools;
import io.cmdschema.impl.candidate.FlagCandidate;
import io.cmdschema.impl.candidate.SourceSpan;
import io.cmdschema.impl.candidate.SubcommandCandidate;
import io.cmdschema.impl.man.ManTokens;
import io.cmdschema.impl.text.FlagRowParser;
import io.cmdschema.impl.text.ValueTypes;
import io.cmdschema.util.TextUtil;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Reads BSD mdoc sources.
 *
 * <p>{@link #parse} builds a {@link RoffDocument} of {@link MdocElement}s; {@link #extract} turns
 * it into candidates. Flags are read from every section, positionals from {@code SYNOPSIS} and
 * {@code USAGE}, subcommands from sections whose name contains {@code COMMAND}.
 */
public final class MdocParser {
  static final String OPTIONS_STRATEGY = "man-roff-mdoc-options";
  static final String SYNOPSIS_STRATEGY = "man-roff-mdoc-synopsis";
  static final String COMMANDS_STRATEGY = "man-roff-mdoc-commands";

  private MdocParser() {}

  public static RoffDocument<MdocElement> parse(List<RoffToken> tokens) {
    RoffDocument<MdocElement> doc = new RoffDocument<>();
    String section = RoffDocument.UNKNOWN_SECTION;
    int listDepth = 0;

    for (RoffToken token : tokens) {
      if (token instanceof RoffToken.Text text) {
        String value = text.value().trim();
        if (!value.isEmpty()) {
          doc.add(section, new MdocElement.Text(value, text.line()));
        }
        continue;
      }
      if (!(token instanceof RoffToken.Macro macro)) {
        continue;
      }
      List<String> args = macro.args();
      int line = macro.line();
      switch (lower(macro.name())) {
        case "dt" -> doc.setTitle(argAt(args, 0), argAt(args, 1));
        case "sh" -> {
          String title = upper(macro.joinedArgs().trim());
          if (!title.isEmpty()) {
            section = title;
          }
          doc.ensureSection(section);
        }
        case "ss" -> {
          if (!args.isEmpty()) {
            doc.add(section, new MdocElement.Text(macro.joinedArgs(), line));
          }
        }
        case "bl" -> listDepth++;
        case "el" -> listDepth = Math.max(0, listDepth - 1);
        case "it" -> {
          if (listDepth > 0) {
            addAll(doc, section, inlineElements(args, line));
          }
        }
        case "fl", "op" -> addAll(doc, section, inlineElements(withHead(macro.name(), args), line));
        case "ar" -> {
          String name = args.isEmpty() ? "" : normalizeArgName(args.get(0));
          if (!name.isEmpty()) {
            doc.add(section, new MdocElement.Arg(name, false, line));
          }
        }
        case "cm", "ic" -> {
          String name = args.isEmpty() ? "" : args.get(0).trim();
          if (!name.isEmpty()) {
            doc.add(section, new MdocElement.Command(name, line));
          }
        }
        case "pp" -> doc.add(section, new MdocElement.Paragraph(line));
        default -> {
          if (!args.isEmpty()) {
            doc.add(section, new MdocElement.Text(macro.joinedArgs(), line));
          }
        }
      }
    }
    return doc;
  }

  /**
   * Extracts candidates from a parsed document.
   *
   * @param doc parsed mdoc document
   * @param confidence roff detection confidence assigned to every candidate
   * @return candidate pools, one entry per distinct key
   */
  public static CandidatePools extract(RoffDocument<MdocElement> doc, double confidence) {
    CandidatePools pools = new CandidatePools();
    extractFlags(doc, confidence, pools.flags());
    extractArgs(doc, confidence, pools.args());
    extractSubcommands(doc, confidence, pools.subcommands());
    return pools;
  }

  private static void extractFlags(
      RoffDocument<MdocElement> doc, double confidence, List<FlagCandidate> out) {
    Object2IntMap<String> positions = new Object2IntOpenHashMap<>();
    for (String name : doc.sectionNames()) {
      List<MdocElement> content = doc.section(name);
      for (int i = 0; i < content.size(); i++) {
        if (!(content.get(i) instanceof MdocElement.Flag flag)) {
          continue;
        }
        FlagSchema schema =
            flag.name().startsWith("--")
                ? FlagSchema.bool(null, flag.name())
                : FlagSchema.bool(flag.name(), null);
        String key = schema.canonicalName();
        if (i + 1 < content.size() && content.get(i + 1) instanceof MdocElement.Arg) {
          schema = schema.withValueType(ValueType.STRING, true);
        }
        String description = nextDescription(content, i + 1);
        if (description != null) {
          schema = schema.withDescription(description);
        }
        if (positions.containsKey(key)) {
          // The synopsis mention comes first; the option list adds value and description.
          int at = positions.getInt(key);
          FlagCandidate first = out.get(at);
          out.set(
              at,
              new FlagCandidate(
                  FlagRowParser.merge(first.flag(), schema),
                  first.span(),
                  first.strategy(),
                  first.confidence()));
          continue;
        }
        positions.put(key, out.size());
        out.add(
            new FlagCandidate(
                schema, SourceSpan.single(flag.line()), OPTIONS_STRATEGY, confidence));
      }
    }
  }

  private static void extractArgs(
      RoffDocument<MdocElement> doc, double confidence, List<ArgCandidate> out) {
    Set<String> seen = new HashSet<>();
    for (String name : doc.sectionNames()) {
      if (!name.contains("SYNOPSIS") && !name.contains("USAGE")) {
        continue;
      }
      for (MdocElement element : doc.section(name)) {
        if (!(element instanceof MdocElement.Arg arg) || !seen.add(arg.name())) {
          continue;
        }
        ValueType type = ValueTypes.fromManText(arg.name());
        ArgSchema schema =
            arg.optional()
                ? ArgSchema.optional(arg.name(), type)
                : ArgSchema.required(arg.name(), type);
        out.add(
            new ArgCandidate(schema, SourceSpan.single(arg.line()), SYNOPSIS_STRATEGY, confidence));
      }
    }
  }

  private static void extractSubcommands(
      RoffDocument<MdocElement> doc, double confidence, List<SubcommandCandidate> out) {
    Set<String> seen = new HashSet<>();
    for (String name : doc.sectionNames()) {
      if (!name.contains("COMMAND")) {
        continue;
      }
      for (MdocElement element : doc.section(name)) {
        if (element instanceof MdocElement.Command command
            && ManTokens.looksLikeCommandName(command.name())
            && seen.add(lower(command.name()))) {
          out.add(
              new SubcommandCandidate(
                  SubcommandSchema.named(command.name()),
                  SourceSpan.single(command.line()),
                  COMMANDS_STRATEGY,
                  confidence));
        }
      }
    }
  }

  /**
   * Walks inline macro arguments ({@code .It Fl o Ar file}, {@code .Op Fl v}). A leading {@code
   * Op} makes every element optional; an inner {@code Op} applies to the next element only.
   */
  static List<MdocElement> inlineElements(List<String> args, int line) {
    List<MdocElement> out = new ArrayList<>();
    int idx = 0;
    boolean itemOptional = !args.isEmpty() && args.get(0).equalsIgnoreCase("op");
    if (itemOptional) {
      idx = 1;
    }
    boolean pendingOptional = false;
    while (idx < args.size()) {
      boolean optional = itemOptional || pendingOptional;
      String head = lower(args.get(idx));
      switch (head) {
        case "op" -> {
          pendingOptional = true;
          idx++;
          continue;
        }
        case "fl" -> {
          if (idx + 1 < args.size()) {
            String name = flagMacroName(args.get(idx + 1));
            if (name != null) {
              out.add(new MdocElement.Flag(name, optional, line));
            }
          }
          idx += 2;
        }
        case "ar" -> {
          if (idx + 1 < args.size()) {
            String name = normalizeArgName(args.get(idx + 1));
            if (!name.isEmpty()) {
              out.add(new MdocElement.Arg(name, optional, line));
            }
          }
          idx += 2;
        }
        case "cm", "ic" -> {
          if (idx + 1 < args.size()) {
            String name = args.get(idx + 1).trim();
            if (!name.isEmpty()) {
              out.add(new MdocElement.Command(name, line));
            }
          }
          idx += 2;
        }
        default -> {
          String raw = args.get(idx).trim();
          if (raw.startsWith("-")) {
            String name = literalFlagName(raw);
            if (name != null) {
              out.add(new MdocElement.Flag(name, optional, line));
            }
          }
          idx++;
        }
      }
      pendingOptional = false;
    }
    return out;
  }

  /**
   * Name of a flag written as a {@code .Fl} argument. The macro supplies one dash, so {@code v}
   * becomes {@code -v} and {@code -verbose} becomes {@code --verbose}.
   */
  static String flagMacroName(String raw) {
    String token = stripFlagPunctuation(raw);
    if (token.isEmpty()) {
      return null;
    }
    if (token.startsWith("--")) {
      return token;
    }
    if (token.startsWith("-") && token.length() > 1) {
      return "-" + token;
    }
    if (TextUtil.all(token, TextUtil::isAsciiAlnum)) {
      return "-" + token;
    }
    return null;
  }

  /** Name of a flag written literally in running text, such as {@code -v}. */
  static String literalFlagName(String raw) {
    String token = stripFlagPunctuation(raw);
    return token.length() > 1 && token.startsWith("-") ? token : null;
  }

  static String normalizeArgName(String raw) {
    return lower(TextUtil.trimChars(raw.trim(), "<>[]{}\"'"));
  }

  private static String stripFlagPunctuation(String raw) {
    return TextUtil.trimChars(raw.trim(), "\",[](){}");
  }

  // First non-blank text after the flag, stopping at the next flag or paragraph.
  private static String nextDescription(List<MdocElement> content, int start) {
    for (int i = start; i < content.size(); i++) {
      MdocElement element = content.get(i);
      if (element instanceof MdocElement.Text text && !text.value().isBlank()) {
        return text.value().trim();
      }
      if (element instanceof MdocElement.Flag || element instanceof MdocElement.Paragraph) {
        return null;
      }
    }
    return null;
  }

  private static List<String> withHead(String head, List<String> args) {
    List<String> out = new ArrayList<>(args.size() + 1);
    out.add(head);
    out.addAll(args);
    return out;
  }

  private static void addAll(
      RoffDocument<MdocElement> doc, String section, List<MdocElement> elements) {
    for (MdocElement element : elements) {
      doc.add(section, element);
    }
  }

  private static String argAt(List<String> args, int index) {
    return index < args.size() ? args.get(index) : null;
  }
}
