package io.cmdschema.impl.text;

import static io.cmdschema.util.TextUtil.lower;

import io.cmdschema.impl.IndexedLine;
import io.cmdschema.internal.HelpPatterns;
import java.util.List;
import java.util.Optional;

/** Splits help text into explicit {@code Commands:} / {@code Flags:} / ... sections. */
public final class SectionScanner {
  private SectionScanner() {}

  private static final List<String> SUBCOMMAND_HEADER_WORDS =
      List.of("command", "subcommand", "action", "workflow", "task");

  private static final List<String> NON_SUBCOMMAND_HEADER_WORDS =
      List.of(
          "variable", "option", "flag", "argument", "example", "column", "field", "property",
          "setting", "key", "keyboard");

  /**
   * Buckets every non-blank line under the most recent recognised header. An unrecognised short
   * {@code text:} header closes the current section.
   */
  public static SectionBuckets identify(List<IndexedLine> lines) {
    SectionBuckets buckets = new SectionBuckets();
    SectionKind current = null;
    for (IndexedLine line : lines) {
      String trimmed = line.trimmed();
      if (trimmed.isEmpty()) {
        continue;
      }
      Optional<SectionKind> header = detectHeader(trimmed);
      if (header.isPresent()) {
        buckets.addHeader(line.index());
        current = header.get();
        continue;
      }
      if (trimmed.endsWith(":") && !trimmed.startsWith("-") && trimmed.length() < 40) {
        current = null;
        continue;
      }
      if (current != null) {
        buckets.add(current, new IndexedLine(line.index(), trimmed));
      }
    }
    return buckets;
  }

  public static Optional<SectionKind> detectHeader(String trimmed) {
    if (HelpPatterns.SUBCOMMANDS_SECTION.matcher(trimmed).matches()) {
      return Optional.of(SectionKind.SUBCOMMANDS);
    }
    String l = lower(trimmed);
    boolean colon = trimmed.endsWith(":");
    if (colon && trimmed.length() <= 64 && looksLikeSubcommandHeader(l)) {
      return Optional.of(SectionKind.SUBCOMMANDS);
    }
    if (colon && l.contains("option")) {
      return Optional.of(SectionKind.OPTIONS);
    }
    if (colon && l.contains("flag")) {
      return Optional.of(SectionKind.FLAGS);
    }
    if (HelpPatterns.FLAGS_SECTION.matcher(trimmed).matches()) {
      return Optional.of(SectionKind.FLAGS);
    }
    if (HelpPatterns.OPTIONS_SECTION.matcher(trimmed).matches()) {
      return Optional.of(SectionKind.OPTIONS);
    }
    if (HelpPatterns.ARGUMENTS_SECTION.matcher(trimmed).matches()) {
      return Optional.of(SectionKind.ARGUMENTS);
    }
    return Optional.empty();
  }

  private static boolean looksLikeSubcommandHeader(String lower) {
    return SUBCOMMAND_HEADER_WORDS.stream().anyMatch(lower::contains)
        && NON_SUBCOMMAND_HEADER_WORDS.stream().noneMatch(lower::contains);
  }
}
