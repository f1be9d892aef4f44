package io.cmdschema.impl.text;

import static io.cmdschema.util.TextUtil.lower;

import io.cmdschema.api.SubcommandSchema;
import io.cmdschema.impl.IndexedLine;
import io.cmdschema.internal.HelpPatterns;
import io.cmdschema.util.TextUtil;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Reads subcommand rows. Instances are bound to the command being parsed so that rows repeating
 * the command name ({@code git commit   Record changes}) can be stripped to the subcommand.
 */
public final class SubcommandRowParser {
  private static final Set<String> EXCLUDED_NAME_COLUMNS =
      Set.of(
          "usage",
          "options",
          "flags",
          "commands",
          "all commands",
          "arguments",
          "examples",
          "example");

  private static final List<String> COMMAND_HEADER_WORDS =
      List.of("command", "subcommand", "action", "workflow", "task");

  private static final List<String> NON_COMMAND_HEADER_WORDS =
      List.of(
          "value", "column", "field", "variable", "environment", "format", "style", "attribute",
          "modifiers", "setting", "key");

  private static final List<String> SECONDARY_GRID_MARKERS =
      List.of(
          "hash", "digest", "cipher", "algorithm", "provider", "legacy", "deprecated", "debug",
          "diagnostic", "completion");

  private static final List<String> SETTING_PREFIXES =
      List.of("same as", "print ", "set ", "tell ");

  private final String command;
  private final String baseCommand;

  public SubcommandRowParser(String command) {
    this.command = command.trim();
    String first = TextUtil.firstWord(this.command);
    this.baseCommand = first.isEmpty() ? this.command : first;
  }

  /** Result of a dense command grid scan. */
  public record GridScan(List<LineMatch<SubcommandSchema>> commands, boolean primary) {}

  /**
   * Parses rows of an explicit commands section: {@code name  description}, {@code name -
   * description}, {@code build, b  description} and comma-separated command lists.
   */
  public List<LineMatch<SubcommandSchema>> parseRows(List<IndexedLine> lines) {
    List<LineMatch<SubcommandSchema>> out = new ArrayList<>();
    Set<String> seen = new HashSet<>();
    for (IndexedLine line : lines) {
      String trimmed = line.trimmed();
      if (trimmed.isEmpty() || trimmed.startsWith("-")) {
        continue;
      }
      if (LineShapes.looksLikeCommandListLine(trimmed)) {
        for (String part : TextUtil.splitLiteral(trimmed, ",")) {
          String name = part.trim();
          if (LineShapes.isValidCommandName(name) && seen.add(name)) {
            out.add(new LineMatch<>(SubcommandSchema.named(name), line.index()));
          }
        }
        continue;
      }
      Optional<Columns> columns = LineShapes.splitDashSeparator(trimmed);
      if (columns.isEmpty()) {
        columns = LineShapes.splitTwoColumns(trimmed);
      }
      String namePart = stripCommandPrefix(columns.map(Columns::left).orElse(trimmed));
      if (namePart.isEmpty()) {
        continue;
      }
      List<String> names = new ArrayList<>();
      for (String part : TextUtil.splitLiteral(namePart, ",")) {
        String name = part.trim();
        if (LineShapes.isValidCommandName(name) && LineShapes.isPlausibleSubcommandName(name)) {
          names.add(name);
        }
      }
      if (names.isEmpty()) {
        for (String name : nameCandidates(namePart)) {
          if (LineShapes.isValidCommandName(name) && LineShapes.isPlausibleSubcommandName(name)) {
            names.add(name);
          }
        }
      }
      if (names.isEmpty() || !seen.add(names.get(0))) {
        continue;
      }
      SubcommandSchema sub =
          SubcommandSchema.named(names.get(0)).withAliases(names.subList(1, names.size()));
      if (columns.isPresent()) {
        sub = sub.withDescription(LineShapes.sanitizeDescription(columns.get().right()));
      }
      out.add(new LineMatch<>(sub, line.index()));
    }
    return out;
  }

  private String stripCommandPrefix(String namePart) {
    String trimmed = namePart.trim();
    if (trimmed.isEmpty()) {
      return trimmed;
    }
    Optional<String> rest = stripInvocation(trimmed, command);
    if (rest.isPresent() && !rest.get().isEmpty()) {
      return rest.get();
    }
    if (!baseCommand.equals(command)) {
      rest = stripInvocation(trimmed, baseCommand);
      if (rest.isPresent() && !rest.get().isEmpty()) {
        return rest.get();
      }
    }
    return trimmed;
  }

  private static Optional<String> stripInvocation(String value, String prefix) {
    if (prefix.isEmpty() || !value.startsWith(prefix)) {
      return Optional.empty();
    }
    String rest = value.substring(prefix.length());
    if (rest.isEmpty()) {
      return Optional.of("");
    }
    if (!Character.isWhitespace(rest.charAt(0))) {
      return Optional.empty();
    }
    return Optional.of(rest.trim());
  }

  // "start UNIT..." names the command "start"; any prose tail rejects the row
  private static List<String> nameCandidates(String namePart) {
    List<String> candidates = new ArrayList<>();
    for (String raw : TextUtil.splitLiteral(namePart, ",")) {
      String segment = raw.trim();
      if (segment.isEmpty()) {
        continue;
      }
      if (LineShapes.isValidCommandName(segment)) {
        candidates.add(segment);
        continue;
      }
      String first = TextUtil.firstWord(segment);
      if (!LineShapes.isValidCommandName(first)) {
        return List.of();
      }
      String tail = segment.substring(first.length()).trim();
      if (!tail.isEmpty() && !LineShapes.looksLikeArgumentPlaceholder(tail)) {
        return List.of();
      }
      candidates.add(first);
    }
    return candidates;
  }

  /**
   * Finds blocks of two or more lower-case two-column rows outside any explicit section. Blocks
   * under value, column or key headers and keybinding tables are skipped.
   */
  public List<LineMatch<SubcommandSchema>> twoColumnBlocks(List<IndexedLine> lines) {
    List<LineMatch<SubcommandSchema>> out = new ArrayList<>();
    List<IndexedLine> block = new ArrayList<>();
    String header = null;
    for (IndexedLine line : lines) {
      String trimmed = line.trimmed();
      if (trimmed.isEmpty()
          || SectionScanner.detectHeader(trimmed).isPresent()
          || trimmed.startsWith("-")) {
        flushBlock(block, header, out);
        header = null;
        continue;
      }
      if (LineShapes.isBlockHeader(trimmed)) {
        flushBlock(block, header, out);
        header = lower(trimmed);
        continue;
      }
      String currentHeader = header;
      boolean commandRow =
          LineShapes.splitTwoColumns(trimmed)
              .map(c -> isGenericNameColumn(c.left(), currentHeader))
              .orElse(false);
      if (commandRow) {
        block.add(new IndexedLine(line.index(), trimmed));
      } else {
        flushBlock(block, header, out);
      }
    }
    flushBlock(block, header, out);

    List<LineMatch<SubcommandSchema>> deduped = new ArrayList<>();
    Set<String> seen = new HashSet<>();
    for (LineMatch<SubcommandSchema> match : out) {
      if (seen.add(match.value().name())) {
        deduped.add(match);
      }
    }
    return deduped;
  }

  private void flushBlock(
      List<IndexedLine> block, String header, List<LineMatch<SubcommandSchema>> out) {
    if (block.size() >= 2
        && (header == null || !isNonCommandBlockHeader(header))
        && !looksLikeKeybindingTable(block)) {
      out.addAll(parseRows(block));
    }
    block.clear();
  }

  static boolean isNonCommandBlockHeader(String header) {
    String l = lower(header);
    if (l.contains("summary of") && l.contains("commands")) {
      return true;
    }
    if (COMMAND_HEADER_WORDS.stream().anyMatch(l::contains)) {
      return false;
    }
    return NON_COMMAND_HEADER_WORDS.stream().anyMatch(l::contains);
  }

  static boolean looksLikeKeybindingTable(List<IndexedLine> block) {
    int markerRows = 0;
    int shortKeyRows = 0;
    for (IndexedLine entry : block) {
      Optional<Columns> columns = LineShapes.splitTwoColumns(entry.text());
      if (columns.isEmpty()) {
        continue;
      }
      String left = columns.get().left();
      String leftLower = lower(left);
      String right = columns.get().right();
      if (left.contains("ESC")
          || leftLower.contains("ctrl")
          || leftLower.contains("arrow")
          || leftLower.contains("backspace")
          || leftLower.contains("delete")
          || left.contains("^")
          || right.contains("^")) {
        markerRows++;
      }
      boolean shortKeys =
          !left.contains(",")
              && TextUtil.words(left).stream().allMatch(token -> token.length() <= 3)
              && TextUtil.any(left, ch -> TextUtil.isAsciiAlpha(ch) || ch == '^' || ch == '-');
      if (shortKeys) {
        shortKeyRows++;
      }
    }
    return markerRows > 0 || (block.size() >= 4 && shortKeyRows * 2 >= block.size());
  }

  static boolean isNameColumn(String left) {
    if (EXCLUDED_NAME_COLUMNS.contains(lower(left)) || left.startsWith("-")) {
      return false;
    }
    List<String> names = TextUtil.commaParts(left);
    return !names.isEmpty()
        && names.stream()
            .allMatch(n -> LineShapes.isValidCommandName(n) || TextUtil.all(n, ch -> ch == '.'));
  }

  static boolean isGenericNameColumn(String left, String header) {
    if (header != null && isNonCommandBlockHeader(header)) {
      return false;
    }
    if (!isNameColumn(left)) {
      return false;
    }
    List<String> names = TextUtil.commaParts(left);
    return names.stream().allMatch(LineShapes::isLowercaseInitial)
        && names.stream().anyMatch(LineShapes::hasLowercase)
        && names.stream().noneMatch(LineShapes::looksLikePlaceholderSubcommandToken)
        && names.stream().noneMatch(LineShapes::looksLikeNonCommandValueToken);
  }

  /**
   * Reads grids of bare command names under headers such as {@code Standard commands}. When any
   * primary section exists, secondary ones (digests, ciphers, ...) are left out of the result.
   * Each command's match range starts at its section header.
   */
  public GridScan denseCommandGrid(List<IndexedLine> lines) {
    List<GridSection> sections = new ArrayList<>();
    GridSection current = null;
    for (IndexedLine line : lines) {
      String trimmed = line.trimmed();
      if (trimmed.isEmpty()) {
        current = flushGrid(current, sections);
        continue;
      }
      Optional<Boolean> headerKind = classifyGridHeader(trimmed);
      if (headerKind.isPresent()) {
        flushGrid(current, sections);
        current = new GridSection(line.index(), headerKind.get());
        continue;
      }
      if (current == null) {
        continue;
      }
      if (LineShapes.isSectionHeaderLine(trimmed)
          || LineShapes.isBlockHeader(trimmed)
          || lower(trimmed).startsWith("usage:")) {
        current = flushGrid(current, sections);
        continue;
      }
      Optional<List<String>> tokens = gridRow(trimmed);
      if (tokens.isEmpty()) {
        current = flushGrid(current, sections);
        continue;
      }
      if (tokens.get().size() >= 2) {
        current.denseRowSeen = true;
      } else if (!current.denseRowSeen) {
        continue;
      }
      current.rows.add(new LineMatch<>(tokens.get(), current.headerIndex, line.index()));
    }
    flushGrid(current, sections);

    boolean primary = sections.stream().anyMatch(s -> s.primary);
    List<LineMatch<SubcommandSchema>> commands = new ArrayList<>();
    Set<String> seen = new HashSet<>();
    for (GridSection section : sections) {
      if (primary && !section.primary) {
        continue;
      }
      for (LineMatch<List<String>> row : section.rows) {
        for (String token : row.value()) {
          if (seen.add(token)) {
            commands.add(row.withValue(SubcommandSchema.named(token)));
          }
        }
      }
    }
    return new GridScan(commands, primary);
  }

  private static final class GridSection {
    final int headerIndex;
    final boolean primary;
    final List<LineMatch<List<String>>> rows = new ArrayList<>();
    boolean denseRowSeen;

    GridSection(int headerIndex, boolean primary) {
      this.headerIndex = headerIndex;
      this.primary = primary;
    }

    int tokenCount() {
      return rows.stream().mapToInt(r -> r.value().size()).sum();
    }
  }

  private static GridSection flushGrid(GridSection section, List<GridSection> out) {
    if (section != null && section.denseRowSeen && section.tokenCount() >= 3) {
      out.add(section);
    }
    return null;
  }

  /** Present when the line is a grid header; the value tells whether it is a primary section. */
  static Optional<Boolean> classifyGridHeader(String trimmed) {
    if (trimmed.startsWith("-")) {
      return Optional.empty();
    }
    String header = TextUtil.trimEndChars(trimmed, ":").trim();
    int note = header.indexOf(" (");
    if (note >= 0) {
      header = header.substring(0, note).trim();
    }
    String l = lower(header);
    if (l.isEmpty()
        || !l.contains("command")
        || l.contains("summary of")
        || TextUtil.words(l).size() > 5) {
      return Optional.empty();
    }
    return Optional.of(SECONDARY_GRID_MARKERS.stream().noneMatch(l::contains));
  }

  private static Optional<List<String>> gridRow(String trimmed) {
    if (trimmed.startsWith("-")) {
      return Optional.empty();
    }
    List<String> tokens = new ArrayList<>();
    for (String raw : HelpPatterns.COLUMN_BREAK.split(trimmed)) {
      String token = raw.trim();
      if (!token.isEmpty()) {
        tokens.add(token);
      }
    }
    if (tokens.isEmpty()
        || !tokens.stream()
            .allMatch(
                t -> LineShapes.isValidCommandName(t) && LineShapes.isPlausibleSubcommandName(t))) {
      return Optional.empty();
    }
    return Optional.of(tokens);
  }

  /**
   * Reads the comma-separated lists under an npm style {@code All commands:} header, up to the
   * next header. Each command's range starts at the {@code All commands:} line.
   */
  public List<LineMatch<SubcommandSchema>> npmCommandList(List<IndexedLine> lines) {
    List<LineMatch<SubcommandSchema>> out = new ArrayList<>();
    Set<String> seen = new HashSet<>();
    int header = -1;
    for (IndexedLine line : lines) {
      String trimmed = line.trimmed();
      if (trimmed.isEmpty()) {
        continue;
      }
      if (trimmed.equalsIgnoreCase("All commands:")) {
        header = line.index();
        continue;
      }
      if (header < 0) {
        continue;
      }
      if (trimmed.endsWith(":") && !trimmed.contains(",")) {
        break;
      }
      if (!LineShapes.looksLikeCommandListLine(trimmed)) {
        continue;
      }
      for (String part : TextUtil.splitLiteral(trimmed, ",")) {
        String name = part.trim();
        if (LineShapes.isValidCommandName(name) && seen.add(name)) {
          out.add(new LineMatch<>(SubcommandSchema.named(name), header, line.index()));
        }
      }
    }
    return out;
  }

  /**
   * Reads {@code name  Same as ...} / {@code Print ...} / {@code Set ...} rows that name settings
   * rather than commands, as printed by terminal configuration tools.
   */
  public List<LineMatch<SubcommandSchema>> namedSettingRows(List<IndexedLine> lines) {
    List<LineMatch<SubcommandSchema>> out = new ArrayList<>();
    Set<String> seen = new HashSet<>();
    for (IndexedLine line : lines) {
      Optional<Columns> columns = LineShapes.splitTwoColumns(line.trimmed());
      if (columns.isEmpty()) {
        continue;
      }
      String left = columns.get().left();
      if (left.startsWith("-")
          || left.contains(" ")
          || !LineShapes.isValidCommandName(left)
          || TextUtil.any(left, ch -> TextUtil.isAsciiUpper(ch) || TextUtil.isAsciiDigit(ch))
          || !LineShapes.hasLowercase(left)) {
        continue;
      }
      String right = lower(columns.get().right());
      if (SETTING_PREFIXES.stream().noneMatch(right::startsWith)) {
        continue;
      }
      if (seen.add(left)) {
        SubcommandSchema sub =
            SubcommandSchema.named(left)
                .withDescription(LineShapes.sanitizeDescription(columns.get().right()));
        out.add(new LineMatch<>(sub, line.index()));
      }
    }
    return out;
  }
}
