package io.cmdschema.impl.man.rendered;

import static io.cmdschema.util.TextUtil.lower;

import io.cmdschema.api.SubcommandSchema;
import io.cmdschema.impl.IndexedLine;
import io.cmdschema.impl.candidate.SourceSpan;
import io.cmdschema.impl.candidate.SubcommandCandidate;
import io.cmdschema.impl.man.ManTokens;
import io.cmdschema.impl.text.Columns;
import io.cmdschema.impl.text.LineShapes;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Rows of a rendered {@code COMMANDS} section, split on a tab, a double space or {@code " - "}.
 */
final class RenderedCommands {
  static final String STRATEGY = "man-rendered-commands";
  static final double CONFIDENCE = 0.83;

  private RenderedCommands() {}

  static void parse(RenderedSection section, List<SubcommandCandidate> out) {
    Set<String> seen = new HashSet<>();
    for (IndexedLine line : section.lines()) {
      String trimmed = line.trimmed();
      if (trimmed.isEmpty() || trimmed.startsWith("-")) {
        continue;
      }
      Optional<Columns> columns = LineShapes.splitTwoColumns(trimmed);
      if (columns.isEmpty()) {
        columns = LineShapes.splitDashSeparator(trimmed);
      }
      String name = columns.map(Columns::left).orElse(trimmed);
      if (!ManTokens.looksLikeCommandName(name) || !seen.add(lower(name))) {
        continue;
      }
      SubcommandSchema sub = SubcommandSchema.named(name);
      if (columns.isPresent()) {
        sub = sub.withDescription(columns.get().right());
      }
      out.add(new SubcommandCandidate(sub, SourceSpan.single(line.index()), STRATEGY, CONFIDENCE));
    }
  }
}
