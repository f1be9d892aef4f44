package io.cmdschema.api;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Outcome of parsing one help text.
 *
 * @param schema the extracted schema, or {@code null} when nothing was recognised
 * @param warnings human-readable notes about discarded or suspicious findings
 * @param detectedFormat highest-scoring help format, or {@code null} for blank input
 * @param formatScores all format scores in descending order
 * @param parsersUsed strategy plan, contributing strategies and confidence tags
 * @param diagnostics line coverage accounting
 */
public record ParseResult(
    CommandSchema schema,
    List<String> warnings,
    HelpFormat detectedFormat,
    List<FormatScore> formatScores,
    List<String> parsersUsed,
    ParseDiagnostics diagnostics) {

  public ParseResult {
    warnings = warnings == null ? List.of() : List.copyOf(warnings);
    formatScores = formatScores == null ? List.of() : List.copyOf(formatScores);
    parsersUsed = parsersUsed == null ? List.of() : List.copyOf(parsersUsed);
    diagnostics = diagnostics == null ? ParseDiagnostics.EMPTY : diagnostics;
  }

  public Optional<CommandSchema> schemaIfPresent() {
    return Optional.ofNullable(schema);
  }

  public boolean isSuccess() {
    return schema != null;
  }

  /** Copy of this result with the schema removed and an extra warning appended. */
  public ParseResult rejected(String warning) {
    List<String> extended = new ArrayList<>(warnings);
    extended.add(warning);
    return new ParseResult(null, extended, detectedFormat, formatScores, parsersUsed, diagnostics);
  }
}
