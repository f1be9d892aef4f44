package io.cmdschema.api;

import java.util.List;

/**
 * Quality report for one extraction, suitable for logging or persisting next to the schema.
 *
 * @param command the command that was parsed
 * @param success whether a schema survived parsing and the quality gate
 * @param acceptedForSuggestions whether callers may use the schema
 * @param qualityTier coarse grade
 * @param qualityReasons thresholds that were missed, plus override notes
 * @param failureCode why no schema was accepted, or {@code null} on success
 * @param failureDetail free-form detail for the failure, or {@code null}
 * @param selectedFormat highest-scoring format, or {@code null}
 * @param formatScores every format score
 * @param parsersUsed strategies and tags recorded by the parser
 * @param confidence overall schema confidence, 0 when no schema
 * @param coverage fraction of relevant lines recognised
 * @param relevantLines count of relevant lines
 * @param recognizedLines count of recognised relevant lines
 * @param unresolvedLines sample of relevant lines not recognised
 * @param warnings parser warnings
 * @param validationErrors structural problems found in the schema
 */
public record ExtractionReport(
    String command,
    boolean success,
    boolean acceptedForSuggestions,
    QualityTier qualityTier,
    List<String> qualityReasons,
    FailureCode failureCode,
    String failureDetail,
    HelpFormat selectedFormat,
    List<FormatScore> formatScores,
    List<String> parsersUsed,
    double confidence,
    double coverage,
    int relevantLines,
    int recognizedLines,
    List<String> unresolvedLines,
    List<String> warnings,
    List<ValidationError> validationErrors) {

  public ExtractionReport {
    qualityReasons = qualityReasons == null ? List.of() : List.copyOf(qualityReasons);
    formatScores = formatScores == null ? List.of() : List.copyOf(formatScores);
    parsersUsed = parsersUsed == null ? List.of() : List.copyOf(parsersUsed);
    unresolvedLines = unresolvedLines == null ? List.of() : List.copyOf(unresolvedLines);
    warnings = warnings == null ? List.of() : List.copyOf(warnings);
    validationErrors = validationErrors == null ? List.of() : List.copyOf(validationErrors);
  }
}
