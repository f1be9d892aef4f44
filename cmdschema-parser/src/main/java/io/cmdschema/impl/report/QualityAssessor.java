package io.cmdschema.impl.report;

import io.cmdschema.api.CommandSchema;
import io.cmdschema.api.ExtractionReport;
import io.cmdschema.api.ExtractionRun;
import io.cmdschema.api.FailureCode;
import io.cmdschema.api.ParseDiagnostics;
import io.cmdschema.api.ParseResult;
import io.cmdschema.api.QualityPolicy;
import io.cmdschema.api.QualityTier;
import io.cmdschema.api.SchemaValidator;
import io.cmdschema.api.ValidationError;
import io.cmdschema.impl.HelpParserImpl;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Grades a parse result against a {@link QualityPolicy} and builds its report. */
public final class QualityAssessor {
  private static final Logger LOG = LoggerFactory.getLogger(QualityAssessor.class);

  static final double HIGH_TIER_CONFIDENCE = 0.85;
  static final double HIGH_TIER_COVERAGE = 0.6;
  static final String NO_SCHEMA_REASON = "Parsing pipeline did not produce a valid schema";
  static final String VALIDATION_REASON = "Schema validation failed";
  static final String OVERRIDE_REASON = "accepted by allow-low-quality override";

  private QualityAssessor() {}

  /**
   * Assesses {@code result}. A schema that fails validation or the policy is removed from the
   * returned result.
   */
  public static ExtractionRun assess(String command, ParseResult result, QualityPolicy policy) {
    ParseDiagnostics diagnostics = result.diagnostics();
    CommandSchema schema = result.schema();
    List<ValidationError> validationErrors =
        schema == null ? List.of() : SchemaValidator.validate(schema);

    if (schema == null || !validationErrors.isEmpty()) {
      FailureCode code =
          result.warnings().contains(HelpParserImpl.EMPTY_INPUT_WARNING)
              ? FailureCode.NOT_HELP_OUTPUT
              : FailureCode.PARSE_FAILED;
      String reason = validationErrors.isEmpty() ? NO_SCHEMA_REASON : VALIDATION_REASON;
      String detail = validationErrors.isEmpty() ? null : validationErrors.toString();
      ParseResult failed = schema == null ? result : result.rejected(reason + ": " + detail);
      LOG.debug("Extraction for '{}' failed: {}", command, code.label());
      return new ExtractionRun(
          failed,
          report(
              command,
              failed,
              false,
              QualityTier.FAILED,
              List.of(reason),
              code,
              detail,
              0.0,
              validationErrors));
    }

    List<String> reasons = new ArrayList<>();
    if (schema.confidence() < policy.minConfidence()) {
      reasons.add(
          String.format(
              Locale.ROOT,
              "confidence %.2f below minimum %.2f",
              schema.confidence(),
              policy.minConfidence()));
    }
    if (diagnostics.coverage() < policy.minCoverage()) {
      reasons.add(
          String.format(
              Locale.ROOT,
              "coverage %.2f below minimum %.2f",
              diagnostics.coverage(),
              policy.minCoverage()));
    }

    boolean accepted = reasons.isEmpty() || policy.allowLowQuality();
    QualityTier tier;
    if (!reasons.isEmpty()) {
      tier = QualityTier.LOW;
    } else if (schema.confidence() >= HIGH_TIER_CONFIDENCE
        && diagnostics.coverage() >= HIGH_TIER_COVERAGE) {
      tier = QualityTier.HIGH;
    } else {
      tier = QualityTier.MEDIUM;
    }
    if (!reasons.isEmpty() && policy.allowLowQuality()) {
      reasons.add(OVERRIDE_REASON);
    }

    if (!accepted) {
      String detail = String.join("; ", reasons);
      ParseResult rejected = result.rejected("Quality gate rejected schema: " + detail);
      LOG.debug("Schema for '{}' rejected: {}", command, detail);
      return new ExtractionRun(
          rejected,
          report(
              command,
              rejected,
              false,
              tier,
              reasons,
              FailureCode.QUALITY_REJECTED,
              detail,
              schema.confidence(),
              List.of()));
    }
    return new ExtractionRun(
        result,
        report(command, result, true, tier, reasons, null, null, schema.confidence(), List.of()));
  }

  private static ExtractionReport report(
      String command,
      ParseResult result,
      boolean success,
      QualityTier tier,
      List<String> reasons,
      FailureCode code,
      String detail,
      double confidence,
      List<ValidationError> validationErrors) {
    ParseDiagnostics diagnostics = result.diagnostics();
    return new ExtractionReport(
        command,
        success,
        success,
        tier,
        reasons,
        code,
        detail,
        result.detectedFormat(),
        result.formatScores(),
        result.parsersUsed(),
        confidence,
        diagnostics.coverage(),
        diagnostics.relevantLines(),
        diagnostics.recognizedLines(),
        diagnostics.unresolvedLines(),
        result.warnings(),
        validationErrors);
  }
}
