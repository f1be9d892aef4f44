package io.cmdschema.impl.report;

import static org.junit.jupiter.api.Assertions.*;

import io.cmdschema.api.CommandSchema;
import io.cmdschema.api.ExtractionReport;
import io.cmdschema.api.ExtractionRun;
import io.cmdschema.api.FailureCode;
import io.cmdschema.api.FlagSchema;
import io.cmdschema.api.HelpFormat;
import io.cmdschema.api.ParseDiagnostics;
import io.cmdschema.api.ParseResult;
import io.cmdschema.api.QualityPolicy;
import io.cmdschema.api.QualityTier;
import io.cmdschema.api.SchemaSource;
import io.cmdschema.impl.HelpParserImpl;
import java.util.List;
import org.junit.jupiter.api.Test;

class QualityAssessorTest {

  private static ParseResult result(CommandSchema schema, double coverage) {
    return new ParseResult(
        schema,
        List.of(),
        HelpFormat.GNU,
        List.of(),
        List.of("section+gnu+usage"),
        new ParseDiagnostics(10, (int) Math.round(coverage * 10), List.of(), coverage));
  }

  private static CommandSchema schema(double confidence, FlagSchema... flags) {
    return CommandSchema.empty("tool", SchemaSource.HELP_COMMAND)
        .withEntities(List.of(flags), List.of(), List.of())
        .withConfidence(confidence);
  }

  @Test
  void confidentWellCoveredSchemaIsHighTier() {
    ExtractionRun run =
        QualityAssessor.assess(
            "tool",
            result(schema(0.9, FlagSchema.bool("-v", null)), 0.8),
            QualityPolicy.defaults());

    ExtractionReport report = run.report();
    assertTrue(report.success());
    assertTrue(report.acceptedForSuggestions());
    assertEquals(QualityTier.HIGH, report.qualityTier());
    assertNull(report.failureCode());
    assertTrue(report.qualityReasons().isEmpty());
    assertEquals(List.of("section+gnu+usage"), report.parsersUsed());
    assertTrue(run.result().isSuccess());
  }

  @Test
  void acceptableSchemaWithModestCoverageIsMediumTier() {
    ExtractionRun run =
        QualityAssessor.assess(
            "tool",
            result(schema(0.7, FlagSchema.bool("-v", null)), 0.4),
            QualityPolicy.defaults());
    assertEquals(QualityTier.MEDIUM, run.report().qualityTier());
  }

  @Test
  void lowConfidenceIsRejected() {
    ExtractionRun run =
        QualityAssessor.assess(
            "tool",
            result(schema(0.55, FlagSchema.bool("-v", null)), 0.8),
            QualityPolicy.defaults());

    ExtractionReport report = run.report();
    assertFalse(report.success());
    assertEquals(QualityTier.LOW, report.qualityTier());
    assertEquals(FailureCode.QUALITY_REJECTED, report.failureCode());
    assertEquals(List.of("confidence 0.55 below minimum 0.60"), report.qualityReasons());
    assertNull(run.result().schema());
    assertEquals(
        "Quality gate rejected schema: confidence 0.55 below minimum 0.60",
        run.result().warnings().get(run.result().warnings().size() - 1));
  }

  @Test
  void overrideAcceptsLowQualityAndSaysSo() {
    ExtractionRun run =
        QualityAssessor.assess(
            "tool",
            result(schema(0.55, FlagSchema.bool("-v", null)), 0.1),
            new QualityPolicy(0.6, 0.2, true));

    ExtractionReport report = run.report();
    assertTrue(report.success());
    assertEquals(QualityTier.LOW, report.qualityTier());
    assertEquals(3, report.qualityReasons().size());
    assertEquals(QualityAssessor.OVERRIDE_REASON, report.qualityReasons().get(2));
    assertNotNull(run.result().schema());
  }

  @Test
  void missingSchemaIsParseFailure() {
    ExtractionRun run =
        QualityAssessor.assess("tool", result(null, 0.0), QualityPolicy.defaults());

    assertEquals(QualityTier.FAILED, run.report().qualityTier());
    assertEquals(FailureCode.PARSE_FAILED, run.report().failureCode());
    assertEquals(List.of(QualityAssessor.NO_SCHEMA_REASON), run.report().qualityReasons());
    assertEquals(0.0, run.report().confidence());
  }

  @Test
  void blankInputIsNotHelpOutput() {
    ParseResult blank =
        new ParseResult(
            null, List.of(HelpParserImpl.EMPTY_INPUT_WARNING), null, List.of(), List.of(), null);

    ExtractionRun run = QualityAssessor.assess("tool", blank, QualityPolicy.permissive());

    assertEquals(FailureCode.NOT_HELP_OUTPUT, run.report().failureCode());
    assertFalse(run.report().acceptedForSuggestions());
  }

  @Test
  void invalidSchemaFailsValidation() {
    CommandSchema duplicate =
        schema(0.9, FlagSchema.bool("-v", null), FlagSchema.bool("-v", "--verbose"));

    ExtractionRun run =
        QualityAssessor.assess("tool", result(duplicate, 0.8), QualityPolicy.permissive());

    ExtractionReport report = run.report();
    assertEquals(QualityTier.FAILED, report.qualityTier());
    assertEquals(FailureCode.PARSE_FAILED, report.failureCode());
    assertEquals(1, report.validationErrors().size());
    assertNull(run.result().schema());
    String last = run.result().warnings().get(run.result().warnings().size() - 1);
    assertTrue(last.startsWith(QualityAssessor.VALIDATION_REASON + ": "), last);
  }
}
