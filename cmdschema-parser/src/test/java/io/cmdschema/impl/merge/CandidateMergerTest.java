package io.cmdschema.impl.merge;

import static org.junit.jupiter.api.Assertions.*;

import io.cmdschema.api.ArgSchema;
import io.cmdschema.api.FlagSchema;
import io.cmdschema.api.SubcommandSchema;
import io.cmdschema.api.ValueType;
import io.cmdschema.impl.candidate.ArgCandidate;
import io.cmdschema.impl.candidate.FlagCandidate;
import io.cmdschema.impl.candidate.SourceSpan;
import io.cmdschema.impl.candidate.SubcommandCandidate;
import java.util.List;
import org.junit.jupiter.api.Test;

class CandidateMergerTest {

  private final CandidateMerger merger = new CandidateMerger();

  private static FlagCandidate flag(FlagSchema flag, String strategy, double confidence) {
    return new FlagCandidate(flag, SourceSpan.single(0), strategy, confidence);
  }

  private static SubcommandCandidate sub(String name, double confidence) {
    return new SubcommandCandidate(
        SubcommandSchema.named(name), SourceSpan.single(0), "test", confidence);
  }

  @Test
  void highestScorerWinsAndOtherContendersAreDemoted() {
    FlagCandidate section =
        flag(FlagSchema.bool("-v", "--verbose").withDescription("be loud"), "section", 0.9);
    FlagCandidate gnu = flag(FlagSchema.bool("-v", "--verbose"), "gnu", 0.7);

    MergeOutcome<FlagSchema, FlagCandidate> outcome = merger.mergeFlags(List.of(gnu, section));

    assertEquals(1, outcome.accepted().size());
    FlagSchema merged = outcome.accepted().get(0);
    assertEquals("--verbose", merged.longName());
    assertEquals("be loud", merged.description());
    assertEquals(List.of(gnu), outcome.medium());
    assertTrue(outcome.discarded().isEmpty());
  }

  @Test
  void winnerIsAcceptedWithoutLoserDetails() {
    FlagCandidate first = flag(FlagSchema.bool(null, "--output"), "section", 0.9);
    FlagCandidate second =
        flag(FlagSchema.withValue("-o", "--output", ValueType.FILE), "gnu", 0.75);

    MergeOutcome<FlagSchema, FlagCandidate> outcome = merger.mergeFlags(List.of(first, second));

    FlagSchema accepted = outcome.accepted().get(0);
    assertNull(accepted.shortName());
    assertFalse(accepted.takesValue());
    assertEquals(ValueType.BOOL, accepted.valueType());
    assertEquals(List.of(second), outcome.medium());
  }

  @Test
  void siblingBetweenMediumAndHighStaysInMedium() {
    FlagCandidate winner = flag(FlagSchema.bool(null, "--color"), "section", 0.9);
    FlagCandidate sibling = flag(FlagSchema.bool(null, "--color"), "usage", 0.6);
    FlagCandidate weak = flag(FlagSchema.bool(null, "--color"), "usage", 0.3);

    MergeOutcome<FlagSchema, FlagCandidate> outcome =
        merger.mergeFlags(List.of(winner, sibling, weak));

    assertEquals(1, outcome.accepted().size());
    assertEquals(List.of(sibling), outcome.medium());
    assertEquals(List.of(weak), outcome.discarded());
  }

  @Test
  void mediumOnlyGroupKeepsBestInMedium() {
    FlagCandidate a = flag(FlagSchema.bool(null, "--color"), "usage", 0.6);
    FlagCandidate b = flag(FlagSchema.bool(null, "--color"), "usage", 0.55);

    MergeOutcome<FlagSchema, FlagCandidate> outcome = merger.mergeFlags(List.of(a, b));

    assertTrue(outcome.accepted().isEmpty());
    assertEquals(List.of(a), outcome.medium());
    assertEquals(List.of(b), outcome.discarded());
  }

  @Test
  void lowConfidenceCandidatesAreDiscarded() {
    MergeOutcome<SubcommandSchema, SubcommandCandidate> outcome =
        merger.mergeSubcommands(List.of(sub("build", 0.3)));

    assertTrue(outcome.accepted().isEmpty());
    assertTrue(outcome.medium().isEmpty());
    assertEquals(1, outcome.discarded().size());
  }

  @Test
  void lowerThresholdStillOnlyAcceptsHighCandidates() {
    CandidateMerger lenient = new CandidateMerger(0.5);

    MergeOutcome<SubcommandSchema, SubcommandCandidate> outcome =
        lenient.mergeSubcommands(List.of(sub("build", 0.6)));

    assertTrue(outcome.accepted().isEmpty());
    assertEquals(
        List.of("build"),
        outcome.medium().stream().map(c -> c.subcommand().name()).toList());
    assertTrue(outcome.discarded().isEmpty());
  }

  @Test
  void higherThresholdKeepsHighWinnerInMedium() {
    CandidateMerger strict = new CandidateMerger(0.95);

    MergeOutcome<SubcommandSchema, SubcommandCandidate> outcome =
        strict.mergeSubcommands(List.of(sub("build", 0.9), sub("build", 0.4)));

    assertTrue(outcome.accepted().isEmpty());
    assertEquals(1, outcome.medium().size());
    assertEquals(1, outcome.discarded().size());
  }

  @Test
  void subcommandsGroupCaseInsensitivelyAndSortByName() {
    MergeOutcome<SubcommandSchema, SubcommandCandidate> outcome =
        merger.mergeSubcommands(List.of(sub("run", 0.9), sub("build", 0.8), sub("Run", 0.75)));

    assertEquals(
        List.of("build", "run"), outcome.accepted().stream().map(SubcommandSchema::name).toList());
    assertEquals(1, outcome.medium().size());
  }

  @Test
  void invalidFlagShapesAreDiscarded() {
    FlagCandidate bad = flag(FlagSchema.bool("x", null), "section", 0.9);

    MergeOutcome<FlagSchema, FlagCandidate> outcome = merger.mergeFlags(List.of(bad));

    assertTrue(outcome.accepted().isEmpty());
    assertEquals(1, outcome.discarded().size());
    assertEquals(CandidateMerger.INVALID_FLAG_STRATEGY, outcome.discarded().get(0).strategy());
  }

  @Test
  void malformedFlagNamesNeverReachAccepted() {
    MergeOutcome<FlagSchema, FlagCandidate> outcome =
        merger.mergeFlags(
            List.of(
                flag(FlagSchema.bool(null, "--exec-path["), "man-synopsis", 0.9),
                flag(FlagSchema.bool("-a/", null), "section", 0.9),
                flag(FlagSchema.bool(null, "--9x"), "section", 0.9),
                flag(FlagSchema.bool(null, "--exec-path"), "man-options", 0.9)));

    assertEquals(
        List.of("--exec-path"),
        outcome.accepted().stream().map(FlagSchema::canonicalName).toList());
    assertEquals(3, outcome.discarded().size());
    assertTrue(
        outcome.discarded().stream()
            .allMatch(c -> CandidateMerger.INVALID_FLAG_STRATEGY.equals(c.strategy())));
  }

  @Test
  void identifierShapes() {
    assertTrue(CandidateMerger.hasValidIdentifiers(FlagSchema.bool("-?", "--dry-run")));
    assertTrue(CandidateMerger.hasValidIdentifiers(FlagSchema.bool(null, "--log_level.v2")));
    assertFalse(CandidateMerger.hasValidIdentifiers(FlagSchema.bool("-x", "--block-size[")));
    assertFalse(CandidateMerger.hasValidIdentifiers(FlagSchema.bool("-<", null)));
    assertFalse(CandidateMerger.hasValidIdentifiers(FlagSchema.bool(null, "---")));
    assertFalse(CandidateMerger.hasValidIdentifiers(FlagSchema.bool(null, "--a=b")));
  }

  @Test
  void shortOnlyFlagFoldsIntoItsLongForm() {
    FlagCandidate shortOnly = flag(FlagSchema.bool("-q", null), "usage", 0.8);
    FlagCandidate full = flag(FlagSchema.bool("-q", "--quiet"), "section", 0.9);

    MergeOutcome<FlagSchema, FlagCandidate> outcome = merger.mergeFlags(List.of(shortOnly, full));

    assertEquals(1, outcome.accepted().size());
    assertEquals("--quiet", outcome.accepted().get(0).canonicalName());
  }

  @Test
  void argWinnerIsTakenAsIs() {
    ArgCandidate plain =
        new ArgCandidate(
            ArgSchema.required("path", ValueType.STRING), SourceSpan.single(1), "usage", 0.8);
    ArgCandidate typed =
        new ArgCandidate(
            ArgSchema.required("path", ValueType.FILE).withMultiple(true),
            SourceSpan.single(3),
            "section",
            0.75);

    MergeOutcome<ArgSchema, ArgCandidate> outcome = merger.mergeArgs(List.of(plain, typed));

    ArgSchema accepted = outcome.accepted().get(0);
    assertEquals(ValueType.STRING, accepted.valueType());
    assertFalse(accepted.multiple());
    assertEquals(List.of(typed), outcome.medium());
  }

  @Test
  void thresholdOutsideUnitRangeIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> new CandidateMerger(1.5));
    assertThrows(IllegalArgumentException.class, () -> new CandidateMerger(Double.NaN));
  }

  @Test
  void schemaGateNeverLowersConfidence() {
    assertEquals(0.5, CandidateMerger.gateSchema(0.2));
    assertEquals(0.9, CandidateMerger.gateSchema(0.9));
  }
}
