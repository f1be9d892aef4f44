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
import org.junit.jupiter.api.Test;

class ConfidenceScorerTest {
  private static final double EPS = 1e-9;

  private static FlagCandidate flag(FlagSchema flag, double confidence) {
    return new FlagCandidate(flag, SourceSpan.single(0), "test", confidence);
  }

  @Test
  void valueTakingFlagGetsBonus() {
    double score =
        ConfidenceScorer.score(flag(FlagSchema.withValue(null, "--out", ValueType.FILE), 0.7));
    assertEquals(0.75, score, EPS);
  }

  @Test
  void assignmentInDescriptionGetsBonus() {
    FlagSchema f = FlagSchema.bool(null, "--mode").withDescription("use --mode=fast");
    assertEquals(0.8, ConfidenceScorer.score(flag(f, 0.7)), EPS);
  }

  @Test
  void placeholderFlagIsPenalized() {
    assertEquals(0.4, ConfidenceScorer.score(flag(FlagSchema.bool(null, "--file"), 0.9)), EPS);
  }

  @Test
  void placeholderAndKeybindingSubcommandsArePenalized() {
    SubcommandCandidate placeholder =
        new SubcommandCandidate(SubcommandSchema.named("COMMAND"), SourceSpan.single(0), "t", 0.9);
    SubcommandCandidate keys =
        new SubcommandCandidate(SubcommandSchema.named("Ctrl+C"), SourceSpan.single(0), "t", 0.9);
    SubcommandCandidate plain =
        new SubcommandCandidate(SubcommandSchema.named("build"), SourceSpan.single(0), "t", 0.9);

    assertEquals(0.2, ConfidenceScorer.score(placeholder), EPS);
    assertEquals(0.4, ConfidenceScorer.score(keys), EPS);
    assertEquals(0.9, ConfidenceScorer.score(plain), EPS);
  }

  @Test
  void placeholderArgIsPenalized() {
    ArgCandidate arg =
        new ArgCandidate(
            ArgSchema.required("FILE", ValueType.FILE), SourceSpan.single(0), "t", 0.8);
    assertEquals(0.35, ConfidenceScorer.score(arg), EPS);
  }

  @Test
  void scoresAreClamped() {
    FlagSchema f =
        FlagSchema.withValue(null, "--x", ValueType.STRING).withDescription("--x=1 sets it");
    assertEquals(1.0, ConfidenceScorer.score(flag(f, 1.0)), EPS);
    assertEquals(0.0, ConfidenceScorer.clamp(Double.NaN));
    assertEquals(0.0, ConfidenceScorer.clamp(-3));
  }
}
