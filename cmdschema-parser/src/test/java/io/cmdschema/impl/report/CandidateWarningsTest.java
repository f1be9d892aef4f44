package io.cmdschema.impl.report;

import static org.junit.jupiter.api.Assertions.*;

import io.cmdschema.api.SubcommandSchema;
import io.cmdschema.impl.candidate.SourceSpan;
import io.cmdschema.impl.candidate.SubcommandCandidate;
import io.cmdschema.impl.merge.MergeOutcome;
import java.util.List;
import org.junit.jupiter.api.Test;

class CandidateWarningsTest {

  private static final MergeOutcome<SubcommandSchema, SubcommandCandidate> NONE =
      new MergeOutcome<>(List.of(), List.of(), List.of());

  @Test
  void quietWhenNothingWasDropped() {
    assertTrue(CandidateWarnings.summarize(NONE, NONE, NONE, 0).isEmpty());
  }

  @Test
  void summarizesMediumDiscardedAndFilterHits() {
    SubcommandCandidate c =
        new SubcommandCandidate(SubcommandSchema.named("x"), SourceSpan.single(0), "t", 0.6);
    MergeOutcome<SubcommandSchema, SubcommandCandidate> subs =
        new MergeOutcome<>(List.of(), List.of(c), List.of(c, c));

    List<String> warnings = CandidateWarnings.summarize(NONE, subs, NONE, 3);

    assertEquals(
        List.of(
            "Medium-confidence findings kept in diagnostics: 0 flags, 1 subcommands, 0 args",
            "Discarded low-confidence findings: 0 flags, 2 subcommands, 0 args",
            "False-positive filters matched 3 rows"),
        warnings);
  }
}
