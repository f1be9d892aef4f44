package io.cmdschema.impl.report;

import static org.junit.jupiter.api.Assertions.*;

import io.cmdschema.api.FlagSchema;
import io.cmdschema.api.ParseDiagnostics;
import io.cmdschema.impl.IndexedLine;
import io.cmdschema.impl.candidate.FlagCandidate;
import io.cmdschema.impl.candidate.SourceSpan;
import io.cmdschema.impl.normalize.HelpNormalizer;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class CoverageTrackerTest {

  private final List<IndexedLine> lines =
      HelpNormalizer.toIndexedLines("-v  verbose\n\n-q  quiet\n--all  everything");

  @Test
  void countsRecognizedRelevantLines() {
    CoverageTracker tracker = new CoverageTracker();
    tracker.markSpans(
        List.of(
            new FlagCandidate(FlagSchema.bool("-v", null), SourceSpan.single(0), "t", 0.9),
            new FlagCandidate(FlagSchema.bool("-q", null), SourceSpan.UNKNOWN, "t", 0.9)));
    tracker.markLine(2);

    ParseDiagnostics diagnostics = tracker.build(lines, 20);

    assertEquals(3, diagnostics.relevantLines());
    assertEquals(2, diagnostics.recognizedLines());
    assertEquals(List.of("--all  everything"), diagnostics.unresolvedLines());
    assertEquals(2.0 / 3.0, diagnostics.coverage(), 1e-9);
  }

  @Test
  void unresolvedSamplesAreCapped() {
    ParseDiagnostics diagnostics = new CoverageTracker().build(lines, 1);

    assertEquals(0, diagnostics.recognizedLines());
    assertEquals(List.of("-v  verbose"), diagnostics.unresolvedLines());
    assertEquals(0.0, diagnostics.coverage());
  }

  @Test
  void negativeAndBlankLinesAreIgnored() {
    CoverageTracker tracker = new CoverageTracker();
    tracker.markLines(IntArrayList.wrap(new int[] {-1, 1, 3}));

    ParseDiagnostics diagnostics = tracker.build(lines, 20);

    assertFalse(tracker.recognized().contains(-1));
    assertEquals(1, diagnostics.recognizedLines());
  }

  @Test
  void noRelevantLinesMeansZeroCoverage() {
    ParseDiagnostics diagnostics =
        new CoverageTracker().build(HelpNormalizer.toIndexedLines("\n"), 20);
    assertEquals(0, diagnostics.relevantLines());
    assertEquals(0.0, diagnostics.coverage());
  }

  @Test
  void confidenceTags() {
    assertEquals("confidence:auto-accept", CoverageTracker.confidenceTag(0.85));
    assertEquals("confidence:draft", CoverageTracker.confidenceTag(0.7));
    assertEquals("confidence:reject", CoverageTracker.confidenceTag(0.6));
  }
}
