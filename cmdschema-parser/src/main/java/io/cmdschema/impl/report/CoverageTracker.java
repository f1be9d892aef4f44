package io.cmdschema.impl.report;

import io.cmdschema.api.ParseDiagnostics;
import io.cmdschema.impl.IndexedLine;
import io.cmdschema.impl.candidate.Candidate;
import io.cmdschema.impl.candidate.SourceSpan;
import io.cmdschema.impl.text.LineShapes;
import it.unimi.dsi.fastutil.ints.IntCollection;
import it.unimi.dsi.fastutil.ints.IntIterator;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntSet;
import java.util.ArrayList;
import java.util.List;

/**
 * Tracks which input lines were attributed to a finding and turns the result into
 * {@link ParseDiagnostics}. Not thread-safe.
 */
public final class CoverageTracker {
  static final double AUTO_ACCEPT = 0.85;
  static final double DRAFT = 0.65;

  private final IntSet recognized = new IntOpenHashSet();

  public void markLine(int index) {
    if (index >= 0) {
      recognized.add(index);
    }
  }

  public void markLines(IntCollection indices) {
    for (IntIterator it = indices.iterator(); it.hasNext(); ) {
      markLine(it.nextInt());
    }
  }

  public void markSpans(List<? extends Candidate> candidates) {
    for (Candidate candidate : candidates) {
      SourceSpan span = candidate.span();
      if (span.isUnknown()) {
        continue;
      }
      for (int i = span.start(); i <= span.end(); i++) {
        recognized.add(i);
      }
    }
  }

  /** The live set of recognized indices, for collaborators that add to it directly. */
  public IntSet recognized() {
    return recognized;
  }

  /**
   * Counts relevant and recognized lines.
   *
   * @param lines normalized lines
   * @param maxSamples upper bound on the unresolved sample list
   */
  public ParseDiagnostics build(List<IndexedLine> lines, int maxSamples) {
    int relevant = 0;
    int hit = 0;
    List<String> unresolved = new ArrayList<>();
    for (IndexedLine line : lines) {
      if (!LineShapes.isRelevantLine(line.trimmed())) {
        continue;
      }
      relevant++;
      if (recognized.contains(line.index())) {
        hit++;
      } else if (unresolved.size() < maxSamples) {
        unresolved.add(line.text());
      }
    }
    double coverage = relevant == 0 ? 0.0 : (double) hit / relevant;
    return new ParseDiagnostics(relevant, hit, unresolved, coverage);
  }

  /** {@code confidence:auto-accept}, {@code confidence:draft} or {@code confidence:reject}. */
  public static String confidenceTag(double confidence) {
    if (confidence >= AUTO_ACCEPT) {
      return "confidence:auto-accept";
    }
    return confidence >= DRAFT ? "confidence:draft" : "confidence:reject";
  }
}
