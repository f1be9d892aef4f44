package io.cmdschema.api;

import java.util.List;

/**
 * Line accounting for one parse.
 *
 * @param relevantLines number of lines that look like part of a help structure
 * @param recognizedLines number of relevant lines attributed to an extracted entity
 * @param unresolvedLines sample of relevant lines nothing was extracted from
 * @param coverage {@code recognizedLines / relevantLines}, or 0 when nothing is relevant
 */
public record ParseDiagnostics(
    int relevantLines, int recognizedLines, List<String> unresolvedLines, double coverage) {

  public static final ParseDiagnostics EMPTY = new ParseDiagnostics(0, 0, List.of(), 0.0);

  public ParseDiagnostics {
    unresolvedLines = unresolvedLines == null ? List.of() : List.copyOf(unresolvedLines);
  }
}
