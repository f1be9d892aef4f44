package io.cmdschema.impl.candidate;

/**
 * Inclusive line range in the normalized input that a candidate was read from.
 *
 * @param start first line index, or -1 when unknown
 * @param end last line index, or -1 when unknown
 */
public record SourceSpan(int start, int end) {

  public static final SourceSpan UNKNOWN = new SourceSpan(-1, -1);

  public SourceSpan {
    if (start > end) {
      throw new IllegalArgumentException("span start " + start + " is after end " + end);
    }
  }

  public static SourceSpan single(int line) {
    return new SourceSpan(line, line);
  }

  public static SourceSpan of(int start, int end) {
    return new SourceSpan(start, end);
  }

  public boolean isUnknown() {
    return start < 0;
  }

  public boolean contains(int line) {
    return !isUnknown() && line >= start && line <= end;
  }
}
