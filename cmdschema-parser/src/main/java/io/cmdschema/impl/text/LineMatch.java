package io.cmdschema.impl.text;

/**
 * A value extracted from a range of normalized lines, usually a single line.
 *
 * @param value the extracted value
 * @param start index of the first line it depends on, such as an introducing header
 * @param end index of the line the value itself was read from
 */
public record LineMatch<T>(T value, int start, int end) {

  public LineMatch(T value, int line) {
    this(value, line, line);
  }

  public <R> LineMatch<R> withValue(R other) {
    return new LineMatch<>(other, start, end);
  }
}
