package io.cmdschema.impl;

/**
 * One normalized help line with its position in the normalized output.
 *
 * @param index zero-based line index; continuation lines keep the index of the line they joined
 * @param text right-trimmed line text
 */
public record IndexedLine(int index, String text) {

  public String trimmed() {
    return text.trim();
  }

  public boolean isBlank() {
    return text.isBlank();
  }

  public boolean isIndented() {
    return text.startsWith(" ") || text.startsWith("\t");
  }
}
