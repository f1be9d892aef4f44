package io.cmdschema.impl.man.rendered;

import io.cmdschema.impl.IndexedLine;
import java.util.List;

/**
 * A canonical section of a rendered manual page.
 *
 * @param name canonical upper-case name, e.g. {@code GLOBAL OPTIONS}
 * @param headerLine index of the header line
 * @param lines body lines after the header, in order
 */
record RenderedSection(String name, int headerLine, List<IndexedLine> lines) {

  RenderedSection {
    lines = List.copyOf(lines);
  }

  boolean hasOptionLikeLines() {
    for (IndexedLine line : lines) {
      if (line.text().stripLeading().startsWith("-")) {
        return true;
      }
    }
    return false;
  }
}
