package io.cmdschema.impl.text;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntSet;

/**
 * Usage synopsis text joined from several lines. Each appended segment remembers the line it came
 * from so that a match offset can be traced back to its source line.
 */
public final class UsageText {
  private final StringBuilder text = new StringBuilder();
  private final IntList segmentStarts = new IntArrayList();
  private final IntList segmentLines = new IntArrayList();
  private final IntSet lines = new IntOpenHashSet();

  void append(int lineIndex, String payload) {
    segmentStarts.add(text.length());
    segmentLines.add(lineIndex);
    lines.add(lineIndex);
    text.append(payload).append(' ');
  }

  public String text() {
    return text.toString();
  }

  public boolean isEmpty() {
    return text.length() == 0;
  }

  /** Indices of every line that contributed to the synopsis. */
  public IntSet lines() {
    return lines;
  }

  /**
   * Maps an offset in {@link #text()} to the index of the line it was taken from.
   *
   * @param offset character offset
   * @return source line index, or {@code -1} when the text is empty
   */
  public int lineAt(int offset) {
    int lo = 0;
    int hi = segmentStarts.size() - 1;
    int found = -1;
    while (lo <= hi) {
      int mid = (lo + hi) >>> 1;
      if (segmentStarts.getInt(mid) <= offset) {
        found = mid;
        lo = mid + 1;
      } else {
        hi = mid - 1;
      }
    }
    return found < 0 ? -1 : segmentLines.getInt(found);
  }
}
