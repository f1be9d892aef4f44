package io.cmdschema.impl.text;

import io.cmdschema.impl.IndexedLine;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/** Lines grouped under the explicit section header that precedes them. */
public final class SectionBuckets {
  private final IntList headerIndices = new IntArrayList();
  private final Map<SectionKind, List<IndexedLine>> entries = new EnumMap<>(SectionKind.class);

  public SectionBuckets() {
    for (SectionKind kind : SectionKind.values()) {
      entries.put(kind, new ArrayList<>());
    }
  }

  void addHeader(int index) {
    headerIndices.add(index);
  }

  void add(SectionKind kind, IndexedLine line) {
    entries.get(kind).add(line);
  }

  /** Indices of the header lines themselves. */
  public IntList headerIndices() {
    return headerIndices;
  }

  /** Trimmed body lines of all sections of the given kind, in input order. */
  public List<IndexedLine> get(SectionKind kind) {
    return entries.get(kind);
  }

  public boolean has(SectionKind kind) {
    return !entries.get(kind).isEmpty();
  }
}
