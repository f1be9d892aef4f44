package io.cmdschema.impl.strategy;

import io.cmdschema.impl.IndexedLine;
import io.cmdschema.impl.man.ManBundle;
import io.cmdschema.impl.text.SectionBuckets;
import io.cmdschema.impl.text.SectionScanner;
import io.cmdschema.impl.text.UsageScanner;
import io.cmdschema.impl.text.UsageText;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Read-only inputs shared by every strategy of one parse, plus a notes set strategies use to
 * record which fallbacks they took. One instance per parse; not thread-safe.
 */
public final class ParseContext {
  private final String command;
  private final List<IndexedLine> lines;
  private final SectionBuckets sections;
  private final UsageText usage;
  private final ManBundle man;
  private final boolean keybindingDocument;
  private final Set<String> notes = new LinkedHashSet<>();

  public ParseContext(
      String command,
      List<IndexedLine> lines,
      SectionBuckets sections,
      UsageText usage,
      ManBundle man,
      boolean keybindingDocument) {
    this.command = Objects.requireNonNull(command, "command must not be null");
    this.lines = List.copyOf(lines);
    this.sections = Objects.requireNonNull(sections, "sections must not be null");
    this.usage = Objects.requireNonNull(usage, "usage must not be null");
    this.man = Objects.requireNonNull(man, "man must not be null");
    this.keybindingDocument = keybindingDocument;
  }

  /** Builds a context for lines that are not a manual page. */
  public static ParseContext of(String command, List<IndexedLine> lines) {
    return new ParseContext(
        command,
        lines,
        SectionScanner.identify(lines),
        UsageScanner.collect(lines),
        ManBundle.EMPTY,
        false);
  }

  public String command() {
    return command;
  }

  public List<IndexedLine> lines() {
    return lines;
  }

  public SectionBuckets sections() {
    return sections;
  }

  public UsageText usage() {
    return usage;
  }

  /** Manual page candidates, computed once before any strategy runs. */
  public ManBundle man() {
    return man;
  }

  public boolean keybindingDocument() {
    return keybindingDocument;
  }

  public void note(String value) {
    notes.add(value);
  }

  public Set<String> notes() {
    return Collections.unmodifiableSet(notes);
  }
}
