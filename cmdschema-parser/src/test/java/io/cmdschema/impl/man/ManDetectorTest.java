package io.cmdschema.impl.man;

import static org.junit.jupiter.api.Assertions.*;

import io.cmdschema.impl.IndexedLine;
import io.cmdschema.impl.normalize.HelpNormalizer;
import java.util.Optional;
import java.util.List;
import org.junit.jupiter.api.Test;

class ManDetectorTest {

  private static List<IndexedLine> lines(String... text) {
    return HelpNormalizer.toIndexedLines(String.join("\n", text));
  }

  @Test
  void classicManSource() {
    List<IndexedLine> source =
        lines(".TH GIT-REBASE 1", ".SH NAME", ".TP", ".B --continue", "Restart.");

    assertTrue(ManDetector.isRawRoff(source));
    assertEquals(Optional.of(ManFormat.MAN), ManDetector.detect(source));
    assertEquals(0.95, ManDetector.confidence(ManFormat.MAN, source));
  }

  @Test
  void twoMacroLinesGiveLowerRoffConfidence() {
    List<IndexedLine> source = lines(".TH LS 1", "text", ".SH NAME", "more text");
    assertEquals(Optional.of(ManFormat.MAN), ManDetector.detect(source));
    assertEquals(0.90, ManDetector.confidence(ManFormat.MAN, source));
  }

  @Test
  void mdocSource() {
    List<IndexedLine> source = lines(".Dd March 1, 2024", ".Dt LS 1", ".Os", ".Sh NAME");
    assertEquals(Optional.of(ManFormat.MDOC), ManDetector.detect(source));
  }

  @Test
  void mixedDialectsFollowTheTitleMacro() {
    assertEquals(
        Optional.of(ManFormat.MDOC),
        ManDetector.detect(lines(".TH X 1", ".Dt X 1", ".SH NAME", ".Sh OPTIONS")));
    assertEquals(
        Optional.of(ManFormat.MAN),
        ManDetector.detect(lines(".TH X 1", ".SH NAME", ".Sh OPTIONS")));
  }

  @Test
  void renderedPageBySectionHeaders() {
    List<IndexedLine> page =
        lines(
            "NAME",
            "       foo - frobnicate",
            "SYNOPSIS",
            "       foo [-v]",
            "OPTIONS",
            "       -v  verbose");

    assertFalse(ManDetector.isRawRoff(page));
    assertEquals(Optional.of(ManFormat.RENDERED), ManDetector.detect(page));
    assertEquals(0.85, ManDetector.confidence(ManFormat.RENDERED, page), 1e-9);
  }

  @Test
  void renderedPageByTitleBanner() {
    List<IndexedLine> page = lines("LS(1)    User Commands    LS(1)", "", "whatever");
    assertEquals(Optional.of(ManFormat.RENDERED), ManDetector.detect(page));
  }

  @Test
  void ordinaryHelpIsNotAManPage() {
    assertEquals(
        Optional.empty(),
        ManDetector.detect(lines("Usage: foo [OPTIONS]", "", "Options:", "  -v  verbose")));
  }

  @Test
  void titleLines() {
    assertTrue(ManDetector.looksLikeTitleLine("GIT-REBASE(1)  Git Manual  GIT-REBASE(1)"));
    assertTrue(ManDetector.looksLikeTitleLine("MY_CMD(3p)"));
    assertTrue(ManDetector.looksLikeTitleLine("G++.TOOL(1)"));
    assertFalse(ManDetector.looksLikeTitleLine("(1)"));
    assertFalse(ManDetector.looksLikeTitleLine("foo(bar baz)"));
    assertFalse(ManDetector.looksLikeTitleLine("call(x y)"));
  }

  @Test
  void lowerCaseCallsAreNotTitleBanners() {
    assertFalse(ManDetector.looksLikeTitleLine("ls(1)"));
    assertFalse(ManDetector.looksLikeTitleLine("print(x)  prints x"));
    assertFalse(ManDetector.looksLikeTitleLine("LS(X)"));
    assertEquals(
        Optional.empty(),
        ManDetector.detect(lines("main(args)   entry point", "", "run(task)    run a task")));
  }

  @Test
  void sectionNamesAreCanonicalized() {
    assertEquals(
        Optional.of("GLOBAL OPTIONS"), ManDetector.canonicalSectionName("  global   options: "));
    assertEquals(Optional.empty(), ManDetector.canonicalSectionName("Options for power users"));
  }
}
