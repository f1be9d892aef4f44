package io.cmdschema.impl.text;

import static org.junit.jupiter.api.Assertions.*;

import io.cmdschema.impl.IndexedLine;
import io.cmdschema.impl.normalize.HelpNormalizer;
import java.util.List;
import org.junit.jupiter.api.Test;

class SectionScannerTest {

  @Test
  void bucketsLinesUnderTheirHeaders() {
    List<IndexedLine> lines =
        HelpNormalizer.toIndexedLines(
            String.join(
                "\n",
                "Commands:",
                "  get    Display resources",
                "",
                "Global Options:",
                "  -v  verbose",
                "Environment:",
                "  FOO  something"));

    SectionBuckets buckets = SectionScanner.identify(lines);

    assertEquals(
        List.of(new IndexedLine(1, "get    Display resources")),
        buckets.get(SectionKind.SUBCOMMANDS));
    assertEquals(List.of(new IndexedLine(4, "-v  verbose")), buckets.get(SectionKind.OPTIONS));
    assertFalse(buckets.has(SectionKind.FLAGS));
    assertFalse(buckets.has(SectionKind.ARGUMENTS));
    assertEquals(List.of(0, 3), List.copyOf(buckets.headerIndices()));
  }

  @Test
  void detectsHeaderKinds() {
    assertEquals(SectionKind.SUBCOMMANDS, SectionScanner.detectHeader("Available Commands:").get());
    assertEquals(SectionKind.SUBCOMMANDS, SectionScanner.detectHeader("Workflow tasks:").get());
    assertEquals(SectionKind.FLAGS, SectionScanner.detectHeader("Global Flags:").get());
    assertEquals(SectionKind.OPTIONS, SectionScanner.detectHeader("OPTIONS").get());
    assertEquals(
        SectionKind.ARGUMENTS, SectionScanner.detectHeader("positional arguments:").get());
    assertTrue(SectionScanner.detectHeader("Environment variables:").isEmpty());
    assertTrue(SectionScanner.detectHeader("Examples").isEmpty());
  }
}
