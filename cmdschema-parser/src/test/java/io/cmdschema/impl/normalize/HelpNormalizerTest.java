package io.cmdschema.impl.normalize;

import static org.junit.jupiter.api.Assertions.*;

import io.cmdschema.impl.IndexedLine;
import java.util.List;
import org.junit.jupiter.api.Test;

class HelpNormalizerTest {

  @Test
  void stripsAnsiEscapes() {
    assertEquals(
        "-v, --verbose  be loud",
        HelpNormalizer.normalize("\u001b[1m-v\u001b[0m, --verbose  be loud\u001b[0m"));
  }

  @Test
  void stripsOverstrikeBold() {
    assertEquals("NAME", HelpNormalizer.normalize("N\bNA\bAM\bME\bE"));
  }

  @Test
  void unifiesLineEndingsAndDropsTrailingBlankLines() {
    assertEquals("a\n\nb", HelpNormalizer.normalize("a\r\n\r\nb  \r\n\r\n"));
  }

  @Test
  void joinsWrappedFlagDescriptions() {
    String raw =
        "  -v, --verbose   print more\n"
            + "                    and more\n"
            + "  -q              quiet\n";

    assertEquals(
        "  -v, --verbose   print more and more\n  -q              quiet",
        HelpNormalizer.normalize(raw));
  }

  @Test
  void neverJoinsOntoHeaders() {
    String raw = "Options:\n  -v  verbose\n";
    assertEquals("Options:\n  -v  verbose", HelpNormalizer.normalize(raw));
  }

  @Test
  void indexesLines() {
    List<IndexedLine> lines = HelpNormalizer.normalizeLines("one\ntwo\n");
    assertEquals(List.of(new IndexedLine(0, "one"), new IndexedLine(1, "two")), lines);
  }

  @Test
  void emptyInputStaysEmpty() {
    assertEquals("", HelpNormalizer.normalize(""));
    assertTrue(HelpNormalizer.normalizeLines("\n\n").isEmpty());
  }
}
