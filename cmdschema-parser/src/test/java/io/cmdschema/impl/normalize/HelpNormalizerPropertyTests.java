package io.cmdschema.impl.normalize;

import static org.junit.jupiter.api.Assertions.*;

import net.jqwik.api.*;

@PropertyDefaults(tries = 200, shrinking = ShrinkingMode.FULL)
class HelpNormalizerPropertyTests {

  @Property
  void normalizingIsIdempotent(@ForAll("helpish") String raw) {
    String once = HelpNormalizer.normalize(raw);
    assertEquals(once, HelpNormalizer.normalize(once));
  }

  @Property
  void outputHasNoCarriageReturnsOrTrailingWhitespace(@ForAll("helpish") String raw) {
    String normalized = HelpNormalizer.normalize(raw);
    assertFalse(normalized.contains("\r"));
    for (String line : normalized.split("\n", -1)) {
      assertEquals(line.stripTrailing(), line);
    }
    assertFalse(normalized.endsWith("\n"));
  }

  @Provide
  Arbitrary<String> helpish() {
    return Arbitraries.strings().withChars(" -abcXYZ:=[]<>,.\t\n\r").ofMaxLength(120);
  }
}
