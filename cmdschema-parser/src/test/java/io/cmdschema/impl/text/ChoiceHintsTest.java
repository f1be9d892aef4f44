package io.cmdschema.impl.text;

import static org.junit.jupiter.api.Assertions.*;

import io.cmdschema.api.FlagSchema;
import io.cmdschema.api.ValueType;
import io.cmdschema.impl.IndexedLine;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntSet;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class ChoiceHintsTest {

  @Test
  void validArgumentsListSetsChoices() {
    IntSet recognized = new IntOpenHashSet();
    List<FlagSchema> flags =
        ChoiceHints.apply(
            lines("Valid arguments for -o:", "json, yaml, wide"),
            List.of(FlagSchema.bool("-o", "--output")),
            recognized);

    assertEquals(1, flags.size());
    assertTrue(flags.get(0).takesValue());
    assertEquals(ValueType.choice(List.of("json", "yaml", "wide")), flags.get(0).valueType());
    assertTrue(recognized.contains(0));
    assertTrue(recognized.contains(1));
  }

  @Test
  void listForUnknownFlagAddsIt() {
    List<FlagSchema> flags =
        ChoiceHints.apply(
            lines("Valid arguments for -x:", "fast, slow"), List.of(), new IntOpenHashSet());

    assertEquals(1, flags.size());
    assertEquals("-x", flags.get(0).shortName());
    assertEquals("Valid arguments for -x", flags.get(0).description());
    assertEquals(ValueType.choice(List.of("fast", "slow")), flags.get(0).valueType());
  }

  @Test
  void placeholderTableResolvesOwningFlag() {
    IntSet recognized = new IntOpenHashSet();
    FlagSchema color =
        FlagSchema.withValue(null, "--color", ValueType.STRING).withDescription("when to colorize");

    List<FlagSchema> flags =
        ChoiceHints.apply(
            lines(
                "--color=WHEN  when to colorize",
                "",
                "WHEN is one of the following:",
                "  always   always colorize",
                "  never    never colorize",
                "  auto     only on a terminal"),
            List.of(color),
            recognized);

    assertEquals(
        ValueType.choice(List.of("always", "never", "auto")), flags.get(0).valueType());
    for (int i = 2; i <= 5; i++) {
      assertTrue(recognized.contains(i), "line " + i);
    }
  }

  @Test
  void genericHeaderUsesFlagNamedAbove() {
    List<FlagSchema> flags =
        ChoiceHints.apply(
            lines(
                "  --format FMT  output format",
                "      Possible values:",
                "        text   plain text",
                "        json   JSON document"),
            List.of(FlagSchema.withValue(null, "--format", ValueType.STRING)),
            new IntOpenHashSet());

    assertEquals(ValueType.choice(List.of("text", "json")), flags.get(0).valueType());
  }

  @Test
  void singleRowTablesAreIgnored() {
    FlagSchema format = FlagSchema.withValue(null, "--format", ValueType.STRING);

    List<FlagSchema> flags =
        ChoiceHints.apply(
            lines("Valid values for --format:", "  text   plain text"),
            List.of(format),
            new IntOpenHashSet());

    assertEquals(List.of(format), flags);
  }

  @Test
  void choiceTokensSkipNumbersAndPlaceholders() {
    assertEquals(List.of("fast", "slow"), ChoiceHints.parseChoiceTokens("fast, 42, FILE, slow"));
  }

  private static List<IndexedLine> lines(String... texts) {
    List<IndexedLine> out = new ArrayList<>();
    for (int i = 0; i < texts.length; i++) {
      out.add(new IndexedLine(i, texts[i]));
    }
    return out;
  }
}
