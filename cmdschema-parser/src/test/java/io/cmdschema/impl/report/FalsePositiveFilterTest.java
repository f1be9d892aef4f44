package io.cmdschema.impl.report;

import static org.junit.jupiter.api.Assertions.*;

import io.cmdschema.api.ArgSchema;
import io.cmdschema.api.SubcommandSchema;
import io.cmdschema.api.ValueType;
import io.cmdschema.impl.candidate.ArgCandidate;
import io.cmdschema.impl.candidate.SourceSpan;
import io.cmdschema.impl.candidate.SubcommandCandidate;
import io.cmdschema.impl.normalize.HelpNormalizer;
import java.util.List;
import org.junit.jupiter.api.Test;

class FalsePositiveFilterTest {

  private static SubcommandCandidate sub(String name) {
    return new SubcommandCandidate(SubcommandSchema.named(name), SourceSpan.single(0), "t", 0.9);
  }

  private static ArgCandidate arg(String name) {
    return new ArgCandidate(
        ArgSchema.required(name, ValueType.STRING), SourceSpan.single(0), "t", 0.9);
  }

  @Test
  void dropsPlaceholdersAndCountsNoiseRows() {
    FalsePositiveFilter.Result result =
        FalsePositiveFilter.apply(
            HelpNormalizer.toIndexedLines("export FOO=bar\n-v  verbose"),
            List.of(sub("COMMAND"), sub("build"), sub("Ctrl+X")),
            List.of(arg("options"), arg("path")));

    assertEquals(List.of("build"), result.subcommands().stream().map(c -> c.name()).toList());
    assertEquals(List.of("path"), result.args().stream().map(c -> c.name()).toList());
    assertEquals(4, result.hits());
  }

  @Test
  void cleanInputHasNoHits() {
    FalsePositiveFilter.Result result =
        FalsePositiveFilter.apply(
            HelpNormalizer.toIndexedLines("-v  verbose"), List.of(sub("run")), List.of());
    assertEquals(0, result.hits());
    assertEquals(1, result.subcommands().size());
  }

  @Test
  void placeholderArgNamesIgnoreCase() {
    assertTrue(FalsePositiveFilter.isPlaceholderArg("Usage"));
    assertTrue(FalsePositiveFilter.isPlaceholderArg("FILE"));
    assertFalse(FalsePositiveFilter.isPlaceholderArg("target"));
  }
}
