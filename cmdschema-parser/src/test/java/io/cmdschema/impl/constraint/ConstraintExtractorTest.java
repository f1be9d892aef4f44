package io.cmdschema.impl.constraint;

import static org.junit.jupiter.api.Assertions.*;

import io.cmdschema.api.FlagSchema;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class ConstraintExtractorTest {

  @Test
  void readsRequiresAndConflictsFromOneDescription() {
    ConstraintExtractor.Relationships found =
        ConstraintExtractor.extract(
            "Requires --verbose, conflicts with --quiet", Set.of("--verbose", "--quiet", "-j"));

    // Both phrases are present, so both lists see every known reference in the text.
    assertEquals(List.of("--verbose", "--quiet"), found.requires());
    assertEquals(List.of("--verbose", "--quiet"), found.conflictsWith());
  }

  @Test
  void unknownReferencesAreIgnored() {
    ConstraintExtractor.Relationships found =
        ConstraintExtractor.extract("Cannot be used with --force", Set.of("--verbose"));
    assertTrue(found.isEmpty());
  }

  @Test
  void descriptionsWithoutPhrasesYieldNothing() {
    assertTrue(
        ConstraintExtractor.extract("Print --verbose output", Set.of("--verbose")).isEmpty());
  }

  @Test
  void applyLinksSiblingsAndSkipsSelf() {
    FlagSchema json =
        FlagSchema.bool(null, "--json")
            .withDescription("Mutually exclusive with --yaml and --json");
    FlagSchema yaml = FlagSchema.bool(null, "--yaml");
    FlagSchema output =
        FlagSchema.bool("-o", "--output").withDescription("Only with --json, requires -o");

    List<FlagSchema> linked = ConstraintExtractor.apply(List.of(json, yaml, output));

    assertEquals(List.of("--yaml"), linked.get(0).conflictsWith());
    assertTrue(linked.get(0).requires().isEmpty());
    assertSame(yaml, linked.get(1));
    assertEquals(List.of("--json"), linked.get(2).requires());
  }
}
