package io.cmdschema.api;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.Test;

class SchemaValidatorTest {

  private static CommandSchema schema(
      String command, List<FlagSchema> flags, List<SubcommandSchema> subs) {
    return CommandSchema.empty(command, SchemaSource.HELP_COMMAND)
        .withEntities(flags, subs, List.of());
  }

  private static List<ValidationError.Kind> kinds(CommandSchema schema) {
    return SchemaValidator.validate(schema).stream().map(ValidationError::kind).toList();
  }

  @Test
  void wellFormedSchemaHasNoErrors() {
    CommandSchema ok =
        schema(
            "git",
            List.of(FlagSchema.bool("-v", "--verbose")),
            List.of(SubcommandSchema.named("add"), SubcommandSchema.named("commit")));
    assertTrue(SchemaValidator.validate(ok).isEmpty());
  }

  @Test
  void blankCommandName() {
    assertEquals(
        List.of(ValidationError.Kind.EMPTY_COMMAND_NAME), kinds(schema(" ", List.of(), List.of())));
  }

  @Test
  void malformedFlagNames() {
    assertEquals(
        List.of(ValidationError.Kind.INVALID_SHORT_FLAG),
        kinds(schema("x", List.of(FlagSchema.bool("--v", null)), List.of())));
    assertEquals(
        List.of(ValidationError.Kind.INVALID_LONG_FLAG),
        kinds(schema("x", List.of(FlagSchema.bool(null, "-verbose")), List.of())));
    assertEquals(
        List.of(ValidationError.Kind.MISSING_FLAG_NAME),
        kinds(schema("x", List.of(FlagSchema.bool(null, null)), List.of())));
  }

  @Test
  void flagNameBodiesMustBeWellShaped() {
    assertEquals(
        List.of(ValidationError.Kind.INVALID_LONG_FLAG),
        kinds(schema("git", List.of(FlagSchema.bool(null, "--exec-path[")), List.of())));
    assertEquals(
        List.of(ValidationError.Kind.INVALID_LONG_FLAG),
        kinds(schema("x", List.of(FlagSchema.bool(null, "--2fa")), List.of())));
    assertEquals(
        List.of(ValidationError.Kind.INVALID_SHORT_FLAG),
        kinds(schema("x", List.of(FlagSchema.bool("-a/", null)), List.of())));
    assertTrue(
        kinds(schema("x", List.of(FlagSchema.bool("-?", "--dry_run.v2")), List.of())).isEmpty());
  }

  @Test
  void duplicatesInOneScope() {
    assertEquals(
        List.of(ValidationError.Kind.DUPLICATE_FLAG),
        kinds(
            schema(
                "x",
                List.of(FlagSchema.bool(null, "--all"), FlagSchema.bool("-a", "--all")),
                List.of())));
    assertEquals(
        List.of(ValidationError.Kind.DUPLICATE_SUBCOMMAND),
        kinds(
            schema(
                "x",
                List.of(),
                List.of(SubcommandSchema.named("run"), SubcommandSchema.named("run")))));
  }

  @Test
  void sameFlagInDifferentScopesIsFine() {
    SubcommandSchema run =
        SubcommandSchema.named("run")
            .withChildren(List.of(FlagSchema.bool("-v", null)), List.of(), List.of());
    assertTrue(
        SchemaValidator.validate(schema("x", List.of(FlagSchema.bool("-v", null)), List.of(run)))
            .isEmpty());
  }

  @Test
  void nameRepeatedAlongPathIsACycle() {
    SubcommandSchema inner =
        SubcommandSchema.named("remote")
            .withChildren(List.of(), List.of(), List.of(SubcommandSchema.named("git")));
    List<ValidationError> errors =
        SchemaValidator.validate(schema("git", List.of(), List.of(inner)));

    assertEquals(1, errors.size());
    assertEquals(ValidationError.Kind.SUBCOMMAND_CYCLE, errors.get(0).kind());
    assertEquals("git remote git", errors.get(0).subject());
  }
}
