package io.cmdschema.api;

import java.util.List;
import java.util.Objects;

/**
 * Structured description of a command line: its global flags, positional arguments and
 * subcommand tree.
 *
 * <p>Instances are immutable. Sibling collections are sorted by canonical name once a schema leaves
 * the parser.
 *
 * @param schemaVersion contract version of this shape, see {@link #SCHEMA_CONTRACT_VERSION}
 * @param command the command name the schema describes
 * @param version version string found in the help banner, or {@code null}
 * @param description one-line description, or {@code null}
 * @param source where the schema came from
 * @param confidence overall extraction confidence in [0, 1]
 */
public record CommandSchema(
    String schemaVersion,
    String command,
    String version,
    String description,
    SchemaSource source,
    double confidence,
    List<FlagSchema> globalFlags,
    List<SubcommandSchema> subcommands,
    List<ArgSchema> positional) {

  /** Version of the schema contract produced by this library. */
  public static final String SCHEMA_CONTRACT_VERSION = "1.0.0";

  public CommandSchema {
    Objects.requireNonNull(schemaVersion, "schemaVersion must not be null");
    Objects.requireNonNull(command, "command must not be null");
    Objects.requireNonNull(source, "source must not be null");
    confidence = Math.max(0.0, Math.min(1.0, confidence));
    globalFlags = globalFlags == null ? List.of() : List.copyOf(globalFlags);
    subcommands = subcommands == null ? List.of() : List.copyOf(subcommands);
    positional = positional == null ? List.of() : List.copyOf(positional);
  }

  /** An empty schema for {@code command} stamped with the current contract version. */
  public static CommandSchema empty(String command, SchemaSource source) {
    return new CommandSchema(
        SCHEMA_CONTRACT_VERSION, command, null, null, source, 0.0, null, null, null);
  }

  /** Whether no flag, subcommand or positional argument was recognised. */
  public boolean isEmpty() {
    return globalFlags.isEmpty() && subcommands.isEmpty() && positional.isEmpty();
  }

  public CommandSchema withConfidence(double value) {
    return new CommandSchema(
        schemaVersion, command, version, description, source, value, globalFlags, subcommands,
        positional);
  }

  public CommandSchema withMetadata(String versionValue, String descriptionValue) {
    return new CommandSchema(
        schemaVersion, command, versionValue, descriptionValue, source, confidence, globalFlags,
        subcommands, positional);
  }

  public CommandSchema withEntities(
      List<FlagSchema> flags, List<SubcommandSchema> subs, List<ArgSchema> args) {
    return new CommandSchema(
        schemaVersion, command, version, description, source, confidence, flags, subs, args);
  }
}
