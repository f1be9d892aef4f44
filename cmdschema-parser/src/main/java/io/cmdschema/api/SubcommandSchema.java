package io.cmdschema.api;

import java.util.List;
import java.util.Objects;

/**
 * A subcommand node. Children are owned by value, so a schema is always a tree; the parser
 * additionally rejects names that would form a cycle along a path.
 */
public record SubcommandSchema(
    String name,
    String description,
    List<String> aliases,
    List<FlagSchema> flags,
    List<ArgSchema> positional,
    List<SubcommandSchema> subcommands) {

  public SubcommandSchema {
    Objects.requireNonNull(name, "name must not be null");
    aliases = aliases == null ? List.of() : List.copyOf(aliases);
    flags = flags == null ? List.of() : List.copyOf(flags);
    positional = positional == null ? List.of() : List.copyOf(positional);
    subcommands = subcommands == null ? List.of() : List.copyOf(subcommands);
  }

  public static SubcommandSchema named(String name) {
    return new SubcommandSchema(name, null, null, null, null, null);
  }

  public SubcommandSchema withDescription(String value) {
    return new SubcommandSchema(name, value, aliases, flags, positional, subcommands);
  }

  public SubcommandSchema withAliases(List<String> value) {
    return new SubcommandSchema(name, description, value, flags, positional, subcommands);
  }

  public SubcommandSchema withChildren(
      List<FlagSchema> flagList, List<ArgSchema> argList, List<SubcommandSchema> subList) {
    return new SubcommandSchema(name, description, aliases, flagList, argList, subList);
  }
}
