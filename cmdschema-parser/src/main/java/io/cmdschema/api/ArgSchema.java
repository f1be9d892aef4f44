package io.cmdschema.api;

import java.util.Objects;

/** A positional argument. */
public record ArgSchema(
    String name, ValueType valueType, boolean required, boolean multiple, String description) {

  public ArgSchema {
    Objects.requireNonNull(name, "name must not be null");
    Objects.requireNonNull(valueType, "valueType must not be null");
  }

  public static ArgSchema required(String name, ValueType valueType) {
    return new ArgSchema(name, valueType, true, false, null);
  }

  public static ArgSchema optional(String name, ValueType valueType) {
    return new ArgSchema(name, valueType, false, false, null);
  }

  public ArgSchema withMultiple(boolean value) {
    return new ArgSchema(name, valueType, required, value, description);
  }

  public ArgSchema withDescription(String value) {
    return new ArgSchema(name, valueType, required, multiple, value);
  }
}
