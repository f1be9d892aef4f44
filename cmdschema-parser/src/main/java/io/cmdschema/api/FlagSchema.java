package io.cmdschema.api;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A command-line flag.
 *
 * <p>At least one of {@code shortName} ({@code -x}) or {@code longName} ({@code --name}) is set.
 * {@code requires} and {@code conflictsWith} hold canonical identifiers of sibling flags.
 *
 * @param shortName short form including its dash, or {@code null}
 * @param longName long form including its dashes, or {@code null}
 * @param valueType type of the flag value; {@link ValueType#BOOL} for switches
 * @param takesValue whether the flag consumes a value
 * @param multiple whether the flag may be repeated
 * @param description human-readable description, or {@code null}
 * @param requires identifiers of flags this flag requires
 * @param conflictsWith identifiers of flags this flag cannot be combined with
 */
public record FlagSchema(
    String shortName,
    String longName,
    ValueType valueType,
    boolean takesValue,
    boolean multiple,
    String description,
    List<String> requires,
    List<String> conflictsWith) {

  public FlagSchema {
    Objects.requireNonNull(valueType, "valueType must not be null");
    requires = requires == null ? List.of() : List.copyOf(requires);
    conflictsWith = conflictsWith == null ? List.of() : List.copyOf(conflictsWith);
  }

  /** Creates a boolean switch. */
  public static FlagSchema bool(String shortName, String longName) {
    return new FlagSchema(shortName, longName, ValueType.BOOL, false, false, null, null, null);
  }

  /** Creates a value-taking flag. */
  public static FlagSchema withValue(String shortName, String longName, ValueType valueType) {
    return new FlagSchema(shortName, longName, valueType, true, false, null, null, null);
  }

  /** Long name if present, otherwise short name, otherwise the empty string. */
  public String canonicalName() {
    if (longName != null) {
      return longName;
    }
    return shortName != null ? shortName : "";
  }

  /** All identifiers of this flag: short first, then long. */
  public List<String> identifiers() {
    List<String> ids = new ArrayList<>(2);
    if (shortName != null) {
      ids.add(shortName);
    }
    if (longName != null) {
      ids.add(longName);
    }
    return ids;
  }

  public boolean hasIdentifier(String id) {
    return id.equals(shortName) || id.equals(longName);
  }

  public FlagSchema withDescription(String value) {
    return new FlagSchema(
        shortName, longName, valueType, takesValue, multiple, value, requires, conflictsWith);
  }

  public FlagSchema withValueType(ValueType type, boolean value) {
    return new FlagSchema(
        shortName, longName, type, value, multiple, description, requires, conflictsWith);
  }

  public FlagSchema withMultiple(boolean value) {
    return new FlagSchema(
        shortName, longName, valueType, takesValue, value, description, requires, conflictsWith);
  }

  public FlagSchema withNames(String shortValue, String longValue) {
    return new FlagSchema(
        shortValue,
        longValue,
        valueType,
        takesValue,
        multiple,
        description,
        requires,
        conflictsWith);
  }

  public FlagSchema withRelationships(List<String> requiresIds, List<String> conflictIds) {
    return new FlagSchema(
        shortName,
        longName,
        valueType,
        takesValue,
        multiple,
        description,
        requiresIds,
        conflictIds);
  }
}
