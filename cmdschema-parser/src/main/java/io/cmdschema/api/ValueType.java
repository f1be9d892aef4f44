package io.cmdschema.api;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * The kind of value a flag or positional argument accepts.
 *
 * <p>The set is closed: every value type is either one of the {@link Scalar} constants or a {@link
 * Choice} carrying its allowed literals.
 */
public sealed interface ValueType permits ValueType.Scalar, ValueType.Choice {

  ValueType BOOL = Scalar.BOOL;
  ValueType STRING = Scalar.STRING;
  ValueType NUMBER = Scalar.NUMBER;
  ValueType FILE = Scalar.FILE;
  ValueType DIRECTORY = Scalar.DIRECTORY;
  ValueType URL = Scalar.URL;
  ValueType REMOTE = Scalar.REMOTE;
  ValueType BRANCH = Scalar.BRANCH;

  /** Lower-case label used in diagnostics and reports. */
  String label();

  /** Creates a choice type from the given literals. */
  static ValueType choice(List<String> values) {
    return new Choice(values);
  }

  /** Value types without parameters. */
  enum Scalar implements ValueType {
    /** Presence-only switch. */
    BOOL,
    STRING,
    NUMBER,
    FILE,
    DIRECTORY,
    URL,
    /** A version-control remote name. */
    REMOTE,
    /** A version-control branch name. */
    BRANCH;

    @Override
    public String label() {
      return name().toLowerCase(Locale.ROOT);
    }
  }

  /** One of a fixed list of literal values, in declaration order. */
  record Choice(List<String> values) implements ValueType {
    public Choice {
      Objects.requireNonNull(values, "values must not be null");
      values = List.copyOf(values);
    }

    @Override
    public String label() {
      return "choice" + values;
    }
  }
}
