package io.cmdschema.api;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Checks structural invariants of a {@link CommandSchema}. Validation stops at the first error in
 * a scope, so the returned list is short and points at the earliest problem.
 */
public final class SchemaValidator {

  private SchemaValidator() {}

  /**
   * Validates a schema.
   *
   * @param schema schema to check
   * @return validation errors, empty when the schema is well formed
   */
  public static List<ValidationError> validate(CommandSchema schema) {
    List<ValidationError> errors = new ArrayList<>();
    if (schema.command().isBlank()) {
      errors.add(new ValidationError(ValidationError.Kind.EMPTY_COMMAND_NAME, null));
      return errors;
    }
    if (validateFlags(schema.globalFlags(), errors)) {
      return errors;
    }
    Deque<String> path = new ArrayDeque<>();
    path.addLast(schema.command());
    validateSubcommands(schema.subcommands(), path, errors);
    return errors;
  }

  private static boolean validateSubcommands(
      List<SubcommandSchema> subcommands, Deque<String> path, List<ValidationError> errors) {
    Set<String> seen = new HashSet<>();
    for (SubcommandSchema sub : subcommands) {
      String name = sub.name().trim();
      if (name.isEmpty() || !seen.add(name)) {
        errors.add(
            new ValidationError(
                ValidationError.Kind.DUPLICATE_SUBCOMMAND, name.isEmpty() ? "<empty>" : name));
        return true;
      }
      if (path.contains(name)) {
        errors.add(
            new ValidationError(
                ValidationError.Kind.SUBCOMMAND_CYCLE, String.join(" ", path) + " " + name));
        return true;
      }
      if (validateFlags(sub.flags(), errors)) {
        return true;
      }
      path.addLast(name);
      boolean failed = validateSubcommands(sub.subcommands(), path, errors);
      path.removeLast();
      if (failed) {
        return true;
      }
    }
    return false;
  }

  private static boolean validateFlags(List<FlagSchema> flags, List<ValidationError> errors) {
    Set<String> seen = new HashSet<>();
    for (FlagSchema flag : flags) {
      if (flag.shortName() == null && flag.longName() == null) {
        errors.add(new ValidationError(ValidationError.Kind.MISSING_FLAG_NAME, null));
        return true;
      }
      String shortName = flag.shortName();
      if (shortName != null) {
        if (!isShortFlagName(shortName)) {
          errors.add(new ValidationError(ValidationError.Kind.INVALID_SHORT_FLAG, shortName));
          return true;
        }
        if (!seen.add(shortName)) {
          errors.add(new ValidationError(ValidationError.Kind.DUPLICATE_FLAG, shortName));
          return true;
        }
      }
      String longName = flag.longName();
      if (longName != null) {
        if (!isLongFlagName(longName)) {
          errors.add(new ValidationError(ValidationError.Kind.INVALID_LONG_FLAG, longName));
          return true;
        }
        if (!seen.add(longName)) {
          errors.add(new ValidationError(ValidationError.Kind.DUPLICATE_FLAG, longName));
          return true;
        }
      }
    }
    return false;
  }

  /** One dash and a body free of brackets, parens, angle brackets and slashes, e.g. {@code -x}. */
  public static boolean isShortFlagName(String name) {
    if (!name.startsWith("-") || name.startsWith("--") || name.length() < 2) {
      return false;
    }
    for (int i = 1; i < name.length(); i++) {
      if ("[]<>()/".indexOf(name.charAt(i)) >= 0) {
        return false;
      }
    }
    return true;
  }

  /**
   * Two dashes, an ASCII letter, then ASCII letters, digits, {@code -}, {@code _} or {@code .},
   * e.g. {@code --dry-run}.
   */
  public static boolean isLongFlagName(String name) {
    if (!name.startsWith("--") || name.length() < 3 || !isAsciiLetter(name.charAt(2))) {
      return false;
    }
    for (int i = 3; i < name.length(); i++) {
      char ch = name.charAt(i);
      if (!isAsciiLetter(ch) && !(ch >= '0' && ch <= '9') && "-_.".indexOf(ch) < 0) {
        return false;
      }
    }
    return true;
  }

  private static boolean isAsciiLetter(char ch) {
    return (ch >= 'a' && ch <= 'z') || (ch >= 'A' && ch <= 'Z');
  }
}
