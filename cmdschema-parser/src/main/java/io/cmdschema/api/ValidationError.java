package io.cmdschema.api;

/**
 * A structural problem in a {@link CommandSchema}.
 *
 * @param kind what is wrong
 * @param subject the offending name or path, or {@code null}
 */
public record ValidationError(Kind kind, String subject) {

  public enum Kind {
    EMPTY_COMMAND_NAME("schema command cannot be empty"),
    INVALID_SHORT_FLAG("invalid short flag format"),
    INVALID_LONG_FLAG("invalid long flag format"),
    MISSING_FLAG_NAME("flag must define short or long form"),
    DUPLICATE_FLAG("duplicate flag in scope"),
    DUPLICATE_SUBCOMMAND("duplicate subcommand in scope"),
    SUBCOMMAND_CYCLE("subcommand cycle detected at path");

    private final String message;

    Kind(String message) {
      this.message = message;
    }

    public String message() {
      return message;
    }
  }

  @Override
  public String toString() {
    return subject == null ? kind.message() : kind.message() + ": " + subject;
  }
}
