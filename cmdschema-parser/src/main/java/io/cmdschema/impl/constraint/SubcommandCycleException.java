package io.cmdschema.impl.constraint;

/** Thrown when a subcommand edge would make a command its own child. */
public class SubcommandCycleException extends RuntimeException {
  private final String command;

  public SubcommandCycleException(String command) {
    super("self-cycle detected for command '" + command + "'");
    this.command = command;
  }

  public String command() {
    return command;
  }
}
