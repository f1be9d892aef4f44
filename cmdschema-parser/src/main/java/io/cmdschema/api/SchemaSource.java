package io.cmdschema.api;

/** Where a {@link CommandSchema} came from. */
public enum SchemaSource {
  /** Parsed from the output of {@code <command> --help} or similar. */
  HELP_COMMAND,
  /** Parsed from a raw roff or rendered manual page. */
  MAN_PAGE,
  /** Shipped with a bootstrap bundle. */
  BOOTSTRAP,
  /** Learned from observed invocations. */
  LEARNED
}
