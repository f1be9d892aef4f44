package io.cmdschema.api;

import java.util.Locale;

/**
 * Why an extraction did not produce an accepted schema.
 *
 * <p>{@code NOT_INSTALLED}, {@code PERMISSION_BLOCKED} and {@code TIMEOUT} are reported by the
 * component that runs the target command; the parser itself only produces the remaining codes.
 */
public enum FailureCode {
  NOT_INSTALLED,
  PERMISSION_BLOCKED,
  TIMEOUT,
  NOT_HELP_OUTPUT,
  PARSE_FAILED,
  QUALITY_REJECTED;

  /** Snake-case label, e.g. {@code quality_rejected}. */
  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }
}
