package io.cmdschema.api;

/**
 * Thrown when parser or quality-policy configuration is out of range or malformed.
 *
 * <p>Help text itself never causes this exception; malformed input only lowers confidence.
 */
public class InvalidConfigurationException extends RuntimeException {

  /**
   * Creates exception with message.
   *
   * @param message error message
   */
  public InvalidConfigurationException(String message) {
    super(message);
  }

  /**
   * Creates exception with message and cause.
   *
   * @param message error message
   * @param cause underlying cause
   */
  public InvalidConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }
}
