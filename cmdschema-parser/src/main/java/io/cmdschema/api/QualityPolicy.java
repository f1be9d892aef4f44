package io.cmdschema.api;

import java.util.Properties;

/**
 * Acceptance thresholds applied to an extracted schema before it is handed to callers.
 *
 * @param minConfidence minimum overall schema confidence in [0, 1]
 * @param minCoverage minimum fraction of relevant lines that were recognised, in [0, 1]
 * @param allowLowQuality accept schemas that miss the thresholds, keeping the reasons
 */
public record QualityPolicy(double minConfidence, double minCoverage, boolean allowLowQuality) {

  public static final double DEFAULT_MIN_CONFIDENCE = 0.6;
  public static final double DEFAULT_MIN_COVERAGE = 0.2;

  public static final String MIN_CONFIDENCE_KEY = "cmdschema.quality.min-confidence";
  public static final String MIN_COVERAGE_KEY = "cmdschema.quality.min-coverage";
  public static final String ALLOW_LOW_QUALITY_KEY = "cmdschema.quality.allow-low-quality";

  public QualityPolicy {
    requireUnitRange("minConfidence", minConfidence);
    requireUnitRange("minCoverage", minCoverage);
  }

  /** The default policy: confidence 0.6, coverage 0.2, low-quality schemas rejected. */
  public static QualityPolicy defaults() {
    return new QualityPolicy(DEFAULT_MIN_CONFIDENCE, DEFAULT_MIN_COVERAGE, false);
  }

  /** Accepts every successfully parsed schema. */
  public static QualityPolicy permissive() {
    return new QualityPolicy(0.0, 0.0, true);
  }

  /**
   * Reads a policy from properties. Missing keys fall back to {@link #defaults()}.
   *
   * @param props properties to read
   * @return the configured policy
   * @throws InvalidConfigurationException if a value is not a number or out of range
   */
  public static QualityPolicy fromProperties(Properties props) {
    double minConfidence = readDouble(props, MIN_CONFIDENCE_KEY, DEFAULT_MIN_CONFIDENCE);
    double minCoverage = readDouble(props, MIN_COVERAGE_KEY, DEFAULT_MIN_COVERAGE);
    boolean allowLowQuality =
        Boolean.parseBoolean(props.getProperty(ALLOW_LOW_QUALITY_KEY, "false").trim());
    return new QualityPolicy(minConfidence, minCoverage, allowLowQuality);
  }

  private static double readDouble(Properties props, String key, double defaultValue) {
    String raw = props.getProperty(key);
    if (raw == null || raw.isBlank()) {
      return defaultValue;
    }
    try {
      return Double.parseDouble(raw.trim());
    } catch (NumberFormatException e) {
      throw new InvalidConfigurationException(
          "Property '" + key + "' is not a number: " + raw, e);
    }
  }

  static void requireUnitRange(String name, double value) {
    if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
      throw new InvalidConfigurationException(
          name + " must be within [0.0, 1.0], got " + value);
    }
  }
}
