package io.cmdschema.api;

import io.cmdschema.impl.HelpParserImpl;
import io.cmdschema.impl.report.QualityAssessor;
import io.cmdschema.impl.strategy.StrategyRegistry;
import java.util.Objects;

/**
 * Main entry point for turning command help text into a {@link CommandSchema}.
 *
 * <p>Example usage:
 *
 * <pre>{@code
 * ParseResult result = HelpParser.parse("ls", helpText);
 * result.schemaIfPresent()
 *     .ifPresent(schema -> schema.globalFlags()
 *         .forEach(flag -> System.out.println(flag.canonicalName())));
 *
 * ExtractionRun run = HelpParser.parseWithReport("git", helpText, QualityPolicy.defaults());
 * if (!run.report().acceptedForSuggestions()) {
 *     System.out.println(run.report().failureCode());
 * }
 * }</pre>
 *
 * <p>Parsing is a pure function of its inputs: no process, file or network access happens here,
 * and all entry points are safe to call from multiple threads.
 */
public final class HelpParser {

  private HelpParser() {}

  /**
   * Parses help text with default options.
   *
   * @param command command the help text belongs to
   * @param helpText raw help output or manual page
   * @return parse result; its schema is absent when nothing was recognised
   * @throws NullPointerException if command or helpText is null
   */
  public static ParseResult parse(String command, String helpText) {
    return parse(command, helpText, ParserOptions.DEFAULT);
  }

  /**
   * Parses help text with custom options.
   *
   * @param command command the help text belongs to
   * @param helpText raw help output or manual page
   * @param options parser options
   * @return parse result
   * @throws NullPointerException if any argument is null
   */
  public static ParseResult parse(String command, String helpText, ParserOptions options) {
    Objects.requireNonNull(command, "command must not be null");
    Objects.requireNonNull(helpText, "helpText must not be null");
    Objects.requireNonNull(options, "options must not be null");
    return newImpl(options).parse(command, helpText);
  }

  /**
   * Parses help text and grades the result against a quality policy.
   *
   * @param command command the help text belongs to
   * @param helpText raw help output or manual page
   * @param policy quality thresholds
   * @return the (possibly rejected) result together with its report
   * @throws NullPointerException if any argument is null
   */
  public static ExtractionRun parseWithReport(
      String command, String helpText, QualityPolicy policy) {
    return parseWithReport(command, helpText, policy, ParserOptions.DEFAULT);
  }

  /**
   * Parses help text with custom options and grades the result against a quality policy.
   *
   * @param command command the help text belongs to
   * @param helpText raw help output or manual page
   * @param policy quality thresholds
   * @param options parser options
   * @return the (possibly rejected) result together with its report
   * @throws NullPointerException if any argument is null
   */
  public static ExtractionRun parseWithReport(
      String command, String helpText, QualityPolicy policy, ParserOptions options) {
    Objects.requireNonNull(policy, "policy must not be null");
    ParseResult result = parse(command, helpText, options);
    return QualityAssessor.assess(command, result, policy);
  }

  private static HelpParserImpl newImpl(ParserOptions options) {
    return new HelpParserImpl(
        StrategyRegistry.defaults(), options.acceptanceThreshold(), options.maxUnresolvedSamples());
  }

  /**
   * Parser configuration options.
   *
   * @param acceptanceThreshold minimum scored confidence for a finding to enter the schema
   * @param maxUnresolvedSamples how many unrecognised lines the diagnostics keep
   */
  public record ParserOptions(double acceptanceThreshold, int maxUnresolvedSamples) {

    /** Accepts findings scoring at least 0.7 and keeps up to 20 unresolved lines. */
    public static final ParserOptions DEFAULT = new ParserOptions(0.7, 20);

    public ParserOptions {
      QualityPolicy.requireUnitRange("acceptanceThreshold", acceptanceThreshold);
      if (maxUnresolvedSamples < 0) {
        throw new InvalidConfigurationException(
            "maxUnresolvedSamples must not be negative: " + maxUnresolvedSamples);
      }
    }

    public static Builder builder() {
      return new Builder();
    }

    public static class Builder {
      private double acceptanceThreshold = DEFAULT.acceptanceThreshold();
      private int maxUnresolvedSamples = DEFAULT.maxUnresolvedSamples();

      public Builder acceptanceThreshold(double value) {
        this.acceptanceThreshold = value;
        return this;
      }

      public Builder maxUnresolvedSamples(int value) {
        this.maxUnresolvedSamples = value;
        return this;
      }

      public ParserOptions build() {
        return new ParserOptions(acceptanceThreshold, maxUnresolvedSamples);
      }
    }
  }
}
