package io.cmdschema.impl;

import static io.cmdschema.util.TextUtil.lower;

import io.cmdschema.api.ArgSchema;
import io.cmdschema.api.CommandSchema;
import io.cmdschema.api.FlagSchema;
import io.cmdschema.api.FormatScore;
import io.cmdschema.api.HelpFormat;
import io.cmdschema.api.ParseDiagnostics;
import io.cmdschema.api.ParseResult;
import io.cmdschema.api.SchemaSource;
import io.cmdschema.api.SubcommandSchema;
import io.cmdschema.impl.candidate.ArgCandidate;
import io.cmdschema.impl.candidate.Candidate;
import io.cmdschema.impl.candidate.FlagCandidate;
import io.cmdschema.impl.candidate.SubcommandCandidate;
import io.cmdschema.impl.classify.FormatClassifier;
import io.cmdschema.impl.constraint.ConstraintExtractor;
import io.cmdschema.impl.constraint.HierarchyValidator;
import io.cmdschema.impl.finalize.SchemaFinalizer;
import io.cmdschema.impl.man.ManBundle;
import io.cmdschema.impl.man.ManExtractor;
import io.cmdschema.impl.merge.CandidateMerger;
import io.cmdschema.impl.merge.ConfidenceScorer;
import io.cmdschema.impl.merge.MergeOutcome;
import io.cmdschema.impl.normalize.HelpNormalizer;
import io.cmdschema.impl.report.CandidateWarnings;
import io.cmdschema.impl.report.CoverageTracker;
import io.cmdschema.impl.report.FalsePositiveFilter;
import io.cmdschema.impl.strategy.ParseContext;
import io.cmdschema.impl.strategy.StrategyPlan;
import io.cmdschema.impl.strategy.StrategyRegistry;
import io.cmdschema.impl.text.ChoiceHints;
import io.cmdschema.impl.text.LineShapes;
import io.cmdschema.impl.text.MetadataExtractor;
import io.cmdschema.impl.text.SectionScanner;
import io.cmdschema.impl.text.UsageScanner;
import it.unimi.dsi.fastutil.ints.IntSet;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The help-text pipeline: normalize, classify, run the planned strategies, score and merge their
 * candidates, then enrich, validate and grade the resulting schema.
 *
 * <p>Instances hold configuration only, so one parser may serve concurrent callers.
 */
public final class HelpParserImpl {
  private static final Logger LOG = LoggerFactory.getLogger(HelpParserImpl.class);

  public static final String EMPTY_INPUT_WARNING = "Empty help output";
  static final String NO_ENTITIES_WARNING =
      "No flags, subcommands or positional arguments were recognized";
  static final String HIERARCHY_WARNING_PREFIX = "Subcommand hierarchy validation: ";

  private final StrategyRegistry registry;
  private final CandidateMerger merger;
  private final int maxUnresolvedSamples;

  public HelpParserImpl(
      StrategyRegistry registry, double acceptanceThreshold, int maxUnresolvedSamples) {
    this.registry = Objects.requireNonNull(registry, "registry must not be null");
    this.merger = new CandidateMerger(acceptanceThreshold);
    if (maxUnresolvedSamples < 0) {
      throw new IllegalArgumentException(
          "maxUnresolvedSamples must not be negative: " + maxUnresolvedSamples);
    }
    this.maxUnresolvedSamples = maxUnresolvedSamples;
  }

  public ParseResult parse(String command, String helpText) {
    if (helpText.isBlank()) {
      return new ParseResult(
          null, List.of(EMPTY_INPUT_WARNING), null, List.of(), List.of(), ParseDiagnostics.EMPTY);
    }

    List<IndexedLine> lines = HelpNormalizer.normalizeLines(helpText);
    List<FormatScore> scores = FormatClassifier.classify(lines);
    HelpFormat top = FormatClassifier.top(scores);
    LOG.debug("Parsing '{}': {} lines, top format {}", command, lines.size(), top);

    ManBundle man = isManPage(scores) ? ManExtractor.collectAll(command, lines) : ManBundle.EMPTY;
    ParseContext context =
        new ParseContext(
            command,
            lines,
            SectionScanner.identify(lines),
            UsageScanner.collect(lines),
            man,
            LineShapes.looksLikeKeybindingDocument(lines));

    StrategyPlan plan = StrategyPlan.rank(scores);
    List<String> parsersUsed = new ArrayList<>();
    parsersUsed.add(plan.label());
    StrategyRegistry.Run run = registry.run(plan, context);
    for (String contributor : run.contributors()) {
      parsersUsed.add("strategy:" + contributor);
    }
    parsersUsed.addAll(extractorNames(run));
    parsersUsed.addAll(context.notes());

    CoverageTracker coverage = new CoverageTracker();
    coverage.markLines(context.sections().headerIndices());
    IntSet usageBlock = UsageScanner.usageBlockIndices(lines);
    if (!usageBlock.isEmpty()) {
      coverage.markLines(usageBlock);
      parsersUsed.add("usage-lines");
    }

    FalsePositiveFilter.Result filtered =
        FalsePositiveFilter.apply(lines, run.pools().subcommands(), run.pools().args());
    List<FlagCandidate> flagCandidates = ConfidenceScorer.scoreFlags(run.pools().flags());
    List<SubcommandCandidate> subCandidates =
        ConfidenceScorer.scoreSubcommands(filtered.subcommands());
    List<ArgCandidate> argCandidates = ConfidenceScorer.scoreArgs(filtered.args());

    MergeOutcome<FlagSchema, FlagCandidate> flags = merger.mergeFlags(flagCandidates);
    MergeOutcome<SubcommandSchema, SubcommandCandidate> subs =
        merger.mergeSubcommands(subCandidates);
    MergeOutcome<ArgSchema, ArgCandidate> args = merger.mergeArgs(argCandidates);

    markRecognized(coverage, flagCandidates, flags, flagKeys(flags.accepted()));
    markRecognized(coverage, subCandidates, subs, keys(subs.accepted(), s -> lower(s.name())));
    markRecognized(coverage, argCandidates, args, keys(args.accepted(), a -> lower(a.name())));

    List<String> warnings =
        new ArrayList<>(CandidateWarnings.summarize(flags, subs, args, filtered.hits()));

    List<FlagSchema> globalFlags =
        ChoiceHints.apply(lines, flags.accepted(), coverage.recognized());
    globalFlags = ConstraintExtractor.apply(globalFlags);

    HierarchyValidator.Check hierarchy = HierarchyValidator.check(command, subs.accepted());
    for (String error : hierarchy.errors()) {
      LOG.warn("Subcommand hierarchy of '{}': {}", command, error);
      warnings.add(HIERARCHY_WARNING_PREFIX + error);
    }

    SchemaSource source =
        man.detectedFormat().isPresent() ? SchemaSource.MAN_PAGE : SchemaSource.HELP_COMMAND;
    CommandSchema schema =
        CommandSchema.empty(command, source)
            .withEntities(globalFlags, hierarchy.subcommands(), args.accepted());

    ParseDiagnostics diagnostics;
    if (schema.isEmpty()) {
      warnings.add(NO_ENTITIES_WARNING);
      diagnostics = coverage.build(lines, maxUnresolvedSamples);
      parsersUsed.add(CoverageTracker.confidenceTag(0.0));
      LOG.debug("No entities recognized for '{}'", command);
      return new ParseResult(null, warnings, top, scores, parsersUsed, diagnostics);
    }

    schema =
        schema.withMetadata(
            MetadataExtractor.version(command, lines).orElse(null),
            MetadataExtractor.description(lines).orElse(null));
    schema = SchemaFinalizer.finalizeSchema(schema);
    schema = schema.withConfidence(CandidateMerger.gateSchema(overallConfidence(schema, top)));

    diagnostics = coverage.build(lines, maxUnresolvedSamples);
    parsersUsed.add(CoverageTracker.confidenceTag(schema.confidence()));
    LOG.debug(
        "Schema for '{}': {} flags, {} subcommands, {} args, confidence {}, coverage {}",
        command,
        schema.globalFlags().size(),
        schema.subcommands().size(),
        schema.positional().size(),
        schema.confidence(),
        diagnostics.coverage());
    return new ParseResult(schema, warnings, top, scores, parsersUsed, diagnostics);
  }

  /** Base 0.5, raised by each kind of evidence the schema carries; at most 1. */
  static double overallConfidence(CommandSchema schema, HelpFormat top) {
    double confidence = 0.5;
    if (!schema.subcommands().isEmpty()) {
      confidence += 0.2;
    }
    if (schema.globalFlags().size() > 3) {
      confidence += 0.15;
    }
    if (!schema.positional().isEmpty()) {
      confidence += 0.1;
    }
    if (top != HelpFormat.UNKNOWN) {
      confidence += 0.1;
    }
    if (schema.description() != null) {
      confidence += 0.05;
    }
    return Math.min(1.0, confidence);
  }

  private static boolean isManPage(List<FormatScore> scores) {
    for (FormatScore score : scores) {
      if (score.format() == HelpFormat.MAN) {
        return true;
      }
    }
    return false;
  }

  // Extractor labels such as section-flags, in first-seen order.
  private static Set<String> extractorNames(StrategyRegistry.Run run) {
    Set<String> names = new LinkedHashSet<>();
    run.pools().flags().forEach(c -> names.add(c.strategy()));
    run.pools().subcommands().forEach(c -> names.add(c.strategy()));
    run.pools().args().forEach(c -> names.add(c.strategy()));
    return names;
  }

  // Lines of accepted keys and of medium findings count as recognized.
  private static <C extends Candidate> void markRecognized(
      CoverageTracker coverage, List<C> candidates, MergeOutcome<?, C> outcome, Set<String> keys) {
    List<C> recognized = new ArrayList<>(outcome.medium());
    for (C candidate : candidates) {
      if (keys.contains(candidate.canonicalKey())
          && candidate.confidence() >= CandidateMerger.MEDIUM) {
        recognized.add(candidate);
      }
    }
    coverage.markSpans(recognized);
  }

  private static Set<String> flagKeys(List<FlagSchema> flags) {
    Set<String> keys = new HashSet<>();
    for (FlagSchema flag : flags) {
      keys.addAll(flag.identifiers());
    }
    return keys;
  }

  private static <T> Set<String> keys(List<T> items, Function<T, String> key) {
    Set<String> keys = new HashSet<>();
    for (T item : items) {
      keys.add(key.apply(item));
    }
    return keys;
  }
}
