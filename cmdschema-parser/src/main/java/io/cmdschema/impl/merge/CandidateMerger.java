package io.cmdschema.impl.merge;

import io.cmdschema.api.ArgSchema;
import io.cmdschema.api.FlagSchema;
import io.cmdschema.api.SchemaValidator;
import io.cmdschema.api.SubcommandSchema;
import io.cmdschema.impl.candidate.ArgCandidate;
import io.cmdschema.impl.candidate.Candidate;
import io.cmdschema.impl.candidate.FlagCandidate;
import io.cmdschema.impl.candidate.SubcommandCandidate;
import io.cmdschema.impl.text.FlagRowParser;
import io.cmdschema.util.TextUtil;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Groups candidates of one kind by canonical key and decides, per key, which finding is accepted.
 *
 * <p>Only candidates at or above {@link #HIGH} compete. The top scorer is accepted as-is when it
 * clears the acceptance threshold; every other candidate of the key, a winner below the threshold
 * included, is kept as medium at or above {@link #MEDIUM} and discarded below it. A key with no
 * contender keeps only its best medium candidate.
 */
public final class CandidateMerger {
  public static final double HIGH = 0.7;
  public static final double MEDIUM = 0.5;

  static final String INVALID_FLAG_STRATEGY = "merge-invalid-flag";

  private final double acceptanceThreshold;

  public CandidateMerger() {
    this(HIGH);
  }

  public CandidateMerger(double acceptanceThreshold) {
    if (Double.isNaN(acceptanceThreshold)
        || acceptanceThreshold < 0.0
        || acceptanceThreshold > 1.0) {
      throw new IllegalArgumentException(
          "acceptanceThreshold must be in [0, 1]: " + acceptanceThreshold);
    }
    this.acceptanceThreshold = acceptanceThreshold;
  }

  public double acceptanceThreshold() {
    return acceptanceThreshold;
  }

  /** Raises an overall schema confidence to {@link #MEDIUM}; never lowers it. */
  public static double gateSchema(double confidence) {
    return Math.max(confidence, MEDIUM);
  }

  public MergeOutcome<FlagSchema, FlagCandidate> mergeFlags(List<FlagCandidate> candidates) {
    MergeOutcome<FlagSchema, FlagCandidate> raw = merge(candidates, FlagCandidate::flag);
    List<FlagSchema> valid = new ArrayList<>();
    List<FlagCandidate> discarded = new ArrayList<>(raw.discarded());
    for (FlagSchema flag : raw.accepted()) {
      if (hasValidIdentifiers(flag)) {
        valid.add(flag);
        continue;
      }
      // The accepted flag is its winning candidate's schema.
      for (FlagCandidate candidate : candidates) {
        if (candidate.flag() == flag) {
          discarded.add(
              new FlagCandidate(
                  candidate.flag(),
                  candidate.span(),
                  INVALID_FLAG_STRATEGY,
                  candidate.confidence()));
          break;
        }
      }
    }
    // A short-only flag and its long form land under different keys; fold them together.
    List<FlagSchema> folded = new ArrayList<>(FlagRowParser.dedupe(valid));
    folded.sort(Comparator.comparing(FlagSchema::canonicalName));
    return new MergeOutcome<>(folded, raw.medium(), discarded);
  }

  public MergeOutcome<SubcommandSchema, SubcommandCandidate> mergeSubcommands(
      List<SubcommandCandidate> candidates) {
    MergeOutcome<SubcommandSchema, SubcommandCandidate> raw =
        merge(candidates, SubcommandCandidate::subcommand);
    List<SubcommandSchema> sorted = new ArrayList<>(raw.accepted());
    sorted.sort(Comparator.comparing(SubcommandSchema::name));
    return new MergeOutcome<>(sorted, raw.medium(), raw.discarded());
  }

  public MergeOutcome<ArgSchema, ArgCandidate> mergeArgs(List<ArgCandidate> candidates) {
    MergeOutcome<ArgSchema, ArgCandidate> raw = merge(candidates, ArgCandidate::arg);
    List<ArgSchema> sorted = new ArrayList<>(raw.accepted());
    sorted.sort(Comparator.comparing(a -> TextUtil.lower(a.name())));
    return new MergeOutcome<>(sorted, raw.medium(), raw.discarded());
  }

  private <T, C extends Candidate> MergeOutcome<T, C> merge(
      List<C> candidates, Function<C, T> entity) {
    Map<String, List<C>> groups = new LinkedHashMap<>();
    for (C candidate : candidates) {
      groups.computeIfAbsent(candidate.canonicalKey(), k -> new ArrayList<>()).add(candidate);
    }

    List<T> accepted = new ArrayList<>();
    List<C> medium = new ArrayList<>();
    List<C> discarded = new ArrayList<>();
    for (List<C> group : groups.values()) {
      C best = highest(group, HIGH);
      if (best == null) {
        C fallback = highest(group, MEDIUM);
        for (C candidate : group) {
          (candidate == fallback ? medium : discarded).add(candidate);
        }
        continue;
      }

      for (C candidate : group) {
        if (candidate == best && best.confidence() >= acceptanceThreshold) {
          accepted.add(entity.apply(best));
        } else {
          (candidate.confidence() >= MEDIUM ? medium : discarded).add(candidate);
        }
      }
    }
    return new MergeOutcome<>(accepted, medium, discarded);
  }

  // First of the top scorers at or above the floor; null when none reaches it.
  private static <C extends Candidate> C highest(List<C> group, double floor) {
    C best = null;
    for (C candidate : group) {
      if (candidate.confidence() >= floor
          && (best == null || candidate.confidence() > best.confidence())) {
        best = candidate;
      }
    }
    return best;
  }

  // At least one name, and every present name well shaped.
  static boolean hasValidIdentifiers(FlagSchema flag) {
    String shortName = flag.shortName();
    String longName = flag.longName();
    if (shortName == null && longName == null) {
      return false;
    }
    return (shortName == null || SchemaValidator.isShortFlagName(shortName))
        && (longName == null || SchemaValidator.isLongFlagName(longName));
  }
}
