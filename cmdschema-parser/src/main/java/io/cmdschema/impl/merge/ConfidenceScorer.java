package io.cmdschema.impl.merge;

import io.cmdschema.impl.candidate.ArgCandidate;
import io.cmdschema.impl.candidate.FlagCandidate;
import io.cmdschema.impl.candidate.SubcommandCandidate;
import io.cmdschema.impl.classify.RowFilters;
import io.cmdschema.util.TextUtil;
import java.util.ArrayList;
import java.util.List;

/**
 * Adjusts strategy-assigned confidences with evidence found in the candidate itself. Results are
 * clamped to [0, 1].
 */
public final class ConfidenceScorer {
  static final double VALUE_BONUS = 0.05;
  static final double ASSIGNMENT_BONUS = 0.10;
  static final double PLACEHOLDER_FLAG_PENALTY = 0.50;
  static final double PLACEHOLDER_SUBCOMMAND_PENALTY = 0.70;
  static final double KEYBINDING_SUBCOMMAND_PENALTY = 0.50;
  static final double PLACEHOLDER_ARG_PENALTY = 0.45;

  private ConfidenceScorer() {}

  public static double score(FlagCandidate candidate) {
    double score = candidate.confidence();
    if (candidate.flag().takesValue()) {
      score += VALUE_BONUS;
    }
    String description = candidate.flag().description();
    if (description != null && description.indexOf('=') >= 0) {
      score += ASSIGNMENT_BONUS;
    }
    String primary = candidate.primaryIdentifier();
    if (primary != null && RowFilters.isPlaceholderToken(TextUtil.trimStartChars(primary, "-"))) {
      score -= PLACEHOLDER_FLAG_PENALTY;
    }
    return clamp(score);
  }

  public static double score(SubcommandCandidate candidate) {
    double score = candidate.confidence();
    String name = candidate.name();
    if (RowFilters.isPlaceholderToken(name) || RowFilters.isEnvVarRow(name)) {
      score -= PLACEHOLDER_SUBCOMMAND_PENALTY;
    }
    if (RowFilters.isKeybindingRow(name)) {
      score -= KEYBINDING_SUBCOMMAND_PENALTY;
    }
    return clamp(score);
  }

  public static double score(ArgCandidate candidate) {
    double score = candidate.confidence();
    if (RowFilters.isPlaceholderToken(candidate.name())) {
      score -= PLACEHOLDER_ARG_PENALTY;
    }
    return clamp(score);
  }

  public static List<FlagCandidate> scoreFlags(List<FlagCandidate> candidates) {
    List<FlagCandidate> out = new ArrayList<>(candidates.size());
    for (FlagCandidate c : candidates) {
      out.add(new FlagCandidate(c.flag(), c.span(), c.strategy(), score(c)));
    }
    return out;
  }

  public static List<SubcommandCandidate> scoreSubcommands(List<SubcommandCandidate> candidates) {
    List<SubcommandCandidate> out = new ArrayList<>(candidates.size());
    for (SubcommandCandidate c : candidates) {
      out.add(new SubcommandCandidate(c.subcommand(), c.span(), c.strategy(), score(c)));
    }
    return out;
  }

  public static List<ArgCandidate> scoreArgs(List<ArgCandidate> candidates) {
    List<ArgCandidate> out = new ArrayList<>(candidates.size());
    for (ArgCandidate c : candidates) {
      out.add(new ArgCandidate(c.arg(), c.span(), c.strategy(), score(c)));
    }
    return out;
  }

  static double clamp(double value) {
    if (Double.isNaN(value)) {
      return 0.0;
    }
    return Math.max(0.0, Math.min(1.0, value));
  }
}
