package io.cmdschema.impl.strategy;

import io.cmdschema.api.FormatScore;
import io.cmdschema.api.HelpFormat;
import io.cmdschema.impl.classify.FormatClassifier;
import java.util.ArrayList;
import java.util.List;

/**
 * Ordered names of the strategies to run, derived from classifier output alone.
 *
 * @param names strategy names in run order
 */
public record StrategyPlan(List<String> names) {

  public StrategyPlan {
    names = List.copyOf(names);
  }

  /**
   * {@code man} when a manual page was detected, then {@code section}, {@code npm} when Cobra
   * scores highest, {@code gnu} and {@code usage}.
   */
  public static StrategyPlan rank(List<FormatScore> scores) {
    List<String> names = new ArrayList<>(5);
    boolean manDetected = false;
    for (FormatScore score : scores) {
      manDetected |= score.format() == HelpFormat.MAN;
    }
    if (manDetected) {
      names.add(ManStrategy.NAME);
    }
    names.add(SectionStrategy.NAME);
    if (FormatClassifier.top(scores) == HelpFormat.COBRA) {
      names.add(NpmStrategy.NAME);
    }
    names.add(GnuStrategy.NAME);
    names.add(UsageStrategy.NAME);
    return new StrategyPlan(names);
  }

  public boolean includes(String name) {
    return names.contains(name);
  }

  /** Diagnostics label, e.g. {@code strategy-plan:section+gnu+usage}. */
  public String label() {
    return "strategy-plan:" + String.join("+", names);
  }
}
