package io.cmdschema.impl.strategy;

import io.cmdschema.impl.candidate.ArgCandidate;
import io.cmdschema.impl.candidate.CandidatePools;
import io.cmdschema.impl.candidate.FlagCandidate;
import io.cmdschema.impl.candidate.SubcommandCandidate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The closed set of extraction strategies, looked up by name. Running a plan invokes every
 * selected strategy in order; none short-circuits the others.
 */
public final class StrategyRegistry {
  private static final Logger LOG = LoggerFactory.getLogger(StrategyRegistry.class);

  private final Map<String, ExtractionStrategy> strategies = new LinkedHashMap<>();

  public StrategyRegistry(List<? extends ExtractionStrategy> strategies) {
    for (ExtractionStrategy strategy : strategies) {
      Objects.requireNonNull(strategy, "strategy must not be null");
      if (this.strategies.putIfAbsent(strategy.name(), strategy) != null) {
        throw new IllegalArgumentException("Duplicate strategy name: " + strategy.name());
      }
    }
  }

  /** Registry holding the built-in strategies. */
  public static StrategyRegistry defaults() {
    return new StrategyRegistry(
        List.of(
            new ManStrategy(),
            new SectionStrategy(),
            new NpmStrategy(),
            new GnuStrategy(),
            new UsageStrategy()));
  }

  public List<String> names() {
    return List.copyOf(strategies.keySet());
  }

  /** Result of running a plan. */
  public record Run(CandidatePools pools, List<String> contributors) {
    public Run {
      contributors = List.copyOf(contributors);
    }
  }

  /**
   * Runs the planned strategies and pools their candidates.
   *
   * @param plan strategies to run; names the registry does not hold are skipped
   * @param context shared parse inputs
   * @return pooled candidates and the names of strategies that produced at least one
   */
  public Run run(StrategyPlan plan, ParseContext context) {
    CandidatePools pools = new CandidatePools();
    List<String> contributors = new ArrayList<>();
    for (String name : plan.names()) {
      ExtractionStrategy strategy = strategies.get(name);
      if (strategy == null) {
        LOG.debug("Strategy '{}' is not registered, skipping", name);
        continue;
      }
      List<FlagCandidate> flags = strategy.collectFlags(context);
      List<SubcommandCandidate> subcommands = strategy.collectSubcommands(context);
      List<ArgCandidate> args = strategy.collectArgs(context);
      pools.flags().addAll(flags);
      pools.subcommands().addAll(subcommands);
      pools.args().addAll(args);
      if (!flags.isEmpty() || !subcommands.isEmpty() || !args.isEmpty()) {
        contributors.add(name);
      }
      LOG.debug(
          "Strategy '{}': {} flags, {} subcommands, {} args",
          name,
          flags.size(),
          subcommands.size(),
          args.size());
    }
    return new Run(pools, contributors);
  }
}
