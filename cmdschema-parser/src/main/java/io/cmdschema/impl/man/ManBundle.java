package io.cmdschema.impl.man;

import io.cmdschema.impl.candidate.ArgCandidate;
import io.cmdschema.impl.candidate.FlagCandidate;
import io.cmdschema.impl.candidate.SubcommandCandidate;
import java.util.List;
import java.util.Optional;

/**
 * Everything the man strategy found in one parse. Computed once per invocation and handed to each
 * of the strategy's collect calls.
 *
 * @param format variant the candidates were read from, or {@code null} when nothing was found
 */
public record ManBundle(
    List<FlagCandidate> flags,
    List<SubcommandCandidate> subcommands,
    List<ArgCandidate> args,
    ManFormat format) {

  public static final ManBundle EMPTY = new ManBundle(List.of(), List.of(), List.of(), null);

  public ManBundle {
    flags = List.copyOf(flags);
    subcommands = List.copyOf(subcommands);
    args = List.copyOf(args);
  }

  public boolean hasEntities() {
    return !flags.isEmpty() || !subcommands.isEmpty() || !args.isEmpty();
  }

  public Optional<ManFormat> detectedFormat() {
    return Optional.ofNullable(format);
  }
}
