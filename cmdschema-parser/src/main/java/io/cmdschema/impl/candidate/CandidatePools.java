package io.cmdschema.impl.candidate;

import java.util.ArrayList;
import java.util.List;

/** The three candidate pools accumulated across strategies during one parse. Not thread-safe. */
public final class CandidatePools {
  private final List<FlagCandidate> flags = new ArrayList<>();
  private final List<SubcommandCandidate> subcommands = new ArrayList<>();
  private final List<ArgCandidate> args = new ArrayList<>();

  public List<FlagCandidate> flags() {
    return flags;
  }

  public List<SubcommandCandidate> subcommands() {
    return subcommands;
  }

  public List<ArgCandidate> args() {
    return args;
  }

  public int size() {
    return flags.size() + subcommands.size() + args.size();
  }
}
