package io.cmdschema.api;

import java.util.Locale;

/** Help-text format families recognised by the classifier, in tie-break order. */
public enum HelpFormat {
  /** Rust clap: {@code USAGE:}, {@code FLAGS:}, {@code OPTIONS:}, {@code SUBCOMMANDS:}. */
  CLAP,
  /** Go cobra: {@code Available Commands:} and {@code Use "... --help"} footers. */
  COBRA,
  /** GNU coreutils style {@code Usage:} banner with dash-led option rows. */
  GNU,
  /** Python argparse: {@code positional arguments:} / {@code optional arguments:}. */
  ARGPARSE,
  /** docopt: text starting with {@code Usage:}. */
  DOCOPT,
  /** BSD manual-style {@code SYNOPSIS} / {@code DESCRIPTION}. */
  BSD,
  /** Raw roff source or a rendered manual page. */
  MAN,
  UNKNOWN;

  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }
}
