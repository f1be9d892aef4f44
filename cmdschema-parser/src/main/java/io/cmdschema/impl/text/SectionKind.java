package io.cmdschema.impl.text;

/** Explicit help sections that feed the section extractor. */
public enum SectionKind {
  SUBCOMMANDS,
  FLAGS,
  OPTIONS,
  ARGUMENTS
}
