package io.cmdschema.internal;

import java.util.regex.Pattern;

/**
 * Compiled regular expressions shared by the help-text extractors. All patterns are compiled once
 * when the class is initialised.
 */
public final class HelpPatterns {
  private HelpPatterns() {}

  // Flag row starts
  public static final Pattern SHORT_FLAG =
      Pattern.compile("^\\s*(-[a-zA-Z0-9?@])(?:\\s|,|\\[|\\||$)");
  public static final Pattern SINGLE_DASH_WORD_FLAG =
      Pattern.compile("^\\s*(-[a-zA-Z][a-zA-Z0-9-]{1,})(?:\\s|,|=|<|\\[|\\||$)");
  public static final Pattern LONG_FLAG =
      Pattern.compile("^\\s*(--[a-zA-Z][-a-zA-Z0-9.]*)(?:\\s|=|\\[|,|\\||\\)|$)");
  public static final Pattern COMBINED_FLAG =
      Pattern.compile(
          "^\\s*(-[a-zA-Z0-9?@]{1,3})(?:\\s*,\\s*|\\s*/\\s*|\\s+)(--[a-zA-Z][-a-zA-Z0-9.]*)");
  public static final Pattern FLAG_WITH_VALUE =
      Pattern.compile(
          "(?:=([A-Za-z_]+)|[<\\[]([A-Za-z_]+)[>\\]]"
              + "|(?:--[a-zA-Z][-a-zA-Z0-9.]*|-[a-zA-Z0-9]{1,3})\\s+([A-Z][A-Z_]+)(?:\\s|$))");

  // Section headers
  public static final Pattern SUBCOMMANDS_SECTION =
      Pattern.compile(
          "^(commands|all commands|subcommands|available commands|sub-commands)\\s*:?\\s*$",
          Pattern.CASE_INSENSITIVE);
  public static final Pattern FLAGS_SECTION =
      Pattern.compile("^(flags|global flags)\\s*:?\\s*$", Pattern.CASE_INSENSITIVE);
  public static final Pattern OPTIONS_SECTION =
      Pattern.compile(
          "^(options|optional arguments|opts)\\s*:?\\s*$", Pattern.CASE_INSENSITIVE);
  public static final Pattern ARGUMENTS_SECTION =
      Pattern.compile(
          "^(arguments|positional arguments|args)\\s*:?\\s*$", Pattern.CASE_INSENSITIVE);

  /** Gap between the two columns of a definition row: tabs or two or more spaces. */
  public static final Pattern COLUMN_BREAK = Pattern.compile("\\t+| {2,}");

  public static final Pattern CHOICE_VALUES = Pattern.compile("\\{([^}]+)\\}");
  public static final Pattern LINE_OF_DASHES = Pattern.compile("^-{8,}$");

  public static final Pattern VERSION_NUMBER = Pattern.compile("(\\d+\\.\\d+(?:\\.\\d+)?)");
  public static final Pattern BANNER_VERSION =
      Pattern.compile("^\\s*[A-Za-z][A-Za-z0-9+._-]*\\s+(\\d+\\.\\d+(?:\\.\\d+)?)\\b");

  // Flag references inside descriptions
  public static final Pattern FLAG_REFERENCE =
      Pattern.compile("(--[a-zA-Z][-a-zA-Z0-9.]*|-[a-zA-Z0-9?@]{1,3})");

  // Inline flags inside usage synopses; the trailing delimiter is not consumed
  public static final Pattern INLINE_LONG =
      Pattern.compile("(?:^|[\\s{\\[(|,])(--[a-zA-Z][-a-zA-Z0-9.]*)(?=$|[\\s}\\])|,])");
  public static final Pattern INLINE_SHORT =
      Pattern.compile(
          "(?:^|[\\s{\\[(|,])(-[a-zA-Z0-9?@](?:\\[[^\\]\\s]+\\])?)(?=$|[\\s}\\])|,])");

  // Description cleanup
  public static final Pattern DOT_LEADER = Pattern.compile("^(?:\\.+\\s+)+");
  public static final Pattern DESCRIPTION_SENTINEL = Pattern.compile("\\s--\\s{2,}.*$");
  public static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+");

  // Terminal noise
  public static final Pattern ANSI_CSI = Pattern.compile("\\x1b\\[[0-9;?]*[ -/]*[@-~]");
  public static final Pattern OVERSTRIKE = Pattern.compile(".\\x08");
}
