package io.cmdschema.impl.text;

/** The definition and description halves of a two-column help row, both trimmed and non-empty. */
public record Columns(String left, String right) {}
