package io.cmdschema.api;

/** A parse result paired with its quality report. */
public record ExtractionRun(ParseResult result, ExtractionReport report) {}
