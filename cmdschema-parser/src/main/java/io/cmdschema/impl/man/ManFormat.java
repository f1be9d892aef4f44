package io.cmdschema.impl.man;

/** Manual page variants the man strategy can read. */
public enum ManFormat {
  /** BSD mdoc macros ({@code .Dt}, {@code .Sh}, {@code .Fl}). */
  MDOC,
  /** Classic man macros ({@code .TH}, {@code .SH}, {@code .TP}). */
  MAN,
  /** Formatted output of {@code man}, without macros. */
  RENDERED
}
