package io.cmdschema.impl.man.roff;

/** Semantic elements of an mdoc section. */
public sealed interface MdocElement
    permits MdocElement.Flag,
        MdocElement.Arg,
        MdocElement.Command,
        MdocElement.Text,
        MdocElement.Paragraph {

  int line();

  /** {@code .Fl}; the name carries its dashes. */
  record Flag(String name, boolean optional, int line) implements MdocElement {}

  /** {@code .Ar}; the name is lower-cased without brackets. */
  record Arg(String name, boolean optional, int line) implements MdocElement {}

  /** {@code .Cm} or {@code .Ic}. */
  record Command(String name, int line) implements MdocElement {}

  record Text(String value, int line) implements MdocElement {}

  /** {@code .Pp}. */
  record Paragraph(int line) implements MdocElement {}
}
