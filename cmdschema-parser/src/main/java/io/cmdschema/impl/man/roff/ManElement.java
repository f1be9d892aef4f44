package io.cmdschema.impl.man.roff;

/** Semantic elements of a man(7) section. */
public sealed interface ManElement
    permits ManElement.TaggedParagraph,
        ManElement.IndentedParagraph,
        ManElement.Text,
        ManElement.Paragraph {

  int line();

  /** {@code .TP}: the tag line and the first body line. */
  record TaggedParagraph(String tag, String description, int line) implements ManElement {}

  /** {@code .IP tag text}; {@code tag} may be null. */
  record IndentedParagraph(String tag, String text, int line) implements ManElement {}

  record Text(String value, int line) implements ManElement {}

  /** {@code .PP} or {@code .P}. */
  record Paragraph(int line) implements ManElement {}
}
