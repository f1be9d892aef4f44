package io.cmdschema.impl.man.roff;

import java.util.List;

/** One lexed roff source line. */
public sealed interface RoffToken permits RoffToken.Macro, RoffToken.Text, RoffToken.Newline {

  /** Index of the normalized line the token was read from. */
  int line();

  /** A request or macro line such as {@code .TP} or {@code .Fl v}. */
  record Macro(String name, List<String> args, int line) implements RoffToken {
    public Macro {
      args = List.copyOf(args);
    }

    public boolean is(String macroName) {
      return name.equals(macroName);
    }

    /** Arguments joined with single spaces. */
    public String joinedArgs() {
      return String.join(" ", args);
    }
  }

  /** A text line with escapes decoded. */
  record Text(String value, int line) implements RoffToken {}

  /** A blank line or a comment. */
  record Newline(int line) implements RoffToken {}
}
