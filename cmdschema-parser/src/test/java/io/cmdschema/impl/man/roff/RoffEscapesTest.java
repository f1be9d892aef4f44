package io.cmdschema.impl.man.roff;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class RoffEscapesTest {

  @Test
  void dropsFontSelections() {
    assertEquals("bold text", RoffEscapes.decode("\\fBbold\\fR text"));
    assertEquals("code", RoffEscapes.decode("\\f(CWcode\\fP"));
    assertEquals("x", RoffEscapes.decode("\\f[BI]x\\f[]"));
  }

  @Test
  void decodesLiteralCharacters() {
    assertEquals("--all", RoffEscapes.decode("\\-\\-all"));
    assertEquals("a b", RoffEscapes.decode("a\\ b"));
    assertEquals("a\\b", RoffEscapes.decode("a\\\\b"));
    assertEquals(".", RoffEscapes.decode("\\&."));
  }

  @Test
  void dropsSpecialGlyphs() {
    assertEquals("xy", RoffEscapes.decode("x\\(emy"));
  }

  @Test
  void keepsTrailingBackslash() {
    assertEquals("a\\", RoffEscapes.decode("a\\"));
  }
}
