package io.sketchbridge.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class StringsTest {

  @Test
  void requireNonBlankTrims() {
    assertEquals("Sketch001", Strings.requireNonBlank("name", "  Sketch001 "));
  }

  @Test
  void requireNonBlankRejectsBlankAndNull() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("name", "   "));
    assertThrows(NullPointerException.class, () -> Strings.requireNonBlank("name", null));
  }

  @Test
  void requireNonBlankRejectsControlCharacters() {
    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("host", "local\nhost"));
    assertEquals("host contains a control character", ex.getMessage());
  }

  @Test
  void requirePrintableAsciiEnforcesLengthAndCharset() {
    assertEquals("XY", Strings.requirePrintableAscii("planeId", "XY", 8));
    assertThrows(IllegalArgumentException.class, () -> Strings.requirePrintableAscii("planeId", "ABCDEFGHI", 8));
    assertThrows(IllegalArgumentException.class, () -> Strings.requirePrintableAscii("planeId", "Ébauche", 32));
  }

  @Test
  void blankToNullNormalizes() {
    assertNull(Strings.blankToNull(null));
    assertNull(Strings.blankToNull("  "));
    assertEquals("value", Strings.blankToNull(" value "));
  }

  @Test
  void containsControlDetectsTabs() {
    assertTrue(Strings.containsControl("a\tb"));
    assertFalse(Strings.containsControl("a b"));
  }
}
