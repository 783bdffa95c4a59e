package ca.bsd.logcheck.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class StringsTest {

  @Test
  void requireNonBlankTrims() {
    assertEquals("*.txt", Strings.requireNonBlank("pattern", "  *.txt "));
  }

  @Test
  void requireNonBlankRejectsBadInput() {
    assertThrows(NullPointerException.class, () -> Strings.requireNonBlank("pattern", null));
    IllegalArgumentException blank =
        assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("pattern", "   "));
    assertTrue(blank.getMessage().startsWith("pattern"));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("pattern", "a\u0000b"));
  }

  @Test
  void requirePrintableAsciiEnforcesLengthAndRange() {
    assertEquals("env=dev", Strings.requirePrintableAscii("attrs", "env=dev", 16));
    assertThrows(IllegalArgumentException.class, () -> Strings.requirePrintableAscii("attrs", "env=dev", 3));
    assertThrows(IllegalArgumentException.class, () -> Strings.requirePrintableAscii("attrs", "é", 16));
    assertThrows(IllegalArgumentException.class, () -> Strings.requirePrintableAscii("attrs", "x", 0));
  }
}
