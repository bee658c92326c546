package ca.gc.cra.sluice.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class StringsTest {

  @Test
  void requireNonBlankTrims() {
    assertEquals("run-7", Strings.requireNonBlank("runId", "  run-7 "));
  }

  @Test
  void requireNonBlankRejectsBlankAndControlCharacters() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("runId", "   "));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("runId", "run\u0007"));
    assertThrows(NullPointerException.class, () -> Strings.requireNonBlank("runId", null));
  }

  @Test
  void sanitizeIdentifierRejectsSeparators() {
    assertEquals("tap-csv.v2", Strings.sanitizeIdentifier("id", "tap-csv.v2"));
    assertThrows(IllegalArgumentException.class, () -> Strings.sanitizeIdentifier("id", "tap/csv"));
  }

  @Test
  void requirePrintableAsciiEnforcesLengthAndCharset() {
    assertEquals("env=prod", Strings.requirePrintableAscii("attrs", "env=prod", 16));
    assertThrows(IllegalArgumentException.class, () -> Strings.requirePrintableAscii("attrs", "x".repeat(17), 16));
    assertThrows(IllegalArgumentException.class, () -> Strings.requirePrintableAscii("attrs", "café", 16));
  }
}
