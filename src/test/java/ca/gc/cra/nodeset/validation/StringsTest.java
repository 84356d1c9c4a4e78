package ca.gc.cra.nodeset.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class StringsTest {

  @Test
  void requireNonBlankStripsWhitespace() {
    assertEquals("value", Strings.requireNonBlank("test", "  value  "));
  }

  @Test
  void requireNonBlankRejectsControlCharacters() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("test", "bad\u0001"));
  }

  @Test
  void requireNonBlankRejectsBlank() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("test", "   "));
  }

  @Test
  void requireNoControlKeepsSurroundingSpaces() {
    assertEquals(" | ", Strings.requireNoControl("separator", " | "));
  }

  @Test
  void requireNoControlRejectsEmptyAndControl() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNoControl("separator", ""));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNoControl("separator", "\t"));
  }
}
