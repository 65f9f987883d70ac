package ca.gc.cra.beacon.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class StringsTest {

  @Test
  void requireNonBlankTrims() {
    assertEquals("value", Strings.requireNonBlank("field", "  value "));
  }

  @Test
  void requireNonBlankRejectsBlankAndControlCharacters() {
    assertThrows(NullPointerException.class, () -> Strings.requireNonBlank("field", null));
    IllegalArgumentException blank =
        assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("field", "   "));
    assertEquals("field must not be blank", blank.getMessage());
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("field", "a\u0007b"));
  }

  @Test
  void channelTokensAreLowerCased() {
    assertEquals("barora", Strings.requireChannelToken("area", " Barora "));
    assertEquals("cv-area", Strings.requireChannelToken("area", "CV-Area"));
  }

  @Test
  void channelTokensRejectSeparatorsAndSpaces() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requireChannelToken("area", "bar_ora"));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireChannelToken("area", "two words"));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireChannelToken("type", "-cd"));
  }
}
