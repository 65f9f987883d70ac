package ca.gc.cra.beacon.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class NumbersTest {

  @Test
  void requireRangeAcceptsBounds() {
    assertEquals(1L, Numbers.requireRange("ackBatchSize", 1, 1, 100));
    assertEquals(100L, Numbers.requireRange("ackBatchSize", 100, 1, 100));
  }

  @Test
  void requireRangeReportsValue() {
    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> Numbers.requireRange("retentionDays", 0, 1, 365));
    assertEquals("retentionDays must be between 1 and 365 (was 0)", ex.getMessage());
  }

  @Test
  void parseRangeRejectsText() {
    assertEquals(42L, Numbers.parseRange("workers", " 42 ", 0, 64));
    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> Numbers.parseRange("workers", "many", 0, 64));
    assertTrue(ex.getMessage().contains("numeric"));
  }

  @Test
  void clampBoundsValue() {
    assertEquals(4, Numbers.clamp(2, 4, 8));
    assertEquals(8, Numbers.clamp(32, 4, 8));
    assertEquals(6, Numbers.clamp(6, 4, 8));
    assertThrows(IllegalArgumentException.class, () -> Numbers.clamp(1, 8, 4));
  }
}
