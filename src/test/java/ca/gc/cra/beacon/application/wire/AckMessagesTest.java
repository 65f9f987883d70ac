package ca.gc.cra.beacon.application.wire;

import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import org.junit.jupiter.api.Test;

class AckMessagesTest {

  @Test
  void rejectsEmptyBatch() {
    assertThrows(IllegalArgumentException.class, () -> AckMessages.build("client-1", List.of()));
    assertThrows(NullPointerException.class, () -> AckMessages.build(null, List.of("e1")));
  }
}
