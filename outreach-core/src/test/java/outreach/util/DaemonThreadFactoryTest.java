package outreach.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DaemonThreadFactoryTest {

  @Test
  void threadsAreDaemonsWithNumberedNames() {
    DaemonThreadFactory factory = new DaemonThreadFactory("outreach-test-");

    Thread first = factory.newThread(() -> { });
    Thread second = factory.newThread(() -> { });

    assertTrue(first.isDaemon());
    assertEquals("outreach-test-1", first.getName());
    assertEquals("outreach-test-2", second.getName());
  }

  @Test
  void nullPrefixRejected() {
    assertThrows(NullPointerException.class, () -> new DaemonThreadFactory(null));
  }
}
