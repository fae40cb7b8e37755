package org.devolia.smcache.resilience;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for RetryBackoff.
 *
 * @author Devolia
 * @since 1.0.0
 */
class RetryBackoffTest {

  @Test
  void testFirstFailureWaitsBaseDelay() {
    RetryBackoff backoff = new RetryBackoff(1000, 2, 3_600_000);
    assertEquals(Duration.ofMillis(1000), backoff.delayAfter(1));
  }

  @Test
  void testDelayDoublesPerFailure() {
    RetryBackoff backoff = new RetryBackoff(1, 2, Long.MAX_VALUE / 4);
    for (int failures = 1; failures <= 20; failures++) {
      assertEquals(Duration.ofMillis(1L << (failures - 1)), backoff.delayAfter(failures));
    }
  }

  @Test
  void testDelayCappedAtMax() {
    RetryBackoff backoff = new RetryBackoff(1000, 2, 3_600_000);
    assertEquals(Duration.ofMillis(2_048_000), backoff.delayAfter(12));
    assertEquals(Duration.ofMillis(3_600_000), backoff.delayAfter(13));
    assertEquals(Duration.ofMillis(3_600_000), backoff.delayAfter(100));
  }

  @Test
  void testGrowthFactorOfOneKeepsDelayConstant() {
    RetryBackoff backoff = new RetryBackoff(250, 1, 1000);
    assertEquals(Duration.ofMillis(250), backoff.delayAfter(1));
    assertEquals(Duration.ofMillis(250), backoff.delayAfter(10));
  }

  @Test
  void testInvalidArguments() {
    assertThrows(IllegalArgumentException.class, () -> new RetryBackoff(0, 2, 1000));
    assertThrows(IllegalArgumentException.class, () -> new RetryBackoff(100, 0.5, 1000));
    assertThrows(IllegalArgumentException.class, () -> new RetryBackoff(100, 2, 10));
    RetryBackoff backoff = new RetryBackoff(100, 2, 1000);
    assertThrows(IllegalArgumentException.class, () -> backoff.delayAfter(0));
  }
}
