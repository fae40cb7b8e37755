package org.devolia.smcache.resilience;

import io.github.resilience4j.core.IntervalFunction;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Exponential backoff schedule for retrying failed cache refreshes.
 *
 * <p>The delay after the n-th consecutive failure is {@code min(base * growth^(n-1), max)}, so the
 * first failure waits exactly the base delay. Arithmetic is delegated to Resilience4j's {@link
 * IntervalFunction}.
 *
 * @author Devolia
 * @since 1.0.0
 */
public class RetryBackoff {

  private static final Logger logger = LoggerFactory.getLogger(RetryBackoff.class);

  private final long baseDelayMillis;
  private final double growthFactor;
  private final long maxDelayMillis;
  private final IntervalFunction intervalFunction;

  /**
   * Creates a backoff schedule.
   *
   * @param baseDelayMillis delay after the first failure, at least 1ms
   * @param growthFactor multiplier applied per consecutive failure, at least 1
   * @param maxDelayMillis upper bound for any delay, at least the base delay
   * @throws IllegalArgumentException if the parameters are out of range
   */
  public RetryBackoff(long baseDelayMillis, double growthFactor, long maxDelayMillis) {
    if (baseDelayMillis < 1) {
      throw new IllegalArgumentException("Base delay must be at least 1ms: " + baseDelayMillis);
    }
    if (growthFactor < 1.0) {
      throw new IllegalArgumentException("Growth factor must be at least 1: " + growthFactor);
    }
    if (maxDelayMillis < baseDelayMillis) {
      throw new IllegalArgumentException(
          "Max delay " + maxDelayMillis + "ms is lower than base delay " + baseDelayMillis + "ms");
    }
    this.baseDelayMillis = baseDelayMillis;
    this.growthFactor = growthFactor;
    this.maxDelayMillis = maxDelayMillis;
    this.intervalFunction =
        IntervalFunction.ofExponentialBackoff(baseDelayMillis, growthFactor, maxDelayMillis);

    logger.debug(
        "Retry backoff initialized - base: {}ms, growth: {}, max: {}ms",
        baseDelayMillis,
        growthFactor,
        maxDelayMillis);
  }

  /**
   * Computes the wait before the next attempt.
   *
   * @param consecutiveFailures number of consecutive failures so far, including the latest one
   * @return the delay before a retry is allowed
   * @throws IllegalArgumentException if consecutiveFailures is less than 1
   */
  public Duration delayAfter(int consecutiveFailures) {
    if (consecutiveFailures < 1) {
      throw new IllegalArgumentException(
          "Consecutive failures must be at least 1: " + consecutiveFailures);
    }
    long millis = Math.min(intervalFunction.apply(consecutiveFailures), maxDelayMillis);
    return Duration.ofMillis(millis);
  }

  public long getBaseDelayMillis() {
    return baseDelayMillis;
  }

  public double getGrowthFactor() {
    return growthFactor;
  }

  public long getMaxDelayMillis() {
    return maxDelayMillis;
  }
}
