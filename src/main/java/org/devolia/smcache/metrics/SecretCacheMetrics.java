package org.devolia.smcache.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Metrics collector for the secret cache.
 *
 * <p>This class provides Micrometer-based metrics for monitoring the cache:
 *
 * <ul>
 *   <li><strong>secret_cache_lookups_total</strong> - Counter of top-level lookups by result
 *       (hit, miss)
 *   <li><strong>secret_cache_refreshes_total</strong> - Counter of backend refreshes by entry type
 *       status and error category
 *   <li><strong>secret_cache_refresh_latency_seconds</strong> - Latency of backend refreshes
 * </ul>
 *
 * @author Devolia
 * @since 1.0.0
 */
public class SecretCacheMetrics {

  private static final Logger logger = LoggerFactory.getLogger(SecretCacheMetrics.class);

  // Metric names
  private static final String LOOKUPS_TOTAL = "secret_cache_lookups_total";
  private static final String REFRESHES_TOTAL = "secret_cache_refreshes_total";
  private static final String REFRESH_LATENCY_SECONDS = "secret_cache_refresh_latency_seconds";

  // Status tags
  private static final String STATUS_SUCCESS = "success";
  private static final String STATUS_ERROR = "error";

  /** Entry type tag for secret metadata refreshes. */
  public static final String ENTRY_SECRET = "secret";

  /** Entry type tag for secret version refreshes. */
  public static final String ENTRY_VERSION = "version";

  private final MeterRegistry meterRegistry;

  private final Counter hitCounter;
  private final Counter missCounter;
  private final Timer refreshTimer;

  /**
   * Creates the collector and registers its base meters.
   *
   * @param meterRegistry the Micrometer meter registry
   */
  public SecretCacheMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry cannot be null");

    this.hitCounter =
        Counter.builder(LOOKUPS_TOTAL)
            .description("Total number of secret cache lookups")
            .tag("result", "hit")
            .register(meterRegistry);

    this.missCounter =
        Counter.builder(LOOKUPS_TOTAL)
            .description("Total number of secret cache lookups")
            .tag("result", "miss")
            .register(meterRegistry);

    this.refreshTimer =
        Timer.builder(REFRESH_LATENCY_SECONDS)
            .description("Latency of secret cache refreshes")
            .register(meterRegistry);

    logger.debug("Initialized secret cache metrics");
  }

  /** Records a lookup that found a cached entry. */
  public void recordHit() {
    hitCounter.increment();
  }

  /** Records a lookup that had to create a new entry. */
  public void recordMiss() {
    missCounter.increment();
  }

  /**
   * Records a successful refresh.
   *
   * @param entryType {@link #ENTRY_SECRET} or {@link #ENTRY_VERSION}
   * @param latencyNanos the refresh latency in nanoseconds
   */
  public void recordRefreshSuccess(String entryType, long latencyNanos) {
    refreshCounter(entryType, STATUS_SUCCESS, "none").increment();
    refreshTimer.record(Duration.ofNanos(latencyNanos));
  }

  /**
   * Records a failed refresh.
   *
   * @param entryType {@link #ENTRY_SECRET} or {@link #ENTRY_VERSION}
   * @param errorCategory the error category (e.g., "throttled", "not_found")
   * @param latencyNanos the refresh latency in nanoseconds
   */
  public void recordRefreshFailure(String entryType, String errorCategory, long latencyNanos) {
    refreshCounter(entryType, STATUS_ERROR, errorCategory != null ? errorCategory : "unknown")
        .increment();
    refreshTimer.record(Duration.ofNanos(latencyNanos));
    logger.debug(
        "Recorded failed {} refresh - category: {}, latency: {}ms",
        entryType,
        errorCategory,
        latencyNanos / 1_000_000);
  }

  public double getHitCount() {
    return hitCounter.count();
  }

  public double getMissCount() {
    return missCounter.count();
  }

  /**
   * Gets the number of successful refreshes for an entry type.
   *
   * @param entryType the entry type tag
   * @return success count
   */
  public double getRefreshSuccessCount(String entryType) {
    Counter counter =
        meterRegistry
            .find(REFRESHES_TOTAL)
            .tag("entry", entryType)
            .tag("status", STATUS_SUCCESS)
            .counter();
    return counter != null ? counter.count() : 0.0;
  }

  /**
   * Gets the number of failed refreshes for an entry type, across all error categories.
   *
   * @param entryType the entry type tag
   * @return failure count
   */
  public double getRefreshFailureCount(String entryType) {
    return meterRegistry.find(REFRESHES_TOTAL).tag("entry", entryType).tag("status", STATUS_ERROR)
        .counters().stream()
        .mapToDouble(Counter::count)
        .sum();
  }

  /**
   * Gets the mean refresh latency in milliseconds.
   *
   * @return mean latency in milliseconds
   */
  public double getMeanRefreshLatencyMs() {
    return refreshTimer.mean(TimeUnit.MILLISECONDS);
  }

  private Counter refreshCounter(String entryType, String status, String errorCategory) {
    return Counter.builder(REFRESHES_TOTAL)
        .description("Total number of secret cache refreshes")
        .tag("entry", entryType)
        .tag("status", status)
        .tag("error_category", errorCategory)
        .register(meterRegistry);
  }
}
