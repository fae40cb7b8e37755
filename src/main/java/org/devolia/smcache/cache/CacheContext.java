package org.devolia.smcache.cache;

import java.time.Clock;
import org.devolia.smcache.client.SecretsBackend;
import org.devolia.smcache.metrics.SecretCacheMetrics;
import org.devolia.smcache.resilience.RetryBackoff;

/** Collaborators shared read-only by every entry of one {@link SecretCache}. */
final class CacheContext {

  private final SecretCacheConfig config;
  private final SecretsBackend backend;
  private final SecretCacheMetrics metrics;
  private final RetryBackoff retryBackoff;
  private final Clock clock;

  CacheContext(
      SecretCacheConfig config, SecretsBackend backend, SecretCacheMetrics metrics, Clock clock) {
    this.config = config;
    this.backend = backend;
    this.metrics = metrics;
    this.clock = clock;
    this.retryBackoff =
        new RetryBackoff(
            config.getExceptionRetryDelayBase(),
            config.getExceptionRetryGrowthFactor(),
            config.getExceptionRetryDelayMax());
  }

  SecretCacheConfig config() {
    return config;
  }

  SecretsBackend backend() {
    return backend;
  }

  SecretCacheMetrics metrics() {
    return metrics;
  }

  RetryBackoff retryBackoff() {
    return retryBackoff;
  }

  Clock clock() {
    return clock;
  }
}
