package org.devolia.smcache.cache;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.util.Objects;
import java.util.Optional;
import org.devolia.smcache.client.AwsSecretsManagerBackend;
import org.devolia.smcache.client.SecretVersion;
import org.devolia.smcache.client.SecretsBackend;
import org.devolia.smcache.client.SecretsManagerClientFactory;
import org.devolia.smcache.metrics.SecretCacheMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-process cache of secret values.
 *
 * <p>Keeps recently used secrets in a bounded LRU so repeated reads do not each cost a backend
 * round-trip:
 *
 * <ul>
 *   <li>Metadata is refreshed lazily on read, on a jittered interval
 *   <li>Version payloads are fetched once and kept
 *   <li>Failed refreshes are retried with exponential backoff while stale values keep being served
 *   <li>Thread-safe; concurrent reads of one secret share a single backend call
 * </ul>
 *
 * <p>Usage:
 *
 * <pre>
 * try (SecretCache cache = new SecretCache()) {
 *   String password = cache.getSecretString("prod/db/password").orElseThrow();
 * }
 * </pre>
 *
 * @author Devolia
 * @since 1.0.0
 */
public class SecretCache implements AutoCloseable {

  private static final Logger logger = LoggerFactory.getLogger(SecretCache.class);

  private final SecretCacheConfig config;
  private final SecretsBackend backend;
  private final boolean ownsBackend;
  private final SecretCacheMetrics metrics;
  private final CacheContext context;
  private final LruCache<String, SecretEntry> entries;

  /** Creates a cache with default configuration over a default AWS Secrets Manager client. */
  public SecretCache() {
    this(SecretCacheConfig.defaultConfig());
  }

  /**
   * Creates a cache over a default AWS Secrets Manager client. The client is closed by {@link
   * #close()}.
   *
   * @param config cache configuration
   */
  public SecretCache(SecretCacheConfig config) {
    this(
        Objects.requireNonNull(config, "config cannot be null"),
        new AwsSecretsManagerBackend(SecretsManagerClientFactory.create(), true),
        true,
        new SimpleMeterRegistry(),
        Clock.systemUTC());
  }

  /**
   * Creates a cache over a caller-managed backend.
   *
   * @param config cache configuration
   * @param backend the secrets backend, not closed by this cache
   */
  public SecretCache(SecretCacheConfig config, SecretsBackend backend) {
    this(config, backend, new SimpleMeterRegistry());
  }

  /**
   * Creates a cache over a caller-managed backend, publishing metrics to the given registry.
   *
   * @param config cache configuration
   * @param backend the secrets backend, not closed by this cache
   * @param meterRegistry registry for cache metrics
   */
  public SecretCache(
      SecretCacheConfig config, SecretsBackend backend, MeterRegistry meterRegistry) {
    this(config, backend, false, meterRegistry, Clock.systemUTC());
  }

  SecretCache(
      SecretCacheConfig config,
      SecretsBackend backend,
      boolean ownsBackend,
      MeterRegistry meterRegistry,
      Clock clock) {
    this.config = Objects.requireNonNull(config, "config cannot be null");
    this.backend = Objects.requireNonNull(backend, "backend cannot be null");
    this.ownsBackend = ownsBackend;
    this.metrics = new SecretCacheMetrics(meterRegistry);
    this.context = new CacheContext(config, backend, metrics, clock);
    this.entries = new LruCache<>(config.getMaxCacheSize());

    logger.info(
        "Initialized secret cache (max size: {}, refresh interval: {}s, default stage: {})",
        config.getMaxCacheSize(),
        config.getSecretRefreshInterval(),
        config.getDefaultVersionStage());
  }

  /**
   * Gets the string value of the secret's default stage.
   *
   * @param secretId the secret name or ARN
   * @return the secret string, or empty if the resolved version has none
   * @throws RuntimeException the last backend failure, when nothing cached can be served
   */
  public Optional<String> getSecretString(String secretId) {
    return getSecretString(secretId, null);
  }

  /**
   * Gets the string value of the version carrying the given stage.
   *
   * @param secretId the secret name or ARN
   * @param versionStage the stage label, null for the configured default
   * @return the secret string, or empty if no version carries the stage or it has no string
   * @throws RuntimeException the last backend failure, when nothing cached can be served
   */
  public Optional<String> getSecretString(String secretId, String versionStage) {
    return getSecretValue(secretId, versionStage).flatMap(SecretVersion::getSecretString);
  }

  /**
   * Gets the binary value of the secret's default stage.
   *
   * @param secretId the secret name or ARN
   * @return a copy of the secret bytes, or empty if the resolved version has none
   * @throws RuntimeException the last backend failure, when nothing cached can be served
   */
  public Optional<byte[]> getSecretBinary(String secretId) {
    return getSecretBinary(secretId, null);
  }

  /**
   * Gets the binary value of the version carrying the given stage.
   *
   * @param secretId the secret name or ARN
   * @param versionStage the stage label, null for the configured default
   * @return a copy of the secret bytes, or empty if no version carries the stage or it has none
   * @throws RuntimeException the last backend failure, when nothing cached can be served
   */
  public Optional<byte[]> getSecretBinary(String secretId, String versionStage) {
    return getSecretValue(secretId, versionStage).flatMap(SecretVersion::getSecretBinary);
  }

  /**
   * Makes the next read of the secret go to the backend, ignoring the refresh schedule.
   *
   * @param secretId the secret name or ARN
   */
  public void refreshSecretNow(String secretId) {
    getOrCreateEntry(secretId).refreshNow();
    logger.debug(
        "Scheduled immediate refresh of secret {}", RefreshableEntry.maskSecretId(secretId));
  }

  /**
   * Gets the cache configuration.
   *
   * @return the immutable configuration
   */
  public SecretCacheConfig getConfig() {
    return config;
  }

  /**
   * Gets the cache metrics.
   *
   * @return the metrics collector
   */
  public SecretCacheMetrics getMetrics() {
    return metrics;
  }

  /**
   * Gets the number of cached secrets.
   *
   * @return number of secret entries
   */
  public int getCacheSize() {
    return entries.size();
  }

  /** Closes the backend if this cache created it. */
  @Override
  public void close() {
    logger.debug("Closing secret cache");
    if (ownsBackend) {
      backend.close();
    }
  }

  private Optional<SecretVersion> getSecretValue(String secretId, String versionStage) {
    return getOrCreateEntry(secretId).getValue(versionStage);
  }

  /**
   * Finds the entry for a secret or inserts a new one. Entries are cheap to build: nothing is
   * fetched until the first read.
   */
  SecretEntry getOrCreateEntry(String secretId) {
    if (secretId == null || secretId.trim().isEmpty()) {
      throw new IllegalArgumentException("Secret id cannot be null or empty");
    }
    Optional<SecretEntry> cached = entries.get(secretId);
    if (cached.isPresent()) {
      metrics.recordHit();
      return cached.get();
    }
    metrics.recordMiss();
    SecretEntry created = new SecretEntry(context, secretId);
    entries.putIfAbsent(secretId, created);
    // Another thread may have won the insert; a zero-capacity cache keeps nothing at all
    return entries.get(secretId).orElse(created);
  }
}
