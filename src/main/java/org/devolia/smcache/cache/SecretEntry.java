package org.devolia.smcache.cache;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;
import org.devolia.smcache.client.SecretMetadata;
import org.devolia.smcache.client.SecretVersion;
import org.devolia.smcache.metrics.SecretCacheMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Cache entry for one secret id.
 *
 * <p>Holds the secret's metadata and resolves a stage label to a version id through it. The
 * metadata is refreshed on a jittered schedule: after each successful describe the next refresh is
 * drawn uniformly between half the configured interval and the full interval, so entries created
 * together do not refresh together. Version payloads live in a small child LRU of {@link
 * SecretVersionEntry}.
 *
 * @author Devolia
 * @since 1.0.0
 */
class SecretEntry extends RefreshableEntry<SecretMetadata> {

  private static final Logger logger = LoggerFactory.getLogger(SecretEntry.class);

  static final int VERSION_CACHE_SIZE = 10;

  private final LruCache<String, SecretVersionEntry> versions = new LruCache<>(VERSION_CACHE_SIZE);

  // Guarded by the entry lock
  private Instant nextRefreshTime;

  SecretEntry(CacheContext context, String secretId) {
    super(context, secretId);
    this.nextRefreshTime = now();
  }

  @Override
  protected SecretMetadata executeRefresh() {
    return context.backend().describe(secretId);
  }

  @Override
  protected boolean isStale(Instant now) {
    return !nextRefreshTime.isAfter(now);
  }

  @Override
  protected void onRefreshSuccess(Instant now) {
    long interval = context.config().getSecretRefreshInterval();
    long minSeconds = Math.max(1, Math.round(interval / 2.0));
    long ttlSeconds = ThreadLocalRandom.current().nextLong(minSeconds, interval + 1);
    nextRefreshTime = now.plusSeconds(ttlSeconds);
    logger.debug("Next metadata refresh for secret {} in {}s", maskSecretId(secretId), ttlSeconds);
  }

  @Override
  protected Optional<SecretVersion> resolve(SecretMetadata metadata, String versionStage) {
    if (metadata == null) {
      return Optional.empty();
    }
    Optional<String> versionId = metadata.findVersionId(versionStage);
    if (versionId.isEmpty()) {
      logger.debug(
          "No version of secret {} carries stage {}", maskSecretId(secretId), versionStage);
      return Optional.empty();
    }
    return versionEntry(versionId.get()).getValue(versionStage);
  }

  @Override
  protected String entryType() {
    return SecretCacheMetrics.ENTRY_SECRET;
  }

  /**
   * Gets the next scheduled metadata refresh.
   *
   * @return the refresh time
   */
  Instant getNextRefreshTime() {
    return readLocked(() -> nextRefreshTime);
  }

  LruCache<String, SecretVersionEntry> versions() {
    return versions;
  }

  // Called under the entry lock, so the lookup and insert cannot interleave with another reader
  private SecretVersionEntry versionEntry(String versionId) {
    Optional<SecretVersionEntry> cached = versions.get(versionId);
    if (cached.isPresent()) {
      return cached.get();
    }
    SecretVersionEntry created = new SecretVersionEntry(context, secretId, versionId);
    versions.putIfAbsent(versionId, created);
    return created;
  }
}
