package org.devolia.smcache.cache;

import java.util.Optional;
import org.devolia.smcache.client.SecretVersion;
import org.devolia.smcache.metrics.SecretCacheMetrics;

/**
 * Cache entry pinned to one immutable secret version.
 *
 * <p>The payload is fetched once. It is never refreshed on a timer, only retried after a failed
 * fetch or on an explicit {@link #refreshNow()}.
 *
 * @author Devolia
 * @since 1.0.0
 */
class SecretVersionEntry extends RefreshableEntry<SecretVersion> {

  private final String versionId;

  SecretVersionEntry(CacheContext context, String secretId, String versionId) {
    super(context, secretId);
    this.versionId = versionId;
  }

  @Override
  protected SecretVersion executeRefresh() {
    return context.backend().getVersion(secretId, versionId);
  }

  // The stage was already resolved by the owning SecretEntry
  @Override
  protected Optional<SecretVersion> resolve(SecretVersion storedResult, String versionStage) {
    return Optional.ofNullable(storedResult);
  }

  @Override
  protected String entryType() {
    return SecretCacheMetrics.ENTRY_VERSION;
  }

  String getVersionId() {
    return versionId;
  }
}
