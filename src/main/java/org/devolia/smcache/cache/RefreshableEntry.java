package org.devolia.smcache.cache;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import org.devolia.smcache.client.SecretVersion;
import org.devolia.smcache.resilience.ExceptionClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A cached backend result that refreshes itself on read when it is due.
 *
 * <p>Every {@link #getValue(String)} call runs under the entry's own lock:
 *
 * <ol>
 *   <li>refresh if an explicit refresh was requested, if the retry window after a failure has
 *       elapsed, or, when no failure is pending, if the subclass reports the result as stale
 *   <li>resolve the requested stage against the stored result, fresh or stale
 *   <li>rethrow the last failure when nothing resolves, otherwise return a copy
 * </ol>
 *
 * <p>A failed refresh never discards the previous result. Consecutive failures push the next retry
 * out exponentially; the first success resets the schedule. Concurrent readers of one entry wait
 * for an in-flight refresh instead of starting their own.
 *
 * @param <T> type of the backend result
 * @author Devolia
 * @since 1.0.0
 */
abstract class RefreshableEntry<T> {

  private static final Logger logger = LoggerFactory.getLogger(RefreshableEntry.class);

  protected final CacheContext context;
  protected final String secretId;

  private final ReentrantLock lock = new ReentrantLock();

  // Guarded by lock
  private Object result;
  private RuntimeException exception;
  private int exceptionCount;
  private boolean refreshNeeded = true;
  private Instant nextRetryTime;

  RefreshableEntry(CacheContext context, String secretId) {
    this.context = context;
    this.secretId = secretId;
  }

  /**
   * Fetches a fresh result from the backend.
   *
   * @return the backend result
   * @throws RuntimeException if the backend call fails
   */
  protected abstract T executeRefresh();

  /**
   * Resolves the requested stage against the stored result.
   *
   * @param storedResult the current result, or null if no refresh has succeeded yet
   * @param versionStage the requested stage
   * @return the matching version payload, or empty if none matches
   */
  protected abstract Optional<SecretVersion> resolve(T storedResult, String versionStage);

  /** Entry type used in log lines and metric tags. */
  protected abstract String entryType();

  /**
   * Whether the stored result has aged out. Only consulted while no failure is pending.
   *
   * @param now the current time
   * @return true if a refresh is due
   */
  protected boolean isStale(Instant now) {
    return false;
  }

  /**
   * Called under the lock after a successful refresh.
   *
   * @param now the time the refresh completed
   */
  protected void onRefreshSuccess(Instant now) {}

  /**
   * Gets the cached value for the given stage, refreshing first if needed.
   *
   * @param versionStage the requested stage, null or blank for the configured default
   * @return a copy of the resolved version, or empty if no version carries the stage
   * @throws RuntimeException the last backend failure, when nothing could be resolved
   */
  Optional<SecretVersion> getValue(String versionStage) {
    String stage =
        versionStage == null || versionStage.isBlank()
            ? context.config().getDefaultVersionStage()
            : versionStage;
    lock.lock();
    try {
      refresh();
      Optional<SecretVersion> value = resolve(storedResult(), stage);
      if (value.isEmpty() && exception != null) {
        throw exception;
      }
      return value.map(SecretVersion::copy);
    } finally {
      lock.unlock();
    }
  }

  /** Forces the next {@link #getValue(String)} to go to the backend regardless of timers. */
  void refreshNow() {
    lock.lock();
    try {
      refreshNeeded = true;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Gets the time after which a failed refresh may be retried.
   *
   * @return the retry time, or null if no failure has occurred
   */
  Instant getNextRetryTime() {
    lock.lock();
    try {
      return nextRetryTime;
    } finally {
      lock.unlock();
    }
  }

  int getExceptionCount() {
    lock.lock();
    try {
      return exceptionCount;
    } finally {
      lock.unlock();
    }
  }

  boolean hasPendingException() {
    lock.lock();
    try {
      return exception != null;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Reads entry state under the entry lock.
   *
   * @param reader reads the guarded state
   * @param <R> type of the value read
   * @return the value read
   */
  protected <R> R readLocked(Supplier<R> reader) {
    lock.lock();
    try {
      return reader.get();
    } finally {
      lock.unlock();
    }
  }

  protected Instant now() {
    return context.clock().instant();
  }

  private boolean isRefreshNeeded(Instant now) {
    if (refreshNeeded) {
      return true;
    }
    if (exception != null) {
      return nextRetryTime != null && !nextRetryTime.isAfter(now);
    }
    return isStale(now);
  }

  private void refresh() {
    if (!isRefreshNeeded(now())) {
      return;
    }
    refreshNeeded = false;
    long startTime = System.nanoTime();
    T fetched;
    try {
      fetched = executeRefresh();
    } catch (RuntimeException e) {
      onRefreshFailure(e, System.nanoTime() - startTime);
      return;
    }
    long latencyNanos = System.nanoTime() - startTime;

    storeResult(fetched);
    exception = null;
    exceptionCount = 0;
    nextRetryTime = null;
    onRefreshSuccess(now());
    context.metrics().recordRefreshSuccess(entryType(), latencyNanos);
    logger.debug("Refreshed {} entry for secret {}", entryType(), maskSecretId(secretId));
  }

  private void onRefreshFailure(RuntimeException e, long latencyNanos) {
    exception = e;
    exceptionCount++;
    Duration delay = context.retryBackoff().delayAfter(exceptionCount);
    nextRetryTime = now().plus(delay);

    String errorCategory = ExceptionClassifier.getErrorCategory(e);
    context.metrics().recordRefreshFailure(entryType(), errorCategory, latencyNanos);
    logger.warn(
        "Failed to refresh {} entry for secret {} (category: {}, consecutive failures: {}),"
            + " next retry in {}ms",
        entryType(),
        maskSecretId(secretId),
        errorCategory,
        exceptionCount,
        delay.toMillis(),
        e);
  }

  private void storeResult(T fetched) {
    SecretCacheHook hook = context.config().getSecretCacheHook();
    result = hook != null ? hook.put(fetched) : fetched;
  }

  @SuppressWarnings("unchecked")
  private T storedResult() {
    SecretCacheHook hook = context.config().getSecretCacheHook();
    if (result == null) {
      return null;
    }
    return (T) (hook != null ? hook.get(result) : result);
  }

  /**
   * Masks secret ids for safe logging.
   *
   * @param secretId the secret id to mask
   * @return masked secret id for logging
   */
  static String maskSecretId(String secretId) {
    if (secretId == null || secretId.length() <= 3) {
      return "***";
    }
    return secretId.substring(0, 2) + "***" + secretId.substring(secretId.length() - 1);
  }
}
