package org.devolia.smcache.cache;

/**
 * Hook into the in-memory storage of cached results.
 *
 * <p>{@link #put(Object)} is applied to every backend result before it is stored and {@link
 * #get(Object)} to the stored object whenever it is read, e.g. to keep secrets encrypted while they
 * sit in memory. Both methods run while the owning entry's lock is held: keep them fast and never
 * call back into the cache from them.
 *
 * @author Devolia
 * @since 1.0.0
 */
public interface SecretCacheHook {

  /**
   * Prepares an object for storing in the cache.
   *
   * @param object the backend result
   * @return the object to store
   */
  Object put(Object object);

  /**
   * Derives the original object from the stored one.
   *
   * @param cachedObject the stored object
   * @return the object previously passed to {@link #put(Object)}
   */
  Object get(Object cachedObject);
}
