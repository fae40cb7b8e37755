package org.devolia.smcache.client;

/**
 * The two backend operations the secret cache depends on.
 *
 * <p>Implementations are shared by every cache entry and every calling thread, so they must be
 * safe for concurrent use. Failures are reported as unchecked exceptions; the cache does not
 * interpret their type.
 *
 * @author Devolia
 * @since 1.0.0
 */
public interface SecretsBackend extends AutoCloseable {

  /**
   * Describes a secret, including the mapping of its version ids to stage labels.
   *
   * @param secretId the secret name or ARN
   * @return the secret metadata, possibly without any versions
   * @throws RuntimeException if the backend call fails
   */
  SecretMetadata describe(String secretId);

  /**
   * Fetches the payload of one specific secret version.
   *
   * @param secretId the secret name or ARN
   * @param versionId the version identifier
   * @return the version payload
   * @throws RuntimeException if the backend call fails
   */
  SecretVersion getVersion(String secretId, String versionId);

  /** Releases backend resources. The default implementation holds none. */
  @Override
  default void close() {}
}
