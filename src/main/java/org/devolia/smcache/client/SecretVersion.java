package org.devolia.smcache.client;

import java.util.Optional;

/**
 * Payload of one immutable secret version.
 *
 * <p>Either payload field may be absent. The binary payload is copied on the way in and on the way
 * out so no caller can reach the cached array.
 *
 * @author Devolia
 * @since 1.0.0
 */
public final class SecretVersion {

  private final String secretId;
  private final String versionId;
  private final String secretString;
  private final byte[] secretBinary;

  /**
   * Creates a secret version payload.
   *
   * @param secretId the secret the version belongs to
   * @param versionId the version identifier
   * @param secretString the string payload, or null
   * @param secretBinary the binary payload, or null
   */
  public SecretVersion(
      String secretId, String versionId, String secretString, byte[] secretBinary) {
    this.secretId = secretId;
    this.versionId = versionId;
    this.secretString = secretString;
    this.secretBinary = secretBinary == null ? null : secretBinary.clone();
  }

  public String getSecretId() {
    return secretId;
  }

  public String getVersionId() {
    return versionId;
  }

  /**
   * Gets the string payload.
   *
   * @return the secret string, or empty if the version has none
   */
  public Optional<String> getSecretString() {
    return Optional.ofNullable(secretString);
  }

  /**
   * Gets a copy of the binary payload.
   *
   * @return the secret bytes, or empty if the version has none
   */
  public Optional<byte[]> getSecretBinary() {
    return secretBinary == null ? Optional.empty() : Optional.of(secretBinary.clone());
  }

  /**
   * Creates an independent deep copy of this payload.
   *
   * @return a copy sharing no mutable state with this instance
   */
  public SecretVersion copy() {
    return new SecretVersion(secretId, versionId, secretString, secretBinary);
  }

  // Never print payloads
  @Override
  public String toString() {
    return "SecretVersion{secretId=" + secretId + ", versionId=" + versionId + "}";
  }
}
