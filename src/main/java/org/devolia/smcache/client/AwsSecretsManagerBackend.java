package org.devolia.smcache.client;

import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.secretsmanager.SecretsManagerClient;
import software.amazon.awssdk.services.secretsmanager.model.DescribeSecretRequest;
import software.amazon.awssdk.services.secretsmanager.model.DescribeSecretResponse;
import software.amazon.awssdk.services.secretsmanager.model.GetSecretValueRequest;
import software.amazon.awssdk.services.secretsmanager.model.GetSecretValueResponse;

/**
 * {@link SecretsBackend} backed by the AWS Secrets Manager SDK client.
 *
 * <p>{@code DescribeSecret} supplies the version to stage mapping and {@code GetSecretValue}
 * supplies version payloads. SDK exceptions are passed through unchanged.
 *
 * @author Devolia
 * @since 1.0.0
 */
public class AwsSecretsManagerBackend implements SecretsBackend {

  private static final Logger logger = LoggerFactory.getLogger(AwsSecretsManagerBackend.class);

  private final SecretsManagerClient client;
  private final boolean ownsClient;

  /**
   * Wraps a caller-managed client. The client is not closed by {@link #close()}.
   *
   * @param client the Secrets Manager client
   */
  public AwsSecretsManagerBackend(SecretsManagerClient client) {
    this(client, false);
  }

  /**
   * Wraps a client.
   *
   * @param client the Secrets Manager client
   * @param ownsClient whether {@link #close()} should close the client
   */
  public AwsSecretsManagerBackend(SecretsManagerClient client, boolean ownsClient) {
    this.client = Objects.requireNonNull(client, "client cannot be null");
    this.ownsClient = ownsClient;
  }

  @Override
  public SecretMetadata describe(String secretId) {
    DescribeSecretResponse response =
        client.describeSecret(DescribeSecretRequest.builder().secretId(secretId).build());
    if (!response.hasVersionIdsToStages()) {
      logger.debug("DescribeSecret returned no versions for secret {}", secretId);
      return new SecretMetadata(response.name(), Map.of());
    }
    return new SecretMetadata(response.name(), response.versionIdsToStages());
  }

  @Override
  public SecretVersion getVersion(String secretId, String versionId) {
    GetSecretValueResponse response =
        client.getSecretValue(
            GetSecretValueRequest.builder().secretId(secretId).versionId(versionId).build());
    return new SecretVersion(
        secretId,
        response.versionId() != null ? response.versionId() : versionId,
        response.secretString(),
        response.secretBinary() != null ? response.secretBinary().asByteArray() : null);
  }

  @Override
  public void close() {
    if (ownsClient) {
      logger.debug("Closing Secrets Manager client");
      client.close();
    }
  }
}
