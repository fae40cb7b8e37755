package org.devolia.smcache.integration;

import static org.junit.jupiter.api.Assertions.*;

import java.net.URI;
import java.util.Optional;
import org.devolia.smcache.cache.SecretCache;
import org.devolia.smcache.cache.SecretCacheConfig;
import org.devolia.smcache.client.AwsSecretsManagerBackend;
import org.devolia.smcache.client.SecretsManagerClientFactory;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.containers.wait.strategy.Wait;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.secretsmanager.SecretsManagerClient;
import software.amazon.awssdk.services.secretsmanager.model.CreateSecretRequest;
import software.amazon.awssdk.services.secretsmanager.model.PutSecretValueRequest;
import software.amazon.awssdk.services.secretsmanager.model.ResourceNotFoundException;

/**
 * Integration test running the cache against a LocalStack Secrets Manager.
 *
 * <p>Skipped when no Docker daemon is available.
 *
 * @author Devolia
 * @since 1.0.0
 */
@Testcontainers(disabledWithoutDocker = true)
class LocalStackIntegrationTest {

  private static final Logger logger = LoggerFactory.getLogger(LocalStackIntegrationTest.class);

  private static final int LOCALSTACK_PORT = 4566;

  @Container
  static GenericContainer<?> localStackContainer =
      new GenericContainer<>(DockerImageName.parse("localstack/localstack:3.4"))
          .withExposedPorts(LOCALSTACK_PORT)
          .withEnv("SERVICES", "secretsmanager")
          .waitingFor(Wait.forHttp("/_localstack/health").forPort(LOCALSTACK_PORT));

  private static SecretsManagerClient client;

  @BeforeAll
  static void setupClient() {
    URI endpoint =
        URI.create(
            String.format(
                "http://%s:%d",
                localStackContainer.getHost(),
                localStackContainer.getMappedPort(LOCALSTACK_PORT)));
    client =
        SecretsManagerClientFactory.create(
            Region.US_EAST_1,
            endpoint,
            StaticCredentialsProvider.create(AwsBasicCredentials.create("test", "test")));
    logger.info("Secrets Manager client pointed at LocalStack on {}", endpoint);
  }

  @AfterAll
  static void closeClient() {
    if (client != null) {
      client.close();
    }
  }

  @Test
  void testReadsAndRefreshesStringSecret() {
    client.createSecret(
        CreateSecretRequest.builder().name("it/db/password").secretString("first").build());

    try (SecretCache cache =
        new SecretCache(SecretCacheConfig.defaultConfig(), new AwsSecretsManagerBackend(client))) {
      assertEquals(Optional.of("first"), cache.getSecretString("it/db/password"));

      client.putSecretValue(
          PutSecretValueRequest.builder()
              .secretId("it/db/password")
              .secretString("second")
              .build());

      // Still inside the refresh interval
      assertEquals(Optional.of("first"), cache.getSecretString("it/db/password"));

      cache.refreshSecretNow("it/db/password");
      assertEquals(Optional.of("second"), cache.getSecretString("it/db/password"));
      assertEquals(Optional.of("first"), cache.getSecretString("it/db/password", "AWSPREVIOUS"));
    }
  }

  @Test
  void testReadsBinarySecret() {
    client.createSecret(
        CreateSecretRequest.builder()
            .name("it/tls/key")
            .secretBinary(SdkBytes.fromByteArray(new byte[] {4, 5, 6}))
            .build());

    try (SecretCache cache =
        new SecretCache(SecretCacheConfig.defaultConfig(), new AwsSecretsManagerBackend(client))) {
      assertArrayEquals(new byte[] {4, 5, 6}, cache.getSecretBinary("it/tls/key").orElseThrow());
      assertEquals(Optional.empty(), cache.getSecretString("it/tls/key"));
    }
  }

  @Test
  void testMissingSecretSurfacesBackendError() {
    try (SecretCache cache =
        new SecretCache(SecretCacheConfig.defaultConfig(), new AwsSecretsManagerBackend(client))) {
      assertThrows(ResourceNotFoundException.class, () -> cache.getSecretString("it/missing"));
      assertEquals(1.0, cache.getMetrics().getRefreshFailureCount("secret"));
    }
  }
}
