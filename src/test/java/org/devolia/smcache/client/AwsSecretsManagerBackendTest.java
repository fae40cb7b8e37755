package org.devolia.smcache.client;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.services.secretsmanager.SecretsManagerClient;
import software.amazon.awssdk.services.secretsmanager.model.DescribeSecretRequest;
import software.amazon.awssdk.services.secretsmanager.model.DescribeSecretResponse;
import software.amazon.awssdk.services.secretsmanager.model.GetSecretValueRequest;
import software.amazon.awssdk.services.secretsmanager.model.GetSecretValueResponse;
import software.amazon.awssdk.services.secretsmanager.model.ResourceNotFoundException;

/**
 * Unit tests for AwsSecretsManagerBackend.
 *
 * @author Devolia
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class AwsSecretsManagerBackendTest {

  @Mock private SecretsManagerClient client;

  @Test
  void testDescribeMapsVersionStages() {
    when(client.describeSecret(any(DescribeSecretRequest.class)))
        .thenReturn(
            DescribeSecretResponse.builder()
                .name("prod/db")
                .versionIdsToStages(
                    Map.of("v1", List.of("AWSPREVIOUS"), "v2", List.of("AWSCURRENT")))
                .build());
    AwsSecretsManagerBackend backend = new AwsSecretsManagerBackend(client);

    SecretMetadata metadata = backend.describe("prod/db");

    assertEquals("prod/db", metadata.getName());
    assertEquals(Set.of("AWSCURRENT"), metadata.getVersionIdsToStages().get("v2"));
    assertEquals(Optional.of("v2"), metadata.findVersionId("AWSCURRENT"));

    ArgumentCaptor<DescribeSecretRequest> request =
        ArgumentCaptor.forClass(DescribeSecretRequest.class);
    verify(client).describeSecret(request.capture());
    assertEquals("prod/db", request.getValue().secretId());
  }

  @Test
  void testDescribeWithoutVersions() {
    when(client.describeSecret(any(DescribeSecretRequest.class)))
        .thenReturn(DescribeSecretResponse.builder().name("empty").build());
    AwsSecretsManagerBackend backend = new AwsSecretsManagerBackend(client);

    SecretMetadata metadata = backend.describe("empty");

    assertTrue(metadata.getVersionIdsToStages().isEmpty());
    assertEquals(Optional.empty(), metadata.findVersionId("AWSCURRENT"));
  }

  @Test
  void testGetVersionString() {
    when(client.getSecretValue(any(GetSecretValueRequest.class)))
        .thenReturn(
            GetSecretValueResponse.builder().versionId("v1").secretString("mysecret").build());
    AwsSecretsManagerBackend backend = new AwsSecretsManagerBackend(client);

    SecretVersion version = backend.getVersion("prod/db", "v1");

    assertEquals("v1", version.getVersionId());
    assertEquals(Optional.of("mysecret"), version.getSecretString());
    assertEquals(Optional.empty(), version.getSecretBinary());

    ArgumentCaptor<GetSecretValueRequest> request =
        ArgumentCaptor.forClass(GetSecretValueRequest.class);
    verify(client).getSecretValue(request.capture());
    assertEquals("prod/db", request.getValue().secretId());
    assertEquals("v1", request.getValue().versionId());
  }

  @Test
  void testGetVersionBinary() {
    when(client.getSecretValue(any(GetSecretValueRequest.class)))
        .thenReturn(
            GetSecretValueResponse.builder()
                .secretBinary(SdkBytes.fromByteArray(new byte[] {1, 2, 3}))
                .build());
    AwsSecretsManagerBackend backend = new AwsSecretsManagerBackend(client);

    SecretVersion version = backend.getVersion("prod/cert", "v7");

    assertEquals("v7", version.getVersionId());
    assertArrayEquals(new byte[] {1, 2, 3}, version.getSecretBinary().orElseThrow());
    assertEquals(Optional.empty(), version.getSecretString());
  }

  @Test
  void testServiceExceptionsPropagate() {
    ResourceNotFoundException notFound =
        ResourceNotFoundException.builder().message("not found").build();
    when(client.describeSecret(any(DescribeSecretRequest.class))).thenThrow(notFound);
    AwsSecretsManagerBackend backend = new AwsSecretsManagerBackend(client);

    ResourceNotFoundException thrown =
        assertThrows(ResourceNotFoundException.class, () -> backend.describe("x"));
    assertSame(notFound, thrown);
  }

  @Test
  void testCloseOnlyClosesOwnedClient() {
    new AwsSecretsManagerBackend(client).close();
    verify(client, never()).close();

    new AwsSecretsManagerBackend(client, true).close();
    verify(client).close();
  }
}
