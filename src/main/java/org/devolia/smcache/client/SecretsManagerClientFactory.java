package org.devolia.smcache.client;

import java.net.URI;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.core.client.config.SdkAdvancedClientOption;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.secretsmanager.SecretsManagerClient;
import software.amazon.awssdk.services.secretsmanager.SecretsManagerClientBuilder;

/**
 * Creates {@link SecretsManagerClient} instances tagged with the cache's user agent.
 *
 * <p>Region and credentials fall back to the SDK's default provider chains when not given.
 *
 * @author Devolia
 * @since 1.0.0
 */
public final class SecretsManagerClientFactory {

  private static final Logger logger = LoggerFactory.getLogger(SecretsManagerClientFactory.class);

  static final String USER_AGENT_PREFIX = "AwsSecretCache/";
  private static final String FALLBACK_VERSION = "0.0.0";

  private SecretsManagerClientFactory() {}

  /**
   * Creates a client using the default region and credential chains.
   *
   * @return a new client
   */
  public static SecretsManagerClient create() {
    return create(null, null, null);
  }

  /**
   * Creates a client.
   *
   * @param region the region, or null for the default region chain
   * @param endpointOverride an endpoint override (e.g. a local emulator), or null
   * @param credentialsProvider a credentials provider, or null for the default chain
   * @return a new client
   */
  public static SecretsManagerClient create(
      Region region, URI endpointOverride, AwsCredentialsProvider credentialsProvider) {
    SecretsManagerClientBuilder builder =
        SecretsManagerClient.builder()
            .overrideConfiguration(
                ClientOverrideConfiguration.builder()
                    .putAdvancedOption(SdkAdvancedClientOption.USER_AGENT_SUFFIX, userAgent())
                    .build());
    if (region != null) {
      builder.region(region);
    }
    if (endpointOverride != null) {
      builder.endpointOverride(endpointOverride);
    }
    if (credentialsProvider != null) {
      builder.credentialsProvider(credentialsProvider);
    }

    SecretsManagerClient client = builder.build();
    logger.info(
        "Created SecretsManagerClient (region: {}, endpoint: {})",
        region != null ? region.id() : "default",
        endpointOverride != null ? endpointOverride : "default");
    return client;
  }

  /**
   * Gets the user agent suffix sent with every request.
   *
   * @return the user agent suffix
   */
  static String userAgent() {
    String version = SecretsManagerClientFactory.class.getPackage().getImplementationVersion();
    return USER_AGENT_PREFIX + (version != null ? version : FALLBACK_VERSION);
  }
}
