package io.b2mash.newsletter.senders.config;

import java.net.URI;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.eventbridge.EventBridgeClient;
import software.amazon.awssdk.services.sesv2.SesV2Client;

/**
 * AWS SDK clients shared by the whole process. Each client is created once, reused across
 * requests and closed with the application context.
 */
@Configuration
@EnableConfigurationProperties({
  SenderProperties.class,
  AwsConfig.AwsProperties.class,
  AwsConfig.AwsCredentialsProperties.class
})
public class AwsConfig {

  @ConfigurationProperties("aws")
  public record AwsProperties(String region, String endpoint) {}

  @ConfigurationProperties("aws.credentials")
  public record AwsCredentialsProperties(String accessKeyId, String secretAccessKey) {}

  @Bean(destroyMethod = "close")
  @ConditionalOnProperty(
      name = "senders.store.provider",
      havingValue = "dynamodb",
      matchIfMissing = true)
  DynamoDbClient dynamoDbClient(
      AwsProperties awsProps, AwsCredentialsProperties credProps, SenderProperties senderProps) {
    var builder =
        DynamoDbClient.builder()
            .region(Region.of(awsProps.region()))
            .credentialsProvider(credentials(awsProps, credProps))
            .overrideConfiguration(timeouts(senderProps));
    if (hasEndpoint(awsProps)) {
      builder.endpointOverride(URI.create(awsProps.endpoint()));
    }
    return builder.build();
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnProperty(
      name = "senders.verification.provider",
      havingValue = "ses",
      matchIfMissing = true)
  SesV2Client sesV2Client(
      AwsProperties awsProps, AwsCredentialsProperties credProps, SenderProperties senderProps) {
    var builder =
        SesV2Client.builder()
            .region(Region.of(awsProps.region()))
            .credentialsProvider(credentials(awsProps, credProps))
            .overrideConfiguration(timeouts(senderProps));
    if (hasEndpoint(awsProps)) {
      builder.endpointOverride(URI.create(awsProps.endpoint()));
    }
    return builder.build();
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnProperty(
      name = "senders.events.provider",
      havingValue = "eventbridge",
      matchIfMissing = true)
  EventBridgeClient eventBridgeClient(
      AwsProperties awsProps, AwsCredentialsProperties credProps, SenderProperties senderProps) {
    var builder =
        EventBridgeClient.builder()
            .region(Region.of(awsProps.region()))
            .credentialsProvider(credentials(awsProps, credProps))
            .overrideConfiguration(timeouts(senderProps));
    if (hasEndpoint(awsProps)) {
      builder.endpointOverride(URI.create(awsProps.endpoint()));
    }
    return builder.build();
  }

  private static ClientOverrideConfiguration timeouts(SenderProperties senderProps) {
    return ClientOverrideConfiguration.builder()
        .apiCallTimeout(senderProps.storeTimeout())
        .apiCallAttemptTimeout(senderProps.storeTimeout())
        .build();
  }

  private static boolean hasEndpoint(AwsProperties awsProps) {
    return awsProps.endpoint() != null && !awsProps.endpoint().isBlank();
  }

  // Static credentials only for local stacks reached through an endpoint override.
  private static AwsCredentialsProvider credentials(
      AwsProperties awsProps, AwsCredentialsProperties credProps) {
    if (hasEndpoint(awsProps) && credProps.accessKeyId() != null) {
      return StaticCredentialsProvider.create(
          AwsBasicCredentials.create(credProps.accessKeyId(), credProps.secretAccessKey()));
    }
    return DefaultCredentialsProvider.create();
  }
}
