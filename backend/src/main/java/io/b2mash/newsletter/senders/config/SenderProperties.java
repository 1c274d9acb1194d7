package io.b2mash.newsletter.senders.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Deployment settings for sender management.
 *
 * @param tableName single table holding senders, domain records and tenant ledgers
 * @param tenantIndexName secondary index used to list a tenant's senders
 * @param identityIndexName secondary index resolving provider identities across tenants
 * @param pendingIndexName sparse secondary index of pending verification attempts
 * @param storeTimeout upper bound for every store and provider call
 * @param verificationTimeout how long a verification may stay pending before it times out
 * @param resendCooldown minimum interval between two verification requests for one sender
 * @param identityArnPrefix prefix used to build provider identity references
 * @param sesConfigurationSet configuration set attached to created identities, optional
 * @param verificationTemplateName custom verification email template, optional
 * @param eventBusName event bus receiving sender events
 * @param eventSource source attribute of published events
 */
@ConfigurationProperties("senders")
public record SenderProperties(
    String tableName,
    String tenantIndexName,
    String identityIndexName,
    String pendingIndexName,
    Duration storeTimeout,
    Duration verificationTimeout,
    Duration resendCooldown,
    String identityArnPrefix,
    String sesConfigurationSet,
    String verificationTemplateName,
    String eventBusName,
    String eventSource) {

  public SenderProperties {
    if (tenantIndexName == null || tenantIndexName.isBlank()) {
      tenantIndexName = "GSI1";
    }
    if (identityIndexName == null || identityIndexName.isBlank()) {
      identityIndexName = "GSI2";
    }
    if (pendingIndexName == null || pendingIndexName.isBlank()) {
      pendingIndexName = "GSI3";
    }
    if (storeTimeout == null) {
      storeTimeout = Duration.ofSeconds(5);
    }
    if (verificationTimeout == null) {
      verificationTimeout = Duration.ofHours(24);
    }
    if (resendCooldown == null) {
      resendCooldown = Duration.ofMinutes(5);
    }
    if (eventBusName == null || eventBusName.isBlank()) {
      eventBusName = "default";
    }
    if (eventSource == null || eventSource.isBlank()) {
      eventSource = "newsletter.senders";
    }
  }
}
