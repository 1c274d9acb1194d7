package io.b2mash.newsletter.senders.verification.ses;

import io.b2mash.newsletter.senders.config.SenderProperties;
import io.b2mash.newsletter.senders.domainverification.DnsRecord;
import io.b2mash.newsletter.senders.exception.ExternalServiceException;
import io.b2mash.newsletter.senders.verification.DkimRecords;
import io.b2mash.newsletter.senders.verification.ProviderVerificationStatus;
import io.b2mash.newsletter.senders.verification.VerificationProvider;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.sesv2.SesV2Client;
import software.amazon.awssdk.services.sesv2.model.AlreadyExistsException;
import software.amazon.awssdk.services.sesv2.model.CreateEmailIdentityRequest;
import software.amazon.awssdk.services.sesv2.model.CreateEmailIdentityResponse;
import software.amazon.awssdk.services.sesv2.model.DeleteEmailIdentityRequest;
import software.amazon.awssdk.services.sesv2.model.DkimAttributes;
import software.amazon.awssdk.services.sesv2.model.GetEmailIdentityRequest;
import software.amazon.awssdk.services.sesv2.model.GetEmailIdentityResponse;
import software.amazon.awssdk.services.sesv2.model.NotFoundException;
import software.amazon.awssdk.services.sesv2.model.SendCustomVerificationEmailRequest;

/** Amazon SES (v2) implementation of {@link VerificationProvider}. */
@Component
@ConditionalOnProperty(
    name = "senders.verification.provider",
    havingValue = "ses",
    matchIfMissing = true)
public class SesVerificationProvider implements VerificationProvider {

  private static final Logger log = LoggerFactory.getLogger(SesVerificationProvider.class);

  private static final String SERVICE = "ses";

  private final SesV2Client ses;
  private final SenderProperties properties;

  public SesVerificationProvider(SesV2Client ses, SenderProperties properties) {
    this.ses = ses;
    this.properties = properties;
  }

  @Override
  public String providerId() {
    return SERVICE;
  }

  @Override
  public String identityReference(String identity) {
    String prefix = properties.identityArnPrefix();
    return prefix != null && !prefix.isBlank() ? prefix + identity : identity;
  }

  @Override
  public void initiateMailboxVerification(String email) {
    try {
      if (hasText(properties.verificationTemplateName())) {
        ses.sendCustomVerificationEmail(
            SendCustomVerificationEmailRequest.builder()
                .emailAddress(email)
                .templateName(properties.verificationTemplateName())
                .configurationSetName(blankToNull(properties.sesConfigurationSet()))
                .build());
        log.info("Sent custom verification email: email={}", email);
        return;
      }
      try {
        createIdentity(email);
        log.info("Initiated mailbox verification: email={}", email);
      } catch (AlreadyExistsException e) {
        resumeExistingMailboxIdentity(email);
      }
    } catch (SdkException e) {
      log.error("SES mailbox verification failed: email={}", email, e);
      throw new ExternalServiceException(SERVICE, e);
    }
  }

  @Override
  public List<DnsRecord> initiateDomainVerification(String domain) {
    try {
      DkimAttributes dkim;
      try {
        dkim = createIdentity(domain).dkimAttributes();
      } catch (AlreadyExistsException e) {
        log.info("Domain identity already registered, reusing DKIM tokens: domain={}", domain);
        dkim = getIdentity(domain).dkimAttributes();
      }
      var records = new ArrayList<DnsRecord>();
      if (dkim != null && dkim.hasTokens()) {
        int position = 1;
        for (String token : dkim.tokens()) {
          records.add(DkimRecords.cname(domain, token, position++));
        }
      }
      log.info("Initiated domain verification: domain={}, records={}", domain, records.size());
      return records;
    } catch (SdkException e) {
      log.error("SES domain verification failed: domain={}", domain, e);
      throw new ExternalServiceException(SERVICE, e);
    }
  }

  @Override
  public ProviderVerificationStatus pollVerificationStatus(String identity) {
    GetEmailIdentityResponse response;
    try {
      response = getIdentity(identity);
    } catch (NotFoundException e) {
      return ProviderVerificationStatus.NOT_FOUND;
    } catch (SdkException e) {
      log.error("SES status check failed: identity={}", identity, e);
      throw new ExternalServiceException(SERVICE, e);
    }
    return statusOf(response);
  }

  @Override
  public void deleteIdentity(String identity) {
    try {
      ses.deleteEmailIdentity(DeleteEmailIdentityRequest.builder().emailIdentity(identity).build());
      log.info("Deleted SES identity: identity={}", identity);
    } catch (NotFoundException e) {
      log.debug("SES identity already absent: identity={}", identity);
    } catch (SdkException e) {
      log.error("SES identity deletion failed: identity={}", identity, e);
      throw new ExternalServiceException(SERVICE, e);
    }
  }

  /**
   * Identities are shared by every tenant of the account. A verified or pending identity is left as
   * it is; only a failed one is registered again, as SES never re-sends its verification email.
   */
  private void resumeExistingMailboxIdentity(String email) {
    switch (statusOf(getIdentity(email))) {
      case SUCCESS -> log.info("Mailbox identity already verified: email={}", email);
      case FAILED -> {
        log.info("Mailbox identity failed verification, registering again: email={}", email);
        ses.deleteEmailIdentity(DeleteEmailIdentityRequest.builder().emailIdentity(email).build());
        createIdentity(email);
      }
      default -> log.info("Mailbox identity verification in progress: email={}", email);
    }
  }

  private static ProviderVerificationStatus statusOf(GetEmailIdentityResponse response) {
    if (response.verificationStatus() == null) {
      return Boolean.TRUE.equals(response.verifiedForSendingStatus())
          ? ProviderVerificationStatus.SUCCESS
          : ProviderVerificationStatus.PENDING;
    }
    return switch (response.verificationStatus()) {
      case SUCCESS -> ProviderVerificationStatus.SUCCESS;
      case FAILED -> ProviderVerificationStatus.FAILED;
      default -> ProviderVerificationStatus.PENDING;
    };
  }

  private CreateEmailIdentityResponse createIdentity(String identity) {
    return ses.createEmailIdentity(
        CreateEmailIdentityRequest.builder()
            .emailIdentity(identity)
            .configurationSetName(blankToNull(properties.sesConfigurationSet()))
            .build());
  }

  private GetEmailIdentityResponse getIdentity(String identity) {
    return ses.getEmailIdentity(GetEmailIdentityRequest.builder().emailIdentity(identity).build());
  }

  private static boolean hasText(String value) {
    return value != null && !value.isBlank();
  }

  private static String blankToNull(String value) {
    return hasText(value) ? value : null;
  }
}
