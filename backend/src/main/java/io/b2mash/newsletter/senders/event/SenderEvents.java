package io.b2mash.newsletter.senders.event;

import io.b2mash.newsletter.senders.domainverification.DomainVerificationRecord;
import io.b2mash.newsletter.senders.sender.Sender;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/** Factories for the events emitted on sender and domain changes. */
public final class SenderEvents {

  private SenderEvents() {}

  public static SenderEvent created(Sender sender, Instant now) {
    return forSender(SenderEvent.SENDER_CREATED, sender, now);
  }

  public static SenderEvent updated(Sender sender, Instant now) {
    return forSender(SenderEvent.SENDER_UPDATED, sender, now);
  }

  public static SenderEvent deleted(Sender sender, String promotedSenderId, Instant now) {
    var detail = senderDetail(sender);
    detail.put("promotedDefaultSenderId", promotedSenderId);
    return new SenderEvent(SenderEvent.SENDER_DELETED, sender.getTenantId(), detail, now);
  }

  public static SenderEvent statusChanged(Sender sender, Instant now) {
    return forSender(SenderEvent.SENDER_VERIFICATION_STATUS_CHANGED, sender, now);
  }

  public static SenderEvent domainStatusChanged(DomainVerificationRecord record, Instant now) {
    var detail = new LinkedHashMap<String, Object>();
    detail.put("domain", record.getDomain());
    detail.put("verificationStatus", record.getVerificationStatus().wireValue());
    detail.put("failureReason", record.getFailureReason());
    return new SenderEvent(
        SenderEvent.DOMAIN_VERIFICATION_STATUS_CHANGED, record.getTenantId(), detail, now);
  }

  private static SenderEvent forSender(String type, Sender sender, Instant now) {
    return new SenderEvent(type, sender.getTenantId(), senderDetail(sender), now);
  }

  private static Map<String, Object> senderDetail(Sender sender) {
    var detail = new LinkedHashMap<String, Object>();
    detail.put("senderId", sender.getSenderId());
    detail.put("email", sender.getEmail());
    detail.put("verificationType", sender.getVerificationType().wireValue());
    detail.put("verificationStatus", sender.getVerificationStatus().wireValue());
    detail.put("isDefault", sender.isDefault());
    detail.put("domain", sender.getDomain());
    return detail;
  }
}
