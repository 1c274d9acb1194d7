package io.b2mash.newsletter.senders.sender.dto;

import io.b2mash.newsletter.senders.sender.StatusRefresh;
import java.time.Instant;

public record SenderStatusResponse(
    SenderResponse sender, boolean statusChanged, String providerStatus, Instant lastChecked) {

  public static SenderStatusResponse from(StatusRefresh refresh) {
    return new SenderStatusResponse(
        SenderResponse.from(refresh.sender()),
        refresh.statusChanged(),
        refresh.providerStatus() != null ? refresh.providerStatus().wireValue() : null,
        refresh.lastChecked());
  }
}
