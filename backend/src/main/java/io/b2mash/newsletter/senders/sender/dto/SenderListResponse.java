package io.b2mash.newsletter.senders.sender.dto;

import io.b2mash.newsletter.senders.sender.SenderOverview;
import io.b2mash.newsletter.senders.tier.TierLimits;
import java.util.List;

public record SenderListResponse(List<SenderResponse> senders, TierLimits tierLimits) {

  public static SenderListResponse from(SenderOverview overview) {
    return new SenderListResponse(
        overview.senders().stream().map(SenderResponse::from).toList(), overview.tierLimits());
  }
}
