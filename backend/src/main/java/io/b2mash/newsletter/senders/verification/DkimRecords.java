package io.b2mash.newsletter.senders.verification;

import io.b2mash.newsletter.senders.domainverification.DnsRecord;

/** Builds the CNAME records that publish Easy DKIM tokens. */
public final class DkimRecords {

  private DkimRecords() {}

  public static DnsRecord cname(String domain, String token, int position) {
    return new DnsRecord(
        token + "._domainkey." + domain,
        "CNAME",
        token + ".dkim.amazonses.com",
        "DKIM token " + position + " for email authentication");
  }
}
