package io.b2mash.newsletter.senders.domainverification;

/** One DNS record a tenant must publish to prove control of a domain. */
public record DnsRecord(String name, String type, String value, String description) {}
