package io.b2mash.newsletter.senders.domainverification;

import static org.hamcrest.Matchers.hasSize;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.jwt;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import io.b2mash.newsletter.senders.store.memory.InMemoryKeyValueStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.webmvc.test.autoconfigure.AutoConfigureMockMvc;
import org.springframework.http.MediaType;
import org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.JwtRequestPostProcessor;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class DomainVerificationControllerIntegrationTest {

  private static final String TENANT = "brand_domains";

  @Autowired private MockMvc mockMvc;
  @Autowired private InMemoryKeyValueStore store;

  @BeforeEach
  void clearStore() {
    store.clear();
  }

  @Test
  void initiate_returnsDnsRecordsAndGuidance() throws Exception {
    initiate(tenantJwt("pro-tier"), "Example.com")
        .andExpect(status().isCreated())
        .andExpect(header().string("Location", "/api/senders/domain/example.com"))
        .andExpect(jsonPath("$.domain").value("example.com"))
        .andExpect(jsonPath("$.verificationStatus").value("pending"))
        .andExpect(jsonPath("$.dnsRecords", hasSize(3)))
        .andExpect(jsonPath("$.dnsRecords[0].type").value("CNAME"))
        .andExpect(jsonPath("$.instructions").isNotEmpty())
        .andExpect(jsonPath("$.estimatedVerificationTime").exists())
        .andExpect(jsonPath("$.troubleshooting").isNotEmpty());
  }

  @Test
  void initiate_onFreeTierIsUnauthorized() throws Exception {
    initiate(tenantJwt("free-tier"), "example.com")
        .andExpect(status().isUnauthorized())
        .andExpect(
            jsonPath("$.message")
                .value("DNS verification not available for your tier. Current tier: free-tier"));
  }

  @Test
  void initiate_malformedDomainIsBadRequest() throws Exception {
    initiate(tenantJwt("pro-tier"), "not a domain")
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("Invalid domain name: not a domain"));
  }

  @Test
  void get_returnsPendingRecord() throws Exception {
    initiate(tenantJwt("pro-tier"), "example.com").andExpect(status().isCreated());

    mockMvc
        .perform(get("/api/senders/domain/example.com").with(tenantJwt("pro-tier")))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.verificationStatus").value("pending"))
        .andExpect(jsonPath("$.dnsRecords", hasSize(3)));
  }

  @Test
  void get_unknownDomainIsNotFound() throws Exception {
    mockMvc
        .perform(get("/api/senders/domain/unknown.example").with(tenantJwt("pro-tier")))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.message").exists());
  }

  private ResultActions initiate(JwtRequestPostProcessor token, String domain) throws Exception {
    return mockMvc.perform(
        post("/api/senders/domain")
            .with(token)
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"domain\": \"%s\"}".formatted(domain)));
  }

  private JwtRequestPostProcessor tenantJwt(String tier) {
    return jwt()
        .jwt(
            j ->
                j.subject("user_domains")
                    .claim("custom:tenant_id", TENANT)
                    .claim("custom:tier", tier));
  }
}
