package io.b2mash.newsletter.senders.sender;

import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.jwt;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.jayway.jsonpath.JsonPath;
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
class SenderControllerIntegrationTest {

  private static final String TENANT = "brand_alpha";
  private static final String OTHER_TENANT = "brand_beta";

  @Autowired private MockMvc mockMvc;
  @Autowired private InMemoryKeyValueStore store;

  @BeforeEach
  void clearStore() {
    store.clear();
  }

  @Test
  void createSender_firstSenderIsPendingDefault() throws Exception {
    createSender(tenantJwt(TENANT, "pro-tier"), "news@example.com", "mailbox")
        .andExpect(status().isCreated())
        .andExpect(header().string("Location", startsWith("/api/senders/")))
        .andExpect(jsonPath("$.email").value("news@example.com"))
        .andExpect(jsonPath("$.verificationType").value("mailbox"))
        .andExpect(jsonPath("$.verificationStatus").value("pending"))
        .andExpect(jsonPath("$.isDefault").value(true))
        .andExpect(jsonPath("$.emailsSent").value(0));
  }

  @Test
  void listSenders_includesTierLimits() throws Exception {
    createSender(tenantJwt(TENANT, "creator-tier"), "news@example.com", "mailbox");

    mockMvc
        .perform(get("/api/senders").with(tenantJwt(TENANT, "creator-tier")))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.senders", hasSize(1)))
        .andExpect(jsonPath("$.tierLimits.tier").value("creator-tier"))
        .andExpect(jsonPath("$.tierLimits.maxSenders").value(2))
        .andExpect(jsonPath("$.tierLimits.currentCount").value(1))
        .andExpect(jsonPath("$.tierLimits.canUseDNS").value(true));
  }

  @Test
  void createSender_beyondTierQuotaIsBadRequest() throws Exception {
    createSender(tenantJwt(TENANT, "free-tier"), "first@example.com", "mailbox")
        .andExpect(status().isCreated());

    createSender(tenantJwt(TENANT, "free-tier"), "second@example.com", "mailbox")
        .andExpect(status().isBadRequest())
        .andExpect(
            jsonPath("$.message")
                .value("Maximum sender limit reached (1). Current tier: free-tier"))
        .andExpect(jsonPath("$.upgradeUrl").value("/settings/billing"));
  }

  @Test
  void createSender_domainOnFreeTierIsUnauthorized() throws Exception {
    createSender(tenantJwt(TENANT, "free-tier"), "news@example.com", "domain")
        .andExpect(status().isUnauthorized())
        .andExpect(
            jsonPath("$.message")
                .value("DNS verification not available for your tier. Current tier: free-tier"));
  }

  @Test
  void createSender_duplicateEmailIsConflict() throws Exception {
    createSender(tenantJwt(TENANT, "pro-tier"), "news@example.com", "mailbox");

    createSender(tenantJwt(TENANT, "pro-tier"), "NEWS@example.com", "mailbox")
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.message").value("Email address already configured"));
  }

  @Test
  void createSender_blankEmailIsBadRequest() throws Exception {
    mockMvc
        .perform(
            post("/api/senders")
                .with(tenantJwt(TENANT, "pro-tier"))
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"email\": \"\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").exists());
  }

  @Test
  void createSender_withoutTenantClaimIsUnauthorized() throws Exception {
    createSender(jwt().jwt(j -> j.subject("user_without_brand")), "news@example.com", "mailbox")
        .andExpect(status().isUnauthorized())
        .andExpect(
            jsonPath("$.message").value("A brand is required before senders can be managed"));
  }

  @Test
  void listSenders_withoutTokenIsUnauthorized() throws Exception {
    mockMvc.perform(get("/api/senders")).andExpect(status().isUnauthorized());
  }

  @Test
  void getSender_unknownIdIsNotFound() throws Exception {
    mockMvc
        .perform(get("/api/senders/does-not-exist").with(tenantJwt(TENANT, "pro-tier")))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.message").value("No sender found with id does-not-exist"));
  }

  @Test
  void getSender_otherTenantIsNotFound() throws Exception {
    String senderId = createdSenderId(TENANT, "news@example.com");

    mockMvc
        .perform(get("/api/senders/" + senderId).with(tenantJwt(OTHER_TENANT, "pro-tier")))
        .andExpect(status().isNotFound());
  }

  @Test
  void updateSender_renames() throws Exception {
    String senderId = createdSenderId(TENANT, "news@example.com");

    mockMvc
        .perform(
            put("/api/senders/" + senderId)
                .with(tenantJwt(TENANT, "pro-tier"))
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"name\": \"Weekly Digest\"}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.name").value("Weekly Digest"));
  }

  @Test
  void updateSender_changingEmailIsBadRequest() throws Exception {
    String senderId = createdSenderId(TENANT, "news@example.com");

    mockMvc
        .perform(
            put("/api/senders/" + senderId)
                .with(tenantJwt(TENANT, "pro-tier"))
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"email\": \"other@example.com\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("Email cannot be changed after creation"));
  }

  @Test
  void deleteSender_removesSender() throws Exception {
    String senderId = createdSenderId(TENANT, "news@example.com");

    mockMvc
        .perform(delete("/api/senders/" + senderId).with(tenantJwt(TENANT, "pro-tier")))
        .andExpect(status().isNoContent());

    mockMvc
        .perform(get("/api/senders/" + senderId).with(tenantJwt(TENANT, "pro-tier")))
        .andExpect(status().isNotFound());
  }

  @Test
  void refreshStatus_reportsProviderStatus() throws Exception {
    String senderId = createdSenderId(TENANT, "news@example.com");

    mockMvc
        .perform(put("/api/senders/" + senderId + "/status").with(tenantJwt(TENANT, "pro-tier")))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.sender.verificationStatus").value("pending"))
        .andExpect(jsonPath("$.statusChanged").value(false))
        .andExpect(jsonPath("$.providerStatus").value("pending"))
        .andExpect(jsonPath("$.lastChecked").exists());
  }

  @Test
  void resendVerification_immediatelyAfterCreateIsThrottled() throws Exception {
    String senderId = createdSenderId(TENANT, "news@example.com");

    mockMvc
        .perform(
            post("/api/senders/" + senderId + "/verification").with(tenantJwt(TENANT, "pro-tier")))
        .andExpect(status().isTooManyRequests())
        .andExpect(jsonPath("$.retryAfterSeconds").exists());
  }

  private String createdSenderId(String tenantId, String email) throws Exception {
    var result =
        createSender(tenantJwt(tenantId, "pro-tier"), email, "mailbox")
            .andExpect(status().isCreated())
            .andReturn();
    return JsonPath.read(result.getResponse().getContentAsString(), "$.senderId");
  }

  private ResultActions createSender(JwtRequestPostProcessor token, String email, String type)
      throws Exception {
    return mockMvc.perform(
        post("/api/senders")
            .with(token)
            .contentType(MediaType.APPLICATION_JSON)
            .content(
                "{\"email\": \"%s\", \"name\": \"Newsletter\", \"verificationType\": \"%s\"}"
                    .formatted(email, type)));
  }

  private JwtRequestPostProcessor tenantJwt(String tenantId, String tier) {
    return jwt()
        .jwt(
            j ->
                j.subject("user_" + tenantId)
                    .claim("custom:tenant_id", tenantId)
                    .claim("custom:tier", tier));
  }
}
