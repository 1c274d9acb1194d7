package io.b2mash.newsletter.senders.webhook;

import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.jwt;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
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

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class SesEventWebhookControllerIntegrationTest {

  private static final String TENANT = "brand_alpha";
  private static final String SECRET = "test-webhook-secret";
  private static final String SUCCESS_EVENT =
      "{\"source\": \"aws.ses\", \"detail\": {\"event-type\": \"identityVerificationSuccess\","
          + " \"identity\": \"news@example.com\"}}";

  @Autowired private MockMvc mockMvc;
  @Autowired private InMemoryKeyValueStore store;

  @BeforeEach
  void clearStore() {
    store.clear();
  }

  @Test
  void identityEvent_verifiesSenderWithoutJwt() throws Exception {
    String senderId = createMailboxSender("news@example.com");

    mockMvc
        .perform(
            post("/api/webhooks/ses")
                .header("X-Webhook-Secret", SECRET)
                .contentType(MediaType.APPLICATION_JSON)
                .content(SUCCESS_EVENT))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.message").value("Event processed"));

    mockMvc
        .perform(get("/api/senders/" + senderId).with(tenantJwt()))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.verificationStatus").value("verified"));
  }

  @Test
  void identityEvent_withWrongSecretIsUnauthorized() throws Exception {
    String senderId = createMailboxSender("news@example.com");

    mockMvc
        .perform(
            post("/api/webhooks/ses")
                .header("X-Webhook-Secret", "wrong")
                .contentType(MediaType.APPLICATION_JSON)
                .content(SUCCESS_EVENT))
        .andExpect(status().isUnauthorized())
        .andExpect(jsonPath("$.message").value("Invalid webhook secret"));

    mockMvc
        .perform(get("/api/senders/" + senderId).with(tenantJwt()))
        .andExpect(jsonPath("$.verificationStatus").value("pending"));
  }

  @Test
  void identityEvent_withoutSecretIsUnauthorized() throws Exception {
    mockMvc
        .perform(
            post("/api/webhooks/ses")
                .contentType(MediaType.APPLICATION_JSON)
                .content(SUCCESS_EVENT))
        .andExpect(status().isUnauthorized());
  }

  @Test
  void identityEvent_malformedBodyIsBadRequest() throws Exception {
    mockMvc
        .perform(
            post("/api/webhooks/ses")
                .header("X-Webhook-Secret", SECRET)
                .contentType(MediaType.APPLICATION_JSON)
                .content("[1, 2"))
        .andExpect(status().isBadRequest());
  }

  private String createMailboxSender(String email) throws Exception {
    var result =
        mockMvc
            .perform(
                post("/api/senders")
                    .with(tenantJwt())
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(
                        "{\"email\": \"%s\", \"verificationType\": \"mailbox\"}".formatted(email)))
            .andExpect(status().isCreated())
            .andReturn();
    return JsonPath.read(result.getResponse().getContentAsString(), "$.senderId");
  }

  private JwtRequestPostProcessor tenantJwt() {
    return jwt()
        .jwt(
            j ->
                j.subject("user_" + TENANT)
                    .claim("custom:tenant_id", TENANT)
                    .claim("custom:tier", "pro-tier"));
  }
}
