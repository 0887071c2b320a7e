package com.flamingo.ai.researchchat.api.rest;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.researchchat.api.dto.request.AgentStreamRequest;
import com.flamingo.ai.researchchat.api.dto.request.PersistedVerifyRequest;
import com.flamingo.ai.researchchat.api.dto.response.PersistedPayload;
import com.flamingo.ai.researchchat.api.validation.AgentRequestSanitizer;
import com.flamingo.ai.researchchat.config.ResearchConfig;
import com.flamingo.ai.researchchat.domain.entity.WorkflowToken;
import com.flamingo.ai.researchchat.exception.ApiError;
import com.flamingo.ai.researchchat.exception.AuthorizationException;
import com.flamingo.ai.researchchat.exception.ConversationNotFoundException;
import com.flamingo.ai.researchchat.exception.GlobalExceptionHandler;
import com.flamingo.ai.researchchat.exception.SignatureVerificationException;
import com.flamingo.ai.researchchat.security.RateLimitInterceptor;
import com.flamingo.ai.researchchat.security.RateLimiter;
import com.flamingo.ai.researchchat.service.generation.AgentRun;
import com.flamingo.ai.researchchat.service.generation.AgentRunRequest;
import com.flamingo.ai.researchchat.service.generation.AgentRunService;
import com.flamingo.ai.researchchat.service.stream.WorkflowTokenService;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import reactor.core.publisher.Flux;

@ExtendWith(MockitoExtension.class)
@DisplayName("AgentController")
class AgentControllerTest {

  private MockMvc mockMvc;
  private ObjectMapper objectMapper;
  private ResearchConfig researchConfig;

  @Mock private AgentRunService agentRunService;
  @Mock private WorkflowTokenService workflowTokenService;

  @BeforeEach
  void setUp() {
    Clock clock = Clock.fixed(Instant.parse("2026-03-15T10:00:00Z"), ZoneOffset.UTC);
    MeterRegistry meterRegistry = new SimpleMeterRegistry();
    researchConfig = new ResearchConfig();
    AgentController controller =
        new AgentController(
            agentRunService, new AgentRequestSanitizer(clock), workflowTokenService);
    mockMvc =
        MockMvcBuilders.standaloneSetup(controller)
            .setControllerAdvice(new GlobalExceptionHandler(meterRegistry))
            .addInterceptors(
                new RateLimitInterceptor(new RateLimiter(clock), researchConfig, meterRegistry))
            .build();
    objectMapper = new ObjectMapper();
  }

  private String body(String message, UUID conversationId) throws Exception {
    return objectMapper.writeValueAsString(
        AgentStreamRequest.builder().message(message).conversationId(conversationId).build());
  }

  @Test
  @DisplayName("Should accept a background run with 202")
  void shouldAcceptBackgroundRun() throws Exception {
    // given
    UUID conversationId = UUID.randomUUID();
    UUID assistantMessageId = UUID.randomUUID();
    when(agentRunService.startBackground(any(AgentRunRequest.class)))
        .thenReturn(new AgentRun(assistantMessageId, "wf-1", Flux.empty()));

    // when / then
    mockMvc
        .perform(
            post("/api/ai/agent")
                .contentType(MediaType.APPLICATION_JSON)
                .content(body("  What is new?  ", conversationId)))
        .andExpect(status().isAccepted())
        .andExpect(jsonPath("$.assistantMessageId").value(assistantMessageId.toString()))
        .andExpect(jsonPath("$.workflowId").value("wf-1"))
        .andExpect(header().string("X-RateLimit-Limit", "10"));

    verify(agentRunService)
        .startBackground(
            new AgentRunRequest("What is new?", conversationId, null, null, List.of()));
  }

  @Test
  @DisplayName("Should reject a blank message with 400")
  void shouldRejectBlankMessage() throws Exception {
    mockMvc
        .perform(
            post("/api/ai/agent")
                .contentType(MediaType.APPLICATION_JSON)
                .content(body("   ", UUID.randomUUID())))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value(ApiError.VALIDATION_ERROR));

    verify(agentRunService, never()).startBackground(any());
  }

  @Test
  @DisplayName("Should answer 429 with a retry hint once the route budget is spent")
  void shouldRejectOverRateLimit() throws Exception {
    // given
    researchConfig.getRateLimit().getRoutes().put("/api/ai/agent", 1);
    when(agentRunService.startBackground(any(AgentRunRequest.class)))
        .thenReturn(new AgentRun(UUID.randomUUID(), "wf-1", Flux.empty()));
    String body = body("Hello", UUID.randomUUID());
    mockMvc
        .perform(post("/api/ai/agent").contentType(MediaType.APPLICATION_JSON).content(body))
        .andExpect(status().isAccepted());

    // when / then
    mockMvc
        .perform(post("/api/ai/agent").contentType(MediaType.APPLICATION_JSON).content(body))
        .andExpect(status().isTooManyRequests())
        .andExpect(header().string("Retry-After", "60"))
        .andExpect(jsonPath("$.error").value("Rate limit exceeded"))
        .andExpect(jsonPath("$.message").value("Too many requests. Please try again later."))
        .andExpect(jsonPath("$.retryAfter").value(60));
  }

  @Test
  @DisplayName("Should return 404 for an unknown session")
  void shouldReturnNotFoundForUnknownSession() throws Exception {
    // given
    UUID id = UUID.randomUUID();
    when(agentRunService.getSessionState(id, null))
        .thenThrow(new ConversationNotFoundException(ConversationNotFoundException.MESSAGE, id));

    // when / then
    mockMvc
        .perform(get("/api/ai/agent/sessions/{id}", id))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.code").value(ApiError.MESSAGE_NOT_FOUND));
  }

  @Test
  @DisplayName("Should pass the caller's session to the state lookup and answer 403 on mismatch")
  void shouldForbidSessionStateForOtherSession() throws Exception {
    // given
    UUID id = UUID.randomUUID();
    when(agentRunService.getSessionState(id, "intruder"))
        .thenThrow(new AuthorizationException(UUID.randomUUID(), "session mismatch"));

    // when / then
    mockMvc
        .perform(get("/api/ai/agent/sessions/{id}", id).header("X-Session-Id", "intruder"))
        .andExpect(status().isForbidden());
  }

  @Test
  @DisplayName("Should acknowledge a verified persisted payload")
  void shouldAcknowledgePersistedPayload() throws Exception {
    // given
    UUID conversationId = UUID.randomUUID();
    PersistedPayload payload =
        PersistedPayload.builder().assistantMessageId("m-1").workflowId("wf-1").answer("A").build();
    when(workflowTokenService.verifyPersisted(any(PersistedPayload.class), eq("n"), eq("sig")))
        .thenReturn(
            WorkflowToken.builder().workflowId("wf-1").conversationId(conversationId).build());

    // when / then
    mockMvc
        .perform(
            post("/api/ai/agent/persisted")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    objectMapper.writeValueAsString(
                        new PersistedVerifyRequest(payload, "n", "sig"))))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.verified").value(true))
        .andExpect(jsonPath("$.workflowId").value("wf-1"));
  }

  @Test
  @DisplayName("Should answer 401 when the persisted signature does not verify")
  void shouldRejectForgedPayload() throws Exception {
    // given
    PersistedPayload payload = PersistedPayload.builder().workflowId("wf-1").build();
    when(workflowTokenService.verifyPersisted(
            any(PersistedPayload.class), anyString(), anyString()))
        .thenThrow(new SignatureVerificationException("signature mismatch"));

    // when / then
    mockMvc
        .perform(
            post("/api/ai/agent/persisted")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    objectMapper.writeValueAsString(
                        new PersistedVerifyRequest(payload, "n", "forged"))))
        .andExpect(status().isUnauthorized())
        .andExpect(jsonPath("$.code").value(ApiError.SIGNATURE_INVALID));
  }
}
