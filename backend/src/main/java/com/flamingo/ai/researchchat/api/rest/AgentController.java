package com.flamingo.ai.researchchat.api.rest;

import com.flamingo.ai.researchchat.api.dto.request.AgentStreamRequest;
import com.flamingo.ai.researchchat.api.dto.request.PersistedVerifyRequest;
import com.flamingo.ai.researchchat.api.dto.response.AgentRunResponse;
import com.flamingo.ai.researchchat.api.dto.response.AgentSessionResponse;
import com.flamingo.ai.researchchat.api.dto.response.PersistedAckResponse;
import com.flamingo.ai.researchchat.api.validation.AgentRequestSanitizer;
import com.flamingo.ai.researchchat.domain.entity.WorkflowToken;
import com.flamingo.ai.researchchat.service.generation.AgentRun;
import com.flamingo.ai.researchchat.service.generation.AgentRunService;
import com.flamingo.ai.researchchat.service.stream.WorkflowTokenService;
import jakarta.validation.Valid;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for background agent runs and their persisted state. */
@RestController
@RequestMapping("/api/ai/agent")
@RequiredArgsConstructor
@Slf4j
public class AgentController {

  private final AgentRunService agentRunService;
  private final AgentRequestSanitizer sanitizer;
  private final WorkflowTokenService workflowTokenService;

  /** Schedules a run and returns immediately. */
  @PostMapping
  public ResponseEntity<AgentRunResponse> startRun(
      @Valid @RequestBody AgentStreamRequest request) {
    AgentRun run = agentRunService.startBackground(sanitizer.sanitize(request));
    return ResponseEntity.status(HttpStatus.ACCEPTED).body(AgentRunResponse.from(run));
  }

  /** Returns the latest persisted state of a run, for reconnecting clients. */
  @GetMapping("/sessions/{assistantMessageId}")
  public ResponseEntity<AgentSessionResponse> getSession(
      @PathVariable UUID assistantMessageId,
      @RequestHeader(value = ConversationController.SESSION_HEADER, required = false)
          String sessionId) {
    return ResponseEntity.ok(agentRunService.getSessionState(assistantMessageId, sessionId));
  }

  /** Acknowledges a persisted notification only when its signature and token check out. */
  @PostMapping("/persisted")
  public ResponseEntity<PersistedAckResponse> verifyPersisted(
      @Valid @RequestBody PersistedVerifyRequest request) {
    WorkflowToken token =
        workflowTokenService.verifyPersisted(
            request.getPayload(), request.getNonce(), request.getSignature());
    log.debug("Verified persisted payload for workflow {}", token.getWorkflowId());
    return ResponseEntity.ok(PersistedAckResponse.fromEntity(token));
  }
}
