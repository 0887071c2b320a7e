package com.flamingo.ai.researchchat.service.stream;

import com.flamingo.ai.researchchat.api.dto.response.PersistedPayload;
import com.flamingo.ai.researchchat.config.ResearchConfig;
import com.flamingo.ai.researchchat.domain.entity.WorkflowToken;
import com.flamingo.ai.researchchat.domain.enums.WorkflowTokenStatus;
import com.flamingo.ai.researchchat.domain.repository.WorkflowTokenRepository;
import com.flamingo.ai.researchchat.exception.SignatureVerificationException;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.util.HexFormat;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Issues, completes and checks the tokens that bind a generation run to its signed result. */
@Service
@RequiredArgsConstructor
@Slf4j
public class WorkflowTokenService {

  private static final SecureRandom RANDOM = new SecureRandom();
  private static final int NONCE_BYTES = 16;

  private final WorkflowTokenRepository workflowTokenRepository;
  private final PayloadSigner payloadSigner;
  private final ResearchConfig researchConfig;
  private final Clock clock;

  @Transactional
  public WorkflowToken issue(UUID conversationId, String sessionId) {
    Instant now = clock.instant();
    WorkflowToken token =
        WorkflowToken.builder()
            .workflowId(UUID.randomUUID().toString())
            .nonce(newNonce())
            .conversationId(conversationId)
            .sessionId(sessionId)
            .status(WorkflowTokenStatus.ACTIVE)
            .issuedAt(now)
            .expiresAt(now.plusMillis(researchConfig.getSigning().getTokenTtlMs()))
            .build();
    WorkflowToken saved = workflowTokenRepository.save(token);
    log.debug(
        "Issued workflow token {} for conversation {}", saved.getWorkflowId(), conversationId);
    return saved;
  }

  /**
   * Marks an active token completed, storing the signature of the final payload if any. A token
   * that has expired is invalidated instead.
   *
   * @return whether the token is now completed
   */
  @Transactional
  public boolean complete(String workflowId, UUID conversationId, String signature) {
    Optional<WorkflowToken> found = workflowTokenRepository.findByWorkflowId(workflowId);
    if (found.isEmpty()) {
      log.warn("Workflow {} has no token, not completing", workflowId);
      return false;
    }
    WorkflowToken token = found.get();
    if (!token.isActive()) {
      log.warn("Workflow {} is {}, not completing", workflowId, token.getStatus());
      return false;
    }
    if (!token.getConversationId().equals(conversationId)) {
      log.warn("Workflow {} belongs to another conversation, not completing", workflowId);
      return false;
    }
    if (isExpired(token)) {
      log.warn("Workflow {} expired at {}, invalidating", workflowId, token.getExpiresAt());
      token.setStatus(WorkflowTokenStatus.INVALIDATED);
      return false;
    }
    token.setSignature(signature);
    token.setStatus(WorkflowTokenStatus.COMPLETED);
    return true;
  }

  @Transactional
  public void invalidate(String workflowId) {
    workflowTokenRepository
        .findByWorkflowId(workflowId)
        .filter(WorkflowToken::isActive)
        .ifPresent(token -> token.setStatus(WorkflowTokenStatus.INVALIDATED));
  }

  @Transactional(readOnly = true)
  public Optional<WorkflowToken> find(String workflowId) {
    return workflowTokenRepository.findByWorkflowId(workflowId);
  }

  /**
   * Accepts a persisted payload only when its signature verifies against the nonce of a completed,
   * unexpired workflow of the conversation the payload names.
   *
   * @throws SignatureVerificationException when any check fails
   */
  @Transactional(readOnly = true)
  public WorkflowToken verifyPersisted(PersistedPayload payload, String nonce, String signature) {
    if (payload == null || payload.getWorkflowId() == null) {
      throw new SignatureVerificationException("Persisted payload has no workflow id");
    }
    String workflowId = payload.getWorkflowId();
    WorkflowToken token =
        workflowTokenRepository
            .findByWorkflowId(workflowId)
            .orElseThrow(
                () -> new SignatureVerificationException("Unknown workflow: " + workflowId));
    if (!token.getNonce().equals(nonce)) {
      throw new SignatureVerificationException("Nonce mismatch for workflow " + workflowId);
    }
    if (token.getStatus() != WorkflowTokenStatus.COMPLETED) {
      throw new SignatureVerificationException(
          "Workflow " + workflowId + " is " + token.getStatus());
    }
    if (!token.getConversationId().toString().equals(payload.getConversationId())) {
      throw new SignatureVerificationException(
          "Workflow " + workflowId + " belongs to another conversation");
    }
    if (isExpired(token)) {
      throw new SignatureVerificationException("Workflow " + workflowId + " has expired");
    }
    if (!payloadSigner.verify(payload, nonce, signature)) {
      throw new SignatureVerificationException(
          "Invalid signature for workflow " + workflowId);
    }
    return token;
  }

  /** A token expiring exactly now counts as expired. */
  private boolean isExpired(WorkflowToken token) {
    return token.getExpiresAt() == null || !clock.instant().isBefore(token.getExpiresAt());
  }

  private static String newNonce() {
    byte[] bytes = new byte[NONCE_BYTES];
    RANDOM.nextBytes(bytes);
    return HexFormat.of().formatHex(bytes);
  }
}
