package com.flamingo.ai.researchchat.domain.entity;

import com.flamingo.ai.researchchat.domain.enums.WorkflowTokenStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** Tracks one generation run so its signed completion can be checked later. */
@Entity
@Table(name = "workflow_tokens")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class WorkflowToken {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(nullable = false, unique = true)
  private String workflowId;

  @Column(nullable = false)
  private String nonce;

  @Column(length = 128)
  private String signature;

  @Column(nullable = false)
  private UUID conversationId;

  private String sessionId;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false)
  @Builder.Default
  private WorkflowTokenStatus status = WorkflowTokenStatus.ACTIVE;

  @Column(nullable = false)
  private Instant issuedAt;

  @Column(nullable = false)
  private Instant expiresAt;

  public boolean isActive() {
    return status == WorkflowTokenStatus.ACTIVE;
  }
}
