package com.flamingo.ai.researchchat.domain.entity;

import com.flamingo.ai.researchchat.domain.converter.ContextReferenceListConverter;
import com.flamingo.ai.researchchat.domain.converter.SearchResultListConverter;
import com.flamingo.ai.researchchat.domain.converter.StringListConverter;
import com.flamingo.ai.researchchat.domain.enums.GenerationState;
import com.flamingo.ai.researchchat.domain.enums.MessageRole;
import com.flamingo.ai.researchchat.domain.model.ContextReference;
import com.flamingo.ai.researchchat.domain.model.SearchResult;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** A single turn in a conversation. Assistant turns also carry generation state. */
@Entity
@Table(name = "chat_messages")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ChatMessage {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "conversation_id", nullable = false)
  private Conversation conversation;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false)
  private MessageRole role;

  @Column(columnDefinition = "TEXT", nullable = false)
  @Builder.Default
  private String content = "";

  /** Reasoning trace streamed alongside the answer. */
  @Column(columnDefinition = "TEXT")
  private String reasoning;

  /** Generation state for assistant turns. */
  @Enumerated(EnumType.STRING)
  private GenerationState generationState;

  @Builder.Default private Boolean streaming = false;

  private String workflowId;

  @Convert(converter = StringListConverter.class)
  @Column(columnDefinition = "TEXT")
  @Builder.Default
  private List<String> sources = new ArrayList<>();

  @Convert(converter = SearchResultListConverter.class)
  @Column(columnDefinition = "TEXT")
  @Builder.Default
  private List<SearchResult> searchResults = new ArrayList<>();

  @Convert(converter = ContextReferenceListConverter.class)
  @Column(columnDefinition = "TEXT")
  @Builder.Default
  private List<ContextReference> contextReferences = new ArrayList<>();

  @Convert(converter = StringListConverter.class)
  @Column(columnDefinition = "TEXT")
  @Builder.Default
  private List<String> errorDetails = new ArrayList<>();

  @Column(nullable = false, updatable = false)
  private LocalDateTime createdAt;

  private LocalDateTime updatedAt;

  @PrePersist
  protected void onCreate() {
    createdAt = LocalDateTime.now();
    updatedAt = createdAt;
  }

  @PreUpdate
  protected void onUpdate() {
    updatedAt = LocalDateTime.now();
  }

  public boolean isFinalized() {
    return generationState != null && generationState.isTerminal();
  }
}
