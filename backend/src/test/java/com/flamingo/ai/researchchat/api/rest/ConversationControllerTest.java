package com.flamingo.ai.researchchat.api.rest;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.flamingo.ai.researchchat.domain.entity.Conversation;
import com.flamingo.ai.researchchat.exception.ApiError;
import com.flamingo.ai.researchchat.exception.AuthorizationException;
import com.flamingo.ai.researchchat.exception.ConversationNotFoundException;
import com.flamingo.ai.researchchat.exception.GlobalExceptionHandler;
import com.flamingo.ai.researchchat.service.collaborator.ChatAccessService;
import com.flamingo.ai.researchchat.service.conversation.ConversationService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
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

@ExtendWith(MockitoExtension.class)
@DisplayName("ConversationController")
class ConversationControllerTest {

  private MockMvc mockMvc;

  @Mock private ConversationService conversationService;
  @Mock private ChatAccessService chatAccessService;

  @BeforeEach
  void setUp() {
    mockMvc =
        MockMvcBuilders.standaloneSetup(
                new ConversationController(conversationService, chatAccessService))
            .setControllerAdvice(new GlobalExceptionHandler(new SimpleMeterRegistry()))
            .build();
  }

  @Test
  @DisplayName("Should create a conversation with 201")
  void shouldCreateConversation() throws Exception {
    // given
    UUID id = UUID.randomUUID();
    when(conversationService.createConversation("Trip planning", "session-1"))
        .thenReturn(Conversation.builder().id(id).title("Trip planning").build());

    // when / then
    mockMvc
        .perform(
            post("/api/conversations")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"title\":\"Trip planning\",\"sessionId\":\"session-1\"}"))
        .andExpect(status().isCreated())
        .andExpect(jsonPath("$.id").value(id.toString()))
        .andExpect(jsonPath("$.title").value("Trip planning"));
  }

  @Test
  @DisplayName("Should return 404 for an unknown conversation")
  void shouldReturnNotFound() throws Exception {
    // given
    UUID id = UUID.randomUUID();
    when(conversationService.getConversation(id))
        .thenThrow(new ConversationNotFoundException(id));

    // when / then
    mockMvc
        .perform(get("/api/conversations/{id}", id))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.code").value(ApiError.CONVERSATION_NOT_FOUND));
  }

  @Test
  @DisplayName("Should delete a conversation owned by the calling session")
  void shouldDeleteOwnedConversation() throws Exception {
    UUID id = UUID.randomUUID();

    mockMvc
        .perform(delete("/api/conversations/{id}", id).header("X-Session-Id", "session-1"))
        .andExpect(status().isNoContent());

    verify(chatAccessService).checkWriteAccess(id, "session-1");
    verify(conversationService).deleteConversation(id);
  }

  @Test
  @DisplayName("Should refuse to delete another session's conversation")
  void shouldRefuseForeignDelete() throws Exception {
    // given
    UUID id = UUID.randomUUID();
    doThrow(new AuthorizationException(id, "session does not own this conversation"))
        .when(chatAccessService)
        .checkWriteAccess(id, "intruder");

    // when / then
    mockMvc
        .perform(delete("/api/conversations/{id}", id).header("X-Session-Id", "intruder"))
        .andExpect(status().isForbidden())
        .andExpect(jsonPath("$.code").value(ApiError.ACCESS_DENIED));
    verify(conversationService, never()).deleteConversation(any());
  }
}
