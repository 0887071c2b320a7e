package com.flamingo.ai.researchchat.service.generation.provider;

import com.flamingo.ai.researchchat.domain.enums.MessageRole;
import com.flamingo.ai.researchchat.domain.model.ConversationTurn;
import com.flamingo.ai.researchchat.exception.LlmServiceException;
import com.flamingo.ai.researchchat.service.generation.GenerationChunk;
import com.flamingo.ai.researchchat.service.generation.GenerationPrompt;
import com.flamingo.ai.researchchat.service.generation.GenerationProvider;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.StreamingChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.chat.response.StreamingChatResponseHandler;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;

/** Primary answer model, streamed through the LangChain4j {@link StreamingChatModel}. */
@Component
@Order(1)
@RequiredArgsConstructor
@Slf4j
public class LangChainGenerationProvider implements GenerationProvider {

  private final StreamingChatModel streamingChatModel;

  @Override
  public String name() {
    return "primary";
  }

  @Override
  public boolean isConfigured() {
    return true;
  }

  @Override
  public Flux<GenerationChunk> stream(GenerationPrompt prompt) {
    List<ChatMessage> messages = toChatMessages(prompt);
    log.debug("Streaming answer with {} messages", messages.size());
    return Flux.create(
        sink ->
            streamingChatModel.chat(
                messages,
                new StreamingChatResponseHandler() {
                  @Override
                  public void onPartialResponse(String token) {
                    sink.next(GenerationChunk.content(token));
                  }

                  @Override
                  public void onCompleteResponse(ChatResponse response) {
                    sink.complete();
                  }

                  @Override
                  public void onError(Throwable error) {
                    sink.error(new LlmServiceException(name(), describe(error), error));
                  }
                }));
  }

  private static String describe(Throwable error) {
    return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
  }

  static List<ChatMessage> toChatMessages(GenerationPrompt prompt) {
    List<ChatMessage> messages = new ArrayList<>();
    messages.add(SystemMessage.from(prompt.systemPrompt()));
    for (ConversationTurn turn : prompt.history()) {
      if (turn.role() == MessageRole.USER) {
        messages.add(UserMessage.from(turn.text()));
      } else if (turn.role() == MessageRole.ASSISTANT) {
        messages.add(AiMessage.from(turn.text()));
      }
    }
    messages.add(UserMessage.from(prompt.userMessage()));
    return messages;
  }
}
