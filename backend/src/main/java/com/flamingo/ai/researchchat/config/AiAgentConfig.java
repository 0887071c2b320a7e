package com.flamingo.ai.researchchat.config;

import com.flamingo.ai.researchchat.agent.SearchPlanningAgent;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.service.AiServices;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for AI agents built with LangChain4j AI Services.
 *
 * <p>Agents are interfaces with {@code @SystemMessage}/{@code @UserMessage}; the answer model is
 * streamed directly because its prompt is assembled per run.
 */
@Configuration
public class AiAgentConfig {

  /** Search planning agent. Uses the JSON chat model for structured output. */
  @Bean
  public SearchPlanningAgent searchPlanningAgent(ChatModel chatModel) {
    return AiServices.builder(SearchPlanningAgent.class).chatModel(chatModel).build();
  }
}
