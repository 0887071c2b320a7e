package com.flamingo.ai.researchchat.agent;

import com.flamingo.ai.researchchat.agent.dto.SearchPlanResult;
import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/** AI agent that decides whether a chat message needs live web research. */
public interface SearchPlanningAgent {

  @SystemMessage(
      """
        You plan web research for a conversational research assistant.

        Decide whether answering the new message needs fresh information from the web, and if
        so propose focused search queries.

        Rules:
        1. shouldSearch=true for facts that change over time (news, prices, weather, releases,
           schedules), niche facts, or anything needing citations
        2. shouldSearch=false for greetings, pure reasoning, rewriting or math on given text
        3. Resolve pronouns and follow-ups ("what about X", "and the price?") using the context
           so every query is self-contained
        4. Return at most 6 short queries, most important first
        5. suggestNewChat=true only when the message clearly starts an unrelated topic

        Return JSON with these fields:
        - shouldSearch (boolean)
        - queries (array of strings)
        - contextSummary (string) - one or two sentences about the conversation so far
        - suggestNewChat (boolean)
        - decisionConfidence (number between 0 and 1)
        - reasons (string) - brief explanation
        """)
  @UserMessage(
      """
        Recent context (most recent last):
        {{context}}

        New message: {{message}}

        Return JSON only.
        """)
  SearchPlanResult plan(@V("context") String context, @V("message") String message);
}
