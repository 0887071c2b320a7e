package com.flamingo.ai.researchchat.agent.dto;

import java.util.List;

/**
 * Structured output from SearchPlanningAgent. LangChain4j deserializes the model's JSON answer into
 * this record; every field may be missing.
 */
public record SearchPlanResult(
    Boolean shouldSearch,
    List<String> queries,
    String contextSummary,
    Boolean suggestNewChat,
    Double decisionConfidence,
    String reasons) {}
