package com.flamingo.ai.researchchat.service.generation;

import com.flamingo.ai.researchchat.api.dto.response.StreamFrame;
import java.util.UUID;
import reactor.core.publisher.Flux;

/**
 * Handle to a started generation run.
 *
 * @param assistantMessageId message the answer is written into
 * @param workflowId workflow token of the run
 * @param frames event stream, empty for background runs
 */
public record AgentRun(UUID assistantMessageId, String workflowId, Flux<StreamFrame> frames) {}
