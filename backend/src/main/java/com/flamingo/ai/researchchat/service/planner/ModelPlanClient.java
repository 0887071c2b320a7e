package com.flamingo.ai.researchchat.service.planner;

import com.flamingo.ai.researchchat.agent.SearchPlanningAgent;
import com.flamingo.ai.researchchat.agent.dto.SearchPlanResult;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Calls the planning model behind the {@code planner} circuit breaker.
 *
 * <p>Failures propagate to the breaker, which records them and hands the call to the fallback; an
 * open breaker skips the model entirely. Either way callers get an empty result and plan with
 * heuristics.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ModelPlanClient {

  private final SearchPlanningAgent planningAgent;
  private final MeterRegistry meterRegistry;

  @CircuitBreaker(name = "planner", fallbackMethod = "planFallback")
  public Optional<SearchPlanResult> plan(String contextSummary, String message) {
    meterRegistry.counter("planner.model.calls").increment();
    return Optional.ofNullable(planningAgent.plan(contextSummary, message));
  }

  @SuppressWarnings("unused")
  private Optional<SearchPlanResult> planFallback(
      String contextSummary, String message, Throwable t) {
    log.warn("Model planning unavailable, using heuristics: {}", t.getMessage());
    meterRegistry.counter("planner.model.errors").increment();
    return Optional.empty();
  }
}
