package com.flamingo.ai.researchchat.service.generation;

import com.flamingo.ai.researchchat.domain.enums.GenerationState;
import com.flamingo.ai.researchchat.domain.model.ContextReference;
import com.flamingo.ai.researchchat.domain.model.ConversationTurn;
import com.flamingo.ai.researchchat.domain.model.SearchResult;
import com.flamingo.ai.researchchat.service.collaborator.RollingSummaryStore;
import com.flamingo.ai.researchchat.service.conversation.ConversationService;
import com.flamingo.ai.researchchat.service.planner.PlanningInput;
import com.flamingo.ai.researchchat.service.planner.ResearchPlan;
import com.flamingo.ai.researchchat.service.planner.SearchPlannerService;
import com.flamingo.ai.researchchat.service.scrape.ContentScraper;
import com.flamingo.ai.researchchat.service.scrape.ScrapedSource;
import com.flamingo.ai.researchchat.service.search.ProviderExecutor;
import com.flamingo.ai.researchchat.service.search.SearchExecutionResult;
import com.flamingo.ai.researchchat.service.stream.EventPersistenceBridge;
import com.flamingo.ai.researchchat.service.stream.FrameChannel;
import com.flamingo.ai.researchchat.service.stream.GenerationSession;
import com.flamingo.ai.researchchat.service.stream.GenerationSessionRegistry;
import io.micrometer.core.annotation.Timed;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Runs plan, search, scrape, generate and persist for one session.
 *
 * <p>Search and scraping are skipped when the plan does not ask for them. Every path ends in
 * exactly one terminal frame and the session is released afterwards.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ResearchPipeline {

  static final String INTERNAL_ERROR = "Something went wrong while generating the response.";

  private final SearchPlannerService searchPlannerService;
  private final ProviderExecutor providerExecutor;
  private final ContentScraper contentScraper;
  private final PromptBuilder promptBuilder;
  private final StreamingGenerator streamingGenerator;
  private final EventPersistenceBridge bridge;
  private final GenerationSessionRegistry sessionRegistry;
  private final RollingSummaryStore rollingSummaryStore;
  private final RollingSummaryUpdater rollingSummaryUpdater;
  private final ConversationService conversationService;
  private final Clock clock;

  /**
   * Executes the run.
   *
   * @param history stored turns before the current message, chronological
   */
  @Timed(value = "agent.run", description = "Time to research and answer one message")
  public void run(
      GenerationSession session,
      FrameChannel channel,
      AgentRunRequest request,
      List<ConversationTurn> history) {
    try {
      execute(session, channel, request, history);
    } catch (RuntimeException e) {
      log.error(
          "Pipeline failed for message {}: {}", session.getAssistantMessageId(), e.getMessage(), e);
      bridge.fail(session, channel, INTERNAL_ERROR);
    } finally {
      sessionRegistry.release(session);
    }
  }

  private void execute(
      GenerationSession session,
      FrameChannel channel,
      AgentRunRequest request,
      List<ConversationTurn> history) {
    String message = request.message();
    bridge.begin(session, channel, "Analyzing your question...");

    String priorSummary =
        rollingSummaryStore
            .read(request.conversationId())
            .orElse(request.conversationContext());
    long start = System.nanoTime();
    ResearchPlan plan =
        searchPlannerService.plan(
            new PlanningInput(request.conversationId(), message, history, priorSummary));
    bridge.toolResult(channel, "plan_research", planSummary(plan), elapsedMs(start));
    log.debug(
        "Plan for message {}: shouldSearch={}, queries={}",
        session.getAssistantMessageId(),
        plan.shouldSearch(),
        plan.queries().size());

    List<SearchResult> results = List.of();
    List<ScrapedSource> scraped = List.of();
    boolean complete = true;
    if (plan.shouldSearch() && !plan.queries().isEmpty()) {
      bridge.enterStage(session, channel, GenerationState.SEARCHING, "Searching the web...");
      start = System.nanoTime();
      SearchExecutionResult search =
          providerExecutor.execute(plan.queries(), message, plan.contextSummary());
      bridge.toolResult(channel, "search_web", searchSummary(search), elapsedMs(start));
      results = search.results();
      complete = search.hasRealResults();

      if (search.hasRealResults() && !results.isEmpty()) {
        bridge.enterStage(session, channel, GenerationState.SCRAPING, "Reading top sources...");
        start = System.nanoTime();
        scraped = contentScraper.scrapeAll(results);
        bridge.toolResult(channel, "scrape_webpage", scrapeSummary(scraped), elapsedMs(start));
      }
    }

    List<ContextReference> references =
        ContextReferences.build(request.contextReferences(), results, scraped, clock.millis());
    bridge.sources(session, channel, results, references, plan.confidence(), complete);

    if (!bridge.enterStage(session, channel, GenerationState.GENERATING, "Writing the answer...")) {
      return;
    }
    GenerationPrompt prompt =
        promptBuilder.build(plan.contextSummary(), scraped, results, history, message);
    GenerationOutcome outcome = streamingGenerator.generate(session, channel, prompt, results);

    if (!outcome.success()) {
      bridge.fail(session, channel, outcome.failure());
      return;
    }
    if (bridge.complete(session, channel, outcome.provider())) {
      afterCompletion(session, request, history, priorSummary);
    }
  }

  private void afterCompletion(
      GenerationSession session,
      AgentRunRequest request,
      List<ConversationTurn> history,
      String priorSummary) {
    try {
      rollingSummaryUpdater.update(
          request.conversationId(), priorSummary, history, request.message(), session.getContent());
      conversationService.updateTitleIfDefault(request.conversationId(), request.message());
    } catch (RuntimeException e) {
      log.warn(
          "Post-completion updates failed for conversation {}: {}",
          request.conversationId(),
          e.getMessage());
    }
  }

  private static Map<String, Object> planSummary(ResearchPlan plan) {
    Map<String, Object> summary = new LinkedHashMap<>();
    summary.put("shouldSearch", plan.shouldSearch());
    summary.put("queries", plan.queries());
    summary.put("confidence", plan.confidence());
    summary.put("suggestNewChat", plan.suggestNewChat());
    summary.put("reasons", plan.reasons());
    return summary;
  }

  private static Map<String, Object> searchSummary(SearchExecutionResult search) {
    Map<String, Object> summary = new LinkedHashMap<>();
    summary.put("resultCount", search.results().size());
    summary.put("hasRealResults", search.hasRealResults());
    summary.put("attempts", search.attempts());
    return summary;
  }

  private static List<Map<String, Object>> scrapeSummary(List<ScrapedSource> scraped) {
    return scraped.stream()
        .map(
            source -> {
              Map<String, Object> entry = new LinkedHashMap<>();
              entry.put("url", source.url());
              entry.put("title", source.title());
              entry.put("contentLength", source.content().length());
              if (source.isFailed()) {
                entry.put("error", source.fetchError());
              }
              return entry;
            })
        .toList();
  }

  private static long elapsedMs(long startNanos) {
    return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
  }
}
