package com.flamingo.ai.researchchat.config;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the research pipeline. */
@Configuration
@ConfigurationProperties(prefix = "research")
@Getter
@Setter
public class ResearchConfig {

  private Summary summary = new Summary();
  private Planner planner = new Planner();
  private Search search = new Search();
  private Scrape scrape = new Scrape();
  private Generation generation = new Generation();
  private Stream stream = new Stream();
  private RateLimit rateLimit = new RateLimit();
  private Cors cors = new Cors();
  private Signing signing = new Signing();

  @Getter
  @Setter
  public static class Summary {
    private int maxChars = 1600;
    private int maxTurns = 14;
  }

  @Getter
  @Setter
  public static class Planner {
    private boolean llmEnabled = true;
    private long cacheTtlMs = 10 * 60 * 1000L;
    private long heuristicCacheTtlMs = 3 * 60 * 1000L;
    private int maxQueries = 6;
    private int rateLimitMaxRequests = 6;
    private long rateLimitWindowMs = 60_000L;
    private int recentMessageWindow = 14;
  }

  @Getter
  @Setter
  public static class Search {
    private String serpApiKey = "";
    private String serpApiUrl = "https://serpapi.com/search.json";
    private String openRouterApiKey = "";
    private String openRouterUrl = "https://openrouter.ai/api/v1/chat/completions";
    private String openRouterSearchModel = "perplexity/sonar";
    private String duckDuckGoUrl = "https://api.duckduckgo.com/";
    private long providerTimeoutMs = 10_000L;
    private int maxResultsPerQuery = 8;
    private int maxResults = 7;
    private long cacheTtlMs = 15 * 60 * 1000L;
  }

  @Getter
  @Setter
  public static class Scrape {
    private int maxSources = 3;
    private long timeoutMs = 10_000L;
    private int maxContentChars = 12_000;
    private int minContentChars = 100;
    private int summaryChars = 500;
    private int cacheMaxEntries = 100;
    private long cacheTtlMs = 15 * 60 * 1000L;
    private long errorCacheTtlMs = 30_000L;
    private String userAgent = "Mozilla/5.0 (compatible; SearchChat/1.0; Web Content Reader)";

    /** Relaxes the private network checks. Development only. */
    private boolean allowPrivateNetwork = false;
  }

  @Getter
  @Setter
  public static class Generation {
    private int maxHistoryMessages = 18;
    private int searchMetadataResults = 5;
    private int searchMetadataSnippetChars = 240;
    private long flushIntervalMs = 100L;
    private int snippetAnswerMaxChars = 1500;
    private String secondaryProviderUrl = "https://openrouter.ai/api/v1/chat/completions";
    private String secondaryModel = "openai/gpt-4o-mini";
    private int rollingSummaryMaxChars = 2000;
  }

  @Getter
  @Setter
  public static class Stream {
    private long inactivityTimeoutMs = 120_000L;
    private long keepaliveIntervalMs = 15_000L;
    private int frameBufferSize = 256;
    private long stallTimeoutMs = 30_000L;
  }

  @Getter
  @Setter
  public static class RateLimit {
    private long windowMs = 60_000L;
    private int defaultLimit = 10;
    private Map<String, Integer> routes = defaultRoutes();

    private static Map<String, Integer> defaultRoutes() {
      Map<String, Integer> routes = new LinkedHashMap<>();
      routes.put("/api/ai/agent", 10);
      routes.put("/api/ai/agent/stream", 10);
      routes.put("/api/search", 30);
      routes.put("/api/scrape", 20);
      return routes;
    }

    public int limitFor(String route) {
      return routes.getOrDefault(route, defaultLimit);
    }
  }

  @Getter
  @Setter
  public static class Cors {
    private List<String> allowedOrigins = new ArrayList<>();
    private List<String> publicPaths =
        new ArrayList<>(List.of("/api/health", "/api/public/", "/actuator/"));
  }

  @Getter
  @Setter
  public static class Signing {
    private String secret = "";
    private long tokenTtlMs = 10 * 60 * 1000L;
  }
}
