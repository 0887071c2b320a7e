package com.flamingo.ai.researchchat.service.search;

import com.flamingo.ai.researchchat.domain.model.SearchResult;
import com.flamingo.ai.researchchat.service.planner.PlanningHeuristics;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Orders merged search results by provider relevance, lexical overlap with the user message and
 * domain quality.
 */
public final class ResultReranker {

  static final double DEFAULT_BASE_SCORE = 0.5;
  private static final double TOKEN_WEIGHT = 0.03;
  private static final double MAX_TOKEN_BOOST = 0.3;
  private static final double PHRASE_WEIGHT = 0.1;
  private static final int MAX_PHRASE_MATCHES = 3;
  private static final double OFFICIAL_SUBDOMAIN_BOOST = 0.12;
  private static final double INSTITUTION_BOOST = 0.1;
  private static final double LOW_SIGNAL_PENALTY = 0.15;
  private static final double FORUM_PENALTY = 0.05;

  private static final List<String> OFFICIAL_PREFIXES =
      List.of("docs.", "developer.", "developers.", "learn.", "support.", "dev.");
  private static final List<String> LOW_SIGNAL_DOMAINS =
      List.of("medium.com", "quora.com", "pinterest.com", "slideshare.net");
  private static final List<String> FORUM_DOMAINS = List.of("reddit.com", "news.ycombinator.com");

  private ResultReranker() {}

  /** Returns at most {@code limit} results, best first. Ties keep their incoming order. */
  public static List<SearchResult> rerank(
      List<SearchResult> results, String userMessage, int limit) {
    List<String> messageTokens =
        PlanningHeuristics.tokenize(userMessage).stream()
            .filter(token -> token.length() > 2)
            .toList();
    Set<String> tokens = new LinkedHashSet<>(messageTokens);
    List<String> phrases = new ArrayList<>();
    for (int i = 0; i + 1 < messageTokens.size(); i++) {
      phrases.add(messageTokens.get(i) + " " + messageTokens.get(i + 1));
    }

    List<Scored> scored = new ArrayList<>();
    for (int i = 0; i < results.size(); i++) {
      SearchResult result = results.get(i);
      scored.add(new Scored(result, score(result, tokens, phrases), i));
    }
    return scored.stream()
        .sorted(
            Comparator.comparingDouble(Scored::score)
                .reversed()
                .thenComparingInt(Scored::position))
        .limit(Math.max(0, limit))
        .map(Scored::result)
        .toList();
  }

  static double score(SearchResult result, Set<String> tokens, List<String> phrases) {
    double score = result.scoreOr(DEFAULT_BASE_SCORE);

    List<String> textTokens =
        PlanningHeuristics.tokenize(
            nullToEmpty(result.title()) + " " + nullToEmpty(result.snippet()));
    Set<String> textTokenSet = new LinkedHashSet<>(textTokens);
    long matched = tokens.stream().filter(textTokenSet::contains).count();
    score += Math.min(MAX_TOKEN_BOOST, TOKEN_WEIGHT * matched);

    String flat = " " + String.join(" ", textTokens) + " ";
    long phraseMatches = phrases.stream().filter(p -> flat.contains(" " + p + " ")).count();
    score += PHRASE_WEIGHT * Math.min(MAX_PHRASE_MATCHES, phraseMatches);

    return score + domainAdjustment(UrlNormalizer.host(result.url()));
  }

  static double domainAdjustment(String host) {
    if (host.isEmpty()) {
      return 0.0;
    }
    double adjustment = 0.0;
    if (OFFICIAL_PREFIXES.stream().anyMatch(host::startsWith)) {
      adjustment += OFFICIAL_SUBDOMAIN_BOOST;
    }
    if (host.endsWith(".gov")
        || host.endsWith(".edu")
        || host.contains(".gov.")
        || host.contains(".edu.")) {
      adjustment += INSTITUTION_BOOST;
    }
    if (matchesDomain(host, LOW_SIGNAL_DOMAINS)) {
      adjustment -= LOW_SIGNAL_PENALTY;
    } else if (matchesDomain(host, FORUM_DOMAINS)) {
      adjustment -= FORUM_PENALTY;
    }
    return adjustment;
  }

  private static boolean matchesDomain(String host, List<String> domains) {
    return domains.stream().anyMatch(d -> host.equals(d) || host.endsWith("." + d));
  }

  private static String nullToEmpty(String value) {
    return value == null ? "" : value;
  }

  private record Scored(SearchResult result, double score, int position) {}
}
