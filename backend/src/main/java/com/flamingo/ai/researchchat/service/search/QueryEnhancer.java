package com.flamingo.ai.researchchat.service.search;

import com.flamingo.ai.researchchat.service.context.TextNormalizer;
import com.flamingo.ai.researchchat.service.planner.PlanningHeuristics;
import java.time.Clock;
import java.time.Year;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** Rewrites a planned query into a sharper search engine query. */
@Component
@RequiredArgsConstructor
public class QueryEnhancer {

  static final int MAX_QUERY_CHARS = 220;
  private static final int MAX_CONTEXT_TERMS = 2;
  private static final int SHORT_QUERY_TOKENS = 3;

  private static final Pattern PROPER_BIGRAM =
      Pattern.compile("\\b([A-Z][a-z]+)\\s+([A-Z][a-z]+)\\b");
  private static final Pattern RECENCY =
      Pattern.compile(
          "\\b(latest|newest|current|recent|today|upcoming|this year)\\b",
          Pattern.CASE_INSENSITIVE);
  private static final Pattern YEAR = Pattern.compile("\\b(19|20)\\d{2}\\b");
  private static final Pattern GITHUB =
      Pattern.compile("\\b(github|repository|repo|source code)\\b", Pattern.CASE_INSENSITIVE);
  private static final Pattern PAPER =
      Pattern.compile("\\b(pdf|whitepaper|paper|datasheet)\\b", Pattern.CASE_INSENSITIVE);
  private static final Pattern DOCS =
      Pattern.compile("\\b(docs|documentation|api reference)\\b", Pattern.CASE_INSENSITIVE);

  private static final Set<String> STOP_WORDS =
      Set.of(
          "what", "when", "where", "which", "who", "why", "how", "the", "this", "that", "does",
          "tell", "about", "with", "from", "have", "user", "assistant", "summary", "please",
          "there", "their", "they", "would", "could", "should");

  private final Clock clock;

  /**
   * Enhances {@code query} with quoted proper names, context terms for very short queries, a
   * site hint and a year cue when the query asks for recent information.
   */
  public String enhance(String query, String contextSummary) {
    String base = TextNormalizer.collapseWhitespace(query);
    if (base.isEmpty()) {
      return base;
    }
    StringBuilder enhanced = new StringBuilder(quoteProperName(base));

    List<String> queryTokens = PlanningHeuristics.tokenize(base);
    if (queryTokens.size() <= SHORT_QUERY_TOKENS) {
      for (String term : contextTerms(contextSummary, Set.copyOf(queryTokens))) {
        enhanced.append(' ').append(term);
      }
    }

    String lower = base.toLowerCase(Locale.ROOT);
    if (!lower.contains("site:") && !lower.contains("filetype:")) {
      String hint = siteHint(base);
      if (hint != null) {
        enhanced.append(' ').append(hint);
      }
    }

    if (RECENCY.matcher(base).find() && !YEAR.matcher(base).find()) {
      enhanced.append(' ').append(Year.now(clock).getValue());
    }
    return TextNormalizer.truncate(enhanced.toString(), MAX_QUERY_CHARS).trim();
  }

  private static String quoteProperName(String query) {
    if (query.indexOf('"') >= 0) {
      return query;
    }
    Matcher matcher = PROPER_BIGRAM.matcher(query);
    while (matcher.find()) {
      if (STOP_WORDS.contains(matcher.group(1).toLowerCase(Locale.ROOT))
          || STOP_WORDS.contains(matcher.group(2).toLowerCase(Locale.ROOT))) {
        continue;
      }
      return query.substring(0, matcher.start())
          + '"'
          + matcher.group()
          + '"'
          + query.substring(matcher.end());
    }
    return query;
  }

  private static List<String> contextTerms(String contextSummary, Set<String> present) {
    Map<String, Integer> frequency = new LinkedHashMap<>();
    for (String token : PlanningHeuristics.tokenize(contextSummary)) {
      if (token.length() < 4 || STOP_WORDS.contains(token) || present.contains(token)) {
        continue;
      }
      frequency.merge(token, 1, Integer::sum);
    }
    return frequency.entrySet().stream()
        .sorted(Map.Entry.<String, Integer>comparingByValue(Comparator.reverseOrder()))
        .limit(MAX_CONTEXT_TERMS)
        .map(Map.Entry::getKey)
        .toList();
  }

  private static String siteHint(String query) {
    if (GITHUB.matcher(query).find()) {
      return "site:github.com";
    }
    if (PAPER.matcher(query).find()) {
      return "filetype:pdf";
    }
    if (DOCS.matcher(query).find()) {
      return "official documentation";
    }
    return null;
  }
}
