package com.flamingo.ai.researchchat.service.scrape;

import com.flamingo.ai.researchchat.config.ResearchConfig;
import com.flamingo.ai.researchchat.exception.ScrapeException;
import com.flamingo.ai.researchchat.service.search.UrlNormalizer;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

/** Extracts the readable main text of an HTML page with jsoup. */
@Component
@RequiredArgsConstructor
@Slf4j
public class HtmlContentExtractor {

  private static final String JUNK_SELECTORS =
      "script, style, nav, footer, header, aside, noscript, iframe, [aria-hidden=true], "
          + "[role=presentation], .ads, .ad, .advertisement, .promo, .sidebar";
  private static final List<String> MAIN_SELECTORS =
      List.of("article", "main", "[role=main]", ".content", ".post");
  private static final int MAIN_CONTENT_MIN_CHARS = 300;
  private static final int JS_APP_MAX_TEXT_CHARS = 500;

  private static final List<Pattern> JUNK_PHRASES =
      List.of(
          "cookie policy",
          "accept cookies",
          "privacy policy",
          "terms of service",
          "subscribe to newsletter",
          "follow us on",
          "share this article")
          .stream()
          .map(phrase -> Pattern.compile(Pattern.quote(phrase), Pattern.CASE_INSENSITIVE))
          .toList();

  private final ResearchConfig researchConfig;

  /**
   * Condenses {@code html} fetched from {@code url}.
   *
   * @throws ScrapeException when too little text remains after cleaning
   */
  public ScrapedSource extract(String html, String url) {
    ResearchConfig.Scrape config = researchConfig.getScrape();
    Document doc = Jsoup.parse(html == null ? "" : html, url);

    String title = title(doc, url);
    int bodyChars = clean(doc.body().text()).length();
    boolean needsJs = needsJsRendering(doc, bodyChars);

    doc.select(JUNK_SELECTORS).remove();
    String content = mainContent(doc);
    if (content.length() > config.getMaxContentChars()) {
      content = content.substring(0, config.getMaxContentChars()) + "...";
    }
    for (Pattern junk : JUNK_PHRASES) {
      content = junk.matcher(content).replaceAll("");
    }
    content = clean(content);

    if (content.length() < config.getMinContentChars()) {
      throw new ScrapeException(
          url, "Content too short after cleaning (" + content.length() + " characters)");
    }
    int summaryChars = Math.min(config.getSummaryChars(), content.length());
    String summary =
        content.substring(0, summaryChars) + (content.length() > summaryChars ? "..." : "");
    log.debug("Extracted {} chars from {} (needsJs={})", content.length(), url, needsJs);
    return new ScrapedSource(url, title, content, summary, null, needsJs);
  }

  private static String title(Document doc, String url) {
    String title = doc.title().trim();
    if (title.isEmpty()) {
      title = firstText(doc, "h1");
    }
    if (title.isEmpty()) {
      title = firstText(doc, "h2");
    }
    if (title.isEmpty()) {
      title = doc.select("meta[property=og:title]").attr("content").trim();
    }
    if (title.isEmpty()) {
      title = doc.select("meta[name=description]").attr("content").trim();
    }
    return title.isEmpty() ? UrlNormalizer.host(url) : title;
  }

  private static boolean needsJsRendering(Document doc, int bodyChars) {
    boolean appRoot = !doc.select("#root, #__next, #app").isEmpty();
    boolean noscriptHint =
        doc.select("noscript").text().toLowerCase(Locale.ROOT).contains("javascript");
    return (appRoot && bodyChars < JS_APP_MAX_TEXT_CHARS) || noscriptHint;
  }

  private static String mainContent(Document doc) {
    for (String selector : MAIN_SELECTORS) {
      String text = clean(firstText(doc, selector));
      if (!text.isEmpty()) {
        if (text.length() > MAIN_CONTENT_MIN_CHARS) {
          return text;
        }
        break;
      }
    }
    String largest = "";
    for (Element element : doc.select("p, article, section, div")) {
      String text = clean(element.text());
      if (text.length() > largest.length()) {
        largest = text;
      }
    }
    if (!largest.isEmpty()) {
      return largest;
    }
    return clean(doc.body().text());
  }

  private static String firstText(Document doc, String selector) {
    Element element = doc.selectFirst(selector);
    return element == null ? "" : element.text().trim();
  }

  private static String clean(String text) {
    return text == null ? "" : text.replace('\u00A0', ' ').replaceAll("\\s+", " ").trim();
  }
}
