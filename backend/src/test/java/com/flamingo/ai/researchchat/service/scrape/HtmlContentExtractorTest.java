package com.flamingo.ai.researchchat.service.scrape;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.researchchat.config.ResearchConfig;
import com.flamingo.ai.researchchat.exception.ScrapeException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("HtmlContentExtractor")
class HtmlContentExtractorTest {

  private static final String PARAGRAPH =
      "The James Webb Space Telescope observes the universe in infrared light. ";

  private HtmlContentExtractor extractor;

  @BeforeEach
  void setUp() {
    extractor = new HtmlContentExtractor(new ResearchConfig());
  }

  @Test
  @DisplayName("Should take the article body and drop navigation, scripts and junk phrases")
  void shouldExtractArticle() {
    String html =
        "<html><head><title> Webb facts </title><script>var x = 1;</script></head><body>"
            + "<nav>Home | About</nav>"
            + "<article><p>"
            + PARAGRAPH.repeat(6)
            + "Accept cookies to continue.</p></article>"
            + "<footer>Privacy Policy</footer></body></html>";

    ScrapedSource source = extractor.extract(html, "https://science.example/webb");

    assertThat(source.title()).isEqualTo("Webb facts");
    assertThat(source.content()).startsWith("The James Webb Space Telescope");
    assertThat(source.content()).doesNotContain("Home | About", "var x", "Accept cookies");
    assertThat(source.fetchError()).isNull();
    assertThat(source.needsJsRendering()).isFalse();
  }

  @Test
  @DisplayName("Should cap the summary at 500 characters with an ellipsis")
  void shouldSummarize() {
    String html = "<html><body><main>" + PARAGRAPH.repeat(20) + "</main></body></html>";

    ScrapedSource source = extractor.extract(html, "https://science.example/long");

    assertThat(source.summary()).hasSize(503).endsWith("...");
    assertThat(source.title()).isEqualTo("science.example");
  }

  @Test
  @DisplayName("Should fall back to the first heading for the title")
  void shouldUseHeadingAsTitle() {
    String html = "<html><body><h1>Launch day</h1><div>" + PARAGRAPH.repeat(3) + "</div></body>";

    assertThat(extractor.extract(html, "https://a.example/").title()).isEqualTo("Launch day");
  }

  @Test
  @DisplayName("Should reject pages with too little text")
  void shouldRejectThinPages() {
    String html = "<html><body><p>Loading...</p></body></html>";

    assertThatThrownBy(() -> extractor.extract(html, "https://a.example/"))
        .isInstanceOf(ScrapeException.class)
        .hasMessageContaining("Content too short");
  }

  @Test
  @DisplayName("Should flag pages that ask for JavaScript")
  void shouldDetectClientRenderedPages() {
    String html =
        "<html><body><noscript>You need to enable JavaScript to run this app.</noscript>"
            + "<div id=\"root\"><p>"
            + PARAGRAPH.repeat(3)
            + "</p></div></body></html>";

    assertThat(extractor.extract(html, "https://app.example/").needsJsRendering()).isTrue();
  }
}
