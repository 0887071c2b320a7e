package com.flamingo.ai.researchchat.service.search;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("UrlNormalizer")
class UrlNormalizerTest {

  @Test
  @DisplayName("Should produce the same key regardless of scheme, host case and trailing slash")
  void shouldIgnoreSchemeCaseAndTrailingSlash() {
    assertThat(UrlNormalizer.normalizeKey("http://EX.com/a/"))
        .isEqualTo(UrlNormalizer.normalizeKey("https://ex.com/a"))
        .isEqualTo("ex.com/a");
  }

  @Test
  @DisplayName("Should strip www, tracking parameters and the fragment")
  void shouldStripTrackingNoise() {
    String key =
        UrlNormalizer.normalizeKey(
            "https://www.example.com/post/?id=42&utm_source=x&utm_medium=y&ref=home#comments");

    assertThat(key).isEqualTo("example.com/post?id=42");
  }

  @Test
  @DisplayName("Should treat the bare host and root path as one key")
  void shouldTreatRootPathAsEmpty() {
    assertThat(UrlNormalizer.normalizeKey("https://example.com/"))
        .isEqualTo(UrlNormalizer.normalizeKey("https://example.com"));
  }

  @Test
  @DisplayName("Should keep non-default ports and path case")
  void shouldKeepPortAndPathCase() {
    assertThat(UrlNormalizer.normalizeKey("http://example.com:8080/Docs/"))
        .isEqualTo("example.com:8080/Docs");
    assertThat(UrlNormalizer.normalizeKey("https://example.com:443/x"))
        .isEqualTo("example.com/x");
  }

  @Test
  @DisplayName("Should fall back to the trimmed input without fragment when unparseable")
  void shouldFallBackForInvalidUrls() {
    assertThat(UrlNormalizer.normalizeKey("  not a url#frag ")).isEqualTo("not a url");
    assertThat(UrlNormalizer.normalizeKey(null)).isEmpty();
  }

  @ParameterizedTest
  @ValueSource(
      strings = {"javascript://x.example.com", "ftp://example.com/file", "/relative/path", ""})
  @DisplayName("Should reject anything that is not an absolute http(s) URL")
  void shouldRejectNonHttpUrls(String url) {
    assertThat(UrlNormalizer.isHttpUrl(url)).isFalse();
  }

  @Test
  @DisplayName("Should extract the host without www")
  void shouldExtractHost() {
    assertThat(UrlNormalizer.host("https://WWW.Docs.Python.org/3/")).isEqualTo("docs.python.org");
    assertThat(UrlNormalizer.host("::bad::")).isEmpty();
  }
}
