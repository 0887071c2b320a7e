package com.flamingo.ai.researchchat.api.rest;

import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.flamingo.ai.researchchat.config.ResearchConfig;
import com.flamingo.ai.researchchat.domain.model.SearchResult;
import com.flamingo.ai.researchchat.exception.ApiError;
import com.flamingo.ai.researchchat.exception.GlobalExceptionHandler;
import com.flamingo.ai.researchchat.exception.ScrapeException;
import com.flamingo.ai.researchchat.service.scrape.ContentScraper;
import com.flamingo.ai.researchchat.service.scrape.ScrapedSource;
import com.flamingo.ai.researchchat.service.search.ProviderExecutor;
import com.flamingo.ai.researchchat.service.search.SearchExecutionResult;
import com.flamingo.ai.researchchat.service.stream.GenerationSessionRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
@DisplayName("Search, scrape and health endpoints")
class ToolControllersTest {

  private MockMvc mockMvc;

  @Mock private ProviderExecutor providerExecutor;
  @Mock private ContentScraper contentScraper;

  @BeforeEach
  void setUp() {
    mockMvc =
        MockMvcBuilders.standaloneSetup(
                new SearchController(providerExecutor, new ResearchConfig()),
                new ScrapeController(contentScraper),
                new HealthController(new GenerationSessionRegistry()))
            .setControllerAdvice(new GlobalExceptionHandler(new SimpleMeterRegistry()))
            .build();
  }

  @Test
  @DisplayName("Should search with the configured default result count")
  void shouldSearchWithDefaultCount() throws Exception {
    // given
    when(providerExecutor.search("java records", 7))
        .thenReturn(
            new SearchExecutionResult(
                List.of(new SearchResult("JEP 395", "https://openjdk.org/jeps/395", "", 0.9)),
                true,
                List.of()));

    // when / then
    mockMvc
        .perform(
            post("/api/search")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"query\":\"  java records \"}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.query").value("java records"))
        .andExpect(jsonPath("$.hasRealResults").value(true))
        .andExpect(jsonPath("$.results[0].url").value("https://openjdk.org/jeps/395"));
  }

  @Test
  @DisplayName("Should reject an out-of-range result count")
  void shouldRejectTooManyResults() throws Exception {
    mockMvc
        .perform(
            post("/api/search")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"query\":\"java\",\"maxResults\":50}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value(ApiError.VALIDATION_ERROR));

    verify(providerExecutor, never()).search(anyString(), anyInt());
  }

  @Test
  @DisplayName("Should return the scraped page")
  void shouldScrapePage() throws Exception {
    // given
    when(contentScraper.scrape("https://docs.example.com/guide"))
        .thenReturn(
            new ScrapedSource(
                "https://docs.example.com/guide", "Guide", "Body", "Body", null, false));

    // when / then
    mockMvc
        .perform(
            post("/api/scrape")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"url\":\"https://docs.example.com/guide\"}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.title").value("Guide"))
        .andExpect(jsonPath("$.fetchError").doesNotExist());
  }

  @Test
  @DisplayName("Should answer 400 for a blocked address")
  void shouldRejectBlockedAddress() throws Exception {
    // given
    when(contentScraper.scrape("http://169.254.169.254/latest"))
        .thenThrow(ScrapeException.blocked("http://169.254.169.254/latest", "private address"));

    // when / then
    mockMvc
        .perform(
            post("/api/scrape")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"url\":\"http://169.254.169.254/latest\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value(ApiError.SCRAPE_BLOCKED));
  }

  @Test
  @DisplayName("Should report health with the active run count")
  void shouldReportHealth() throws Exception {
    mockMvc
        .perform(get("/api/health"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("UP"))
        .andExpect(jsonPath("$.activeRuns").value(0));
  }
}
