package com.flamingo.ai.researchchat.config;

import com.flamingo.ai.researchchat.security.RateLimiter;
import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Request guard beans. */
@Configuration
public class SecurityConfig {

  /** Process-wide request budget keyed by client and route. */
  @Bean
  public RateLimiter rateLimiter(Clock clock) {
    return new RateLimiter(clock);
  }
}
