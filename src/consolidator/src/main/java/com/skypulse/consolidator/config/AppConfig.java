package com.skypulse.consolidator.config;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class AppConfig {
  @Bean
  public HttpClient httpClient(ConsolidatorProperties properties) {
    return HttpClient.newBuilder()
        .connectTimeout(Duration.ofSeconds(properties.getCollector().getTimeoutSeconds()))
        .build();
  }

  // Every window boundary is computed in UTC.
  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
