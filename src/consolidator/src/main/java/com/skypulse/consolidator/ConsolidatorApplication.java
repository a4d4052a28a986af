package com.skypulse.consolidator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Spring Boot entrypoint for the consolidator service.
 *
 * <p>The consolidator samples network activity into the partitioned snapshot store, maintains
 * window retention, and serves live, window and chart reports over HTTP.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class ConsolidatorApplication {
  public static void main(String[] args) {
    SpringApplication.run(ConsolidatorApplication.class, args);
  }

  @Configuration(proxyBeanMethods = false)
  @EnableScheduling
  @ConditionalOnProperty(
      prefix = "consolidator.scheduling",
      name = "enabled",
      havingValue = "true",
      matchIfMissing = true)
  static class SchedulingConfiguration {}
}
