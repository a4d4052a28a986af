package com.skypulse.consolidator.collector;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.skypulse.consolidator.config.ConsolidatorProperties;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Fetches the network's live snapshot document.
 *
 * <p>Failures never propagate: the caller skips the cycle and retries at the next tick.
 */
@Component
public class NetworkSnapshotClient {
  private static final Logger log = LoggerFactory.getLogger(NetworkSnapshotClient.class);

  private final ConsolidatorProperties properties;
  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final Timer requestTimer;
  private final Counter successCounter;
  private final Counter httpErrorCounter;
  private final Counter exceptionCounter;
  private final AtomicInteger lastStatusCode = new AtomicInteger(0);

  public NetworkSnapshotClient(
      ConsolidatorProperties properties,
      HttpClient httpClient,
      ObjectMapper objectMapper,
      MeterRegistry meterRegistry) {
    this.properties = properties;
    this.httpClient = httpClient;
    this.objectMapper = objectMapper;
    this.requestTimer = Timer.builder("consolidator.collector.http.duration")
        .description("Upstream snapshot request duration (seconds)")
        .register(meterRegistry);
    // Keep cardinality low: a handful of outcomes, no URL labels.
    this.successCounter = Counter.builder("consolidator.collector.http.requests.total")
        .tag("outcome", "success")
        .register(meterRegistry);
    this.httpErrorCounter = Counter.builder("consolidator.collector.http.requests.total")
        .tag("outcome", "http_error")
        .register(meterRegistry);
    this.exceptionCounter = Counter.builder("consolidator.collector.http.requests.total")
        .tag("outcome", "exception")
        .register(meterRegistry);
    meterRegistry.gauge("consolidator.collector.http.last_status", lastStatusCode);
  }

  public Optional<NetworkSnapshotPayload> fetch() {
    String url = properties.getCollector().getUrl();
    if (url == null || url.isBlank()) {
      log.warn("consolidator.collector.url is empty; skipping fetch");
      return Optional.empty();
    }

    long startNs = System.nanoTime();
    try {
      HttpRequest request = HttpRequest.newBuilder()
          .uri(URI.create(url))
          .timeout(Duration.ofSeconds(properties.getCollector().getTimeoutSeconds()))
          .header("Accept", "application/json")
          .GET()
          .build();
      HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
      lastStatusCode.set(response.statusCode());
      if (response.statusCode() >= 400) {
        httpErrorCounter.increment();
        log.warn("Snapshot fetch failed: status={}", response.statusCode());
        return Optional.empty();
      }
      successCounter.increment();
      return Optional.ofNullable(objectMapper.readValue(response.body(), NetworkSnapshotPayload.class));
    } catch (InterruptedException ex) {
      lastStatusCode.set(0);
      exceptionCounter.increment();
      Thread.currentThread().interrupt();
      log.error("Snapshot fetch interrupted", ex);
      return Optional.empty();
    } catch (Exception ex) {
      lastStatusCode.set(0);
      exceptionCounter.increment();
      log.error("Failed to fetch network snapshot", ex);
      return Optional.empty();
    } finally {
      requestTimer.record(System.nanoTime() - startNs, TimeUnit.NANOSECONDS);
    }
  }
}
