package com.skypulse.consolidator.collector;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.skypulse.consolidator.chart.TtlCache;
import com.skypulse.consolidator.config.ConsolidatorProperties;
import com.skypulse.consolidator.service.WeatherProvider;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Clock;
import java.time.Duration;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Looks up the raw METAR of the configured airport for the live report.
 *
 * <p>Every answer is kept for the refresh period, a missing one included, so the live endpoint
 * costs at most one upstream request per airport and period. Failures never propagate: the
 * report goes out without weather.
 */
@Component
@ConditionalOnProperty(prefix = "consolidator.weather", name = "enabled", havingValue = "true")
public class MetarWeatherProvider implements WeatherProvider {
  private static final Logger log = LoggerFactory.getLogger(MetarWeatherProvider.class);

  private final ConsolidatorProperties.Weather settings;
  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final TtlCache<String, Observation> cache;
  private final Timer requestTimer;
  private final Counter successCounter;
  private final Counter notFoundCounter;
  private final Counter httpErrorCounter;
  private final Counter exceptionCounter;

  public MetarWeatherProvider(
      ConsolidatorProperties properties,
      HttpClient httpClient,
      ObjectMapper objectMapper,
      Clock clock,
      MeterRegistry meterRegistry) {
    this.settings = properties.getWeather();
    this.httpClient = httpClient;
    this.objectMapper = objectMapper;
    Duration refresh = Duration.ofSeconds(settings.getRefreshSeconds());
    this.cache = new TtlCache<>(clock, refresh, refresh);
    this.requestTimer = Timer.builder("consolidator.weather.http.duration")
        .description("METAR request duration (seconds)")
        .register(meterRegistry);
    this.successCounter = Counter.builder("consolidator.weather.requests.total")
        .tag("outcome", "success")
        .register(meterRegistry);
    this.notFoundCounter = Counter.builder("consolidator.weather.requests.total")
        .tag("outcome", "not_found")
        .register(meterRegistry);
    this.httpErrorCounter = Counter.builder("consolidator.weather.requests.total")
        .tag("outcome", "http_error")
        .register(meterRegistry);
    this.exceptionCounter = Counter.builder("consolidator.weather.requests.total")
        .tag("outcome", "exception")
        .register(meterRegistry);
  }

  @Override
  public Optional<String> currentWeather() {
    return metar(settings.getAirport());
  }

  /**
   * Returns the raw METAR of an airport, from the cache while it is fresh.
   *
   * @param icao airport ICAO code, case-insensitive
   * @return raw METAR text, empty when unknown, unconfigured or unreachable
   */
  public Optional<String> metar(String icao) {
    if (icao == null || icao.isBlank()) {
      return Optional.empty();
    }
    String key = icao.trim().toUpperCase(Locale.ROOT);
    Optional<Observation> cached = cache.get(key);
    if (cached.isPresent()) {
      return cached.get().raw();
    }
    Observation observation = new Observation(fetch(key));
    cache.put(key, observation);
    return observation.raw();
  }

  private Optional<String> fetch(String icao) {
    String token = settings.getToken();
    if (token == null || token.isBlank()) {
      log.debug("consolidator.weather.token is empty; no METAR for {}", icao);
      return Optional.empty();
    }

    long startNs = System.nanoTime();
    try {
      HttpRequest request = HttpRequest.newBuilder()
          .uri(URI.create(settings.getUrl() + "/" + icao + "?options=info"))
          .timeout(Duration.ofSeconds(settings.getTimeoutSeconds()))
          .header("Authorization", "Bearer " + token)
          .header("Accept", "application/json")
          .GET()
          .build();
      HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
      if (response.statusCode() == 404) {
        notFoundCounter.increment();
        log.info("No METAR published for {}", icao);
        return Optional.empty();
      }
      if (response.statusCode() != 200) {
        httpErrorCounter.increment();
        log.warn("METAR fetch failed: icao={} status={}", icao, response.statusCode());
        return Optional.empty();
      }
      successCounter.increment();
      JsonNode raw = objectMapper.readTree(response.body()).path("raw");
      return raw.isTextual() && !raw.asText().isBlank() ? Optional.of(raw.asText()) : Optional.empty();
    } catch (InterruptedException ex) {
      exceptionCounter.increment();
      Thread.currentThread().interrupt();
      log.error("METAR fetch interrupted", ex);
      return Optional.empty();
    } catch (Exception ex) {
      exceptionCounter.increment();
      log.error("Failed to fetch METAR for {}", icao, ex);
      return Optional.empty();
    } finally {
      requestTimer.record(System.nanoTime() - startNs, TimeUnit.NANOSECONDS);
    }
  }

  private record Observation(Optional<String> raw) {
  }
}
