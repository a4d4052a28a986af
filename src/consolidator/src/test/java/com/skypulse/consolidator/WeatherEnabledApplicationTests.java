package com.skypulse.consolidator;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.skypulse.consolidator.collector.MetarWeatherProvider;
import com.skypulse.consolidator.model.FlightRecord;
import com.skypulse.consolidator.model.Partition;
import com.skypulse.consolidator.model.Statistics;
import com.skypulse.consolidator.service.ConsolidationService;
import com.skypulse.consolidator.service.SnapshotIngestService;
import com.skypulse.consolidator.service.WeatherProvider;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentMatchers;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;

@SpringBootTest(
    properties = {
      "consolidator.scheduling.enabled=false",
      "consolidator.collector.enabled=false",
      "consolidator.store.path=target/test-store-weather/consolidator.db",
      "consolidator.chart.output-dir=target/test-store-weather/charts",
      "consolidator.weather.enabled=true",
      "consolidator.weather.token=test-token",
      "consolidator.weather.airport=LFPG"
    })
class WeatherEnabledApplicationTests {
  private static final String METAR = "LFPG 101200Z 24010KT CAVOK 12/04 Q1021 NOSIG";

  @MockBean
  private HttpClient httpClient;

  @Autowired
  private WeatherProvider weatherProvider;

  @Autowired
  private SnapshotIngestService ingestService;

  @Autowired
  private ConsolidationService consolidationService;

  @Test
  void liveReportCarriesTheConfiguredAirportMetar() throws Exception {
    @SuppressWarnings("unchecked")
    HttpResponse<String> response = (HttpResponse<String>) mock(HttpResponse.class);
    when(response.statusCode()).thenReturn(200);
    when(response.body()).thenReturn("{\"raw\": \"" + METAR + "\"}");
    when(httpClient.send(any(HttpRequest.class), ArgumentMatchers.<HttpResponse.BodyHandler<String>>any()))
        .thenReturn(response);

    ingestService.ingest(
        Instant.now(),
        List.of(new FlightRecord("1", "AFR12", "LFPG", "LFMN", "DCT", 180, "A320")),
        List.of());
    Statistics live = consolidationService.getLiveStatistics(Partition.SHORT).orElseThrow();

    assertThat(weatherProvider).isInstanceOf(MetarWeatherProvider.class);
    assertThat(live.weather()).isEqualTo(METAR);
  }
}
