package com.skypulse.consolidator.api;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.skypulse.consolidator.model.ActiveFlight;
import com.skypulse.consolidator.model.ChartSeries;
import com.skypulse.consolidator.model.FlightCategory;
import com.skypulse.consolidator.model.LeaderboardEntry;
import com.skypulse.consolidator.model.Partition;
import com.skypulse.consolidator.model.SessionRecord;
import com.skypulse.consolidator.model.Statistics;
import com.skypulse.consolidator.model.WindowType;
import com.skypulse.consolidator.region.RegionConfigProvider;
import com.skypulse.consolidator.region.RegionPrefixes;
import com.skypulse.consolidator.service.ConsolidationService;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(controllers = StatisticsController.class)
@AutoConfigureMockMvc(addFilters = false)
class StatisticsControllerTest {

  @Autowired private MockMvc mockMvc;

  @MockBean private ConsolidationService consolidationService;
  @MockBean private RegionConfigProvider regionConfig;

  @Test
  void live_returns200() throws Exception {
    Statistics live = new Statistics(
        1, 1, 0, 0, 1, 180, 42, 12, 1,
        List.of(new ActiveFlight("AFR12", "LFPG", "LFMN", "DCT", 180, "A320", FlightCategory.DOMESTIC)),
        List.of(new SessionRecord("9", "LFPG_TWR", 118.65, null)),
        null, null, null, null);
    when(consolidationService.getLiveStatistics(Partition.SHORT)).thenReturn(Optional.of(live));

    mockMvc.perform(get("/api/statistics/live"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.totalFlights").value(1))
        .andExpect(jsonPath("$.activeFlights[0].callsign").value("AFR12"))
        .andExpect(jsonPath("$.activeFlights[0].category").value("DOMESTIC"))
        .andExpect(jsonPath("$.topPilots").doesNotExist())
        .andExpect(jsonPath("$.weather").doesNotExist());
  }

  @Test
  void live_returns404WhenStoreIsEmpty() throws Exception {
    when(consolidationService.getLiveStatistics(Partition.SHORT)).thenReturn(Optional.empty());

    mockMvc.perform(get("/api/statistics/live"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.error").value("not_found"));
  }

  @Test
  void window_returns200WithLeaderboards() throws Exception {
    Statistics weekly = new Statistics(
        3, 1, 1, 1, 3, 450, 120, 60, 2,
        null, null, null,
        List.of(),
        List.of(new LeaderboardEntry("100", 90)),
        List.of(new LeaderboardEntry("9", 60)));
    when(consolidationService.getWindowStatistics(WindowType.WEEKLY)).thenReturn(Optional.of(weekly));

    mockMvc.perform(get("/api/statistics/weekly"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.topPilots[0].subjectId").value("100"))
        .andExpect(jsonPath("$.topPilots[0].minutes").value(90))
        .andExpect(jsonPath("$.activeFlights").doesNotExist());
  }

  @Test
  void window_returns400ForUnknownWindow() throws Exception {
    mockMvc.perform(get("/api/statistics/yearly"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error").value("bad_request"));
  }

  @Test
  void window_returns404WhenWindowIsEmpty() throws Exception {
    when(consolidationService.getWindowStatistics(WindowType.MONTHLY)).thenReturn(Optional.empty());

    mockMvc.perform(get("/api/statistics/monthly"))
        .andExpect(status().isNotFound());
  }

  @Test
  void window_returns502WhenStoreFails() throws Exception {
    when(consolidationService.getWindowStatistics(WindowType.DAILY))
        .thenThrow(new DataAccessResourceFailureException("database is locked"));

    mockMvc.perform(get("/api/statistics/daily"))
        .andExpect(status().isBadGateway())
        .andExpect(jsonPath("$.error").value("backend_unavailable"));
  }

  @Test
  void controllerSessions_returnsMinutesPerCallsign() throws Exception {
    Map<String, Integer> minutes = new LinkedHashMap<>();
    minutes.put("LFPG_TWR", 95);
    minutes.put("LFMN_APP", 0);
    when(consolidationService.getControllerSessionMinutes(List.of("LFPG_TWR", "LFMN_APP"))).thenReturn(minutes);

    mockMvc.perform(get("/api/controllers/sessions")
            .param("callsign", "LFPG_TWR")
            .param("callsign", "LFMN_APP"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.LFPG_TWR").value(95))
        .andExpect(jsonPath("$.LFMN_APP").value(0));
  }

  @Test
  void controllerSessions_returns400WithoutCallsign() throws Exception {
    mockMvc.perform(get("/api/controllers/sessions"))
        .andExpect(status().isBadRequest());
  }

  @Test
  void chartSeries_returns200() throws Exception {
    ChartSeries series = new ChartSeries(
        WindowType.DAILY,
        List.of(new ChartSeries.Point("00:00", 0, 0), new ChartSeries.Point("14:30", 12, 3)));
    when(consolidationService.getChartSeries(WindowType.DAILY)).thenReturn(series);

    mockMvc.perform(get("/api/charts/daily/series"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.windowType").value("DAILY"))
        .andExpect(jsonPath("$.points[1].label").value("14:30"))
        .andExpect(jsonPath("$.points[1].participants").value(12));
  }

  @Test
  void chartImage_returns500WhenRenderingFails() throws Exception {
    when(consolidationService.renderChart(any()))
        .thenThrow(new UncheckedIOException(new IOException("disk full")));

    mockMvc.perform(get("/api/charts/weekly/image"))
        .andExpect(status().isInternalServerError())
        .andExpect(jsonPath("$.error").value("render_failed"));
  }

  @Test
  void regions_returnsCurrentPrefixes() throws Exception {
    when(regionConfig.current()).thenReturn(RegionPrefixes.of("LF", "LO"));

    mockMvc.perform(get("/api/regions"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.prefixes[0]").value("LF"))
        .andExpect(jsonPath("$.prefixes[1]").value("LO"));
  }

  @Test
  void updateRegions_normalizesAndApplies() throws Exception {
    mockMvc.perform(put("/api/regions")
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"prefixes\":[\" lf \",\"eg\",\"\"]}"))
        .andExpect(status().isOk())
        .andExpect(content().json("{\"prefixes\":[\"LF\",\"EG\"]}"));

    verify(regionConfig).update(eq(RegionPrefixes.of("LF", "EG")));
  }

  @Test
  void updateRegions_returns400ForEmptyPrefixes() throws Exception {
    mockMvc.perform(put("/api/regions")
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"prefixes\":[\" \"]}"))
        .andExpect(status().isBadRequest());

    verify(regionConfig, never()).update(any());
  }
}
