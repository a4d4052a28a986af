package com.skypulse.consolidator.api;

import com.skypulse.consolidator.model.ChartSeries;
import com.skypulse.consolidator.model.Partition;
import com.skypulse.consolidator.model.Statistics;
import com.skypulse.consolidator.model.WindowType;
import com.skypulse.consolidator.region.RegionConfigProvider;
import com.skypulse.consolidator.region.RegionPrefixes;
import com.skypulse.consolidator.service.ConsolidationService;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller over the consolidation reports.
 *
 * <p>Route design:
 * <ul>
 *   <li>{@code GET /api/statistics/live}: report built from the latest sample</li>
 *   <li>{@code GET /api/statistics/{window}}: daily, weekly or monthly report</li>
 *   <li>{@code GET /api/controllers/sessions}: continuous duty minutes per callsign</li>
 *   <li>{@code GET /api/charts/{window}/series} and {@code /image}: chart data and PNG</li>
 *   <li>{@code GET|PUT /api/regions}: region prefixes in force</li>
 * </ul>
 */
@RestController
@RequestMapping("/api")
public class StatisticsController {
  private final ConsolidationService consolidationService;
  private final RegionConfigProvider regionConfig;

  public StatisticsController(ConsolidationService consolidationService, RegionConfigProvider regionConfig) {
    this.consolidationService = consolidationService;
    this.regionConfig = regionConfig;
  }

  @GetMapping("/statistics/live")
  public Statistics live() {
    return consolidationService.getLiveStatistics(Partition.SHORT)
        .orElseThrow(() -> new NotFoundException("no sample stored yet"));
  }

  /**
   * Returns the report of a historical window.
   *
   * @param window {@code daily}, {@code weekly} or {@code monthly}
   * @return window statistics with leaderboards
   */
  @GetMapping("/statistics/{window}")
  public Statistics window(@PathVariable("window") String window) {
    WindowType windowType = parseWindow(window);
    if (windowType == WindowType.LIVE) {
      return live();
    }
    return consolidationService.getWindowStatistics(windowType)
        .orElseThrow(() -> new NotFoundException("no sample in " + window + " window"));
  }

  /**
   * Returns continuous duty minutes for each requested controller.
   *
   * @param callsigns one or more {@code callsign} parameters
   * @return minutes keyed by upper-case callsign
   */
  @GetMapping("/controllers/sessions")
  public Map<String, Integer> controllerSessions(
      @RequestParam(value = "callsign", required = false) List<String> callsigns) {
    if (callsigns == null || callsigns.stream().allMatch(c -> c == null || c.isBlank())) {
      throw new BadRequestException("at least one callsign is required");
    }
    return consolidationService.getControllerSessionMinutes(callsigns);
  }

  @GetMapping("/charts/{window}/series")
  public ChartSeries chartSeries(@PathVariable("window") String window) {
    return consolidationService.getChartSeries(parseWindow(window));
  }

  @GetMapping("/charts/{window}/image")
  public ResponseEntity<Resource> chartImage(@PathVariable("window") String window) {
    Path chart = consolidationService.renderChart(parseWindow(window));
    return ResponseEntity.ok().contentType(MediaType.IMAGE_PNG).body(new FileSystemResource(chart));
  }

  @GetMapping("/regions")
  public RegionPrefixesPayload regions() {
    return new RegionPrefixesPayload(regionConfig.current().values());
  }

  /**
   * Replaces the region prefixes used by subsequent queries.
   *
   * @param payload new prefixes, at least one non-blank entry
   * @return prefixes now in force
   */
  @PutMapping("/regions")
  public RegionPrefixesPayload updateRegions(@RequestBody RegionPrefixesPayload payload) {
    RegionPrefixes prefixes = RegionPrefixes.of(payload == null ? null : payload.prefixes());
    if (prefixes.isEmpty()) {
      throw new BadRequestException("prefixes must contain at least one non-blank value");
    }
    regionConfig.update(prefixes);
    return new RegionPrefixesPayload(prefixes.values());
  }

  private static WindowType parseWindow(String raw) {
    return WindowType.fromToken(raw)
        .orElseThrow(() -> new BadRequestException("unknown window: " + raw));
  }
}
