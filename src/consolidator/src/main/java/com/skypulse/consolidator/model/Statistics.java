package com.skypulse.consolidator.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;

/**
 * Consolidated activity figures for one report.
 *
 * <p>Built fresh per query and never mutated afterwards. Live-only and window-only fields are
 * {@code null} when they do not apply to the report that produced the instance.
 *
 * @param totalFlights distinct flights involving the region
 * @param domesticFlights flights with both endpoints in the region
 * @param outgoingFlights flights leaving the region
 * @param incomingFlights flights entering the region
 * @param uniquePilots distinct pilots among region flights
 * @param peopleOnBoard people on board (per-flight high-water mark for windows)
 * @param flightMinutes pilot person-minutes
 * @param controlMinutes controller person-minutes
 * @param controllerCount active controllers (live) or distinct controllers (window)
 * @param activeFlights live only: flights in the latest sample
 * @param activeControllers live only: in-scope sessions in the latest sample
 * @param weather live only: weather text from the optional provider
 * @param topAirports window only: busiest in-region airports
 * @param topPilots window only: pilots ranked by flight minutes
 * @param topControllers window only: controllers ranked by control minutes
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Statistics(
    int totalFlights,
    int domesticFlights,
    int outgoingFlights,
    int incomingFlights,
    int uniquePilots,
    long peopleOnBoard,
    long flightMinutes,
    long controlMinutes,
    int controllerCount,
    List<ActiveFlight> activeFlights,
    List<SessionRecord> activeControllers,
    String weather,
    List<AirportActivity> topAirports,
    List<LeaderboardEntry> topPilots,
    List<LeaderboardEntry> topControllers) {

  public Statistics {
    activeFlights = activeFlights == null ? null : List.copyOf(activeFlights);
    activeControllers = activeControllers == null ? null : List.copyOf(activeControllers);
    topAirports = topAirports == null ? null : List.copyOf(topAirports);
    topPilots = topPilots == null ? null : List.copyOf(topPilots);
    topControllers = topControllers == null ? null : List.copyOf(topControllers);
  }

  /**
   * Returns a copy carrying the given weather text.
   *
   * @param weatherText weather text, may be null
   * @return new instance; this one is left untouched
   */
  public Statistics withWeather(String weatherText) {
    return new Statistics(
        totalFlights,
        domesticFlights,
        outgoingFlights,
        incomingFlights,
        uniquePilots,
        peopleOnBoard,
        flightMinutes,
        controlMinutes,
        controllerCount,
        activeFlights,
        activeControllers,
        weatherText,
        topAirports,
        topPilots,
        topControllers);
  }
}
