package com.skypulse.consolidator.collector;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;

/**
 * Subset of the network's live snapshot document used by the collector.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record NetworkSnapshotPayload(Clients clients) {

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Clients(List<Pilot> pilots, List<Controller> atcs) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Pilot(String userId, String callsign, FlightPlan flightPlan) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record FlightPlan(
      String departureId, String arrivalId, Integer peopleOnBoard, String route, Aircraft aircraft) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Aircraft(String icaoCode) {}

  /**
   * Controller position. The frequency is reported either inside {@code atcSession} or at the
   * top level depending on the API revision; {@code atis} is an object with a {@code lines}
   * array or plain text.
   */
  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Controller(
      String userId, String callsign, AtcSession atcSession, Double frequency, JsonNode atis) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record AtcSession(Double frequency) {}
}
