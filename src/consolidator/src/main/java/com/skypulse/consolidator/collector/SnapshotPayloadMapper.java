package com.skypulse.consolidator.collector;

import com.fasterxml.jackson.databind.JsonNode;
import com.skypulse.consolidator.model.FlightRecord;
import com.skypulse.consolidator.model.SessionRecord;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Maps the upstream document onto flight and session records.
 *
 * <p>Codes are upper-cased, missing aircraft types become {@code UNKNOWN} and routes are
 * normalized. Validation against the region happens at ingestion, not here.
 */
final class SnapshotPayloadMapper {
  static final String UNKNOWN_AIRCRAFT = "UNKNOWN";

  private SnapshotPayloadMapper() {}

  static List<FlightRecord> flights(NetworkSnapshotPayload payload) {
    if (payload == null || payload.clients() == null || payload.clients().pilots() == null) {
      return List.of();
    }
    List<FlightRecord> flights = new ArrayList<>();
    for (NetworkSnapshotPayload.Pilot pilot : payload.clients().pilots()) {
      if (pilot == null) {
        continue;
      }
      NetworkSnapshotPayload.FlightPlan plan = pilot.flightPlan();
      String aircraft = plan == null || plan.aircraft() == null ? null : plan.aircraft().icaoCode();
      flights.add(new FlightRecord(
          pilot.userId(),
          upper(pilot.callsign()),
          plan == null ? "" : upper(plan.departureId()),
          plan == null ? "" : upper(plan.arrivalId()),
          RouteNormalizer.normalize(plan == null ? null : plan.route()),
          plan == null || plan.peopleOnBoard() == null ? 0 : plan.peopleOnBoard(),
          aircraft == null || aircraft.isBlank() ? UNKNOWN_AIRCRAFT : upper(aircraft)));
    }
    return flights;
  }

  static List<SessionRecord> sessions(NetworkSnapshotPayload payload) {
    if (payload == null || payload.clients() == null || payload.clients().atcs() == null) {
      return List.of();
    }
    List<SessionRecord> sessions = new ArrayList<>();
    for (NetworkSnapshotPayload.Controller controller : payload.clients().atcs()) {
      if (controller == null) {
        continue;
      }
      Double frequency = controller.atcSession() != null
          ? controller.atcSession().frequency()
          : controller.frequency();
      sessions.add(new SessionRecord(
          controller.userId(), upper(controller.callsign()), frequency, atisText(controller.atis())));
    }
    return sessions;
  }

  private static String atisText(JsonNode atis) {
    if (atis == null || atis.isNull() || atis.isMissingNode()) {
      return null;
    }
    if (atis.isTextual()) {
      return atis.asText();
    }
    JsonNode lines = atis.path("lines");
    if (lines.isArray()) {
      List<String> text = new ArrayList<>();
      lines.forEach(line -> text.add(line.asText()));
      return String.join("\n", text);
    }
    return atis.toString();
  }

  private static String upper(String value) {
    return value == null ? "" : value.trim().toUpperCase(Locale.ROOT);
  }
}
