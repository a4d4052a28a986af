package com.skypulse.consolidator.model;

/**
 * One pilot observed in one sample.
 *
 * @param subjectId network member id, may be null when the upstream omits it
 * @param callsign upper-case callsign
 * @param departure departure airport code
 * @param arrival arrival airport code
 * @param route normalized route text
 * @param seats people on board reported in this sample
 * @param aircraftType ICAO aircraft type
 */
public record FlightRecord(
    String subjectId,
    String callsign,
    String departure,
    String arrival,
    String route,
    int seats,
    String aircraftType) {

  /**
   * Returns the identity used for person-time accounting: the subject id, or the callsign when
   * no subject id is known.
   */
  public String subjectKey() {
    if (subjectId != null && !subjectId.isBlank()) {
      return subjectId.trim();
    }
    return callsign;
  }
}
