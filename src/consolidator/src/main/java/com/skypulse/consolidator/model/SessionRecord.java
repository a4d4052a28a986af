package com.skypulse.consolidator.model;

/**
 * One controller position observed in one sample.
 *
 * @param subjectId network member id, may be null
 * @param callsign upper-case position callsign
 * @param frequency tuned frequency in MHz, may be null
 * @param status free-text status payload (ATIS lines), may be null
 */
public record SessionRecord(String subjectId, String callsign, Double frequency, String status) {

  /** Subject id, or callsign when no subject id is known. */
  public String subjectKey() {
    if (subjectId != null && !subjectId.isBlank()) {
      return subjectId.trim();
    }
    return callsign;
  }
}
