package com.skypulse.consolidator.model;

/**
 * Distinct flight movements at one in-region airport over a window.
 *
 * @param airport airport code
 * @param departures distinct flights departing from it
 * @param arrivals distinct flights arriving to it
 */
public record AirportActivity(String airport, long departures, long arrivals) {

  public long movements() {
    return departures + arrivals;
  }
}
