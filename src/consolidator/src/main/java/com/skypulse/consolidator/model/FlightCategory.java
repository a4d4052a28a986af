package com.skypulse.consolidator.model;

/** Classification of a flight relative to the configured region. */
public enum FlightCategory {
  DOMESTIC,
  OUTGOING,
  INCOMING,
  UNRELATED
}
