package com.skypulse.consolidator.model;

/**
 * Flight currently visible in the latest sample, as listed in live reports.
 */
public record ActiveFlight(
    String callsign,
    String departure,
    String arrival,
    String route,
    int seats,
    String aircraftType,
    FlightCategory category) {}
