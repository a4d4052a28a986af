package com.skypulse.consolidator.model;

/**
 * One row of a "top N" ranking.
 *
 * @param subjectId subject key (member id or callsign fallback)
 * @param minutes accumulated person-minutes in the window
 */
public record LeaderboardEntry(String subjectId, long minutes) {}
