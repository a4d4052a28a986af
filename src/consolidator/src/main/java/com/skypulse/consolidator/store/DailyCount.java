package com.skypulse.consolidator.store;

import java.time.LocalDate;

/**
 * Distinct participants seen on one UTC calendar day.
 *
 * @param day UTC day
 * @param pilots distinct pilot subject keys
 * @param controllers distinct controller subject keys
 */
public record DailyCount(LocalDate day, int pilots, int controllers) {}
