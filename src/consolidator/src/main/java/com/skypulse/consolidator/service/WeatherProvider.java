package com.skypulse.consolidator.service;

import java.util.Optional;

/**
 * Optional source of a short weather text attached to live reports.
 */
public interface WeatherProvider {
  Optional<String> currentWeather();
}
