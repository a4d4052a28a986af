package com.skypulse.consolidator.model;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.temporal.TemporalAdjusters;
import java.util.Locale;
import java.util.Optional;

/**
 * Report windows and the partition that backs each of them.
 *
 * <p>All window boundaries are computed in UTC.
 */
public enum WindowType {
  /** Rolling 26 hours, so the first visible chart tick sits exactly 24 hours back. */
  LIVE(Partition.SHORT, false),
  DAILY(Partition.SHORT, false),
  WEEKLY(Partition.MEDIUM, true),
  MONTHLY(Partition.LONG, true);

  private static final Duration LIVE_LOOKBACK = Duration.ofHours(26);

  private final Partition partition;
  private final boolean perDaySeries;

  WindowType(Partition partition, boolean perDaySeries) {
    this.partition = partition;
    this.perDaySeries = perDaySeries;
  }

  public Partition partition() {
    return partition;
  }

  /** Whether chart series points are per calendar day rather than per sample. */
  public boolean perDaySeries() {
    return perDaySeries;
  }

  /**
   * Returns the inclusive start of this window relative to {@code now}.
   *
   * @param now reference instant
   * @return window start
   */
  public Instant start(Instant now) {
    LocalDate today = LocalDate.ofInstant(now, ZoneOffset.UTC);
    return switch (this) {
      case LIVE -> now.minus(LIVE_LOOKBACK);
      case DAILY -> today.atStartOfDay(ZoneOffset.UTC).toInstant();
      case WEEKLY -> today.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY))
          .atStartOfDay(ZoneOffset.UTC)
          .toInstant();
      case MONTHLY -> today.withDayOfMonth(1).atStartOfDay(ZoneOffset.UTC).toInstant();
    };
  }

  /**
   * Resolves a window from a lower-case path token such as {@code weekly}.
   *
   * @param raw token to resolve
   * @return matching window, empty when unknown
   */
  public static Optional<WindowType> fromToken(String raw) {
    if (raw == null || raw.isBlank()) {
      return Optional.empty();
    }
    String normalized = raw.trim().toUpperCase(Locale.ROOT);
    for (WindowType type : values()) {
      if (type.name().equals(normalized)) {
        return Optional.of(type);
      }
    }
    return Optional.empty();
  }
}
