package com.skypulse.consolidator.stats;

import com.skypulse.consolidator.config.ConsolidatorProperties;
import com.skypulse.consolidator.model.Partition;
import com.skypulse.consolidator.store.ControllerPresence;
import com.skypulse.consolidator.store.SnapshotRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Reconstructs how long each active controller has been continuously on duty.
 *
 * <p>Continuity follows the short partition's sample ids, not wall-clock gaps. When the
 * collector is down no sample is written, so ids stay consecutive and the session survives the
 * outage. When the controller disconnects while the collector keeps running, at least one
 * sample lacks the callsign, which leaves a hole in the id sequence and ends the session.
 */
@Component
public class SessionContinuityTracker {
  private static final Logger log = LoggerFactory.getLogger(SessionContinuityTracker.class);

  private final SnapshotRepository repository;
  private final Clock clock;
  private final Duration lookback;
  private final Counter lookupFailureCounter;

  public SessionContinuityTracker(
      SnapshotRepository repository,
      Clock clock,
      ConsolidatorProperties properties,
      MeterRegistry meterRegistry) {
    this.repository = repository;
    this.clock = clock;
    this.lookback = Duration.ofHours(properties.getSessions().getLookbackHours());
    this.lookupFailureCounter = meterRegistry.counter("consolidator.sessions.lookup.failures");
  }

  /**
   * Returns continuous duty minutes per callsign.
   *
   * <p>Callsigns are upper-cased and blanks ignored. A callsign without history within the
   * lookback maps to 0. When the store cannot be read every callsign maps to 0.
   *
   * @param callsigns currently active controller callsigns
   * @return minutes keyed by upper-case callsign, in request order
   */
  public Map<String, Integer> sessionMinutes(Collection<String> callsigns) {
    Set<String> targets = new LinkedHashSet<>();
    for (String callsign : callsigns) {
      if (callsign != null && !callsign.isBlank()) {
        targets.add(callsign.trim().toUpperCase(Locale.ROOT));
      }
    }
    Map<String, Integer> minutes = new LinkedHashMap<>();
    targets.forEach(callsign -> minutes.put(callsign, 0));
    if (targets.isEmpty()) {
      return minutes;
    }

    Instant now = clock.instant();
    List<ControllerPresence> history;
    try {
      history = repository.controllerHistory(Partition.SHORT, targets, now.minus(lookback));
    } catch (RuntimeException ex) {
      lookupFailureCounter.increment();
      log.warn("Controller history lookup failed; reporting zero session time for {}", targets, ex);
      return minutes;
    }

    Map<String, List<ControllerPresence>> byCallsign = new HashMap<>();
    for (ControllerPresence presence : history) {
      byCallsign.computeIfAbsent(presence.callsign().toUpperCase(Locale.ROOT), c -> new ArrayList<>())
          .add(presence);
    }
    for (String callsign : targets) {
      List<ControllerPresence> rows = byCallsign.getOrDefault(callsign, List.of());
      continuousSince(rows).ifPresent(start -> minutes.put(callsign, durationMinutes(start, now)));
    }
    return minutes;
  }

  /**
   * Walks newest-first presence rows back while sample ids stay consecutive.
   *
   * @param newestFirst rows of one callsign ordered by sample id descending
   * @return timestamp of the earliest sample of the unbroken run, empty without rows
   */
  static Optional<Instant> continuousSince(List<ControllerPresence> newestFirst) {
    if (newestFirst.isEmpty()) {
      return Optional.empty();
    }
    ControllerPresence start = newestFirst.get(0);
    for (int i = 1; i < newestFirst.size(); i++) {
      ControllerPresence older = newestFirst.get(i);
      if (start.sampleId() - older.sampleId() != 1) {
        break;
      }
      start = older;
    }
    return Optional.of(start.timestamp());
  }

  /** Whole minutes from {@code start} to {@code now}, plus one; never below 1. */
  static int durationMinutes(Instant start, Instant now) {
    long seconds = Math.max(0, Duration.between(start, now).getSeconds());
    return (int) (seconds / 60) + 1;
  }
}
