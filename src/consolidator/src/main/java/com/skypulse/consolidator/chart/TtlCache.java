package com.skypulse.consolidator.chart;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BiConsumer;
import java.util.function.Predicate;

/**
 * Small concurrent cache whose entries are served for one TTL and evicted after two.
 *
 * <p>Entries older than the TTL are no longer returned but stay in the map until a sweep removes
 * them once they are older than twice the TTL. Sweeps run at most once per sweep interval and
 * are triggered from {@link #get(Object)} and {@link #put(Object, Object)}, or explicitly via
 * {@link #sweep()}. The eviction listener runs for every swept entry.
 *
 * @param <K> key type
 * @param <V> value type
 */
public class TtlCache<K, V> {
  private final Map<K, Entry<V>> entries = new ConcurrentHashMap<>();
  private final Clock clock;
  private final Duration ttl;
  private final Duration sweepInterval;
  private final Predicate<V> validity;
  private final BiConsumer<K, V> onEvict;
  private final AtomicReference<Instant> lastSweep;

  public TtlCache(Clock clock, Duration ttl, Duration sweepInterval) {
    this(clock, ttl, sweepInterval, value -> true, (key, value) -> {});
  }

  /**
   * Creates a cache.
   *
   * @param clock time source
   * @param ttl how long an entry is served
   * @param sweepInterval minimum delay between two opportunistic sweeps
   * @param validity extra check a fresh entry must pass to be served (e.g. its file still exists)
   * @param onEvict called with every entry removed by a sweep
   */
  public TtlCache(
      Clock clock,
      Duration ttl,
      Duration sweepInterval,
      Predicate<V> validity,
      BiConsumer<K, V> onEvict) {
    this.clock = Objects.requireNonNull(clock, "clock");
    this.ttl = Objects.requireNonNull(ttl, "ttl");
    this.sweepInterval = Objects.requireNonNull(sweepInterval, "sweepInterval");
    this.validity = Objects.requireNonNull(validity, "validity");
    this.onEvict = Objects.requireNonNull(onEvict, "onEvict");
    this.lastSweep = new AtomicReference<>(clock.instant());
  }

  /**
   * Returns the value cached under {@code key} when it is younger than the TTL and still valid.
   */
  public Optional<V> get(K key) {
    Instant now = clock.instant();
    maybeSweep(now);
    Entry<V> entry = entries.get(key);
    if (entry == null || !isFresh(entry, now) || !validity.test(entry.value())) {
      return Optional.empty();
    }
    return Optional.of(entry.value());
  }

  public void put(K key, V value) {
    Instant now = clock.instant();
    entries.put(key, new Entry<>(Objects.requireNonNull(value, "value"), now));
    maybeSweep(now);
  }

  /**
   * Removes entries older than twice the TTL.
   *
   * @return number of evicted entries
   */
  public int sweep() {
    Instant now = clock.instant();
    lastSweep.set(now);
    Instant cutoff = now.minus(ttl.multipliedBy(2));
    int evicted = 0;
    for (Map.Entry<K, Entry<V>> mapping : entries.entrySet()) {
      Entry<V> entry = mapping.getValue();
      // remove(key, value) leaves an entry alone if a newer put replaced it meanwhile
      if (entry.createdAt().isBefore(cutoff) && entries.remove(mapping.getKey(), entry)) {
        onEvict.accept(mapping.getKey(), entry.value());
        evicted++;
      }
    }
    return evicted;
  }

  public int size() {
    return entries.size();
  }

  public Duration ttl() {
    return ttl;
  }

  private boolean isFresh(Entry<V> entry, Instant now) {
    return Duration.between(entry.createdAt(), now).compareTo(ttl) < 0;
  }

  private void maybeSweep(Instant now) {
    Instant previous = lastSweep.get();
    if (Duration.between(previous, now).compareTo(sweepInterval) >= 0
        && lastSweep.compareAndSet(previous, now)) {
      sweep();
    }
  }

  private record Entry<V>(V value, Instant createdAt) {}
}
