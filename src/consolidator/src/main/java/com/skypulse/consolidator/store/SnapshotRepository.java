package com.skypulse.consolidator.store;

import com.skypulse.consolidator.model.Partition;
import com.skypulse.consolidator.model.Sample;
import com.skypulse.consolidator.model.StoredSample;
import java.time.Instant;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Partitioned, append-only snapshot persistence.
 *
 * <p>Every sample is replicated into the {@link Partition#SHORT}, {@link Partition#MEDIUM} and
 * {@link Partition#LONG} table groups. Each partition is pruned or reset on its own schedule and
 * hands out its own strictly increasing sample ids.
 */
public interface SnapshotRepository {

  /**
   * Writes a sample, with its flights and sessions, into one partition.
   *
   * <p>The sample row and its child rows commit or roll back together. Failures are logged and
   * reported through the return value, never thrown.
   *
   * @param partition target partition
   * @param sample sample to write
   * @return {@code true} when the partition write committed
   */
  boolean store(Partition partition, Sample sample);

  /**
   * Writes a sample into every partition. A failing partition does not stop the others.
   *
   * @param sample sample to write
   * @return write outcome per partition, in partition order
   */
  default Map<Partition, Boolean> store(Sample sample) {
    Map<Partition, Boolean> outcome = new EnumMap<>(Partition.class);
    for (Partition partition : Partition.values()) {
      outcome.put(partition, store(partition, sample));
    }
    return outcome;
  }

  /**
   * Returns the most recently stored sample of a partition.
   *
   * @param partition partition to read
   * @return newest sample by id, empty when the partition holds none
   */
  Optional<StoredSample> latest(Partition partition);

  /**
   * Returns the samples whose timestamp lies within the inclusive bounds, ordered by id.
   *
   * @param partition partition to read
   * @param from inclusive lower bound, {@code null} for unbounded
   * @param to inclusive upper bound, {@code null} for unbounded
   * @return samples in insertion order
   */
  List<StoredSample> range(Partition partition, Instant from, Instant to);

  /**
   * Deletes samples strictly older than a timestamp, children included.
   *
   * @param partition partition to prune
   * @param olderThan exclusive cutoff
   * @return number of deleted samples
   */
  int prune(Partition partition, Instant olderThan);

  /**
   * Deletes every sample of a partition, children included.
   *
   * @param partition partition to empty
   */
  void reset(Partition partition);

  long countSamples(Partition partition, Instant from);

  /**
   * Returns the appearances of the given callsigns since a timestamp, grouped by callsign and
   * ordered newest sample first.
   *
   * @param partition partition to read
   * @param callsigns upper-case callsigns to look up
   * @param since inclusive lower bound
   * @return presence rows
   */
  List<ControllerPresence> controllerHistory(
      Partition partition, Collection<String> callsigns, Instant since);

  List<SampleCount> sampleCounts(Partition partition, Instant from, Instant to);

  /**
   * Returns distinct pilot and controller counts per UTC day since a timestamp. Days without
   * samples are absent.
   *
   * @param partition partition to read
   * @param from inclusive lower bound
   * @return counts ordered by day
   */
  List<DailyCount> dailyParticipantCounts(Partition partition, Instant from);
}
