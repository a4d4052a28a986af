package com.skypulse.consolidator.store;

import com.skypulse.consolidator.model.FlightRecord;
import com.skypulse.consolidator.model.Partition;
import com.skypulse.consolidator.model.Sample;
import com.skypulse.consolidator.model.SessionRecord;
import com.skypulse.consolidator.model.StoredSample;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * SQLite implementation of {@link SnapshotRepository}.
 *
 * <p>The repository uses:
 * <ul>
 *   <li>one transaction per partition write, so a sample row never exists without its children</li>
 *   <li>epoch seconds in {@code ts} columns, which keeps window predicates index-friendly</li>
 *   <li>foreign-key cascades for prune and reset</li>
 * </ul>
 *
 * <p>The schema is created idempotently when the repository is constructed.
 */
@Repository
public class SqliteSnapshotRepository implements SnapshotRepository {
  private static final Logger log = LoggerFactory.getLogger(SqliteSnapshotRepository.class);

  private final JdbcTemplate jdbcTemplate;
  private final TransactionTemplate transactionTemplate;
  private final Map<Partition, Counter> writeCounters = new EnumMap<>(Partition.class);
  private final Map<Partition, Counter> writeFailureCounters = new EnumMap<>(Partition.class);

  public SqliteSnapshotRepository(
      JdbcTemplate jdbcTemplate, TransactionTemplate transactionTemplate, MeterRegistry meterRegistry) {
    this.jdbcTemplate = jdbcTemplate;
    this.transactionTemplate = transactionTemplate;
    for (Partition partition : Partition.values()) {
      writeCounters.put(partition, Counter.builder("consolidator.store.partition.writes")
          .description("Committed sample writes per partition")
          .tag("partition", partition.label())
          .register(meterRegistry));
      writeFailureCounters.put(partition, Counter.builder("consolidator.store.partition.write.failures")
          .description("Rolled back sample writes per partition")
          .tag("partition", partition.label())
          .register(meterRegistry));
    }
    SnapshotSchema.create(jdbcTemplate);
  }

  @Override
  public boolean store(Partition partition, Sample sample) {
    try {
      long sampleId = transactionTemplate.execute(status -> insert(partition, sample));
      writeCounters.get(partition).increment();
      log.debug("Stored sample {} into {} ({} flights, {} sessions)",
          sampleId, partition.label(), sample.flights().size(), sample.sessions().size());
      return true;
    } catch (RuntimeException ex) {
      // The transaction is already rolled back; the other partitions are still attempted.
      writeFailureCounters.get(partition).increment();
      log.error("Failed to store sample {} into partition {}", sample.timestamp(), partition.label(), ex);
      return false;
    }
  }

  private long insert(Partition partition, Sample sample) {
    jdbcTemplate.update(
        "INSERT INTO " + partition.samplesTable() + " (ts) VALUES (?)",
        sample.timestamp().getEpochSecond());
    // Same connection as the insert: the transaction binds it to this thread.
    Long sampleId = jdbcTemplate.queryForObject("SELECT last_insert_rowid()", Long.class);
    if (sampleId == null) {
      throw new IllegalStateException("No id generated for " + partition.samplesTable());
    }

    if (!sample.flights().isEmpty()) {
      List<Object[]> rows = new ArrayList<>(sample.flights().size());
      for (FlightRecord flight : sample.flights()) {
        rows.add(new Object[] {
            sampleId,
            flight.subjectId(),
            flight.callsign(),
            flight.departure(),
            flight.arrival(),
            flight.route(),
            flight.seats(),
            flight.aircraftType()
        });
      }
      jdbcTemplate.batchUpdate(
          "INSERT INTO " + partition.flightsTable()
              + " (sample_id, subject_id, callsign, departure, arrival, route, seats, aircraft_type)"
              + " VALUES (?, ?, ?, ?, ?, ?, ?, ?)",
          rows);
    }

    if (!sample.sessions().isEmpty()) {
      List<Object[]> rows = new ArrayList<>(sample.sessions().size());
      for (SessionRecord session : sample.sessions()) {
        rows.add(new Object[] {
            sampleId, session.subjectId(), session.callsign(), session.frequency(), session.status()
        });
      }
      jdbcTemplate.batchUpdate(
          "INSERT INTO " + partition.sessionsTable()
              + " (sample_id, subject_id, callsign, frequency, status) VALUES (?, ?, ?, ?, ?)",
          rows);
    }
    return sampleId;
  }

  @Override
  public Optional<StoredSample> latest(Partition partition) {
    List<SampleRow> rows = jdbcTemplate.query(
        "SELECT id, ts FROM " + partition.samplesTable() + " ORDER BY id DESC LIMIT 1",
        (rs, rowNum) -> new SampleRow(rs.getLong("id"), Instant.ofEpochSecond(rs.getLong("ts"))));
    if (rows.isEmpty()) {
      return Optional.empty();
    }
    SampleRow row = rows.get(0);
    List<FlightRecord> flights = jdbcTemplate.query(
        "SELECT * FROM " + partition.flightsTable() + " WHERE sample_id = ? ORDER BY id",
        (rs, rowNum) -> mapFlight(rs),
        row.id());
    List<SessionRecord> sessions = jdbcTemplate.query(
        "SELECT * FROM " + partition.sessionsTable() + " WHERE sample_id = ? ORDER BY id",
        (rs, rowNum) -> mapSession(rs),
        row.id());
    return Optional.of(new StoredSample(row.id(), partition, new Sample(row.timestamp(), flights, sessions)));
  }

  @Override
  public List<StoredSample> range(Partition partition, Instant from, Instant to) {
    List<Object> params = new ArrayList<>();
    String where = timeBounds("ts", from, to, params);
    Object[] args = params.toArray();

    List<SampleRow> rows = jdbcTemplate.query(
        "SELECT id, ts FROM " + partition.samplesTable() + where + " ORDER BY id",
        (rs, rowNum) -> new SampleRow(rs.getLong("id"), Instant.ofEpochSecond(rs.getLong("ts"))),
        args);
    if (rows.isEmpty()) {
      return List.of();
    }

    String sampleIds = "SELECT id FROM " + partition.samplesTable() + where;
    Map<Long, List<FlightRecord>> flights = new HashMap<>();
    jdbcTemplate.query(
        "SELECT * FROM " + partition.flightsTable() + " WHERE sample_id IN (" + sampleIds + ")"
            + " ORDER BY sample_id, id",
        rs -> {
          flights.computeIfAbsent(rs.getLong("sample_id"), id -> new ArrayList<>()).add(mapFlight(rs));
        },
        args);
    Map<Long, List<SessionRecord>> sessions = new HashMap<>();
    jdbcTemplate.query(
        "SELECT * FROM " + partition.sessionsTable() + " WHERE sample_id IN (" + sampleIds + ")"
            + " ORDER BY sample_id, id",
        rs -> {
          sessions.computeIfAbsent(rs.getLong("sample_id"), id -> new ArrayList<>()).add(mapSession(rs));
        },
        args);

    List<StoredSample> samples = new ArrayList<>(rows.size());
    for (SampleRow row : rows) {
      Sample sample = new Sample(
          row.timestamp(),
          flights.getOrDefault(row.id(), List.of()),
          sessions.getOrDefault(row.id(), List.of()));
      samples.add(new StoredSample(row.id(), partition, sample));
    }
    return samples;
  }

  @Override
  public int prune(Partition partition, Instant olderThan) {
    int deleted = jdbcTemplate.update(
        "DELETE FROM " + partition.samplesTable() + " WHERE ts < ?", olderThan.getEpochSecond());
    log.info("Pruned {} samples older than {} from partition {}", deleted, olderThan, partition.label());
    return deleted;
  }

  @Override
  public void reset(Partition partition) {
    int deleted = jdbcTemplate.update("DELETE FROM " + partition.samplesTable());
    log.info("Reset partition {}: {} samples removed", partition.label(), deleted);
  }

  @Override
  public long countSamples(Partition partition, Instant from) {
    List<Object> params = new ArrayList<>();
    String where = timeBounds("ts", from, null, params);
    Long count = jdbcTemplate.queryForObject(
        "SELECT COUNT(*) FROM " + partition.samplesTable() + where, Long.class, params.toArray());
    return count == null ? 0 : count;
  }

  @Override
  public List<ControllerPresence> controllerHistory(
      Partition partition, Collection<String> callsigns, Instant since) {
    Set<String> targets = new LinkedHashSet<>();
    for (String callsign : callsigns) {
      if (callsign != null && !callsign.isBlank()) {
        targets.add(callsign.trim().toUpperCase(Locale.ROOT));
      }
    }
    if (targets.isEmpty()) {
      return List.of();
    }

    String placeholders = String.join(",", Collections.nCopies(targets.size(), "?"));
    List<Object> params = new ArrayList<>(targets);
    params.add(since.getEpochSecond());
    return jdbcTemplate.query(
        "SELECT DISTINCT r.callsign, s.id, s.ts FROM " + partition.sessionsTable() + " r"
            + " JOIN " + partition.samplesTable() + " s ON s.id = r.sample_id"
            + " WHERE r.callsign IN (" + placeholders + ") AND s.ts >= ?"
            + " ORDER BY r.callsign, s.id DESC",
        (rs, rowNum) -> new ControllerPresence(
            rs.getString("callsign"), rs.getLong("id"), Instant.ofEpochSecond(rs.getLong("ts"))),
        params.toArray());
  }

  @Override
  public List<SampleCount> sampleCounts(Partition partition, Instant from, Instant to) {
    List<Object> params = new ArrayList<>();
    String where = timeBounds("s.ts", from, to, params);
    return jdbcTemplate.query(
        "SELECT s.id, s.ts,"
            + " (SELECT COUNT(*) FROM " + partition.flightsTable() + " f WHERE f.sample_id = s.id) AS flights,"
            + " (SELECT COUNT(*) FROM " + partition.sessionsTable() + " r WHERE r.sample_id = s.id) AS sessions"
            + " FROM " + partition.samplesTable() + " s" + where
            + " ORDER BY s.id",
        (rs, rowNum) -> new SampleCount(
            rs.getLong("id"),
            Instant.ofEpochSecond(rs.getLong("ts")),
            rs.getInt("flights"),
            rs.getInt("sessions")),
        params.toArray());
  }

  @Override
  public List<DailyCount> dailyParticipantCounts(Partition partition, Instant from) {
    List<Object> params = new ArrayList<>();
    String where = timeBounds("s.ts", from, null, params);
    Object[] args = params.toArray();

    Map<LocalDate, int[]> byDay = new TreeMap<>();
    jdbcTemplate.query(
        "SELECT date(s.ts, 'unixepoch') AS day,"
            + " COUNT(DISTINCT COALESCE(NULLIF(f.subject_id, ''), f.callsign)) AS n"
            + " FROM " + partition.flightsTable() + " f"
            + " JOIN " + partition.samplesTable() + " s ON s.id = f.sample_id" + where
            + " GROUP BY day",
        rs -> {
          byDay.computeIfAbsent(LocalDate.parse(rs.getString("day")), d -> new int[2])[0] = rs.getInt("n");
        },
        args);
    jdbcTemplate.query(
        "SELECT date(s.ts, 'unixepoch') AS day,"
            + " COUNT(DISTINCT COALESCE(NULLIF(r.subject_id, ''), r.callsign)) AS n"
            + " FROM " + partition.sessionsTable() + " r"
            + " JOIN " + partition.samplesTable() + " s ON s.id = r.sample_id" + where
            + " GROUP BY day",
        rs -> {
          byDay.computeIfAbsent(LocalDate.parse(rs.getString("day")), d -> new int[2])[1] = rs.getInt("n");
        },
        args);

    List<DailyCount> counts = new ArrayList<>(byDay.size());
    byDay.forEach((day, values) -> counts.add(new DailyCount(day, values[0], values[1])));
    return counts;
  }

  private static String timeBounds(String column, Instant from, Instant to, List<Object> params) {
    List<String> clauses = new ArrayList<>(2);
    if (from != null) {
      clauses.add(column + " >= ?");
      params.add(from.getEpochSecond());
    }
    if (to != null) {
      clauses.add(column + " <= ?");
      params.add(to.getEpochSecond());
    }
    return clauses.isEmpty() ? "" : " WHERE " + String.join(" AND ", clauses);
  }

  private static FlightRecord mapFlight(ResultSet rs) throws SQLException {
    return new FlightRecord(
        rs.getString("subject_id"),
        rs.getString("callsign"),
        rs.getString("departure"),
        rs.getString("arrival"),
        rs.getString("route"),
        rs.getInt("seats"),
        rs.getString("aircraft_type"));
  }

  private static SessionRecord mapSession(ResultSet rs) throws SQLException {
    double frequency = rs.getDouble("frequency");
    Double boxed = rs.wasNull() ? null : frequency;
    return new SessionRecord(rs.getString("subject_id"), rs.getString("callsign"), boxed, rs.getString("status"));
  }

  private record SampleRow(long id, Instant timestamp) {}
}
