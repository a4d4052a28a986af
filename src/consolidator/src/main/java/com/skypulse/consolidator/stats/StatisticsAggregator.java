package com.skypulse.consolidator.stats;

import com.skypulse.consolidator.model.AirportActivity;
import com.skypulse.consolidator.model.LeaderboardEntry;
import com.skypulse.consolidator.model.Partition;
import com.skypulse.consolidator.model.Statistics;
import com.skypulse.consolidator.region.RegionPrefixes;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

/**
 * Windowed aggregates computed as SQL over one partition.
 *
 * <p>Nothing is replayed in memory: every figure is a grouping or distinct count evaluated by
 * SQLite. Region prefixes are passed per call so results always reflect the prefixes current
 * at query time.
 *
 * <p>Person-time is counted in (subject key, epoch minute) buckets. Flight-time accounting
 * skips samples taken during the 00:00 UTC minute; control time does not.
 */
@Component
public class StatisticsAggregator {
  public static final int DEFAULT_TOP_N = 3;

  private static final String FLIGHT_SUBJECT = "COALESCE(NULLIF(f.subject_id, ''), f.callsign)";
  private static final String SESSION_SUBJECT = "COALESCE(NULLIF(r.subject_id, ''), r.callsign)";
  private static final String NOT_MIDNIGHT_MINUTE = "(s.ts % 86400) >= 60";

  private final JdbcTemplate jdbcTemplate;

  public StatisticsAggregator(JdbcTemplate jdbcTemplate) {
    this.jdbcTemplate = jdbcTemplate;
  }

  /**
   * Computes the full window report: totals, person-minutes and leaderboards.
   *
   * @param partition partition backing the window
   * @param from inclusive window start
   * @param prefixes region prefixes in force
   * @param topN leaderboard length
   * @return window statistics without live-only fields
   */
  public Statistics windowStatistics(Partition partition, Instant from, RegionPrefixes prefixes, int topN) {
    FlightTotals flights = flightTotals(partition, from, prefixes);
    return new Statistics(
        flights.total(),
        flights.domestic(),
        flights.outgoing(),
        flights.incoming(),
        flights.uniquePilots(),
        flights.peopleOnBoard(),
        flightMinutes(partition, from, prefixes),
        controlMinutes(partition, from, prefixes),
        controllerCount(partition, from, prefixes),
        null,
        null,
        null,
        topAirports(partition, from, prefixes, topN),
        topPilots(partition, from, prefixes, topN),
        topControllers(partition, from, prefixes, topN));
  }

  /**
   * Counts distinct flights (subject key, departure, arrival, route) involving the region.
   *
   * <p>People on board takes the highest seat count seen for each flight, so a flight observed
   * with 3, 5 and 4 seats contributes 5.
   */
  public FlightTotals flightTotals(Partition partition, Instant from, RegionPrefixes prefixes) {
    List<Object> params = new ArrayList<>();
    params.add(from.getEpochSecond());
    String departureIn = PrefixPredicate.likeAny("dep", prefixes, params);
    String arrivalIn = PrefixPredicate.likeAny("arr", prefixes, params);

    String sql = "WITH flights AS ("
        + " SELECT " + FLIGHT_SUBJECT + " AS subject, f.departure AS dep, f.arrival AS arr,"
        + " COALESCE(f.route, '') AS route, MAX(f.seats) AS seats"
        + " FROM " + partition.flightsTable() + " f"
        + " JOIN " + partition.samplesTable() + " s ON s.id = f.sample_id"
        + " WHERE s.ts >= ?"
        + " GROUP BY subject, dep, arr, route),"
        + " tagged AS ("
        + " SELECT subject, seats,"
        + " CASE WHEN " + departureIn + " THEN 1 ELSE 0 END AS dep_in,"
        + " CASE WHEN " + arrivalIn + " THEN 1 ELSE 0 END AS arr_in"
        + " FROM flights)"
        + " SELECT COUNT(*) AS total,"
        + " COALESCE(SUM(CASE WHEN dep_in = 1 AND arr_in = 1 THEN 1 ELSE 0 END), 0) AS domestic,"
        + " COALESCE(SUM(CASE WHEN dep_in = 1 AND arr_in = 0 THEN 1 ELSE 0 END), 0) AS outgoing,"
        + " COALESCE(SUM(CASE WHEN dep_in = 0 AND arr_in = 1 THEN 1 ELSE 0 END), 0) AS incoming,"
        + " COUNT(DISTINCT subject) AS pilots,"
        + " COALESCE(SUM(seats), 0) AS pob"
        + " FROM tagged WHERE dep_in = 1 OR arr_in = 1";

    FlightTotals totals = jdbcTemplate.queryForObject(
        sql,
        (rs, rowNum) -> new FlightTotals(
            rs.getInt("total"),
            rs.getInt("domestic"),
            rs.getInt("outgoing"),
            rs.getInt("incoming"),
            rs.getInt("pilots"),
            rs.getLong("pob")),
        params.toArray());
    return totals == null ? FlightTotals.EMPTY : totals;
  }

  /** Distinct (pilot, minute) buckets of region flights, midnight minute excluded. */
  public long flightMinutes(Partition partition, Instant from, RegionPrefixes prefixes) {
    List<Object> params = new ArrayList<>();
    String buckets = pilotMinuteBuckets(partition, from, prefixes, params);
    Long minutes = jdbcTemplate.queryForObject(
        "SELECT COUNT(*) FROM (" + buckets + ")", Long.class, params.toArray());
    return minutes == null ? 0 : minutes;
  }

  /** Distinct (controller, minute) buckets of in-scope sessions. */
  public long controlMinutes(Partition partition, Instant from, RegionPrefixes prefixes) {
    List<Object> params = new ArrayList<>();
    String buckets = controllerMinuteBuckets(partition, from, prefixes, params);
    Long minutes = jdbcTemplate.queryForObject(
        "SELECT COUNT(*) FROM (" + buckets + ")", Long.class, params.toArray());
    return minutes == null ? 0 : minutes;
  }

  /** Distinct in-scope controller subject keys in the window. */
  public int controllerCount(Partition partition, Instant from, RegionPrefixes prefixes) {
    List<Object> params = new ArrayList<>();
    params.add(from.getEpochSecond());
    String inScope = PrefixPredicate.likeAny("r.callsign", prefixes, params);
    Integer count = jdbcTemplate.queryForObject(
        "SELECT COUNT(DISTINCT " + SESSION_SUBJECT + ")"
            + " FROM " + partition.sessionsTable() + " r"
            + " JOIN " + partition.samplesTable() + " s ON s.id = r.sample_id"
            + " WHERE s.ts >= ? AND " + inScope,
        Integer.class,
        params.toArray());
    return count == null ? 0 : count;
  }

  public List<LeaderboardEntry> topPilots(Partition partition, Instant from, RegionPrefixes prefixes, int limit) {
    List<Object> params = new ArrayList<>();
    String buckets = pilotMinuteBuckets(partition, from, prefixes, params);
    return leaderboard(buckets, params, limit);
  }

  public List<LeaderboardEntry> topControllers(
      Partition partition, Instant from, RegionPrefixes prefixes, int limit) {
    List<Object> params = new ArrayList<>();
    String buckets = controllerMinuteBuckets(partition, from, prefixes, params);
    return leaderboard(buckets, params, limit);
  }

  /**
   * Ranks in-region airports by distinct flights departing plus arriving, ties by code.
   */
  public List<AirportActivity> topAirports(Partition partition, Instant from, RegionPrefixes prefixes, int limit) {
    List<Object> params = new ArrayList<>();
    params.add(from.getEpochSecond());
    String departureIn = PrefixPredicate.likeAny("dep", prefixes, params);
    String arrivalIn = PrefixPredicate.likeAny("arr", prefixes, params);
    params.add(limit);

    String sql = "WITH flights AS ("
        + " SELECT DISTINCT " + FLIGHT_SUBJECT + " AS subject, f.departure AS dep, f.arrival AS arr,"
        + " COALESCE(f.route, '') AS route"
        + " FROM " + partition.flightsTable() + " f"
        + " JOIN " + partition.samplesTable() + " s ON s.id = f.sample_id"
        + " WHERE s.ts >= ?),"
        + " moves AS ("
        + " SELECT dep AS airport, 1 AS d, 0 AS a FROM flights WHERE " + departureIn
        + " UNION ALL"
        + " SELECT arr AS airport, 0 AS d, 1 AS a FROM flights WHERE " + arrivalIn + ")"
        + " SELECT airport, SUM(d) AS departures, SUM(a) AS arrivals FROM moves"
        + " GROUP BY airport"
        + " ORDER BY SUM(d) + SUM(a) DESC, airport ASC"
        + " LIMIT ?";

    return jdbcTemplate.query(
        sql,
        (rs, rowNum) -> new AirportActivity(
            rs.getString("airport"), rs.getLong("departures"), rs.getLong("arrivals")),
        params.toArray());
  }

  private List<LeaderboardEntry> leaderboard(String buckets, List<Object> params, int limit) {
    params.add(limit);
    return jdbcTemplate.query(
        "SELECT subject, COUNT(*) AS minutes FROM (" + buckets + ")"
            + " GROUP BY subject"
            + " ORDER BY minutes DESC, subject ASC"
            + " LIMIT ?",
        (rs, rowNum) -> new LeaderboardEntry(rs.getString("subject"), rs.getLong("minutes")),
        params.toArray());
  }

  private static String pilotMinuteBuckets(
      Partition partition, Instant from, RegionPrefixes prefixes, List<Object> params) {
    params.add(from.getEpochSecond());
    String departureIn = PrefixPredicate.likeAny("f.departure", prefixes, params);
    String arrivalIn = PrefixPredicate.likeAny("f.arrival", prefixes, params);
    return "SELECT DISTINCT " + FLIGHT_SUBJECT + " AS subject, s.ts / 60 AS minute"
        + " FROM " + partition.flightsTable() + " f"
        + " JOIN " + partition.samplesTable() + " s ON s.id = f.sample_id"
        + " WHERE s.ts >= ? AND " + NOT_MIDNIGHT_MINUTE
        + " AND (" + departureIn + " OR " + arrivalIn + ")";
  }

  private static String controllerMinuteBuckets(
      Partition partition, Instant from, RegionPrefixes prefixes, List<Object> params) {
    params.add(from.getEpochSecond());
    String inScope = PrefixPredicate.likeAny("r.callsign", prefixes, params);
    return "SELECT DISTINCT " + SESSION_SUBJECT + " AS subject, s.ts / 60 AS minute"
        + " FROM " + partition.sessionsTable() + " r"
        + " JOIN " + partition.samplesTable() + " s ON s.id = r.sample_id"
        + " WHERE s.ts >= ? AND " + inScope;
  }
}
