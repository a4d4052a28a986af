package com.skypulse.consolidator.stats;

import static org.assertj.core.api.Assertions.assertThat;

import com.skypulse.consolidator.model.AirportActivity;
import com.skypulse.consolidator.model.FlightRecord;
import com.skypulse.consolidator.model.LeaderboardEntry;
import com.skypulse.consolidator.model.Partition;
import com.skypulse.consolidator.model.Sample;
import com.skypulse.consolidator.model.SessionRecord;
import com.skypulse.consolidator.model.Statistics;
import com.skypulse.consolidator.region.RegionPrefixes;
import com.skypulse.consolidator.store.SnapshotRepository;
import com.skypulse.consolidator.store.SnapshotStoreFixture;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class StatisticsAggregatorTest {
  private static final Instant DAY = Instant.parse("2026-03-10T00:00:00Z");
  private static final Instant T0 = Instant.parse("2026-03-10T10:00:00Z");
  private static final RegionPrefixes LF = RegionPrefixes.of("LF");

  @TempDir
  Path tempDir;

  private SnapshotRepository repository;
  private StatisticsAggregator aggregator;

  @BeforeEach
  void setUp() {
    SnapshotStoreFixture store = SnapshotStoreFixture.create(tempDir, new SimpleMeterRegistry());
    repository = store.repository;
    aggregator = new StatisticsAggregator(store.jdbcTemplate);
  }

  @Test
  void samplesWithinTheSameMinuteCountOnce() {
    FlightRecord flight = flight("1", "AFR1", "LFPG", "LFMN", 100);
    storeFlights(T0.plusSeconds(5), flight);
    storeFlights(T0.plusSeconds(35), flight);
    storeFlights(T0.plusSeconds(50), flight);
    storeFlights(T0.plusSeconds(70), flight);
    storeFlights(T0.plusSeconds(130), flight);

    assertThat(aggregator.flightMinutes(Partition.SHORT, DAY, LF)).isEqualTo(3);
  }

  @Test
  void peopleOnBoardTakesHighestSeatCountPerFlight() {
    storeFlights(T0, flight("1", "AFR1", "LFPG", "LFMN", 3));
    storeFlights(T0.plusSeconds(60), flight("1", "AFR1", "LFPG", "LFMN", 5));
    storeFlights(T0.plusSeconds(120), flight("1", "AFR1", "LFPG", "LFMN", 4));

    FlightTotals totals = aggregator.flightTotals(Partition.SHORT, DAY, LF);

    assertThat(totals.total()).isEqualTo(1);
    assertThat(totals.peopleOnBoard()).isEqualTo(5);
  }

  @Test
  void flightsAreCategorizedAndUnrelatedOnesIgnored() {
    storeFlights(
        T0,
        flight("1", "AFR1", "LFPG", "LFMN", 100),
        flight("2", "DAL2", "LFPG", "KJFK", 200),
        flight("3", "BAW3", "EGLL", "LFPG", 150),
        flight("4", "DLH4", "EGLL", "EDDF", 120));
    // Same flight tuple seen again is not a new flight.
    storeFlights(T0.plusSeconds(60), flight("1", "AFR1", "LFPG", "LFMN", 100));

    FlightTotals totals = aggregator.flightTotals(Partition.SHORT, DAY, LF);

    assertThat(totals).isEqualTo(new FlightTotals(3, 1, 1, 1, 3, 450));
  }

  @Test
  void subjectFallsBackToCallsignWhenIdIsMissing() {
    storeFlights(T0, flight(null, "AFR1", "LFPG", "LFMN", 1), flight(null, "AFR2", "LFPG", "LFMN", 1));

    assertThat(aggregator.flightTotals(Partition.SHORT, DAY, LF).uniquePilots()).isEqualTo(2);
    assertThat(aggregator.flightMinutes(Partition.SHORT, DAY, LF)).isEqualTo(2);
  }

  @Test
  void midnightMinuteIsSkippedForFlightTimeOnly() {
    Sample midnight = new Sample(
        DAY.plusSeconds(30),
        List.of(flight("1", "AFR1", "LFPG", "LFMN", 1)),
        List.of(session("9", "LFPG_TWR")));
    Sample later = new Sample(
        DAY.plusSeconds(90),
        List.of(flight("1", "AFR1", "LFPG", "LFMN", 1)),
        List.of(session("9", "LFPG_TWR")));
    repository.store(midnight);
    repository.store(later);

    assertThat(aggregator.flightMinutes(Partition.SHORT, DAY, LF)).isEqualTo(1);
    assertThat(aggregator.controlMinutes(Partition.SHORT, DAY, LF)).isEqualTo(2);
  }

  @Test
  void controllersOutOfScopeAreIgnored() {
    repository.store(new Sample(
        T0, List.of(), List.of(session("9", "LFPG_TWR"), session("8", "EGLL_TWR"))));
    repository.store(new Sample(
        T0.plusSeconds(60), List.of(), List.of(session("9", "LFPG_TWR"))));

    assertThat(aggregator.controlMinutes(Partition.SHORT, DAY, LF)).isEqualTo(2);
    assertThat(aggregator.controllerCount(Partition.SHORT, DAY, LF)).isEqualTo(1);
  }

  @Test
  void personMinutesNeverExceedMinutesTimesSubjects() {
    for (int i = 0; i < 4; i++) {
      storeFlights(
          T0.plusSeconds(60L * i),
          flight("1", "AFR1", "LFPG", "LFMN", 1),
          flight("2", "AFR2", "LFPG", "LFML", 1));
      storeFlights(T0.plusSeconds(60L * i + 30), flight("1", "AFR1", "LFPG", "LFMN", 1));
    }

    long minutes = aggregator.flightMinutes(Partition.SHORT, DAY, LF);

    assertThat(minutes).isEqualTo(8).isLessThanOrEqualTo(4 * 2);
  }

  @Test
  void leaderboardsOrderByMinutesThenSubject() {
    for (int i = 0; i < 3; i++) {
      storeFlights(T0.plusSeconds(60L * i), flight("300", "C", "LFPG", "LFMN", 1));
    }
    for (int i = 0; i < 2; i++) {
      storeFlights(
          T0.plusSeconds(600 + 60L * i),
          flight("200", "B", "LFPG", "LFMN", 1),
          flight("100", "A", "LFPG", "LFMN", 1));
    }
    storeFlights(T0.plusSeconds(1200), flight("400", "D", "LFPG", "LFMN", 1));

    List<LeaderboardEntry> top = aggregator.topPilots(Partition.SHORT, DAY, LF, 3);

    assertThat(top).containsExactly(
        new LeaderboardEntry("300", 3),
        new LeaderboardEntry("100", 2),
        new LeaderboardEntry("200", 2));
  }

  @Test
  void topAirportsCountDistinctMovementsInRegion() {
    storeFlights(
        T0,
        flight("1", "A1", "LFPG", "LFMN", 1),
        flight("2", "A2", "LFPG", "KJFK", 1),
        flight("3", "A3", "EGLL", "LFMN", 1),
        flight("4", "A4", "LFBO", "LFPG", 1));
    storeFlights(T0.plusSeconds(60), flight("1", "A1", "LFPG", "LFMN", 1));

    List<AirportActivity> airports = aggregator.topAirports(Partition.SHORT, DAY, LF, 3);

    assertThat(airports).containsExactly(
        new AirportActivity("LFPG", 2, 1),
        new AirportActivity("LFMN", 0, 2),
        new AirportActivity("LFBO", 1, 0));
  }

  @Test
  void prefixesArePassedPerCall() {
    storeFlights(T0, flight("1", "A1", "LFPG", "EGLL", 1));

    assertThat(aggregator.flightTotals(Partition.SHORT, DAY, LF).outgoing()).isEqualTo(1);
    assertThat(aggregator.flightTotals(Partition.SHORT, DAY, RegionPrefixes.of("EG")).incoming()).isEqualTo(1);
    assertThat(aggregator.flightTotals(Partition.SHORT, DAY, RegionPrefixes.of("L_")).total()).isZero();
  }

  @Test
  void windowStatisticsOnlyCoverSamplesSinceStart() {
    storeFlights(T0.minusSeconds(7200), flight("1", "A1", "LFPG", "LFMN", 1));
    storeFlights(T0, flight("2", "A2", "LFPG", "LFML", 4));
    repository.store(new Sample(T0.plusSeconds(60), List.of(), List.of(session("9", "LFMN_APP"))));

    Statistics statistics = aggregator.windowStatistics(Partition.SHORT, T0, LF, 3);

    assertThat(statistics.totalFlights()).isEqualTo(1);
    assertThat(statistics.peopleOnBoard()).isEqualTo(4);
    assertThat(statistics.flightMinutes()).isEqualTo(1);
    assertThat(statistics.controlMinutes()).isEqualTo(1);
    assertThat(statistics.controllerCount()).isEqualTo(1);
    assertThat(statistics.topPilots()).containsExactly(new LeaderboardEntry("2", 1));
    assertThat(statistics.topControllers()).containsExactly(new LeaderboardEntry("9", 1));
    assertThat(statistics.activeFlights()).isNull();
  }

  private void storeFlights(Instant timestamp, FlightRecord... flights) {
    repository.store(new Sample(timestamp, List.of(flights), List.of()));
  }

  private static FlightRecord flight(String subjectId, String callsign, String departure, String arrival, int seats) {
    return new FlightRecord(subjectId, callsign, departure, arrival, "DCT", seats, "A320");
  }

  private static SessionRecord session(String subjectId, String callsign) {
    return new SessionRecord(subjectId, callsign, 118.1, null);
  }
}
