package com.skypulse.consolidator.store;

import com.skypulse.consolidator.model.Partition;
import java.util.ArrayList;
import java.util.List;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * DDL for the three partition table groups.
 *
 * <p>Each group holds a sample table and two child tables foreign-keyed to the sample id with
 * {@code ON DELETE CASCADE}. {@code AUTOINCREMENT} keeps ids strictly increasing even after
 * deletes.
 */
final class SnapshotSchema {

  private SnapshotSchema() {}

  static void create(JdbcTemplate jdbcTemplate) {
    for (Partition partition : Partition.values()) {
      for (String statement : statements(partition)) {
        jdbcTemplate.execute(statement);
      }
    }
  }

  static List<String> statements(Partition partition) {
    String samples = partition.samplesTable();
    String flights = partition.flightsTable();
    String sessions = partition.sessionsTable();
    List<String> ddl = new ArrayList<>();
    ddl.add("CREATE TABLE IF NOT EXISTS " + samples + " ("
        + "id INTEGER PRIMARY KEY AUTOINCREMENT, "
        + "ts INTEGER NOT NULL)");
    ddl.add("CREATE INDEX IF NOT EXISTS idx_" + samples + "_ts ON " + samples + "(ts)");

    ddl.add("CREATE TABLE IF NOT EXISTS " + flights + " ("
        + "id INTEGER PRIMARY KEY AUTOINCREMENT, "
        + "sample_id INTEGER NOT NULL REFERENCES " + samples + "(id) ON DELETE CASCADE, "
        + "subject_id TEXT, "
        + "callsign TEXT NOT NULL, "
        + "departure TEXT, "
        + "arrival TEXT, "
        + "route TEXT, "
        + "seats INTEGER NOT NULL DEFAULT 0, "
        + "aircraft_type TEXT)");
    ddl.add("CREATE INDEX IF NOT EXISTS idx_" + flights + "_sample ON " + flights + "(sample_id)");
    ddl.add("CREATE INDEX IF NOT EXISTS idx_" + flights + "_subject ON " + flights + "(subject_id)");
    ddl.add("CREATE INDEX IF NOT EXISTS idx_" + flights + "_callsign ON " + flights + "(callsign)");

    ddl.add("CREATE TABLE IF NOT EXISTS " + sessions + " ("
        + "id INTEGER PRIMARY KEY AUTOINCREMENT, "
        + "sample_id INTEGER NOT NULL REFERENCES " + samples + "(id) ON DELETE CASCADE, "
        + "subject_id TEXT, "
        + "callsign TEXT NOT NULL, "
        + "frequency REAL, "
        + "status TEXT)");
    ddl.add("CREATE INDEX IF NOT EXISTS idx_" + sessions + "_sample ON " + sessions + "(sample_id)");
    ddl.add("CREATE INDEX IF NOT EXISTS idx_" + sessions + "_subject ON " + sessions + "(subject_id)");
    ddl.add("CREATE INDEX IF NOT EXISTS idx_" + sessions + "_callsign ON " + sessions + "(callsign)");
    return ddl;
  }
}
