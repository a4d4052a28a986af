package com.skypulse.consolidator.store;

import com.skypulse.consolidator.config.StoreConfig;
import io.micrometer.core.instrument.MeterRegistry;
import java.nio.file.Path;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * File-backed SQLite store wired like the application context does it.
 */
public final class SnapshotStoreFixture {
  public final JdbcTemplate jdbcTemplate;
  public final SqliteSnapshotRepository repository;
  public final PlatformTransactionManager transactionManager;

  private SnapshotStoreFixture(
      JdbcTemplate jdbcTemplate,
      SqliteSnapshotRepository repository,
      PlatformTransactionManager transactionManager) {
    this.jdbcTemplate = jdbcTemplate;
    this.repository = repository;
    this.transactionManager = transactionManager;
  }

  public static SnapshotStoreFixture create(Path dir, MeterRegistry meterRegistry) {
    var dataSource = StoreConfig.sqliteDataSource(dir.resolve("snapshots.db"), 5000);
    JdbcTemplate jdbcTemplate = new JdbcTemplate(dataSource);
    PlatformTransactionManager transactionManager = new DataSourceTransactionManager(dataSource);
    TransactionTemplate transactionTemplate = new TransactionTemplate(transactionManager);
    return new SnapshotStoreFixture(
        jdbcTemplate,
        new SqliteSnapshotRepository(jdbcTemplate, transactionTemplate, meterRegistry),
        transactionManager);
  }
}
