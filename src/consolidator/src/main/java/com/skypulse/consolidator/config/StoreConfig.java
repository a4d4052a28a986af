package com.skypulse.consolidator.config;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;
import org.sqlite.SQLiteConfig;
import org.sqlite.SQLiteDataSource;

/**
 * Spring configuration for the SQLite snapshot store.
 *
 * <p>Every connection enforces foreign keys (child rows cascade with their sample) and runs in
 * WAL mode so report queries can read while the collector writes.
 */
@Configuration
public class StoreConfig {
  private static final Logger log = LoggerFactory.getLogger(StoreConfig.class);

  /**
   * Creates the store data source from {@code consolidator.store.*}.
   *
   * @param properties consolidator configuration properties
   * @return SQLite data source bound to the configured file
   */
  @Bean
  public DataSource dataSource(ConsolidatorProperties properties) {
    String path = properties.getStore().getPath();
    if (path == null || path.isBlank()) {
      throw new IllegalStateException("consolidator.store.path is empty");
    }
    Path file = Path.of(path).toAbsolutePath();
    try {
      if (file.getParent() != null) {
        Files.createDirectories(file.getParent());
      }
    } catch (IOException ex) {
      throw new UncheckedIOException("Cannot create snapshot store directory for " + file, ex);
    }
    log.info("Snapshot store: {}", file);
    return sqliteDataSource(file, properties.getStore().getBusyTimeoutMs());
  }

  @Bean
  public JdbcTemplate jdbcTemplate(DataSource dataSource) {
    return new JdbcTemplate(dataSource);
  }

  @Bean
  public PlatformTransactionManager transactionManager(DataSource dataSource) {
    return new DataSourceTransactionManager(dataSource);
  }

  @Bean
  public TransactionTemplate transactionTemplate(PlatformTransactionManager transactionManager) {
    return new TransactionTemplate(transactionManager);
  }

  /**
   * Builds a SQLite data source with the store's connection settings.
   *
   * @param file database file
   * @param busyTimeoutMs how long a writer waits on a locked database
   * @return configured data source
   */
  public static SQLiteDataSource sqliteDataSource(Path file, int busyTimeoutMs) {
    SQLiteConfig config = new SQLiteConfig();
    config.enforceForeignKeys(true);
    config.setJournalMode(SQLiteConfig.JournalMode.WAL);
    config.setSynchronous(SQLiteConfig.SynchronousMode.NORMAL);
    config.setBusyTimeout(busyTimeoutMs);
    SQLiteDataSource dataSource = new SQLiteDataSource(config);
    dataSource.setUrl("jdbc:sqlite:" + file);
    return dataSource;
  }
}
