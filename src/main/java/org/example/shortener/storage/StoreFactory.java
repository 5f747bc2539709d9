package org.example.shortener.storage;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import java.nio.file.Path;
import java.util.Objects;
import org.example.shortener.exception.StoreException;
import org.example.shortener.util.CodeGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Chooses and opens the {@link UrlStore} backend once at startup.
 *
 * <p>Precedence: database DSN, then journal path, then memory. The returned store has already
 * been {@linkplain UrlStore#bootstrap() bootstrapped}; if bootstrapping fails the store is closed
 * and the failure propagates, so a misconfigured database stops the application instead of
 * silently falling back.
 */
public final class StoreFactory {

  private static final Logger LOG = LoggerFactory.getLogger(StoreFactory.class);

  /** Available backends. */
  public enum Backend {
    DATABASE,
    FILE,
    MEMORY
  }

  private StoreFactory() {}

  /**
   * @param cfg resolved configuration
   * @return the backend {@code cfg} selects
   */
  public static Backend select(StoreConfig cfg) {
    if (cfg.databaseDsn != null && !cfg.databaseDsn.isBlank()) return Backend.DATABASE;
    if (cfg.fileStoragePath != null && !cfg.fileStoragePath.isBlank()) return Backend.FILE;
    return Backend.MEMORY;
  }

  /**
   * Opens the backend selected by {@code cfg} with the secure code generator.
   *
   * @param cfg resolved configuration
   * @return a bootstrapped store
   */
  public static UrlStore open(StoreConfig cfg) {
    return open(cfg, CodeGenerator.secure());
  }

  /**
   * @param cfg resolved configuration
   * @param generator source of candidate codes
   * @return a bootstrapped store
   * @throws org.example.shortener.exception.BackendUnavailableException if the backend cannot be
   *     reached or prepared
   */
  public static UrlStore open(StoreConfig cfg, CodeGenerator generator) {
    Objects.requireNonNull(cfg, "cfg");
    CodeAllocator allocator =
        new CodeAllocator(generator, cfg.shortCodeLength, cfg.maxAllocationAttempts);

    UrlStore store;
    switch (select(cfg)) {
      case DATABASE -> {
        JdbcDsn dsn = JdbcDsn.parse(cfg.databaseDsn);
        LOG.info("Using database store at {}", dsn);
        store = new JdbcUrlStore(dataSource(dsn, cfg), allocator, cfg.queryTimeoutSeconds);
      }
      case FILE -> {
        LOG.info("Using file journal store at {}", cfg.fileStoragePath);
        store = new FileJournalUrlStore(Path.of(cfg.fileStoragePath), allocator);
      }
      default -> {
        LOG.info("Using in-memory store; data will not survive a restart");
        store = new MemoryUrlStore(allocator);
      }
    }

    try {
      store.bootstrap();
    } catch (StoreException e) {
      try {
        store.close();
      } catch (StoreException closeFailure) {
        e.addSuppressed(closeFailure);
      }
      throw e;
    }
    return store;
  }

  private static HikariDataSource dataSource(JdbcDsn dsn, StoreConfig cfg) {
    HikariConfig hc = new HikariConfig();
    hc.setPoolName("shortener");
    hc.setJdbcUrl(dsn.getJdbcUrl());
    if (dsn.getUser() != null) hc.setUsername(dsn.getUser());
    if (dsn.getPassword() != null) hc.setPassword(dsn.getPassword());
    hc.setMaximumPoolSize(cfg.maxPoolSize);
    if (cfg.queryTimeoutSeconds > 0) {
      hc.setConnectionTimeout(Math.max(250L, cfg.queryTimeoutSeconds * 1000L));
    }
    // connectivity is checked by bootstrap(), which reports it as BackendUnavailableException
    hc.setInitializationFailTimeout(-1);
    return new HikariDataSource(hc);
  }
}
