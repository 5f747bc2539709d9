package org.example.shortener.storage;

import static org.junit.jupiter.api.Assertions.*;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.UUID;
import javax.sql.DataSource;
import org.example.shortener.exception.BackendUnavailableException;
import org.example.shortener.exception.StoreException;
import org.example.shortener.model.SaveResult;
import org.example.shortener.util.CodeGenerator;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Contract tests plus relational specifics of {@link JdbcUrlStore}, run against an in-memory H2
 * database in PostgreSQL compatibility mode. Each store gets a database of its own.
 */
public class JdbcUrlStoreTest extends UrlStoreContractTest {

  private DataSource lastDataSource;

  @Override
  protected UrlStore newStore(CodeGenerator generator) {
    lastDataSource = h2();
    JdbcUrlStore store = new JdbcUrlStore(lastDataSource, new CodeAllocator(generator, 8, 5), 5);
    store.bootstrap();
    return store;
  }

  // ---------- helpers ----------

  private static DataSource h2() {
    JdbcDataSource ds = new JdbcDataSource();
    ds.setURL(
        "jdbc:h2:mem:urls_"
            + UUID.randomUUID().toString().replace("-", "")
            + ";MODE=PostgreSQL;DB_CLOSE_DELAY=-1");
    ds.setUser("sa");
    ds.setPassword("");
    return ds;
  }

  private int countRows() throws SQLException {
    try (Connection c = lastDataSource.getConnection();
        Statement st = c.createStatement();
        ResultSet rs = st.executeQuery("SELECT COUNT(*) FROM short_urls")) {
      rs.next();
      return rs.getInt(1);
    }
  }

  // ---------- tests ----------

  @Test
  @DisplayName("Batch hitting a non-retryable database error persists nothing")
  void saveBatch_rollsBackOnDatabaseError() throws Exception {
    UrlStore store = open();
    String tooLong = "https://example.com/" + "x".repeat(3000);

    StoreException ex =
        assertThrows(
            StoreException.class,
            () -> store.saveBatch("u1", List.of("https://a.example", tooLong), BASE));

    assertInstanceOf(SQLException.class, ex.getCause());
    assertEquals(0, countRows(), "Whole batch must be rolled back");
    assertTrue(store.loadUserUrls("u1", BASE).isEmpty());
  }

  @Test
  @DisplayName("Bootstrap is idempotent and keeps existing rows")
  void bootstrap_idempotent() throws Exception {
    UrlStore store = open();
    SaveResult r = store.save("u1", "https://a.example", BASE);

    store.bootstrap();

    assertEquals(1, countRows());
    assertFalse(store.loadFull(code(r)).get().deleted);
  }

  @Test
  @DisplayName("Single UPDATE reports how many rows it tombstoned")
  void deleteBatch_setsDeletedAt() throws Exception {
    UrlStore store = open();
    String a = code(store.save("u1", "https://a.example", BASE));
    String b = code(store.save("u1", "https://b.example", BASE));

    assertEquals(2, store.deleteBatch("u1", List.of(a, b, a)));

    try (Connection c = lastDataSource.getConnection();
        Statement st = c.createStatement();
        ResultSet rs =
            st.executeQuery(
                "SELECT COUNT(*) FROM short_urls WHERE is_deleted = TRUE "
                    + "AND deleted_at IS NOT NULL")) {
      rs.next();
      assertEquals(2, rs.getInt(1));
    }
  }

  @Test
  @DisplayName("Unreachable database fails bootstrap as BackendUnavailable")
  void bootstrap_unreachable() {
    JdbcDataSource ds = new JdbcDataSource();
    // nothing listens on port 1
    ds.setURL("jdbc:h2:tcp://127.0.0.1:1/nothing");
    JdbcUrlStore store = new JdbcUrlStore(ds, CodeAllocator.defaults(), 1);

    assertThrows(BackendUnavailableException.class, store::bootstrap);
    assertThrows(BackendUnavailableException.class, store::ping);
  }

  @Test
  @DisplayName("Negative query timeout is rejected")
  void negativeTimeout_rejected() {
    assertThrows(
        IllegalArgumentException.class,
        () -> new JdbcUrlStore(h2(), CodeAllocator.defaults(), -1));
  }
}
