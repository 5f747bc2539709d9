package org.example.shortener.storage;

import java.sql.*;
import java.time.Instant;
import java.util.*;
import javax.sql.DataSource;
import org.example.shortener.exception.BackendUnavailableException;
import org.example.shortener.exception.StoreException;
import org.example.shortener.model.SaveResult;
import org.example.shortener.model.UrlRecord;
import org.example.shortener.model.UserUrl;
import org.example.shortener.util.UrlValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link UrlStore} backed by a relational database through JDBC.
 *
 * <p>All state lives in the {@code short_urls} table created by {@link #bootstrap()}. The unique
 * constraints on {@code short_id} and {@code original_url} do the real work:
 *
 * <ul>
 *   <li>An insert that violates either one (SQLState {@code 23505}) is resolved by looking the URL
 *       up. If it is there, its code is returned as a conflict; otherwise the violation was a code
 *       collision and the allocation loop retries with a fresh code.
 *   <li>{@link #saveBatch} runs in one transaction on one connection. Each row is inserted under a
 *       savepoint, so a conflicting row is rolled back alone and resolved inline while the rest of
 *       the transaction carries on. Any other error rolls the whole batch back.
 *   <li>{@link #deleteBatch} is a single owner-scoped {@code UPDATE}, so there is no read-then-write
 *       window.
 * </ul>
 *
 * <p>Concurrency control is left to the database. Every statement carries the configured query
 * timeout; when it fires, the driver cancels the statement and an open batch transaction is rolled
 * back. Transient errors are not retried here.
 */
public class JdbcUrlStore implements UrlStore {

  private static final Logger LOG = LoggerFactory.getLogger(JdbcUrlStore.class);

  static final String CREATE_TABLE =
      "CREATE TABLE IF NOT EXISTS short_urls ("
          + "id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY, "
          + "short_id VARCHAR(32) NOT NULL UNIQUE, "
          + "original_url VARCHAR(2048) NOT NULL UNIQUE, "
          + "user_id VARCHAR(255) NOT NULL, "
          + "is_deleted BOOLEAN NOT NULL DEFAULT FALSE, "
          + "created_at TIMESTAMP NOT NULL DEFAULT CURRENT_TIMESTAMP, "
          + "deleted_at TIMESTAMP NULL)";

  private static final String INSERT =
      "INSERT INTO short_urls (short_id, original_url, user_id) VALUES (?, ?, ?)";

  private static final String SELECT_CODE_BY_URL =
      "SELECT short_id FROM short_urls WHERE original_url = ?";

  private static final String SELECT_BY_CODE =
      "SELECT short_id, original_url, user_id, is_deleted, created_at, deleted_at "
          + "FROM short_urls WHERE short_id = ?";

  private static final String SELECT_BY_OWNER =
      "SELECT short_id, original_url FROM short_urls "
          + "WHERE user_id = ? AND is_deleted = FALSE ORDER BY id";

  private static final String TOMBSTONE_PREFIX =
      "UPDATE short_urls SET is_deleted = TRUE, deleted_at = CURRENT_TIMESTAMP "
          + "WHERE user_id = ? AND is_deleted = FALSE AND short_id IN (";

  private static final String UNIQUE_VIOLATION = "23505";

  private final DataSource dataSource;
  private final CodeAllocator allocator;
  private final int queryTimeoutSeconds;

  /**
   * @param dataSource connection source; closed by {@link #close()} if it is {@link AutoCloseable}
   * @param allocator code allocation policy
   * @param queryTimeoutSeconds per-statement timeout, {@code 0} for none
   */
  public JdbcUrlStore(DataSource dataSource, CodeAllocator allocator, int queryTimeoutSeconds) {
    this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
    this.allocator = Objects.requireNonNull(allocator, "allocator");
    if (queryTimeoutSeconds < 0) throw new IllegalArgumentException("negative query timeout");
    this.queryTimeoutSeconds = queryTimeoutSeconds;
  }

  @Override
  public void bootstrap() {
    try (Connection conn = dataSource.getConnection()) {
      conn.setAutoCommit(false);
      try (Statement st = conn.createStatement()) {
        if (queryTimeoutSeconds > 0) st.setQueryTimeout(queryTimeoutSeconds);
        st.execute(CREATE_TABLE);
        conn.commit();
      } catch (SQLException e) {
        rollback(conn, e);
        throw e;
      }
      LOG.info("Table short_urls is ready");
    } catch (SQLException e) {
      LOG.error("Cannot create table short_urls (SQLState {})", e.getSQLState(), e);
      throw new BackendUnavailableException("Cannot bootstrap database schema", e);
    }
  }

  @Override
  public SaveResult save(String ownerId, String url, String baseUrl) {
    Objects.requireNonNull(url, "url");
    String owner = ownerId == null ? "" : ownerId;
    try (Connection conn = dataSource.getConnection()) {
      CodeAllocator.Allocation a =
          allocator.allocate(candidate -> insertOrResolve(conn, candidate, url, owner, false));
      if (a.isExisting()) LOG.debug("URL already stored under {}", a.getCode());
      return toResult(baseUrl, a);
    } catch (SQLException e) {
      throw translate("save", e);
    }
  }

  @Override
  public List<SaveResult> saveBatch(String ownerId, List<String> urls, String baseUrl) {
    Objects.requireNonNull(urls, "urls");
    if (urls.isEmpty()) return new ArrayList<>();
    String owner = ownerId == null ? "" : ownerId;

    try (Connection conn = dataSource.getConnection()) {
      conn.setAutoCommit(false);
      try {
        List<SaveResult> results = new ArrayList<>(urls.size());
        for (String url : urls) {
          Objects.requireNonNull(url, "url");
          CodeAllocator.Allocation a =
              allocator.allocate(candidate -> insertOrResolve(conn, candidate, url, owner, true));
          results.add(toResult(baseUrl, a));
        }
        conn.commit();
        LOG.debug("Batch of {} URLs committed for owner {}", urls.size(), owner);
        return results;
      } catch (SQLException | RuntimeException e) {
        rollback(conn, e);
        throw e;
      }
    } catch (SQLException e) {
      throw translate("batch save", e);
    }
  }

  @Override
  public Optional<UrlRecord> loadFull(String code) {
    try (Connection conn = dataSource.getConnection();
        PreparedStatement ps = prepare(conn, SELECT_BY_CODE)) {
      ps.setString(1, code);
      try (ResultSet rs = ps.executeQuery()) {
        if (!rs.next()) return Optional.empty();
        UrlRecord r =
            new UrlRecord(
                rs.getString("short_id"),
                rs.getString("original_url"),
                rs.getString("user_id"),
                toInstant(rs.getTimestamp("created_at")));
        r.deleted = rs.getBoolean("is_deleted");
        r.deletedAt = toInstant(rs.getTimestamp("deleted_at"));
        return Optional.of(r);
      }
    } catch (SQLException e) {
      throw translate("load", e);
    }
  }

  @Override
  public List<UserUrl> loadUserUrls(String ownerId, String baseUrl) {
    List<UserUrl> out = new ArrayList<>();
    if (ownerId == null || ownerId.isEmpty()) return out;
    try (Connection conn = dataSource.getConnection();
        PreparedStatement ps = prepare(conn, SELECT_BY_OWNER)) {
      ps.setString(1, ownerId);
      try (ResultSet rs = ps.executeQuery()) {
        while (rs.next()) {
          out.add(
              new UserUrl(
                  UrlValidator.shortUrl(baseUrl, rs.getString("short_id")),
                  rs.getString("original_url")));
        }
      }
      return out;
    } catch (SQLException e) {
      throw translate("list user URLs", e);
    }
  }

  @Override
  public int deleteBatch(String ownerId, List<String> codes) {
    if (ownerId == null || ownerId.isEmpty() || codes == null) return 0;
    Set<String> distinct = new LinkedHashSet<>();
    for (String c : codes) if (c != null && !c.isEmpty()) distinct.add(c);
    if (distinct.isEmpty()) return 0;

    StringBuilder sql = new StringBuilder(TOMBSTONE_PREFIX);
    for (int i = 0; i < distinct.size(); i++) sql.append(i == 0 ? "?" : ", ?");
    sql.append(')');

    try (Connection conn = dataSource.getConnection();
        PreparedStatement ps = prepare(conn, sql.toString())) {
      int idx = 1;
      ps.setString(idx++, ownerId);
      for (String c : distinct) ps.setString(idx++, c);
      int n = ps.executeUpdate();
      LOG.debug("Tombstoned {} of {} requested codes for owner {}", n, distinct.size(), ownerId);
      return n;
    } catch (SQLException e) {
      throw translate("delete", e);
    }
  }

  @Override
  public void ping() {
    try (Connection conn = dataSource.getConnection()) {
      if (!conn.isValid(queryTimeoutSeconds)) {
        throw new BackendUnavailableException("Database connection is not valid");
      }
    } catch (SQLException e) {
      LOG.error("Database ping failed", e);
      throw new BackendUnavailableException("Database ping failed", e);
    }
  }

  @Override
  public void close() {
    if (dataSource instanceof AutoCloseable) {
      try {
        ((AutoCloseable) dataSource).close();
        LOG.info("Database connection pool closed");
      } catch (Exception e) {
        LOG.error("Failed to close database connection pool", e);
        throw new StoreException("Failed to close database connection pool", e);
      }
    }
  }

  /**
   * One allocation attempt: insert the candidate, and on a unique violation decide whether the URL
   * or the code was the cause.
   */
  private CodeAllocator.AttemptResult insertOrResolve(
      Connection conn, String candidate, String url, String owner, boolean inTransaction)
      throws SQLException {
    Savepoint sp = inTransaction ? conn.setSavepoint() : null;
    try (PreparedStatement ps = prepare(conn, INSERT)) {
      ps.setString(1, candidate);
      ps.setString(2, url);
      ps.setString(3, owner);
      ps.executeUpdate();
    } catch (SQLException e) {
      if (!UNIQUE_VIOLATION.equals(e.getSQLState())) throw e;
      if (sp != null) conn.rollback(sp);
      Optional<String> existing = findCodeByUrl(conn, url);
      if (existing.isPresent()) return CodeAllocator.AttemptResult.urlExists(existing.get());
      return CodeAllocator.AttemptResult.codeTaken();
    }
    if (sp != null) conn.releaseSavepoint(sp);
    return CodeAllocator.AttemptResult.inserted(candidate);
  }

  private Optional<String> findCodeByUrl(Connection conn, String url) throws SQLException {
    try (PreparedStatement ps = prepare(conn, SELECT_CODE_BY_URL)) {
      ps.setString(1, url);
      try (ResultSet rs = ps.executeQuery()) {
        return rs.next() ? Optional.of(rs.getString(1)) : Optional.empty();
      }
    }
  }

  private PreparedStatement prepare(Connection conn, String sql) throws SQLException {
    PreparedStatement ps = conn.prepareStatement(sql);
    if (queryTimeoutSeconds > 0) ps.setQueryTimeout(queryTimeoutSeconds);
    return ps;
  }

  private static void rollback(Connection conn, Exception cause) {
    try {
      conn.rollback();
    } catch (SQLException e) {
      LOG.error("Rollback failed", e);
      cause.addSuppressed(e);
    }
  }

  private static StoreException translate(String operation, SQLException e) {
    LOG.error("Database error during {} (SQLState {})", operation, e.getSQLState(), e);
    String state = e.getSQLState();
    if (e instanceof SQLTransientConnectionException
        || e instanceof SQLNonTransientConnectionException
        || (state != null && state.startsWith("08"))) {
      return new BackendUnavailableException("Database unavailable during " + operation, e);
    }
    return new StoreException("Database error during " + operation, e);
  }

  private static Instant toInstant(Timestamp ts) {
    return ts == null ? null : ts.toInstant();
  }

  private static SaveResult toResult(String baseUrl, CodeAllocator.Allocation a) {
    String shortUrl = UrlValidator.shortUrl(baseUrl, a.getCode());
    return a.isExisting() ? SaveResult.conflict(shortUrl) : SaveResult.created(shortUrl);
  }
}
