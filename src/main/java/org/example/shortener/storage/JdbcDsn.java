package org.example.shortener.storage;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Connection settings derived from the configured database DSN.
 *
 * <p>Three spellings are accepted:
 *
 * <ul>
 *   <li>a JDBC URL ({@code jdbc:postgresql://db:5432/app}, {@code jdbc:h2:mem:test}) used as is;
 *   <li>a URL DSN ({@code postgres://user:secret@db:5432/app?sslmode=disable}), translated to a
 *       PostgreSQL JDBC URL with the credentials split out;
 *   <li>a keyword DSN ({@code host=db port=5432 user=app password=secret dbname=app}).
 * </ul>
 *
 * <p>{@link #toString()} never reveals the password, so instances can be logged.
 */
public final class JdbcDsn {

  private static final Pattern PASSWORD_PARAM = Pattern.compile("(?i)(password=)[^&;\\s]*");

  private final String jdbcUrl;
  private final String user;
  private final String password;

  JdbcDsn(String jdbcUrl, String user, String password) {
    this.jdbcUrl = jdbcUrl;
    this.user = user;
    this.password = password;
  }

  /**
   * @param dsn configured DSN
   * @return parsed settings
   * @throws IllegalArgumentException if {@code dsn} is blank or in none of the accepted forms
   */
  public static JdbcDsn parse(String dsn) {
    if (dsn == null || dsn.isBlank()) {
      throw new IllegalArgumentException("Database DSN is empty");
    }
    String s = dsn.trim();
    if (s.startsWith("jdbc:")) return new JdbcDsn(s, null, null);
    if (s.startsWith("postgres://") || s.startsWith("postgresql://")) return parseUrl(s);
    if (s.contains("=") && !s.contains("://")) return parseKeywords(s);
    throw new IllegalArgumentException("Unsupported database DSN: " + mask(s));
  }

  private static JdbcDsn parseUrl(String s) {
    URI uri;
    try {
      uri = new URI(s);
    } catch (URISyntaxException e) {
      throw new IllegalArgumentException("Malformed database DSN: " + mask(s), e);
    }
    if (uri.getHost() == null) {
      throw new IllegalArgumentException("Database DSN has no host: " + mask(s));
    }
    String user = null;
    String password = null;
    String userInfo = uri.getRawUserInfo();
    if (userInfo != null) {
      int colon = userInfo.indexOf(':');
      user = decode(colon < 0 ? userInfo : userInfo.substring(0, colon));
      if (colon >= 0) password = decode(userInfo.substring(colon + 1));
    }
    StringBuilder url = new StringBuilder("jdbc:postgresql://").append(uri.getHost());
    if (uri.getPort() > 0) url.append(':').append(uri.getPort());
    String path = uri.getRawPath();
    url.append(path == null || path.isEmpty() ? "/" : path);
    if (uri.getRawQuery() != null) url.append('?').append(uri.getRawQuery());
    return new JdbcDsn(url.toString(), user, password);
  }

  private static JdbcDsn parseKeywords(String s) {
    Map<String, String> kv = new LinkedHashMap<>();
    for (String token : s.split("\\s+")) {
      int eq = token.indexOf('=');
      if (eq <= 0) throw new IllegalArgumentException("Malformed database DSN: " + mask(s));
      kv.put(token.substring(0, eq).toLowerCase(Locale.ROOT), token.substring(eq + 1));
    }
    String host = kv.getOrDefault("host", "localhost");
    StringBuilder url = new StringBuilder("jdbc:postgresql://").append(host);
    if (kv.containsKey("port")) url.append(':').append(kv.get("port"));
    url.append('/').append(kv.getOrDefault("dbname", ""));
    if (kv.containsKey("sslmode")) url.append("?sslmode=").append(kv.get("sslmode"));
    return new JdbcDsn(url.toString(), kv.get("user"), kv.get("password"));
  }

  private static String decode(String s) {
    return URLDecoder.decode(s, StandardCharsets.UTF_8);
  }

  /**
   * Replaces any password, in user info or as a parameter, with {@code ****}.
   *
   * @param dsn DSN in any accepted form
   * @return the DSN safe to log
   */
  public static String mask(String dsn) {
    if (dsn == null) return null;
    String masked = PASSWORD_PARAM.matcher(dsn).replaceAll("$1****");
    int scheme = masked.indexOf("://");
    int at = masked.indexOf('@');
    if (scheme >= 0 && at > scheme) {
      String userInfo = masked.substring(scheme + 3, at);
      int colon = userInfo.indexOf(':');
      if (colon >= 0) {
        masked =
            masked.substring(0, scheme + 3)
                + userInfo.substring(0, colon)
                + ":****"
                + masked.substring(at);
      }
    }
    return masked;
  }

  public String getJdbcUrl() {
    return jdbcUrl;
  }

  /** @return user name, or {@code null} when the JDBC URL carries its own */
  public String getUser() {
    return user;
  }

  /** @return password, or {@code null} when the JDBC URL carries its own */
  public String getPassword() {
    return password;
  }

  @Override
  public String toString() {
    return mask(jdbcUrl) + (user == null ? "" : " (user " + user + ")");
  }
}
