package org.example.shortener.storage;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.example.shortener.util.JsonUtils;
import org.example.shortener.util.UrlValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Store configuration with load/save helpers.
 *
 * <p>Values are resolved with the following priority (highest first):
 *
 * <ol>
 *   <li>Environment variables {@code BASE_URL}, {@code FILE_STORAGE_PATH}, {@code DATABASE_DSN}
 *       ({@link #applyEnvironment(Map)}).
 *   <li>Command-line flags {@code -b}, {@code -f}, {@code -d} ({@link #applyFlags(List)}).
 *   <li>The JSON file, {@code data/config.json} by default ({@link #loadOrCreateDefault(Path)}).
 *   <li>Field defaults.
 * </ol>
 *
 * <p>Which backend is used follows from the resolved values: a non-empty {@link #databaseDsn}
 * selects the database, otherwise a non-empty {@link #fileStoragePath} selects the journal,
 * otherwise everything stays in memory. See {@link StoreFactory}.
 *
 * <p><b>File format:</b> pretty-printed JSON produced by Gson. All fields are public for simple
 * (de)serialization.
 */
public class StoreConfig {

  private static final Logger LOG = LoggerFactory.getLogger(StoreConfig.class);

  /** Prefix of every short URL; always ends in {@code /} after {@link #normalize()}. */
  public String baseUrl = "http://localhost:8080/";

  /** URL journal location; empty disables the journal. */
  public String fileStoragePath = DataPaths.JOURNAL_FILE.toString();

  /** Database DSN; empty disables the database. */
  public String databaseDsn = "";

  /** Number of characters in a generated short code. */
  public int shortCodeLength = CodeAllocator.DEFAULT_CODE_LENGTH;

  /** Codes tried per URL before giving up. */
  public int maxAllocationAttempts = CodeAllocator.DEFAULT_MAX_ATTEMPTS;

  /** Per-statement database timeout in seconds; {@code 0} disables it. */
  public int queryTimeoutSeconds = 5;

  /** Upper bound of the database connection pool. */
  public int maxPoolSize = 10;

  /** Maximum accepted length of an original URL (validation guard in the service). */
  public int maxUrlLength = 2048;

  private static final Gson GSON = JsonUtils.gson();

  /** @return configuration from {@code data/config.json}, created with defaults if missing */
  public static StoreConfig loadOrCreateDefault() {
    return loadOrCreateDefault(DataPaths.CONFIG_JSON);
  }

  /**
   * Loads configuration from {@code path}, writing a default file there if it does not exist.
   *
   * <p>If the file cannot be read or parsed, or holds out-of-range numbers, in-memory defaults are
   * used and the cause is logged. The file itself is left as it is.
   *
   * @param path configuration file
   * @return a normalized, non-null configuration
   */
  public static StoreConfig loadOrCreateDefault(Path path) {
    try {
      ensureParentDir(path);
      if (Files.exists(path)) {
        try (BufferedReader br = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
          StoreConfig cfg = GSON.fromJson(br, StoreConfig.class);
          return (cfg != null) ? cfg.normalize() : writeDefault(path);
        }
      }
      return writeDefault(path);
    } catch (IOException | JsonParseException | IllegalArgumentException e) {
      LOG.warn("Failed to load {}, using defaults: {}", path, e.getMessage());
      return new StoreConfig().normalize();
    }
  }

  /**
   * Consumes leading {@code -b <baseUrl>}, {@code -f <path>} and {@code -d <dsn>} flags.
   *
   * @param args command-line arguments
   * @return the arguments after the last recognized flag
   * @throws IllegalArgumentException if a flag has no value
   */
  public List<String> applyFlags(List<String> args) {
    int i = 0;
    while (i < args.size()) {
      String flag = args.get(i);
      if (!flag.equals("-b") && !flag.equals("-f") && !flag.equals("-d")) break;
      if (i + 1 >= args.size()) throw new IllegalArgumentException("Missing value for " + flag);
      String value = args.get(i + 1);
      switch (flag) {
        case "-b" -> baseUrl = value;
        case "-f" -> fileStoragePath = value;
        default -> databaseDsn = value;
      }
      i += 2;
    }
    normalize();
    return new ArrayList<>(args.subList(i, args.size()));
  }

  /**
   * Overrides values from environment variables. A variable that is set but empty still
   * overrides, which is how the journal is switched off from the environment.
   *
   * @param env environment, usually {@link System#getenv()}
   * @return this configuration
   */
  public StoreConfig applyEnvironment(Map<String, String> env) {
    if (env.containsKey("BASE_URL")) baseUrl = env.get("BASE_URL");
    if (env.containsKey("FILE_STORAGE_PATH")) fileStoragePath = env.get("FILE_STORAGE_PATH");
    if (env.containsKey("DATABASE_DSN")) databaseDsn = env.get("DATABASE_DSN");
    return normalize();
  }

  /**
   * Fills {@code null} strings, appends the trailing slash to {@link #baseUrl} and checks numeric
   * bounds.
   *
   * @return this configuration
   * @throws IllegalArgumentException if a numeric value is out of range
   */
  public StoreConfig normalize() {
    baseUrl = UrlValidator.ensureTrailingSlash(baseUrl == null ? "" : baseUrl.trim());
    fileStoragePath = fileStoragePath == null ? "" : fileStoragePath.trim();
    databaseDsn = databaseDsn == null ? "" : databaseDsn.trim();
    if (shortCodeLength <= 0) throw new IllegalArgumentException("shortCodeLength must be > 0");
    if (maxAllocationAttempts <= 0) {
      throw new IllegalArgumentException("maxAllocationAttempts must be > 0");
    }
    if (queryTimeoutSeconds < 0) throw new IllegalArgumentException("queryTimeoutSeconds < 0");
    if (maxPoolSize <= 0) throw new IllegalArgumentException("maxPoolSize must be > 0");
    if (maxUrlLength <= 0) throw new IllegalArgumentException("maxUrlLength must be > 0");
    return this;
  }

  private static StoreConfig writeDefault(Path path) throws IOException {
    StoreConfig def = new StoreConfig().normalize();
    try (BufferedWriter bw =
        Files.newBufferedWriter(
            path,
            StandardCharsets.UTF_8,
            StandardOpenOption.CREATE,
            StandardOpenOption.TRUNCATE_EXISTING,
            StandardOpenOption.WRITE)) {
      GSON.toJson(def, bw);
    }
    LOG.info("Default configuration written to {}", path.toAbsolutePath());
    return def;
  }

  private static void ensureParentDir(Path p) throws IOException {
    Path parent = p.getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
  }
}
