package org.example.shortener.storage;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Default file-system locations, all relative to the working directory.
 *
 * <ul>
 *   <li>{@link #CONFIG_JSON} – store configuration.
 *   <li>{@link #JOURNAL_FILE} – URL journal used when no database is configured.
 *   <li>{@link #UUID_FILE} – identity of the local console user.
 * </ul>
 */
public final class DataPaths {
  private DataPaths() {}

  /** Root directory for application data files: {@code data/}. */
  public static final Path DATA_DIR = Paths.get("data");

  /** Configuration file: {@code data/config.json}. */
  public static final Path CONFIG_JSON = DATA_DIR.resolve("config.json");

  /** Default URL journal: {@code data/shortener_data.json}. */
  public static final Path JOURNAL_FILE = DATA_DIR.resolve("shortener_data.json");

  /** Local state directory: {@code .local/}. */
  public static final Path LOCAL_DIR = Paths.get(".local");

  /** Console user identity: {@code .local/user.uuid}. */
  public static final Path UUID_FILE = LOCAL_DIR.resolve("user.uuid");
}
