package org.example.shortener.app;

import java.util.Arrays;
import java.util.List;
import org.example.shortener.cli.ConsoleCommands;
import org.example.shortener.exception.StoreException;
import org.example.shortener.service.ShortenerService;
import org.example.shortener.storage.LocalUuid;
import org.example.shortener.storage.StoreConfig;
import org.example.shortener.storage.StoreFactory;
import org.example.shortener.storage.UrlStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of the shortener console application.
 *
 * <ol>
 *   <li>Loads {@code data/config.json}, creating it with defaults if missing (see {@link
 *       StoreConfig#loadOrCreateDefault()}).
 *   <li>Applies the {@code -b}/{@code -f}/{@code -d} flags, then the {@code BASE_URL}, {@code
 *       FILE_STORAGE_PATH} and {@code DATABASE_DSN} environment variables.
 *   <li>Resolves the local owner id (see {@link LocalUuid#ensureCurrentUserUuid()}).
 *   <li>Opens the selected backend, runs one command through {@link ConsoleCommands} and closes
 *       the backend again.
 * </ol>
 *
 * <p>The process exits with the code returned by {@link ConsoleCommands#run(List)}, or {@code 1}
 * if the backend could not be opened.
 */
public class Main {

  private static final Logger LOG = LoggerFactory.getLogger(Main.class);

  public static void main(String[] args) {
    System.exit(run(Arrays.asList(args)));
  }

  /**
   * Runs the application without exiting the JVM.
   *
   * @param args command-line arguments
   * @return process exit code
   */
  static int run(List<String> args) {
    // 1) Config: file, then flags, then environment
    StoreConfig config;
    List<String> command;
    try {
      config = StoreConfig.loadOrCreateDefault();
      command = config.applyFlags(args);
      config.applyEnvironment(System.getenv());
    } catch (IllegalArgumentException e) {
      System.err.println(e.getMessage());
      return ConsoleCommands.EXIT_USAGE;
    }

    // 2) Owner identity
    String ownerId = LocalUuid.ensureCurrentUserUuid();

    // 3) Store lifetime is the lifetime of one command
    try (UrlStore store = StoreFactory.open(config)) {
      ShortenerService service =
          new ShortenerService(store, config.baseUrl, config.maxUrlLength);
      return new ConsoleCommands(service, ownerId, System.out, System.err).run(command);
    } catch (StoreException e) {
      LOG.error("Cannot run command: {}", e.getMessage(), e);
      System.err.println("Storage error: " + e.getMessage());
      return ConsoleCommands.EXIT_FAILURE;
    } catch (IllegalArgumentException e) {
      // unparseable DSN
      System.err.println(e.getMessage());
      return ConsoleCommands.EXIT_USAGE;
    }
  }
}
