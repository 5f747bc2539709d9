package org.example.shortener.storage;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owner identity of the local console user.
 *
 * <p>The store only needs an opaque owner string. For the console front end that string is a UUID
 * kept in a plain-text file ({@code .local/user.uuid} by default) so that the same user sees the
 * same links across runs. If the file cannot be written, an ephemeral UUID is used for the current
 * process and a warning is logged.
 */
public final class LocalUuid {

  private static final Logger LOG = LoggerFactory.getLogger(LocalUuid.class);

  private LocalUuid() {}

  /** @return the owner id stored in {@code .local/user.uuid}, created if missing */
  public static String ensureCurrentUserUuid() {
    return ensureCurrentUserUuid(DataPaths.UUID_FILE);
  }

  /**
   * Returns the trimmed first line of {@code file} if present and non-blank; otherwise generates a
   * new UUID, stores it there and returns it.
   *
   * @param file identity file
   * @return the owner id, never {@code null}
   */
  public static String ensureCurrentUserUuid(Path file) {
    try {
      Path parent = file.getParent();
      if (parent != null) Files.createDirectories(parent);
      if (Files.exists(file)) {
        try (BufferedReader br = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
          String s = br.readLine();
          if (s != null && !s.isBlank()) {
            return s.trim();
          }
        }
      }
      String generated = UUID.randomUUID().toString();
      try (BufferedWriter bw =
          Files.newBufferedWriter(
              file,
              StandardCharsets.UTF_8,
              StandardOpenOption.CREATE,
              StandardOpenOption.TRUNCATE_EXISTING,
              StandardOpenOption.WRITE)) {
        bw.write(generated);
        bw.write("\n");
      }
      LOG.info("New local owner id {} stored in {}", generated, file);
      return generated;
    } catch (IOException e) {
      String fallback = UUID.randomUUID().toString();
      LOG.warn("Cannot persist owner id in {}, using ephemeral {}", file, fallback, e);
      return fallback;
    }
  }
}
