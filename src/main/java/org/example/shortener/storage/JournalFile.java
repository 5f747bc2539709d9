package org.example.shortener.storage;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import org.example.shortener.util.JsonUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Append-only, newline-delimited JSON file.
 *
 * <p>Two operations matter:
 *
 * <ul>
 *   <li>{@link #open(Consumer)} – creates the file if needed (owner read/write only on POSIX file
 *       systems), replays every line in order and keeps an append channel open.
 *   <li>{@link #append(List)} – writes a group of entries with a single write and forces it to
 *       disk before returning.
 * </ul>
 *
 * <p>Lines are never rewritten. A line that cannot be parsed is logged and skipped during replay.
 * If the previous process died mid-write and left a torn last line, a newline is appended on open
 * so the next entry starts on a line of its own.
 *
 * <p><b>Thread-safety:</b> none. The owning store serializes access.
 */
final class JournalFile implements Closeable {

  private static final Logger LOG = LoggerFactory.getLogger(JournalFile.class);

  private static final Gson GSON = JsonUtils.compactGson();

  private final Path path;
  private FileChannel channel;

  JournalFile(Path path) {
    this.path = Objects.requireNonNull(path, "path");
  }

  /**
   * Creates the journal if missing, replays it into {@code sink}, then opens it for appending.
   *
   * @param sink receives every well-formed entry in file order
   * @return number of entries delivered to {@code sink}
   * @throws IOException if the file cannot be created, read or opened
   */
  int open(Consumer<JournalEntry> sink) throws IOException {
    ensureParent(path);
    createIfMissing(path);
    int applied = replay(sink);
    channel = FileChannel.open(path, StandardOpenOption.WRITE, StandardOpenOption.APPEND);
    repairTornTail();
    return applied;
  }

  /**
   * Appends entries, one JSON object per line, and flushes them to the device.
   *
   * @param entries entries to write; nothing happens when empty
   * @throws IOException if the journal is closed or the write fails
   */
  void append(List<JournalEntry> entries) throws IOException {
    if (entries.isEmpty()) return;
    if (channel == null || !channel.isOpen()) {
      throw new IOException("Journal is not open: " + path);
    }
    StringBuilder sb = new StringBuilder();
    for (JournalEntry e : entries) sb.append(GSON.toJson(e)).append('\n');

    ByteBuffer buf = ByteBuffer.wrap(sb.toString().getBytes(StandardCharsets.UTF_8));
    while (buf.hasRemaining()) channel.write(buf);
    channel.force(false);
  }

  boolean isOpen() {
    return channel != null && channel.isOpen();
  }

  Path path() {
    return path;
  }

  @Override
  public void close() throws IOException {
    if (channel != null) channel.close();
  }

  private int replay(Consumer<JournalEntry> sink) throws IOException {
    int applied = 0;
    int lineNo = 0;
    // InputStreamReader substitutes malformed bytes, so a torn multi-byte character cannot abort
    // the whole replay
    try (BufferedReader br =
        new BufferedReader(
            new InputStreamReader(Files.newInputStream(path), StandardCharsets.UTF_8))) {
      String line;
      while ((line = br.readLine()) != null) {
        lineNo++;
        if (line.isBlank()) continue;
        JournalEntry e;
        try {
          e = GSON.fromJson(line, JournalEntry.class);
        } catch (JsonParseException | IllegalStateException | UnsupportedOperationException ex) {
          // JsonElement accessors report a wrong shape with the two unchecked types
          LOG.warn("Skipping malformed journal line {} in {}: {}", lineNo, path, ex.getMessage());
          continue;
        }
        if (e == null || e.shortUrl == null || e.shortUrl.isEmpty()) {
          LOG.warn("Skipping journal line {} in {}: no short_url", lineNo, path);
          continue;
        }
        sink.accept(e);
        applied++;
      }
    }
    return applied;
  }

  private void repairTornTail() throws IOException {
    long size = channel.size();
    if (size == 0) return;
    try (FileChannel reader = FileChannel.open(path, StandardOpenOption.READ)) {
      ByteBuffer last = ByteBuffer.allocate(1);
      reader.read(last, size - 1);
      if (last.get(0) == '\n') return;
    }
    LOG.warn("Journal {} ends with a torn line; terminating it before appending", path);
    ByteBuffer nl = ByteBuffer.wrap(new byte[] {'\n'});
    while (nl.hasRemaining()) channel.write(nl);
    channel.force(false);
  }

  private static void createIfMissing(Path p) throws IOException {
    if (Files.exists(p)) return;
    try {
      Files.createFile(
          p, PosixFilePermissions.asFileAttribute(PosixFilePermissions.fromString("rw-------")));
    } catch (UnsupportedOperationException e) {
      // non-POSIX file system, fall back to default permissions
      Files.createFile(p);
    } catch (FileAlreadyExistsException e) {
      LOG.debug("Journal {} was created concurrently", p);
    }
  }

  private static void ensureParent(Path p) throws IOException {
    Path parent = p.toAbsolutePath().getParent();
    if (parent != null) Files.createDirectories(parent);
  }
}
