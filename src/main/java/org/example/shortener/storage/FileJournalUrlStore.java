package org.example.shortener.storage;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import org.example.shortener.exception.BackendUnavailableException;
import org.example.shortener.exception.StoreException;
import org.example.shortener.model.UrlRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link UrlStore} made durable by an append-only JSON journal.
 *
 * <p>Every mutation (new record, tombstone) appends the full record as one line and forces it to
 * disk before the in-memory map changes; reads are served from the map alone. On construction the
 * journal is replayed line by line with last-write-wins semantics per code, so a tombstone written
 * after the original record makes the code Gone after a restart. There is no compaction.
 *
 * <p>Construction fails with {@link BackendUnavailableException} if the journal cannot be created
 * or read.
 */
public class FileJournalUrlStore extends AbstractMapUrlStore {

  private static final Logger LOG = LoggerFactory.getLogger(FileJournalUrlStore.class);

  private final JournalFile journal;

  public FileJournalUrlStore(Path path) {
    this(path, CodeAllocator.defaults());
  }

  public FileJournalUrlStore(Path path, CodeAllocator allocator) {
    this(path, allocator, Clock.systemUTC());
  }

  public FileJournalUrlStore(Path path, CodeAllocator allocator, Clock clock) {
    super(allocator, clock);
    this.journal = new JournalFile(path);
    try {
      int applied = journal.open(e -> restore(e.toRecord()));
      LOG.info("URL journal {} replayed: {} lines applied, {} codes known", path, applied, size());
    } catch (IOException e) {
      LOG.error("Cannot open URL journal {}", path, e);
      closeQuietly();
      throw new BackendUnavailableException("Cannot open URL journal " + path, e);
    }
  }

  @Override
  protected void persist(List<UrlRecord> records) {
    List<JournalEntry> entries = new ArrayList<>(records.size());
    for (UrlRecord r : records) entries.add(JournalEntry.of(r));
    try {
      journal.append(entries);
    } catch (IOException e) {
      LOG.error("Failed to append {} records to URL journal {}", entries.size(), journal.path(), e);
      throw new StoreException("Failed to append to URL journal " + journal.path(), e);
    }
  }

  @Override
  public void ping() {
    if (!journal.isOpen()) {
      throw new BackendUnavailableException("URL journal is closed: " + journal.path());
    }
  }

  @Override
  public void bootstrap() {
    ping();
  }

  @Override
  public void close() {
    try {
      journal.close();
      LOG.info("URL journal {} closed", journal.path());
    } catch (IOException e) {
      LOG.error("Failed to close URL journal {}", journal.path(), e);
      throw new StoreException("Failed to close URL journal " + journal.path(), e);
    }
  }

  private void closeQuietly() {
    try {
      journal.close();
    } catch (IOException suppressed) {
      LOG.debug("Ignoring close failure after failed open of {}", journal.path(), suppressed);
    }
  }
}
