package org.example.shortener.storage;

import java.time.Clock;
import java.util.List;
import org.example.shortener.model.UrlRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Volatile {@link UrlStore}: everything lives in the process and is lost on restart.
 *
 * <p>Used when neither a database DSN nor a journal path is configured, and throughout the tests.
 */
public class MemoryUrlStore extends AbstractMapUrlStore {

  private static final Logger LOG = LoggerFactory.getLogger(MemoryUrlStore.class);

  public MemoryUrlStore() {
    this(CodeAllocator.defaults());
  }

  public MemoryUrlStore(CodeAllocator allocator) {
    this(allocator, Clock.systemUTC());
  }

  public MemoryUrlStore(CodeAllocator allocator, Clock clock) {
    super(allocator, clock);
    LOG.debug("In-memory URL store created");
  }

  @Override
  protected void persist(List<UrlRecord> records) {
    // nothing to make durable
  }

  @Override
  public void ping() {}

  @Override
  public void close() {
    LOG.debug("In-memory URL store closed with {} records", size());
  }
}
