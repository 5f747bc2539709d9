package org.example.shortener.storage;

import java.time.Clock;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.locks.ReentrantLock;
import org.example.shortener.model.SaveResult;
import org.example.shortener.model.UrlRecord;
import org.example.shortener.model.UserUrl;
import org.example.shortener.util.UrlValidator;

/**
 * Base class for stores that keep every record in an in-process map.
 *
 * <p>State is a map from code to {@link UrlRecord} (insertion ordered, so listings come out oldest
 * first) plus an index from original URL to code used for deduplication. Both are guarded by one
 * private {@link ReentrantLock}; it is never handed out and never acquired twice by the same call.
 *
 * <p>Subclasses decide what durability means through {@link #persist(List)}, which is invoked
 * while the lock is held and <em>before</em> the map changes. If it throws, the map is left as it
 * was, so nothing unconfirmed is ever visible to readers.
 *
 * <p>Batch semantics: the whole batch is staged under the lock, each URL going through the normal
 * allocation loop and deduplicated against both stored records and earlier URLs of the same
 * batch. Only when every URL has a code is the batch persisted and published.
 */
abstract class AbstractMapUrlStore implements UrlStore {

  private final ReentrantLock lock = new ReentrantLock();
  private final Map<String, UrlRecord> byCode = new LinkedHashMap<>();
  private final Map<String, String> codeByUrl = new HashMap<>();

  private final CodeAllocator allocator;
  private final Clock clock;

  protected AbstractMapUrlStore(CodeAllocator allocator, Clock clock) {
    this.allocator = Objects.requireNonNull(allocator, "allocator");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Makes new or changed records durable. Called with the lock held.
   *
   * @param records records about to be published, in order
   * @throws org.example.shortener.exception.StoreException if they could not be persisted
   */
  protected abstract void persist(List<UrlRecord> records);

  @Override
  public SaveResult save(String ownerId, String url, String baseUrl) {
    Objects.requireNonNull(url, "url");
    // one lock acquisition per attempt; code generation happens outside the lock
    CodeAllocator.Allocation a =
        allocator.allocate(
            candidate -> {
              lock.lock();
              try {
                String existing = codeByUrl.get(url);
                if (existing != null) return CodeAllocator.AttemptResult.urlExists(existing);
                if (byCode.containsKey(candidate)) return CodeAllocator.AttemptResult.codeTaken();
                UrlRecord r = new UrlRecord(candidate, url, ownerId, clock.instant());
                persist(List.of(r));
                publish(r);
                return CodeAllocator.AttemptResult.inserted(candidate);
              } finally {
                lock.unlock();
              }
            });
    return toResult(baseUrl, a);
  }

  @Override
  public List<SaveResult> saveBatch(String ownerId, List<String> urls, String baseUrl) {
    Objects.requireNonNull(urls, "urls");
    if (urls.isEmpty()) return new ArrayList<>();

    lock.lock();
    try {
      Map<String, UrlRecord> stagedByCode = new LinkedHashMap<>();
      Map<String, String> stagedByUrl = new HashMap<>();
      List<SaveResult> results = new ArrayList<>(urls.size());
      Instant now = clock.instant();

      for (String url : urls) {
        Objects.requireNonNull(url, "url");
        CodeAllocator.Allocation a =
            allocator.allocate(
                candidate -> {
                  String existing = codeByUrl.get(url);
                  if (existing == null) existing = stagedByUrl.get(url);
                  if (existing != null) return CodeAllocator.AttemptResult.urlExists(existing);
                  if (byCode.containsKey(candidate) || stagedByCode.containsKey(candidate)) {
                    return CodeAllocator.AttemptResult.codeTaken();
                  }
                  stagedByCode.put(candidate, new UrlRecord(candidate, url, ownerId, now));
                  stagedByUrl.put(url, candidate);
                  return CodeAllocator.AttemptResult.inserted(candidate);
                });
        results.add(toResult(baseUrl, a));
      }

      if (!stagedByCode.isEmpty()) {
        List<UrlRecord> staged = new ArrayList<>(stagedByCode.values());
        persist(staged);
        for (UrlRecord r : staged) publish(r);
      }
      return results;
    } finally {
      lock.unlock();
    }
  }

  @Override
  public Optional<UrlRecord> loadFull(String code) {
    lock.lock();
    try {
      UrlRecord r = byCode.get(code);
      return r == null ? Optional.empty() : Optional.of(r.copy());
    } finally {
      lock.unlock();
    }
  }

  @Override
  public List<UserUrl> loadUserUrls(String ownerId, String baseUrl) {
    List<UserUrl> out = new ArrayList<>();
    lock.lock();
    try {
      for (UrlRecord r : byCode.values()) {
        if (!r.deleted && r.isOwnedBy(ownerId)) {
          out.add(new UserUrl(UrlValidator.shortUrl(baseUrl, r.shortCode), r.originalUrl));
        }
      }
    } finally {
      lock.unlock();
    }
    return out;
  }

  @Override
  public int deleteBatch(String ownerId, List<String> codes) {
    if (codes == null || codes.isEmpty() || ownerId == null || ownerId.isEmpty()) return 0;

    lock.lock();
    try {
      Instant now = clock.instant();
      Map<String, UrlRecord> tombstones = new LinkedHashMap<>();
      for (String code : codes) {
        UrlRecord r = byCode.get(code);
        if (r == null || r.deleted || !r.isOwnedBy(ownerId)) continue;
        tombstones.putIfAbsent(code, r.tombstoned(now));
      }
      if (tombstones.isEmpty()) return 0;

      List<UrlRecord> changed = new ArrayList<>(tombstones.values());
      persist(changed);
      for (UrlRecord r : changed) byCode.put(r.shortCode, r);
      return changed.size();
    } finally {
      lock.unlock();
    }
  }

  @Override
  public void bootstrap() {}

  /**
   * Loads a record during recovery, merging it with what is already known for its code. Later
   * calls win, except that a tombstone is never undone and missing fields keep earlier values.
   *
   * @param r record read back from durable storage
   */
  protected void restore(UrlRecord r) {
    lock.lock();
    try {
      UrlRecord prev = byCode.get(r.shortCode);
      if (prev != null) {
        if (r.originalUrl == null || r.originalUrl.isEmpty()) r.originalUrl = prev.originalUrl;
        if (r.ownerId == null || r.ownerId.isEmpty()) r.ownerId = prev.ownerId;
        if (r.createdAt == null) r.createdAt = prev.createdAt;
        if (prev.deleted) {
          r.deleted = true;
          if (r.deletedAt == null) r.deletedAt = prev.deletedAt;
        }
        if (prev.originalUrl != null && !prev.originalUrl.equals(r.originalUrl)) {
          codeByUrl.remove(prev.originalUrl, r.shortCode);
        }
      }
      if (r.ownerId == null) r.ownerId = "";
      publish(r);
    } finally {
      lock.unlock();
    }
  }

  /** @return number of distinct codes held, tombstones included */
  protected int size() {
    lock.lock();
    try {
      return byCode.size();
    } finally {
      lock.unlock();
    }
  }

  private void publish(UrlRecord r) {
    byCode.put(r.shortCode, r);
    if (r.originalUrl != null && !r.originalUrl.isEmpty()) {
      codeByUrl.putIfAbsent(r.originalUrl, r.shortCode);
    }
  }

  private static SaveResult toResult(String baseUrl, CodeAllocator.Allocation a) {
    String shortUrl = UrlValidator.shortUrl(baseUrl, a.getCode());
    return a.isExisting() ? SaveResult.conflict(shortUrl) : SaveResult.created(shortUrl);
  }
}
