package org.example.shortener.storage;

import java.util.List;
import java.util.Optional;
import org.example.shortener.model.SaveResult;
import org.example.shortener.model.UrlRecord;
import org.example.shortener.model.UserUrl;

/**
 * Persistence contract for short URLs.
 *
 * <p>Callers depend on this interface only, so the backend (memory, file journal, relational
 * database) can be chosen once at startup by {@link StoreFactory} without the rest of the
 * application noticing. Every implementation is safe for concurrent use.
 *
 * <p>Ownership rules shared by all implementations:
 *
 * <ul>
 *   <li>An original URL maps to exactly one code per store, whoever submits it. Resubmitting a
 *       stored URL returns the existing code as a {@linkplain SaveResult#isConflict() conflict}.
 *   <li>Codes are never reused; deleted records stay behind as tombstones.
 *   <li>Listing and deletion are scoped to the given owner. An empty owner matches nothing.
 * </ul>
 *
 * <p>Methods take no per-call deadline or cancellation argument. Bounding the time a call may
 * block is a property of the backend, fixed when it is opened: the relational store applies
 * {@link StoreConfig#queryTimeoutSeconds} to every statement and to connection checkout, and an
 * expired timeout aborts the statement and rolls back an open batch. The map-based stores never
 * block on anything but their own lock.
 */
public interface UrlStore extends AutoCloseable {

  /**
   * Allocates a code for {@code url} or returns the one it already has.
   *
   * @param ownerId submitting owner, may be empty
   * @param url original URL, already validated by the caller
   * @param baseUrl prefix for the returned short URL
   * @return the short URL, flagged as conflict when {@code url} was already stored
   * @throws org.example.shortener.exception.AllocationExhaustedException if every attempt collided
   * @throws org.example.shortener.exception.StoreException on backend failure
   */
  SaveResult save(String ownerId, String url, String baseUrl);

  /**
   * Bulk variant of {@link #save}: either every URL is stored (or resolved to its existing code)
   * or none is.
   *
   * @param ownerId submitting owner
   * @param urls URLs to store
   * @param baseUrl prefix for the returned short URLs
   * @return one result per input URL, in input order
   */
  List<SaveResult> saveBatch(String ownerId, List<String> urls, String baseUrl);

  /**
   * Looks up a code, including tombstoned records.
   *
   * @param code short code
   * @return a copy of the record, or empty when the code was never allocated
   */
  Optional<UrlRecord> loadFull(String code);

  /**
   * @param ownerId owner whose URLs to list
   * @param baseUrl prefix for the listed short URLs
   * @return the owner's live URLs, oldest first
   */
  List<UserUrl> loadUserUrls(String ownerId, String baseUrl);

  /**
   * Tombstones the given codes if they belong to {@code ownerId}. Codes owned by someone else,
   * unknown codes and codes already deleted are skipped without error.
   *
   * @param ownerId owner requesting deletion
   * @param codes short codes to delete
   * @return number of records tombstoned by this call
   */
  int deleteBatch(String ownerId, List<String> codes);

  /**
   * Checks that the backend is reachable.
   *
   * @throws org.example.shortener.exception.BackendUnavailableException if it is not
   */
  void ping();

  /**
   * Prepares backend resources such as the database schema. No-op where nothing is needed.
   *
   * @throws org.example.shortener.exception.BackendUnavailableException if the backend cannot be
   *     reached
   */
  void bootstrap();

  /** Releases files, connections and pools held by the store. */
  @Override
  void close();
}
