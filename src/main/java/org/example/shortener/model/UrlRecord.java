package org.example.shortener.model;

import java.time.Instant;

/**
 * A single shortening kept by a {@link org.example.shortener.storage.UrlStore}.
 *
 * <p>A record binds an original URL to its short code and remembers who submitted it. It is
 * created once when a code is allocated and afterwards only ever tombstoned; codes are never
 * reused, so records are never physically removed.
 *
 * <p>Fields are public to keep the model a plain data holder. Stores own their instances and hand
 * out {@link #copy()}s, so callers may modify what they receive without affecting stored state.
 *
 * <h2>Fields overview</h2>
 *
 * <ul>
 *   <li>{@code shortCode} – random alphanumeric code, unique per store.
 *   <li>{@code originalUrl} – the submitted URL, unique per store.
 *   <li>{@code ownerId} – opaque owner identifier; empty for anonymous submissions.
 *   <li>{@code deleted} – tombstone flag; once {@code true} it stays {@code true}.
 *   <li>{@code createdAt} – allocation time.
 *   <li>{@code deletedAt} – tombstone time; {@code null} while the record is live.
 * </ul>
 */
public class UrlRecord {

  /** Short code appended to the base URL. */
  public String shortCode;

  /** The URL the code resolves to. */
  public String originalUrl;

  /** Owner that submitted the URL; may be empty. */
  public String ownerId;

  /** Whether the owner deleted this record. */
  public boolean deleted;

  /** When the code was allocated. */
  public Instant createdAt;

  /** When the record was tombstoned; {@code null} if live. */
  public Instant deletedAt;

  public UrlRecord() {}

  /**
   * Creates a live record.
   *
   * @param shortCode allocated code
   * @param originalUrl submitted URL
   * @param ownerId owner identifier, {@code null} is stored as empty
   * @param createdAt allocation time
   */
  public UrlRecord(String shortCode, String originalUrl, String ownerId, Instant createdAt) {
    this.shortCode = shortCode;
    this.originalUrl = originalUrl;
    this.ownerId = ownerId == null ? "" : ownerId;
    this.createdAt = createdAt;
  }

  /** @return a detached copy of this record */
  public UrlRecord copy() {
    UrlRecord c = new UrlRecord(shortCode, originalUrl, ownerId, createdAt);
    c.deleted = deleted;
    c.deletedAt = deletedAt;
    return c;
  }

  /**
   * Returns a tombstoned copy. The receiver is left untouched so that stores can persist the new
   * state before publishing it.
   *
   * @param at deletion time
   * @return a copy with {@code deleted = true} and {@code deletedAt = at}
   */
  public UrlRecord tombstoned(Instant at) {
    UrlRecord c = copy();
    c.deleted = true;
    c.deletedAt = at;
    return c;
  }

  /**
   * @param ownerId owner to compare with
   * @return {@code true} if {@code ownerId} is non-empty and equals this record's owner
   */
  public boolean isOwnedBy(String ownerId) {
    return ownerId != null && !ownerId.isEmpty() && ownerId.equals(this.ownerId);
  }

  @Override
  public String toString() {
    return "UrlRecord{"
        + "shortCode='"
        + shortCode
        + "', originalUrl='"
        + originalUrl
        + "', ownerId='"
        + ownerId
        + "', deleted="
        + deleted
        + '}';
  }
}
