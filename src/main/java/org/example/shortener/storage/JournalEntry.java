package org.example.shortener.storage;

import com.google.gson.annotations.SerializedName;
import java.time.Instant;
import org.example.shortener.model.UrlRecord;

/**
 * One line of the URL journal as it appears on disk.
 *
 * <p>Field names follow the journal format ({@code uuid}, {@code short_url}, {@code
 * original_url}, {@code user_id}, {@code is_deleted}); {@code uuid} is reserved and always written
 * empty. The timestamps are optional: lines written without them still load.
 */
final class JournalEntry {

  @SerializedName("uuid")
  String uuid = "";

  @SerializedName("short_url")
  String shortUrl;

  @SerializedName("original_url")
  String originalUrl;

  @SerializedName("user_id")
  String userId;

  @SerializedName("is_deleted")
  boolean deleted;

  @SerializedName("created_at")
  Instant createdAt;

  @SerializedName("deleted_at")
  Instant deletedAt;

  static JournalEntry of(UrlRecord r) {
    JournalEntry e = new JournalEntry();
    e.shortUrl = r.shortCode;
    e.originalUrl = r.originalUrl;
    e.userId = r.ownerId;
    e.deleted = r.deleted;
    e.createdAt = r.createdAt;
    e.deletedAt = r.deletedAt;
    return e;
  }

  UrlRecord toRecord() {
    UrlRecord r = new UrlRecord(shortUrl, originalUrl, userId, createdAt);
    r.deleted = deleted;
    r.deletedAt = deletedAt;
    return r;
  }
}
