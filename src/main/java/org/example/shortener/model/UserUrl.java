package org.example.shortener.model;

import java.util.Objects;

/**
 * Read-only listing entry: one live short URL of an owner together with its target.
 *
 * <p>Produced on demand by {@link org.example.shortener.storage.UrlStore#loadUserUrls}; never
 * persisted.
 */
public final class UserUrl {

  private final String shortUrl;
  private final String originalUrl;

  public UserUrl(String shortUrl, String originalUrl) {
    this.shortUrl = shortUrl;
    this.originalUrl = originalUrl;
  }

  /** @return fully-qualified short URL */
  public String getShortUrl() {
    return shortUrl;
  }

  public String getOriginalUrl() {
    return originalUrl;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof UserUrl)) return false;
    UserUrl other = (UserUrl) o;
    return shortUrl.equals(other.shortUrl) && originalUrl.equals(other.originalUrl);
  }

  @Override
  public int hashCode() {
    return Objects.hash(shortUrl, originalUrl);
  }

  @Override
  public String toString() {
    return shortUrl + " -> " + originalUrl;
  }
}
