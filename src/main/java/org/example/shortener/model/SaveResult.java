package org.example.shortener.model;

import java.util.Objects;

/**
 * Outcome of saving one URL.
 *
 * <p>Both outcomes carry a usable short URL. {@link #isConflict()} tells a freshly allocated code
 * apart from the code that was already assigned to the same URL earlier; an HTTP front end
 * answers {@code 201 Created} for the former and {@code 409 Conflict} for the latter.
 */
public final class SaveResult {

  private final String shortUrl;
  private final boolean conflict;

  private SaveResult(String shortUrl, boolean conflict) {
    this.shortUrl = Objects.requireNonNull(shortUrl, "shortUrl");
    this.conflict = conflict;
  }

  /**
   * @param shortUrl fully-qualified URL of a newly allocated code
   * @return a created outcome
   */
  public static SaveResult created(String shortUrl) {
    return new SaveResult(shortUrl, false);
  }

  /**
   * @param shortUrl fully-qualified URL of the code the URL already had
   * @return a conflict outcome
   */
  public static SaveResult conflict(String shortUrl) {
    return new SaveResult(shortUrl, true);
  }

  public String getShortUrl() {
    return shortUrl;
  }

  /** @return {@code true} if the URL was already stored and no new code was minted */
  public boolean isConflict() {
    return conflict;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof SaveResult)) return false;
    SaveResult other = (SaveResult) o;
    return conflict == other.conflict && shortUrl.equals(other.shortUrl);
  }

  @Override
  public int hashCode() {
    return Objects.hash(shortUrl, conflict);
  }

  @Override
  public String toString() {
    return (conflict ? "CONFLICT " : "CREATED ") + shortUrl;
  }
}
