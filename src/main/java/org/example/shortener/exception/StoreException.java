package org.example.shortener.exception;

/**
 * Base type for every failure raised by a {@link org.example.shortener.storage.UrlStore}.
 *
 * <p>Backend I/O and SQL errors that have no more specific type are wrapped in this class with
 * their original cause attached. A resubmitted URL is not a failure and never surfaces here; see
 * {@link org.example.shortener.model.SaveResult#isConflict()}.
 */
public class StoreException extends RuntimeException {

  /**
   * @param message what the store was doing when it failed
   */
  public StoreException(String message) {
    super(message);
  }

  /**
   * @param message what the store was doing when it failed
   * @param cause the underlying I/O or SQL error
   */
  public StoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
