package org.example.shortener.exception;

/**
 * Thrown when the backing resource (journal file, database) cannot be reached.
 *
 * <p>Fatal when raised from {@code bootstrap()} during startup; at request time the caller may
 * decide to retry.
 */
public class BackendUnavailableException extends StoreException {

  public BackendUnavailableException(String message) {
    super(message);
  }

  public BackendUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
