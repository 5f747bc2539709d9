package org.example.shortener.exception;

/**
 * Thrown when a short code exists but was deleted by its owner.
 *
 * <p>Kept separate from {@link LinkNotFoundException} so that an HTTP front end can answer {@code
 * 410 Gone} instead of {@code 404}.
 */
public class LinkGoneException extends RuntimeException {

  private final String code;

  /**
   * @param code the tombstoned short code
   */
  public LinkGoneException(String code) {
    super("Short link was deleted: " + code);
    this.code = code;
  }

  public String getCode() {
    return code;
  }
}
