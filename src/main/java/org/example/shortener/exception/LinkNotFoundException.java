package org.example.shortener.exception;

/**
 * Thrown when a short code was never allocated.
 *
 * <p>An HTTP front end maps this to {@code 404 Not Found}.
 */
public class LinkNotFoundException extends RuntimeException {

  private final String code;

  /**
   * @param code the short code that was looked up
   */
  public LinkNotFoundException(String code) {
    super("Short link not found: " + code);
    this.code = code;
  }

  public String getCode() {
    return code;
  }
}
