package org.example.shortener.exception;

/**
 * Thrown when every allocation attempt collided with an existing short code.
 *
 * <p>Callers should report this as a server-side error: the input was fine, the code space was
 * not.
 */
public class AllocationExhaustedException extends StoreException {

  private final int attempts;

  /**
   * @param attempts how many codes were tried before giving up
   */
  public AllocationExhaustedException(int attempts) {
    super("Could not allocate a unique short code after " + attempts + " attempts");
    this.attempts = attempts;
  }

  /** @return number of attempts made */
  public int getAttempts() {
    return attempts;
  }
}
