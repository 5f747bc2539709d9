package org.example.shortener.util;

/**
 * Source of candidate short codes.
 *
 * <p>Implementations must be safe for concurrent use. Uniqueness is not their concern: the
 * allocation engine checks every candidate against the store and asks for another one on a
 * collision.
 */
@FunctionalInterface
public interface CodeGenerator {

  /**
   * Produces a code of exactly {@code length} alphanumeric characters.
   *
   * @param length number of characters, positive
   * @return a fresh candidate code
   * @throws org.example.shortener.exception.CodeGenerationException if the random source fails
   */
  String generate(int length);

  /** @return the default generator backed by {@link java.security.SecureRandom} */
  static CodeGenerator secure() {
    return new SecureCodeGenerator();
  }
}
