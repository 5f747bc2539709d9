package org.example.shortener.util;

import java.security.SecureRandom;
import org.example.shortener.exception.CodeGenerationException;

/**
 * {@link CodeGenerator} drawing every character uniformly from the 62-character alphanumeric
 * alphabet with a {@link SecureRandom}.
 *
 * <p>A cryptographically strong source keeps one owner from predicting the codes handed to
 * another. {@link SecureRandom} is thread-safe, so a single instance is shared by all callers.
 */
public final class SecureCodeGenerator implements CodeGenerator {

  static final char[] ALPHABET =
      "abcdefghijklmnopqrstuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789".toCharArray();

  private final SecureRandom random;

  public SecureCodeGenerator() {
    this(new SecureRandom());
  }

  SecureCodeGenerator(SecureRandom random) {
    this.random = random;
  }

  @Override
  public String generate(int length) {
    if (length <= 0) {
      throw new IllegalArgumentException("Code length must be positive: " + length);
    }
    char[] c = new char[length];
    try {
      for (int i = 0; i < length; i++) c[i] = ALPHABET[random.nextInt(ALPHABET.length)];
    } catch (RuntimeException e) {
      // SecureRandom reports a broken entropy source with unchecked provider exceptions
      throw new CodeGenerationException("Random source failed while generating a short code", e);
    }
    return new String(c);
  }
}
