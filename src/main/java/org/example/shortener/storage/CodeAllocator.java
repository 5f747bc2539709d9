package org.example.shortener.storage;

import java.util.Objects;
import org.example.shortener.exception.AllocationExhaustedException;
import org.example.shortener.util.CodeGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Retry loop shared by every store: generate a code, try to insert it, and react to the outcome.
 *
 * <p>Backends differ only in how one attempt is carried out, which they supply as an {@link
 * InsertAttempt}. The loop itself decides the policy:
 *
 * <ol>
 *   <li>{@link Outcome#INSERTED} – done, the fresh code is returned.
 *   <li>{@link Outcome#URL_EXISTS} – the URL already has a code; stop immediately and return that
 *       code as a conflict.
 *   <li>{@link Outcome#CODE_TAKEN} – the candidate collided; try again with a new code.
 * </ol>
 *
 * <p>After {@code maxAttempts} collisions an {@link AllocationExhaustedException} is thrown.
 * Instances are immutable and thread-safe.
 */
public final class CodeAllocator {

  private static final Logger LOG = LoggerFactory.getLogger(CodeAllocator.class);

  /** Default number of characters in a short code. */
  public static final int DEFAULT_CODE_LENGTH = 8;

  /** Default retry budget per URL. */
  public static final int DEFAULT_MAX_ATTEMPTS = 5;

  private final CodeGenerator generator;
  private final int codeLength;
  private final int maxAttempts;

  public CodeAllocator(CodeGenerator generator, int codeLength, int maxAttempts) {
    this.generator = Objects.requireNonNull(generator, "generator");
    if (codeLength <= 0) throw new IllegalArgumentException("codeLength must be positive");
    if (maxAttempts <= 0) throw new IllegalArgumentException("maxAttempts must be positive");
    this.codeLength = codeLength;
    this.maxAttempts = maxAttempts;
  }

  /** @return allocator with a secure generator, 8-character codes and 5 attempts */
  public static CodeAllocator defaults() {
    return new CodeAllocator(CodeGenerator.secure(), DEFAULT_CODE_LENGTH, DEFAULT_MAX_ATTEMPTS);
  }

  /**
   * Runs the allocation loop.
   *
   * @param attempt backend-specific "insert if absent" step
   * @param <E> checked exception the attempt may throw; propagated unchanged
   * @return the allocated or pre-existing code
   * @throws E when an attempt fails for a reason other than a collision
   * @throws AllocationExhaustedException when every attempt collided
   */
  public <E extends Exception> Allocation allocate(InsertAttempt<E> attempt) throws E {
    for (int i = 1; i <= maxAttempts; i++) {
      String candidate = generator.generate(codeLength);
      AttemptResult r = attempt.tryInsert(candidate);
      switch (r.outcome) {
        case INSERTED -> {
          return new Allocation(r.code, false);
        }
        case URL_EXISTS -> {
          return new Allocation(r.code, true);
        }
        default -> LOG.debug("Short code collision on attempt {}/{}", i, maxAttempts);
      }
    }
    LOG.warn("Short code allocation exhausted after {} attempts", maxAttempts);
    throw new AllocationExhaustedException(maxAttempts);
  }

  public int getCodeLength() {
    return codeLength;
  }

  public int getMaxAttempts() {
    return maxAttempts;
  }

  /**
   * One backend-specific insertion attempt.
   *
   * @param <E> checked exception type the backend may raise
   */
  @FunctionalInterface
  public interface InsertAttempt<E extends Exception> {
    /**
     * @param candidate freshly generated code
     * @return what happened to the candidate
     */
    AttemptResult tryInsert(String candidate) throws E;
  }

  /** Possible results of one attempt. */
  public enum Outcome {
    INSERTED,
    CODE_TAKEN,
    URL_EXISTS
  }

  /** Result of one {@link InsertAttempt}. */
  public static final class AttemptResult {
    private static final AttemptResult TAKEN = new AttemptResult(Outcome.CODE_TAKEN, null);

    final Outcome outcome;
    final String code;

    private AttemptResult(Outcome outcome, String code) {
      this.outcome = outcome;
      this.code = code;
    }

    /** @param code the candidate that was stored */
    public static AttemptResult inserted(String code) {
      return new AttemptResult(Outcome.INSERTED, code);
    }

    /** The candidate is already in use. */
    public static AttemptResult codeTaken() {
      return TAKEN;
    }

    /** @param existingCode the code already assigned to the URL */
    public static AttemptResult urlExists(String existingCode) {
      return new AttemptResult(Outcome.URL_EXISTS, existingCode);
    }

    public Outcome getOutcome() {
      return outcome;
    }
  }

  /** Final result of {@link #allocate}. */
  public static final class Allocation {
    private final String code;
    private final boolean existing;

    Allocation(String code, boolean existing) {
      this.code = code;
      this.existing = existing;
    }

    public String getCode() {
      return code;
    }

    /** @return {@code true} if the code belonged to the URL before this call */
    public boolean isExisting() {
      return existing;
    }
  }
}
