package org.example.shortener.exception;

/** Thrown when the random source behind a code generator fails. Not retried. */
public class CodeGenerationException extends StoreException {

  public CodeGenerationException(String message, Throwable cause) {
    super(message, cause);
  }
}
