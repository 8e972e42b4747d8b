package com.flamingo.ai.quotes.exception;

/** Exception thrown when a classification call keeps failing after every allowed attempt. */
public class ClassificationException extends RuntimeException {

  private final String operation;
  private final int attempts;

  public ClassificationException(String operation, int attempts, Throwable cause) {
    super(
        String.format(
            "Classification '%s' failed after %d attempts: %s",
            operation, attempts, cause.getMessage()),
        cause);
    this.operation = operation;
    this.attempts = attempts;
  }

  public String getOperation() {
    return operation;
  }

  public int getAttempts() {
    return attempts;
  }
}
