package com.flamingo.ai.quotes.exception;

/**
 * Exception thrown when a model answers but the answer is empty, is not JSON, or breaks the
 * response schema. Retried like any transport failure.
 */
public class MalformedModelResponseException extends RuntimeException {

  public MalformedModelResponseException(String message) {
    super(message);
  }

  public MalformedModelResponseException(String message, Throwable cause) {
    super(message, cause);
  }
}
