package com.flamingo.ai.rfxintake.exception;

/** Thrown when the model call exhausted its attempts without a schema-conformant response. */
public class ExtractionFailedException extends RuntimeException {

  private final int attempts;
  private final String userMessage;

  public ExtractionFailedException(String message, int attempts, Throwable cause) {
    super(message, cause);
    this.attempts = attempts;
    this.userMessage =
        "Could not extract structured data from the documents. Please try again later.";
  }

  public int getAttempts() {
    return attempts;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
