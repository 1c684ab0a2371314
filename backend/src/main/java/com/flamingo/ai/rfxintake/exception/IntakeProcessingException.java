package com.flamingo.ai.rfxintake.exception;

/** Unexpected failure inside the intake pipeline itself. */
public class IntakeProcessingException extends RuntimeException {

  private final String userMessage;

  public IntakeProcessingException(String message, Throwable cause) {
    super(message, cause);
    this.userMessage = "Failed to process documents";
  }

  public String getUserMessage() {
    return userMessage;
  }
}
