package com.flamingo.ai.rfxintake.exception;

import java.time.Duration;

/** Thrown when an intake request runs past its request-level timeout. */
public class PipelineTimeoutException extends RuntimeException {

  private final Duration timeout;
  private final String stage;
  private final String userMessage;

  public PipelineTimeoutException(String stage, Duration timeout) {
    super("Intake request timed out after " + timeout.toMillis() + " ms during " + stage);
    this.timeout = timeout;
    this.stage = stage;
    this.userMessage = "Processing the documents took too long. Please try again with fewer files.";
  }

  public Duration getTimeout() {
    return timeout;
  }

  public String getStage() {
    return stage;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
