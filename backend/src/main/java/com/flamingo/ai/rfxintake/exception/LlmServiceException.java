package com.flamingo.ai.rfxintake.exception;

/**
 * A single model call failed, either at the transport level or because the response did not
 * conform to the extraction schema. Always retried by the caller within its attempt budget.
 */
public class LlmServiceException extends RuntimeException {

  private final boolean schemaViolation;

  public LlmServiceException(String message, Throwable cause) {
    super(message, cause);
    this.schemaViolation = false;
  }

  private LlmServiceException(String message, boolean schemaViolation) {
    super(message);
    this.schemaViolation = schemaViolation;
  }

  public static LlmServiceException schemaViolation(String message) {
    return new LlmServiceException(message, true);
  }

  public boolean isSchemaViolation() {
    return schemaViolation;
  }
}
