package com.flamingo.ai.rfxintake.service.validation;

/**
 * A field that failed a check and was coerced or nulled. The record stays usable.
 *
 * @param field dotted path of the field, e.g. {@code requested_products[2].quantity}
 * @param code machine-readable reason
 * @param message human-readable detail
 */
public record ValidationIssue(String field, Code code, String message) {

  public enum Code {
    INVALID_NUMBER,
    NEGATIVE_NUMBER,
    UNKNOWN_CURRENCY,
    INVALID_DATE,
    INVALID_EMAIL,
    INVALID_RANGE,
    INVALID_ENUM,
    UNSUPPORTED_INPUT,
    FAILED_SOURCE
  }
}
