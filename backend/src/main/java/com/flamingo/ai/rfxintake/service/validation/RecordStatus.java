package com.flamingo.ai.rfxintake.service.validation;

/** Outcome classification of a validated record. */
public enum RecordStatus {
  /** Extraction succeeded and no field needed correction. */
  COMPLETE,
  /** Usable record with at least one validation issue. */
  NEEDS_REVIEW,
  /** No line items and no client information: the documents likely held no RFX content. */
  EMPTY_EXTRACTION
}
