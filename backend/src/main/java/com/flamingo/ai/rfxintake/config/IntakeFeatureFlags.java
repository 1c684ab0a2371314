package com.flamingo.ai.rfxintake.config;

/**
 * Immutable feature flags handed to pipeline stages at construction.
 *
 * @param useOcr run the OCR fallback for low-yield PDFs and images
 * @param useZip expand ZIP archives one level deep
 */
public record IntakeFeatureFlags(boolean useOcr, boolean useZip) {

  public static IntakeFeatureFlags defaults() {
    return new IntakeFeatureFlags(true, true);
  }
}
