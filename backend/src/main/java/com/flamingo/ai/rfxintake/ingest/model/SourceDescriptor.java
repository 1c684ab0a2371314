package com.flamingo.ai.rfxintake.ingest.model;

/** Per-file summary reported back to the caller alongside the extracted record. */
public record SourceDescriptor(
    String filename,
    ContentKind kind,
    boolean usedOcrFallback,
    boolean extractionSucceeded,
    int characters) {

  public static SourceDescriptor from(ExtractedFragment fragment) {
    return new SourceDescriptor(
        fragment.filename(),
        fragment.kind(),
        fragment.usedOcrFallback(),
        fragment.extractionSucceeded(),
        fragment.text().length());
  }
}
