package com.flamingo.ai.rfxintake.ingest.model;

import java.util.List;

/**
 * Text extracted from a single classified blob.
 *
 * @param ordinal index of the uploaded file the text came from
 * @param sequence position inside an expanded archive, 0 for top-level uploads
 * @param filename source filename
 * @param kind detected content kind
 * @param text extracted text, never null
 * @param usedOcrFallback whether {@code text} came from OCR
 * @param extractionSucceeded false when the extractor failed or degraded
 * @param pageCount pages (PDF) or images the text was read from, at least 1
 * @param rows canonical rows for spreadsheet sources, empty otherwise
 */
public record ExtractedFragment(
    int ordinal,
    int sequence,
    String filename,
    ContentKind kind,
    String text,
    boolean usedOcrFallback,
    boolean extractionSucceeded,
    int pageCount,
    List<SpreadsheetRow> rows) {

  public ExtractedFragment {
    text = text == null ? "" : text;
    pageCount = Math.max(1, pageCount);
    rows = rows == null ? List.of() : List.copyOf(rows);
  }

  public static ExtractedFragment of(ClassifiedBlob source, String text, int pageCount) {
    return new ExtractedFragment(
        source.ordinal(),
        source.sequence(),
        source.filename(),
        source.kind(),
        text,
        false,
        true,
        pageCount,
        List.of());
  }

  public static ExtractedFragment ofRows(
      ClassifiedBlob source, String text, List<SpreadsheetRow> rows) {
    return new ExtractedFragment(
        source.ordinal(),
        source.sequence(),
        source.filename(),
        source.kind(),
        text,
        false,
        true,
        1,
        rows);
  }

  /** An empty fragment; {@code succeeded} is false when extraction failed or degraded. */
  public static ExtractedFragment empty(ClassifiedBlob source, boolean succeeded) {
    return new ExtractedFragment(
        source.ordinal(),
        source.sequence(),
        source.filename(),
        source.kind(),
        "",
        false,
        succeeded,
        1,
        List.of());
  }

  public ExtractedFragment withOcrText(String ocrText) {
    return new ExtractedFragment(
        ordinal, sequence, filename, kind, ocrText, true, true, pageCount, rows);
  }

  /** Number of non-whitespace characters in {@link #text()}. */
  public int textYield() {
    return nonWhitespaceLength(text);
  }

  public static int nonWhitespaceLength(String value) {
    if (value == null) {
      return 0;
    }
    int count = 0;
    for (int i = 0; i < value.length(); i++) {
      if (!Character.isWhitespace(value.charAt(i))) {
        count++;
      }
    }
    return count;
  }
}
