package com.flamingo.ai.rfxintake.service.extraction;

import com.flamingo.ai.rfxintake.ingest.model.ClassifiedBlob;
import com.flamingo.ai.rfxintake.ingest.model.ExtractedFragment;
import com.flamingo.ai.rfxintake.service.ocr.OcrFallbackEngine;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.tika.exception.TikaException;
import org.springframework.stereotype.Service;

/**
 * Extracts one classified blob, choosing the extractor by content kind.
 *
 * <p>Never throws for bad input: a file that cannot be read becomes an empty fragment with {@code
 * extractionSucceeded = false}, so one broken attachment cannot sink the request.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FragmentExtractor {

  private final PdfTextExtractor pdfTextExtractor;
  private final DocxTextExtractor docxTextExtractor;
  private final PlainTextExtractor plainTextExtractor;
  private final SpreadsheetParser spreadsheetParser;
  private final OcrFallbackEngine ocrFallbackEngine;
  private final MeterRegistry meterRegistry;

  public ExtractedFragment extract(ClassifiedBlob blob) {
    ExtractedFragment fragment;
    try {
      fragment =
          switch (blob.kind()) {
            case PDF -> ocrFallbackEngine.maybeOcr(blob, pdfTextExtractor.extract(blob));
            case IMAGE -> ocrFallbackEngine.maybeOcr(blob, ExtractedFragment.of(blob, "", 1));
            case DOCX -> docxTextExtractor.extract(blob);
            case PLAIN_TEXT -> plainTextExtractor.extract(blob);
            case SPREADSHEET_XLSX, SPREADSHEET_CSV -> spreadsheetParser.parse(blob);
            case ARCHIVE_ZIP, UNKNOWN -> ExtractedFragment.empty(blob, false);
          };
    } catch (IOException | TikaException | RuntimeException e) {
      log.warn(
          "Extraction failed for '{}' ({}): {}", blob.filename(), blob.kind(), e.getMessage());
      fragment = ExtractedFragment.empty(blob, false);
    }

    meterRegistry
        .counter(
            "intake.fragments",
            "kind",
            blob.kind().name().toLowerCase(Locale.ROOT),
            "outcome",
            fragment.extractionSucceeded() ? "success" : "failure")
        .increment();
    return fragment;
  }
}
