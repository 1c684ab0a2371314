package com.flamingo.ai.rfxintake.service.ocr;

import com.flamingo.ai.rfxintake.config.IntakeConfig;
import com.flamingo.ai.rfxintake.config.IntakeFeatureFlags;
import com.flamingo.ai.rfxintake.ingest.model.ClassifiedBlob;
import com.flamingo.ai.rfxintake.ingest.model.ContentKind;
import com.flamingo.ai.rfxintake.ingest.model.ExtractedFragment;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Re-reads scanned PDFs and images with OCR when their text layer is too thin.
 *
 * <p>OCR runs when the primary fragment has fewer than {@code minCharsPerPage} non-whitespace
 * characters per page. PDFs are rasterised and every rendered page is recognised once; images are
 * recognised directly. The OCR text replaces the primary text only when it is longer.
 *
 * <p>OCR is an enhancement: a missing engine or rasteriser, a disabled flag or a failing OCR pass
 * all return the primary fragment untouched.
 */
@Component
@Slf4j
public class OcrFallbackEngine {

  private final OcrEngine ocrEngine;
  private final PageRasterizer rasterizer;
  private final int minCharsPerPage;
  private final MeterRegistry meterRegistry;

  @Autowired
  public OcrFallbackEngine(
      OcrEngine ocrEngine,
      PageRasterizer rasterizer,
      IntakeConfig intakeConfig,
      MeterRegistry meterRegistry) {
    this(
        ocrEngine,
        rasterizer,
        intakeConfig.featureFlags(),
        intakeConfig.getOcr().getMinCharsPerPage(),
        meterRegistry);
  }

  public OcrFallbackEngine(
      OcrEngine ocrEngine,
      PageRasterizer rasterizer,
      IntakeFeatureFlags flags,
      int minCharsPerPage,
      MeterRegistry meterRegistry) {
    // a disabled flag takes the same path as an engine that is not installed
    this.ocrEngine = flags.useOcr() ? ocrEngine : UnavailableOcrEngine.INSTANCE;
    this.rasterizer = rasterizer;
    this.minCharsPerPage = minCharsPerPage;
    this.meterRegistry = meterRegistry;
  }

  public ExtractedFragment maybeOcr(ClassifiedBlob blob, ExtractedFragment primary) {
    ContentKind kind = primary.kind();
    if (kind != ContentKind.PDF && kind != ContentKind.IMAGE) {
      return primary;
    }

    int threshold = minCharsPerPage * primary.pageCount();
    if (primary.textYield() >= threshold) {
      countOutcome("skipped");
      return primary;
    }

    if (!ocrEngine.isAvailable() || (kind == ContentKind.PDF && !rasterizer.isAvailable())) {
      log.warn("OCR unavailable, keeping primary text for '{}'", blob.filename());
      countOutcome("unavailable");
      return primary;
    }

    String ocrText;
    try {
      ocrText =
          kind == ContentKind.PDF
              ? recognizePages(blob)
              : ocrEngine.recognize(blob.blob().content());
    } catch (IOException | RuntimeException | LinkageError e) {
      log.warn("OCR failed for '{}', keeping primary text: {}", blob.filename(), e.getMessage());
      countOutcome("failed");
      return primary;
    }

    int ocrYield = ExtractedFragment.nonWhitespaceLength(ocrText);
    if (ocrYield <= primary.textYield()) {
      log.debug(
          "OCR yield {} did not beat primary yield {} for '{}'",
          ocrYield,
          primary.textYield(),
          blob.filename());
      countOutcome("not_better");
      return primary;
    }

    log.info("OCR recovered {} chars for '{}'", ocrYield, blob.filename());
    countOutcome("replaced");
    return primary.withOcrText(ocrText);
  }

  private String recognizePages(ClassifiedBlob blob) throws IOException {
    List<byte[]> pages = rasterizer.rasterize(blob.blob().content());
    StringBuilder text = new StringBuilder();
    for (int i = 0; i < pages.size(); i++) {
      String pageText;
      try {
        pageText = ocrEngine.recognize(pages.get(i)).strip();
      } catch (IOException | RuntimeException e) {
        log.warn("OCR failed on page {} of '{}': {}", i + 1, blob.filename(), e.getMessage());
        continue;
      }
      if (!pageText.isEmpty()) {
        text.append("--- Page ").append(i + 1).append(" (OCR) ---\n");
        text.append(pageText).append("\n\n");
      }
    }
    return text.toString().strip();
  }

  private void countOutcome(String outcome) {
    meterRegistry.counter("intake.ocr.fallback", "outcome", outcome).increment();
  }
}
