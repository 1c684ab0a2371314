package com.flamingo.ai.rfxintake.service.extraction;

import com.flamingo.ai.rfxintake.ingest.model.ClassifiedBlob;
import com.flamingo.ai.rfxintake.ingest.model.ExtractedFragment;
import java.io.IOException;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Component;

/**
 * Reads the text layer of a PDF with PDFBox, page by page.
 *
 * <p>Pages with text are prefixed with a {@code --- Page N ---} line. Pages without a text layer
 * contribute nothing, so a fully scanned document yields an empty fragment and the real page count
 * for the OCR heuristic.
 */
@Component
@Slf4j
public class PdfTextExtractor {

  public ExtractedFragment extract(ClassifiedBlob blob) throws IOException {
    try (PDDocument document = Loader.loadPDF(blob.blob().content())) {
      int pageCount = document.getNumberOfPages();
      PDFTextStripper stripper = new PDFTextStripper();
      stripper.setSortByPosition(true);

      StringBuilder text = new StringBuilder();
      for (int page = 1; page <= pageCount; page++) {
        stripper.setStartPage(page);
        stripper.setEndPage(page);
        String pageText = stripper.getText(document).strip();
        if (!pageText.isEmpty()) {
          text.append("--- Page ").append(page).append(" ---\n").append(pageText).append("\n\n");
        }
      }

      log.debug(
          "Extracted {} chars from {} pages of '{}'", text.length(), pageCount, blob.filename());
      return ExtractedFragment.of(blob, text.toString().strip(), pageCount);
    }
  }
}
