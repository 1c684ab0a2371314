package com.flamingo.ai.rfxintake.service.ocr;

import com.flamingo.ai.rfxintake.config.IntakeConfig;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.apache.tika.Tika;
import org.apache.tika.exception.TikaConfigException;
import org.apache.tika.exception.TikaException;
import org.apache.tika.metadata.Metadata;
import org.apache.tika.parser.ParseContext;
import org.apache.tika.parser.ocr.TesseractOCRConfig;
import org.apache.tika.parser.ocr.TesseractOCRParser;
import org.apache.tika.sax.BodyContentHandler;
import org.springframework.stereotype.Component;
import org.xml.sax.SAXException;

/**
 * {@link OcrEngine} running the Tesseract binary through Tika's OCR parser.
 *
 * <p>Availability is checked once, on first use: Tika reports no supported types when the {@code
 * tesseract} executable cannot be found.
 */
@Component
@Slf4j
public class TesseractOcrEngine implements OcrEngine {

  private static final Tika TIKA = new Tika();

  private final TesseractOCRConfig ocrConfig;
  private volatile TesseractOCRParser parser;
  private volatile Boolean available;

  public TesseractOcrEngine(IntakeConfig intakeConfig) {
    IntakeConfig.Ocr ocr = intakeConfig.getOcr();
    this.ocrConfig = new TesseractOCRConfig();
    this.ocrConfig.setLanguage(ocr.getLanguage());
    this.ocrConfig.setTimeoutSeconds(ocr.getTimeoutSeconds());
  }

  @Override
  public boolean isAvailable() {
    Boolean result = available;
    if (result == null) {
      synchronized (this) {
        if (available == null) {
          available = checkAvailability();
        }
        result = available;
      }
    }
    return result;
  }

  private boolean checkAvailability() {
    try {
      TesseractOCRParser candidate = new TesseractOCRParser();
      candidate.initialize(Map.of());
      ParseContext context = new ParseContext();
      context.set(TesseractOCRConfig.class, ocrConfig);
      if (candidate.getSupportedTypes(context).isEmpty()) {
        log.warn("Tesseract executable not found, OCR fallback disabled");
        return false;
      }
      parser = candidate;
      log.info("Tesseract OCR available (language {})", ocrConfig.getLanguage());
      return true;
    } catch (TikaConfigException | RuntimeException | LinkageError e) {
      log.warn("Tesseract OCR could not be initialised, OCR fallback disabled: {}", e.toString());
      return false;
    }
  }

  @Override
  public String recognize(byte[] image) throws IOException {
    if (!isAvailable()) {
      throw new IllegalStateException("Tesseract OCR is not available");
    }
    Metadata metadata = new Metadata();
    metadata.set(Metadata.CONTENT_TYPE, TIKA.detect(image));
    ParseContext context = new ParseContext();
    context.set(TesseractOCRConfig.class, ocrConfig);
    BodyContentHandler handler = new BodyContentHandler(-1);

    try (InputStream in = new ByteArrayInputStream(image)) {
      parser.parse(in, handler, metadata, context);
    } catch (SAXException | TikaException e) {
      throw new IOException("Tesseract OCR failed: " + e.getMessage(), e);
    }
    return handler.toString().strip();
  }
}
