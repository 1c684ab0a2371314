package com.flamingo.ai.rfxintake.service.ocr;

import java.io.IOException;

/** Optical character recognition over a single image. */
public interface OcrEngine {

  /** Whether the engine can run in this process. Checked before every OCR pass. */
  boolean isAvailable();

  /**
   * Recognises text in an image.
   *
   * @param image encoded image bytes (PNG, JPEG, TIFF, ...)
   * @return recognised text, possibly empty
   */
  String recognize(byte[] image) throws IOException;
}
