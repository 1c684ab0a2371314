package com.flamingo.ai.rfxintake.service.ocr;

/** Engine used when OCR is switched off; indistinguishable from a missing Tesseract install. */
enum UnavailableOcrEngine implements OcrEngine {
  INSTANCE;

  @Override
  public boolean isAvailable() {
    return false;
  }

  @Override
  public String recognize(byte[] image) {
    throw new IllegalStateException("OCR is not available");
  }
}
