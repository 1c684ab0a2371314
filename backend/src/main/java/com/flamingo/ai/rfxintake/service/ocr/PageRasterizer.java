package com.flamingo.ai.rfxintake.service.ocr;

import java.io.IOException;
import java.util.List;

/** Renders PDF pages to images for OCR. */
public interface PageRasterizer {

  boolean isAvailable();

  /**
   * Renders the leading pages of a PDF.
   *
   * @param pdf PDF bytes
   * @return one encoded image per rendered page, in page order
   */
  List<byte[]> rasterize(byte[] pdf) throws IOException;
}
