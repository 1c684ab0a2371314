package com.flamingo.ai.rfxintake.service.ocr;

import com.flamingo.ai.rfxintake.config.IntakeConfig;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import javax.imageio.ImageIO;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;
import org.springframework.stereotype.Component;
import org.springframework.util.ClassUtils;

/** Renders PDF pages to grayscale PNGs with PDFBox, up to the configured page cap. */
@Component
@Slf4j
public class PdfBoxPageRasterizer implements PageRasterizer {

  private static final String RENDERER_CLASS = "org.apache.pdfbox.rendering.PDFRenderer";

  private final int dpi;
  private final int maxPages;

  public PdfBoxPageRasterizer(IntakeConfig intakeConfig) {
    this.dpi = intakeConfig.getOcr().getDpi();
    this.maxPages = intakeConfig.getOcr().getMaxPages();
  }

  @Override
  public boolean isAvailable() {
    return ClassUtils.isPresent(RENDERER_CLASS, getClass().getClassLoader());
  }

  @Override
  public List<byte[]> rasterize(byte[] pdf) throws IOException {
    try (PDDocument document = Loader.loadPDF(pdf)) {
      PDFRenderer renderer = new PDFRenderer(document);
      int pages = Math.min(document.getNumberOfPages(), maxPages);
      if (document.getNumberOfPages() > maxPages) {
        log.info(
            "Rasterizing first {} of {} pages for OCR", maxPages, document.getNumberOfPages());
      }

      List<byte[]> images = new ArrayList<>(pages);
      for (int page = 0; page < pages; page++) {
        BufferedImage image = renderer.renderImageWithDPI(page, dpi, ImageType.GRAY);
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ImageIO.write(image, "png", out);
        images.add(out.toByteArray());
      }
      return images;
    }
  }
}
