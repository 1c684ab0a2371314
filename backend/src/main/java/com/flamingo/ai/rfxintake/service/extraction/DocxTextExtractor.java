package com.flamingo.ai.rfxintake.service.extraction;

import com.flamingo.ai.rfxintake.ingest.model.ClassifiedBlob;
import com.flamingo.ai.rfxintake.ingest.model.ExtractedFragment;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import lombok.extern.slf4j.Slf4j;
import org.apache.tika.Tika;
import org.apache.tika.exception.TikaException;
import org.springframework.stereotype.Component;

/** Extracts paragraph and table text from Word documents through Tika's OOXML parser. */
@Component
@Slf4j
public class DocxTextExtractor {

  private static final Tika TIKA = new Tika();

  static {
    TIKA.setMaxStringLength(-1);
  }

  public ExtractedFragment extract(ClassifiedBlob blob) throws IOException, TikaException {
    String text;
    try (InputStream in = new ByteArrayInputStream(blob.blob().content())) {
      text = TIKA.parseToString(in);
    }
    String cleaned = collapseBlankLines(text);
    log.debug("Extracted {} chars from '{}'", cleaned.length(), blob.filename());
    return ExtractedFragment.of(blob, cleaned, 1);
  }

  private static String collapseBlankLines(String text) {
    return text.replace("\r\n", "\n")
        .replaceAll("[ \\t]+\\n", "\n")
        .replaceAll("\\n{3,}", "\n\n")
        .strip();
  }
}
