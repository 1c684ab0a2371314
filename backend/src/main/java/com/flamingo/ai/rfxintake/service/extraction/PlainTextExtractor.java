package com.flamingo.ai.rfxintake.service.extraction;

import com.flamingo.ai.rfxintake.ingest.model.ClassifiedBlob;
import com.flamingo.ai.rfxintake.ingest.model.ExtractedFragment;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import lombok.extern.slf4j.Slf4j;
import org.apache.tika.parser.txt.CharsetDetector;
import org.apache.tika.parser.txt.CharsetMatch;
import org.springframework.stereotype.Component;

/** Decodes plain-text uploads: strict UTF-8 first, then Tika charset detection, then Latin-1. */
@Component
@Slf4j
public class PlainTextExtractor {

  private static final int MIN_DETECTION_CONFIDENCE = 30;

  public ExtractedFragment extract(ClassifiedBlob blob) {
    String text = decode(blob.blob().content());
    return ExtractedFragment.of(blob, text.replace("\r\n", "\n").strip(), 1);
  }

  static String decode(byte[] bytes) {
    try {
      String text =
          StandardCharsets.UTF_8
              .newDecoder()
              .onMalformedInput(CodingErrorAction.REPORT)
              .onUnmappableCharacter(CodingErrorAction.REPORT)
              .decode(ByteBuffer.wrap(bytes))
              .toString();
      return text.startsWith("\uFEFF") ? text.substring(1) : text;
    } catch (CharacterCodingException e) {
      log.debug("Input is not UTF-8, detecting charset");
    }

    CharsetDetector detector = new CharsetDetector();
    detector.setText(bytes);
    CharsetMatch match = detector.detect();
    if (match != null
        && match.getConfidence() >= MIN_DETECTION_CONFIDENCE
        && Charset.isSupported(match.getName())) {
      return new String(bytes, Charset.forName(match.getName()));
    }
    return new String(bytes, StandardCharsets.ISO_8859_1);
  }
}
