package com.flamingo.ai.rfxintake.service.extraction;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class PlainTextExtractorTest {

  @Test
  @DisplayName("should strip the UTF-8 byte order mark")
  void shouldStripBom() {
    byte[] bytes = "\uFEFFCotización".getBytes(StandardCharsets.UTF_8);

    assertThat(PlainTextExtractor.decode(bytes)).isEqualTo("Cotización");
  }

  @Test
  @DisplayName("should decode Latin-1 input that is not valid UTF-8")
  void shouldDecodeLatin1_whenNotUtf8() {
    byte[] bytes =
        "Descripción del artículo y cantidad solicitada para la licitación pública"
            .getBytes(StandardCharsets.ISO_8859_1);

    assertThat(PlainTextExtractor.decode(bytes)).contains("Descripción").contains("artículo");
  }
}
