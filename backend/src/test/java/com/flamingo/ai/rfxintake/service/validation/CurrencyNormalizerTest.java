package com.flamingo.ai.rfxintake.service.validation;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

class CurrencyNormalizerTest {

  private final CurrencyNormalizer normalizer = new CurrencyNormalizer();

  @ParameterizedTest
  @CsvSource({
    "usd, USD",
    "US$, USD",
    "'$', USD",
    "R$, BRL",
    "€, EUR",
    "Pesos Colombianos, COP",
    "pesos, MXN",
    "Soles, PEN",
    "precio en MXN, MXN",
    "1.500 dólares, USD"
  })
  @DisplayName("should map codes, symbols and names to ISO-4217")
  void shouldNormalizeKnownCurrencies(String raw, String expected) {
    assertThat(normalizer.normalize(raw)).contains(expected);
  }

  @ParameterizedTest
  @ValueSource(strings = {"PAB", "HNL", "NIO", "AED", "PHP", "SVC"})
  @DisplayName("should keep any ISO-4217 code as it is")
  void shouldKeepIsoCode_whenOutsideAliasTable(String code) {
    assertThat(normalizer.normalize(code)).contains(code);
    assertThat(normalizer.normalize(code.toLowerCase())).contains(code);
  }

  @Test
  @DisplayName("should return empty for unknown or blank input")
  void shouldReturnEmpty_whenUnknown() {
    assertThat(normalizer.normalize("zorkmids")).isEmpty();
    assertThat(normalizer.normalize("  ")).isEmpty();
    assertThat(normalizer.normalize(null)).isEmpty();
  }
}
