package com.flamingo.ai.rfxintake.service.validation;

import java.text.Normalizer;
import java.util.Comparator;
import java.util.Currency;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/** Maps free-text currency names, symbols and codes to ISO-4217 codes. */
@Component
public class CurrencyNormalizer {

  /** Every ISO-4217 code the JDK knows, including PAB, HNL, NIO and other regional currencies. */
  static final Set<String> ISO_CODES =
      Currency.getAvailableCurrencies().stream()
          .map(Currency::getCurrencyCode)
          .collect(Collectors.toUnmodifiableSet());

  private static final Pattern CODE_TOKEN = Pattern.compile("\\b[A-Z]{3}\\b");

  /** Longest aliases first so that "PESOS COLOMBIANOS" wins over "PESOS" and "R$" over "$". */
  private static final List<Map.Entry<String, String>> ALIASES = buildAliases();

  public Optional<String> normalize(String raw) {
    if (raw == null || raw.isBlank()) {
      return Optional.empty();
    }
    String value = fold(raw);

    if (ISO_CODES.contains(value)) {
      return Optional.of(value);
    }
    for (Map.Entry<String, String> alias : ALIASES) {
      if (value.equals(alias.getKey())) {
        return Optional.of(alias.getValue());
      }
    }
    Matcher matcher = CODE_TOKEN.matcher(value);
    while (matcher.find()) {
      if (ISO_CODES.contains(matcher.group())) {
        return Optional.of(matcher.group());
      }
    }
    for (Map.Entry<String, String> alias : ALIASES) {
      if (value.contains(alias.getKey())) {
        return Optional.of(alias.getValue());
      }
    }
    return Optional.empty();
  }

  private static String fold(String raw) {
    return Normalizer.normalize(raw.strip(), Normalizer.Form.NFD)
        .replaceAll("\\p{M}", "")
        .toUpperCase(Locale.ROOT)
        .replaceAll("\\s+", " ");
  }

  private static List<Map.Entry<String, String>> buildAliases() {
    Map<String, String> aliases = new LinkedHashMap<>();
    aliases.put("US$", "USD");
    aliases.put("U$S", "USD");
    aliases.put("R$", "BRL");
    aliases.put("S/", "PEN");
    aliases.put("$", "USD");
    aliases.put("€", "EUR");
    aliases.put("£", "GBP");
    aliases.put("¥", "JPY");
    aliases.put("₹", "INR");
    aliases.put("₽", "RUB");
    aliases.put("₩", "KRW");
    aliases.put("DOLAR", "USD");
    aliases.put("DOLARES", "USD");
    aliases.put("DOLLAR", "USD");
    aliases.put("DOLLARS", "USD");
    aliases.put("EURO", "EUR");
    aliases.put("EUROS", "EUR");
    aliases.put("LIBRA", "GBP");
    aliases.put("LIBRAS", "GBP");
    aliases.put("POUND", "GBP");
    aliases.put("YEN", "JPY");
    aliases.put("PESO", "MXN");
    aliases.put("PESOS", "MXN");
    aliases.put("PESOS MEXICANOS", "MXN");
    aliases.put("PESOS COLOMBIANOS", "COP");
    aliases.put("PESOS ARGENTINOS", "ARS");
    aliases.put("PESOS CHILENOS", "CLP");
    aliases.put("PESOS URUGUAYOS", "UYU");
    aliases.put("REAL", "BRL");
    aliases.put("REALES", "BRL");
    aliases.put("REAIS", "BRL");
    aliases.put("SOL", "PEN");
    aliases.put("SOLES", "PEN");
    aliases.put("BOLIVAR", "VES");
    aliases.put("BOLIVARES", "VES");
    aliases.put("BOLIVIANO", "BOB");
    aliases.put("BOLIVIANOS", "BOB");
    aliases.put("YUAN", "CNY");
    aliases.put("RUPIA", "INR");
    aliases.put("RUPEE", "INR");
    aliases.put("RUBLO", "RUB");
    aliases.put("RUBLE", "RUB");
    return aliases.entrySet().stream()
        .sorted(
            Comparator.comparingInt((Map.Entry<String, String> e) -> e.getKey().length())
                .reversed())
        .map(e -> Map.entry(e.getKey(), e.getValue()))
        .toList();
  }
}
