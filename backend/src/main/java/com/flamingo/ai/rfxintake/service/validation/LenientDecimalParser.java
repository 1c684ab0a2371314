package com.flamingo.ai.rfxintake.service.validation;

import java.math.BigDecimal;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Parses human-written numbers such as {@code 1,000.50}, {@code 1.000,50}, {@code $ 20} or {@code
 * 10 unidades}.
 *
 * <p>When both separators appear, the last one is the decimal separator. A separator of only one
 * kind followed by groups of exactly three digits, after a non-zero integer part, is a thousands
 * separator ({@code 1.500} and {@code 1,500} are both 1500); otherwise it is the decimal separator.
 * Scientific notation such as {@code 1e3} is accepted. Letters between digits make the value
 * unparseable.
 */
public final class LenientDecimalParser {

  private static final Pattern COMMA_GROUPED = Pattern.compile("-?[1-9]\\d{0,2}(,\\d{3})+");
  private static final Pattern DOT_GROUPED = Pattern.compile("-?[1-9]\\d{0,2}(\\.\\d{3})+");
  private static final Pattern SCIENTIFIC = Pattern.compile("-?\\d+(\\.\\d+)?[eE][+-]?\\d+");
  private static final Pattern LETTERS_BETWEEN_DIGITS = Pattern.compile("\\d\\s*\\p{L}+\\s*\\d");
  private static final Pattern NUMBER = Pattern.compile("-?\\d+(\\.\\d+)?");

  private LenientDecimalParser() {}

  public static Optional<BigDecimal> parse(String raw) {
    if (raw == null) {
      return Optional.empty();
    }
    String trimmed = raw.strip();
    if (SCIENTIFIC.matcher(trimmed).matches()) {
      return Optional.of(new BigDecimal(trimmed));
    }
    if (LETTERS_BETWEEN_DIGITS.matcher(trimmed).find()) {
      return Optional.empty();
    }
    String cleaned = trimmed.replaceAll("[^0-9,.\\-]", "");
    if (cleaned.isEmpty() || cleaned.chars().noneMatch(Character::isDigit)) {
      return Optional.empty();
    }
    if (cleaned.lastIndexOf('-') > 0) {
      return Optional.empty();
    }

    int lastComma = cleaned.lastIndexOf(',');
    int lastDot = cleaned.lastIndexOf('.');
    String canonical;
    if (lastComma >= 0 && lastDot >= 0) {
      canonical =
          lastComma > lastDot
              ? cleaned.replace(".", "").replace(',', '.')
              : cleaned.replace(",", "");
    } else if (lastComma >= 0) {
      canonical =
          COMMA_GROUPED.matcher(cleaned).matches()
              ? cleaned.replace(",", "")
              : cleaned.replace(',', '.');
    } else if (DOT_GROUPED.matcher(cleaned).matches()) {
      canonical = cleaned.replace(".", "");
    } else {
      canonical = cleaned;
    }

    if (!NUMBER.matcher(canonical).matches()) {
      return Optional.empty();
    }
    return Optional.of(new BigDecimal(canonical));
  }

  /** Plain string form without trailing zeros, e.g. {@code 10} or {@code 12.5}. */
  public static String toPlainString(BigDecimal value) {
    BigDecimal stripped = value.stripTrailingZeros();
    return stripped.scale() < 0 ? stripped.setScale(0).toPlainString() : stripped.toPlainString();
  }
}
