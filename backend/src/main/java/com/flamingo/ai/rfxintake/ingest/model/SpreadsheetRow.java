package com.flamingo.ai.rfxintake.ingest.model;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * A spreadsheet data row keyed by canonical column.
 *
 * <p>Cell values are already normalised: numeric columns hold a plain decimal string, malformed
 * cells are empty strings. Only columns present in the sheet header appear in {@code cells}.
 *
 * @param sheet sheet name, or the filename for CSV input
 * @param rowNumber 1-based row number in the source sheet
 * @param cells normalised cell values by canonical column
 */
public record SpreadsheetRow(String sheet, int rowNumber, Map<CanonicalColumn, String> cells) {

  public SpreadsheetRow {
    cells =
        cells.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new EnumMap<>(cells));
  }

  public String get(CanonicalColumn column) {
    return cells.getOrDefault(column, "");
  }

  public String productName() {
    return get(CanonicalColumn.PRODUCT_NAME);
  }

  public BigDecimal quantity() {
    return decimal(CanonicalColumn.QUANTITY);
  }

  public BigDecimal unitPrice() {
    return decimal(CanonicalColumn.UNIT_PRICE);
  }

  private BigDecimal decimal(CanonicalColumn column) {
    String value = get(column);
    return value.isEmpty() ? null : new BigDecimal(value);
  }
}
