package com.flamingo.ai.rfxintake.ingest.model;

import java.text.Normalizer;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/** Canonical spreadsheet columns and the header aliases that map onto them. */
public enum CanonicalColumn {
  ITEM_CODE("item_code", "item #", "item#", "item no", "item_no", "id", "code", "codigo", "sku"),
  PRODUCT_NAME(
      "product_name",
      "product",
      "producto",
      "nombre",
      "item",
      "articulo",
      "name",
      "nombre_producto"),
  DESCRIPTION("description", "descripcion", "detalle", "detail"),
  QUANTITY("quantity", "qty", "cantidad", "cant"),
  UNIT("unit", "units", "uom", "unidad", "unidad_medida", "unit_of_measure"),
  UNIT_PRICE(
      "unit_price", "price", "precio_unitario", "precio", "costo_unitario", "costo", "unit_cost");

  private final String fieldName;
  private final List<String> aliases;

  CanonicalColumn(String fieldName, String... aliases) {
    this.fieldName = fieldName;
    this.aliases =
        Arrays.stream(aliases).map(CanonicalColumn::normalizeHeader).distinct().toList();
  }

  public String fieldName() {
    return fieldName;
  }

  /** Resolves a raw header cell, ignoring case, accents and separators. */
  public static Optional<CanonicalColumn> fromHeader(String header) {
    if (header == null || header.isBlank()) {
      return Optional.empty();
    }
    String normalized = normalizeHeader(header);
    for (CanonicalColumn column : values()) {
      if (column.aliases.contains(normalized)) {
        return Optional.of(column);
      }
    }
    return Optional.empty();
  }

  static String normalizeHeader(String header) {
    String stripped =
        Normalizer.normalize(header.strip(), Normalizer.Form.NFD).replaceAll("\\p{M}", "");
    return stripped
        .toLowerCase(Locale.ROOT)
        .replace('\uFEFF', ' ')
        .replaceAll("[\\s_\\-.]+", " ")
        .strip();
  }
}
