package com.flamingo.ai.rfxintake.service.extraction;

import com.flamingo.ai.rfxintake.ingest.model.CanonicalColumn;
import com.flamingo.ai.rfxintake.ingest.model.ClassifiedBlob;
import com.flamingo.ai.rfxintake.ingest.model.ExtractedFragment;
import com.flamingo.ai.rfxintake.ingest.model.SpreadsheetRow;
import com.flamingo.ai.rfxintake.service.extraction.TabularParser.TableSheet;
import com.flamingo.ai.rfxintake.service.validation.LenientDecimalParser;
import java.io.IOException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Turns spreadsheets into canonical line-item rows plus a pipe-separated text rendering.
 *
 * <p>The header row is the first of the leading rows that contains at least one known column
 * alias. Unknown columns are ignored, rows with no value in any known column are dropped, and
 * numeric cells that cannot be parsed become empty. Sheets without a recognisable header are
 * rendered as raw text so their content still reaches the model, but contribute no rows.
 *
 * <p>When the tabular parser is unavailable the result is an empty, failed fragment.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SpreadsheetParser {

  static final int HEADER_SEARCH_ROWS = 10;
  static final int RAW_PREVIEW_ROWS = 200;

  private static final Map<String, String> UNIT_ALIASES = buildUnitAliases();

  private final TabularParser tabularParser;

  public ExtractedFragment parse(ClassifiedBlob blob) {
    if (!tabularParser.isAvailable()) {
      log.warn("Skipping spreadsheet '{}': tabular parser unavailable", blob.filename());
      return ExtractedFragment.empty(blob, false);
    }

    List<TableSheet> sheets;
    try {
      sheets = tabularParser.parseTable(blob.blob().content(), blob.kind());
    } catch (LinkageError e) {
      log.warn(
          "Skipping spreadsheet '{}': tabular parser failed to load: {}",
          blob.filename(),
          e.toString());
      return ExtractedFragment.empty(blob, false);
    } catch (IOException e) {
      log.warn("Could not read spreadsheet '{}': {}", blob.filename(), e.getMessage());
      return ExtractedFragment.empty(blob, false);
    }

    List<SpreadsheetRow> rows = new ArrayList<>();
    StringBuilder text = new StringBuilder();
    for (TableSheet sheet : sheets) {
      String sheetName = sheet.name() != null ? sheet.name() : blob.filename();
      if (sheet.name() != null) {
        text.append("--- Sheet: ").append(sheet.name()).append(" ---\n");
      }
      renderSheet(sheet, sheetName, rows, text);
    }

    log.debug(
        "Parsed spreadsheet '{}': {} sheets, {} canonical rows",
        blob.filename(),
        sheets.size(),
        rows.size());
    return ExtractedFragment.ofRows(blob, text.toString().strip(), rows);
  }

  private void renderSheet(
      TableSheet sheet, String sheetName, List<SpreadsheetRow> rows, StringBuilder text) {
    Optional<Integer> headerIndex = findHeaderRow(sheet.rows());
    if (headerIndex.isEmpty()) {
      renderRaw(sheet, text);
      return;
    }

    Map<Integer, CanonicalColumn> columns = mapColumns(sheet.rows().get(headerIndex.get()));
    List<CanonicalColumn> present = columns.values().stream().distinct().sorted().toList();
    text.append(present.stream().map(CanonicalColumn::fieldName).collect(Collectors.joining(" | ")))
        .append('\n');

    for (int i = headerIndex.get() + 1; i < sheet.rows().size(); i++) {
      Map<CanonicalColumn, String> cells = readCells(sheet.rows().get(i), columns);
      if (cells.values().stream().allMatch(String::isEmpty)) {
        continue;
      }
      SpreadsheetRow row = new SpreadsheetRow(sheetName, sheet.rowNumbers().get(i), cells);
      rows.add(row);
      text.append(present.stream().map(row::get).collect(Collectors.joining(" | "))).append('\n');
    }
    text.append('\n');
  }

  private Optional<Integer> findHeaderRow(List<List<String>> sheetRows) {
    int limit = Math.min(HEADER_SEARCH_ROWS, sheetRows.size());
    for (int i = 0; i < limit; i++) {
      if (!mapColumns(sheetRows.get(i)).isEmpty()) {
        return Optional.of(i);
      }
    }
    return Optional.empty();
  }

  /** Maps column index to canonical column; the first column claiming a canonical name wins. */
  private Map<Integer, CanonicalColumn> mapColumns(List<String> headerRow) {
    Map<Integer, CanonicalColumn> columns = new LinkedHashMap<>();
    for (int index = 0; index < headerRow.size(); index++) {
      int column = index;
      CanonicalColumn.fromHeader(headerRow.get(index))
          .filter(canonical -> !columns.containsValue(canonical))
          .ifPresent(canonical -> columns.put(column, canonical));
    }
    return columns;
  }

  private Map<CanonicalColumn, String> readCells(
      List<String> rawRow, Map<Integer, CanonicalColumn> columns) {
    Map<CanonicalColumn, String> cells = new EnumMap<>(CanonicalColumn.class);
    columns.forEach(
        (index, column) -> {
          String raw = index < rawRow.size() ? rawRow.get(index) : "";
          cells.put(column, normalizeCell(column, raw));
        });
    return cells;
  }

  static String normalizeCell(CanonicalColumn column, String raw) {
    String value = raw == null ? "" : raw.replaceAll("\\p{Cntrl}", " ").strip();
    return switch (column) {
      case QUANTITY, UNIT_PRICE ->
          LenientDecimalParser.parse(value).map(LenientDecimalParser::toPlainString).orElse("");
      case UNIT -> normalizeUnit(value);
      case ITEM_CODE, PRODUCT_NAME, DESCRIPTION -> value;
    };
  }

  static String normalizeUnit(String unit) {
    if (unit.isEmpty()) {
      return unit;
    }
    String key = unit.toLowerCase(Locale.ROOT).replace(".", "").strip();
    return UNIT_ALIASES.getOrDefault(key, key);
  }

  private void renderRaw(TableSheet sheet, StringBuilder text) {
    sheet.rows().stream()
        .limit(RAW_PREVIEW_ROWS)
        .map(
            cells ->
                cells.stream().filter(cell -> !cell.isBlank()).collect(Collectors.joining(" | ")))
        .filter(line -> !line.isEmpty())
        .forEach(line -> text.append(line).append('\n'));
    text.append('\n');
  }

  private static Map<String, String> buildUnitAliases() {
    Map<String, String> aliases = new LinkedHashMap<>();
    for (String alias :
        List.of(
            "und", "unds", "unid", "unidad", "unidades", "u", "pcs", "pc", "pieza", "piezas", "pz",
            "pza", "ea", "each", "unit", "units")) {
      aliases.put(alias, "unidades");
    }
    for (String alias : List.of("kg", "kgs", "kilo", "kilos", "kilogramo", "kilogramos")) {
      aliases.put(alias, "kg");
    }
    for (String alias : List.of("g", "gr", "grs", "gramo", "gramos")) {
      aliases.put(alias, "g");
    }
    for (String alias : List.of("l", "lt", "lts", "litro", "litros", "liter", "liters")) {
      aliases.put(alias, "l");
    }
    for (String alias : List.of("m", "mt", "mts", "metro", "metros", "meter", "meters")) {
      aliases.put(alias, "m");
    }
    for (String alias : List.of("caja", "cajas", "box", "boxes")) {
      aliases.put(alias, "cajas");
    }
    for (String alias : List.of("servicio", "servicios", "service", "services")) {
      aliases.put(alias, "servicio");
    }
    return Map.copyOf(aliases);
  }
}
