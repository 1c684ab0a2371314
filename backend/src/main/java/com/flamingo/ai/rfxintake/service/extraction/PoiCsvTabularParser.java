package com.flamingo.ai.rfxintake.service.extraction;

import com.flamingo.ai.rfxintake.ingest.model.ContentKind;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.FormulaEvaluator;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.springframework.stereotype.Component;
import org.springframework.util.ClassUtils;

/** {@link TabularParser} backed by Apache POI for XLSX and Apache Commons CSV for CSV. */
@Component
@Slf4j
public class PoiCsvTabularParser implements TabularParser {

  static final int MAX_ROWS_PER_SHEET = 10_000;

  private static final String POI_WORKBOOK = "org.apache.poi.xssf.usermodel.XSSFWorkbook";
  private static final String CSV_FORMAT = "org.apache.commons.csv.CSVFormat";

  private final boolean available;

  public PoiCsvTabularParser() {
    ClassLoader classLoader = getClass().getClassLoader();
    this.available =
        ClassUtils.isPresent(POI_WORKBOOK, classLoader)
            && ClassUtils.isPresent(CSV_FORMAT, classLoader);
    if (!available) {
      log.warn("Spreadsheet libraries not found on the classpath, spreadsheets will be skipped");
    }
  }

  @Override
  public boolean isAvailable() {
    return available;
  }

  @Override
  public List<TableSheet> parseTable(byte[] content, ContentKind kind) throws IOException {
    return switch (kind) {
      case SPREADSHEET_XLSX -> parseWorkbook(content);
      case SPREADSHEET_CSV -> List.of(parseCsv(content));
      default -> throw new IllegalArgumentException("Not a spreadsheet kind: " + kind);
    };
  }

  private List<TableSheet> parseWorkbook(byte[] content) throws IOException {
    List<TableSheet> sheets = new ArrayList<>();
    try (XSSFWorkbook workbook = new XSSFWorkbook(new ByteArrayInputStream(content))) {
      DataFormatter formatter = new DataFormatter();
      FormulaEvaluator evaluator = workbook.getCreationHelper().createFormulaEvaluator();

      for (Sheet sheet : workbook) {
        List<List<String>> rows = new ArrayList<>();
        List<Integer> rowNumbers = new ArrayList<>();
        for (Row row : sheet) {
          if (rows.size() >= MAX_ROWS_PER_SHEET) {
            log.warn("Sheet '{}' truncated at {} rows", sheet.getSheetName(), MAX_ROWS_PER_SHEET);
            break;
          }
          rows.add(readRow(row, formatter, evaluator));
          rowNumbers.add(row.getRowNum() + 1);
        }
        sheets.add(new TableSheet(sheet.getSheetName(), rows, rowNumbers));
      }
    } catch (RuntimeException e) {
      // POI signals malformed OOXML packages with unchecked exceptions
      throw new IOException("Unreadable workbook: " + e.getMessage(), e);
    }
    return sheets;
  }

  private List<String> readRow(Row row, DataFormatter formatter, FormulaEvaluator evaluator) {
    List<String> cells = new ArrayList<>();
    short lastCell = row.getLastCellNum();
    for (int column = 0; column < lastCell; column++) {
      Cell cell = row.getCell(column, Row.MissingCellPolicy.RETURN_BLANK_AS_NULL);
      cells.add(cell == null ? "" : formatCell(cell, formatter, evaluator));
    }
    return cells;
  }

  private String formatCell(Cell cell, DataFormatter formatter, FormulaEvaluator evaluator) {
    try {
      return formatter.formatCellValue(cell, evaluator).strip();
    } catch (RuntimeException e) {
      log.debug(
          "Unreadable cell {} in sheet '{}': {}",
          cell.getAddress(),
          cell.getSheet().getSheetName(),
          e.getMessage());
      return "";
    }
  }

  private TableSheet parseCsv(byte[] content) throws IOException {
    String text = PlainTextExtractor.decode(content);
    CSVFormat format =
        CSVFormat.DEFAULT
            .builder()
            .setDelimiter(sniffDelimiter(text))
            .setIgnoreEmptyLines(true)
            .setTrim(true)
            .build();

    List<List<String>> rows = new ArrayList<>();
    List<Integer> rowNumbers = new ArrayList<>();
    try (Reader reader = new StringReader(text);
        CSVParser parser = format.parse(reader)) {
      for (CSVRecord record : parser) {
        if (rows.size() >= MAX_ROWS_PER_SHEET) {
          log.warn("CSV truncated at {} rows", MAX_ROWS_PER_SHEET);
          break;
        }
        rows.add(record.toList());
        rowNumbers.add((int) record.getRecordNumber());
      }
    } catch (UncheckedIOException e) {
      throw e.getCause();
    } catch (IllegalStateException e) {
      throw new IOException("Malformed CSV: " + e.getMessage(), e);
    }
    return new TableSheet(null, rows, rowNumbers);
  }

  /** Picks whichever of comma, semicolon or tab occurs most often on the first line. */
  static char sniffDelimiter(String text) {
    int end = text.indexOf('\n');
    String firstLine = end < 0 ? text : text.substring(0, end);
    char best = ',';
    long bestCount = firstLine.chars().filter(c -> c == ',').count();
    for (char candidate : new char[] {';', '\t'}) {
      long count = firstLine.chars().filter(c -> c == candidate).count();
      if (count > bestCount) {
        best = candidate;
        bestCount = count;
      }
    }
    return best;
  }
}
