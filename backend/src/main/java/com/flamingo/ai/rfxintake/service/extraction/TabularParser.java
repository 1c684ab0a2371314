package com.flamingo.ai.rfxintake.service.extraction;

import com.flamingo.ai.rfxintake.ingest.model.ContentKind;
import java.io.IOException;
import java.util.List;

/** Reads raw cell grids out of spreadsheet files. */
public interface TabularParser {

  /** Whether the parsing libraries are present at runtime. */
  boolean isAvailable();

  /**
   * Parses every sheet of a workbook, or the single table of a CSV file.
   *
   * @param content file bytes
   * @param kind {@link ContentKind#SPREADSHEET_XLSX} or {@link ContentKind#SPREADSHEET_CSV}
   * @return sheets in workbook order; cells are raw strings, never null
   * @throws IOException when the file cannot be read as the given kind
   */
  List<TableSheet> parseTable(byte[] content, ContentKind kind) throws IOException;

  /**
   * One sheet of raw cells.
   *
   * @param name sheet name, null for CSV input
   * @param rows rows of cells, with their 1-based source row number at the same index in {@code
   *     rowNumbers}
   * @param rowNumbers source row numbers
   */
  record TableSheet(String name, List<List<String>> rows, List<Integer> rowNumbers) {}
}
