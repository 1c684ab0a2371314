package com.flamingo.ai.rfxintake.ingest.model;

/** Closed set of content kinds the intake pipeline knows how to handle. */
public enum ContentKind {
  PDF,
  DOCX,
  IMAGE,
  SPREADSHEET_XLSX,
  SPREADSHEET_CSV,
  ARCHIVE_ZIP,
  PLAIN_TEXT,
  UNKNOWN;

  public boolean isSpreadsheet() {
    return this == SPREADSHEET_XLSX || this == SPREADSHEET_CSV;
  }
}
