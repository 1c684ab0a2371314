package com.flamingo.ai.rfxintake.service.extraction;

import static com.flamingo.ai.rfxintake.support.DocumentFixtures.classified;
import static com.flamingo.ai.rfxintake.support.DocumentFixtures.utf8;
import static com.flamingo.ai.rfxintake.support.DocumentFixtures.xlsx;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.rfxintake.ingest.model.CanonicalColumn;
import com.flamingo.ai.rfxintake.ingest.model.ContentKind;
import com.flamingo.ai.rfxintake.ingest.model.ExtractedFragment;
import com.flamingo.ai.rfxintake.ingest.model.SpreadsheetRow;
import java.io.IOException;
import java.math.BigDecimal;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("SpreadsheetParser Tests")
class SpreadsheetParserTest {

  private SpreadsheetParser parser;

  @BeforeEach
  void setUp() {
    parser = new SpreadsheetParser(new PoiCsvTabularParser());
  }

  private ExtractedFragment parseCsv(String csv) {
    return parser.parse(classified("items.csv", utf8(csv), ContentKind.SPREADSHEET_CSV));
  }

  @Test
  @DisplayName("should map Spanish and English headers onto the same canonical columns")
  void shouldProduceSameKeys_forSpanishAndEnglishHeaders() {
    ExtractedFragment spanish = parseCsv("nombre,cantidad,precio\nSillas,10,25.50\n");
    ExtractedFragment english = parseCsv("product,qty,unit price\nSillas,10,25.50\n");

    SpreadsheetRow spanishRow = spanish.rows().get(0);
    SpreadsheetRow englishRow = english.rows().get(0);
    assertThat(spanishRow.cells()).isEqualTo(englishRow.cells());
    assertThat(spanishRow.cells().keySet())
        .containsExactly(
            CanonicalColumn.PRODUCT_NAME, CanonicalColumn.QUANTITY, CanonicalColumn.UNIT_PRICE);
    assertThat(spanish.text()).isEqualTo(english.text());
  }

  @Test
  @DisplayName("should render the table as pipe-separated canonical lines")
  void shouldRenderCanonicalText() {
    ExtractedFragment fragment = parseCsv("nombre,cantidad\nSillas,10\nMesas,5\n");

    assertThat(fragment.extractionSucceeded()).isTrue();
    assertThat(fragment.text()).isEqualTo("product_name | quantity\nSillas | 10\nMesas | 5");
    assertThat(fragment.rows()).extracting(SpreadsheetRow::productName)
        .containsExactly("Sillas", "Mesas");
    assertThat(fragment.rows()).extracting(SpreadsheetRow::rowNumber).containsExactly(2, 3);
  }

  @Test
  @DisplayName("should ignore unknown columns and drop rows without canonical values")
  void shouldDropRows_whenNoCanonicalValue() {
    ExtractedFragment fragment =
        parseCsv("producto,notas internas,cantidad\nSillas,urgente,10\n,solo notas,\n");

    assertThat(fragment.rows()).hasSize(1);
    assertThat(fragment.rows().get(0).cells()).doesNotContainValue("urgente");
  }

  @Test
  @DisplayName("should leave malformed numeric cells empty instead of failing")
  void shouldBlankMalformedNumbers() {
    ExtractedFragment fragment =
        parseCsv("producto;cantidad;precio\nSillas;diez;$ 1.250,50\nMesas;5 unidades;abc\n");

    SpreadsheetRow sillas = fragment.rows().get(0);
    SpreadsheetRow mesas = fragment.rows().get(1);
    assertThat(sillas.get(CanonicalColumn.QUANTITY)).isEmpty();
    assertThat(sillas.quantity()).isNull();
    assertThat(sillas.unitPrice()).isEqualByComparingTo(new BigDecimal("1250.50"));
    assertThat(mesas.quantity()).isEqualByComparingTo(BigDecimal.valueOf(5));
    assertThat(mesas.get(CanonicalColumn.UNIT_PRICE)).isEmpty();
  }

  @Test
  @DisplayName("should find a header row below a title row")
  void shouldLocateHeader_afterTitleRows() {
    ExtractedFragment fragment =
        parseCsv(
            "Solicitud de compra 2024\n\n"
                + "Codigo,Descripción,Cant.,Unidad\n"
                + "A-1,Resma papel,20,und\n");

    SpreadsheetRow row = fragment.rows().get(0);
    assertThat(row.get(CanonicalColumn.ITEM_CODE)).isEqualTo("A-1");
    assertThat(row.get(CanonicalColumn.DESCRIPTION)).isEqualTo("Resma papel");
    assertThat(row.get(CanonicalColumn.UNIT)).isEqualTo("unidades");
  }

  @Test
  @DisplayName("should render headerless sheets as raw text without rows")
  void shouldRenderRaw_whenNoHeader() {
    ExtractedFragment fragment = parseCsv("foo,bar\n1,2\n");

    assertThat(fragment.rows()).isEmpty();
    assertThat(fragment.text()).contains("foo | bar").contains("1 | 2");
    assertThat(fragment.extractionSucceeded()).isTrue();
  }

  @Test
  @DisplayName("should read every sheet of an XLSX workbook")
  void shouldParseWorkbook() {
    byte[] workbook =
        xlsx(
            "Items",
            List.of(
                List.of("Producto", "Cantidad", "Precio Unitario"),
                List.of("Escritorio", "3", "199.99")));

    ExtractedFragment fragment =
        parser.parse(classified("items.xlsx", workbook, ContentKind.SPREADSHEET_XLSX));

    assertThat(fragment.text()).startsWith("--- Sheet: Items ---");
    SpreadsheetRow row = fragment.rows().get(0);
    assertThat(row.sheet()).isEqualTo("Items");
    assertThat(row.productName()).isEqualTo("Escritorio");
    assertThat(row.quantity()).isEqualByComparingTo(BigDecimal.valueOf(3));
    assertThat(row.unitPrice()).isEqualByComparingTo(new BigDecimal("199.99"));
  }

  @Test
  @DisplayName("should return a failed empty fragment when the tabular parser is unavailable")
  void shouldFail_whenParserUnavailable() throws IOException {
    TabularParser unavailable = mock(TabularParser.class);
    when(unavailable.isAvailable()).thenReturn(false);
    SpreadsheetParser degraded = new SpreadsheetParser(unavailable);

    ExtractedFragment fragment =
        degraded.parse(classified("items.csv", utf8("a,b"), ContentKind.SPREADSHEET_CSV));

    assertThat(fragment.extractionSucceeded()).isFalse();
    assertThat(fragment.text()).isEmpty();
    verify(unavailable, never()).parseTable(any(), any());
  }

  @Test
  @DisplayName("should return a failed empty fragment for an unreadable workbook")
  void shouldFail_whenWorkbookCorrupt() {
    ExtractedFragment fragment =
        parser.parse(
            classified("items.xlsx", utf8("not a workbook"), ContentKind.SPREADSHEET_XLSX));

    assertThat(fragment.extractionSucceeded()).isFalse();
    assertThat(fragment.rows()).isEmpty();
  }
}
