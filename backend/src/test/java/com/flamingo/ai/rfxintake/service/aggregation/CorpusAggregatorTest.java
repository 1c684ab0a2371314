package com.flamingo.ai.rfxintake.service.aggregation;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.rfxintake.ingest.model.AggregatedCorpus;
import com.flamingo.ai.rfxintake.ingest.model.ContentKind;
import com.flamingo.ai.rfxintake.ingest.model.CorpusSection;
import com.flamingo.ai.rfxintake.ingest.model.ExtractedFragment;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("CorpusAggregator Tests")
class CorpusAggregatorTest {

  private static ExtractedFragment fragment(
      int ordinal, int sequence, String filename, ContentKind kind, String text) {
    return new ExtractedFragment(
        ordinal, sequence, filename, kind, text, false, true, 1, List.of());
  }

  @Test
  @DisplayName("should order sections by upload position regardless of input order")
  void shouldOrderByOrdinalAndSequence() {
    CorpusAggregator aggregator = new CorpusAggregator(10_000);
    List<ExtractedFragment> shuffled =
        List.of(
            fragment(2, 0, "c.txt", ContentKind.PLAIN_TEXT, "tercero"),
            fragment(1, 2, "b.zip/y.txt", ContentKind.PLAIN_TEXT, "segundo-b"),
            fragment(0, 0, "a.pdf", ContentKind.PDF, "primero"),
            fragment(1, 1, "b.zip/x.txt", ContentKind.PLAIN_TEXT, "segundo-a"));

    AggregatedCorpus corpus = aggregator.aggregate(shuffled);

    assertThat(corpus.sections())
        .extracting(CorpusSection::filename)
        .containsExactly("a.pdf", "b.zip/x.txt", "b.zip/y.txt", "c.txt");
    assertThat(corpus.text())
        .isEqualTo(
            "### SOURCE: a.pdf\nprimero\n\n"
                + "### SOURCE: b.zip/x.txt\nsegundo-a\n\n"
                + "### SOURCE: b.zip/y.txt\nsegundo-b\n\n"
                + "### SOURCE: c.txt\ntercero\n");
  }

  @Test
  @DisplayName("should keep a marker for failed fragments with an empty body")
  void shouldEmitMarker_whenFragmentFailed() {
    CorpusAggregator aggregator = new CorpusAggregator(10_000);
    ExtractedFragment failed =
        new ExtractedFragment(0, 0, "roto.pdf", ContentKind.PDF, "", false, false, 1, List.of());
    ExtractedFragment ok = fragment(1, 0, "ok.txt", ContentKind.PLAIN_TEXT, "contenido");

    AggregatedCorpus corpus = aggregator.aggregate(List.of(ok, failed));

    assertThat(corpus.sectionCount()).isEqualTo(2);
    assertThat(corpus.text()).startsWith("### SOURCE: roto.pdf\n\n### SOURCE: ok.txt\n");
    assertThat(corpus.contentYield()).isEqualTo("contenido".length());
  }

  @Test
  @DisplayName("should truncate OCR text before document text and spreadsheets last")
  void shouldTruncateLowestPriorityFirst() {
    CorpusAggregator aggregator = new CorpusAggregator(300);
    ExtractedFragment ocr =
        new ExtractedFragment(
            0, 0, "scan.pdf", ContentKind.PDF, "o".repeat(200), true, true, 1, List.of());
    ExtractedFragment pdf = fragment(1, 0, "rfp.pdf", ContentKind.PDF, "p".repeat(150));
    ExtractedFragment sheet =
        fragment(2, 0, "items.csv", ContentKind.SPREADSHEET_CSV, "s".repeat(100));

    AggregatedCorpus corpus = aggregator.aggregate(List.of(ocr, pdf, sheet));

    List<CorpusSection> sections = corpus.sections();
    assertThat(sections.get(0).truncatedChars()).isEqualTo(150);
    assertThat(sections.get(0).body()).isEqualTo("o".repeat(50) + "\n[... truncated 150 chars]");
    assertThat(sections.get(1).truncatedChars()).isZero();
    assertThat(sections.get(2).body()).isEqualTo("s".repeat(100));
    assertThat(corpus.truncatedChars()).isEqualTo(150);
  }

  @Test
  @DisplayName("should cut into the next tier once the lowest tier is exhausted")
  void shouldCutNextTier_whenLowestTierExhausted() {
    CorpusAggregator aggregator = new CorpusAggregator(100);
    ExtractedFragment notes = fragment(0, 0, "notas.txt", ContentKind.PLAIN_TEXT, "n".repeat(60));
    ExtractedFragment pdf = fragment(1, 0, "rfp.pdf", ContentKind.PDF, "p".repeat(80));
    ExtractedFragment sheet =
        fragment(2, 0, "items.csv", ContentKind.SPREADSHEET_CSV, "s".repeat(40));

    AggregatedCorpus corpus = aggregator.aggregate(List.of(notes, pdf, sheet));

    assertThat(corpus.sections())
        .extracting(CorpusSection::truncatedChars)
        .containsExactly(60, 20, 0);
  }

  @Test
  @DisplayName("should leave the corpus untouched when it fits the budget")
  void shouldNotTruncate_whenWithinBudget() {
    CorpusAggregator aggregator = new CorpusAggregator(100);

    AggregatedCorpus corpus =
        aggregator.aggregate(List.of(fragment(0, 0, "a.txt", ContentKind.PLAIN_TEXT, "hola")));

    assertThat(corpus.truncatedChars()).isZero();
    assertThat(corpus.text()).isEqualTo("### SOURCE: a.txt\nhola\n");
  }
}
