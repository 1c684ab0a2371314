package com.flamingo.ai.rfxintake.agent;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.rfxintake.ingest.model.AggregatedCorpus;
import com.flamingo.ai.rfxintake.ingest.model.ContentKind;
import com.flamingo.ai.rfxintake.ingest.model.CorpusSection;
import dev.langchain4j.model.chat.request.json.JsonArraySchema;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class RfxExtractionPromptsTest {

  @Test
  @DisplayName("should add the multi-source note only when there are several sources")
  void shouldAddMultiSourceNote_whenSeveralSections() {
    CorpusSection first = new CorpusSection("a.pdf", ContentKind.PDF, "uno", 0);
    CorpusSection second = new CorpusSection("b.csv", ContentKind.SPREADSHEET_CSV, "dos", 0);

    String single =
        RfxExtractionPrompts.userMessage(new AggregatedCorpus(List.of(first), first.render()));
    String multiple =
        RfxExtractionPrompts.userMessage(
            new AggregatedCorpus(
                List.of(first, second), first.render() + "\n" + second.render()));

    assertThat(single).doesNotContain("prefer the one that appears later").endsWith("uno\n");
    assertThat(multiple)
        .contains("combines 2 source files")
        .contains("prefer the one that appears later");
  }

  @Test
  @DisplayName("should put the previous error ahead of the documents on a retry")
  void shouldPrefixPreviousError_whenBuildingRetryMessage() {
    CorpusSection section = new CorpusSection("a.pdf", ContentKind.PDF, "uno", 0);
    AggregatedCorpus corpus = new AggregatedCorpus(List.of(section), section.render());

    String retry = RfxExtractionPrompts.retryMessage(corpus, "Line item without product_name");

    assertThat(retry)
        .startsWith("The previous answer was rejected: Line item without product_name")
        .endsWith(RfxExtractionPrompts.userMessage(corpus));
  }

  @Test
  @DisplayName("should state the schema version in the system message")
  void shouldReferenceSchemaVersion() {
    assertThat(RfxExtractionPrompts.SYSTEM_MESSAGE)
        .contains("version " + RfxExtractionSchema.VERSION);
  }

  @Test
  @DisplayName("should require title, description and requested products at the root")
  void shouldDeclareRequiredRootFields() {
    JsonObjectSchema root = (JsonObjectSchema) RfxExtractionSchema.schema().rootElement();

    assertThat(root.required()).containsExactlyElementsOf(RfxExtractionSchema.REQUIRED);
    assertThat(root.properties()).containsKeys("company_info", "requester_info", "currency");
    JsonArraySchema products = (JsonArraySchema) root.properties().get("requested_products");
    assertThat(((JsonObjectSchema) products.items()).required()).contains("product_name");
  }
}
