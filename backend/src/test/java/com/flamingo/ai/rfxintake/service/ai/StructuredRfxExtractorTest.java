package com.flamingo.ai.rfxintake.service.ai;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.rfxintake.agent.RfxExtractionSchema;
import com.flamingo.ai.rfxintake.agent.dto.ExtractionDraft;
import com.flamingo.ai.rfxintake.config.IntakeConfig;
import com.flamingo.ai.rfxintake.exception.ExtractionFailedException;
import com.flamingo.ai.rfxintake.exception.LlmServiceException;
import com.flamingo.ai.rfxintake.ingest.model.AggregatedCorpus;
import com.flamingo.ai.rfxintake.ingest.model.ContentKind;
import com.flamingo.ai.rfxintake.ingest.model.CorpusSection;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.ResponseFormatType;
import dev.langchain4j.model.chat.response.ChatResponse;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class StructuredRfxExtractorTest {

  private static final String VALID_RESPONSE =
      """
      {
        "title": "Mobiliario de oficina",
        "description": "Compra de sillas y mesas",
        "currency": "MXN",
        "requested_products": [
          {"product_name": "Sillas", "quantity": 10, "unit_of_measure": "unidades"},
          {"product_name": "Mesas", "quantity": "5", "is_mandatory": false}
        ],
        "company_info": {"company_name": "Acme SA"},
        "unexpected_field": "ignored"
      }
      """;

  @Mock private ChatModel chatModel;

  private IntakeConfig intakeConfig;
  private SimpleMeterRegistry meterRegistry;
  private StructuredRfxExtractor extractor;

  @BeforeEach
  void setUp() {
    intakeConfig = new IntakeConfig();
    intakeConfig.getExtraction().setInitialBackoff(Duration.ofMillis(1));
    intakeConfig.getExtraction().setBackoffMultiplier(1.0);
    meterRegistry = new SimpleMeterRegistry();
    extractor =
        new StructuredRfxExtractor(chatModel, new ObjectMapper(), intakeConfig, meterRegistry);
  }

  private static AggregatedCorpus corpus(String... bodies) {
    List<CorpusSection> sections =
        IntStream.range(0, bodies.length)
            .mapToObj(
                i -> new CorpusSection("doc" + i + ".txt", ContentKind.PLAIN_TEXT, bodies[i], 0))
            .toList();
    String text = sections.stream().map(CorpusSection::render).collect(Collectors.joining("\n"));
    return new AggregatedCorpus(sections, text);
  }

  private static ChatResponse response(String json) {
    return ChatResponse.builder().aiMessage(AiMessage.from(json)).build();
  }

  @Test
  @DisplayName("should parse a conformant response on the first attempt")
  void shouldReturnDraft_whenResponseIsValid() {
    // Given
    when(chatModel.chat(any(ChatRequest.class))).thenReturn(response(VALID_RESPONSE));

    // When
    ExtractionDraft draft = extractor.extractStructured(corpus("Necesitamos 10 sillas y 5 mesas"));

    // Then
    assertThat(draft.title()).isEqualTo("Mobiliario de oficina");
    assertThat(draft.lineItems())
        .extracting(ExtractionDraft.LineItemDraft::productName)
        .containsExactly("Sillas", "Mesas");
    assertThat(draft.lineItems().get(0).quantity()).isEqualTo("10");
    assertThat(draft.lineItems().get(1).mandatory()).isFalse();
    assertThat(draft.companyInfo().companyName()).isEqualTo("Acme SA");
    verify(chatModel, times(1)).chat(any(ChatRequest.class));
  }

  @Test
  @DisplayName("should send the JSON schema and every source in the request")
  void shouldSendSchemaConstrainedRequest() {
    // Given
    when(chatModel.chat(any(ChatRequest.class))).thenReturn(response(VALID_RESPONSE));
    ArgumentCaptor<ChatRequest> captor = ArgumentCaptor.forClass(ChatRequest.class);

    // When
    extractor.extractStructured(corpus("Pliego de condiciones", "Anexo de precios"));

    // Then
    verify(chatModel).chat(captor.capture());
    ChatRequest request = captor.getValue();
    assertThat(request.responseFormat().type()).isEqualTo(ResponseFormatType.JSON);
    assertThat(request.responseFormat().jsonSchema().name()).isEqualTo(RfxExtractionSchema.NAME);
    UserMessage userMessage = (UserMessage) request.messages().get(1);
    assertThat(userMessage.singleText())
        .contains("combines 2 source files")
        .contains("### SOURCE: doc0.txt")
        .contains("### SOURCE: doc1.txt");
  }

  @Test
  @DisplayName("should make exactly maxAttempts calls and then fail when the model keeps failing")
  void shouldFailAfterMaxAttempts_whenModelAlwaysThrows() {
    // Given
    when(chatModel.chat(any(ChatRequest.class))).thenThrow(new RuntimeException("503 overloaded"));

    // When / Then
    assertThatThrownBy(() -> extractor.extractStructured(corpus("Necesitamos 10 sillas")))
        .isInstanceOf(ExtractionFailedException.class)
        .satisfies(
            e -> {
              ExtractionFailedException failure = (ExtractionFailedException) e;
              assertThat(failure.getAttempts()).isEqualTo(3);
              assertThat(failure.getCause()).isInstanceOf(LlmServiceException.class);
            });
    verify(chatModel, times(3)).chat(any(ChatRequest.class));
    assertThat(meterRegistry.counter("intake.ai.attempts").count()).isEqualTo(3.0);
    assertThat(meterRegistry.counter("intake.ai.failures").count()).isEqualTo(1.0);
  }

  @Test
  @DisplayName("should retry after a transient failure and return the later result")
  void shouldRecover_whenFirstAttemptFails() {
    // Given
    when(chatModel.chat(any(ChatRequest.class)))
        .thenThrow(new RuntimeException("timeout"))
        .thenReturn(response(VALID_RESPONSE));

    // When
    ExtractionDraft draft = extractor.extractStructured(corpus("Necesitamos 10 sillas"));

    // Then
    assertThat(draft.lineItems()).hasSize(2);
    verify(chatModel, times(2)).chat(any(ChatRequest.class));
  }

  @Test
  @DisplayName("should count a non-conformant response as a failed attempt")
  void shouldRetry_whenResponseViolatesSchema() {
    // Given
    when(chatModel.chat(any(ChatRequest.class)))
        .thenReturn(response("{\"title\": \"Sin productos\"}"))
        .thenReturn(response("not json at all"))
        .thenReturn(
            response(
                "{\"title\": \"x\", \"description\": \"y\","
                    + " \"requested_products\": [{\"quantity\": 3}]}"));

    // When / Then
    assertThatThrownBy(() -> extractor.extractStructured(corpus("Necesitamos 10 sillas")))
        .isInstanceOf(ExtractionFailedException.class)
        .hasCauseInstanceOf(LlmServiceException.class);
    verify(chatModel, times(3)).chat(any(ChatRequest.class));
  }

  @Test
  @DisplayName("should tell the model what was wrong when it retries after a schema violation")
  void shouldIncludePreviousError_whenRetryingAfterSchemaViolation() {
    // Given
    when(chatModel.chat(any(ChatRequest.class)))
        .thenReturn(response("{\"title\": \"Sin productos\", \"description\": \"y\"}"))
        .thenReturn(response(VALID_RESPONSE));
    ArgumentCaptor<ChatRequest> captor = ArgumentCaptor.forClass(ChatRequest.class);

    // When
    ExtractionDraft draft = extractor.extractStructured(corpus("Necesitamos 10 sillas"));

    // Then
    assertThat(draft.lineItems()).hasSize(2);
    verify(chatModel, times(2)).chat(captor.capture());
    String first = userText(captor.getAllValues().get(0));
    String retry = userText(captor.getAllValues().get(1));
    assertThat(first).doesNotContain("previous answer was rejected");
    assertThat(retry)
        .contains("previous answer was rejected")
        .contains("Missing required field 'requested_products'")
        .contains("Necesitamos 10 sillas");
  }

  @Test
  @DisplayName("should resend the same prompt after a transport failure")
  void shouldKeepPrompt_whenRetryingAfterServiceError() {
    // Given
    when(chatModel.chat(any(ChatRequest.class)))
        .thenThrow(new RuntimeException("connection reset"))
        .thenReturn(response(VALID_RESPONSE));
    ArgumentCaptor<ChatRequest> captor = ArgumentCaptor.forClass(ChatRequest.class);

    // When
    extractor.extractStructured(corpus("Necesitamos 10 sillas"));

    // Then
    verify(chatModel, times(2)).chat(captor.capture());
    assertThat(userText(captor.getAllValues().get(1)))
        .isEqualTo(userText(captor.getAllValues().get(0)));
  }

  private static String userText(ChatRequest request) {
    return ((UserMessage) request.messages().get(1)).singleText();
  }

  @Test
  @DisplayName("should accept JSON wrapped in markdown code fences")
  void shouldStripCodeFences() {
    String fenced = "```json\n" + VALID_RESPONSE + "```";

    ExtractionDraft draft = extractor.parseDraft(fenced);

    assertThat(draft.description()).isEqualTo("Compra de sillas y mesas");
  }

  @Test
  @DisplayName("should flag schema problems as schema violations")
  void shouldMarkSchemaViolation_whenRequiredFieldMissing() {
    assertThatThrownBy(() -> extractor.parseDraft("{\"title\": \"x\", \"description\": \"y\"}"))
        .isInstanceOf(LlmServiceException.class)
        .hasMessageContaining("requested_products")
        .matches(e -> ((LlmServiceException) e).isSchemaViolation());
  }

  @Test
  @DisplayName("should skip the model call when the corpus has almost no text")
  void shouldSkipModel_whenCorpusTooSmall() {
    ExtractionDraft draft = extractor.extractStructured(corpus("", "   ", "ok"));

    assertThat(draft.lineItems()).isEmpty();
    assertThat(draft.title()).isNull();
    verify(chatModel, never()).chat(any(ChatRequest.class));
  }

  @Test
  @DisplayName("should honour a single-attempt budget")
  void shouldCallOnce_whenMaxAttemptsIsOne() {
    // Given
    intakeConfig.getExtraction().setMaxAttempts(1);
    when(chatModel.chat(any(ChatRequest.class))).thenThrow(new RuntimeException("boom"));

    // When / Then
    assertThatThrownBy(() -> extractor.extractStructured(corpus("Necesitamos 10 sillas")))
        .isInstanceOf(ExtractionFailedException.class);
    verify(chatModel, times(1)).chat(any(ChatRequest.class));
  }
}
