package com.flamingo.ai.rfxintake.service.ai;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.rfxintake.agent.RfxExtractionPrompts;
import com.flamingo.ai.rfxintake.agent.RfxExtractionSchema;
import com.flamingo.ai.rfxintake.agent.dto.ExtractionDraft;
import com.flamingo.ai.rfxintake.config.IntakeConfig;
import com.flamingo.ai.rfxintake.exception.ExtractionFailedException;
import com.flamingo.ai.rfxintake.exception.LlmServiceException;
import com.flamingo.ai.rfxintake.ingest.model.AggregatedCorpus;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.ResponseFormat;
import dev.langchain4j.model.chat.request.ResponseFormatType;
import dev.langchain4j.model.chat.response.ChatResponse;
import io.github.resilience4j.core.IntervalFunction;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Turns the aggregated corpus into an {@link ExtractionDraft} with one schema-constrained model
 * call, retried with exponential backoff.
 *
 * <p>Transport errors and responses that do not conform to {@link RfxExtractionSchema} both count
 * as failed attempts; after a schema violation the next attempt tells the model what was wrong
 * with its previous answer. After {@code maxAttempts} failures the request fails with {@link
 * ExtractionFailedException}; a partially parsed draft is never returned. Nothing is cached across
 * requests.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StructuredRfxExtractor {

  private final ChatModel chatModel;
  private final ObjectMapper objectMapper;
  private final IntakeConfig intakeConfig;
  private final MeterRegistry meterRegistry;

  @Timed(value = "intake.ai.extraction", description = "Time to extract structured RFX data")
  public ExtractionDraft extractStructured(AggregatedCorpus corpus) {
    IntakeConfig.Extraction config = intakeConfig.getExtraction();
    if (corpus.contentYield() < config.getMinCorpusChars()) {
      log.info(
          "Corpus has only {} non-whitespace chars, skipping model call", corpus.contentYield());
      return ExtractionDraft.empty();
    }

    ExtractionOutcome outcome = attemptExtraction(corpus, config);
    if (outcome.succeeded()) {
      log.info(
          "Extracted {} line items in {} attempt(s)",
          outcome.draft().lineItems().size(),
          outcome.attempts());
      return outcome.draft();
    }

    meterRegistry.counter("intake.ai.failures").increment();
    LlmServiceException lastError = outcome.lastError();
    log.error(
        "Structured extraction failed after {} attempts: {}",
        outcome.attempts(),
        lastError != null ? lastError.getMessage() : "no attempt made");
    throw new ExtractionFailedException(
        "Structured extraction failed after " + outcome.attempts() + " attempts",
        outcome.attempts(),
        lastError);
  }

  ExtractionOutcome attemptExtraction(AggregatedCorpus corpus, IntakeConfig.Extraction config) {
    ChatRequest request = buildRequest(RfxExtractionPrompts.userMessage(corpus));
    IntervalFunction backoff =
        IntervalFunction.ofExponentialBackoff(
            config.getInitialBackoff(), config.getBackoffMultiplier());
    int maxAttempts = Math.max(1, config.getMaxAttempts());

    LlmServiceException lastError = null;
    for (int attempt = 1; attempt <= maxAttempts; attempt++) {
      meterRegistry.counter("intake.ai.attempts").increment();
      try {
        return ExtractionOutcome.success(callOnce(request), attempt);
      } catch (LlmServiceException e) {
        lastError = e;
        log.warn(
            "Extraction attempt {}/{} failed ({}): {}",
            attempt,
            maxAttempts,
            e.isSchemaViolation() ? "schema" : "service",
            e.getMessage());
        if (e.isSchemaViolation()) {
          request = buildRequest(RfxExtractionPrompts.retryMessage(corpus, e.getMessage()));
        }
      }

      if (attempt < maxAttempts) {
        long delayMillis = backoff.apply(attempt);
        log.debug("Retrying extraction in {} ms", delayMillis);
        try {
          Thread.sleep(delayMillis);
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          return ExtractionOutcome.failure(attempt, lastError);
        }
      }
    }
    return ExtractionOutcome.failure(maxAttempts, lastError);
  }

  private ChatRequest buildRequest(String userMessage) {
    return ChatRequest.builder()
        .messages(
            SystemMessage.from(RfxExtractionPrompts.SYSTEM_MESSAGE),
            UserMessage.from(userMessage))
        .responseFormat(
            ResponseFormat.builder()
                .type(ResponseFormatType.JSON)
                .jsonSchema(RfxExtractionSchema.schema())
                .build())
        .build();
  }

  private ExtractionDraft callOnce(ChatRequest request) {
    ChatResponse response;
    try {
      response = chatModel.chat(request);
    } catch (RuntimeException e) {
      throw new LlmServiceException("Model call failed: " + e.getMessage(), e);
    }
    AiMessage message = response != null ? response.aiMessage() : null;
    return parseDraft(message != null ? message.text() : null);
  }

  ExtractionDraft parseDraft(String responseText) {
    if (responseText == null || responseText.isBlank()) {
      throw LlmServiceException.schemaViolation("Empty model response");
    }

    JsonNode root;
    try {
      root = objectMapper.readTree(stripCodeFences(responseText));
    } catch (JsonProcessingException e) {
      throw LlmServiceException.schemaViolation("Response is not JSON: " + e.getOriginalMessage());
    }
    checkStructure(root);

    try {
      return objectMapper.treeToValue(root, ExtractionDraft.class);
    } catch (JsonProcessingException e) {
      throw LlmServiceException.schemaViolation(
          "Response does not match schema " + RfxExtractionSchema.VERSION + ": "
              + e.getOriginalMessage());
    }
  }

  private void checkStructure(JsonNode root) {
    if (root == null || !root.isObject()) {
      throw LlmServiceException.schemaViolation("Response is not a JSON object");
    }
    for (String field : RfxExtractionSchema.REQUIRED) {
      if (!root.has(field)) {
        throw LlmServiceException.schemaViolation("Missing required field '" + field + "'");
      }
    }
    JsonNode products = root.get("requested_products");
    if (!products.isArray()) {
      throw LlmServiceException.schemaViolation("'requested_products' is not an array");
    }
    for (JsonNode product : products) {
      JsonNode name = product.get("product_name");
      if (!product.isObject() || name == null || !name.isTextual() || name.asText().isBlank()) {
        throw LlmServiceException.schemaViolation("Line item without product_name");
      }
    }
  }

  /** Models sometimes wrap JSON in markdown fences despite the response format. */
  static String stripCodeFences(String text) {
    String trimmed = text.strip();
    if (trimmed.startsWith("```")) {
      int firstNewline = trimmed.indexOf('\n');
      int lastFence = trimmed.lastIndexOf("```");
      if (firstNewline > 0 && lastFence > firstNewline) {
        return trimmed.substring(firstNewline + 1, lastFence).strip();
      }
    }
    return trimmed;
  }
}
