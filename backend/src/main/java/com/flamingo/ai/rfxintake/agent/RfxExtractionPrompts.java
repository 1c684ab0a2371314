package com.flamingo.ai.rfxintake.agent;

import com.flamingo.ai.rfxintake.ingest.model.AggregatedCorpus;
import com.flamingo.ai.rfxintake.ingest.model.CorpusSection;

/** Prompts for the structured extraction call. */
public final class RfxExtractionPrompts {

  public static final String SYSTEM_MESSAGE =
      """
      You extract structured data from request-for-quotation, request-for-proposal and
      request-for-information documents written in Spanish or English.

      Rules:
      - Answer only with a JSON object matching the provided schema (version %s).
      - Copy values from the documents. Never invent names, quantities, prices or dates; leave a
        field null when the documents do not state it.
      - List every requested product or service as its own entry in requested_products, with the
        quantity as a number. Spreadsheet rows are already normalised: one row is one product.
      - Write dates as YYYY-MM-DD and currencies as ISO-4217 codes.
      - company_info describes the organisation issuing the request, requester_info the person
        who sent it. Do not fill them with the supplier's details.
      - Confidence scores go from 0 to 1 and reflect how explicit the documents were.
      """
          .formatted(RfxExtractionSchema.VERSION);

  private static final String MULTI_SOURCE_NOTE =
      """
      The text below combines %d source files. Each starts with a line "%s<filename>".
      Consider all of them together. When sources disagree, prefer the one that appears later.

      """;

  private static final String RETRY_NOTE =
      """
      The previous answer was rejected: %s
      Answer again with a single JSON object that matches the schema. Pay attention to:
      - a product_name on every entry of requested_products
      - quantities and prices as plain positive numbers
      - dates as YYYY-MM-DD and valid email addresses

      """;

  private RfxExtractionPrompts() {}

  public static String userMessage(AggregatedCorpus corpus) {
    StringBuilder message = new StringBuilder();
    if (corpus.sectionCount() > 1) {
      message.append(
          MULTI_SOURCE_NOTE.formatted(corpus.sectionCount(), CorpusSection.MARKER_PREFIX));
    }
    message.append("Extract the RFX data from the following documents:\n\n");
    message.append(corpus.text());
    return message.toString();
  }

  /** User message for a new attempt after the model's answer failed schema checks. */
  public static String retryMessage(AggregatedCorpus corpus, String previousError) {
    return RETRY_NOTE.formatted(previousError) + userMessage(corpus);
  }
}
