package com.flamingo.ai.rfxintake.agent;

import dev.langchain4j.model.chat.request.json.JsonArraySchema;
import dev.langchain4j.model.chat.request.json.JsonEnumSchema;
import dev.langchain4j.model.chat.request.json.JsonNumberSchema;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.request.json.JsonSchema;
import dev.langchain4j.model.chat.request.json.JsonSchemaElement;
import dev.langchain4j.model.chat.request.json.JsonStringSchema;
import java.util.List;

/**
 * Versioned JSON schema the extraction model must answer with.
 *
 * <p>Line items, criteria, company and requester are nested objects; everything else is a flat
 * property of the root. Numbers are typed as numbers, dates as ISO-8601 strings.
 */
public final class RfxExtractionSchema {

  public static final String NAME = "rfx_extraction";
  public static final String VERSION = "2.2";

  /** Root keys every conformant response must carry. */
  public static final List<String> REQUIRED = List.of("title", "description", "requested_products");

  private static final JsonSchema SCHEMA = build();

  private RfxExtractionSchema() {}

  public static JsonSchema schema() {
    return SCHEMA;
  }

  private static JsonSchema build() {
    JsonObjectSchema root =
        JsonObjectSchema.builder()
            .description("Structured RFX record, schema version " + VERSION)
            .addStringProperty("title", "Short title of the request")
            .addStringProperty("description", "What is being requested, in one paragraph")
            .addProperty("rfx_type", enumOf("Kind of request", "rfq", "rfp", "rfi"))
            .addProperty("priority", enumOf("Urgency", "low", "medium", "high", "urgent"))
            .addStringProperty("submission_deadline", "ISO-8601 date proposals are due")
            .addStringProperty("expected_decision_date", "ISO-8601 date")
            .addStringProperty("project_start_date", "ISO-8601 date")
            .addStringProperty("project_end_date", "ISO-8601 date")
            .addStringProperty("delivery_date", "ISO-8601 date goods or services are needed")
            .addStringProperty("delivery_time", "Time of day for delivery, HH:mm")
            .addNumberProperty("budget_range_min", "Lower budget bound")
            .addNumberProperty("budget_range_max", "Upper budget bound, not below the minimum")
            .addStringProperty("currency", "ISO-4217 currency code")
            .addStringProperty("event_location", "Venue or delivery address")
            .addStringProperty("event_city")
            .addStringProperty("event_state")
            .addStringProperty("event_country")
            .addStringProperty("requirements", "Technical and commercial requirements")
            .addNumberProperty("requirements_confidence", "0 to 1")
            .addProperty("requested_products", arrayOf("Requested products", lineItem()))
            .addProperty(
                "evaluation_criteria", arrayOf("How proposals will be evaluated", criterion()))
            .addProperty("company_info", companyInfo())
            .addProperty("requester_info", requesterInfo())
            .addProperty("extraction_confidence", confidence())
            .addStringProperty("detected_language", "ISO-639-1 code of the source documents")
            .addProperty(
                "special_requirements",
                arrayOf("Special conditions", JsonStringSchema.builder().build()))
            .required(REQUIRED)
            .build();

    return JsonSchema.builder().name(NAME).rootElement(root).build();
  }

  private static JsonObjectSchema lineItem() {
    return JsonObjectSchema.builder()
        .addStringProperty("product_name", "Product or service name")
        .addStringProperty("description")
        .addStringProperty("category")
        .addNumberProperty("quantity", "Requested quantity, never negative")
        .addStringProperty("unit_of_measure")
        .addStringProperty("specifications")
        .addBooleanProperty("is_mandatory")
        .addNumberProperty("unit_price", "Unit price stated in the documents, if any")
        .required("product_name", "quantity")
        .build();
  }

  private static JsonObjectSchema criterion() {
    return JsonObjectSchema.builder()
        .addStringProperty("criterion")
        .addNumberProperty("weight", "Relative weight, percent")
        .addStringProperty("description")
        .required("criterion")
        .build();
  }

  private static JsonObjectSchema companyInfo() {
    return JsonObjectSchema.builder()
        .description("The organisation issuing the request")
        .addStringProperty("company_name")
        .addStringProperty("industry")
        .addStringProperty("tax_id")
        .addStringProperty("company_email")
        .addStringProperty("phone")
        .addStringProperty("address")
        .addStringProperty("city")
        .addStringProperty("state")
        .addStringProperty("country")
        .build();
  }

  private static JsonObjectSchema requesterInfo() {
    return JsonObjectSchema.builder()
        .description("The person who sent the request")
        .addStringProperty("name")
        .addStringProperty("email")
        .addStringProperty("phone")
        .addStringProperty("position")
        .addStringProperty("department")
        .build();
  }

  private static JsonObjectSchema confidence() {
    JsonNumberSchema score = JsonNumberSchema.builder().description("0 to 1").build();
    return JsonObjectSchema.builder()
        .addProperty("overall", score)
        .addProperty("products", score)
        .addProperty("dates", score)
        .addProperty("contact", score)
        .build();
  }

  private static JsonEnumSchema enumOf(String description, String... values) {
    return JsonEnumSchema.builder().description(description).enumValues(values).build();
  }

  private static JsonArraySchema arrayOf(String description, JsonSchemaElement items) {
    return JsonArraySchema.builder().description(description).items(items).build();
  }
}
