package com.flamingo.ai.rfxintake.agent.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Raw structured output of the extraction model, before validation.
 *
 * <p>Scalars that need checking (numbers, dates, currency) are kept as the model wrote them; the
 * validator parses and coerces them. Every field may be null.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ExtractionDraft(
    String title,
    String description,
    @JsonProperty("rfx_type") String rfxType, // rfq | rfp | rfi
    String priority, // low | medium | high | urgent
    @JsonProperty("submission_deadline") String submissionDeadline,
    @JsonProperty("expected_decision_date") String expectedDecisionDate,
    @JsonProperty("project_start_date") String projectStartDate,
    @JsonProperty("project_end_date") String projectEndDate,
    @JsonProperty("delivery_date") String deliveryDate,
    @JsonProperty("delivery_time") String deliveryTime,
    @JsonProperty("budget_range_min") String budgetRangeMin,
    @JsonProperty("budget_range_max") String budgetRangeMax,
    String currency,
    @JsonProperty("event_location") String eventLocation,
    @JsonProperty("event_city") String eventCity,
    @JsonProperty("event_state") String eventState,
    @JsonProperty("event_country") String eventCountry,
    String requirements,
    @JsonProperty("requirements_confidence") Double requirementsConfidence,
    @JsonProperty("requested_products") List<LineItemDraft> requestedProducts,
    @JsonProperty("evaluation_criteria") List<EvaluationCriterionDraft> evaluationCriteria,
    @JsonProperty("company_info") CompanyInfoDraft companyInfo,
    @JsonProperty("requester_info") RequesterInfoDraft requesterInfo,
    @JsonProperty("extraction_confidence") ExtractionConfidenceDraft extractionConfidence,
    @JsonProperty("detected_language") String detectedLanguage,
    @JsonProperty("special_requirements") List<String> specialRequirements) {

  /** Draft used when there is no text worth sending to the model. */
  public static ExtractionDraft empty() {
    return new ExtractionDraft(
        null, null, null, null, null, null, null, null, null, null, null, null, null, null, null,
        null, null, null, null, List.of(), List.of(), null, null, null, null, List.of());
  }

  public List<LineItemDraft> lineItems() {
    return requestedProducts == null ? List.of() : requestedProducts;
  }

  /** A product line as written by the model. */
  @JsonIgnoreProperties(ignoreUnknown = true)
  public record LineItemDraft(
      @JsonProperty("product_name") String productName,
      String description,
      String category,
      String quantity,
      @JsonProperty("unit_of_measure") String unitOfMeasure,
      String specifications,
      @JsonProperty("is_mandatory") Boolean mandatory,
      @JsonProperty("unit_price") String unitPrice) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record EvaluationCriterionDraft(String criterion, String weight, String description) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record CompanyInfoDraft(
      @JsonProperty("company_name") String companyName,
      String industry,
      @JsonProperty("tax_id") String taxId,
      @JsonProperty("company_email") String companyEmail,
      String phone,
      String address,
      String city,
      String state,
      String country) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record RequesterInfoDraft(
      String name, String email, String phone, String position, String department) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record ExtractionConfidenceDraft(
      Double overall, Double products, Double dates, Double contact) {}
}
