package com.flamingo.ai.rfxintake.service.validation;

import com.flamingo.ai.rfxintake.ingest.model.SourceDescriptor;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import lombok.Builder;

/**
 * Final typed output of the intake pipeline. Every present field satisfies its type and range
 * constraints; fields that did not are null and listed in {@link #issues()}.
 */
@Builder(toBuilder = true)
public record ValidatedRecord(
    String schemaVersion,
    RecordStatus status,
    double completenessScore, // fraction of expected top-level fields present, 0..1
    String title,
    String description,
    String rfxType,
    String priority,
    LocalDate submissionDeadline,
    LocalDate expectedDecisionDate,
    LocalDate projectStartDate,
    LocalDate projectEndDate,
    LocalDate deliveryDate,
    String deliveryTime,
    BigDecimal budgetRangeMin,
    BigDecimal budgetRangeMax,
    String currency, // ISO-4217
    String eventLocation,
    String eventCity,
    String eventState,
    String eventCountry,
    String requirements,
    Double requirementsConfidence,
    List<LineItem> lineItems,
    List<EvaluationCriterion> evaluationCriteria,
    CompanyInfo company,
    RequesterInfo requester,
    Confidence confidence,
    String detectedLanguage,
    List<String> specialRequirements,
    List<SourceDescriptor> sources,
    List<ValidationIssue> issues) {

  public ValidatedRecord {
    lineItems = lineItems == null ? List.of() : List.copyOf(lineItems);
    evaluationCriteria = evaluationCriteria == null ? List.of() : List.copyOf(evaluationCriteria);
    specialRequirements =
        specialRequirements == null ? List.of() : List.copyOf(specialRequirements);
    sources = sources == null ? List.of() : List.copyOf(sources);
    issues = issues == null ? List.of() : List.copyOf(issues);
  }

  public boolean isEmptyExtraction() {
    return status == RecordStatus.EMPTY_EXTRACTION;
  }

  public boolean hasIssues() {
    return !issues.isEmpty();
  }

  /**
   * A requested product or service.
   *
   * @param source filename the item was read from, null when it came from the model
   */
  public record LineItem(
      String productName,
      String description,
      String category,
      BigDecimal quantity,
      String unitOfMeasure,
      String specifications,
      boolean mandatory,
      BigDecimal unitPrice,
      String source) {}

  public record EvaluationCriterion(String criterion, BigDecimal weight, String description) {}

  public record CompanyInfo(
      String companyName,
      String industry,
      String taxId,
      String email,
      String phone,
      String address,
      String city,
      String state,
      String country) {}

  public record RequesterInfo(
      String name, String email, String phone, String position, String department) {}

  public record Confidence(Double overall, Double products, Double dates, Double contact) {}
}
