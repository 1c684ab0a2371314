package com.flamingo.ai.rfxintake.service.validation;

import com.flamingo.ai.rfxintake.agent.RfxExtractionSchema;
import com.flamingo.ai.rfxintake.agent.dto.ExtractionDraft;
import com.flamingo.ai.rfxintake.agent.dto.ExtractionDraft.CompanyInfoDraft;
import com.flamingo.ai.rfxintake.agent.dto.ExtractionDraft.EvaluationCriterionDraft;
import com.flamingo.ai.rfxintake.agent.dto.ExtractionDraft.ExtractionConfidenceDraft;
import com.flamingo.ai.rfxintake.agent.dto.ExtractionDraft.LineItemDraft;
import com.flamingo.ai.rfxintake.agent.dto.ExtractionDraft.RequesterInfoDraft;
import com.flamingo.ai.rfxintake.config.IntakeConfig;
import com.flamingo.ai.rfxintake.ingest.model.CanonicalColumn;
import com.flamingo.ai.rfxintake.ingest.model.ContentKind;
import com.flamingo.ai.rfxintake.ingest.model.ExtractedFragment;
import com.flamingo.ai.rfxintake.ingest.model.SourceDescriptor;
import com.flamingo.ai.rfxintake.ingest.model.SpreadsheetRow;
import com.flamingo.ai.rfxintake.service.validation.ValidatedRecord.CompanyInfo;
import com.flamingo.ai.rfxintake.service.validation.ValidatedRecord.Confidence;
import com.flamingo.ai.rfxintake.service.validation.ValidatedRecord.EvaluationCriterion;
import com.flamingo.ai.rfxintake.service.validation.ValidatedRecord.LineItem;
import com.flamingo.ai.rfxintake.service.validation.ValidatedRecord.RequesterInfo;
import com.flamingo.ai.rfxintake.service.validation.ValidationIssue.Code;
import java.math.BigDecimal;
import java.text.Normalizer;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.ResolverStyle;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Stream;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Validates and normalises an {@link ExtractionDraft} into a {@link ValidatedRecord}.
 *
 * <p>Each field is checked on its own: a bad value is nulled (or replaced by a default) and
 * reported as a {@link ValidationIssue}, never thrown. Canonical spreadsheet rows are merged in as
 * line items when the model did not list them.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DraftValidator {

  static final int COMPLETENESS_FIELDS = 10;

  private static final Set<String> RFX_TYPES = Set.of("rfq", "rfp", "rfi");
  private static final Set<String> PRIORITIES = Set.of("low", "medium", "high", "urgent");
  private static final Pattern EMAIL = Pattern.compile("^[^@\\s]+@[^@\\s]+\\.[^@\\s]+$");
  private static final Pattern TIME = Pattern.compile("^([01]?\\d|2[0-3]):[0-5]\\d(:[0-5]\\d)?$");
  private static final List<DateTimeFormatter> DAY_FIRST_FORMATS =
      List.of(
          DateTimeFormatter.ofPattern("d/M/uuuu").withResolverStyle(ResolverStyle.STRICT),
          DateTimeFormatter.ofPattern("d-M-uuuu").withResolverStyle(ResolverStyle.STRICT));

  private final CurrencyNormalizer currencyNormalizer;
  private final IntakeConfig intakeConfig;

  public ValidatedRecord validate(ExtractionDraft draft) {
    return validate(draft, List.of());
  }

  /**
   * Validates the draft and folds in what the extracted fragments add: spreadsheet rows as line
   * items, source descriptors and per-source issues.
   */
  public ValidatedRecord validate(ExtractionDraft draft, List<ExtractedFragment> fragments) {
    List<ValidationIssue> issues = new ArrayList<>();

    List<LineItem> lineItems = validateLineItems(draft.lineItems(), issues);
    mergeSpreadsheetRows(lineItems, fragments, issues);

    BigDecimal budgetMin = number(draft.budgetRangeMin(), "budget_range_min", issues);
    BigDecimal budgetMax = number(draft.budgetRangeMax(), "budget_range_max", issues);
    if (budgetMin != null && budgetMax != null && budgetMax.compareTo(budgetMin) < 0) {
      issues.add(
          new ValidationIssue(
              "budget_range_max",
              Code.INVALID_RANGE,
              "Maximum " + budgetMax + " is below minimum " + budgetMin));
      budgetMax = null;
    }

    CompanyInfo company = validateCompany(draft.companyInfo(), issues);
    RequesterInfo requester = validateRequester(draft.requesterInfo(), issues);

    ValidatedRecord.ValidatedRecordBuilder builder =
        ValidatedRecord.builder()
            .schemaVersion(RfxExtractionSchema.VERSION)
            .title(text(draft.title()))
            .description(text(draft.description()))
            .rfxType(enumValue(draft.rfxType(), RFX_TYPES, "rfx_type", issues))
            .priority(enumValue(draft.priority(), PRIORITIES, "priority", issues))
            .submissionDeadline(date(draft.submissionDeadline(), "submission_deadline", issues))
            .expectedDecisionDate(
                date(draft.expectedDecisionDate(), "expected_decision_date", issues))
            .projectStartDate(date(draft.projectStartDate(), "project_start_date", issues))
            .projectEndDate(date(draft.projectEndDate(), "project_end_date", issues))
            .deliveryDate(date(draft.deliveryDate(), "delivery_date", issues))
            .deliveryTime(time(draft.deliveryTime(), issues))
            .budgetRangeMin(budgetMin)
            .budgetRangeMax(budgetMax)
            .currency(currency(draft.currency(), issues))
            .eventLocation(text(draft.eventLocation()))
            .eventCity(text(draft.eventCity()))
            .eventState(text(draft.eventState()))
            .eventCountry(text(draft.eventCountry()))
            .requirements(text(draft.requirements()))
            .requirementsConfidence(score(draft.requirementsConfidence()))
            .lineItems(lineItems)
            .evaluationCriteria(validateCriteria(draft.evaluationCriteria(), issues))
            .company(company)
            .requester(requester)
            .confidence(validateConfidence(draft.extractionConfidence()))
            .detectedLanguage(text(draft.detectedLanguage()))
            .specialRequirements(texts(draft.specialRequirements()))
            .sources(fragments.stream().map(SourceDescriptor::from).toList());

    addSourceIssues(fragments, issues);
    boolean empty = lineItems.isEmpty() && company == null && requester == null;
    if (empty && !fragments.isEmpty() && allUnsupported(fragments)) {
      issues.add(
          new ValidationIssue(
              "sources", Code.UNSUPPORTED_INPUT, "None of the files contained readable content"));
    }

    ValidatedRecord validated = builder.issues(issues).build();
    RecordStatus status =
        empty
            ? RecordStatus.EMPTY_EXTRACTION
            : issues.isEmpty() ? RecordStatus.COMPLETE : RecordStatus.NEEDS_REVIEW;
    return validated.toBuilder().status(status).completenessScore(completeness(validated)).build();
  }

  private List<LineItem> validateLineItems(
      List<LineItemDraft> drafts, List<ValidationIssue> issues) {
    List<LineItem> items = new ArrayList<>();
    for (int i = 0; i < drafts.size(); i++) {
      LineItemDraft draft = drafts.get(i);
      String name = draft == null ? null : text(draft.productName());
      if (name == null) {
        log.debug("Dropping line item {} without a product name", i);
        continue;
      }
      String path = "requested_products[" + i + "]";
      items.add(
          new LineItem(
              name,
              text(draft.description()),
              text(draft.category()),
              number(draft.quantity(), path + ".quantity", issues),
              text(draft.unitOfMeasure()),
              text(draft.specifications()),
              draft.mandatory() == null || draft.mandatory(),
              number(draft.unitPrice(), path + ".unit_price", issues),
              null));
    }
    return items;
  }

  private void mergeSpreadsheetRows(
      List<LineItem> items, List<ExtractedFragment> fragments, List<ValidationIssue> issues) {
    Set<String> known = new HashSet<>();
    items.forEach(item -> known.add(matchKey(item.productName())));

    for (ExtractedFragment fragment : fragments) {
      for (SpreadsheetRow row : fragment.rows()) {
        String name =
            Stream.of(
                    row.productName(),
                    row.get(CanonicalColumn.DESCRIPTION),
                    row.get(CanonicalColumn.ITEM_CODE))
                .map(DraftValidator::text)
                .filter(Objects::nonNull)
                .findFirst()
                .orElse(null);
        if (name == null || !known.add(matchKey(name))) {
          continue;
        }
        String path = fragment.filename() + "#" + row.sheet() + "!" + row.rowNumber();
        items.add(
            new LineItem(
                name,
                text(row.get(CanonicalColumn.DESCRIPTION)),
                null,
                nonNegative(row.quantity(), path + ".quantity", issues),
                text(row.get(CanonicalColumn.UNIT)),
                null,
                true,
                nonNegative(row.unitPrice(), path + ".unit_price", issues),
                fragment.filename()));
      }
    }
  }

  private List<EvaluationCriterion> validateCriteria(
      List<EvaluationCriterionDraft> drafts, List<ValidationIssue> issues) {
    if (drafts == null) {
      return List.of();
    }
    List<EvaluationCriterion> criteria = new ArrayList<>();
    for (int i = 0; i < drafts.size(); i++) {
      EvaluationCriterionDraft draft = drafts.get(i);
      String criterion = draft == null ? null : text(draft.criterion());
      if (criterion == null) {
        continue;
      }
      criteria.add(
          new EvaluationCriterion(
              criterion,
              number(draft.weight(), "evaluation_criteria[" + i + "].weight", issues),
              text(draft.description())));
    }
    return criteria;
  }

  private CompanyInfo validateCompany(CompanyInfoDraft draft, List<ValidationIssue> issues) {
    if (draft == null) {
      return null;
    }
    CompanyInfo company =
        new CompanyInfo(
            text(draft.companyName()),
            text(draft.industry()),
            text(draft.taxId()),
            email(draft.companyEmail(), "company_info.company_email", issues),
            text(draft.phone()),
            text(draft.address()),
            text(draft.city()),
            text(draft.state()),
            text(draft.country()));
    return allNull(
            company.companyName(),
            company.industry(),
            company.taxId(),
            company.email(),
            company.phone(),
            company.address(),
            company.city(),
            company.state(),
            company.country())
        ? null
        : company;
  }

  private RequesterInfo validateRequester(RequesterInfoDraft draft, List<ValidationIssue> issues) {
    if (draft == null) {
      return null;
    }
    RequesterInfo requester =
        new RequesterInfo(
            text(draft.name()),
            email(draft.email(), "requester_info.email", issues),
            text(draft.phone()),
            text(draft.position()),
            text(draft.department()));
    return allNull(
            requester.name(),
            requester.email(),
            requester.phone(),
            requester.position(),
            requester.department())
        ? null
        : requester;
  }

  private Confidence validateConfidence(ExtractionConfidenceDraft draft) {
    if (draft == null) {
      return null;
    }
    return new Confidence(
        score(draft.overall()),
        score(draft.products()),
        score(draft.dates()),
        score(draft.contact()));
  }

  private void addSourceIssues(List<ExtractedFragment> fragments, List<ValidationIssue> issues) {
    for (ExtractedFragment fragment : fragments) {
      if (!fragment.extractionSucceeded() && !isUnsupported(fragment.kind())) {
        issues.add(
            new ValidationIssue(
                "sources[" + fragment.filename() + "]",
                Code.FAILED_SOURCE,
                "Could not read " + fragment.kind().name().toLowerCase(Locale.ROOT) + " file"));
      }
    }
  }

  private static boolean allUnsupported(List<ExtractedFragment> fragments) {
    return fragments.stream()
        .allMatch(fragment -> isUnsupported(fragment.kind()) && fragment.textYield() == 0);
  }

  private static boolean isUnsupported(ContentKind kind) {
    return kind == ContentKind.UNKNOWN || kind == ContentKind.ARCHIVE_ZIP;
  }

  /** Fraction of the expected top-level fields that carry a value. */
  static double completeness(ValidatedRecord validated) {
    CompanyInfo company = validated.company();
    RequesterInfo requester = validated.requester();
    long present =
        Stream.of(
                validated.title() != null,
                validated.description() != null,
                company != null && company.companyName() != null,
                requester != null && requester.name() != null,
                requester != null && requester.email() != null,
                !validated.lineItems().isEmpty(),
                validated.deliveryDate() != null || validated.submissionDeadline() != null,
                validated.currency() != null,
                validated.budgetRangeMin() != null || validated.budgetRangeMax() != null,
                validated.requirements() != null)
            .filter(Boolean::booleanValue)
            .count();
    return (double) present / COMPLETENESS_FIELDS;
  }

  private String currency(String raw, List<ValidationIssue> issues) {
    if (text(raw) == null) {
      return null;
    }
    String defaultCurrency = intakeConfig.getValidation().getDefaultCurrency();
    return currencyNormalizer
        .normalize(raw)
        .orElseGet(
            () -> {
              issues.add(
                  new ValidationIssue(
                      "currency",
                      Code.UNKNOWN_CURRENCY,
                      "Unrecognised currency '" + raw.strip() + "', using " + defaultCurrency));
              return defaultCurrency;
            });
  }

  private static BigDecimal number(String raw, String field, List<ValidationIssue> issues) {
    if (text(raw) == null) {
      return null;
    }
    BigDecimal value = LenientDecimalParser.parse(raw).orElse(null);
    if (value == null) {
      issues.add(new ValidationIssue(field, Code.INVALID_NUMBER, "Not a number: '" + raw + "'"));
      return null;
    }
    return nonNegative(value, field, issues);
  }

  private static BigDecimal nonNegative(
      BigDecimal value, String field, List<ValidationIssue> issues) {
    if (value != null && value.signum() < 0) {
      issues.add(new ValidationIssue(field, Code.NEGATIVE_NUMBER, "Negative value " + value));
      return null;
    }
    return value;
  }

  private static LocalDate date(String raw, String field, List<ValidationIssue> issues) {
    String value = text(raw);
    if (value == null) {
      return null;
    }
    try {
      return LocalDate.parse(value);
    } catch (DateTimeParseException e) {
      // fall through to the other accepted shapes
    }
    try {
      return OffsetDateTime.parse(value).toLocalDate();
    } catch (DateTimeParseException e) {
      // fall through
    }
    for (DateTimeFormatter format : DAY_FIRST_FORMATS) {
      try {
        return LocalDate.parse(value, format);
      } catch (DateTimeParseException e) {
        // try the next format
      }
    }
    issues.add(new ValidationIssue(field, Code.INVALID_DATE, "Unrecognised date '" + value + "'"));
    return null;
  }

  private static String time(String raw, List<ValidationIssue> issues) {
    String value = text(raw);
    if (value == null || TIME.matcher(value).matches()) {
      return value;
    }
    issues.add(
        new ValidationIssue(
            "delivery_time", Code.INVALID_DATE, "Unrecognised time '" + value + "'"));
    return null;
  }

  private static String email(String raw, String field, List<ValidationIssue> issues) {
    String value = text(raw);
    if (value == null || EMAIL.matcher(value).matches()) {
      return value;
    }
    issues.add(new ValidationIssue(field, Code.INVALID_EMAIL, "Invalid email '" + value + "'"));
    return null;
  }

  private static String enumValue(
      String raw, Set<String> allowed, String field, List<ValidationIssue> issues) {
    String value = text(raw);
    if (value == null) {
      return null;
    }
    String normalized = value.toLowerCase(Locale.ROOT);
    if (allowed.contains(normalized)) {
      return normalized;
    }
    issues.add(new ValidationIssue(field, Code.INVALID_ENUM, "Unexpected value '" + value + "'"));
    return null;
  }

  private static Double score(Double raw) {
    if (raw == null || raw.isNaN()) {
      return null;
    }
    return Math.max(0.0, Math.min(1.0, raw));
  }

  private static String text(String raw) {
    if (raw == null) {
      return null;
    }
    String value = raw.strip();
    return value.isEmpty() || "null".equalsIgnoreCase(value) ? null : value;
  }

  private static List<String> texts(List<String> raw) {
    if (raw == null) {
      return List.of();
    }
    return raw.stream().map(DraftValidator::text).filter(Objects::nonNull).toList();
  }

  private static boolean allNull(Object... values) {
    return Stream.of(values).allMatch(Objects::isNull);
  }

  private static String matchKey(String name) {
    return Normalizer.normalize(name, Normalizer.Form.NFD)
        .replaceAll("\\p{M}", "")
        .toLowerCase(Locale.ROOT)
        .replaceAll("\\s+", " ")
        .strip();
  }
}
