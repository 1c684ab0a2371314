package com.flamingo.ai.rfxintake.service.aggregation;

import com.flamingo.ai.rfxintake.config.IntakeConfig;
import com.flamingo.ai.rfxintake.ingest.model.AggregatedCorpus;
import com.flamingo.ai.rfxintake.ingest.model.ContentKind;
import com.flamingo.ai.rfxintake.ingest.model.CorpusSection;
import com.flamingo.ai.rfxintake.ingest.model.ExtractedFragment;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Concatenates fragments into the corpus sent to the model.
 *
 * <p>Sections follow upload order (archive members at their archive's position, in entry order),
 * whatever order the fragments finished in. Failed fragments still get a marker line with an empty
 * body.
 *
 * <p>When section bodies exceed the character budget, bodies are cut from the end, least valuable
 * sources first: OCR output, then plain text, then PDF and Word text, spreadsheets last. Within a
 * tier the longest body is cut first.
 */
@Component
@Slf4j
public class CorpusAggregator {

  static final String TRUNCATION_NOTE = "\n[... truncated %d chars]";

  private static final Comparator<ExtractedFragment> UPLOAD_ORDER =
      Comparator.comparingInt(ExtractedFragment::ordinal)
          .thenComparingInt(ExtractedFragment::sequence);

  private final int maxChars;

  @Autowired
  public CorpusAggregator(IntakeConfig intakeConfig) {
    this(intakeConfig.getCorpus().getMaxChars());
  }

  public CorpusAggregator(int maxChars) {
    this.maxChars = maxChars;
  }

  public AggregatedCorpus aggregate(List<ExtractedFragment> fragments) {
    List<ExtractedFragment> ordered = fragments.stream().sorted(UPLOAD_ORDER).toList();
    int[] keep = truncationPlan(ordered);

    List<CorpusSection> sections = new ArrayList<>(ordered.size());
    StringBuilder text = new StringBuilder();
    for (int i = 0; i < ordered.size(); i++) {
      ExtractedFragment fragment = ordered.get(i);
      String body = fragment.text().strip();
      int removed = body.length() - keep[i];
      if (removed > 0) {
        body = body.substring(0, keep[i]).stripTrailing() + String.format(TRUNCATION_NOTE, removed);
      }
      CorpusSection section =
          new CorpusSection(fragment.filename(), fragment.kind(), body, Math.max(0, removed));
      sections.add(section);
      if (i > 0) {
        text.append('\n');
      }
      text.append(section.render());
    }

    AggregatedCorpus corpus = new AggregatedCorpus(sections, text.toString());
    log.info(
        "Aggregated {} sections into {} chars ({} chars truncated)",
        sections.size(),
        corpus.text().length(),
        corpus.truncatedChars());
    return corpus;
  }

  /** Characters of each body to keep, indexed like {@code ordered}. */
  private int[] truncationPlan(List<ExtractedFragment> ordered) {
    int[] keep = new int[ordered.size()];
    long total = 0;
    for (int i = 0; i < ordered.size(); i++) {
      keep[i] = ordered.get(i).text().strip().length();
      total += keep[i];
    }

    long overflow = total - maxChars;
    if (overflow <= 0) {
      return keep;
    }

    List<Integer> cutOrder = new ArrayList<>();
    for (int i = 0; i < ordered.size(); i++) {
      cutOrder.add(i);
    }
    cutOrder.sort(
        Comparator.<Integer>comparingInt(i -> retentionPriority(ordered.get(i)))
            .thenComparing(i -> keep[i], Comparator.reverseOrder()));

    for (int index : cutOrder) {
      if (overflow <= 0) {
        break;
      }
      int cut = (int) Math.min(overflow, keep[index]);
      keep[index] -= cut;
      overflow -= cut;
    }
    return keep;
  }

  /** Lower values are truncated first. */
  static int retentionPriority(ExtractedFragment fragment) {
    if (fragment.usedOcrFallback()) {
      return 0;
    }
    ContentKind kind = fragment.kind();
    if (kind.isSpreadsheet()) {
      return 3;
    }
    if (kind == ContentKind.PDF || kind == ContentKind.DOCX) {
      return 2;
    }
    return 1;
  }
}
