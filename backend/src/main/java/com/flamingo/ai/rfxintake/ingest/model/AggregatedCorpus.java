package com.flamingo.ai.rfxintake.ingest.model;

import java.util.List;

/**
 * Ordered, source-annotated text handed to the structured extractor.
 *
 * @param sections sections in upload order
 * @param text rendered corpus
 */
public record AggregatedCorpus(List<CorpusSection> sections, String text) {

  public AggregatedCorpus {
    sections = List.copyOf(sections);
    text = text == null ? "" : text;
  }

  public int sectionCount() {
    return sections.size();
  }

  public int truncatedChars() {
    return sections.stream().mapToInt(CorpusSection::truncatedChars).sum();
  }

  /** Non-whitespace characters across section bodies, markers excluded. */
  public int contentYield() {
    return sections.stream()
        .mapToInt(section -> ExtractedFragment.nonWhitespaceLength(section.body()))
        .sum();
  }
}
