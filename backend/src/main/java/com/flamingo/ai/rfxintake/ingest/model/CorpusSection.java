package com.flamingo.ai.rfxintake.ingest.model;

/**
 * One {@code ### SOURCE:} section of the aggregated corpus.
 *
 * @param filename source filename written in the marker line
 * @param kind content kind of the source
 * @param body section text after truncation
 * @param truncatedChars characters removed from the body to respect the corpus budget
 */
public record CorpusSection(String filename, ContentKind kind, String body, int truncatedChars) {

  public static final String MARKER_PREFIX = "### SOURCE: ";

  public String render() {
    return body.isEmpty()
        ? MARKER_PREFIX + filename + "\n"
        : MARKER_PREFIX + filename + "\n" + body + "\n";
  }
}
