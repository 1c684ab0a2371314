package com.flamingo.ai.rfxintake.service.ai;

import com.flamingo.ai.rfxintake.agent.dto.ExtractionDraft;
import com.flamingo.ai.rfxintake.exception.LlmServiceException;

/**
 * Result of the attempt loop: either a draft or the last error seen.
 *
 * @param draft parsed draft, null on failure
 * @param attempts model calls made
 * @param lastError error of the final attempt, null on success
 */
public record ExtractionOutcome(
    ExtractionDraft draft, int attempts, LlmServiceException lastError) {

  public static ExtractionOutcome success(ExtractionDraft draft, int attempts) {
    return new ExtractionOutcome(draft, attempts, null);
  }

  public static ExtractionOutcome failure(int attempts, LlmServiceException lastError) {
    return new ExtractionOutcome(null, attempts, lastError);
  }

  public boolean succeeded() {
    return draft != null;
  }
}
