package com.flamingo.ai.rfxintake.service.pipeline;

import com.flamingo.ai.rfxintake.agent.dto.ExtractionDraft;
import com.flamingo.ai.rfxintake.config.IntakeConfig;
import com.flamingo.ai.rfxintake.exception.IntakeProcessingException;
import com.flamingo.ai.rfxintake.exception.PipelineTimeoutException;
import com.flamingo.ai.rfxintake.exception.SizeLimitExceededException;
import com.flamingo.ai.rfxintake.ingest.model.AggregatedCorpus;
import com.flamingo.ai.rfxintake.ingest.model.ClassifiedBlob;
import com.flamingo.ai.rfxintake.ingest.model.ExtractedFragment;
import com.flamingo.ai.rfxintake.ingest.model.InputBlob;
import com.flamingo.ai.rfxintake.service.aggregation.CorpusAggregator;
import com.flamingo.ai.rfxintake.service.ai.StructuredRfxExtractor;
import com.flamingo.ai.rfxintake.service.archive.ArchiveExpander;
import com.flamingo.ai.rfxintake.service.detection.ContentTypeDetector;
import com.flamingo.ai.rfxintake.service.extraction.FragmentExtractor;
import com.flamingo.ai.rfxintake.service.validation.DraftValidator;
import com.flamingo.ai.rfxintake.service.validation.ValidatedRecord;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;

/**
 * Runs one intake request end to end: size checks, detection and archive expansion, parallel
 * extraction, aggregation, the structured model call and validation.
 *
 * <p>Blobs are extracted independently on the shared worker pool; a failing blob becomes an empty
 * fragment instead of failing the request. The whole request shares one deadline. When it passes,
 * in-flight work is cancelled and {@link PipelineTimeoutException} is thrown; there is no partial
 * result.
 */
@Service
@Slf4j
public class RfxIntakePipeline {

  private static final Duration SATURATED_POLL = Duration.ofMillis(20);

  private final ContentTypeDetector detector;
  private final ArchiveExpander archiveExpander;
  private final FragmentExtractor fragmentExtractor;
  private final CorpusAggregator corpusAggregator;
  private final StructuredRfxExtractor structuredExtractor;
  private final DraftValidator draftValidator;
  private final ExecutorService executor;
  private final IntakeConfig intakeConfig;
  private final MeterRegistry meterRegistry;

  @Autowired
  public RfxIntakePipeline(
      ContentTypeDetector detector,
      ArchiveExpander archiveExpander,
      FragmentExtractor fragmentExtractor,
      CorpusAggregator corpusAggregator,
      StructuredRfxExtractor structuredExtractor,
      DraftValidator draftValidator,
      @Qualifier("intakeExecutor") ThreadPoolTaskExecutor intakeExecutor,
      IntakeConfig intakeConfig,
      MeterRegistry meterRegistry) {
    this(
        detector,
        archiveExpander,
        fragmentExtractor,
        corpusAggregator,
        structuredExtractor,
        draftValidator,
        intakeExecutor.getThreadPoolExecutor(),
        intakeConfig,
        meterRegistry);
  }

  RfxIntakePipeline(
      ContentTypeDetector detector,
      ArchiveExpander archiveExpander,
      FragmentExtractor fragmentExtractor,
      CorpusAggregator corpusAggregator,
      StructuredRfxExtractor structuredExtractor,
      DraftValidator draftValidator,
      ExecutorService executor,
      IntakeConfig intakeConfig,
      MeterRegistry meterRegistry) {
    this.detector = detector;
    this.archiveExpander = archiveExpander;
    this.fragmentExtractor = fragmentExtractor;
    this.corpusAggregator = corpusAggregator;
    this.structuredExtractor = structuredExtractor;
    this.draftValidator = draftValidator;
    this.executor = executor;
    this.intakeConfig = intakeConfig;
    this.meterRegistry = meterRegistry;
  }

  /**
   * Processes the uploaded files of one request.
   *
   * @param blobs uploaded files in the order the client sent them
   * @return validated record, possibly flagged with issues or as an empty extraction
   * @throws SizeLimitExceededException if a file or the request total is too large
   * @throws com.flamingo.ai.rfxintake.exception.ExtractionFailedException if the model call
   *     exhausted its attempts
   * @throws PipelineTimeoutException if the request timeout elapsed
   */
  @Timed(value = "intake.process", description = "Time to process an intake request")
  public ValidatedRecord process(List<InputBlob> blobs) {
    checkSizeLimits(blobs);
    Duration timeout = intakeConfig.getPipeline().getRequestTimeout();
    long deadline = System.nanoTime() + timeout.toNanos();
    log.info("Processing intake request with {} files", blobs.size());

    List<ClassifiedBlob> classified = classifyAndExpand(blobs);
    List<ExtractedFragment> fragments = extractAll(classified, deadline, timeout);
    AggregatedCorpus corpus = corpusAggregator.aggregate(fragments);

    ExtractionDraft draft =
        awaitWithin(
            "structured extraction",
            submitWithin(
                "structured extraction",
                () -> structuredExtractor.extractStructured(corpus),
                deadline,
                timeout),
            deadline,
            timeout);

    ValidatedRecord result = draftValidator.validate(draft, fragments);
    meterRegistry
        .counter("intake.records", "status", result.status().name().toLowerCase(Locale.ROOT))
        .increment();
    log.info(
        "Intake request finished: status={}, {} line items, completeness {}, {} issues",
        result.status(),
        result.lineItems().size(),
        String.format(Locale.ROOT, "%.2f", result.completenessScore()),
        result.issues().size());
    return result;
  }

  private void checkSizeLimits(List<InputBlob> blobs) {
    IntakeConfig.Limits limits = intakeConfig.getLimits();
    long total = 0;
    for (InputBlob blob : blobs) {
      if (blob.size() > limits.getMaxFileBytes()) {
        throw new SizeLimitExceededException(
            blob.filename(), blob.size(), limits.getMaxFileBytes());
      }
      total += blob.size();
    }
    if (total > limits.getMaxTotalBytes()) {
      throw new SizeLimitExceededException(null, total, limits.getMaxTotalBytes());
    }
  }

  private List<ClassifiedBlob> classifyAndExpand(List<InputBlob> blobs) {
    List<ClassifiedBlob> classified = new ArrayList<>();
    for (int ordinal = 0; ordinal < blobs.size(); ordinal++) {
      InputBlob blob = blobs.get(ordinal);
      ClassifiedBlob top = new ClassifiedBlob(blob, detector.detect(blob), ordinal, 0);
      classified.addAll(archiveExpander.expand(top));
    }
    return classified;
  }

  private List<ExtractedFragment> extractAll(
      List<ClassifiedBlob> classified, long deadline, Duration timeout) {
    List<Future<ExtractedFragment>> futures = new ArrayList<>(classified.size());
    try {
      for (ClassifiedBlob blob : classified) {
        futures.add(submitWithin("extraction", extractionTask(blob), deadline, timeout));
      }
    } catch (PipelineTimeoutException | IntakeProcessingException e) {
      futures.forEach(future -> future.cancel(true));
      throw e;
    }

    List<ExtractedFragment> fragments = new ArrayList<>(futures.size());
    for (int i = 0; i < futures.size(); i++) {
      try {
        fragments.add(awaitWithin("extraction", futures.get(i), deadline, timeout));
      } catch (PipelineTimeoutException | IntakeProcessingException e) {
        futures.forEach(future -> future.cancel(true));
        throw e;
      }
    }
    return fragments;
  }

  private Callable<ExtractedFragment> extractionTask(ClassifiedBlob blob) {
    return () -> {
      try {
        return fragmentExtractor.extract(blob);
      } catch (RuntimeException | LinkageError e) {
        log.warn("Unexpected failure extracting '{}': {}", blob.filename(), e.toString());
        return ExtractedFragment.empty(blob, false);
      }
    };
  }

  /**
   * Hands a task to the shared pool, waiting for room while the pool is saturated. Tasks never run
   * on the request thread, so the deadline bounds them.
   */
  private <T> Future<T> submitWithin(
      String stage, Callable<T> task, long deadline, Duration timeout) {
    while (true) {
      try {
        return executor.submit(task);
      } catch (RejectedExecutionException e) {
        long remaining = deadline - System.nanoTime();
        if (remaining <= 0) {
          log.error("Intake request timed out waiting for a worker during {}", stage);
          throw new PipelineTimeoutException(stage, timeout);
        }
        try {
          TimeUnit.NANOSECONDS.sleep(Math.min(remaining, SATURATED_POLL.toNanos()));
        } catch (InterruptedException interrupted) {
          Thread.currentThread().interrupt();
          throw new IntakeProcessingException("Interrupted during " + stage, interrupted);
        }
      }
    }
  }

  private <T> T awaitWithin(String stage, Future<T> future, long deadline, Duration timeout) {
    try {
      long remaining = deadline - System.nanoTime();
      return future.get(Math.max(0, remaining), TimeUnit.NANOSECONDS);
    } catch (TimeoutException e) {
      future.cancel(true);
      log.error("Intake request timed out during {}", stage);
      throw new PipelineTimeoutException(stage, timeout);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      future.cancel(true);
      throw new IntakeProcessingException("Interrupted during " + stage, e);
    } catch (ExecutionException e) {
      if (e.getCause() instanceof RuntimeException runtimeException) {
        throw runtimeException;
      }
      throw new IntakeProcessingException("Failure during " + stage, e.getCause());
    }
  }
}
