package com.flamingo.ai.rfxintake.config;

import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the RFX intake pipeline. */
@Configuration
@ConfigurationProperties(prefix = "intake")
@Getter
@Setter
public class IntakeConfig {

  private Features features = new Features();
  private Limits limits = new Limits();
  private Ocr ocr = new Ocr();
  private Corpus corpus = new Corpus();
  private Extraction extraction = new Extraction();
  private Validation validation = new Validation();
  private Pipeline pipeline = new Pipeline();

  /** Snapshot of the feature flags, taken once when a stage is constructed. */
  public IntakeFeatureFlags featureFlags() {
    return new IntakeFeatureFlags(features.isUseOcr(), features.isUseZip());
  }

  @Getter
  @Setter
  public static class Features {
    private boolean useOcr = true;
    private boolean useZip = true;
  }

  @Getter
  @Setter
  public static class Limits {
    private long maxFileBytes = 16L * 1024 * 1024; // 16 MB
    private long maxTotalBytes = 32L * 1024 * 1024; // 32 MB

    /** Members read from a single archive before the rest are skipped. */
    private int maxArchiveEntries = 200;

    /** Inflated bytes read from a single archive before the rest are skipped. */
    private long maxExpandedBytes = 32L * 1024 * 1024;
  }

  @Getter
  @Setter
  public static class Ocr {
    /** Non-whitespace characters per page below which the text layer counts as missing. */
    private int minCharsPerPage = 50;

    private int dpi = 200;
    private int maxPages = 10;
    private String language = "spa+eng";
    private int timeoutSeconds = 120;
  }

  @Getter
  @Setter
  public static class Corpus {
    /** Upper bound on section body characters sent to the model. */
    private int maxChars = 120_000;
  }

  @Getter
  @Setter
  public static class Extraction {
    /** Total model calls per request, first attempt included. */
    private int maxAttempts = 3;

    private Duration initialBackoff = Duration.ofSeconds(2);
    private double backoffMultiplier = 2.0;

    /** Corpora with fewer non-whitespace characters skip the model call. */
    private int minCorpusChars = 10;
  }

  @Getter
  @Setter
  public static class Validation {
    private String defaultCurrency = "USD";
  }

  @Getter
  @Setter
  public static class Pipeline {
    private int workerThreads = 4;
    private int queueCapacity = 64;
    private Duration requestTimeout = Duration.ofSeconds(180);
  }
}
