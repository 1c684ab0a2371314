package com.flamingo.ai.rfxintake.exception;

/** Thrown before extraction when a file or the whole request is larger than allowed. */
public class SizeLimitExceededException extends RuntimeException {

  private final String filename;
  private final long actualBytes;
  private final long limitBytes;
  private final String userMessage;

  public SizeLimitExceededException(String filename, long actualBytes, long limitBytes) {
    super(
        filename == null
            ? String.format("Request is %d bytes, limit is %d bytes", actualBytes, limitBytes)
            : String.format(
                "File '%s' is %d bytes, limit is %d bytes", filename, actualBytes, limitBytes));
    this.filename = filename;
    this.actualBytes = actualBytes;
    this.limitBytes = limitBytes;
    long limitMb = toMegabytes(limitBytes);
    this.userMessage =
        filename == null
            ? "The uploaded files exceed the total size limit of " + limitMb + " MB"
            : "File '" + filename + "' exceeds the size limit of " + limitMb + " MB";
  }

  /** Filename that exceeded the per-file limit, or null when the request total was exceeded. */
  public String getFilename() {
    return filename;
  }

  public long getActualBytes() {
    return actualBytes;
  }

  public long getLimitBytes() {
    return limitBytes;
  }

  public String getUserMessage() {
    return userMessage;
  }

  private static long toMegabytes(long bytes) {
    return bytes / (1024 * 1024);
  }
}
