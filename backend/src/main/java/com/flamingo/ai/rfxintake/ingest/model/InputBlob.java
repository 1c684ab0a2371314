package com.flamingo.ai.rfxintake.ingest.model;

import java.util.Locale;

/**
 * One uploaded file before classification.
 *
 * <p>The byte array is shared, not copied: blobs can be up to the per-file limit and callers hand
 * ownership over when they build one.
 *
 * @param filename original filename, never null
 * @param content raw bytes, never null
 * @param declaredMimeType client-declared MIME type, may be null
 */
public record InputBlob(String filename, byte[] content, String declaredMimeType) {

  public InputBlob {
    filename = filename == null || filename.isBlank() ? "unnamed" : filename;
    content = content == null ? new byte[0] : content;
  }

  public static InputBlob of(String filename, byte[] content) {
    return new InputBlob(filename, content, null);
  }

  public int size() {
    return content.length;
  }

  /** Lower-case extension without the dot, or empty string when the name has none. */
  public String extension() {
    int slash = Math.max(filename.lastIndexOf('/'), filename.lastIndexOf('\\'));
    int dot = filename.lastIndexOf('.');
    if (dot <= slash + 1 || dot == filename.length() - 1) {
      return "";
    }
    return filename.substring(dot + 1).toLowerCase(Locale.ROOT);
  }
}
