package com.flamingo.ai.rfxintake.ingest.model;

/**
 * A blob paired with its detected kind and its position in the request.
 *
 * @param blob the payload
 * @param kind detected content kind
 * @param ordinal index of the uploaded file this blob came from
 * @param sequence position inside an expanded archive, 0 for top-level uploads
 */
public record ClassifiedBlob(InputBlob blob, ContentKind kind, int ordinal, int sequence) {

  public String filename() {
    return blob.filename();
  }

  public ClassifiedBlob withKind(ContentKind newKind) {
    return new ClassifiedBlob(blob, newKind, ordinal, sequence);
  }
}
