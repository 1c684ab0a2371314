package com.flamingo.ai.rfxintake.service.detection;

import com.flamingo.ai.rfxintake.ingest.model.ContentKind;
import com.flamingo.ai.rfxintake.ingest.model.InputBlob;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Set;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;
import lombok.extern.slf4j.Slf4j;
import org.apache.tika.mime.MediaType;
import org.springframework.stereotype.Component;

/**
 * Classifies a blob into a {@link ContentKind}.
 *
 * <p>Magic bytes win over the filename extension, which wins over the declared MIME type. The
 * declared type is client-controlled and frequently wrong for re-uploaded files, so it never
 * overrides a positive signature match. Detection is a pure function of the blob and never
 * throws; anything unrecognised is {@link ContentKind#UNKNOWN}.
 */
@Component
@Slf4j
public class ContentTypeDetector {

  static final int TEXT_SNIFF_MAX_BYTES = 50_000;
  private static final int ZIP_SNIFF_MAX_ENTRIES = 64;

  private static final byte[] PDF = {'%', 'P', 'D', 'F'};
  private static final byte[] ZIP_LOCAL = {'P', 'K', 3, 4};
  private static final byte[] ZIP_EMPTY = {'P', 'K', 5, 6};
  private static final byte[] ZIP_SPANNED = {'P', 'K', 7, 8};
  private static final byte[] PNG = {(byte) 0x89, 'P', 'N', 'G', 0x0D, 0x0A, 0x1A, 0x0A};
  private static final byte[] JPEG = {(byte) 0xFF, (byte) 0xD8, (byte) 0xFF};
  private static final byte[] TIFF_LE = {'I', 'I', 0x2A, 0x00};
  private static final byte[] TIFF_BE = {'M', 'M', 0x00, 0x2A};
  private static final byte[] GIF = {'G', 'I', 'F', '8'};
  private static final byte[] BMP = {'B', 'M'};
  private static final byte[] OLE2 = {(byte) 0xD0, (byte) 0xCF, 0x11, (byte) 0xE0};

  private static final Map<String, ContentKind> EXTENSIONS =
      Map.ofEntries(
          Map.entry("pdf", ContentKind.PDF),
          Map.entry("docx", ContentKind.DOCX),
          Map.entry("xlsx", ContentKind.SPREADSHEET_XLSX),
          Map.entry("csv", ContentKind.SPREADSHEET_CSV),
          Map.entry("txt", ContentKind.PLAIN_TEXT),
          Map.entry("text", ContentKind.PLAIN_TEXT),
          Map.entry("md", ContentKind.PLAIN_TEXT),
          Map.entry("log", ContentKind.PLAIN_TEXT),
          Map.entry("zip", ContentKind.ARCHIVE_ZIP),
          Map.entry("png", ContentKind.IMAGE),
          Map.entry("jpg", ContentKind.IMAGE),
          Map.entry("jpeg", ContentKind.IMAGE),
          Map.entry("tif", ContentKind.IMAGE),
          Map.entry("tiff", ContentKind.IMAGE),
          Map.entry("gif", ContentKind.IMAGE),
          Map.entry("bmp", ContentKind.IMAGE));

  private static final Map<String, ContentKind> MIME_TYPES =
      Map.of(
          "application/pdf", ContentKind.PDF,
          "application/vnd.openxmlformats-officedocument.wordprocessingml.document",
              ContentKind.DOCX,
          "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet",
              ContentKind.SPREADSHEET_XLSX,
          "text/csv", ContentKind.SPREADSHEET_CSV,
          "application/csv", ContentKind.SPREADSHEET_CSV,
          "text/plain", ContentKind.PLAIN_TEXT,
          "application/zip", ContentKind.ARCHIVE_ZIP,
          "application/x-zip-compressed", ContentKind.ARCHIVE_ZIP);

  private static final Set<String> OOXML_WORD_EXTENSIONS = Set.of("docx");
  private static final Set<String> OOXML_SHEET_EXTENSIONS = Set.of("xlsx");

  public ContentKind detect(InputBlob blob) {
    ContentKind kind = detectInternal(blob);
    log.debug("Detected '{}' ({} bytes) as {}", blob.filename(), blob.size(), kind);
    return kind;
  }

  private ContentKind detectInternal(InputBlob blob) {
    byte[] bytes = blob.content();
    String extension = blob.extension();

    ContentKind byMagic = detectByMagic(bytes, extension);
    if (byMagic != null) {
      return byMagic;
    }

    ContentKind byExtension = EXTENSIONS.get(extension);
    if (byExtension != null) {
      return byExtension;
    }

    ContentKind byMime = detectByMime(blob.declaredMimeType());
    if (byMime != null) {
      return byMime;
    }

    return looksLikeText(bytes) ? ContentKind.PLAIN_TEXT : ContentKind.UNKNOWN;
  }

  /** Returns null when no signature matches. */
  private ContentKind detectByMagic(byte[] bytes, String extension) {
    if (startsWith(bytes, PDF)) {
      return ContentKind.PDF;
    }
    if (startsWith(bytes, ZIP_LOCAL)
        || startsWith(bytes, ZIP_EMPTY)
        || startsWith(bytes, ZIP_SPANNED)) {
      return classifyZipContainer(bytes, extension);
    }
    if (startsWith(bytes, PNG)
        || startsWith(bytes, JPEG)
        || startsWith(bytes, TIFF_LE)
        || startsWith(bytes, TIFF_BE)
        || startsWith(bytes, GIF)) {
      return ContentKind.IMAGE;
    }
    if (startsWith(bytes, BMP) && "bmp".equals(extension)) {
      return ContentKind.IMAGE;
    }
    if (startsWith(bytes, OLE2)) {
      // legacy .doc / .xls compound files are not supported
      return ContentKind.UNKNOWN;
    }
    return null;
  }

  private ContentKind classifyZipContainer(byte[] bytes, String extension) {
    if (OOXML_WORD_EXTENSIONS.contains(extension)) {
      return ContentKind.DOCX;
    }
    if (OOXML_SHEET_EXTENSIONS.contains(extension)) {
      return ContentKind.SPREADSHEET_XLSX;
    }
    if ("zip".equals(extension)) {
      return ContentKind.ARCHIVE_ZIP;
    }
    return sniffOoxmlParts(bytes);
  }

  /** Office files uploaded without their extension still carry their part folders. */
  private ContentKind sniffOoxmlParts(byte[] bytes) {
    try (ZipInputStream zip = new ZipInputStream(new ByteArrayInputStream(bytes))) {
      ZipEntry entry;
      int seen = 0;
      while ((entry = zip.getNextEntry()) != null && seen++ < ZIP_SNIFF_MAX_ENTRIES) {
        String name = entry.getName();
        if (name.startsWith("word/")) {
          return ContentKind.DOCX;
        }
        if (name.startsWith("xl/")) {
          return ContentKind.SPREADSHEET_XLSX;
        }
      }
    } catch (IOException | IllegalArgumentException e) {
      log.debug("Could not list ZIP entries while sniffing: {}", e.getMessage());
    }
    return ContentKind.ARCHIVE_ZIP;
  }

  private ContentKind detectByMime(String declaredMimeType) {
    if (declaredMimeType == null || declaredMimeType.isBlank()) {
      return null;
    }
    MediaType mediaType = MediaType.parse(declaredMimeType.strip());
    if (mediaType == null) {
      return null;
    }
    String baseType = mediaType.getBaseType().toString();
    if ("image".equals(mediaType.getType())) {
      return ContentKind.IMAGE;
    }
    return MIME_TYPES.get(baseType);
  }

  private boolean looksLikeText(byte[] bytes) {
    if (bytes.length == 0 || bytes.length >= TEXT_SNIFF_MAX_BYTES) {
      return false;
    }
    for (byte b : bytes) {
      if (b == 0) {
        return false;
      }
    }
    try {
      StandardCharsets.UTF_8
          .newDecoder()
          .onMalformedInput(CodingErrorAction.REPORT)
          .onUnmappableCharacter(CodingErrorAction.REPORT)
          .decode(ByteBuffer.wrap(bytes));
      return true;
    } catch (CharacterCodingException e) {
      return false;
    }
  }

  private static boolean startsWith(byte[] bytes, byte[] signature) {
    if (bytes.length < signature.length) {
      return false;
    }
    for (int i = 0; i < signature.length; i++) {
      if (bytes[i] != signature[i]) {
        return false;
      }
    }
    return true;
  }
}
