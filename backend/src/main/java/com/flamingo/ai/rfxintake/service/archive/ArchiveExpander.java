package com.flamingo.ai.rfxintake.service.archive;

import com.flamingo.ai.rfxintake.config.IntakeConfig;
import com.flamingo.ai.rfxintake.config.IntakeFeatureFlags;
import com.flamingo.ai.rfxintake.ingest.model.ClassifiedBlob;
import com.flamingo.ai.rfxintake.ingest.model.ContentKind;
import com.flamingo.ai.rfxintake.ingest.model.InputBlob;
import com.flamingo.ai.rfxintake.service.detection.ContentTypeDetector;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Unpacks ZIP uploads into their member files, one level deep.
 *
 * <p>Members are classified with the {@link ContentTypeDetector}. A member that is itself an
 * archive keeps {@link ContentKind#ARCHIVE_ZIP} and is never opened. A corrupt archive comes back
 * as a single {@link ContentKind#UNKNOWN} blob; with expansion disabled the archive is returned
 * unchanged.
 */
@Component
@Slf4j
public class ArchiveExpander {

  private static final int COPY_BUFFER_BYTES = 8192;

  /** Size of the end-of-central-directory record, the whole of a well-formed empty archive. */
  private static final int EMPTY_ARCHIVE_BYTES = 22;

  private final ContentTypeDetector detector;
  private final IntakeFeatureFlags flags;
  private final IntakeConfig.Limits limits;

  @Autowired
  public ArchiveExpander(ContentTypeDetector detector, IntakeConfig intakeConfig) {
    this(detector, intakeConfig.featureFlags(), intakeConfig.getLimits());
  }

  public ArchiveExpander(
      ContentTypeDetector detector, IntakeFeatureFlags flags, IntakeConfig.Limits limits) {
    this.detector = detector;
    this.flags = flags;
    this.limits = limits;
  }

  public List<ClassifiedBlob> expand(ClassifiedBlob archive) {
    if (archive.kind() != ContentKind.ARCHIVE_ZIP || !flags.useZip() || archive.sequence() > 0) {
      return List.of(archive);
    }

    try {
      Expansion expansion = readMembers(archive);
      List<ClassifiedBlob> members = expansion.members();
      if (expansion.entriesSeen() == 0 && archive.blob().size() > EMPTY_ARCHIVE_BYTES) {
        throw new IOException("no readable entries");
      }
      if (members.isEmpty()) {
        log.info("Archive '{}' contains no usable members", archive.filename());
        return List.of(archive);
      }
      log.debug("Expanded archive '{}' into {} members", archive.filename(), members.size());
      return members;
    } catch (IOException | IllegalArgumentException e) {
      log.warn(
          "Archive '{}' could not be read, treating it as unknown content: {}",
          archive.filename(),
          e.getMessage());
      return List.of(archive.withKind(ContentKind.UNKNOWN));
    }
  }

  private Expansion readMembers(ClassifiedBlob archive) throws IOException {
    List<ClassifiedBlob> members = new ArrayList<>();
    long expandedBytes = 0;
    int sequence = 0;
    int entriesSeen = 0;

    try (ZipInputStream zip =
        new ZipInputStream(new ByteArrayInputStream(archive.blob().content()))) {
      ZipEntry entry;
      while ((entry = zip.getNextEntry()) != null) {
        entriesSeen++;
        if (entry.isDirectory() || isMetadataEntry(entry.getName())) {
          continue;
        }
        if (members.size() >= limits.getMaxArchiveEntries()) {
          log.warn(
              "Archive '{}' has more than {} members, skipping the rest",
              archive.filename(),
              limits.getMaxArchiveEntries());
          break;
        }

        long remaining = limits.getMaxExpandedBytes() - expandedBytes;
        byte[] content = readBounded(zip, Math.min(limits.getMaxFileBytes(), remaining));
        if (content == null) {
          if (remaining < limits.getMaxFileBytes()) {
            log.warn(
                "Archive '{}' inflates beyond {} bytes, skipping remaining members",
                archive.filename(),
                limits.getMaxExpandedBytes());
            break;
          }
          log.warn(
              "Skipping archive member '{}' in '{}': larger than {} bytes",
              entry.getName(),
              archive.filename(),
              limits.getMaxFileBytes());
          continue;
        }
        expandedBytes += content.length;

        InputBlob member = new InputBlob(archive.filename() + "/" + entry.getName(), content, null);
        members.add(
            new ClassifiedBlob(member, detector.detect(member), archive.ordinal(), ++sequence));
      }
    }
    return new Expansion(members, entriesSeen);
  }

  /** Reads the current entry, or returns null once more than {@code limit} bytes are seen. */
  private static byte[] readBounded(InputStream in, long limit) throws IOException {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    byte[] buffer = new byte[COPY_BUFFER_BYTES];
    long total = 0;
    int read;
    while ((read = in.read(buffer)) != -1) {
      total += read;
      if (total > limit) {
        return null;
      }
      out.write(buffer, 0, read);
    }
    return out.toByteArray();
  }

  private record Expansion(List<ClassifiedBlob> members, int entriesSeen) {}

  private static boolean isMetadataEntry(String name) {
    String baseName = name.substring(name.lastIndexOf('/') + 1);
    return name.startsWith("__MACOSX/") || baseName.startsWith(".");
  }
}
