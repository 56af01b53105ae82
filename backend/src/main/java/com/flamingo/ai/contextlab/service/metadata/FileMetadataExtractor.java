package com.flamingo.ai.contextlab.service.metadata;

import com.flamingo.ai.contextlab.service.processing.AbstractContextProcessor;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.FileTime;
import java.nio.file.attribute.PosixFilePermission;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.apache.tika.Tika;
import org.apache.tika.mime.MediaType;
import org.springframework.stereotype.Service;

/**
 * Extracts file-system metadata for any file plus a format-specific tier for the categories in
 * {@link FileCategory}.
 *
 * <p>Extraction is best-effort. A missing file yields an empty map; a failing format extractor only
 * loses its own tier.
 */
@Service
@Slf4j
public class FileMetadataExtractor {

  private static final double BYTES_PER_MB = 1024.0 * 1024.0;

  private final Map<FileCategory, FormatMetadataExtractor> extractors;
  private final Tika tika = new Tika();

  public FileMetadataExtractor(List<FormatMetadataExtractor> formatExtractors) {
    Map<FileCategory, FormatMetadataExtractor> byCategory = new EnumMap<>(FileCategory.class);
    for (FormatMetadataExtractor extractor : formatExtractors) {
      FormatMetadataExtractor previous = byCategory.put(extractor.getCategory(), extractor);
      if (previous != null) {
        throw new IllegalStateException(
            "Duplicate metadata extractor for " + extractor.getCategory());
      }
    }
    this.extractors = Collections.unmodifiableMap(byCategory);
    log.info("Registered metadata extractors for {}", byCategory.keySet());
  }

  /**
   * Extracts metadata from a file.
   *
   * @param filePath file to inspect
   * @return metadata map; empty when the file does not exist or cannot be read
   */
  public Map<String, Object> extractMetadata(Path filePath) {
    if (filePath == null || !Files.exists(filePath)) {
      log.warn("File not found: {}", filePath);
      return Map.of();
    }

    Map<String, Object> metadata;
    try {
      metadata = extractBasicMetadata(filePath);
    } catch (IOException e) {
      log.error("Error extracting metadata from {}: {}", filePath, e.getMessage(), e);
      return Map.of();
    }

    String extension = AbstractContextProcessor.extensionOf(filePath);
    Optional<FileCategory> category = FileCategory.fromExtension(extension);
    if (category.isPresent() && extractors.containsKey(category.get())) {
      try {
        metadata.putAll(extractors.get(category.get()).extract(filePath));
      } catch (Exception e) {
        log.warn(
            "Error extracting {} metadata from {}: {}", category.get(), filePath, e.getMessage());
      }
    }
    return metadata;
  }

  private Map<String, Object> extractBasicMetadata(Path filePath) throws IOException {
    BasicFileAttributes attributes = Files.readAttributes(filePath, BasicFileAttributes.class);
    String fileName = filePath.getFileName().toString();
    String extension = AbstractContextProcessor.extensionOf(filePath);
    long size = attributes.size();

    Map<String, Object> metadata = new LinkedHashMap<>();
    metadata.put("file_name", fileName);
    metadata.put("file_path", filePath.toAbsolutePath().toString());
    metadata.put("file_size", size);
    metadata.put("file_size_mb", Math.round(size / BYTES_PER_MB * 100.0) / 100.0);
    metadata.put("created_time", toIso(attributes.creationTime()));
    metadata.put("modified_time", toIso(attributes.lastModifiedTime()));
    metadata.put("accessed_time", toIso(attributes.lastAccessTime()));
    metadata.put("file_extension", extension);
    metadata.put("file_stem", fileName.substring(0, fileName.length() - extension.length()));

    String mimeType = tika.detect(fileName);
    if (mimeType != null && !MediaType.OCTET_STREAM.toString().equals(mimeType)) {
      metadata.put("mime_type", mimeType);
    }

    try {
      metadata.put("permissions", toOctal(Files.getPosixFilePermissions(filePath)));
    } catch (UnsupportedOperationException e) {
      log.debug("POSIX permissions not available for {}", filePath);
    }
    return metadata;
  }

  private static String toIso(FileTime time) {
    return LocalDateTime.ofInstant(time.toInstant(), ZoneId.systemDefault()).toString();
  }

  /** Renders permissions as three octal digits, e.g. {@code 644}. */
  static String toOctal(Set<PosixFilePermission> permissions) {
    int owner = 0;
    int group = 0;
    int others = 0;
    for (PosixFilePermission permission : permissions) {
      switch (permission) {
        case OWNER_READ -> owner |= 4;
        case OWNER_WRITE -> owner |= 2;
        case OWNER_EXECUTE -> owner |= 1;
        case GROUP_READ -> group |= 4;
        case GROUP_WRITE -> group |= 2;
        case GROUP_EXECUTE -> group |= 1;
        case OTHERS_READ -> others |= 4;
        case OTHERS_WRITE -> others |= 2;
        case OTHERS_EXECUTE -> others |= 1;
        default -> {}
      }
    }
    return "" + owner + group + others;
  }
}
