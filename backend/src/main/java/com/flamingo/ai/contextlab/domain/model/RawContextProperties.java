package com.flamingo.ai.contextlab.domain.model;

import com.flamingo.ai.contextlab.domain.enums.ContentFormat;
import com.flamingo.ai.contextlab.domain.enums.ContextSource;
import java.time.LocalDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Input envelope describing one unprocessed captured item, as handed over by a capture component.
 *
 * <p>Exactly one of {@code rawData} and {@code contentPath} carries the content. Every processor in
 * this module reads from {@code contentPath}; in-memory payloads are left to other consumers.
 *
 * @param objectId identifier of the captured object; processed contexts derive their id from it
 * @param source capture component that produced the item
 * @param contentFormat physical format of the content
 * @param rawData in-memory content, or {@code null}
 * @param contentPath file system path of the content, or {@code null}
 * @param metadata capture-side metadata, copied to an unmodifiable map
 * @param createTime capture time
 */
public record RawContextProperties(
    String objectId,
    ContextSource source,
    ContentFormat contentFormat,
    byte[] rawData,
    String contentPath,
    Map<String, Object> metadata,
    LocalDateTime createTime) {

  public RawContextProperties {
    if (objectId == null || objectId.isBlank()) {
      throw new IllegalArgumentException("objectId is required");
    }
    if (rawData != null && contentPath != null) {
      throw new IllegalArgumentException("rawData and contentPath are mutually exclusive");
    }
    metadata =
        metadata == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    createTime = createTime == null ? LocalDateTime.now() : createTime;
  }

  /** Creates a properties object for a file on the local file system. */
  public static RawContextProperties forLocalFile(
      String objectId, String contentPath, Map<String, Object> metadata) {
    return new RawContextProperties(
        objectId,
        ContextSource.LOCAL_FILE,
        ContentFormat.FILE,
        null,
        contentPath,
        metadata,
        LocalDateTime.now());
  }
}
