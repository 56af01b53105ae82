package com.flamingo.ai.contextlab.service.metadata;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.tika.parser.txt.CharsetDetector;
import org.apache.tika.parser.txt.CharsetMatch;
import org.springframework.stereotype.Component;

/** Line statistics and detected character encoding for source files. */
@Component
public class CodeMetadataExtractor implements FormatMetadataExtractor {

  private static final List<String> COMMENT_PREFIXES = List.of("#", "//", "/*", "*");

  @Override
  public FileCategory getCategory() {
    return FileCategory.CODE;
  }

  @Override
  public Map<String, Object> extract(Path filePath) throws IOException {
    byte[] bytes = Files.readAllBytes(filePath);
    String content =
        StandardCharsets.UTF_8
            .newDecoder()
            .onMalformedInput(CodingErrorAction.IGNORE)
            .onUnmappableCharacter(CodingErrorAction.IGNORE)
            .decode(ByteBuffer.wrap(bytes))
            .toString();
    String[] lines = content.split("\n", -1);

    long nonEmpty = 0;
    long comments = 0;
    for (String line : lines) {
      String stripped = line.strip();
      if (stripped.isEmpty()) {
        continue;
      }
      nonEmpty++;
      if (COMMENT_PREFIXES.stream().anyMatch(stripped::startsWith)) {
        comments++;
      }
    }

    Map<String, Object> metadata = new LinkedHashMap<>();
    metadata.put("code_total_lines", lines.length);
    metadata.put("code_non_empty_lines", nonEmpty);
    metadata.put("code_comment_lines", comments);

    CharsetDetector detector = new CharsetDetector();
    detector.setText(bytes);
    CharsetMatch match = detector.detect();
    if (match != null) {
      metadata.put("code_encoding", match.getName());
      metadata.put("code_encoding_confidence", match.getConfidence() / 100.0);
    }
    return metadata;
  }
}
