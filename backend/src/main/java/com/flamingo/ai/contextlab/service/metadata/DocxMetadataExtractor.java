package com.flamingo.ai.contextlab.service.metadata;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.apache.poi.ooxml.POIXMLProperties;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.springframework.stereotype.Component;

/**
 * Word core properties and document statistics. Legacy binary {@code .doc} files are not OOXML
 * and fail here, which only drops this tier.
 */
@Component
public class DocxMetadataExtractor implements FormatMetadataExtractor {

  private static final int PREVIEW_PARAGRAPHS = 5;
  private static final int PREVIEW_LENGTH = 500;

  @Override
  public FileCategory getCategory() {
    return FileCategory.DOCX;
  }

  @Override
  public Map<String, Object> extract(Path filePath) throws IOException {
    Map<String, Object> metadata = new LinkedHashMap<>();
    try (InputStream in = Files.newInputStream(filePath);
        XWPFDocument document = new XWPFDocument(in)) {
      POIXMLProperties.CoreProperties core = document.getProperties().getCoreProperties();
      putIfPresent(metadata, "docx_title", core.getTitle());
      putIfPresent(metadata, "docx_author", core.getCreator());
      putIfPresent(metadata, "docx_subject", core.getSubject());
      putIfPresent(metadata, "docx_keywords", core.getKeywords());
      putIfPresent(metadata, "docx_created", isoDate(core.getCreated()));
      putIfPresent(metadata, "docx_modified", isoDate(core.getModified()));
      putIfPresent(metadata, "docx_last_modified_by", core.getLastModifiedByUser());

      List<XWPFParagraph> paragraphs = document.getParagraphs();
      metadata.put("docx_paragraph_count", paragraphs.size());
      metadata.put("docx_table_count", document.getTables().size());

      String preview =
          paragraphs.stream()
              .limit(PREVIEW_PARAGRAPHS)
              .map(XWPFParagraph::getText)
              .filter(text -> text != null && !text.isEmpty())
              .collect(Collectors.joining("\n"));
      if (!preview.isEmpty()) {
        metadata.put(
            "docx_text_preview", preview.substring(0, Math.min(PREVIEW_LENGTH, preview.length())));
      }
    }
    return metadata;
  }

  static void putIfPresent(Map<String, Object> metadata, String key, String value) {
    if (value != null && !value.isEmpty()) {
      metadata.put(key, value);
    }
  }

  static String isoDate(Date date) {
    return date == null ? null : date.toInstant().toString();
  }
}
