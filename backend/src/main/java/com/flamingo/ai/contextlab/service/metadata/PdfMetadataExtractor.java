package com.flamingo.ai.contextlab.service.metadata;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDDocumentInformation;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Component;

/** PDF document information, page count and a first-page text preview. */
@Component
public class PdfMetadataExtractor implements FormatMetadataExtractor {

  private static final int PREVIEW_LENGTH = 500;

  @Override
  public FileCategory getCategory() {
    return FileCategory.PDF;
  }

  @Override
  public Map<String, Object> extract(Path filePath) throws IOException {
    Map<String, Object> metadata = new LinkedHashMap<>();
    try (PDDocument document = Loader.loadPDF(filePath.toFile())) {
      PDDocumentInformation info = document.getDocumentInformation();
      if (info != null) {
        for (String key : info.getMetadataKeys()) {
          String value = info.getCustomMetadataValue(key);
          if (value != null && !value.isEmpty()) {
            metadata.put("pdf_" + key.toLowerCase(Locale.ROOT), value);
          }
        }
      }

      int pageCount = document.getNumberOfPages();
      metadata.put("pdf_page_count", pageCount);
      if (pageCount > 0) {
        PDFTextStripper stripper = new PDFTextStripper();
        stripper.setStartPage(1);
        stripper.setEndPage(1);
        String text = stripper.getText(document);
        if (text != null && !text.isBlank()) {
          metadata.put(
              "pdf_first_page_preview", text.substring(0, Math.min(PREVIEW_LENGTH, text.length())));
        }
      }
    }
    return metadata;
  }
}
