package com.flamingo.ai.contextlab.service.metadata;

import static com.flamingo.ai.contextlab.service.metadata.DocxMetadataExtractor.isoDate;
import static com.flamingo.ai.contextlab.service.metadata.DocxMetadataExtractor.putIfPresent;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.poi.hpsf.SummaryInformation;
import org.apache.poi.hssf.usermodel.HSSFWorkbook;
import org.apache.poi.ooxml.POIXMLProperties;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.springframework.stereotype.Component;

/** Workbook properties, sheet names and first-sheet dimensions. */
@Component
public class SpreadsheetMetadataExtractor implements FormatMetadataExtractor {

  @Override
  public FileCategory getCategory() {
    return FileCategory.XLSX;
  }

  @Override
  public Map<String, Object> extract(Path filePath) throws IOException {
    Map<String, Object> metadata = new LinkedHashMap<>();
    try (Workbook workbook = WorkbookFactory.create(filePath.toFile(), null, true)) {
      if (workbook instanceof XSSFWorkbook) {
        POIXMLProperties.CoreProperties core =
            ((XSSFWorkbook) workbook).getProperties().getCoreProperties();
        putIfPresent(metadata, "xlsx_title", core.getTitle());
        putIfPresent(metadata, "xlsx_creator", core.getCreator());
        putIfPresent(metadata, "xlsx_subject", core.getSubject());
        putIfPresent(metadata, "xlsx_keywords", core.getKeywords());
        putIfPresent(metadata, "xlsx_created", isoDate(core.getCreated()));
        putIfPresent(metadata, "xlsx_modified", isoDate(core.getModified()));
        putIfPresent(metadata, "xlsx_last_modified_by", core.getLastModifiedByUser());
      } else if (workbook instanceof HSSFWorkbook) {
        SummaryInformation summary = ((HSSFWorkbook) workbook).getSummaryInformation();
        if (summary != null) {
          putIfPresent(metadata, "xlsx_title", summary.getTitle());
          putIfPresent(metadata, "xlsx_creator", summary.getAuthor());
          putIfPresent(metadata, "xlsx_subject", summary.getSubject());
          putIfPresent(metadata, "xlsx_keywords", summary.getKeywords());
          putIfPresent(metadata, "xlsx_created", isoDate(summary.getCreateDateTime()));
          putIfPresent(metadata, "xlsx_modified", isoDate(summary.getLastSaveDateTime()));
          putIfPresent(metadata, "xlsx_last_modified_by", summary.getLastAuthor());
        }
      }

      List<String> sheetNames = new ArrayList<>();
      for (Sheet sheet : workbook) {
        sheetNames.add(sheet.getSheetName());
      }
      metadata.put("xlsx_sheet_count", sheetNames.size());
      metadata.put("xlsx_sheet_names", sheetNames);

      if (workbook.getNumberOfSheets() > 0) {
        Sheet first = workbook.getSheetAt(0);
        int columns = 0;
        for (Row row : first) {
          columns = Math.max(columns, row.getLastCellNum());
        }
        metadata.put(
            "xlsx_first_sheet_rows",
            first.getPhysicalNumberOfRows() == 0 ? 0 : first.getLastRowNum() + 1);
        metadata.put("xlsx_first_sheet_cols", columns);
      }
    }
    return metadata;
  }
}
