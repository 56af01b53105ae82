package com.flamingo.ai.contextlab.service.processing.excel;

import com.flamingo.ai.contextlab.config.IngestionConfig;
import com.flamingo.ai.contextlab.domain.model.Chunk;
import com.flamingo.ai.contextlab.domain.model.ProcessedContext;
import com.flamingo.ai.contextlab.domain.model.RawContextProperties;
import com.flamingo.ai.contextlab.exception.ContextProcessingException;
import com.flamingo.ai.contextlab.service.processing.AbstractContextProcessor;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.Comment;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.apache.poi.ss.util.CellAddress;
import org.apache.poi.ss.util.CellReference;
import org.apache.poi.xssf.usermodel.XSSFSheet;
import org.apache.poi.xssf.usermodel.XSSFTable;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Processor for Excel workbooks. Each sheet with data becomes its own context with id {@code
 * <objectId>_<sheetName>}: a header chunk describing columns, types and numeric ranges, followed
 * by row batches rendered as aligned text tables.
 */
@Service
@Order(10)
@Slf4j
public class ExcelProcessor extends AbstractContextProcessor {

  public static final String NAME = "excel_processor";

  public static final Set<String> SUPPORTED_FORMATS = Set.of(".xlsx", ".xls");

  private static final int KEYWORD_COLUMNS = 5;

  private final IngestionConfig.Excel config;

  public ExcelProcessor(IngestionConfig ingestionConfig, MeterRegistry meterRegistry) {
    super(meterRegistry);
    this.config = ingestionConfig.getExcel();
  }

  @Override
  public String getName() {
    return NAME;
  }

  @Override
  public String getDescription() {
    return "Excel processor with sheet-level chunking and metadata extraction";
  }

  @Override
  public Set<String> getSupportedFormats() {
    return SUPPORTED_FORMATS;
  }

  @Override
  protected boolean isEnabled() {
    return config.isEnabled();
  }

  @Override
  protected List<ProcessedContext> doProcess(RawContextProperties raw, Path filePath) {
    List<ProcessedContext> contexts = new ArrayList<>();
    try (Workbook workbook = WorkbookFactory.create(filePath.toFile(), null, true)) {
      for (Sheet sheet : workbook) {
        SheetTable table = SheetTable.read(sheet);
        if (!table.hasData()) {
          log.debug("Skipping sheet '{}' in {}: no data rows", sheet.getSheetName(), filePath);
          continue;
        }
        Optional<List<Map<String, String>>> tables = detectTables(sheet);
        Map<String, Object> metadata = extractSheetMetadata(sheet, filePath, tables);
        List<Chunk> chunks = createChunks(sheet, table);
        contexts.add(
            createContext(
                raw, chunks, metadata, sheet.getSheetName(), tables.orElse(List.of())));
      }
    } catch (IOException | RuntimeException e) {
      throw new ContextProcessingException(
          raw.objectId(), raw.contentPath(), "Failed to read workbook: " + e.getMessage(), e);
    }
    log.info("Extracted {} sheet context(s) from {}", contexts.size(), filePath);
    return contexts;
  }

  Map<String, Object> extractSheetMetadata(
      Sheet sheet, Path filePath, Optional<List<Map<String, String>>> tables) {
    int maxRow = sheet.getLastRowNum() + 1;
    int maxColumn = 0;
    int minColumn = Integer.MAX_VALUE;
    for (Row row : sheet) {
      if (row.getFirstCellNum() >= 0) {
        minColumn = Math.min(minColumn, row.getFirstCellNum());
        maxColumn = Math.max(maxColumn, row.getLastCellNum());
      }
    }
    if (minColumn == Integer.MAX_VALUE) {
      minColumn = 0;
    }

    Map<String, Object> metadata = new LinkedHashMap<>();
    metadata.put("file_name", filePath.getFileName().toString());
    metadata.put("file_path", filePath.toString());
    metadata.put("sheet_name", sheet.getSheetName());
    metadata.put("max_row", maxRow);
    metadata.put("max_column", maxColumn);
    metadata.put(
        "dimensions",
        new CellReference(sheet.getFirstRowNum(), minColumn).formatAsString(false)
            + ":"
            + new CellReference(sheet.getLastRowNum(), Math.max(0, maxColumn - 1))
                .formatAsString(false));

    tables.ifPresent(found -> metadata.put("tables", found));
    if (config.isExtractComments()) {
      try {
        List<Map<String, String>> comments = extractComments(sheet);
        if (!comments.isEmpty()) {
          metadata.put("comments", comments);
        }
      } catch (RuntimeException e) {
        log.warn(
            "Comment extraction failed for sheet '{}': {}", sheet.getSheetName(), e.getMessage());
      }
    }
    return metadata;
  }

  /** Named Excel tables of the sheet; empty when detection is off or fails. */
  private Optional<List<Map<String, String>>> detectTables(Sheet sheet) {
    if (!config.isDetectTables()) {
      return Optional.empty();
    }
    try {
      return Optional.of(listTables(sheet));
    } catch (RuntimeException e) {
      log.warn("Table detection failed for sheet '{}': {}", sheet.getSheetName(), e.getMessage());
      return Optional.empty();
    }
  }

  private static List<Map<String, String>> listTables(Sheet sheet) {
    List<Map<String, String>> tables = new ArrayList<>();
    if (sheet instanceof XSSFSheet) {
      for (XSSFTable table : ((XSSFSheet) sheet).getTables()) {
        Map<String, String> entry = new LinkedHashMap<>();
        entry.put("name", table.getName());
        entry.put(
            "range",
            table.getStartCellReference().formatAsString(false)
                + ":"
                + table.getEndCellReference().formatAsString(false));
        entry.put("type", "excel_table");
        tables.add(entry);
      }
    }
    return tables;
  }

  private List<Map<String, String>> extractComments(Sheet sheet) {
    Map<CellAddress, ? extends Comment> cellComments = new TreeMap<>(sheet.getCellComments());
    List<Map<String, String>> comments = new ArrayList<>();
    cellComments.forEach(
        (address, comment) -> {
          Map<String, String> entry = new LinkedHashMap<>();
          entry.put("cell", address.formatAsString());
          entry.put("comment", comment.getString() != null ? comment.getString().getString() : "");
          comments.add(entry);
        });
    return comments;
  }

  List<Chunk> createChunks(Sheet sheet, SheetTable table) {
    List<Chunk> chunks = new ArrayList<>();
    String sheetName = sheet.getSheetName();
    chunks.add(
        new Chunk(headerText(sheetName, table), 0, List.of(sheetName, "header", "metadata")));

    List<String> columns = table.columns();
    List<String> keywordColumns = columns.subList(0, Math.min(KEYWORD_COLUMNS, columns.size()));
    int batchSize = Math.max(1, config.getMaxRowsPerChunk());
    List<List<Object>> rows = table.rows();

    for (int i = 0; i < rows.size(); i += batchSize) {
      List<List<Object>> batch = rows.subList(i, Math.min(i + batchSize, rows.size()));
      int first = i + 1;
      int last = i + batch.size();

      StringBuilder text = new StringBuilder();
      text.append("Sheet: ").append(sheetName);
      text.append(" (Rows ").append(first).append(" to ").append(last).append(")\n");
      text.append(renderTable(columns, batch)).append('\n');

      if (config.isExtractFormulas()) {
        int firstSheetRow = table.headerRowIndex() + 1 + i;
        List<String> formulas = extractFormulas(sheet, firstSheetRow, firstSheetRow + batch.size());
        if (!formulas.isEmpty()) {
          text.append("\nFormulas:\n").append(String.join("\n", formulas));
        }
      }

      List<String> keywords = new ArrayList<>();
      keywords.add(sheetName);
      keywords.add("rows_" + first + "_to_" + last);
      keywords.addAll(keywordColumns);
      chunks.add(new Chunk(text.toString(), chunks.size(), keywords));
    }
    return chunks;
  }

  private String headerText(String sheetName, SheetTable table) {
    List<String> columns = table.columns();
    StringBuilder text = new StringBuilder();
    text.append("Sheet: ").append(sheetName).append('\n');
    text.append("Columns: ").append(String.join(", ", columns)).append('\n');
    text.append("Rows: ").append(table.rows().size());
    text.append(", Columns: ").append(columns.size()).append('\n');

    text.append("\nData Types:\n");
    List<Integer> numericColumns = new ArrayList<>();
    for (int c = 0; c < columns.size(); c++) {
      String type = table.columnType(c);
      text.append(columns.get(c)).append(": ").append(type).append('\n');
      if (SheetTable.isNumeric(type)) {
        numericColumns.add(c);
      }
    }

    if (!numericColumns.isEmpty()) {
      text.append("\nNumeric Summary:\n");
      for (int c : numericColumns) {
        text.append(columns.get(c)).append(": ").append(numericSummary(table.column(c)));
        text.append('\n');
      }
    }
    return text.toString();
  }

  private static String numericSummary(List<Object> values) {
    Number min = null;
    Number max = null;
    double sum = 0;
    int count = 0;
    for (Object value : values) {
      if (!(value instanceof Number)) {
        continue;
      }
      Number n = (Number) value;
      if (min == null || n.doubleValue() < min.doubleValue()) {
        min = n;
      }
      if (max == null || n.doubleValue() > max.doubleValue()) {
        max = n;
      }
      sum += n.doubleValue();
      count++;
    }
    return String.format(
        Locale.ROOT, "min=%s, max=%s, mean=%.2f", min, max, count == 0 ? 0.0 : sum / count);
  }

  /** Renders rows as a right-aligned plain-text table under the column names. */
  static String renderTable(List<String> columns, List<List<Object>> rows) {
    int[] widths = new int[columns.size()];
    for (int c = 0; c < columns.size(); c++) {
      widths[c] = columns.get(c).length();
      for (List<Object> row : rows) {
        widths[c] = Math.max(widths[c], SheetTable.render(row.get(c)).length());
      }
    }

    List<String> lines = new ArrayList<>(rows.size() + 1);
    lines.add(renderLine(columns, widths));
    for (List<Object> row : rows) {
      List<String> cells = new ArrayList<>(row.size());
      for (Object value : row) {
        cells.add(SheetTable.render(value));
      }
      lines.add(renderLine(cells, widths));
    }
    return String.join("\n", lines);
  }

  private static String renderLine(List<String> cells, int[] widths) {
    StringBuilder line = new StringBuilder();
    for (int c = 0; c < cells.size(); c++) {
      if (c > 0) {
        line.append("  ");
      }
      line.append(" ".repeat(widths[c] - cells.get(c).length())).append(cells.get(c));
    }
    return line.toString().stripTrailing();
  }

  /** Lists formulas in sheet rows {@code [fromRow, toRow)} (zero-based) as {@code A2: =SUM(..)}. */
  static List<String> extractFormulas(Sheet sheet, int fromRow, int toRow) {
    List<String> formulas = new ArrayList<>();
    for (int r = fromRow; r < toRow && r <= sheet.getLastRowNum(); r++) {
      Row row = sheet.getRow(r);
      if (row == null) {
        continue;
      }
      for (Cell cell : row) {
        if (cell.getCellType() == CellType.FORMULA) {
          formulas.add(
              new CellReference(r, cell.getColumnIndex()).formatAsString(false)
                  + ": ="
                  + cell.getCellFormula());
        }
      }
    }
    return formulas;
  }

  private ProcessedContext createContext(
      RawContextProperties raw,
      List<Chunk> chunks,
      Map<String, Object> metadata,
      String sheetName,
      List<Map<String, String>> tables) {
    String fileName = (String) metadata.get("file_name");
    String title = fileName + " - " + sheetName;
    String summary =
        "Excel sheet '"
            + sheetName
            + "' with "
            + metadata.get("max_row")
            + " rows and "
            + metadata.get("max_column")
            + " columns";

    List<String> keywords = new ArrayList<>(List.of(sheetName, fileName, "excel", "spreadsheet"));
    for (Map<String, String> table : tables) {
      keywords.add(table.get("name"));
    }

    return buildContext(
        raw.objectId() + "_" + sheetName,
        raw,
        chunks,
        title,
        summary,
        keywords,
        List.of(),
        metadata,
        90,
        70);
  }
}
