package com.flamingo.ai.contextlab.service.processing.excel;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.FormulaError;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;

/**
 * Tabular view of one worksheet: the first populated row is the header, every following row up to
 * the last populated one is a data row. Cell values are {@link Long}, {@link Double}, {@link
 * Boolean}, {@link LocalDateTime}, {@link String} or {@code null} for empty cells.
 */
final class SheetTable {

  private final int headerRowIndex;
  private final List<String> columns;
  private final List<List<Object>> rows;

  private SheetTable(int headerRowIndex, List<String> columns, List<List<Object>> rows) {
    this.headerRowIndex = headerRowIndex;
    this.columns = columns;
    this.rows = rows;
  }

  static SheetTable read(Sheet sheet) {
    if (sheet.getPhysicalNumberOfRows() == 0) {
      return new SheetTable(0, List.of(), List.of());
    }
    int first = sheet.getFirstRowNum();
    int last = sheet.getLastRowNum();

    int width = 0;
    for (int r = first; r <= last; r++) {
      Row row = sheet.getRow(r);
      if (row != null && row.getLastCellNum() > width) {
        width = row.getLastCellNum();
      }
    }

    Row header = sheet.getRow(first);
    List<String> columns = new ArrayList<>(width);
    for (int c = 0; c < width; c++) {
      Object value = header != null ? cellValue(header.getCell(c)) : null;
      String name = value == null ? "" : render(value).strip();
      columns.add(name.isEmpty() ? "Unnamed: " + c : name);
    }

    List<List<Object>> rows = new ArrayList<>();
    for (int r = first + 1; r <= last; r++) {
      Row row = sheet.getRow(r);
      List<Object> values = new ArrayList<>(width);
      for (int c = 0; c < width; c++) {
        values.add(row != null ? cellValue(row.getCell(c)) : null);
      }
      rows.add(Collections.unmodifiableList(values));
    }
    return new SheetTable(first, List.copyOf(columns), List.copyOf(rows));
  }

  int headerRowIndex() {
    return headerRowIndex;
  }

  List<String> columns() {
    return columns;
  }

  List<List<Object>> rows() {
    return rows;
  }

  boolean hasData() {
    return !rows.isEmpty();
  }

  List<Object> column(int index) {
    List<Object> values = new ArrayList<>(rows.size());
    for (List<Object> row : rows) {
      values.add(row.get(index));
    }
    return values;
  }

  /**
   * Infers a column's data type from its non-empty values.
   *
   * @return one of {@code integer}, {@code number}, {@code boolean}, {@code datetime}, {@code
   *     string}, {@code empty}, {@code mixed}
   */
  String columnType(int index) {
    String type = "empty";
    for (Object value : column(index)) {
      if (value == null) {
        continue;
      }
      String valueType = typeOf(value);
      if (type.equals("empty")) {
        type = valueType;
      } else if (!type.equals(valueType)) {
        if (isNumeric(type) && isNumeric(valueType)) {
          type = "number";
        } else {
          return "mixed";
        }
      }
    }
    return type;
  }

  static boolean isNumeric(String type) {
    return type.equals("integer") || type.equals("number");
  }

  /** Renders a cell value for display; {@code null} renders as an empty string. */
  static String render(Object value) {
    return value == null ? "" : value.toString();
  }

  private static String typeOf(Object value) {
    if (value instanceof Long) {
      return "integer";
    }
    if (value instanceof Double) {
      return "number";
    }
    if (value instanceof Boolean) {
      return "boolean";
    }
    if (value instanceof LocalDateTime) {
      return "datetime";
    }
    return "string";
  }

  private static Object cellValue(Cell cell) {
    if (cell == null) {
      return null;
    }
    CellType type = cell.getCellType();
    if (type == CellType.FORMULA) {
      type = cell.getCachedFormulaResultType();
    }
    switch (type) {
      case NUMERIC:
        if (DateUtil.isCellDateFormatted(cell)) {
          return cell.getLocalDateTimeCellValue();
        }
        double number = cell.getNumericCellValue();
        if (number == Math.rint(number) && Math.abs(number) < 1e15) {
          return (long) number;
        }
        return number;
      case BOOLEAN:
        return cell.getBooleanCellValue();
      case STRING:
        String text = cell.getStringCellValue();
        return text == null || text.isEmpty() ? null : text;
      case ERROR:
        return FormulaError.forInt(cell.getErrorCellValue()).getString();
      default:
        return null;
    }
  }
}
