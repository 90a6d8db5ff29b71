package com.mossbauer.common.ingestion;

import com.mossbauer.common.exception.DataFormatException;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the first sheet of an .xlsx workbook. The first row is a header row and only
 * fixes the column count; numeric cells are rendered with {@link Double#toString}.
 */
final class SpreadsheetParser {

    private SpreadsheetParser() {}

    static RawTable parse(byte[] raw) {
        try (Workbook workbook = new XSSFWorkbook(new ByteArrayInputStream(raw))) {
            if (workbook.getNumberOfSheets() == 0) {
                return RawTable.EMPTY;
            }
            Sheet sheet = workbook.getSheetAt(0);
            Row header = sheet.getRow(sheet.getFirstRowNum());
            if (header == null) {
                return RawTable.EMPTY;
            }
            int width = Math.max(header.getLastCellNum(), 0);

            List<RawTable.Line> rows = new ArrayList<>();
            for (int r = sheet.getFirstRowNum() + 1; r <= sheet.getLastRowNum(); r++) {
                Row row = sheet.getRow(r);
                if (row == null) {
                    continue;
                }
                String[] cells = new String[width];
                for (int c = 0; c < width; c++) {
                    cells[c] = text(row.getCell(c));
                }
                rows.add(new RawTable.Line(r, cells));
            }
            return new RawTable(rows, width);
        } catch (IOException | RuntimeException e) {
            throw new DataFormatException("Could not read spreadsheet: " + e.getMessage(), e);
        }
    }

    private static String text(Cell cell) {
        if (cell == null) {
            return null;
        }
        CellType type = cell.getCellType() == CellType.FORMULA
            ? cell.getCachedFormulaResultType()
            : cell.getCellType();
        return switch (type) {
            case NUMERIC -> Double.toString(cell.getNumericCellValue());
            case STRING  -> cell.getStringCellValue();
            case BOOLEAN -> Boolean.toString(cell.getBooleanCellValue());
            default      -> null;
        };
    }
}
