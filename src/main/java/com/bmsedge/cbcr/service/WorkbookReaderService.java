package com.bmsedge.cbcr.service;

import com.bmsedge.cbcr.exception.WorkbookParseException;
import com.bmsedge.cbcr.model.SheetData;
import com.bmsedge.cbcr.model.WorkbookData;
import com.bmsedge.cbcr.util.CellValueUtil;
import org.apache.poi.ss.usermodel.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Reads an uploaded .xlsx/.xls file into {@link WorkbookData}.
 * The first physical row of each sheet supplies the column names, every
 * following row up to the last non-empty one is a data row.
 */
@Service
public class WorkbookReaderService {

    private static final Logger logger = LoggerFactory.getLogger(WorkbookReaderService.class);

    /** Text cells read as missing, the same markers pandas treats as NA. */
    static final Set<String> NA_MARKERS = Set.of(
            "#N/A", "#N/A N/A", "#NA", "-1.#IND", "-1.#QNAN", "-NaN", "-nan", "1.#IND", "1.#QNAN",
            "<NA>", "N/A", "NA", "NULL", "NaN", "None", "n/a", "nan", "null");

    public WorkbookData read(MultipartFile file) throws WorkbookParseException {
        try (InputStream inputStream = file.getInputStream()) {
            return read(inputStream);
        } catch (WorkbookParseException e) {
            throw e;
        } catch (IOException e) {
            throw new WorkbookParseException("Failed to read Excel file: " + e.getMessage(), e);
        }
    }

    public WorkbookData read(InputStream inputStream) throws WorkbookParseException {
        try (Workbook workbook = WorkbookFactory.create(inputStream)) {
            logger.info("Reading workbook with {} sheets", workbook.getNumberOfSheets());

            List<SheetData> sheets = new ArrayList<>();
            for (int sheetIdx = 0; sheetIdx < workbook.getNumberOfSheets(); sheetIdx++) {
                Sheet sheet = workbook.getSheetAt(sheetIdx);
                SheetData sheetData = readSheet(sheet);
                logger.info("  Sheet '{}': {} columns, {} data rows",
                        sheetData.getName(), sheetData.getColumnCount(), sheetData.getRows().size());
                sheets.add(sheetData);
            }
            return new WorkbookData(sheets);

        } catch (IOException | RuntimeException e) {
            // POI reports corrupt or unsupported content with a mix of checked and unchecked exceptions
            throw new WorkbookParseException("Failed to read Excel file: " + e.getMessage(), e);
        }
    }

    private SheetData readSheet(Sheet sheet) {
        String sheetName = sheet.getSheetName();
        if (sheet.getPhysicalNumberOfRows() == 0) {
            return new SheetData(sheetName, List.of(), List.of());
        }

        int headerRowIdx = sheet.getFirstRowNum();
        Row headerRow = sheet.getRow(headerRowIdx);
        int width = headerRow != null && headerRow.getLastCellNum() > 0 ? headerRow.getLastCellNum() : 0;

        // Data rows may be wider than the header
        int lastDataRow = headerRowIdx;
        for (int rowIdx = headerRowIdx + 1; rowIdx <= sheet.getLastRowNum(); rowIdx++) {
            Row row = sheet.getRow(rowIdx);
            if (row == null || isRowEmpty(row)) continue;
            lastDataRow = rowIdx;
            width = Math.max(width, row.getLastCellNum());
        }

        List<String> columns = new ArrayList<>();
        List<Object> headerValues = new ArrayList<>();
        for (int col = 0; col < width; col++) {
            Object value = headerRow != null ? getCellValue(headerRow.getCell(col)) : null;
            String name = CellValueUtil.toText(value);
            columns.add(name.isEmpty() ? SheetData.UNNAMED_COLUMN_PREFIX + col : name);
            headerValues.add(value);
        }

        List<List<Object>> rows = new ArrayList<>();
        for (int rowIdx = headerRowIdx + 1; rowIdx <= lastDataRow; rowIdx++) {
            Row row = sheet.getRow(rowIdx);
            List<Object> values = new ArrayList<>(width);
            for (int col = 0; col < width; col++) {
                values.add(row == null ? null : getCellValue(row.getCell(col)));
            }
            rows.add(values);
        }

        return new SheetData(sheetName, columns, headerValues, rows);
    }

    /**
     * Typed cell value: String, Double, LocalDateTime, Boolean, or
     * {@code null} for blank, error and NA-marker cells.
     */
    Object getCellValue(Cell cell) {
        if (cell == null) return null;
        CellType type = cell.getCellType() == CellType.FORMULA
                ? cell.getCachedFormulaResultType()
                : cell.getCellType();
        switch (type) {
            case STRING:
                String text = cell.getStringCellValue().trim();
                return text.isEmpty() || NA_MARKERS.contains(text) ? null : text;
            case NUMERIC:
                if (DateUtil.isCellDateFormatted(cell)) {
                    return cell.getLocalDateTimeCellValue();
                }
                return cell.getNumericCellValue();
            case BOOLEAN:
                return cell.getBooleanCellValue();
            default:
                return null;
        }
    }

    private boolean isRowEmpty(Row row) {
        for (int cellNum = 0; cellNum < row.getLastCellNum(); cellNum++) {
            if (getCellValue(row.getCell(cellNum)) != null) {
                return false;
            }
        }
        return true;
    }
}
