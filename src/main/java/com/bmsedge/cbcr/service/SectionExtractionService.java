package com.bmsedge.cbcr.service;

import com.bmsedge.cbcr.model.CountryRow;
import com.bmsedge.cbcr.model.GeneralInfo;
import com.bmsedge.cbcr.model.SheetClassification;
import com.bmsedge.cbcr.model.SheetData;
import com.bmsedge.cbcr.model.SubsidiaryRow;
import com.bmsedge.cbcr.model.WorkbookData;
import com.bmsedge.cbcr.util.CellValueUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.function.IntFunction;
import java.util.stream.IntStream;
import java.util.stream.Stream;

/**
 * Pulls typed records out of the classified sheets of a workbook.
 */
@Service
public class SectionExtractionService {

    private static final Logger logger = LoggerFactory.getLogger(SectionExtractionService.class);

    public static final String NO_INFORMATION_OMITTED = "No information omitted";

    public SheetClassification classifySheets(WorkbookData workbook) {
        SheetClassification classification = SheetClassification.of(workbook);
        if (!classification.getIgnoredSheets().isEmpty()) {
            logger.warn("Sheets ignored because an earlier sheet already has the same role: {}",
                    classification.getIgnoredSheets());
        }
        return classification;
    }

    /**
     * Reads label/value pairs from the first two columns. The header row is
     * read as a pair too, so a sheet without a separate header still works.
     * Unknown labels are ignored; a later row overrides an earlier one.
     */
    public GeneralInfo extractGeneralInfo(SheetData sheet) {
        GeneralInfo info = new GeneralInfo();
        if (sheet == null || sheet.getColumnCount() < 2) {
            return info;
        }

        List<String> columns = sheet.getColumns();
        if (!SheetData.isUnnamedColumn(columns.get(1))) {
            applyLabel(info, columns.get(0), sheet.getHeaderValue(1));
        }
        for (int rowIdx = 0; rowIdx < sheet.getRows().size(); rowIdx++) {
            applyLabel(info, sheet.getCell(rowIdx, 0), sheet.getCell(rowIdx, 1));
        }
        return info;
    }

    private void applyLabel(GeneralInfo info, Object rawLabel, Object rawValue) {
        String key = CellValueUtil.toText(rawLabel).toLowerCase(Locale.ROOT);
        if (key.isEmpty() || CellValueUtil.isMissing(rawValue)) {
            return;
        }
        String value = CellValueUtil.toText(rawValue);

        if (key.contains("ultimate parent")) {
            info.setUltimateParent(value);
        } else if (key.contains("country of registered office")) {
            info.setCountryOffice(value);
        } else if (key.contains("financial year start")) {
            info.setFyStart(CellValueUtil.formatDate(rawValue));
        } else if (key.contains("financial year end")) {
            info.setFyEnd(CellValueUtil.formatDate(rawValue));
        } else if (key.contains("reporting currency")) {
            info.setCurrency(value);
        } else if (key.contains("oecd")) {
            String flag = value.toLowerCase(Locale.ROOT);
            info.setOecdInstructions(flag.equals("yes") || flag.equals("true") || flag.equals("1"));
        } else {
            return;
        }
        logger.debug("General information '{}' = '{}'", key, value);
    }

    /**
     * Lazy single-pass stream of country rows; rows whose first cell is
     * missing are skipped. Columns are bound by position.
     */
    public Stream<CountryRow> streamCountryRows(SheetData sheet) {
        return streamRows(sheet, row -> new CountryRow(
                text(sheet, row, 0),
                text(sheet, row, 1),
                CellValueUtil.coerceInteger(sheet.getCell(row, 2)),
                CellValueUtil.coerceInteger(sheet.getCell(row, 3)),
                CellValueUtil.coerceInteger(sheet.getCell(row, 4)),
                CellValueUtil.coerceInteger(sheet.getCell(row, 5)),
                CellValueUtil.coerceInteger(sheet.getCell(row, 6)),
                CellValueUtil.coerceInteger(sheet.getCell(row, 7))
        ));
    }

    public Stream<SubsidiaryRow> streamSubsidiaryRows(SheetData sheet) {
        return streamRows(sheet, row -> new SubsidiaryRow(
                text(sheet, row, 0),
                text(sheet, row, 1),
                text(sheet, row, 2),
                text(sheet, row, 3)
        ));
    }

    public String extractOmittedInformation(SheetData sheet) {
        if (sheet == null || sheet.isEmpty()) {
            return NO_INFORMATION_OMITTED;
        }
        return CellValueUtil.textOrDefault(sheet.getCell(0, 0), NO_INFORMATION_OMITTED);
    }

    private <T> Stream<T> streamRows(SheetData sheet, IntFunction<T> mapper) {
        if (sheet == null || sheet.isEmpty()) {
            return Stream.empty();
        }
        return IntStream.range(0, sheet.getRows().size())
                .filter(row -> sheet.getCell(row, 0) != null)
                .mapToObj(mapper);
    }

    private static String text(SheetData sheet, int row, int column) {
        return CellValueUtil.textOrDefault(sheet.getCell(row, column), CellValueUtil.NOT_AVAILABLE);
    }
}
