package com.bmsedge.cbcr.service;

import org.apache.poi.ss.usermodel.*;
import org.apache.poi.xssf.usermodel.XSSFSheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.List;

/**
 * Generates the Excel input template users fill in before uploading.
 */
@Service
public class TemplateDownloadService {

    private static final Logger logger = LoggerFactory.getLogger(TemplateDownloadService.class);

    static final String[] SUBSIDIARY_COLUMNS = {
            "Tax Jurisdiction", "Country Code", "Subsidiary Name", "Nature of Activities"
    };

    /**
     * Template with the four required sheets plus an instructions sheet.
     */
    public byte[] generateReportTemplate(boolean includeSampleData) throws IOException {
        try (XSSFWorkbook workbook = new XSSFWorkbook()) {
            CellStyle headerStyle = createHeaderStyle(workbook);
            CellStyle dataStyle = createDataStyle(workbook);

            createGeneralInformationSheet(workbook, headerStyle, dataStyle, includeSampleData);

            XSSFSheet countrySheet = createTabularSheet(workbook, "Country-by-Country Overview",
                    SchemaValidationService.REQUIRED_COUNTRY_FIELDS.toArray(new String[0]), headerStyle);
            XSSFSheet subsidiarySheet = createTabularSheet(workbook, "Subsidiaries and Activities",
                    SUBSIDIARY_COLUMNS, headerStyle);
            XSSFSheet omittedSheet = createTabularSheet(workbook, "Omitted Information",
                    new String[]{"Omitted Information"}, headerStyle);
            omittedSheet.setColumnWidth(0, 15000);

            if (includeSampleData) {
                addRow(countrySheet, 1, dataStyle,
                        "Ireland", "IE", 1000000d, 200000d, 50000d, 45000d, 150000d, 120d);
                addRow(countrySheet, 2, dataStyle,
                        "Germany", "DE", 750000d, -25000d, 0d, 1000d, 80000d, 45d);
                addRow(subsidiarySheet, 1, dataStyle, "Ireland", "IE", "Acme Sub Ltd", "Manufacturing");
                addRow(subsidiarySheet, 2, dataStyle, "Germany", "DE", "Acme GmbH", "Sales and distribution");
                addRow(omittedSheet, 1, dataStyle, "No information omitted");
            }

            createInstructionsSheet(workbook, dataStyle);

            ByteArrayOutputStream outputStream = new ByteArrayOutputStream();
            workbook.write(outputStream);

            logger.info("Generated report template with {}", includeSampleData ? "sample data" : "headers only");
            return outputStream.toByteArray();
        }
    }

    private void createGeneralInformationSheet(XSSFWorkbook workbook, CellStyle headerStyle,
                                               CellStyle dataStyle, boolean includeSampleData) {
        XSSFSheet sheet = createTabularSheet(workbook, "General Information",
                new String[]{"Field", "Value"}, headerStyle);
        sheet.setColumnWidth(0, 9000);
        sheet.setColumnWidth(1, 9000);

        List<String> labels = SchemaValidationService.REQUIRED_GENERAL_INFO_FIELDS;
        String[] samples = {"Acme Group", "IE", "2025-01-01", "2025-12-31", "EUR", "Yes"};

        for (int i = 0; i < labels.size(); i++) {
            Row row = sheet.createRow(i + 1);
            Cell label = row.createCell(0);
            label.setCellValue(labels.get(i));
            label.setCellStyle(dataStyle);

            Cell value = row.createCell(1);
            if (includeSampleData) {
                value.setCellValue(samples[i]);
            }
            value.setCellStyle(dataStyle);
        }
    }

    private XSSFSheet createTabularSheet(XSSFWorkbook workbook, String name, String[] headers, CellStyle headerStyle) {
        XSSFSheet sheet = workbook.createSheet(name);
        Row headerRow = sheet.createRow(0);
        for (int i = 0; i < headers.length; i++) {
            Cell cell = headerRow.createCell(i);
            cell.setCellValue(headers[i]);
            cell.setCellStyle(headerStyle);
            sheet.setColumnWidth(i, 6000);
        }
        return sheet;
    }

    private void addRow(XSSFSheet sheet, int rowNum, CellStyle dataStyle, Object... values) {
        Row row = sheet.createRow(rowNum);
        for (int i = 0; i < values.length; i++) {
            Cell cell = row.createCell(i);
            if (values[i] instanceof Double) {
                cell.setCellValue((Double) values[i]);
            } else {
                cell.setCellValue(String.valueOf(values[i]));
            }
            cell.setCellStyle(dataStyle);
        }
    }

    private void createInstructionsSheet(XSSFWorkbook workbook, CellStyle normalStyle) {
        XSSFSheet sheet = workbook.createSheet("Instructions");
        CellStyle titleStyle = createTitleStyle(workbook);

        int rowNum = 0;

        Row titleRow = sheet.createRow(rowNum++);
        Cell titleCell = titleRow.createCell(0);
        titleCell.setCellValue("Country-by-Country Report Template - Instructions");
        titleCell.setCellStyle(titleStyle);
        rowNum++;

        String[] instructions = {
                "Required sheets (names may vary, matching is by keyword):",
                "- General Information: one label per row in column A, value in column B",
                "- Country-by-Country Overview: one row per tax jurisdiction",
                "- Subsidiaries and Activities: one row per subsidiary undertaking",
                "- Omitted Information: free text in the first cell below the header",
                "",
                "Important Notes:",
                "- Dates may be entered as YYYY-MM-DD, DD/MM/YYYY, MM/DD/YYYY, DD-MM-YYYY or YYYY/MM/DD",
                "- Monetary amounts and employee counts must be plain numbers (no currency symbols)",
                "- Rows with an empty first column are skipped",
                "- OECD Instructions Used accepts Yes/No",
                "",
                "After filling the template:",
                "1. Save the file as .xlsx or .xls (max 16MB)",
                "2. Upload via POST /api/cbcr/convert",
                "3. Download the generated .xhtml report"
        };

        for (String instruction : instructions) {
            Row row = sheet.createRow(rowNum++);
            Cell cell = row.createCell(0);
            cell.setCellValue(instruction);
            cell.setCellStyle(normalStyle);
        }

        sheet.setColumnWidth(0, 20000);
    }

    private CellStyle createHeaderStyle(XSSFWorkbook workbook) {
        CellStyle style = workbook.createCellStyle();
        Font font = workbook.createFont();
        font.setBold(true);
        font.setFontHeightInPoints((short) 11);
        font.setColor(IndexedColors.WHITE.getIndex());
        style.setFont(font);
        style.setFillForegroundColor(IndexedColors.DARK_BLUE.getIndex());
        style.setFillPattern(FillPatternType.SOLID_FOREGROUND);
        style.setBorderBottom(BorderStyle.THIN);
        style.setBorderTop(BorderStyle.THIN);
        style.setBorderLeft(BorderStyle.THIN);
        style.setBorderRight(BorderStyle.THIN);
        style.setAlignment(HorizontalAlignment.CENTER);
        style.setVerticalAlignment(VerticalAlignment.CENTER);
        return style;
    }

    private CellStyle createDataStyle(XSSFWorkbook workbook) {
        CellStyle style = workbook.createCellStyle();
        style.setBorderBottom(BorderStyle.THIN);
        style.setBorderTop(BorderStyle.THIN);
        style.setBorderLeft(BorderStyle.THIN);
        style.setBorderRight(BorderStyle.THIN);
        style.setAlignment(HorizontalAlignment.LEFT);
        style.setVerticalAlignment(VerticalAlignment.CENTER);
        return style;
    }

    private CellStyle createTitleStyle(XSSFWorkbook workbook) {
        CellStyle style = workbook.createCellStyle();
        Font font = workbook.createFont();
        font.setBold(true);
        font.setFontHeightInPoints((short) 14);
        style.setFont(font);
        return style;
    }
}
