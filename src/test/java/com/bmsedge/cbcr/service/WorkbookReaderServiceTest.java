package com.bmsedge.cbcr.service;

import com.bmsedge.cbcr.exception.WorkbookParseException;
import com.bmsedge.cbcr.model.GeneralInfo;
import com.bmsedge.cbcr.model.SheetData;
import com.bmsedge.cbcr.model.WorkbookData;
import org.apache.poi.hssf.usermodel.HSSFWorkbook;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockMultipartFile;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class WorkbookReaderServiceTest {

    private WorkbookReaderService readerService;

    @BeforeEach
    void setUp() {
        readerService = new WorkbookReaderService();
    }

    @Test
    @DisplayName("Should read sheets in order with typed cell values")
    void testReadXlsx() throws Exception {
        byte[] bytes;
        try (XSSFWorkbook workbook = new XSSFWorkbook()) {
            Sheet general = workbook.createSheet("General Information");
            row(general, 0, "Field", "Value");
            row(general, 1, "Ultimate Parent Name", "Acme Group");
            Row dateRow = general.createRow(2);
            dateRow.createCell(0).setCellValue("Financial Year Start Date");
            CellStyle dateStyle = workbook.createCellStyle();
            dateStyle.setDataFormat(workbook.getCreationHelper().createDataFormat().getFormat("yyyy-mm-dd"));
            dateRow.createCell(1).setCellValue(LocalDateTime.of(2025, 1, 1, 0, 0));
            dateRow.getCell(1).setCellStyle(dateStyle);
            Row flagRow = general.createRow(3);
            flagRow.createCell(0).setCellValue("OECD Instructions Used");
            flagRow.createCell(1).setCellValue(true);

            Sheet country = workbook.createSheet("Country-by-Country Overview");
            row(country, 0, "Tax Jurisdiction", "Country Code", "Revenues");
            Row data = country.createRow(1);
            data.createCell(0).setCellValue("IE");
            data.createCell(2).setCellValue(1000000d);
            // Blank row in the middle is kept, trailing blank rows are not
            country.createRow(2);
            row(country, 3, "DE", "DE");
            country.createRow(6);

            bytes = toBytes(workbook);
        }

        WorkbookData result = readerService.read(
                new MockMultipartFile("file", "report.xlsx", "application/octet-stream", bytes));

        assertEquals(List.of("General Information", "Country-by-Country Overview"), result.getSheetNames());

        SheetData general = result.getSheet("General Information");
        assertEquals(List.of("Field", "Value"), general.getColumns());
        assertEquals("Acme Group", general.getCell(0, 1));
        assertEquals(LocalDateTime.of(2025, 1, 1, 0, 0), general.getCell(1, 1));
        assertEquals(Boolean.TRUE, general.getCell(2, 1));

        SheetData country = result.getSheet("Country-by-Country Overview");
        assertEquals(3, country.getRows().size());
        assertEquals("IE", country.getCell(0, 0));
        assertNull(country.getCell(0, 1));
        assertEquals(1000000d, country.getCell(0, 2));
        assertNull(country.getCell(1, 0));
        assertEquals("DE", country.getCell(2, 0));
    }

    @Test
    @DisplayName("Should read legacy .xls workbooks and name blank headers")
    void testReadXls() throws Exception {
        byte[] bytes;
        try (HSSFWorkbook workbook = new HSSFWorkbook()) {
            Sheet omitted = workbook.createSheet("Omitted Information");
            Row header = omitted.createRow(0);
            header.createCell(1).setCellValue("Notes");
            row(omitted, 1, "Nothing omitted", "n/a");
            workbook.createSheet("Subsidiaries and Activities");
            bytes = toBytes(workbook);
        }

        WorkbookData result = readerService.read(
                new MockMultipartFile("file", "report.xls", "application/vnd.ms-excel", bytes));

        SheetData omitted = result.getSheet("Omitted Information");
        assertEquals(List.of("Unnamed: 0", "Notes"), omitted.getColumns());
        assertEquals("Nothing omitted", omitted.getCell(0, 0));
        assertTrue(result.getSheet("Subsidiaries and Activities").isEmpty());
    }

    @Test
    @DisplayName("Should keep a date in the first row typed so it renders as an ISO date")
    void testDateInHeaderRow() throws Exception {
        // Arrange
        byte[] bytes;
        try (XSSFWorkbook workbook = new XSSFWorkbook()) {
            Sheet general = workbook.createSheet("General Information");
            Row first = general.createRow(0);
            first.createCell(0).setCellValue("Financial Year Start Date");
            CellStyle shortDate = workbook.createCellStyle();
            shortDate.setDataFormat((short) 14);
            first.createCell(1).setCellValue(LocalDate.of(2024, 4, 1));
            first.getCell(1).setCellStyle(shortDate);
            row(general, 1, "Ultimate Parent Name", "Acme Group");
            bytes = toBytes(workbook);
        }

        // Act
        SheetData general = readerService.read(
                new MockMultipartFile("file", "report.xlsx", "application/octet-stream", bytes))
                .getSheet("General Information");
        GeneralInfo info = new SectionExtractionService().extractGeneralInfo(general);

        // Assert
        assertEquals(List.of("Financial Year Start Date", "2024-04-01"), general.getColumns());
        assertEquals(LocalDateTime.of(2024, 4, 1, 0, 0), general.getHeaderValue(1));
        assertEquals("2024-04-01", info.getFyStart());
        assertEquals("Acme Group", info.getUltimateParent());
    }

    @Test
    @DisplayName("Should read NA marker text as a missing cell")
    void testNaMarkersAreMissing() throws Exception {
        byte[] bytes;
        try (XSSFWorkbook workbook = new XSSFWorkbook()) {
            Sheet country = workbook.createSheet("Country-by-Country Overview");
            row(country, 0, "Tax Jurisdiction", "Country Code");
            row(country, 1, "N/A", "XX");
            row(country, 2, "Ireland", "NaN");
            row(country, 3, "Germany", "n.a.");
            bytes = toBytes(workbook);
        }

        SheetData country = readerService.read(
                new MockMultipartFile("file", "report.xlsx", "application/octet-stream", bytes))
                .getSheet("Country-by-Country Overview");

        assertNull(country.getCell(0, 0));
        assertNull(country.getCell(1, 1));
        assertEquals("n.a.", country.getCell(2, 1));
        assertEquals(2, new SectionExtractionService().streamCountryRows(country).count());
    }

    @Test
    @DisplayName("Should read the same workbook consistently from parallel requests")
    void testParallelReads() throws Exception {
        byte[] bytes = new TemplateDownloadService().generateReportTemplate(true);
        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Future<WorkbookData>> reads = new ArrayList<>();
            for (int i = 0; i < 16; i++) {
                reads.add(executor.submit(() -> readerService.read(new ByteArrayInputStream(bytes))));
            }
            for (Future<WorkbookData> read : reads) {
                SheetData country = read.get(30, TimeUnit.SECONDS).getSheet("Country-by-Country Overview");
                assertEquals("Revenues", country.getColumns().get(2));
                assertEquals(-25000d, country.getCell(1, 3));
            }
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("Should wrap unreadable content in a parse exception")
    void testCorruptFile() {
        MockMultipartFile file = new MockMultipartFile("file", "report.xlsx", "application/octet-stream",
                "definitely not a spreadsheet".getBytes(StandardCharsets.UTF_8));

        WorkbookParseException exception = assertThrows(WorkbookParseException.class, () -> readerService.read(file));

        assertTrue(exception.getMessage().startsWith("Failed to read Excel file"));
    }

    private static void row(Sheet sheet, int index, String... values) {
        Row row = sheet.createRow(index);
        for (int i = 0; i < values.length; i++) {
            row.createCell(i).setCellValue(values[i]);
        }
    }

    private static byte[] toBytes(Workbook workbook) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        workbook.write(out);
        return out.toByteArray();
    }
}
