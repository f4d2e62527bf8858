package com.bmsedge.cbcr.service;

import com.bmsedge.cbcr.WorkbookFixtures;
import com.bmsedge.cbcr.dto.ValidationReport;
import com.bmsedge.cbcr.model.SheetData;
import com.bmsedge.cbcr.model.WorkbookData;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.bmsedge.cbcr.WorkbookFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class SchemaValidationServiceTest {

    private SchemaValidationService validationService;

    @BeforeEach
    void setUp() {
        validationService = new SchemaValidationService();
    }

    @Test
    @DisplayName("Should accept the reference workbook with no errors")
    void testValidWorkbook() {
        ValidationReport report = validationService.validate(acmeWorkbook());

        assertTrue(report.isValid());
        assertTrue(report.getMessages().isEmpty());
    }

    @Test
    @DisplayName("Should report each missing section by its label")
    void testMissingSections() {
        WorkbookData workbook = workbook(acmeGeneralInformation(), acmeSubsidiaries());

        List<String> missing = validationService.validateSections(workbook);

        assertEquals(List.of("Country-by-Country Overview", "Omitted Information"), missing);
    }

    @Test
    @DisplayName("Should match section names as case-insensitive substrings")
    void testSectionSubstringMatch() {
        WorkbookData workbook = workbook(
                sheet("1. GENERAL INFORMATION", List.of("a")),
                sheet("country-by-country overview (EUR)", List.of("a")),
                sheet("Subsidiaries and Activities 2025", List.of("a")),
                sheet("omitted information", List.of("a")));

        assertTrue(validationService.validateSections(workbook).isEmpty());
    }

    @Test
    @DisplayName("Should skip field checks when sections are missing")
    void testMissingSectionsShortCircuit() {
        SheetData emptyGeneral = sheet("General Information", List.of());
        WorkbookData workbook = workbook(emptyGeneral);

        ValidationReport report = validationService.validate(workbook);

        assertFalse(report.isValid());
        assertEquals(3, report.getMissingSections().size());
        assertTrue(report.getMissingGeneralInfoFields().isEmpty());
        assertTrue(report.getMissingCountryFields().isEmpty());
        assertEquals(1, report.getMessages().size());
        assertTrue(report.getMessages().get(0).startsWith("Missing required sections: Country-by-Country Overview"));
    }

    @Test
    @DisplayName("Should find general information labels in headers or the first column")
    void testGeneralInfoLabels() {
        SheetData sheet = sheet("General Information", List.of("Ultimate Parent Name", "Acme Group"),
                new Object[]{"country of registered office", "IE"},
                new Object[]{"Financial Year Start Date", "2025-01-01"},
                new Object[]{null, "orphan value"},
                new Object[]{"Reporting Currency", "EUR"});

        List<String> missing = validationService.validateGeneralInfo(sheet);

        assertEquals(List.of("Financial Year End Date", "OECD Instructions Used"), missing);
    }

    @Test
    @DisplayName("Should fail every field for an empty or absent sheet")
    void testEmptySheets() {
        assertEquals(SchemaValidationService.REQUIRED_GENERAL_INFO_FIELDS, validationService.validateGeneralInfo(null));
        assertEquals(SchemaValidationService.REQUIRED_COUNTRY_FIELDS,
                validationService.validateCountryData(sheet("Overview", COUNTRY_COLUMNS)));
    }

    @Test
    @DisplayName("Should collect all missing country columns in one pass")
    void testMissingCountryColumns() {
        SheetData sheet = sheet("Country-by-Country Overview",
                List.of("Tax Jurisdiction", "COUNTRY CODE", "Revenues (EUR)", "Number of Employees"),
                new Object[]{"IE", "IE", 1d, 1d});

        List<String> missing = validationService.validateCountryData(sheet);

        assertEquals(List.of("Profit (Loss) Before Tax", "Income Tax Paid",
                "Income Tax Accrued", "Accumulated Earnings"), missing);
    }

    @Test
    @DisplayName("Should report general and country field errors together")
    void testFieldErrorsCollectedEagerly() {
        WorkbookData workbook = workbook(
                sheet("General Information", List.of("Field", "Value"), new Object[]{"Reporting Currency", "EUR"}),
                sheet("Country-by-Country Overview", List.of("Tax Jurisdiction"), new Object[]{"IE"}),
                WorkbookFixtures.acmeSubsidiaries(),
                WorkbookFixtures.acmeOmittedInformation());

        ValidationReport report = validationService.validate(workbook);

        assertFalse(report.isValid());
        assertEquals(2, report.getMessages().size());
        assertTrue(report.getMessages().get(0).startsWith("Missing fields in General Information: Ultimate Parent Name"));
        assertTrue(report.getMessages().get(1).startsWith("Missing fields in Country-by-Country Overview: Country Code"));
    }
}
