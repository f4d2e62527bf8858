package com.bmsedge.cbcr.service;

import com.bmsedge.cbcr.dto.ValidationReport;
import com.bmsedge.cbcr.model.SectionRole;
import com.bmsedge.cbcr.model.SheetClassification;
import com.bmsedge.cbcr.model.SheetData;
import com.bmsedge.cbcr.model.WorkbookData;
import com.bmsedge.cbcr.util.CellValueUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Structural checks on an uploaded workbook. Every check only collects the
 * names of what is missing; nothing here throws.
 */
@Service
public class SchemaValidationService {

    private static final Logger logger = LoggerFactory.getLogger(SchemaValidationService.class);

    public static final List<String> REQUIRED_SECTIONS = SectionRole.requiredSectionLabels();

    public static final List<String> REQUIRED_GENERAL_INFO_FIELDS = List.of(
            "Ultimate Parent Name",
            "Country of Registered Office",
            "Financial Year Start Date",
            "Financial Year End Date",
            "Reporting Currency",
            "OECD Instructions Used"
    );

    public static final List<String> REQUIRED_COUNTRY_FIELDS = List.of(
            "Tax Jurisdiction",
            "Country Code",
            "Revenues",
            "Profit (Loss) Before Tax",
            "Income Tax Paid",
            "Income Tax Accrued",
            "Accumulated Earnings",
            "Number of Employees"
    );

    /**
     * Full structural validation. Field checks only run once every required
     * section is present.
     */
    public ValidationReport validate(WorkbookData workbook) {
        List<String> missingSections = validateSections(workbook);
        if (!missingSections.isEmpty()) {
            logger.warn("Workbook is missing sections: {}", missingSections);
            return ValidationReport.missingSections(missingSections);
        }

        SheetClassification classification = SheetClassification.of(workbook);

        List<String> missingGeneral = classification.get(SectionRole.GENERAL_INFO)
                .map(this::validateGeneralInfo)
                .orElse(List.of());
        List<String> missingCountry = classification.get(SectionRole.COUNTRY_OVERVIEW)
                .map(this::validateCountryData)
                .orElse(List.of());

        ValidationReport report = new ValidationReport(List.of(), missingGeneral, missingCountry);
        if (!report.isValid()) {
            logger.warn("Workbook failed field validation: {}", report.getMessages());
        }
        return report;
    }

    public List<String> validateSections(WorkbookData workbook) {
        List<String> sheetNames = workbook == null ? List.of() : workbook.getSheetNames();
        List<String> missing = new ArrayList<>();
        for (String section : REQUIRED_SECTIONS) {
            if (sheetNames.stream().noneMatch(name -> containsIgnoreCase(name, section))) {
                missing.add(section);
            }
        }
        return missing;
    }

    public List<String> validateGeneralInfo(SheetData sheet) {
        if (sheet == null || sheet.isEmpty()) {
            return REQUIRED_GENERAL_INFO_FIELDS;
        }
        List<Object> labels = sheet.getFirstColumnValues();
        List<String> missing = new ArrayList<>();
        for (String field : REQUIRED_GENERAL_INFO_FIELDS) {
            boolean inHeader = sheet.getColumns().stream().anyMatch(col -> containsIgnoreCase(col, field));
            boolean inFirstColumn = labels.stream()
                    .anyMatch(label -> containsIgnoreCase(CellValueUtil.toText(label), field));
            if (!inHeader && !inFirstColumn) {
                missing.add(field);
            }
        }
        return missing;
    }

    public List<String> validateCountryData(SheetData sheet) {
        if (sheet == null || sheet.isEmpty()) {
            return REQUIRED_COUNTRY_FIELDS;
        }
        List<String> missing = new ArrayList<>();
        for (String field : REQUIRED_COUNTRY_FIELDS) {
            if (sheet.getColumns().stream().noneMatch(col -> containsIgnoreCase(col, field))) {
                missing.add(field);
            }
        }
        return missing;
    }

    private static boolean containsIgnoreCase(String text, String fragment) {
        return text != null && text.toLowerCase(Locale.ROOT).contains(fragment.toLowerCase(Locale.ROOT));
    }
}
