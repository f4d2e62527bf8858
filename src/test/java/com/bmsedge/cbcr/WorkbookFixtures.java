package com.bmsedge.cbcr;

import com.bmsedge.cbcr.model.SheetData;
import com.bmsedge.cbcr.model.WorkbookData;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * In-memory workbooks shaped like the reader's output.
 */
public final class WorkbookFixtures {

    public static final List<String> COUNTRY_COLUMNS = List.of(
            "Tax Jurisdiction", "Country Code", "Revenues", "Profit (Loss) Before Tax",
            "Income Tax Paid", "Income Tax Accrued", "Accumulated Earnings", "Number of Employees");

    public static final List<String> SUBSIDIARY_COLUMNS = List.of(
            "Tax Jurisdiction", "Country Code", "Subsidiary Name", "Nature of Activities");

    private WorkbookFixtures() {
    }

    public static SheetData sheet(String name, List<String> columns, Object[]... rows) {
        List<List<Object>> data = new ArrayList<>();
        for (Object[] row : rows) {
            data.add(Arrays.asList(row));
        }
        return new SheetData(name, columns, data);
    }

    public static SheetData acmeGeneralInformation() {
        return sheet("General Information", List.of("Field", "Value"),
                new Object[]{"Ultimate Parent Name", "Acme Group"},
                new Object[]{"Country of Registered Office", "IE"},
                new Object[]{"Financial Year Start Date", "2025-01-01"},
                new Object[]{"Financial Year End Date", "2025-12-31"},
                new Object[]{"Reporting Currency", "EUR"},
                new Object[]{"OECD Instructions Used", "Yes"});
    }

    public static SheetData acmeCountryOverview() {
        return sheet("Country-by-Country Overview", COUNTRY_COLUMNS,
                new Object[]{"IE", "IE", "1000000", "200000", "50000", "45000", "150000", "120"});
    }

    public static SheetData acmeSubsidiaries() {
        return sheet("Subsidiaries and Activities", SUBSIDIARY_COLUMNS,
                new Object[]{"IE", "IE", "Acme Sub Ltd", "Manufacturing"});
    }

    public static SheetData acmeOmittedInformation() {
        return sheet("Omitted Information", List.of("Omitted Information"),
                new Object[]{"None"});
    }

    public static WorkbookData acmeWorkbook() {
        return new WorkbookData(List.of(
                acmeGeneralInformation(),
                acmeCountryOverview(),
                acmeSubsidiaries(),
                acmeOmittedInformation()));
    }

    public static WorkbookData workbook(SheetData... sheets) {
        return new WorkbookData(Arrays.asList(sheets));
    }
}
