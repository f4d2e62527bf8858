package com.bmsedge.cbcr.service;

import com.bmsedge.cbcr.config.ConverterProperties;
import com.bmsedge.cbcr.model.CountryRow;
import com.bmsedge.cbcr.model.GeneralInfo;
import com.bmsedge.cbcr.model.ReportingContext;
import com.bmsedge.cbcr.model.SectionRole;
import com.bmsedge.cbcr.model.SheetClassification;
import com.bmsedge.cbcr.model.SubsidiaryRow;
import com.bmsedge.cbcr.model.WorkbookData;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.regex.Pattern;
import java.util.stream.Stream;

import static com.bmsedge.cbcr.util.CbcrTaxonomy.*;
import static com.bmsedge.cbcr.util.CellValueUtil.NOT_AVAILABLE;
import static com.bmsedge.cbcr.util.CellValueUtil.escapeXml;
import static com.bmsedge.cbcr.util.CellValueUtil.escapeXmlAttribute;

/**
 * Builds the XHTML + Inline XBRL document for a workbook that already passed
 * structural validation. Missing sheets degrade to empty tables or default
 * text; rendering itself never reports errors.
 *
 * <p>The whole document is assembled in memory before it is returned, and
 * no state is shared between calls.</p>
 */
@Service
public class ReportRenderingService {

    private static final Logger logger = LoggerFactory.getLogger(ReportRenderingService.class);

    static final String MATERIAL_DISCREPANCIES_TEXT = "No material discrepancies identified";

    private static final Pattern ISO_CURRENCY_CODE = Pattern.compile("[A-Z]{3}");

    private static final String[] COUNTRY_HEADERS = {
            "Tax Jurisdiction", "Country Code", "Revenues", "Profit (Loss) Before Tax",
            "Income Tax Paid", "Income Tax Accrued", "Accumulated Earnings", "Number of Employees"
    };

    private static final String[] SUBSIDIARY_HEADERS = {
            "Tax Jurisdiction", "Country Code", "Subsidiary Name", "Nature of Activities"
    };

    private final SectionExtractionService extractionService;
    private final EntityIdentifierGenerator entityIdentifierGenerator;
    private final ConverterProperties properties;

    public ReportRenderingService(SectionExtractionService extractionService,
                                  EntityIdentifierGenerator entityIdentifierGenerator,
                                  ConverterProperties properties) {
        this.extractionService = extractionService;
        this.entityIdentifierGenerator = entityIdentifierGenerator;
        this.properties = properties;
    }

    public String render(WorkbookData workbook) {
        return render(workbook, entityIdentifierGenerator.nextIdentifier());
    }

    public String render(WorkbookData workbook, String entityId) {
        SheetClassification sheets = extractionService.classifySheets(workbook);

        GeneralInfo info = sheets.get(SectionRole.GENERAL_INFO)
                .map(extractionService::extractGeneralInfo)
                .orElseGet(GeneralInfo::new);
        ReportingContext context = ReportingContext.from(info, entityId);

        StringBuilder xhtml = new StringBuilder(16 * 1024);
        appendPrologue(xhtml, info);
        appendHeader(xhtml, context);
        xhtml.append("    <h1>Country-by-Country Report</h1>\n");

        appendGeneralInformation(xhtml, info, context);

        int countryRows;
        try (Stream<CountryRow> rows = sheets.get(SectionRole.COUNTRY_OVERVIEW)
                .map(extractionService::streamCountryRows)
                .orElseGet(Stream::empty)) {
            countryRows = appendCountryOverview(xhtml, rows);
        }

        int subsidiaryRows;
        try (Stream<SubsidiaryRow> rows = sheets.get(SectionRole.SUBSIDIARIES)
                .map(extractionService::streamSubsidiaryRows)
                .orElseGet(Stream::empty)) {
            subsidiaryRows = appendSubsidiaries(xhtml, rows);
        }

        String omitted = sheets.get(SectionRole.OMITTED_INFO)
                .map(extractionService::extractOmittedInformation)
                .orElse(SectionExtractionService.NO_INFORMATION_OMITTED);
        appendOmittedInformation(xhtml, omitted);
        appendMaterialDiscrepancies(xhtml);
        appendFooter(xhtml);

        logger.info("Rendered report for '{}' with {} country rows and {} subsidiary rows",
                info.getUltimateParent() != null ? info.getUltimateParent() : NOT_AVAILABLE,
                countryRows, subsidiaryRows);
        return xhtml.toString();
    }

    private void appendPrologue(StringBuilder xhtml, GeneralInfo info) {
        String parent = info.getUltimateParent() != null ? info.getUltimateParent() : NOT_AVAILABLE;
        xhtml.append("<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n")
                .append("<!DOCTYPE html PUBLIC \"-//W3C//DTD XHTML 1.0 Strict//EN\" ")
                .append("\"http://www.w3.org/TR/xhtml1/DTD/xhtml1-strict.dtd\">\n")
                .append("<html xmlns=\"").append(NS_XHTML).append("\"\n")
                .append("      xmlns:ix=\"").append(NS_IX).append("\"\n")
                .append("      xmlns:ixt=\"").append(NS_IXT).append("\"\n")
                .append("      xmlns:xsi=\"").append(NS_XSI).append("\"\n")
                .append("      xmlns:xbrli=\"").append(NS_XBRLI).append("\"\n")
                .append("      xmlns:cbcr=\"").append(NS_CBCR).append("\">\n")
                .append("<head>\n")
                .append("    <meta http-equiv=\"Content-Type\" content=\"text/html; charset=UTF-8\" />\n")
                .append("    <title>Country-by-Country Report - ").append(escapeXml(parent)).append("</title>\n")
                .append("</head>\n")
                .append("<body>\n");
    }

    private void appendHeader(StringBuilder xhtml, ReportingContext context) {
        String currencyCode = measureCurrency(context.getCurrency());
        xhtml.append("    <div style=\"display:none\">\n")
                .append("        <ix:header>\n")
                .append("            <ix:references>\n")
                .append("                <link:schemaRef xmlns:link=\"").append(NS_LINK).append("\"")
                .append(" xmlns:xlink=\"").append(NS_XLINK).append("\"")
                .append(" xlink:type=\"simple\" xlink:href=\"")
                .append(escapeXmlAttribute(properties.getTaxonomyEntryPoint())).append("\" />\n")
                .append("            </ix:references>\n")
                .append("            <ix:resources>\n")
                .append("                <xbrli:context id=\"").append(CONTEXT_ID).append("\">\n")
                .append("                    <xbrli:entity>\n")
                .append("                        <xbrli:identifier scheme=\"")
                .append(escapeXmlAttribute(properties.getIdentifierScheme())).append("\">")
                .append(escapeXml(context.getEntityId())).append("</xbrli:identifier>\n")
                .append("                    </xbrli:entity>\n")
                .append("                    <xbrli:period>\n")
                .append("                        <xbrli:startDate>").append(escapeXml(context.getStartDate()))
                .append("</xbrli:startDate>\n")
                .append("                        <xbrli:endDate>").append(escapeXml(context.getEndDate()))
                .append("</xbrli:endDate>\n")
                .append("                    </xbrli:period>\n")
                .append("                </xbrli:context>\n")
                .append("                <xbrli:unit id=\"").append(CURRENCY_UNIT_ID).append("\">\n")
                .append("                    <xbrli:measure xmlns:iso4217=\"").append(NS_ISO4217).append("\">iso4217:")
                .append(escapeXml(currencyCode)).append("</xbrli:measure>\n")
                .append("                </xbrli:unit>\n")
                .append("                <xbrli:unit id=\"").append(PURE_UNIT_ID).append("\">\n")
                .append("                    <xbrli:measure>xbrli:pure</xbrli:measure>\n")
                .append("                </xbrli:unit>\n")
                .append("            </ix:resources>\n")
                .append("        </ix:header>\n")
                .append("    </div>\n");
    }

    private void appendGeneralInformation(StringBuilder xhtml, GeneralInfo info, ReportingContext context) {
        xhtml.append("\n    <!-- Section 1: General Information -->\n")
                .append("    <h2>Section 1: General Information</h2>\n")
                .append("    <table border=\"1\">\n");
        appendLabelledFact(xhtml, "Name of Ultimate Parent Undertaking:", ULTIMATE_PARENT_NAME,
                orDefault(info.getUltimateParent()));
        appendLabelledFact(xhtml, "Country of Registered Office:", COUNTRY_OF_REGISTERED_OFFICE,
                orDefault(info.getCountryOffice()));
        appendLabelledFact(xhtml, "Financial Year Start Date:", FINANCIAL_YEAR_START, context.getStartDate());
        appendLabelledFact(xhtml, "Financial Year End Date:", FINANCIAL_YEAR_END, context.getEndDate());
        appendLabelledFact(xhtml, "Reporting Currency:", REPORTING_CURRENCY, context.getCurrency());
        appendLabelledFact(xhtml, "OECD Instructions Used:", OECD_INSTRUCTIONS_APPLIED,
                info.isOecdInstructionsUsed() ? "Yes" : "No");
        xhtml.append("    </table>\n");
    }

    private void appendLabelledFact(StringBuilder xhtml, String label, String element, String value) {
        xhtml.append("        <tr>\n")
                .append("            <td>").append(escapeXml(label)).append("</td>\n")
                .append("            <td>").append(nonNumeric(element, value)).append("</td>\n")
                .append("        </tr>\n");
    }

    private int appendCountryOverview(StringBuilder xhtml, Stream<CountryRow> rows) {
        xhtml.append("\n    <!-- Section 2: Country-by-Country Overview -->\n")
                .append("    <h2>Section 2: Overview of Information on a Country-by-Country Basis</h2>\n");

        StringBuilder body = new StringBuilder();
        int[] count = {0};
        rows.forEachOrdered(row -> {
            body.append("            <tr>\n");
            cell(body, nonNumeric(TAX_JURISDICTION, row.getJurisdiction()));
            cell(body, nonNumeric(COUNTRY_CODE, row.getCountryCode()));
            cell(body, nonFraction(REVENUES, CURRENCY_UNIT_ID, row.getRevenues()));
            cell(body, nonFraction(PROFIT_LOSS_BEFORE_TAX, CURRENCY_UNIT_ID, row.getProfitBeforeTax()));
            cell(body, nonFraction(INCOME_TAX_PAID, CURRENCY_UNIT_ID, row.getTaxPaid()));
            cell(body, nonFraction(INCOME_TAX_ACCRUED, CURRENCY_UNIT_ID, row.getTaxAccrued()));
            cell(body, nonFraction(ACCUMULATED_EARNINGS, CURRENCY_UNIT_ID, row.getAccumulatedEarnings()));
            cell(body, nonFraction(NUMBER_OF_EMPLOYEES, PURE_UNIT_ID, row.getEmployeeCount()));
            body.append("            </tr>\n");
            count[0]++;
        });

        appendTable(xhtml, COUNTRY_HEADERS, body);
        return count[0];
    }

    private int appendSubsidiaries(StringBuilder xhtml, Stream<SubsidiaryRow> rows) {
        xhtml.append("\n    <!-- Section 3: List of Subsidiaries and Activities -->\n")
                .append("    <h2>Section 3: List of Subsidiaries and Activities</h2>\n");

        StringBuilder body = new StringBuilder();
        int[] count = {0};
        rows.forEachOrdered(row -> {
            body.append("            <tr>\n");
            cell(body, nonNumeric(TAX_JURISDICTION, row.getJurisdiction()));
            cell(body, nonNumeric(COUNTRY_CODE, row.getCountryCode()));
            cell(body, nonNumeric(SUBSIDIARY_NAMES, row.getSubsidiaryName()));
            cell(body, nonNumeric(NATURE_OF_ACTIVITIES, row.getActivityDescription()));
            body.append("            </tr>\n");
            count[0]++;
        });

        appendTable(xhtml, SUBSIDIARY_HEADERS, body);
        return count[0];
    }

    private void appendOmittedInformation(StringBuilder xhtml, String omitted) {
        xhtml.append("\n    <!-- Section 4: Omitted Information -->\n")
                .append("    <h2>Section 4: Omitted Information</h2>\n")
                .append("    <div>\n")
                .append("        <p><strong>Information Omitted:</strong></p>\n")
                .append("        <p>").append(nonNumeric(INFORMATION_OMITTED, omitted)).append("</p>\n")
                .append("    </div>\n");
    }

    private void appendMaterialDiscrepancies(StringBuilder xhtml) {
        xhtml.append("\n    <!-- Section 5: Explanations for Material Discrepancies -->\n")
                .append("    <h2>Section 5: Explanations for Material Discrepancies</h2>\n")
                .append("    <div>\n")
                .append("        <p>").append(nonNumeric(MATERIAL_DISCREPANCIES, MATERIAL_DISCREPANCIES_TEXT))
                .append("</p>\n")
                .append("    </div>\n");
    }

    private void appendFooter(StringBuilder xhtml) {
        xhtml.append("\n    <hr />\n")
                .append("    <p><em>This report was generated in compliance with ")
                .append(GOVERNING_REGULATION).append(".</em></p>\n")
                .append("</body>\n")
                .append("</html>\n");
    }

    // XHTML 1.0 Strict does not allow an empty tbody
    private void appendTable(StringBuilder xhtml, String[] headers, StringBuilder body) {
        xhtml.append("    <table border=\"1\">\n")
                .append("        <thead>\n")
                .append("            <tr>\n");
        for (String header : headers) {
            xhtml.append("                <th>").append(escapeXml(header)).append("</th>\n");
        }
        xhtml.append("            </tr>\n")
                .append("        </thead>\n");
        if (body.length() > 0) {
            xhtml.append("        <tbody>\n").append(body).append("        </tbody>\n");
        }
        xhtml.append("    </table>\n");
    }

    private static void cell(StringBuilder body, String content) {
        body.append("                <td>").append(content).append("</td>\n");
    }

    private static String nonNumeric(String element, String value) {
        return "<ix:nonNumeric name=\"" + element + "\" contextRef=\"" + CONTEXT_ID + "\">"
                + escapeXml(value) + "</ix:nonNumeric>";
    }

    /**
     * Numeric fact; negative values carry {@code sign="-"} so the content is digits only.
     */
    private static String nonFraction(String element, String unitRef, long value) {
        String digits = String.valueOf(value);
        String sign = "";
        if (value < 0) {
            digits = digits.substring(1);
            sign = " sign=\"-\"";
        }
        return "<ix:nonFraction name=\"" + element + "\" contextRef=\"" + CONTEXT_ID
                + "\" unitRef=\"" + unitRef + "\" decimals=\"0\" scale=\"0\"" + sign + ">"
                + digits + "</ix:nonFraction>";
    }

    /**
     * ISO 4217 code for the currency unit measure; anything that is not a
     * three-letter code falls back to the default currency.
     */
    private static String measureCurrency(String currency) {
        String code = currency.trim().toUpperCase(Locale.ROOT);
        if (ISO_CURRENCY_CODE.matcher(code).matches()) {
            return code;
        }
        logger.warn("Reporting currency '{}' is not an ISO 4217 code, using {} for the unit measure",
                currency, ReportingContext.DEFAULT_CURRENCY);
        return ReportingContext.DEFAULT_CURRENCY;
    }

    private static String orDefault(String value) {
        return value != null ? value : NOT_AVAILABLE;
    }
}
