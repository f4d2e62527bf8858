package com.bmsedge.cbcr.util;

/**
 * Namespaces and fully-qualified element names of the public CbCR
 * taxonomy used by the generated document. These are external identifiers
 * and must not be reworded.
 */
public final class CbcrTaxonomy {

    private CbcrTaxonomy() {
    }

    // Namespaces declared on the root element
    public static final String NS_XHTML = "http://www.w3.org/1999/xhtml";
    public static final String NS_IX = "http://www.xbrl.org/2013/inlineXBRL";
    public static final String NS_IXT = "http://www.xbrl.org/inlineXBRL/transformation/2020-02-12";
    public static final String NS_XSI = "http://www.w3.org/2001/XMLSchema-instance";
    public static final String NS_XBRLI = "http://www.xbrl.org/2003/instance";
    public static final String NS_CBCR = "http://xbrl.ifrs.org/taxonomy/2024-03-14/ifrs-cbcr";

    // Declared locally where used
    public static final String NS_ISO4217 = "http://www.xbrl.org/2003/iso4217";
    public static final String NS_LINK = "http://www.xbrl.org/2003/linkbase";
    public static final String NS_XLINK = "http://www.w3.org/1999/xlink";

    public static final String CONTEXT_ID = "duration";
    public static final String CURRENCY_UNIT_ID = "currency";
    public static final String PURE_UNIT_ID = "pure";

    // General information
    public static final String ULTIMATE_PARENT_NAME = "cbcr:NameOfUltimateParentOfGroupOfStandaloneCompany";
    public static final String COUNTRY_OF_REGISTERED_OFFICE = "cbcr:CountryOfRegisteredOfficeOfUltimateParentUndertaking";
    public static final String FINANCIAL_YEAR_START = "cbcr:DateOfStartOfFinancialYear";
    public static final String FINANCIAL_YEAR_END = "cbcr:DateOfEndOfFinancialYear";
    public static final String REPORTING_CURRENCY = "cbcr:ReportingCurrency";
    public static final String OECD_INSTRUCTIONS_APPLIED =
            "cbcr:ApplicationOfOptionToReportInAccordanceWithTaxationReportingInstructions";

    // Country-by-country overview
    public static final String TAX_JURISDICTION = "cbcr:TaxJurisdiction";
    public static final String COUNTRY_CODE = "cbcr:CountryCodeOfMemberStateOrTaxJurisdiction";
    public static final String REVENUES = "cbcr:Revenues";
    public static final String PROFIT_LOSS_BEFORE_TAX = "cbcr:ProfitLossBeforeTax";
    public static final String INCOME_TAX_PAID = "cbcr:IncomeTaxPaidOnCashBasis";
    public static final String INCOME_TAX_ACCRUED = "cbcr:IncomeTaxAccrued";
    public static final String ACCUMULATED_EARNINGS = "cbcr:AccumulatedEarnings";
    public static final String NUMBER_OF_EMPLOYEES = "cbcr:NumberOfEmployees";

    // Subsidiaries
    public static final String SUBSIDIARY_NAMES =
            "cbcr:DisclosureOfNamesOfSubsidiaryUndertakingsConsolidatedInFinancialStatementsOfUltimateParentUndertakingExplanatory";
    public static final String NATURE_OF_ACTIVITIES =
            "cbcr:DescriptionOfNatureOfActivitiesOfSubsidiaryUndertakingsInMemberStateOrTaxJurisdictionExplanatory";

    // Narrative sections
    public static final String INFORMATION_OMITTED = "cbcr:DisclosureOfTypeOfInformationOmittedExplanatory";
    public static final String MATERIAL_DISCREPANCIES =
            "cbcr:ExplanationOfAnyMaterialDiscrepanciesBetweenIncomeTaxPaidAndAccruedExplanatory";

    public static final String GOVERNING_REGULATION = "Commission Implementing Regulation (EU) 2024/2952";
}
