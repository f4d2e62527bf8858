package com.bmsedge.cbcr.model;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Entity identity and reporting period shared by every fact of one document.
 */
@Getter
@AllArgsConstructor
public class ReportingContext {

    public static final String DEFAULT_START_DATE = "2025-01-01";
    public static final String DEFAULT_END_DATE = "2025-12-31";
    public static final String DEFAULT_CURRENCY = "EUR";

    private final String entityId;
    private final String startDate;
    private final String endDate;
    private final String currency;

    public static ReportingContext from(GeneralInfo info, String entityId) {
        return new ReportingContext(
                entityId,
                info.getFyStart() != null ? info.getFyStart() : DEFAULT_START_DATE,
                info.getFyEnd() != null ? info.getFyEnd() : DEFAULT_END_DATE,
                info.getCurrency() != null ? info.getCurrency() : DEFAULT_CURRENCY
        );
    }
}
