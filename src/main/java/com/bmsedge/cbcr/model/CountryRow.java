package com.bmsedge.cbcr.model;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class CountryRow {
    private final String jurisdiction;
    private final String countryCode;
    private final long revenues;
    private final long profitBeforeTax;
    private final long taxPaid;
    private final long taxAccrued;
    private final long accumulatedEarnings;
    private final long employeeCount;
}
