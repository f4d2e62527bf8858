package com.bmsedge.cbcr.model;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class SubsidiaryRow {
    private final String jurisdiction;
    private final String countryCode;
    private final String subsidiaryName;
    private final String activityDescription;
}
