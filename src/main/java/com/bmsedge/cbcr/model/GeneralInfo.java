package com.bmsedge.cbcr.model;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Values read from the general information sheet. Any field may be
 * {@code null} when the matching label row is absent.
 * Dates are already normalized to {@code yyyy-MM-dd} where parseable.
 */
@Getter
@Setter
@NoArgsConstructor
public class GeneralInfo {

    private String ultimateParent;
    private String countryOffice;
    private String fyStart;
    private String fyEnd;
    private String currency;
    private Boolean oecdInstructions;

    public boolean isOecdInstructionsUsed() {
        return Boolean.TRUE.equals(oecdInstructions);
    }
}
