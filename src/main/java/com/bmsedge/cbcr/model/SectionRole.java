package com.bmsedge.cbcr.model;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Logical role of a worksheet in a country-by-country workbook.
 * Roles are tried in declaration order; the first role with a keyword
 * contained in the sheet name wins.
 */
public enum SectionRole {

    GENERAL_INFO("General Information", List.of("general")),
    COUNTRY_OVERVIEW("Country-by-Country Overview", List.of("country", "overview")),
    SUBSIDIARIES("Subsidiaries and Activities", List.of("subsid", "activities")),
    OMITTED_INFO("Omitted Information", List.of("omit")),
    UNRECOGNIZED(null, List.of());

    private final String requiredSectionLabel;
    private final List<String> keywords;

    SectionRole(String requiredSectionLabel, List<String> keywords) {
        this.requiredSectionLabel = requiredSectionLabel;
        this.keywords = keywords;
    }

    public String getRequiredSectionLabel() {
        return requiredSectionLabel;
    }

    /**
     * Labels of the sections every workbook must contain, in declaration order.
     */
    public static List<String> requiredSectionLabels() {
        return Arrays.stream(values())
                .map(SectionRole::getRequiredSectionLabel)
                .filter(Objects::nonNull)
                .collect(Collectors.toUnmodifiableList());
    }

    public static SectionRole classify(String sheetName) {
        if (sheetName == null) {
            return UNRECOGNIZED;
        }
        String lower = sheetName.toLowerCase(Locale.ROOT);
        for (SectionRole role : values()) {
            for (String keyword : role.keywords) {
                if (lower.contains(keyword)) {
                    return role;
                }
            }
        }
        return UNRECOGNIZED;
    }
}
