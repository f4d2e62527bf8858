package com.bmsedge.cbcr.dto;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of checking a workbook's structure. Missing sections suppress the
 * field-level checks, so at most one of the two groups is populated when
 * sections are missing.
 */
@Getter
public class ValidationReport {

    private final List<String> missingSections;
    private final List<String> missingGeneralInfoFields;
    private final List<String> missingCountryFields;

    public ValidationReport(List<String> missingSections,
                            List<String> missingGeneralInfoFields,
                            List<String> missingCountryFields) {
        this.missingSections = List.copyOf(missingSections);
        this.missingGeneralInfoFields = List.copyOf(missingGeneralInfoFields);
        this.missingCountryFields = List.copyOf(missingCountryFields);
    }

    public static ValidationReport missingSections(List<String> missingSections) {
        return new ValidationReport(missingSections, List.of(), List.of());
    }

    public boolean isValid() {
        return missingSections.isEmpty() && missingGeneralInfoFields.isEmpty() && missingCountryFields.isEmpty();
    }

    /**
     * Human-readable messages in reporting order.
     */
    public List<String> getMessages() {
        if (!missingSections.isEmpty()) {
            return Collections.singletonList(String.format(
                    "Missing required sections: %s. Please ensure your Excel file contains sheets for: "
                            + "General Information, Country-by-Country Overview, Subsidiaries and Activities, "
                            + "and Omitted Information.",
                    String.join(", ", missingSections)));
        }
        List<String> messages = new ArrayList<>();
        if (!missingGeneralInfoFields.isEmpty()) {
            messages.add("Missing fields in General Information: " + String.join(", ", missingGeneralInfoFields));
        }
        if (!missingCountryFields.isEmpty()) {
            messages.add("Missing fields in Country-by-Country Overview: " + String.join(", ", missingCountryFields));
        }
        return messages;
    }
}
