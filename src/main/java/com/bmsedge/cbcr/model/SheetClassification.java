package com.bmsedge.cbcr.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Per-role sheet assignment for one workbook. At most one sheet per role;
 * later sheets that classify into an already assigned role are kept aside
 * as ignored instead of replacing the first one.
 */
public class SheetClassification {

    private final Map<SectionRole, SheetData> assigned = new EnumMap<>(SectionRole.class);
    private final Map<String, SectionRole> rolesBySheet = new LinkedHashMap<>();
    private final List<String> ignoredSheets = new ArrayList<>();

    void assign(SheetData sheet, SectionRole role) {
        rolesBySheet.put(sheet.getName(), role);
        if (role == SectionRole.UNRECOGNIZED) {
            return;
        }
        if (assigned.containsKey(role)) {
            ignoredSheets.add(sheet.getName());
        } else {
            assigned.put(role, sheet);
        }
    }

    public static SheetClassification of(WorkbookData workbook) {
        SheetClassification classification = new SheetClassification();
        for (SheetData sheet : workbook.getSheets()) {
            classification.assign(sheet, SectionRole.classify(sheet.getName()));
        }
        return classification;
    }

    public Optional<SheetData> get(SectionRole role) {
        return Optional.ofNullable(assigned.get(role));
    }

    public Map<String, SectionRole> getRolesBySheet() {
        return Collections.unmodifiableMap(rolesBySheet);
    }

    public List<String> getIgnoredSheets() {
        return Collections.unmodifiableList(ignoredSheets);
    }
}
