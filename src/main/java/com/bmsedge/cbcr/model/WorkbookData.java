package com.bmsedge.cbcr.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ordered sheet name to sheet mapping produced by the workbook reader.
 * Read-only once built.
 */
public class WorkbookData {

    private final Map<String, SheetData> sheets;

    public WorkbookData(List<SheetData> sheets) {
        Map<String, SheetData> ordered = new LinkedHashMap<>();
        for (SheetData sheet : sheets) {
            ordered.putIfAbsent(sheet.getName(), sheet);
        }
        this.sheets = Collections.unmodifiableMap(ordered);
    }

    public List<String> getSheetNames() {
        return new ArrayList<>(sheets.keySet());
    }

    public SheetData getSheet(String name) {
        return sheets.get(name);
    }

    public Collection<SheetData> getSheets() {
        return sheets.values();
    }

    public int size() {
        return sheets.size();
    }
}
