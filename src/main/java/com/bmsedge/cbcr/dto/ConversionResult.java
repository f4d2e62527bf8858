package com.bmsedge.cbcr.dto;

import lombok.Getter;

import java.util.List;

/**
 * Either a complete document or the list of reasons none was produced.
 */
@Getter
public class ConversionResult {

    private final boolean success;
    private final String document;
    private final List<String> errors;

    private ConversionResult(boolean success, String document, List<String> errors) {
        this.success = success;
        this.document = document;
        this.errors = errors;
    }

    public static ConversionResult success(String document) {
        return new ConversionResult(true, document, List.of());
    }

    public static ConversionResult failure(List<String> errors) {
        return new ConversionResult(false, null, List.copyOf(errors));
    }

    public static ConversionResult failure(String error) {
        return failure(List.of(error));
    }
}
