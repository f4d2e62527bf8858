package com.bmsedge.cbcr.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * JSON body for conversion and validation outcomes that carry no document.
 */
@Getter
@Setter
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ConversionResponse {

    private boolean success;
    private String message;
    private List<String> errors;
    private Map<String, String> sheets;
    private String fileName;
    private LocalDateTime timestamp;

    public ConversionResponse() {
        this.timestamp = LocalDateTime.now();
    }

    public ConversionResponse(boolean success, String message, List<String> errors) {
        this();
        this.success = success;
        this.message = message;
        this.errors = errors;
    }
}
