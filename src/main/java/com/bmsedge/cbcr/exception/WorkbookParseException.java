package com.bmsedge.cbcr.exception;

import java.io.IOException;

/**
 * The uploaded workbook could not be read (corrupt file, unsupported cell content).
 */
public class WorkbookParseException extends IOException {

    public WorkbookParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
