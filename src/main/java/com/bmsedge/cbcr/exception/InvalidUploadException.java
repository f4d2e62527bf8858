package com.bmsedge.cbcr.exception;

/**
 * Upload rejected before any parsing: no file, empty file, wrong extension
 * or over the size limit.
 */
public class InvalidUploadException extends BusinessException {

    private final String errorCode;

    public InvalidUploadException(String message, String errorCode) {
        super(message);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
