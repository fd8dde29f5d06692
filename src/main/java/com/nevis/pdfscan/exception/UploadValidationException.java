package com.nevis.pdfscan.exception;

import lombok.Getter;

/**
 * Rejected upload. The code is a stable identifier such as {@code EMPTY_FILE} or {@code FILE_TOO_LARGE}.
 */
@Getter
public class UploadValidationException extends RuntimeException {
    private final String code;

    public UploadValidationException(String message, String code) {
        super(message);
        this.code = code;
    }
}
