package com.nevis.pdfscan.exception;

/**
 * Raised when the scanned file is not a well-formed PDF.
 */
public class InvalidPdfException extends RuntimeException {

    public InvalidPdfException(String message, Throwable cause) {
        super(message, cause);
    }
}
