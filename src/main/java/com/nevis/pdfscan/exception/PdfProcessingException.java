package com.nevis.pdfscan.exception;

/**
 * Unexpected failure while staging or scanning an uploaded PDF.
 */
public class PdfProcessingException extends RuntimeException {

    public PdfProcessingException(String message, Throwable cause) {
        super(message, cause);
    }
}
