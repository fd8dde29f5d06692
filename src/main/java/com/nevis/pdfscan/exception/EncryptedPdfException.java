package com.nevis.pdfscan.exception;

/**
 * Raised when the scanned PDF is password-protected or encrypted and its text cannot be read.
 */
public class EncryptedPdfException extends RuntimeException {

    public EncryptedPdfException() {
        super("PDF is password-protected and cannot be scanned");
    }

    public EncryptedPdfException(Throwable cause) {
        super("PDF is password-protected and cannot be scanned", cause);
    }
}
