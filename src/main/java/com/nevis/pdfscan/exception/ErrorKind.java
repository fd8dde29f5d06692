package com.nevis.pdfscan.exception;

import org.springframework.dao.DataAccessException;

/**
 * Failure categories shared by the pipeline and the HTTP layer.
 */
public enum ErrorKind {
    VALIDATION_FAILURE,
    NOT_FOUND,
    INVALID_FORMAT,
    UNSUPPORTED,
    STORAGE_FAILURE,
    PROCESSING_FAILURE;

    public static ErrorKind classify(Throwable error) {
        if (error instanceof UploadValidationException) {
            return VALIDATION_FAILURE;
        }
        if (error instanceof DocumentNotFoundException) {
            return ((DocumentNotFoundException) error).errorKind();
        }
        if (error instanceof PdfNotFoundException) {
            return NOT_FOUND;
        }
        if (error instanceof InvalidPdfException) {
            return INVALID_FORMAT;
        }
        if (error instanceof EncryptedPdfException) {
            return UNSUPPORTED;
        }
        if (error instanceof StorageException || error instanceof DataAccessException) {
            return STORAGE_FAILURE;
        }
        return PROCESSING_FAILURE;
    }
}
