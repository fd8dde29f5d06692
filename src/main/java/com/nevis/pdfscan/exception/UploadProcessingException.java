package com.nevis.pdfscan.exception;

/**
 * An upload that was accepted but could not be processed. The cause is the pipeline's original error.
 */
public class UploadProcessingException extends RuntimeException {

    public UploadProcessingException(RuntimeException cause) {
        super("Failed to process document: " + (cause.getMessage() != null
            ? cause.getMessage()
            : cause.getClass().getSimpleName()), cause);
    }
}
