package com.nevis.pdfscan.service;

import com.nevis.pdfscan.controller.UploadResponse;
import com.nevis.pdfscan.exception.ErrorKind;

import java.util.UUID;

/**
 * Result of one pipeline run. A failure keeps the original exception so callers can rethrow it unchanged.
 */
public sealed interface ProcessingOutcome permits ProcessingOutcome.Success, ProcessingOutcome.Failure {

    UUID documentId();

    /**
     * Returns the response of a successful run, or rethrows the exception that failed it.
     */
    UploadResponse orElseThrow();

    record Success(UploadResponse response) implements ProcessingOutcome {

        @Override
        public UUID documentId() {
            return response.documentId();
        }

        @Override
        public UploadResponse orElseThrow() {
            return response;
        }
    }

    /**
     * The cause is either a {@link RuntimeException} or an {@link Error}.
     */
    record Failure(UUID documentId, ErrorKind errorKind, String message, Throwable cause)
        implements ProcessingOutcome {

        @Override
        public UploadResponse orElseThrow() {
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw (RuntimeException) cause;
        }
    }
}
