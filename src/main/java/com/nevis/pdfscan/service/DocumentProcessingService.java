package com.nevis.pdfscan.service;

import com.nevis.pdfscan.controller.UploadResponse;

public interface DocumentProcessingService {

    /**
     * Stores, scans and records an uploaded PDF.
     *
     * @return the stored document's final state and the number of findings
     * @throws RuntimeException the exception that failed the scan, unchanged, after the document
     *                          has been marked failed; an {@link Error} is rethrown the same way
     */
    UploadResponse processUpload(String filename, long fileSize, byte[] content);

    ProcessingOutcome process(String filename, long fileSize, byte[] content);
}
