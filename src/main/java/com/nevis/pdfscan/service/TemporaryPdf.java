package com.nevis.pdfscan.service;

import com.nevis.pdfscan.exception.PdfProcessingException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.UUID;

/**
 * Uploaded bytes staged on disk for the scanner. Closing deletes the file.
 */
@Slf4j
final class TemporaryPdf implements AutoCloseable {

    private final Path path;

    private TemporaryPdf(Path path) {
        this.path = path;
    }

    static TemporaryPdf write(Path directory, UUID documentId, byte[] content) {
        Path path = null;
        try {
            Files.createDirectories(directory);
            path = Files.createTempFile(directory, "pdf_scan_" + documentId + "_", ".pdf");
            Files.write(path, content);
            return new TemporaryPdf(path);
        } catch (IOException e) {
            PdfProcessingException failure = new PdfProcessingException("Unable to stage upload for scanning", e);
            if (path != null) {
                try {
                    Files.deleteIfExists(path);
                } catch (IOException cleanupError) {
                    failure.addSuppressed(cleanupError);
                }
            }
            throw failure;
        }
    }

    Path path() {
        return path;
    }

    @Override
    public void close() {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.warn("Failed to delete temporary file {}: {}", path, e.getMessage());
        }
    }
}
