package com.nevis.pdfscan.exception;

import lombok.Getter;

import java.nio.file.Path;

/**
 * Raised by a scanner when the file it was asked to scan does not exist.
 */
@Getter
public class PdfNotFoundException extends RuntimeException {
    private final Path path;

    public PdfNotFoundException(Path path) {
        super("PDF file not found: " + path);
        this.path = path;
    }
}
