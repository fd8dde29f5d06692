package com.nevis.pdfscan.validation;

import com.nevis.pdfscan.exception.UploadValidationException;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.Locale;

/**
 * Checks an uploaded file before it reaches the pipeline. Checks run in a fixed order and the first
 * failing one decides the error code.
 */
@Component
public class UploadValidator {

    public static final String PDF_CONTENT_TYPE = "application/pdf";
    public static final String PDF_EXTENSION = ".pdf";

    private final long maxFileSize;

    public UploadValidator(@Value("${app.upload.max-file-size:10485760}") long maxFileSize) {
        this.maxFileSize = maxFileSize;
    }

    public ValidatedUpload validateAndRead(MultipartFile file) {
        if (file == null) {
            throw new UploadValidationException("No file provided", "MISSING_FILE");
        }

        byte[] content;
        try {
            content = file.getBytes();
        } catch (IOException e) {
            throw new UploadValidationException("Failed to read file: " + e.getMessage(), "FILE_READ_ERROR");
        }

        validate(file.getOriginalFilename(), file.getContentType(), content.length);
        return new ValidatedUpload(file.getOriginalFilename(), content);
    }

    public void validate(String filename, String contentType, long fileSize) {
        if (filename == null || filename.isBlank()) {
            throw new UploadValidationException("Filename is required", "MISSING_FILENAME");
        }
        if (!filename.toLowerCase(Locale.ROOT).endsWith(PDF_EXTENSION)) {
            throw new UploadValidationException("Invalid file type. Only PDF files are allowed.", "INVALID_FILE_TYPE");
        }
        if (contentType != null && !contentType.isEmpty() && !PDF_CONTENT_TYPE.equals(contentType)) {
            throw new UploadValidationException(
                "Invalid content type: %s. Expected: %s".formatted(contentType, PDF_CONTENT_TYPE),
                "INVALID_CONTENT_TYPE"
            );
        }
        if (fileSize == 0) {
            throw new UploadValidationException("File is empty", "EMPTY_FILE");
        }
        if (fileSize > maxFileSize) {
            throw new UploadValidationException(
                "File size (%d bytes) exceeds maximum allowed size of %d bytes".formatted(fileSize, maxFileSize),
                "FILE_TOO_LARGE"
            );
        }
    }
}
