package com.nevis.pdfscan.model;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Objects;
import java.util.UUID;

/**
 * One uploaded file and its processing status.
 * <p>
 * Instances are immutable; a status change produces a new value through {@link #withStatus}.
 */
public record Document(
    UUID id,
    String filename,
    OffsetDateTime uploadTime,
    DocumentStatus status,
    long fileSize,
    String errorMessage
) {

    public Document {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(uploadTime, "uploadTime");
        Objects.requireNonNull(status, "status");
        if (fileSize < 0) {
            throw new IllegalArgumentException("fileSize must not be negative: " + fileSize);
        }
        if (errorMessage != null && status != DocumentStatus.FAILED) {
            throw new IllegalArgumentException("errorMessage is only allowed for failed documents");
        }
    }

    public static Document create(String filename, long fileSize) {
        return new Document(
            UUID.randomUUID(),
            filename,
            OffsetDateTime.now(ZoneOffset.UTC),
            DocumentStatus.PENDING,
            fileSize,
            null
        );
    }

    /**
     * Returns a copy with the given status. The error message is kept only for
     * {@link DocumentStatus#FAILED}; any other status clears it.
     */
    public Document withStatus(DocumentStatus newStatus, String newErrorMessage) {
        return new Document(
            id,
            filename,
            uploadTime,
            newStatus,
            fileSize,
            newStatus == DocumentStatus.FAILED ? newErrorMessage : null
        );
    }
}
