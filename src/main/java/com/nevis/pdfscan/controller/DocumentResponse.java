package com.nevis.pdfscan.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.nevis.pdfscan.model.Document;
import com.nevis.pdfscan.model.DocumentStatus;

import java.time.OffsetDateTime;
import java.util.UUID;

public record DocumentResponse(
    @JsonProperty("document_id")
    UUID documentId,

    String filename,

    @JsonProperty("upload_time")
    OffsetDateTime uploadTime,

    DocumentStatus status,

    @JsonProperty("file_size")
    long fileSize,

    @JsonProperty("error_message")
    String errorMessage
) {

    public static DocumentResponse from(Document document) {
        return new DocumentResponse(
            document.id(),
            document.filename(),
            document.uploadTime(),
            document.status(),
            document.fileSize(),
            document.errorMessage()
        );
    }
}
