package com.nevis.pdfscan.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.nevis.pdfscan.model.DocumentStatus;

import java.time.OffsetDateTime;
import java.util.UUID;

public record UploadResponse(
    @JsonProperty("document_id")
    UUID documentId,

    String filename,

    DocumentStatus status,

    @JsonProperty("upload_time")
    OffsetDateTime uploadTime,

    @JsonProperty("file_size")
    long fileSize,

    @JsonProperty("findings_count")
    int findingsCount
) {}
