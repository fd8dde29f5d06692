package com.nevis.pdfscan.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.nevis.pdfscan.model.DocumentStatus;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

public record DocumentFindingsResponse(
    @JsonProperty("document_id")
    UUID documentId,

    String filename,

    @JsonProperty("upload_time")
    OffsetDateTime uploadTime,

    DocumentStatus status,

    @JsonProperty("file_size")
    long fileSize,

    List<FindingResponse> findings
) {}
