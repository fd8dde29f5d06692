package com.nevis.pdfscan.controller;

import java.util.List;

public record DocumentsPageResponse(
    List<DocumentResponse> documents,
    PaginationResponse pagination
) {}
