package com.nevis.pdfscan.service;

import com.nevis.pdfscan.controller.DocumentFindingsResponse;
import com.nevis.pdfscan.controller.DocumentResponse;
import com.nevis.pdfscan.controller.DocumentsPageResponse;

import java.util.UUID;

public interface DocumentService {
    DocumentResponse getById(UUID id);
    DocumentsPageResponse list(int limit, int offset);
    DocumentFindingsResponse getFindings(UUID documentId);
}
