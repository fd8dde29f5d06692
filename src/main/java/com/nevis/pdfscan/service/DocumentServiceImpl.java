package com.nevis.pdfscan.service;

import com.nevis.pdfscan.config.Backends;
import com.nevis.pdfscan.controller.DocumentFindingsResponse;
import com.nevis.pdfscan.controller.DocumentResponse;
import com.nevis.pdfscan.controller.DocumentsPageResponse;
import com.nevis.pdfscan.controller.FindingResponse;
import com.nevis.pdfscan.controller.PaginationResponse;
import com.nevis.pdfscan.exception.DocumentNotFoundException;
import com.nevis.pdfscan.model.Document;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;

@Service
@Slf4j
@RequiredArgsConstructor
public class DocumentServiceImpl implements DocumentService {

    private final Backends backends;

    @Override
    public DocumentResponse getById(UUID id) {
        return DocumentResponse.from(load(id));
    }

    @Override
    public DocumentsPageResponse list(int limit, int offset) {
        List<DocumentResponse> documents = backends.documents().findAll(limit, offset).stream()
            .map(DocumentResponse::from)
            .toList();
        return new DocumentsPageResponse(documents, new PaginationResponse(limit, offset, null, documents.size()));
    }

    @Override
    public DocumentFindingsResponse getFindings(UUID documentId) {
        Document document = load(documentId);
        List<FindingResponse> findings = backends.findings().findByDocumentId(documentId).stream()
            .map(FindingResponse::from)
            .toList();

        log.debug("Doc {}: returning {} findings", documentId, findings.size());
        return new DocumentFindingsResponse(
            document.id(),
            document.filename(),
            document.uploadTime(),
            document.status(),
            document.fileSize(),
            findings
        );
    }

    private Document load(UUID id) {
        return backends.documents().findById(id)
            .orElseThrow(() -> new DocumentNotFoundException(id));
    }
}
