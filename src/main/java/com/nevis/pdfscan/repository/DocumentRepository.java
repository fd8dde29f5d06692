package com.nevis.pdfscan.repository;

import com.nevis.pdfscan.model.Document;
import com.nevis.pdfscan.model.DocumentStatus;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface DocumentRepository {

    /**
     * Stores the document, overwriting any previous document with the same id.
     */
    void save(Document document);

    Optional<Document> findById(UUID id);

    /**
     * Replaces the status of an existing document. The error message is kept only when the new
     * status is {@link DocumentStatus#FAILED}.
     *
     * @throws com.nevis.pdfscan.exception.DocumentNotFoundException if no document has this id
     */
    void updateStatus(UUID id, DocumentStatus status, String errorMessage);

    /**
     * Lists documents, most recent upload first. An offset past the end yields an empty list.
     */
    List<Document> findAll(int limit, int offset);
}
