package com.nevis.pdfscan.exception;

import lombok.Getter;

import java.util.UUID;

/**
 * No stored document has the given id. Raised by lookups and by status transitions, which never create
 * a document.
 */
@Getter
public class DocumentNotFoundException extends RuntimeException {
    private final UUID documentId;

    public DocumentNotFoundException(UUID documentId) {
        super("Document not found: " + documentId);
        this.documentId = documentId;
    }

    public ErrorKind errorKind() {
        return ErrorKind.NOT_FOUND;
    }
}
