package com.nevis.pdfscan.model;

import java.util.Objects;
import java.util.UUID;

/**
 * A detected instance of sensitive data. Only metadata about the match is kept, never the matched text.
 */
public record Finding(
    UUID id,
    UUID documentId,
    FindingType findingType,
    String location,
    double confidence
) {

    public Finding {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(documentId, "documentId");
        Objects.requireNonNull(findingType, "findingType");
        if (confidence < 0.0 || confidence > 1.0 || Double.isNaN(confidence)) {
            throw new IllegalArgumentException("confidence must be within [0.0, 1.0]: " + confidence);
        }
    }

    public static Finding create(UUID documentId, FindingType findingType, String location, double confidence) {
        return new Finding(UUID.randomUUID(), documentId, findingType, location, confidence);
    }

    public Finding withDocumentId(UUID newDocumentId) {
        return new Finding(id, newDocumentId, findingType, location, confidence);
    }
}
