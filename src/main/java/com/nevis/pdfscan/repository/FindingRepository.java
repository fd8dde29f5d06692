package com.nevis.pdfscan.repository;

import com.nevis.pdfscan.model.Finding;
import com.nevis.pdfscan.model.FindingType;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Storage for findings. Every listing is ordered by confidence, highest first.
 */
public interface FindingRepository {
    void save(Finding finding);
    List<Finding> findByDocumentId(UUID documentId);
    List<Finding> findAll(int limit, int offset, Optional<FindingType> findingType);
    long count(Optional<UUID> documentId);
    long countByType(FindingType findingType);
}
